package com.congruence.core.model;

/**
 * Technical dependency between two files, weighted by co-change count.
 */
public record TdEdge(UnorderedPair<Long> files, double weight) {

    public TdEdge {
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be non-negative: " + weight);
        }
    }
}
