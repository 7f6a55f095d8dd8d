package com.congruence.core.model;

/**
 * Observed coordination activity between two contributors.
 */
public record CaEdge(UnorderedPair<Long> contributors, double weight, Evidence evidence) {

    public CaEdge {
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be non-negative: " + weight);
        }
    }
}
