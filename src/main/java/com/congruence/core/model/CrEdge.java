package com.congruence.core.model;

/**
 * Coordination requirement between two contributors, derived from TA and TD.
 */
public record CrEdge(UnorderedPair<Long> contributors, double weight) {

    public CrEdge {
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be non-negative: " + weight);
        }
    }
}
