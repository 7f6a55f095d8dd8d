package com.congruence.core.model;

/**
 * Task assignment: how often a contributor edited a file.
 */
public record TaEntry(long contributorId, long fileId, int editCount) {

    public TaEntry {
        if (editCount < 0) {
            throw new IllegalArgumentException("editCount must be non-negative: " + editCount);
        }
    }
}
