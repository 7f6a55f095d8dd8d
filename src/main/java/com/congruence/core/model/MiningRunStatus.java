package com.congruence.core.model;

/**
 * Lifecycle status of a mining run.
 */
public enum MiningRunStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
