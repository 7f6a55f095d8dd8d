package com.congruence.core.model;

/**
 * Coarse behavioral role inferred from modification statistics.
 */
public enum FunctionalRole {
    CODER,
    REVIEWER,
    UNCLASSIFIED
}
