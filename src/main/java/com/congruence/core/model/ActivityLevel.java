package com.congruence.core.model;

/**
 * Bucketing of a contributor's total modifications.
 */
public enum ActivityLevel {
    HIGH,
    MEDIUM,
    LOW,
    MINIMAL;

    public static ActivityLevel of(int totalModifications) {
        if (totalModifications >= 1000) return HIGH;
        if (totalModifications >= 100) return MEDIUM;
        if (totalModifications >= 10) return LOW;
        return MINIMAL;
    }
}
