package com.congruence.core.coordination;

/**
 * Congruence within one class pair of an MC-STC run.
 *
 * @param matched CR edges of the pair that also have a CA edge
 */
public record ClassPairScore(String classPair, int crCount, int matched, double ratio, double weight) {}
