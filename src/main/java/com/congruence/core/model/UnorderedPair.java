package com.congruence.core.model;

import java.util.Objects;

/**
 * Undirected pair in canonical order: {@code first < second} always holds.
 * Use {@link #of} to build one; the constructor rejects non-canonical input.
 */
public record UnorderedPair<T extends Comparable<? super T>>(T first, T second) {

    public UnorderedPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.compareTo(second) >= 0) {
            throw new IllegalArgumentException(
                    "Pair must be canonically ordered with distinct ends: (%s, %s)".formatted(first, second));
        }
    }

    /**
     * Normalizes {@code (b, a)} to {@code (a, b)}. Self pairs are rejected.
     */
    public static <T extends Comparable<? super T>> UnorderedPair<T> of(T a, T b) {
        int cmp = a.compareTo(b);
        if (cmp == 0) {
            throw new IllegalArgumentException("Self pair is not an edge: " + a);
        }
        return cmp < 0 ? new UnorderedPair<>(a, b) : new UnorderedPair<>(b, a);
    }

    public boolean contains(T value) {
        return first.equals(value) || second.equals(value);
    }
}
