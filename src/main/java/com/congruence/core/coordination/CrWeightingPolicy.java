package com.congruence.core.coordination;

/**
 * Weight one (contributor A on file X, contributor B on file Y, X depends on Y)
 * triple adds to the coordination requirement between A and B.
 */
@FunctionalInterface
public interface CrWeightingPolicy {

    double weight(int taAX, int taBY, double tdXY);
}
