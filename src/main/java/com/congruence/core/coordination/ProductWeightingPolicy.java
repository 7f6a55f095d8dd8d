package com.congruence.core.coordination;

import org.springframework.stereotype.Component;

/**
 * {@code ta(A,X) * ta(B,Y) * td(X,Y)}.
 */
@Component
public class ProductWeightingPolicy implements CrWeightingPolicy {

    @Override
    public double weight(int taAX, int taBY, double tdXY) {
        return (double) taAX * taBY * tdXY;
    }
}
