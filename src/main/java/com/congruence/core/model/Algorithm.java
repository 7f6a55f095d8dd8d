package com.congruence.core.model;

/**
 * Congruence scoring algorithm.
 */
public enum Algorithm {
    STC,
    MC_STC
}
