package com.congruence.core.model;

/**
 * Why two contributors are considered to coordinate.
 */
public enum Evidence {
    /** Both authored the same commit. */
    SAME_COMMIT,
    /** Both edited at least one common file. */
    SAME_FILE,
    /** Both repeatedly edited a set of common files. */
    CO_EDIT
}
