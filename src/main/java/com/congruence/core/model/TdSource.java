package com.congruence.core.model;

/**
 * Origin of technical dependencies: logical (co-change) or structural.
 */
public enum TdSource {
    LD,
    SD
}
