package com.congruence.core.model;

import java.util.List;

/**
 * Outcome of a remote reference listing.
 */
public record AccessValidation(
    boolean accessible,
    List<String> branches,
    String defaultBranch,
    boolean usedAuth
) {}
