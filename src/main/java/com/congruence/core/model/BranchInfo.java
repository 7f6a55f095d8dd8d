package com.congruence.core.model;

/**
 * A branch of a local clone.
 *
 * @param branchId stable id derived from the name and the commit hash
 */
public record BranchInfo(
    String name,
    boolean isCurrent,
    String commitHash,
    String branchId
) {}
