package com.congruence.core.model;

/**
 * Repository reference owned by the project-management subsystem. Read-only here.
 */
public record Project(
    long id,
    String repoUrl,
    String defaultBranch,
    String ownerId
) {}
