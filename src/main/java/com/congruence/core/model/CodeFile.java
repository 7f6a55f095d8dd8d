package com.congruence.core.model;

/**
 * A source file of a project. {@code loc} is null when unknown.
 */
public record CodeFile(long id, long projectId, String path, String language, Integer loc) {}
