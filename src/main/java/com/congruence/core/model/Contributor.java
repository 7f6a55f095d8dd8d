package com.congruence.core.model;

/**
 * A developer identified by the login derived from the commit-author email.
 */
public record Contributor(long id, String login, String email) {}
