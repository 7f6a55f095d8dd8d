package com.congruence.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for PATCH /api/v1/projects/{id}/contributors/{contributorId}.
 */
public record RoleOverrideRequest(
    String role,
    @JsonProperty("is_core") boolean isCore
) {}
