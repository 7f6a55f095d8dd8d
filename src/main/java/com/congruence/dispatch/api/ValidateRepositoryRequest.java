package com.congruence.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/repositories/validate.
 *
 * @param ownerId nullable; when set, that owner's stored credentials are tried
 */
public record ValidateRepositoryRequest(
    String url,
    @JsonProperty("owner_id") String ownerId
) {}
