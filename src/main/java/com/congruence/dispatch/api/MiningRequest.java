package com.congruence.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/projects/{id}/mining.
 *
 * @param branch   nullable, defaults to the project default branch
 * @param dataType assignment_matrix, file_dependency, files_ownership or coordination_minimal
 * @param safeMode nullable, defaults to true
 */
public record MiningRequest(
    String branch,
    @JsonProperty("data_type") String dataType,
    @JsonProperty("safe_mode") Boolean safeMode
) {}
