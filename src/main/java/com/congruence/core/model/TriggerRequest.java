package com.congruence.core.model;

/**
 * Parameters of a mining trigger.
 *
 * @param branch   branch to mine, null for the project default
 * @param safeMode mine a sanitized workspace instead of the clone itself
 */
public record TriggerRequest(
    Long projectId,
    String branch,
    MiningDataType dataType,
    boolean safeMode
) {

    public static TriggerRequest of(Long projectId, String branch, String dataType, Boolean safeMode) {
        return new TriggerRequest(projectId, branch, MiningDataType.fromValue(dataType),
                safeMode == null || safeMode);
    }
}
