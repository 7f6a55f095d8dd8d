package com.congruence.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Per-project snapshot of a contributor's mined statistics.
 *
 * @param minerUserId    id the miner assigned to the author
 * @param fileTypes      modifications per lower-case file extension
 * @param roleOverridden true once a reviewer set the role by hand
 */
public record ProjectContributor(
    long projectId,
    long contributorId,
    String login,
    String minerUserId,
    int filesModified,
    int totalModifications,
    double avgModificationsPerFile,
    FunctionalRole functionalRole,
    double roleConfidence,
    boolean coreContributor,
    boolean roleOverridden,
    String minedBranch,
    Instant lastAnalysisAt,
    Map<String, Integer> fileTypes
) {

    public ActivityLevel activityLevel() {
        return ActivityLevel.of(totalModifications);
    }
}
