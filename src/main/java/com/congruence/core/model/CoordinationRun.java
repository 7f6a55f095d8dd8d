package com.congruence.core.model;

import java.time.Instant;

/**
 * One persisted congruence computation. Append-only.
 *
 * @param classConfig    JSON of the class policy used (MC-STC), "{}" for STC
 * @param classBreakdown JSON of per class-pair ratios (MC-STC), "{}" for STC
 * @param diffCount      CR edges with no matching CA edge
 */
public record CoordinationRun(
    long id,
    long projectId,
    String branch,
    Algorithm algorithm,
    TdSource tdSource,
    String caSource,
    String classConfig,
    String classBreakdown,
    double score,
    int crCount,
    int diffCount,
    Instant createdAt
) {

    public ScoreBand band() {
        return ScoreBand.of(score);
    }
}
