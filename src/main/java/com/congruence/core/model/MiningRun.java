package com.congruence.core.model;

import java.time.Instant;

/**
 * One invocation of the mining pipeline.
 *
 * @param command     miner command names joined with ','
 * @param optionsJson JSON of the options passed to the miner
 * @param artifactDir directory holding the mined artifacts, null until mining ran
 * @param errorCode   typed error code of a failed run
 * @param log         bounded tail of miner output
 */
public record MiningRun(
    long id,
    long projectId,
    String repoUrl,
    String branch,
    MiningDataType dataType,
    String command,
    String optionsJson,
    MiningRunStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String artifactDir,
    String errorCode,
    String errorMessage,
    String log
) {}
