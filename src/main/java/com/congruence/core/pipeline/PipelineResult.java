package com.congruence.core.pipeline;

import com.congruence.core.coordination.CoordinationResult;
import com.congruence.core.ingest.IngestionResult;
import com.congruence.core.model.MiningRun;

/**
 * Final state of a run and what it produced.
 *
 * @param ingestion    null when the data type carries no assignment matrix
 * @param coordination null unless the data type was {@code coordination_minimal}
 */
public record PipelineResult(MiningRun run, IngestionResult ingestion, CoordinationResult coordination) {}
