package com.congruence.core.coordination;

import com.congruence.core.model.CoordinationRun;

import java.util.List;

/**
 * Runs persisted by one coordination pass, one per configured algorithm.
 */
public record CoordinationResult(List<CoordinationRun> runs, int tdEdges, int caEdges, int crEdges) {

    public CoordinationResult {
        runs = List.copyOf(runs);
    }
}
