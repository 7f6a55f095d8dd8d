package com.congruence.core.pipeline;

import com.congruence.core.model.MiningRunStatus;
import com.congruence.core.persistence.MiningRunRepository;

import java.util.concurrent.Future;

/**
 * Observation and cancellation of a background run. Status is read from the
 * run row, so it reflects failures recorded by the worker.
 */
public final class RunHandle {

    private final long runId;
    private final Future<?> future;
    private final MiningRunRepository runs;

    RunHandle(long runId, Future<?> future, MiningRunRepository runs) {
        this.runId = runId;
        this.future = future;
        this.runs = runs;
    }

    public long runId() {
        return runId;
    }

    public Future<?> future() {
        return future;
    }

    public MiningRunStatus status() {
        return runs.findById(runId)
                .map(run -> run.status())
                .orElseThrow(() -> new IllegalStateException("Mining run %d disappeared".formatted(runId)));
    }

    /**
     * Interrupts the worker. A running miner process is killed and the run ends FAILED.
     *
     * @return false when the run had already finished
     */
    public boolean cancel() {
        return future.cancel(true);
    }
}
