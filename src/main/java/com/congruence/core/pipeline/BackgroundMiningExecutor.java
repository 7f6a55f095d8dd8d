package com.congruence.core.pipeline;

import com.congruence.core.model.MiningRun;
import com.congruence.core.model.TriggerRequest;
import com.congruence.core.persistence.MiningRunRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fire-and-forget mining on a bounded worker pool.
 *
 * <p>The run row is created QUEUED before submission, so callers get an id at once.
 * A full queue rejects the trigger synchronously and the run is closed as FAILED.
 * Worker failures are recorded on the run by the pipeline and logged here, never rethrown.
 */
@Service
public class BackgroundMiningExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackgroundMiningExecutor.class);

    private final MiningPipeline pipeline;
    private final MiningRunRepository runs;
    private final Clock clock;
    private final ThreadPoolExecutor executor;

    public BackgroundMiningExecutor(MiningPipeline pipeline, MiningRunRepository runs, Clock clock,
                                    PipelineProperties properties) {
        this.pipeline = pipeline;
        this.runs = runs;
        this.clock = clock;
        var counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(properties.getPoolSize(), properties.getPoolSize(),
                60, TimeUnit.SECONDS, new ArrayBlockingQueue<>(Math.max(1, properties.getQueueCapacity())),
                r -> {
                    Thread t = new Thread(r, "mining-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * @throws com.congruence.core.error.ValidationException for an invalid trigger; no run is created
     * @throws RejectedExecutionException when the queue is full
     */
    public RunHandle submit(TriggerRequest request) {
        MiningRun run = pipeline.accept(request);
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        var task = new FutureTask<Void>(() -> {
            if (callerMdc != null) {
                MDC.setContextMap(callerMdc);
            }
            try {
                pipeline.execute(run, request);
            } catch (RuntimeException e) {
                log.warn("Background mining run {} ended with {}", run.id(), e.toString());
            } finally {
                MDC.clear();
            }
            return null;
        }) {
            @Override
            protected void done() {
                if (isCancelled()) {
                    closeCancelled(run.id());
                }
            }
        };
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            runs.markFailed(run.id(), clock.instant(), "REJECTED", "Mining queue is full", "");
            log.warn("Rejected mining run {}: queue full ({} waiting)", run.id(), executor.getQueue().size());
            throw e;
        }
        return new RunHandle(run.id(), task, runs);
    }

    /**
     * A run cancelled while still queued never reaches the pipeline; close it here.
     */
    private void closeCancelled(long runId) {
        if (runs.cancelQueued(runId, clock.instant(), "CANCELLED", "Cancelled before start")) {
            log.info("Cancelled queued mining run {}", runId);
        }
    }

    public int activeCount() {
        return executor.getActiveCount();
    }

    public int queuedCount() {
        return executor.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
