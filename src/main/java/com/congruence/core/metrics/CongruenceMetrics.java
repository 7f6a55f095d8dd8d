package com.congruence.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the mining pipeline.
 */
@Service
public class CongruenceMetrics {

    private final MeterRegistry registry;

    public CongruenceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMinerDuration(String command, Duration duration) {
        Timer.builder("congruence.miner.duration")
                .tag("command", command)
                .register(registry)
                .record(duration);
    }

    public void recordMiningRun(String status) {
        Counter.builder("congruence.mining_runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Counts classified git transport failures.
     *
     * @param errorType name of the classified error type
     */
    public void recordGitFailure(String errorType) {
        Counter.builder("congruence.git.failures")
                .description("Classified git transport failures")
                .tag("type", errorType)
                .register(registry)
                .increment();
    }

    public void recordPrunedFiles(int count) {
        DistributionSummary.builder("congruence.workspace.pruned_files")
                .description("Files removed while sanitizing a mining workspace")
                .register(registry)
                .record(count);
    }

    public void recordIngestion(int ingested, int skipped) {
        Counter.builder("congruence.ingest.contributors")
                .tag("result", "ingested")
                .register(registry)
                .increment(ingested);
        Counter.builder("congruence.ingest.contributors")
                .tag("result", "skipped")
                .register(registry)
                .increment(skipped);
    }

    public void recordScore(String algorithm, double score) {
        DistributionSummary.builder("congruence.coordination.score")
                .tag("algorithm", algorithm)
                .register(registry)
                .record(score);
    }
}
