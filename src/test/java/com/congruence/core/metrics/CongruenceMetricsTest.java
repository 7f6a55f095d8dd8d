package com.congruence.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CongruenceMetricsTest {

    private SimpleMeterRegistry registry;
    private CongruenceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CongruenceMetrics(registry);
    }

    @Test
    @DisplayName("recordMinerDuration records by command tag")
    void recordMinerDuration() {
        metrics.recordMinerDuration("AssignmentMatrixMiner", Duration.ofSeconds(3));

        var timer = registry.find("congruence.miner.duration").tag("command", "AssignmentMatrixMiner").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordMiningRun increments the counter of the status")
    void recordMiningRun() {
        metrics.recordMiningRun("SUCCEEDED");
        metrics.recordMiningRun("SUCCEEDED");
        metrics.recordMiningRun("FAILED");

        assertEquals(2.0, registry.find("congruence.mining_runs.total").tag("status", "SUCCEEDED").counter().count());
        assertEquals(1.0, registry.find("congruence.mining_runs.total").tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("recordGitFailure counts by classified type")
    void recordGitFailure() {
        metrics.recordGitFailure("AUTH_FAILED");

        var counter = registry.find("congruence.git.failures").tag("type", "AUTH_FAILED").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordIngestion counts ingested and skipped contributors")
    void recordIngestion() {
        metrics.recordIngestion(5, 1);

        assertEquals(5.0, registry.find("congruence.ingest.contributors").tag("result", "ingested").counter().count());
        assertEquals(1.0, registry.find("congruence.ingest.contributors").tag("result", "skipped").counter().count());
    }

    @Test
    @DisplayName("recordScore and recordPrunedFiles feed distribution summaries")
    void summaries() {
        metrics.recordScore("STC", 0.5);
        metrics.recordPrunedFiles(12);

        var score = registry.find("congruence.coordination.score").tag("algorithm", "STC").summary();
        assertNotNull(score);
        assertEquals(0.5, score.totalAmount());
        assertEquals(12.0, registry.find("congruence.workspace.pruned_files").summary().totalAmount());
    }
}
