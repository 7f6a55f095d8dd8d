package com.congruence.core.pipeline;

import com.congruence.core.model.MiningDataType;
import com.congruence.core.model.MiningRun;
import com.congruence.core.model.MiningRunStatus;
import com.congruence.core.model.TriggerRequest;
import com.congruence.core.persistence.MiningRunRepository;
import com.congruence.mining.MinerExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BackgroundMiningExecutorTest {

    private static final Instant NOW = Instant.parse("2026-04-01T12:00:00Z");

    private MiningPipeline pipeline;
    private MiningRunRepository runs;
    private BackgroundMiningExecutor executor;
    private final AtomicLong ids = new AtomicLong();

    @BeforeEach
    void setUp() {
        pipeline = mock(MiningPipeline.class);
        runs = mock(MiningRunRepository.class);
        var properties = new PipelineProperties();
        properties.setPoolSize(1);
        properties.setQueueCapacity(1);
        executor = new BackgroundMiningExecutor(pipeline, runs, Clock.fixed(NOW, ZoneOffset.UTC), properties);
        when(pipeline.accept(any())).thenAnswer(inv -> run(ids.incrementAndGet(), MiningRunStatus.QUEUED));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static MiningRun run(long id, MiningRunStatus status) {
        return new MiningRun(id, 1, "https://github.com/acme/app.git", "main", MiningDataType.ASSIGNMENT_MATRIX,
                null, null, status, NOW, null, null, null, null, null, null);
    }

    private static TriggerRequest request() {
        return new TriggerRequest(1L, "main", MiningDataType.ASSIGNMENT_MATRIX, true);
    }

    @Test
    @DisplayName("A worker failure is contained and the handle reports the recorded status")
    void workerFailureContained() throws Exception {
        when(pipeline.execute(any(), any())).thenThrow(new MinerExecutionException("exit 1", 1, "", "boom"));
        when(runs.findById(1)).thenReturn(Optional.of(run(1, MiningRunStatus.FAILED)));

        RunHandle handle = executor.submit(request());
        handle.future().get(5, TimeUnit.SECONDS);

        assertEquals(1, handle.runId());
        assertEquals(MiningRunStatus.FAILED, handle.status());
        verify(pipeline).execute(argThat(r -> r.id() == 1), any());
    }

    @Test
    @DisplayName("A full queue rejects the trigger and closes its run as FAILED")
    void fullQueueRejected() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        when(pipeline.execute(any(), any())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        });

        executor.submit(request());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        executor.submit(request());

        assertThrows(RejectedExecutionException.class, () -> executor.submit(request()));
        verify(runs).markFailed(eq(3L), eq(NOW), eq("REJECTED"), anyString(), eq(""));
        assertEquals(1, executor.queuedCount());
        release.countDown();
    }

    @Test
    @DisplayName("Cancelling a queued run closes it as FAILED")
    void cancelQueued() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        when(pipeline.execute(any(), any())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
        when(runs.cancelQueued(eq(2L), any(), anyString(), anyString())).thenReturn(true);

        executor.submit(request());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        RunHandle queued = executor.submit(request());

        assertTrue(queued.cancel());
        verify(runs).cancelQueued(eq(2L), eq(NOW), eq("CANCELLED"), anyString());
        verify(runs, never()).markFailed(eq(2L), any(), any(), any(), any());
        release.countDown();
    }
}
