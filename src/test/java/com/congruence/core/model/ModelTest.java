package com.congruence.core.model;

import com.congruence.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    // ═══════════════════════════════════════════════════════════════════
    //  Enums
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Enums")
    class EnumTests {

        @Test
        @DisplayName("Data types parse from their wire value in any case")
        void dataTypeParsing() {
            assertEquals(MiningDataType.COORDINATION_MINIMAL, MiningDataType.fromValue(" Coordination_Minimal "));
            assertEquals("assignment_matrix", MiningDataType.ASSIGNMENT_MATRIX.value());
        }

        @Test
        @DisplayName("Unknown or missing data types are validation errors")
        void dataTypeRejected() {
            var e = assertThrows(ValidationException.class, () -> MiningDataType.fromValue("commits"));
            assertTrue(e.getMessage().contains("assignment_matrix"));
            assertThrows(ValidationException.class, () -> MiningDataType.fromValue(" "));
        }

        @Test
        @DisplayName("Activity levels bucket total modifications")
        void activityLevels() {
            assertEquals(ActivityLevel.HIGH, ActivityLevel.of(1000));
            assertEquals(ActivityLevel.MEDIUM, ActivityLevel.of(999));
            assertEquals(ActivityLevel.MEDIUM, ActivityLevel.of(100));
            assertEquals(ActivityLevel.LOW, ActivityLevel.of(10));
            assertEquals(ActivityLevel.MINIMAL, ActivityLevel.of(9));
        }

        @Test
        @DisplayName("Score bands")
        void scoreBands() {
            assertEquals(ScoreBand.EXCELLENT, ScoreBand.of(0.8));
            assertEquals(ScoreBand.GOOD, ScoreBand.of(0.6));
            assertEquals(ScoreBand.MODERATE, ScoreBand.of(0.4));
            assertEquals(ScoreBand.POOR, ScoreBand.of(0.399));
        }

        @Test
        @DisplayName("Providers are recognised from the URL host")
        void providers() {
            assertEquals(GitProvider.GITHUB, GitProvider.fromUrl("https://github.com/a/b.git"));
            assertEquals(GitProvider.GITLAB, GitProvider.fromUrl("git@gitlab.example.com:a/b.git"));
            assertEquals(GitProvider.BITBUCKET, GitProvider.fromUrl("https://bitbucket.org/a/b"));
            assertEquals(GitProvider.GENERIC, GitProvider.fromUrl("https://git.example.com/a/b"));
        }

        @Test
        @DisplayName("Only finished runs are terminal")
        void terminalStatus() {
            assertFalse(MiningRunStatus.QUEUED.isTerminal());
            assertFalse(MiningRunStatus.RUNNING.isTerminal());
            assertTrue(MiningRunStatus.SUCCEEDED.isTerminal());
            assertTrue(MiningRunStatus.FAILED.isTerminal());
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Records
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Records")
    class RecordTests {

        @Test
        @DisplayName("UnorderedPair.of normalizes order")
        void pairNormalized() {
            assertEquals(new UnorderedPair<>(1L, 2L), UnorderedPair.of(2L, 1L));
            assertEquals(UnorderedPair.of(1L, 2L), UnorderedPair.of(2L, 1L));
            assertTrue(UnorderedPair.of(2L, 1L).contains(2L));
            assertFalse(UnorderedPair.of(2L, 1L).contains(3L));
        }

        @Test
        @DisplayName("UnorderedPair rejects self pairs and reversed construction")
        void pairRejected() {
            assertThrows(IllegalArgumentException.class, () -> UnorderedPair.of(4L, 4L));
            assertThrows(IllegalArgumentException.class, () -> new UnorderedPair<>(2L, 1L));
            assertThrows(NullPointerException.class, () -> new UnorderedPair<Long>(null, 1L));
        }

        @Test
        @DisplayName("Trigger defaults to safe mode")
        void triggerDefaults() {
            TriggerRequest request = TriggerRequest.of(7L, null, "file_dependency", null);

            assertTrue(request.safeMode());
            assertEquals(MiningDataType.FILE_DEPENDENCY, request.dataType());
            assertFalse(TriggerRequest.of(7L, "dev", "file_dependency", false).safeMode());
        }

        @Test
        @DisplayName("Coordination runs expose their band")
        void runBand() {
            var run = new CoordinationRun(1, 1, "main", Algorithm.STC, TdSource.LD, "ta-shared-files", "{}", "{}",
                    0.75, 4, 1, Instant.EPOCH);

            assertEquals(ScoreBand.GOOD, run.band());
        }

        @Test
        @DisplayName("Access validation keeps the remote branch names")
        void accessValidation() {
            var validation = new AccessValidation(true, List.of("dev", "main"), "main", false);

            assertEquals("main", validation.defaultBranch());
            assertEquals(List.of("dev", "main"), validation.branches());
            assertFalse(validation.usedAuth());
        }
    }
}
