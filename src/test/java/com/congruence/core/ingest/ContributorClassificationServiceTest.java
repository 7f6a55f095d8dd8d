package com.congruence.core.ingest;

import com.congruence.core.error.ValidationException;
import com.congruence.core.model.ActivityLevel;
import com.congruence.core.model.FunctionalRole;
import com.congruence.core.model.ProjectContributor;
import com.congruence.core.persistence.ProjectContributorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ContributorClassificationServiceTest {

    private ProjectContributorRepository repository;
    private ContributorClassificationService service;

    @BeforeEach
    void setUp() {
        repository = mock(ProjectContributorRepository.class);
        service = new ContributorClassificationService(repository);
    }

    private static ProjectContributor row(long id, FunctionalRole role, int mods, boolean core, boolean overridden) {
        return new ProjectContributor(1, id, "user" + id, String.valueOf(id), 1, mods, mods, role, 0.5,
                core, overridden, "main", Instant.EPOCH, Map.of());
    }

    @Test
    @DisplayName("List filters by role and activity level")
    void listFilters() {
        when(repository.findByProject(1)).thenReturn(List.of(
                row(1, FunctionalRole.CODER, 1500, true, false),
                row(2, FunctionalRole.CODER, 20, false, false),
                row(3, FunctionalRole.REVIEWER, 20, false, false)));

        assertEquals(2, service.list(1, FunctionalRole.CODER, null).size());
        assertEquals(List.of(2L), service.list(1, FunctionalRole.CODER, ActivityLevel.LOW).stream()
                .map(ProjectContributor::contributorId).toList());
        assertEquals(3, service.list(1, null, null).size());
    }

    @Test
    @DisplayName("Override returns the pinned snapshot")
    void override() {
        when(repository.overrideRole(1, 2, FunctionalRole.REVIEWER, true)).thenReturn(true);
        ProjectContributor pinned = row(2, FunctionalRole.REVIEWER, 20, true, true);
        when(repository.find(1, 2)).thenReturn(Optional.of(pinned));

        assertSame(pinned, service.override(1, 2, FunctionalRole.REVIEWER, true));
    }

    @Test
    @DisplayName("Override of an unknown contributor or without a role is rejected")
    void overrideRejected() {
        when(repository.overrideRole(anyLong(), anyLong(), any(), anyBoolean())).thenReturn(false);

        assertThrows(ValidationException.class, () -> service.override(1, 9, FunctionalRole.CODER, false));
        assertThrows(ValidationException.class, () -> service.override(1, 2, null, false));
    }

    @Test
    @DisplayName("Summary counts every role and activity level")
    void summary() {
        when(repository.findByProject(1)).thenReturn(List.of(
                row(1, FunctionalRole.CODER, 1500, true, false),
                row(2, FunctionalRole.REVIEWER, 5, false, true)));

        ContributorClassificationService.Summary summary = service.summary(1);

        assertEquals(2, summary.total());
        assertEquals(1, summary.roles().get(FunctionalRole.CODER));
        assertEquals(0, summary.roles().get(FunctionalRole.UNCLASSIFIED));
        assertEquals(1, summary.activity().get(ActivityLevel.HIGH));
        assertEquals(1, summary.activity().get(ActivityLevel.MINIMAL));
        assertEquals(1, summary.coreContributors());
        assertEquals(1, summary.overridden());
    }
}
