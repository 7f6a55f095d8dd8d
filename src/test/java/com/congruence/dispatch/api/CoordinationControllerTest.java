package com.congruence.dispatch.api;

import com.congruence.core.model.Algorithm;
import com.congruence.core.model.CoordinationRun;
import com.congruence.core.model.CrEdge;
import com.congruence.core.model.TdSource;
import com.congruence.core.model.UnorderedPair;
import com.congruence.core.persistence.CoordinationRunRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CoordinationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class CoordinationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CoordinationRunRepository runs;

    private static CoordinationRun run(long id, long projectId, Algorithm algorithm, double score) {
        return new CoordinationRun(id, projectId, "main", algorithm, TdSource.LD, "ta-shared-files", "{}", "{}",
                score, 4, 1, Instant.parse("2026-04-01T12:00:00Z"));
    }

    @Test
    @DisplayName("GET /latest accepts the hyphenated algorithm name")
    void latest() throws Exception {
        when(runs.findLatest(1, Algorithm.MC_STC)).thenReturn(Optional.of(run(3, 1, Algorithm.MC_STC, 0.9)));

        mockMvc.perform(get("/api/v1/projects/1/coordination-runs/latest?algorithm=mc-stc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.algorithm").value("MC_STC"))
                .andExpect(jsonPath("$.band").value("EXCELLENT"))
                .andExpect(jsonPath("$.cr_count").value(4));
    }

    @Test
    @DisplayName("GET /latest without runs is 404, with a bad algorithm 400")
    void latestMissing() throws Exception {
        when(runs.findLatest(1, Algorithm.STC)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/projects/1/coordination-runs/latest"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/projects/1/coordination-runs/latest?algorithm=magic"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET CR edges lists canonical pairs of a run in the project")
    void crEdges() throws Exception {
        when(runs.findById(3)).thenReturn(Optional.of(run(3, 1, Algorithm.STC, 0.75)));
        when(runs.findCrEdges(3)).thenReturn(List.of(new CrEdge(UnorderedPair.of(9L, 4L), 30.0)));

        mockMvc.perform(get("/api/v1/projects/1/coordination-runs/3/cr-edges"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].contributor_i").value(4))
                .andExpect(jsonPath("$[0].contributor_j").value(9))
                .andExpect(jsonPath("$[0].weight").value(30.0));
    }

    @Test
    @DisplayName("GET CR edges of another project's run is 404")
    void crEdgesOtherProject() throws Exception {
        when(runs.findById(3)).thenReturn(Optional.of(run(3, 2, Algorithm.STC, 0.75)));

        mockMvc.perform(get("/api/v1/projects/1/coordination-runs/3/cr-edges"))
                .andExpect(status().isNotFound());
        verify(runs, never()).findCrEdges(anyLong());
    }
}
