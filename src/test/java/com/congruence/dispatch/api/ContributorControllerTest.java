package com.congruence.dispatch.api;

import com.congruence.core.error.ValidationException;
import com.congruence.core.ingest.ContributorClassificationService;
import com.congruence.core.model.ActivityLevel;
import com.congruence.core.model.FunctionalRole;
import com.congruence.core.model.ProjectContributor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ContributorController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ContributorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ContributorClassificationService classification;

    private static ProjectContributor alice(FunctionalRole role, boolean overridden) {
        return new ProjectContributor(1, 5, "alice", "1", 12, 150, 12.5, role, overridden ? 1.0 : 0.8,
                true, overridden, "main", Instant.parse("2026-04-01T12:00:00Z"), Map.of("py", 150));
    }

    @Test
    @DisplayName("GET lists contributors filtered by role and activity")
    void list() throws Exception {
        when(classification.list(1, FunctionalRole.CODER, ActivityLevel.MEDIUM))
                .thenReturn(List.of(alice(FunctionalRole.CODER, false)));

        mockMvc.perform(get("/api/v1/projects/1/contributors?role=coder&activity=medium"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].login").value("alice"))
                .andExpect(jsonPath("$[0].activity_level").value("MEDIUM"))
                .andExpect(jsonPath("$[0].file_types.py").value(150));
    }

    @Test
    @DisplayName("GET with an unknown role is a 400")
    void invalidRole() throws Exception {
        mockMvc.perform(get("/api/v1/projects/1/contributors?role=architect"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION"));
    }

    @Test
    @DisplayName("PATCH pins the role")
    void override() throws Exception {
        when(classification.override(1, 5, FunctionalRole.REVIEWER, true))
                .thenReturn(alice(FunctionalRole.REVIEWER, true));

        mockMvc.perform(patch("/api/v1/projects/1/contributors/5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"reviewer\", \"is_core\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.functional_role").value("REVIEWER"))
                .andExpect(jsonPath("$.role_overridden").value(true))
                .andExpect(jsonPath("$.role_confidence").value(1.0));
    }

    @Test
    @DisplayName("PATCH for a contributor outside the project is a 400")
    void overrideUnknown() throws Exception {
        when(classification.override(1, 9, FunctionalRole.CODER, false))
                .thenThrow(new ValidationException("Contributor 9 is not part of project 1"));

        mockMvc.perform(patch("/api/v1/projects/1/contributors/9")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"CODER\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("not part of project")));
    }
}
