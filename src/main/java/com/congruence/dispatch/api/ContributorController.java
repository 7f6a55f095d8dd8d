package com.congruence.dispatch.api;

import com.congruence.core.error.ValidationException;
import com.congruence.core.ingest.ContributorClassificationService;
import com.congruence.core.model.ActivityLevel;
import com.congruence.core.model.FunctionalRole;
import com.congruence.core.model.ProjectContributor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for contributor classification review.
 */
@RestController
@RequestMapping("/api/v1/projects/{id}/contributors")
public class ContributorController {

    private final ContributorClassificationService classification;

    public ContributorController(ContributorClassificationService classification) {
        this.classification = classification;
    }

    @GetMapping
    public List<Map<String, Object>> list(@PathVariable long id,
                                          @RequestParam(required = false) String role,
                                          @RequestParam(required = false) String activity) {
        return classification.list(id, parse(FunctionalRole.class, role), parse(ActivityLevel.class, activity))
                .stream().map(ContributorController::toBody).toList();
    }

    @GetMapping("/summary")
    public ContributorClassificationService.Summary summary(@PathVariable long id) {
        return classification.summary(id);
    }

    /**
     * PATCH /api/v1/projects/{id}/contributors/{contributorId}: Pins a role; later mining keeps it.
     */
    @PatchMapping("/{contributorId}")
    public Map<String, Object> override(@PathVariable long id, @PathVariable long contributorId,
                                        @RequestBody RoleOverrideRequest request) {
        FunctionalRole role = parse(FunctionalRole.class, request.role());
        return toBody(classification.override(id, contributorId, role, request.isCore()));
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid %s: %s".formatted(type.getSimpleName(), value));
        }
    }

    private static Map<String, Object> toBody(ProjectContributor pc) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contributor_id", pc.contributorId());
        body.put("login", pc.login());
        body.put("functional_role", pc.functionalRole().name());
        body.put("role_confidence", pc.roleConfidence());
        body.put("role_overridden", pc.roleOverridden());
        body.put("is_core_contributor", pc.coreContributor());
        body.put("files_modified", pc.filesModified());
        body.put("total_modifications", pc.totalModifications());
        body.put("avg_modifications_per_file", pc.avgModificationsPerFile());
        body.put("activity_level", pc.activityLevel().name());
        body.put("mined_branch", pc.minedBranch());
        body.put("last_analysis_at", pc.lastAnalysisAt());
        body.put("file_types", pc.fileTypes());
        return body;
    }
}
