package com.congruence.core.ingest;

import com.congruence.core.error.ValidationException;
import com.congruence.core.model.ActivityLevel;
import com.congruence.core.model.FunctionalRole;
import com.congruence.core.model.ProjectContributor;
import com.congruence.core.persistence.ProjectContributorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Review surface over mined contributor roles: listing, manual override and summary.
 * An overridden role survives later ingestion runs.
 */
@Service
public class ContributorClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ContributorClassificationService.class);

    private final ProjectContributorRepository repository;

    public ContributorClassificationService(ProjectContributorRepository repository) {
        this.repository = repository;
    }

    public record Summary(long projectId, int total, Map<FunctionalRole, Integer> roles,
                          Map<ActivityLevel, Integer> activity, int coreContributors, int overridden) {}

    /**
     * @param role     only this role, or null for all
     * @param activity only this activity level, or null for all
     */
    public List<ProjectContributor> list(long projectId, FunctionalRole role, ActivityLevel activity) {
        return repository.findByProject(projectId).stream()
                .filter(pc -> role == null || pc.functionalRole() == role)
                .filter(pc -> activity == null || pc.activityLevel() == activity)
                .toList();
    }

    /**
     * Pins the role and core flag set by a reviewer.
     *
     * @throws ValidationException when the contributor has no snapshot in the project
     */
    public ProjectContributor override(long projectId, long contributorId, FunctionalRole role, boolean core) {
        if (role == null) {
            throw new ValidationException("role is required");
        }
        if (!repository.overrideRole(projectId, contributorId, role, core)) {
            throw new ValidationException("Contributor %d is not part of project %d".formatted(contributorId, projectId));
        }
        log.info("Role of contributor {} in project {} set to {} (core={})", contributorId, projectId, role, core);
        return repository.find(projectId, contributorId)
                .orElseThrow(() -> new ValidationException("Contributor %d vanished from project %d"
                        .formatted(contributorId, projectId)));
    }

    public Summary summary(long projectId) {
        List<ProjectContributor> rows = repository.findByProject(projectId);
        Map<FunctionalRole, Integer> roles = new EnumMap<>(FunctionalRole.class);
        Map<ActivityLevel, Integer> activity = new EnumMap<>(ActivityLevel.class);
        for (FunctionalRole r : FunctionalRole.values()) {
            roles.put(r, 0);
        }
        for (ActivityLevel a : ActivityLevel.values()) {
            activity.put(a, 0);
        }
        int core = 0;
        int overridden = 0;
        for (ProjectContributor pc : rows) {
            roles.merge(pc.functionalRole(), 1, Integer::sum);
            activity.merge(pc.activityLevel(), 1, Integer::sum);
            if (pc.coreContributor()) core++;
            if (pc.roleOverridden()) overridden++;
        }
        return new Summary(projectId, rows.size(), roles, activity, core, overridden);
    }
}
