package com.congruence.dispatch.cli;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.ingest.ContributorClassificationService;
import com.congruence.core.model.ActivityLevel;
import com.congruence.core.model.FunctionalRole;
import com.congruence.core.model.ProjectContributor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: congruence contributors &lt;project-id&gt;
 * <p>
 * Lists mined contributor roles, prints a summary, or pins a role by hand.
 */
@Command(name = "contributors", mixinStandardHelpOptions = true,
        description = "Review contributor classification of a project")
@Component
public class ContributorsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private long projectId;

    @Option(names = {"--role"}, description = "Only this role: ${COMPLETION-CANDIDATES}")
    private FunctionalRole role;

    @Option(names = {"--activity"}, description = "Only this activity level: ${COMPLETION-CANDIDATES}")
    private ActivityLevel activity;

    @Option(names = {"--summary"}, description = "Print role and activity counts only")
    private boolean summary;

    @Option(names = {"--override"}, paramLabel = "CONTRIBUTOR_ID",
            description = "Contributor whose role is set to --role")
    private Long overrideId;

    @Option(names = {"--core"}, description = "With --override: mark as core contributor")
    private boolean core;

    private final ContributorClassificationService classification;

    public ContributorsCommand(ContributorClassificationService classification) {
        this.classification = classification;
    }

    @Override
    public Integer call() {
        try {
            if (overrideId != null) {
                if (role == null) {
                    ConsoleOutput.error("--override needs --role");
                    return 2;
                }
                ProjectContributor updated = classification.override(projectId, overrideId, role, core);
                ConsoleOutput.success(updated.login() + " is now " + updated.functionalRole()
                        + (updated.coreContributor() ? " (core)" : ""));
                return 0;
            }
            if (summary) {
                var s = classification.summary(projectId);
                ConsoleOutput.info("Project " + projectId + ": " + s.total() + " contributors, "
                        + s.coreContributors() + " core, " + s.overridden() + " overridden");
                s.roles().forEach((r, n) -> System.out.println("  " + r + ": " + n));
                s.activity().forEach((a, n) -> System.out.println("  " + a + ": " + n));
                return 0;
            }
            List<ProjectContributor> rows = classification.list(projectId, role, activity);
            if (rows.isEmpty()) {
                ConsoleOutput.info("No contributors match");
                return 0;
            }
            System.out.printf("%-8s %-24s %-12s %6s %6s %7s %-8s%n",
                    "ID", "LOGIN", "ROLE", "FILES", "MODS", "AVG", "ACTIVITY");
            for (ProjectContributor pc : rows) {
                System.out.printf("%-8d %-24s %-12s %6d %6d %7.2f %-8s%s%n",
                        pc.contributorId(), pc.login(), pc.functionalRole() + (pc.roleOverridden() ? "*" : ""),
                        pc.filesModified(), pc.totalModifications(), pc.avgModificationsPerFile(),
                        pc.activityLevel(), pc.coreContributor() ? " core" : "");
            }
            return 0;
        } catch (CongruenceException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
