package com.congruence.dispatch.cli;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.error.ValidationException;
import com.congruence.core.git.ProjectBranchService;
import com.congruence.core.model.BranchInfo;
import com.congruence.core.model.Project;
import com.congruence.core.persistence.ProjectRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: congruence branches &lt;project-id&gt; [--switch &lt;branch&gt;]
 */
@Command(name = "branches", mixinStandardHelpOptions = true,
        description = "List the branches of a project's clone, optionally switching first")
@Component
public class BranchesCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private long projectId;

    @Option(names = {"--switch", "-s"}, description = "Branch to check out before listing")
    private String switchTo;

    private final ProjectRepository projects;
    private final ProjectBranchService branchService;

    public BranchesCommand(ProjectRepository projects, ProjectBranchService branchService) {
        this.projects = projects;
        this.branchService = branchService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            Project project = projects.findById(projectId)
                    .orElseThrow(() -> new ValidationException("Unknown project: " + projectId));
            branchService.ensureClone(project);
            if (switchTo != null) {
                String current = branchService.switchBranch(projectId, switchTo);
                ConsoleOutput.success("Switched to " + current);
            }
            for (BranchInfo branch : branchService.branches(projectId)) {
                String marker = branch.isCurrent() ? "@|fg(green) *|@" : " ";
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  " + marker + " " + branch.name() + "  " + abbreviate(branch.commitHash())
                        + "  id " + branch.branchId()));
            }
            return 0;
        } catch (CongruenceException e) {
            return ConsoleOutput.failure(e);
        }
    }

    private static String abbreviate(String hash) {
        return hash != null && hash.length() > 8 ? hash.substring(0, 8) : String.valueOf(hash);
    }
}
