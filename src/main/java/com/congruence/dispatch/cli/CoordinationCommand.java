package com.congruence.dispatch.cli;

import com.congruence.core.model.CoordinationRun;
import com.congruence.core.model.CrEdge;
import com.congruence.core.persistence.CoordinationRunRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: congruence coordination &lt;project-id&gt;
 */
@Command(name = "coordination", mixinStandardHelpOptions = true,
        description = "Show congruence scores and coordination requirements")
@Component
public class CoordinationCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private long projectId;

    @Option(names = {"--limit", "-n"}, defaultValue = "10", description = "Runs to list (default: ${DEFAULT-VALUE})")
    private int limit;

    @Option(names = {"--edges"}, paramLabel = "RUN_ID", description = "Print the CR edges of a run")
    private Long edgesOf;

    private final CoordinationRunRepository runs;

    public CoordinationCommand(CoordinationRunRepository runs) {
        this.runs = runs;
    }

    @Override
    public Integer call() {
        if (edgesOf != null) {
            var run = runs.findById(edgesOf).filter(r -> r.projectId() == projectId);
            if (run.isEmpty()) {
                ConsoleOutput.error("Coordination run %d not found in project %d".formatted(edgesOf, projectId));
                return 1;
            }
            ConsoleOutput.coordinationRun(run.get());
            for (CrEdge edge : runs.findCrEdges(edgesOf)) {
                System.out.printf("  %d - %d  %.2f%n", edge.contributors().first(), edge.contributors().second(),
                        edge.weight());
            }
            return 0;
        }
        List<CoordinationRun> history = runs.findByProject(projectId, limit);
        if (history.isEmpty()) {
            ConsoleOutput.info("No coordination runs for project " + projectId);
            return 0;
        }
        ConsoleOutput.info("Project " + projectId);
        history.forEach(ConsoleOutput::coordinationRun);
        return 0;
    }
}
