package com.congruence.dispatch.cli;

import com.congruence.core.model.MiningRun;
import com.congruence.core.persistence.MiningRunRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: congruence status (--run &lt;id&gt; | --project &lt;id&gt;)
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show mining run status")
@Component
public class StatusCommand implements Callable<Integer> {

    @ArgGroup(multiplicity = "1")
    private Target target;

    static class Target {
        @Option(names = {"--run", "-r"}, description = "Mining run ID")
        Long runId;

        @Option(names = {"--project", "-p"}, description = "Project ID, shows its recent runs")
        Long projectId;
    }

    @Option(names = {"--limit", "-n"}, defaultValue = "10", description = "Runs to list (default: ${DEFAULT-VALUE})")
    private int limit;

    @Option(names = {"--log"}, description = "Print the captured miner output")
    private boolean showLog;

    private final MiningRunRepository runs;

    public StatusCommand(MiningRunRepository runs) {
        this.runs = runs;
    }

    @Override
    public Integer call() {
        if (target.runId != null) {
            Optional<MiningRun> run = runs.findById(target.runId);
            if (run.isEmpty()) {
                ConsoleOutput.error("Mining run not found: " + target.runId);
                return 1;
            }
            ConsoleOutput.miningRun(run.get());
            if (showLog && run.get().log() != null && !run.get().log().isEmpty()) {
                System.out.println("──────────────────────────────────");
                System.out.println(run.get().log());
            }
            return 0;
        }
        List<MiningRun> recent = runs.findRecent(target.projectId, limit);
        if (recent.isEmpty()) {
            ConsoleOutput.info("No mining runs for project " + target.projectId);
            return 0;
        }
        recent.forEach(ConsoleOutput::miningRun);
        return 0;
    }
}
