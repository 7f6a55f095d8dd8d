package com.congruence.dispatch.cli;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.model.CoordinationRun;
import com.congruence.core.model.MiningRunStatus;
import com.congruence.core.model.TriggerRequest;
import com.congruence.core.pipeline.BackgroundMiningExecutor;
import com.congruence.core.pipeline.MiningPipeline;
import com.congruence.core.pipeline.PipelineResult;
import com.congruence.core.pipeline.RunHandle;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * CLI command: congruence mine &lt;project-id&gt;
 * <p>
 * Runs clone, sanitizing, mining, ingestion and scoring for one branch.
 * With {@code --async} the run goes to the background pool and the command
 * waits for it, printing the run id first.
 */
@Command(name = "mine", mixinStandardHelpOptions = true, description = "Mine a project branch")
@Component
public class MineCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private Long projectId;

    @Option(names = {"--branch", "-b"}, description = "Branch to mine (default: project default branch)")
    private String branch;

    @Option(names = {"--data-type", "-t"}, defaultValue = "coordination_minimal",
            description = "assignment_matrix, file_dependency, files_ownership or coordination_minimal (default: ${DEFAULT-VALUE})")
    private String dataType;

    @Option(names = {"--unsafe"}, description = "Mine the clone directly instead of a sanitized workspace")
    private boolean unsafe;

    @Option(names = {"--async"}, description = "Submit to the background pool")
    private boolean async;

    private final MiningPipeline pipeline;
    private final BackgroundMiningExecutor background;

    public MineCommand(MiningPipeline pipeline, BackgroundMiningExecutor background) {
        this.pipeline = pipeline;
        this.background = background;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            TriggerRequest request = TriggerRequest.of(projectId, branch, dataType, !unsafe);
            if (async) {
                return runInBackground(request);
            }
            ConsoleOutput.info("Mining project " + projectId + " (" + request.dataType().value() + ")...");
            PipelineResult result = pipeline.run(request);
            ConsoleOutput.miningRun(result.run());
            if (result.ingestion() != null) {
                ConsoleOutput.success("Contributors: " + result.ingestion().contributors()
                        + " (" + result.ingestion().skipped() + " skipped), files: " + result.ingestion().files());
            }
            if (result.coordination() != null) {
                for (CoordinationRun run : result.coordination().runs()) {
                    ConsoleOutput.coordinationRun(run);
                }
            }
            return 0;
        } catch (CongruenceException e) {
            return ConsoleOutput.failure(e);
        }
    }

    private int runInBackground(TriggerRequest request) {
        RunHandle handle;
        try {
            handle = background.submit(request);
        } catch (RejectedExecutionException e) {
            ConsoleOutput.error("Mining queue is full, try again later");
            return 1;
        }
        ConsoleOutput.info("Submitted mining run " + handle.runId());
        try {
            handle.future().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
            ConsoleOutput.error("Interrupted, run " + handle.runId() + " cancelled");
            return 1;
        } catch (ExecutionException e) {
            ConsoleOutput.error("Run " + handle.runId() + " failed: " + e.getCause().getMessage());
        }
        ConsoleOutput.info("Run " + handle.runId() + " finished: " + handle.status());
        return handle.status() == MiningRunStatus.SUCCEEDED ? 0 : 1;
    }
}
