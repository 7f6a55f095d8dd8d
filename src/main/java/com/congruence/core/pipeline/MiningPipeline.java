package com.congruence.core.pipeline;

import com.congruence.core.coordination.CoordinationGraphBuilder;
import com.congruence.core.coordination.CoordinationResult;
import com.congruence.core.error.CongruenceException;
import com.congruence.core.error.ValidationException;
import com.congruence.core.git.GitAccessException;
import com.congruence.core.git.GitAccessService;
import com.congruence.core.git.ProjectBranchService;
import com.congruence.core.ingest.IngestionResult;
import com.congruence.core.ingest.OutputIngester;
import com.congruence.core.logging.MdcContext;
import com.congruence.core.metrics.CongruenceMetrics;
import com.congruence.core.model.MiningDataType;
import com.congruence.core.model.MiningRun;
import com.congruence.core.model.MiningRunStatus;
import com.congruence.core.model.Project;
import com.congruence.core.model.TriggerRequest;
import com.congruence.core.persistence.MiningRunRepository;
import com.congruence.core.persistence.ProjectRepository;
import com.congruence.core.persistence.TransactionRunner;
import com.congruence.core.process.ProcessResult;
import com.congruence.core.workspace.FileTrees;
import com.congruence.core.workspace.PreparedWorkspace;
import com.congruence.core.workspace.WorkspacePreparer;
import com.congruence.mining.MinerCommand;
import com.congruence.mining.MinerExecutionException;
import com.congruence.mining.MiningOrchestrator;
import com.congruence.mining.MiningTimeoutException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * End-to-end mining run: clone, optional sanitized workspace, miners, ingestion
 * and congruence scoring, with the outcome recorded on a {@link MiningRun}.
 *
 * <p>Input problems are rejected before a run row exists or any process starts.
 * Once the run exists every failure is recorded on it and rethrown.
 */
@Service
public class MiningPipeline {

    private static final Logger log = LoggerFactory.getLogger(MiningPipeline.class);

    private final ProjectRepository projects;
    private final MiningRunRepository runs;
    private final ProjectBranchService branches;
    private final WorkspacePreparer workspacePreparer;
    private final MiningOrchestrator orchestrator;
    private final OutputIngester ingester;
    private final CoordinationGraphBuilder coordination;
    private final TransactionRunner tx;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CongruenceMetrics metrics;

    public MiningPipeline(ProjectRepository projects, MiningRunRepository runs, ProjectBranchService branches,
                          WorkspacePreparer workspacePreparer, MiningOrchestrator orchestrator,
                          OutputIngester ingester, CoordinationGraphBuilder coordination, TransactionRunner tx,
                          PipelineProperties properties, ObjectMapper objectMapper, Clock clock,
                          @Autowired(required = false) CongruenceMetrics metrics) {
        this.projects = projects;
        this.runs = runs;
        this.branches = branches;
        this.workspacePreparer = workspacePreparer;
        this.orchestrator = orchestrator;
        this.ingester = ingester;
        this.coordination = coordination;
        this.tx = tx;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Runs the whole pipeline on the calling thread.
     */
    public PipelineResult run(TriggerRequest request) {
        return execute(accept(request), request);
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Acceptance
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Validates the trigger and records a QUEUED run for it.
     *
     * @throws ValidationException for a missing id, data type or unknown project, or a bad branch name
     */
    public MiningRun accept(TriggerRequest request) {
        if (request == null || request.projectId() == null) {
            throw new ValidationException("projectId is required");
        }
        if (request.dataType() == null) {
            throw new ValidationException("dataType is required");
        }
        Project project = projects.findById(request.projectId())
                .orElseThrow(() -> new ValidationException("Unknown project: " + request.projectId()));
        String branch = resolveBranch(request, project);
        GitAccessService.validateRefName(branch);

        MiningRun run = runs.create(project.id(), project.repoUrl(), branch, request.dataType(), clock.instant());
        log.info("Accepted mining run {} for project {} on {} ({}, safe mode {})", run.id(), project.id(), branch,
                request.dataType().value(), request.safeMode());
        return run;
    }

    String resolveBranch(TriggerRequest request, Project project) {
        if (request.branch() != null && !request.branch().isBlank()) {
            return request.branch().trim();
        }
        if (project.defaultBranch() != null && !project.defaultBranch().isBlank()) {
            return project.defaultBranch();
        }
        return properties.getFallbackBranch();
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Execution
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Executes an accepted run.
     *
     * @throws CongruenceException the failure, after it was recorded on the run
     */
    public PipelineResult execute(MiningRun run, TriggerRequest request) {
        long projectId = run.projectId();
        String branch = run.branch();
        MiningDataType dataType = run.dataType();
        MdcContext.setRun(projectId, run.id(), branch);
        try {
            if (!runs.markRunning(run.id(), clock.instant())) {
                log.info("Mining run {} is no longer queued, not starting it", run.id());
                return new PipelineResult(runs.findById(run.id()).orElse(run), null, null);
            }
            Project project = projects.findById(projectId)
                    .orElseThrow(() -> new ValidationException("Unknown project: " + projectId));

            Path repository = branches.ensureClone(project);
            branches.switchBranch(projectId, branch);

            Path outputDir = orchestrator.outputDirectory(projectId, branch);
            FileTrees.deleteRecursively(outputDir);
            List<MinerCommand> commands = orchestrator.commandsFor(dataType);
            runs.recordCommand(run.id(), commands.stream().map(MinerCommand::commandName).collect(Collectors.joining(",")),
                    optionsJson(request, commands), outputDir.toString());

            List<ProcessResult> results;
            if (request.safeMode()) {
                try (PreparedWorkspace workspace = workspacePreparer.prepare(repository, branch)) {
                    results = orchestrator.mine(dataType, workspace.gitDir(), workspace.branch(), outputDir);
                }
            } else {
                results = orchestrator.mine(dataType, repository.resolve(".git"), branch, outputDir);
            }

            Stored stored = tx.inTransaction("store mining run " + run.id(), conn -> store(dataType, projectId,
                    branch, outputDir));

            runs.markSucceeded(run.id(), clock.instant(), outputLog(results));
            record(MiningRunStatus.SUCCEEDED);
            log.info("Mining run {} succeeded", run.id());
            return new PipelineResult(runs.findById(run.id()).orElse(run), stored.ingestion(), stored.scores());
        } catch (CongruenceException e) {
            fail(run, e.code().name(), e.getMessage(), failureLog(e));
            throw e;
        } catch (RuntimeException e) {
            fail(run, "INTERNAL", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), "");
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private record Stored(IngestionResult ingestion, CoordinationResult scores) {}

    /**
     * Ingestion and scoring share the caller's transaction, so a failed run leaves the
     * snapshot of the last successful one in place.
     */
    private Stored store(MiningDataType dataType, long projectId, String branch, Path outputDir) {
        IngestionResult ingestion = null;
        if (dataType == MiningDataType.ASSIGNMENT_MATRIX || dataType == MiningDataType.COORDINATION_MINIMAL) {
            ingestion = ingester.ingest(projectId, branch, outputDir);
        }
        CoordinationResult scores = null;
        if (dataType == MiningDataType.COORDINATION_MINIMAL) {
            scores = coordination.build(projectId, branch, outputDir);
        }
        return new Stored(ingestion, scores);
    }

    private void fail(MiningRun run, String code, String message, String output) {
        log.error("Mining run {} failed [{}]: {}", run.id(), code, message);
        runs.markFailed(run.id(), clock.instant(), code, message, output);
        record(MiningRunStatus.FAILED);
    }

    private void record(MiningRunStatus status) {
        if (metrics != null) {
            metrics.recordMiningRun(status.name());
        }
    }

    private String optionsJson(TriggerRequest request, List<MinerCommand> commands) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("dataType", request.dataType().value());
        options.put("safeMode", request.safeMode());
        options.put("commands", commands.stream().map(MinerCommand::commandName).toList());
        try {
            return objectMapper.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize run options", e);
        }
    }

    private static String outputLog(List<ProcessResult> results) {
        return results.stream()
                .map(r -> joinStreams(r.stdout(), r.stderr()))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    private static String failureLog(CongruenceException e) {
        if (e instanceof MinerExecutionException miner) {
            return joinStreams(miner.stdout(), miner.stderr());
        }
        if (e instanceof MiningTimeoutException timeout) {
            return joinStreams(timeout.stdout(), timeout.stderr());
        }
        if (e instanceof GitAccessException git) {
            return joinStreams(git.stdout(), git.stderr());
        }
        return "";
    }

    private static String joinStreams(String stdout, String stderr) {
        String out = stdout == null ? "" : stdout.strip();
        String err = stderr == null ? "" : stderr.strip();
        if (out.isEmpty()) return err;
        if (err.isEmpty()) return out;
        return out + "\n" + err;
    }
}
