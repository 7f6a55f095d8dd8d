package com.congruence.mining;

import com.congruence.core.error.ValidationException;
import com.congruence.core.logging.MdcContext;
import com.congruence.core.metrics.CongruenceMetrics;
import com.congruence.core.model.MiningArtifact;
import com.congruence.core.model.MiningDataType;
import com.congruence.core.process.ProcessResult;
import com.congruence.core.workspace.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs the external mining tool through the configured {@link MiningBackend}
 * and lays out its artifacts in a per-project-and-branch output directory.
 */
@Service
public class MiningOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MiningOrchestrator.class);

    /** Scratch directory the dependency miner writes into before its artifacts are renamed. */
    static final String DEPENDENCY_STAGING_DIR = ".file-dependency";

    private final MiningBackend backend;
    private final MinerProperties properties;
    private final CongruenceMetrics metrics;

    public MiningOrchestrator(MiningBackend backend, MinerProperties properties,
                              @Autowired(required = false) CongruenceMetrics metrics) {
        this.backend = backend;
        this.properties = properties;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Single command
    // ═══════════════════════════════════════════════════════════════════

    public ProcessResult runCommand(String name, List<String> options, List<String> args) {
        return runCommand(name, options, args, null, null, null);
    }

    /**
     * Runs one miner synchronously and returns its result whatever the exit code.
     *
     * @param cwd      working directory, null for the backend default
     * @param timeout  bound, null for {@code congruence.miner.timeout-seconds}
     * @param lineSink stdout consumer; when null and streaming is enabled lines go to the log
     * @throws ValidationException    blank name or unusable backend, before any process starts
     * @throws MiningTimeoutException the bound was exceeded and the run stopped
     */
    public ProcessResult runCommand(String name, List<String> options, List<String> args,
                                    Path cwd, Duration timeout, Consumer<String> lineSink) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Miner command name is required");
        }
        backend.verifyReady();

        Duration bound = timeout != null ? timeout : properties.timeout();
        Consumer<String> sink = lineSink;
        if (sink == null && properties.isStreamOutput()) {
            sink = line -> log.info("[{}] {}", name, line);
        }
        var invocation = new MinerInvocation(name, options == null ? List.of() : options,
                args == null ? List.of() : args, cwd, bound, sink);

        MdcContext.setCommand(name);
        try {
            log.info("Running miner {} on backend {} (timeout {}s)", name, backend.name(), bound.toSeconds());
            ProcessResult result = backend.execute(invocation);
            if (metrics != null) {
                metrics.recordMinerDuration(name, result.duration());
            }
            if (!properties.isStreamOutput() && !result.stdout().isEmpty()) {
                log.debug("Miner {} stdout:\n{}", name, result.stdout());
            }
            log.info("Miner {} finished with exit code {} in {}ms", name, result.exitCode(),
                    result.duration().toMillis());
            return result;
        } finally {
            MdcContext.clearCommand();
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Data-type runs
    // ═══════════════════════════════════════════════════════════════════

    public List<MinerCommand> commandsFor(MiningDataType dataType) {
        return switch (dataType) {
            case ASSIGNMENT_MATRIX -> List.of(MinerCommand.ASSIGNMENT_MATRIX);
            case FILE_DEPENDENCY -> List.of(MinerCommand.FILE_DEPENDENCY);
            case FILES_OWNERSHIP -> List.of(MinerCommand.FILES_OWNERSHIP);
            case COORDINATION_MINIMAL -> List.of(MinerCommand.ASSIGNMENT_MATRIX, MinerCommand.FILE_DEPENDENCY);
        };
    }

    /**
     * Runs every miner {@code dataType} needs against {@code gitDir} on {@code branch}.
     *
     * @return results in execution order
     * @throws MinerExecutionException on the first non-zero exit; later miners do not run
     */
    public List<ProcessResult> mine(MiningDataType dataType, Path gitDir, String branch, Path outputDir,
                                    Consumer<String> lineSink) {
        if (dataType == null) {
            throw new ValidationException("dataType is required");
        }
        if (branch == null || branch.isBlank()) {
            throw new ValidationException("branch is required");
        }
        backend.verifyReady();
        createDirectories(outputDir);

        var results = new ArrayList<ProcessResult>();
        for (MinerCommand command : commandsFor(dataType)) {
            Path target = command == MinerCommand.FILE_DEPENDENCY
                    ? outputDir.resolve(DEPENDENCY_STAGING_DIR) : outputDir;
            createDirectories(target);

            ProcessResult result = runCommand(command.commandName(), command.options(gitDir, target),
                    List.of(branch), outputDir, null, lineSink);
            if (!result.isSuccess()) {
                throw new MinerExecutionException("Miner %s exited with code %d".formatted(
                        command.commandName(), result.exitCode()),
                        result.exitCode(), result.stdout(), result.stderr());
            }
            if (command == MinerCommand.FILE_DEPENDENCY) {
                promoteDependencyArtifacts(target, outputDir);
            }
            results.add(result);
        }
        return results;
    }

    public List<ProcessResult> mine(MiningDataType dataType, Path gitDir, String branch, Path outputDir) {
        return mine(dataType, gitDir, branch, outputDir, null);
    }

    /**
     * {@code <output-dir>/project_<id>_<branch>} with {@code /} in the branch replaced by {@code _}.
     */
    public Path outputDirectory(long projectId, String branch) {
        return Path.of(properties.getOutputDir()).resolve("project_%d_%s".formatted(projectId, branch.replace('/', '_')));
    }

    /**
     * The dependency miner numbers files on its own, so its id map must not overwrite the
     * assignment miner's. Its matrix moves up unchanged and its id map is renamed.
     */
    private static void promoteDependencyArtifacts(Path staging, Path outputDir) {
        try {
            Path matrix = MiningArtifact.FILE_DEPENDENCY_MATRIX.in(staging);
            if (Files.exists(matrix)) {
                Files.move(matrix, MiningArtifact.FILE_DEPENDENCY_MATRIX.in(outputDir),
                        StandardCopyOption.REPLACE_EXISTING);
            }
            Path idMap = MiningArtifact.ID_TO_FILE.in(staging);
            if (Files.exists(idMap)) {
                Files.move(idMap, MiningArtifact.FILE_DEPENDENCY_ID_TO_FILE.in(outputDir),
                        StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new MinerExecutionException("Failed to move dependency artifacts from " + staging, e);
        }
        FileTrees.deleteRecursively(staging);
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new MinerExecutionException("Cannot create miner output directory " + dir, e);
        }
    }
}
