package com.congruence.mining;

import com.congruence.core.error.ValidationException;
import com.congruence.core.process.ProcessLaunchException;
import com.congruence.core.process.ProcessResult;
import com.congruence.core.process.ProcessRunner;
import com.congruence.core.process.ProcessTimeoutException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the mining tool as a local process: {@code <prefix...> <command> <options...> <args...>}.
 * The prefix is {@code <java> -jar <jar>} unless a run script replaces it.
 */
public class ProcessMiningBackend implements MiningBackend {

    private final ProcessRunner processRunner;
    private final List<String> prefix;
    private final Path defaultWorkDir;
    private final Path requiredJar;

    public ProcessMiningBackend(ProcessRunner processRunner, List<String> prefix, Path defaultWorkDir) {
        this(processRunner, prefix, defaultWorkDir, null);
    }

    private ProcessMiningBackend(ProcessRunner processRunner, List<String> prefix, Path defaultWorkDir,
                                 Path requiredJar) {
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("Miner command prefix must not be empty");
        }
        this.processRunner = processRunner;
        this.prefix = List.copyOf(prefix);
        this.defaultWorkDir = defaultWorkDir;
        this.requiredJar = requiredJar;
    }

    /**
     * Backend running {@code java -jar} on the configured jar.
     */
    public static ProcessMiningBackend forJar(ProcessRunner runner, String javaPath, String jarPath, Path workDir) {
        return new ProcessMiningBackend(runner, List.of(javaPath, "-jar", jarPath), workDir, Path.of(jarPath));
    }

    /**
     * Backend running a custom shell-split prefix, such as a wrapper script.
     */
    public static ProcessMiningBackend forRunScript(ProcessRunner runner, String runScript, Path workDir) {
        return new ProcessMiningBackend(runner, CommandLineSplitter.split(runScript), workDir);
    }

    @Override
    public String name() {
        return "process";
    }

    @Override
    public void verifyReady() {
        if (requiredJar != null && !Files.isRegularFile(requiredJar)) {
            throw new ValidationException("Miner jar not found: " + requiredJar);
        }
    }

    public List<String> prefix() {
        return prefix;
    }

    List<String> commandLine(MinerInvocation invocation) {
        var command = new ArrayList<String>(prefix);
        command.addAll(invocation.toolArguments());
        return command;
    }

    @Override
    public ProcessResult execute(MinerInvocation invocation) {
        Path cwd = invocation.cwd() != null ? invocation.cwd() : defaultWorkDir;
        try {
            return processRunner.run(commandLine(invocation), cwd, invocation.timeout(),
                    Map.of(), invocation.lineSink());
        } catch (ProcessTimeoutException e) {
            throw new MiningTimeoutException(invocation.command(), invocation.timeout(), e.stdout(), e.stderr());
        } catch (ProcessLaunchException e) {
            throw new MinerExecutionException("Cannot run miner %s: %s".formatted(invocation.command(), e.getMessage()), e);
        }
    }
}
