package com.congruence.core.git;

import com.congruence.core.process.ProcessResult;
import com.congruence.core.process.ProcessRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper that shells out to the {@code git} binary. Interactive prompts are
 * disabled so a missing credential fails fast instead of hanging until the timeout.
 */
@Component
public class GitCli {

    static final Map<String, String> NON_INTERACTIVE = Map.of(
            "GIT_TERMINAL_PROMPT", "0",
            "GIT_SSH_COMMAND", "ssh -o BatchMode=yes -o StrictHostKeyChecking=accept-new");

    private final ProcessRunner processRunner;

    public GitCli(ProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    public ProcessResult run(Path workDir, Duration timeout, String... args) {
        return run(workDir, timeout, Map.of(), args);
    }

    /**
     * Runs {@code git <args>} in {@code workDir} (may be null) with extra environment.
     */
    public ProcessResult run(Path workDir, Duration timeout, Map<String, String> environment, String... args) {
        var env = new HashMap<>(NON_INTERACTIVE);
        env.putAll(environment);
        return processRunner.run(buildCommand(args), workDir, timeout, env, null);
    }

    static List<String> buildCommand(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }
}
