package com.congruence.mining;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * One call of the mining tool.
 *
 * @param cwd      working directory, null for the backend default
 * @param lineSink receives stdout lines as they arrive, null to only buffer
 */
public record MinerInvocation(
    String command,
    List<String> options,
    List<String> args,
    Path cwd,
    Duration timeout,
    Consumer<String> lineSink
) {

    public MinerInvocation {
        options = List.copyOf(options);
        args = List.copyOf(args);
    }

    /**
     * {@code <command> <options...> <args...>}, the part every backend appends to its prefix.
     */
    public List<String> toolArguments() {
        var arguments = new ArrayList<String>(1 + options.size() + args.size());
        arguments.add(command);
        arguments.addAll(options);
        arguments.addAll(args);
        return arguments;
    }
}
