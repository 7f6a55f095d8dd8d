package com.congruence.core.process;

import java.time.Duration;

/**
 * Outcome of an external process that ran to completion.
 */
public record ProcessResult(int exitCode, String stdout, String stderr, Duration duration) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public static ProcessResult of(int exitCode, String stdout, String stderr) {
        return new ProcessResult(exitCode, stdout, stderr, Duration.ZERO);
    }
}
