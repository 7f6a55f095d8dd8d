package com.congruence.core.process;

import java.time.Duration;

/**
 * Raised after a process exceeded its bound and was killed. Partial output is
 * kept for diagnostics only; a timed-out process never counts as a success.
 */
public class ProcessTimeoutException extends RuntimeException {

    private final Duration timeout;
    private final String stdout;
    private final String stderr;

    public ProcessTimeoutException(String command, Duration timeout, String stdout, String stderr) {
        super("Command timed out after %ds: %s".formatted(timeout.toSeconds(), command));
        this.timeout = timeout;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public Duration timeout() {
        return timeout;
    }

    public String stdout() {
        return stdout;
    }

    public String stderr() {
        return stderr;
    }
}
