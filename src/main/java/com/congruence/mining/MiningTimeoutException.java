package com.congruence.mining;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.error.ErrorCode;

import java.time.Duration;

/**
 * The mining tool exceeded its bound and was stopped. There is no partial result.
 */
public class MiningTimeoutException extends CongruenceException {

    private final String stdout;
    private final String stderr;

    public MiningTimeoutException(String command, Duration timeout, String stdout, String stderr) {
        super(ErrorCode.TOOL_EXECUTION, "Miner %s timed out after %ds".formatted(command, timeout.toSeconds()));
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public String stdout() {
        return stdout;
    }

    public String stderr() {
        return stderr;
    }
}
