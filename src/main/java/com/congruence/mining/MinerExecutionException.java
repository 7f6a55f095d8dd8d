package com.congruence.mining;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.error.ErrorCode;

/**
 * The mining tool could not be started or exited non-zero.
 */
public class MinerExecutionException extends CongruenceException {

    private final int exitCode;
    private final String stdout;
    private final String stderr;

    public MinerExecutionException(String message, int exitCode, String stdout, String stderr) {
        super(ErrorCode.TOOL_EXECUTION, message);
        this.exitCode = exitCode;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public MinerExecutionException(String message, Throwable cause) {
        super(ErrorCode.TOOL_EXECUTION, message, cause);
        this.exitCode = -1;
        this.stdout = "";
        this.stderr = "";
    }

    public int exitCode() {
        return exitCode;
    }

    public String stdout() {
        return stdout;
    }

    public String stderr() {
        return stderr;
    }

    /**
     * Remediation hint shown next to the raw output.
     */
    public String solution() {
        return "Inspect the miner output. Check that the repository path and branch exist and that the miner has enough memory.";
    }
}
