package com.congruence.core.git;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.error.ErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classified git transport failure. Carries the raw process output and a remediation hint.
 */
public class GitAccessException extends CongruenceException {

    private final GitErrorType errorType;
    private final String solution;
    private final String stdout;
    private final String stderr;

    public GitAccessException(GitErrorType errorType, String message, String solution,
                              String stdout, String stderr) {
        super(ErrorCode.TRANSPORT, message);
        this.errorType = errorType;
        this.solution = solution;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public GitErrorType errorType() {
        return errorType;
    }

    public String solution() {
        return solution;
    }

    public String stdout() {
        return stdout;
    }

    public String stderr() {
        return stderr;
    }

    /**
     * Structured guidance for clients: {@code {error_type, solution}}.
     */
    public Map<String, String> toErrorBody() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error_type", errorType.name());
        body.put("solution", solution);
        return body;
    }
}
