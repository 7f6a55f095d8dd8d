package com.congruence.core.error;

/**
 * Base of all pipeline failures. Every failure carries an {@link ErrorCode}.
 */
public abstract class CongruenceException extends RuntimeException {

    private final ErrorCode code;

    protected CongruenceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected CongruenceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
