package com.congruence.core.process;

/**
 * The process could not be started or waiting for it was interrupted.
 */
public class ProcessLaunchException extends RuntimeException {

    public ProcessLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
