package com.congruence.core.error;

/**
 * Malformed input, unknown data type or missing identifier.
 * Always raised before any external process starts.
 */
public class ValidationException extends CongruenceException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
