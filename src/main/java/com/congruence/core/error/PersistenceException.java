package com.congruence.core.error;

public class PersistenceException extends CongruenceException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE, message, cause);
    }
}
