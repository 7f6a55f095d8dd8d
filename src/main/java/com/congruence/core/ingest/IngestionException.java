package com.congruence.core.ingest;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.error.ErrorCode;

/**
 * A required artifact is missing or is not a JSON object.
 */
public class IngestionException extends CongruenceException {

    public IngestionException(String message) {
        super(ErrorCode.INGESTION, message);
    }

    public IngestionException(String message, Throwable cause) {
        super(ErrorCode.INGESTION, message, cause);
    }
}
