package com.congruence.core.error;

/**
 * Typed failure category returned with every error.
 */
public enum ErrorCode {
    TRANSPORT,
    VALIDATION,
    TOOL_EXECUTION,
    INGESTION,
    PERSISTENCE,
    WORKSPACE
}
