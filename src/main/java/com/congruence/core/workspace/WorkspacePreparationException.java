package com.congruence.core.workspace;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.error.ErrorCode;

/**
 * Preparing the sanitized workspace failed; mining cannot proceed. Cleanup
 * problems are attached as suppressed exceptions.
 */
public class WorkspacePreparationException extends CongruenceException {

    public WorkspacePreparationException(String message) {
        super(ErrorCode.WORKSPACE, message);
    }

    public WorkspacePreparationException(String message, Throwable cause) {
        super(ErrorCode.WORKSPACE, message, cause);
    }
}
