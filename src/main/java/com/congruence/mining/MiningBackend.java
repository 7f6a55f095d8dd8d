package com.congruence.mining;

import com.congruence.core.process.ProcessResult;

/**
 * Where and how the mining tool runs.
 * Implementations: {@link ProcessMiningBackend} (local process),
 * {@link DockerExecMiningBackend} (pre-existing container).
 */
public interface MiningBackend {

    /**
     * Short label for logs and health output.
     */
    String name();

    /**
     * Runs the invocation to completion within its timeout.
     *
     * @return exit code and captured output; non-zero exits are returned, not thrown
     * @throws MiningTimeoutException when the bound is exceeded
     */
    ProcessResult execute(MinerInvocation invocation);

    /**
     * Checks that the backend can start the tool at all.
     *
     * @throws com.congruence.core.error.ValidationException when it cannot
     */
    default void verifyReady() {
    }
}
