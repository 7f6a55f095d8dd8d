package com.congruence.core.git;

import com.congruence.core.model.GitProvider;

/**
 * Classified git transport failure, each with a remediation hint.
 */
public enum GitErrorType {
    SSH_PERMISSION_DENIED,
    HTTPS_PERMISSION_DENIED,
    REPOSITORY_NOT_FOUND,
    NETWORK_ERROR,
    AUTHENTICATION_FAILED,
    BRANCH_NOT_FOUND,
    TIMEOUT,
    UNKNOWN;

    /**
     * Remediation text tailored to the provider hosting the repository.
     */
    public String solution(GitProvider provider) {
        String name = provider.displayName();
        String tokenHint = provider.tokenHelpUrl().isEmpty()
                ? "Create a new access token on " + name
                : "Create a new access token at " + provider.tokenHelpUrl();
        return switch (this) {
            case SSH_PERMISSION_DENIED -> provider.sshKeysUrl().isEmpty()
                    ? "The SSH key was rejected by %s. Register your public key there or use an HTTPS URL with an access token.".formatted(name)
                    : "The SSH key was rejected by %s. Add your public key at %s or use an HTTPS URL with an access token.".formatted(name, provider.sshKeysUrl());
            case HTTPS_PERMISSION_DENIED ->
                    "%s denied access over HTTPS. Make sure the token grants read access to this repository. %s.".formatted(name, tokenHint);
            case REPOSITORY_NOT_FOUND ->
                    "Check the repository URL. Private %s repositories also report 'not found' when no valid credential is configured.".formatted(name);
            case NETWORK_ERROR ->
                    "Could not reach %s. Check network connectivity, DNS and proxy settings.".formatted(name);
            case AUTHENTICATION_FAILED ->
                    "The stored credential was rejected by %s. %s and update the credential.".formatted(name, tokenHint);
            case BRANCH_NOT_FOUND ->
                    "The branch does not exist. List the repository branches and pick an existing one.";
            case TIMEOUT ->
                    "The git operation did not finish in time. Retry later or check repository size and network speed.";
            case UNKNOWN ->
                    "Unexpected git failure. Inspect the raw git output for details.";
        };
    }
}
