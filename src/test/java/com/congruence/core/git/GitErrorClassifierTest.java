package com.congruence.core.git;

import com.congruence.core.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GitErrorClassifierTest {

    private final GitErrorClassifier classifier = new GitErrorClassifier();

    @Test
    @DisplayName("publickey rejection is SSH permission denied")
    void sshPublicKey() {
        assertEquals(GitErrorType.SSH_PERMISSION_DENIED,
                classifier.classify("git@github.com: Permission denied (publickey).", "git@github.com:a/b.git"));
    }

    @Test
    @DisplayName("403 over https is HTTPS permission denied")
    void https403() {
        assertEquals(GitErrorType.HTTPS_PERMISSION_DENIED,
                classifier.classify("fatal: unable to access 'https://github.com/a/b.git/': The requested URL returned error: 403",
                        "https://github.com/a/b.git"));
    }

    @Test
    @DisplayName("Generic permission denied on an ssh URL is SSH permission denied")
    void permissionDeniedSsh() {
        assertEquals(GitErrorType.SSH_PERMISSION_DENIED,
                classifier.classify("ERROR: Permission denied to user", "ssh://git@host/a/b.git"));
    }

    @Test
    @DisplayName("Repository not found wins over the auth rules")
    void notFound() {
        assertEquals(GitErrorType.REPOSITORY_NOT_FOUND,
                classifier.classify("remote: Repository not found.\nfatal: Authentication failed", "https://github.com/a/b"));
    }

    @Test
    @DisplayName("Authentication failed is classified")
    void authFailed() {
        assertEquals(GitErrorType.AUTHENTICATION_FAILED,
                classifier.classify("fatal: Authentication failed for 'https://gitlab.com/a/b.git/'", "https://gitlab.com/a/b.git"));
    }

    @Test
    @DisplayName("Missing remote ref is branch not found")
    void branchMissing() {
        assertEquals(GitErrorType.BRANCH_NOT_FOUND,
                classifier.classify("fatal: Remote branch nope not found in upstream origin", "https://github.com/a/b"));
        assertEquals(GitErrorType.BRANCH_NOT_FOUND,
                classifier.classify("error: pathspec 'nope' did not match any file(s) known to git", null));
    }

    @Test
    @DisplayName("DNS failure is a network error")
    void network() {
        assertEquals(GitErrorType.NETWORK_ERROR,
                classifier.classify("fatal: Could not resolve host: github.invalid", "https://github.invalid/a/b"));
    }

    @Test
    @DisplayName("Empty or unmatched stderr is UNKNOWN")
    void unknown() {
        assertEquals(GitErrorType.UNKNOWN, classifier.classify("", "https://github.com/a/b"));
        assertEquals(GitErrorType.UNKNOWN, classifier.classify(null, "https://github.com/a/b"));
        assertEquals(GitErrorType.UNKNOWN, classifier.classify("something odd", "https://github.com/a/b"));
    }

    @Test
    @DisplayName("classifyError masks embedded tokens and carries a provider-specific solution")
    void classifyErrorMasksAndSolves() {
        GitAccessException e = classifier.classifyError(
                "fatal: unable to access 'https://ghp_secret@github.com/a/b.git/': The requested URL returned error: 403",
                "https://github.com/a/b.git");

        assertEquals(GitErrorType.HTTPS_PERMISSION_DENIED, e.errorType());
        assertEquals(ErrorCode.TRANSPORT, e.code());
        assertFalse(e.getMessage().contains("ghp_secret"));
        assertFalse(e.stderr().contains("ghp_secret"));
        assertTrue(e.solution().contains("https://github.com/settings/tokens"));
        assertEquals("HTTPS_PERMISSION_DENIED", e.toErrorBody().get("error_type"));
    }
}
