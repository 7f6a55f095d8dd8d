package com.congruence.core.git;

import com.congruence.core.model.GitProvider;
import com.congruence.core.process.ProcessTimeoutException;
import com.congruence.core.process.SensitiveData;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps raw git stderr to a {@link GitErrorType}. Rules are checked in order;
 * the first match wins.
 */
@Component
public class GitErrorClassifier {

    private static final List<String> SSH_DENIED = List.of(
            "permission denied (publickey", "host key verification failed", "no matching host key");

    private static final List<String> NOT_FOUND = List.of(
            "repository not found", "does not appear to be a git repository", "project you were looking for could not be found",
            "returned error: 404");

    private static final List<String> AUTH_FAILED = List.of(
            "authentication failed", "invalid username or password", "could not read username",
            "could not read password", "returned error: 401", "http basic: access denied", "invalid credentials");

    private static final List<String> DENIED = List.of(
            "returned error: 403", "permission denied", "access denied", "forbidden", "not authorized");

    private static final List<String> BRANCH_MISSING = List.of(
            "couldn't find remote ref", "did not match any file(s) known to git", "invalid reference",
            "unknown revision", "not a valid object name");

    private static final List<String> NETWORK = List.of(
            "could not resolve host", "connection refused", "connection timed out", "network is unreachable",
            "failed to connect", "connection reset", "no route to host", "temporary failure in name resolution",
            "unable to access", "ssl certificate problem", "gnutls", "early eof");

    public GitAccessException classifyError(String stderr, String url) {
        return classifyError(stderr, url, null);
    }

    public GitAccessException classifyError(String stderr, String url, String stdout) {
        GitErrorType type = classify(stderr, url);
        GitProvider provider = GitProvider.fromUrl(url);
        String message = "%s: %s".formatted(type, firstLine(stderr));
        return new GitAccessException(type, message, type.solution(provider),
                SensitiveData.mask(stdout), SensitiveData.mask(stderr));
    }

    public GitAccessException timeout(String url, ProcessTimeoutException e) {
        GitProvider provider = GitProvider.fromUrl(url);
        return new GitAccessException(GitErrorType.TIMEOUT, e.getMessage(),
                GitErrorType.TIMEOUT.solution(provider), e.stdout(), SensitiveData.mask(e.stderr()));
    }

    GitErrorType classify(String stderr, String url) {
        if (stderr == null || stderr.isBlank()) {
            return GitErrorType.UNKNOWN;
        }
        String text = stderr.toLowerCase(Locale.ROOT);
        if (containsAny(text, SSH_DENIED)) {
            return GitErrorType.SSH_PERMISSION_DENIED;
        }
        if (containsAny(text, NOT_FOUND) || (text.contains("repository '") && text.contains("' not found"))) {
            return GitErrorType.REPOSITORY_NOT_FOUND;
        }
        if (containsAny(text, AUTH_FAILED)) {
            return GitErrorType.AUTHENTICATION_FAILED;
        }
        if (containsAny(text, DENIED)) {
            return isSshUrl(url) ? GitErrorType.SSH_PERMISSION_DENIED : GitErrorType.HTTPS_PERMISSION_DENIED;
        }
        if (containsAny(text, BRANCH_MISSING) || (text.contains("remote branch") && text.contains("not found"))) {
            return GitErrorType.BRANCH_NOT_FOUND;
        }
        if (containsAny(text, NETWORK)) {
            return GitErrorType.NETWORK_ERROR;
        }
        return GitErrorType.UNKNOWN;
    }

    static boolean isSshUrl(String url) {
        return url != null && (url.startsWith("git@") || url.startsWith("ssh://"));
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String firstLine(String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "no error output";
        }
        for (String line : stderr.split("\n")) {
            if (!line.isBlank()) {
                return SensitiveData.mask(line.trim());
            }
        }
        return "no error output";
    }
}
