package com.congruence.core.git;

import com.congruence.core.error.ValidationException;
import com.congruence.core.metrics.CongruenceMetrics;
import com.congruence.core.model.AccessValidation;
import com.congruence.core.model.BranchInfo;
import com.congruence.core.model.Credential;
import com.congruence.core.persistence.CredentialRepository;
import com.congruence.core.process.ProcessResult;
import com.congruence.core.process.ProcessTimeoutException;
import com.congruence.core.workspace.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Remote listing, clone and branch operations against git repositories.
 *
 * <p>Every call has an explicit bound: 10s for local reads, 30s for remote and
 * branch operations, 300s for a full clone. Failures are classified through
 * {@link GitErrorClassifier} and never retried here.
 */
@Service
public class GitAccessService {

    private static final Logger log = LoggerFactory.getLogger(GitAccessService.class);

    private static final List<String> URL_PREFIXES = List.of("https://", "http://", "ssh://", "git@");

    private final GitCli git;
    private final GitErrorClassifier classifier;
    private final AuthenticatedUrlBuilder urlBuilder;
    private final CredentialRepository credentialRepository;
    private final GitProperties properties;
    private final Clock clock;
    private final CongruenceMetrics metrics;

    public GitAccessService(GitCli git,
                            GitErrorClassifier classifier,
                            AuthenticatedUrlBuilder urlBuilder,
                            CredentialRepository credentialRepository,
                            GitProperties properties,
                            Clock clock,
                            @Autowired(required = false) CongruenceMetrics metrics) {
        this.git = git;
        this.classifier = classifier;
        this.urlBuilder = urlBuilder;
        this.credentialRepository = credentialRepository;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════════
    // Remote operations
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Lists remote heads without cloning.
     *
     * @throws GitAccessException when the remote cannot be listed
     */
    public AccessValidation validateAccess(String url, Credential credential) {
        validateUrl(url);
        String authUrl = credential == null ? url : urlBuilder.buildAuthenticatedUrl(url, credential);
        boolean usedAuth = !authUrl.equals(url);

        ProcessResult result;
        try {
            result = git.run(null, properties.remoteTimeout(), "ls-remote", "--heads", authUrl);
        } catch (ProcessTimeoutException e) {
            recordUse(credential, usedAuth, GitErrorType.TIMEOUT.name());
            throw fail(classifier.timeout(url, e));
        }
        if (!result.isSuccess()) {
            GitAccessException error = classifier.classifyError(result.stderr(), url, result.stdout());
            recordUse(credential, usedAuth, error.errorType().name());
            throw fail(error);
        }
        recordUse(credential, usedAuth, null);

        List<String> branches = parseRemoteHeads(result.stdout());
        log.info("Repository {} accessible, {} branches (auth: {})", url, branches.size(), usedAuth);
        return new AccessValidation(true, branches, defaultBranch(branches), usedAuth);
    }

    /**
     * Clones {@code url} into {@code dir}. The stored remote URL is reset to the
     * plain form afterwards so no secret remains in {@code .git/config}.
     */
    public void cloneRepository(String url, Path dir, String branch, Credential credential) {
        validateUrl(url);
        if (branch != null) {
            validateRefName(branch);
        }
        if (Files.exists(dir) && !isEmptyDirectory(dir)) {
            throw new ValidationException("Clone target is not empty: " + dir);
        }
        String authUrl = credential == null ? url : urlBuilder.buildAuthenticatedUrl(url, credential);
        boolean usedAuth = !authUrl.equals(url);

        List<String> args = new ArrayList<>(List.of("clone"));
        if (branch != null && !branch.isBlank()) {
            args.add("--branch");
            args.add(branch);
        }
        args.add(authUrl);
        args.add(dir.toString());

        try {
            Files.createDirectories(dir.getParent());
        } catch (IOException e) {
            throw new ValidationException("Cannot create clone parent for %s: %s".formatted(dir, e.getMessage()));
        }

        log.info("Cloning {} into {}", url, dir);
        ProcessResult result;
        try {
            result = git.run(null, properties.cloneTimeout(), args.toArray(String[]::new));
        } catch (ProcessTimeoutException e) {
            FileTrees.deleteRecursively(dir);
            recordUse(credential, usedAuth, GitErrorType.TIMEOUT.name());
            throw fail(classifier.timeout(url, e));
        }
        if (!result.isSuccess()) {
            FileTrees.deleteRecursively(dir);
            GitAccessException error = classifier.classifyError(result.stderr(), url, result.stdout());
            recordUse(credential, usedAuth, error.errorType().name());
            throw fail(error);
        }
        recordUse(credential, usedAuth, null);

        if (usedAuth) {
            ProcessResult reset = git.run(dir, properties.localTimeout(), "remote", "set-url", "origin", url);
            if (!reset.isSuccess()) {
                log.warn("Could not reset remote URL of {}: {}", dir, reset.stderr());
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Local branch operations
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Local and remote-tracking branches, deduplicated by name and sorted.
     */
    public List<BranchInfo> listBranches(Path repoPath) {
        requireRepository(repoPath);
        ProcessResult result = runLocal(repoPath, properties.localTimeout(), "branch", "-a", "--no-color");

        Map<String, String> refsByName = new LinkedHashMap<>();
        String current = null;
        for (String line : result.stdout().split("\n")) {
            if (line.isBlank() || line.length() < 2) {
                continue;
            }
            boolean isCurrent = line.charAt(0) == '*';
            String entry = line.substring(2).trim();
            if (entry.startsWith("(") || entry.contains("->")) {
                continue;
            }
            String name;
            String ref;
            if (entry.startsWith("remotes/")) {
                String remotePath = entry.substring("remotes/".length());
                int slash = remotePath.indexOf('/');
                if (slash < 0) {
                    continue;
                }
                name = remotePath.substring(slash + 1);
                ref = "refs/" + entry;
            } else {
                name = entry;
                ref = "refs/heads/" + entry;
            }
            if ("HEAD".equals(name)) {
                continue;
            }
            refsByName.putIfAbsent(name, ref);
            if (isCurrent) {
                current = name;
            }
        }

        List<String> names = new ArrayList<>(refsByName.keySet());
        List<String> hashes = resolveCommitHashes(repoPath, new ArrayList<>(refsByName.values()));
        List<BranchInfo> branches = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            String hash = hashes.get(i);
            branches.add(new BranchInfo(name, name.equals(current), hash, branchId(name, hash)));
        }
        branches.sort(Comparator.comparing(BranchInfo::name));
        return branches;
    }

    /**
     * Name of the checked-out branch, or null when HEAD is detached.
     */
    public String currentBranch(Path repoPath) {
        requireRepository(repoPath);
        String name = runLocal(repoPath, properties.localTimeout(), "branch", "--show-current").stdout().trim();
        return name.isEmpty() ? null : name;
    }

    /**
     * Fetches all remotes and checks out {@code name}. A failed fetch is
     * classified and logged; the checkout still decides the outcome.
     */
    public void checkoutBranch(Path repoPath, String name) {
        requireRepository(repoPath);
        validateRefName(name);
        String remote = remoteUrl(repoPath);

        try {
            ProcessResult fetch = git.run(repoPath, properties.remoteTimeout(), "fetch", "--all");
            if (!fetch.isSuccess()) {
                GitAccessException error = classifier.classifyError(fetch.stderr(), remote, fetch.stdout());
                recordFailure(error);
                log.warn("Fetch before checkout of '{}' failed ({}), using local refs", name, error.errorType());
            }
        } catch (ProcessTimeoutException e) {
            throw fail(classifier.timeout(remote, e));
        }

        runLocal(repoPath, properties.remoteTimeout(), "checkout", name);
        log.info("Checked out '{}' in {}", name, repoPath);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Accepts https, http, ssh and scp-style URLs. Rejected before any process starts.
     */
    public static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Repository URL is required");
        }
        if (url.chars().anyMatch(Character::isWhitespace)) {
            throw new ValidationException("Repository URL must not contain whitespace");
        }
        if (URL_PREFIXES.stream().noneMatch(url::startsWith)) {
            throw new ValidationException("Unsupported repository URL '%s', expected one of %s".formatted(url, URL_PREFIXES));
        }
    }

    public static void validateRefName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Branch name is required");
        }
        if (name.startsWith("-") || name.contains("..") || name.chars().anyMatch(Character::isWhitespace)) {
            throw new ValidationException("Invalid branch name: " + name);
        }
    }

    static List<String> parseRemoteHeads(String lsRemoteOutput) {
        List<String> branches = new ArrayList<>();
        for (String line : lsRemoteOutput.split("\n")) {
            int tab = line.indexOf('\t');
            if (tab < 0) {
                continue;
            }
            String ref = line.substring(tab + 1).trim();
            if (ref.startsWith("refs/heads/")) {
                branches.add(ref.substring("refs/heads/".length()));
            }
        }
        return branches;
    }

    static String defaultBranch(List<String> branches) {
        if (branches.contains("main")) return "main";
        if (branches.contains("master")) return "master";
        return branches.isEmpty() ? null : branches.get(0);
    }

    /**
     * Stable id: identical names at different commits get different ids.
     */
    static String branchId(String name, String commitHash) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest((name + ":" + (commitHash == null ? "" : commitHash)).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * One batched rev-parse for all refs; falls back to one call per ref when the
     * batch fails (a single unresolvable ref fails the whole batch).
     */
    private List<String> resolveCommitHashes(Path repoPath, List<String> refs) {
        if (refs.isEmpty()) {
            return List.of();
        }
        List<String> args = new ArrayList<>(List.of("rev-parse"));
        args.addAll(refs);
        ProcessResult batch = git.run(repoPath, properties.localTimeout(), args.toArray(String[]::new));
        if (batch.isSuccess()) {
            List<String> lines = batch.stdout().lines().map(String::trim).filter(l -> !l.isEmpty()).toList();
            if (lines.size() == refs.size()) {
                return lines;
            }
        }
        log.debug("Batched rev-parse failed for {}, resolving refs one by one", repoPath);
        List<String> hashes = new ArrayList<>(refs.size());
        for (String ref : refs) {
            ProcessResult single = git.run(repoPath, properties.localTimeout(), "rev-parse", "--verify", "--quiet", ref);
            hashes.add(single.isSuccess() ? single.stdout().trim() : null);
        }
        return hashes;
    }

    private ProcessResult runLocal(Path repoPath, Duration timeout, String... args) {
        String remote = null;
        try {
            ProcessResult result = git.run(repoPath, timeout, args);
            if (!result.isSuccess()) {
                remote = remoteUrl(repoPath);
                throw fail(classifier.classifyError(result.stderr(), remote, result.stdout()));
            }
            return result;
        } catch (ProcessTimeoutException e) {
            throw fail(classifier.timeout(remote, e));
        }
    }

    private String remoteUrl(Path repoPath) {
        try {
            ProcessResult result = git.run(repoPath, properties.localTimeout(), "remote", "get-url", "origin");
            return result.isSuccess() ? result.stdout().trim() : null;
        } catch (ProcessTimeoutException e) {
            return null;
        }
    }

    private static void requireRepository(Path repoPath) {
        if (repoPath == null || !Files.exists(repoPath.resolve(".git"))) {
            throw new ValidationException("Not a git repository: " + repoPath);
        }
    }

    private void recordUse(Credential credential, boolean usedAuth, String error) {
        if (credential == null || !usedAuth) {
            return;
        }
        credentialRepository.markUsed(credential.id(), clock.instant(), error);
    }

    private GitAccessException fail(GitAccessException error) {
        recordFailure(error);
        log.warn("Git operation failed: {}", error.getMessage());
        return error;
    }

    private void recordFailure(GitAccessException error) {
        if (metrics != null) {
            metrics.recordGitFailure(error.errorType().name());
        }
    }

    private static boolean isEmptyDirectory(Path dir) {
        try (var entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        } catch (IOException e) {
            return false;
        }
    }
}
