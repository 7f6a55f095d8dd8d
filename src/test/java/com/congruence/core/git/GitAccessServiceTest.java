package com.congruence.core.git;

import com.congruence.core.error.ValidationException;
import com.congruence.core.model.AccessValidation;
import com.congruence.core.model.BranchInfo;
import com.congruence.core.model.Credential;
import com.congruence.core.model.CredentialType;
import com.congruence.core.model.GitProvider;
import com.congruence.core.persistence.CredentialRepository;
import com.congruence.core.process.ProcessResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GitAccessServiceTest {

    /** Records every git invocation and answers from a script keyed on the joined arguments. */
    private static final class ScriptedGit extends GitCli {
        final List<String> calls = new ArrayList<>();
        Function<String, ProcessResult> script = args -> ProcessResult.of(0, "", "");

        ScriptedGit() {
            super(null);
        }

        @Override
        public ProcessResult run(Path workDir, Duration timeout, Map<String, String> environment, String... args) {
            String joined = String.join(" ", args);
            calls.add(joined);
            return script.apply(joined);
        }
    }

    @TempDir
    Path tempDir;

    private ScriptedGit git;
    private AuthenticatedUrlBuilder urlBuilder;
    private CredentialRepository credentials;
    private GitAccessService service;

    @BeforeEach
    void setUp() {
        git = new ScriptedGit();
        urlBuilder = mock(AuthenticatedUrlBuilder.class);
        credentials = mock(CredentialRepository.class);
        service = new GitAccessService(git, new GitErrorClassifier(), urlBuilder, credentials,
                new GitProperties(), Clock.systemUTC(), null);
    }

    private Path repo() throws Exception {
        Path repo = tempDir.resolve("repo");
        Files.createDirectories(repo.resolve(".git"));
        return repo;
    }

    // ── validateAccess ─────────────────────────────────────────────────

    @Test
    @DisplayName("validateAccess lists remote heads and picks main as default")
    void validateAccessParsesHeads() {
        git.script = args -> ProcessResult.of(0,
                "aaa\trefs/heads/develop\nbbb\trefs/heads/main\nccc\trefs/tags/v1\n", "");

        AccessValidation result = service.validateAccess("https://github.com/a/b.git", null);

        assertTrue(result.accessible());
        assertEquals(List.of("develop", "main"), result.branches());
        assertEquals("main", result.defaultBranch());
        assertFalse(result.usedAuth());
        assertEquals(List.of("ls-remote --heads https://github.com/a/b.git"), git.calls);
    }

    @Test
    @DisplayName("validateAccess throws a classified error and records the credential failure")
    void validateAccessFailure() {
        var credential = new Credential(7, "alice", GitProvider.GITHUB, CredentialType.HTTPS_TOKEN,
                "x", null, true, null, null, 0, null);
        when(urlBuilder.buildAuthenticatedUrl(anyString(), eq(credential))).thenReturn("https://tok@github.com/a/b.git");
        git.script = args -> ProcessResult.of(128, "", "remote: Repository not found.");

        var e = assertThrows(GitAccessException.class,
                () -> service.validateAccess("https://github.com/a/b.git", credential));

        assertEquals(GitErrorType.REPOSITORY_NOT_FOUND, e.errorType());
        verify(credentials).markUsed(eq(7L), any(), eq("REPOSITORY_NOT_FOUND"));
    }

    @Test
    @DisplayName("Malformed URLs are rejected before any git process starts")
    void rejectsBadUrl() {
        assertThrows(ValidationException.class, () -> service.validateAccess("ftp://host/repo", null));
        assertThrows(ValidationException.class, () -> service.validateAccess("https://host/a b", null));
        assertThrows(ValidationException.class, () -> service.validateAccess(" ", null));
        assertTrue(git.calls.isEmpty());
    }

    @Test
    @DisplayName("Default branch prefers main, then master, then the first branch")
    void defaultBranchOrder() {
        assertEquals("main", GitAccessService.defaultBranch(List.of("master", "main")));
        assertEquals("master", GitAccessService.defaultBranch(List.of("dev", "master")));
        assertEquals("dev", GitAccessService.defaultBranch(List.of("dev", "feature")));
        assertNull(GitAccessService.defaultBranch(List.of()));
    }

    // ── clone ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("Authenticated clone resets origin to the plain URL")
    void cloneResetsRemote() {
        var credential = new Credential(7, "alice", GitProvider.GITHUB, CredentialType.HTTPS_TOKEN,
                "x", null, true, null, null, 0, null);
        when(urlBuilder.buildAuthenticatedUrl(anyString(), eq(credential))).thenReturn("https://tok@github.com/a/b.git");
        Path target = tempDir.resolve("clones/project_1");

        service.cloneRepository("https://github.com/a/b.git", target, "main", credential);

        assertEquals("clone --branch main https://tok@github.com/a/b.git " + target, git.calls.get(0));
        assertEquals("remote set-url origin https://github.com/a/b.git", git.calls.get(1));
        verify(credentials).markUsed(eq(7L), any(), isNull());
    }

    @Test
    @DisplayName("Failed clone removes the partial directory")
    void failedCloneCleansUp() throws Exception {
        Path target = tempDir.resolve("clones/project_2");
        git.script = args -> {
            try {
                Files.createDirectories(target.resolve(".git"));
            } catch (Exception ignored) {
                // test setup only
            }
            return ProcessResult.of(128, "", "fatal: Could not resolve host: github.com");
        };

        var e = assertThrows(GitAccessException.class,
                () -> service.cloneRepository("https://github.com/a/b.git", target, null, null));

        assertEquals(GitErrorType.NETWORK_ERROR, e.errorType());
        assertFalse(Files.exists(target));
    }

    @Test
    @DisplayName("Clone into a non-empty directory is rejected")
    void cloneIntoNonEmpty() throws Exception {
        Path target = tempDir.resolve("busy");
        Files.createDirectories(target);
        Files.writeString(target.resolve("file.txt"), "x");

        assertThrows(ValidationException.class,
                () -> service.cloneRepository("https://github.com/a/b.git", target, null, null));
        assertTrue(git.calls.isEmpty());
    }

    // ── branches ───────────────────────────────────────────────────────

    private void scriptBranches(String mainHash, String featureHash) {
        git.script = args -> {
            if (args.startsWith("branch -a")) {
                return ProcessResult.of(0, """
                        * main
                          remotes/origin/HEAD -> origin/main
                          remotes/origin/main
                          remotes/origin/feature/x
                        """, "");
            }
            if (args.startsWith("rev-parse")) {
                return ProcessResult.of(0, mainHash + "\n" + featureHash + "\n", "");
            }
            return ProcessResult.of(0, "", "");
        };
    }

    @Test
    @DisplayName("listBranches deduplicates local and remote refs and marks the current branch")
    void listBranches() throws Exception {
        Path repo = repo();
        scriptBranches("1111", "2222");

        List<BranchInfo> branches = service.listBranches(repo);

        assertEquals(List.of("feature/x", "main"), branches.stream().map(BranchInfo::name).toList());
        BranchInfo main = branches.get(1);
        assertTrue(main.isCurrent());
        assertEquals("1111", main.commitHash());
        assertEquals(16, main.branchId().length());
        assertTrue(git.calls.contains("rev-parse refs/heads/main refs/remotes/origin/feature/x"));
    }

    @Test
    @DisplayName("Branch ids are stable and change only for the branch that moved")
    void branchIdsStable() throws Exception {
        Path repo = repo();
        scriptBranches("1111", "2222");
        List<BranchInfo> first = service.listBranches(repo);
        List<BranchInfo> again = service.listBranches(repo);
        scriptBranches("1111", "3333");
        List<BranchInfo> moved = service.listBranches(repo);

        assertEquals(first, again);
        assertEquals(first.get(1).branchId(), moved.get(1).branchId());
        assertNotEquals(first.get(0).branchId(), moved.get(0).branchId());
    }

    @Test
    @DisplayName("listBranches on a non-repository is a validation error")
    void listBranchesRequiresRepo() {
        assertThrows(ValidationException.class, () -> service.listBranches(tempDir));
    }

    @Test
    @DisplayName("A failed fetch does not prevent the checkout")
    void checkoutAfterFailedFetch() throws Exception {
        Path repo = repo();
        git.script = args -> args.equals("fetch --all")
                ? ProcessResult.of(1, "", "fatal: unable to access 'https://github.com/a/b/': Could not resolve host")
                : ProcessResult.of(0, "https://github.com/a/b\n", "");

        service.checkoutBranch(repo, "develop");

        assertTrue(git.calls.contains("checkout develop"));
    }

    @Test
    @DisplayName("Branch names that look like options are rejected")
    void rejectsOptionLikeBranch() throws Exception {
        Path repo = repo();
        assertThrows(ValidationException.class, () -> service.checkoutBranch(repo, "--orphan"));
        assertThrows(ValidationException.class, () -> service.checkoutBranch(repo, "a..b"));
        assertTrue(git.calls.isEmpty());
    }
}
