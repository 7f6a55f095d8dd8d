package com.congruence.core.workspace;

import com.congruence.core.error.ValidationException;
import com.congruence.core.git.GitAccessService;
import com.congruence.core.git.GitCli;
import com.congruence.core.metrics.CongruenceMetrics;
import com.congruence.core.process.ProcessResult;
import com.congruence.core.process.ProcessTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds the sanitized workspace that safe-mode mining runs against.
 *
 * <p>The workspace is a local {@code --shared} clone of an existing clone, so no
 * network access happens and objects are reused. After checkout the tree is
 * pruned to allowed source files, symbolic links and submodules are dropped,
 * and the result is committed on {@value #PRUNED_BRANCH}. Optionally the whole
 * history of that branch is rewritten so excluded paths disappear from every
 * commit, keeping the original authors.
 *
 * <p>The caller owns the returned {@link PreparedWorkspace} and must close it.
 */
@Service
public class WorkspacePreparer {

    private static final Logger log = LoggerFactory.getLogger(WorkspacePreparer.class);

    public static final String PRUNED_BRANCH = "safe-mode-pruned";

    private static final String GITLINK_MODE = "160000";

    private final GitCli git;
    private final WorkspaceProperties properties;
    private final CongruenceMetrics metrics;
    private final TreePruner pruner = new TreePruner();

    public WorkspacePreparer(GitCli git,
                             WorkspaceProperties properties,
                             @Autowired(required = false) CongruenceMetrics metrics) {
        this.git = git;
        this.properties = properties;
        this.metrics = metrics;
    }

    public PreparedWorkspace prepare(Path sourceRepo, String branch) {
        return prepare(sourceRepo, branch, properties.toOptions());
    }

    /**
     * Validates the source first; nothing is created when the source is not a
     * repository or the branch is missing. Any later failure removes the
     * temporary directory and is reported as one {@link WorkspacePreparationException}.
     */
    public PreparedWorkspace prepare(Path sourceRepo, String branch, SafeModeOptions options) {
        Path source = sourceRepo.toAbsolutePath().normalize();
        if (!Files.isDirectory(source.resolve(".git"))) {
            throw new WorkspacePreparationException("Not a git repository: " + source);
        }
        try {
            GitAccessService.validateRefName(branch);
        } catch (ValidationException e) {
            throw new WorkspacePreparationException(e.getMessage(), e);
        }
        String commit = resolveBranchCommit(source, branch);

        Path root;
        try {
            root = createTempDirectory();
        } catch (IOException e) {
            throw new WorkspacePreparationException("Cannot create temporary workspace: " + e.getMessage(), e);
        }

        try {
            gitOrFail(null, "clone", "--shared", "--no-checkout", "--quiet", source.toString(), root.toString());
            gitOrFail(root, "checkout", "-q", "-B", branch, commit);

            PruneStats stats = pruner.prune(root, options);
            stats = stats.withSubmodules(removeSubmodules(root));
            gitOrFail(root, "add", "-A");
            stats = stats.withEmptyDirectories(pruner.removeEmptyDirectories(root));

            gitOrFail(root, "checkout", "-q", "-b", PRUNED_BRANCH);
            commitIfChanged(root);
            if (options.rewriteHistory()) {
                rewriteHistory(root, options);
            }

            if (metrics != null) {
                metrics.recordPrunedFiles(stats.filesRemoved());
            }
            log.info("Prepared workspace {} from {}@{}: {}", root, source, branch, stats);
            return new PreparedWorkspace(root, PRUNED_BRANCH, stats);
        } catch (IOException | RuntimeException e) {
            var failure = new WorkspacePreparationException(
                    "Failed to prepare safe workspace for %s@%s: %s".formatted(source, branch, e.getMessage()), e);
            try {
                FileTrees.deleteTree(root);
            } catch (IOException | RuntimeException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    private String resolveBranchCommit(Path source, String branch) {
        for (String ref : List.of("refs/heads/" + branch, "refs/remotes/origin/" + branch)) {
            ProcessResult result;
            try {
                result = git.run(source, timeout(), "rev-parse", "--verify", "--quiet", ref + "^{commit}");
            } catch (ProcessTimeoutException e) {
                throw new WorkspacePreparationException("Resolving branch '%s' in %s timed out after %ss"
                        .formatted(branch, source, e.timeout().toSeconds()), e);
            }
            if (result.isSuccess() && !result.stdout().isBlank()) {
                return result.stdout().trim();
            }
        }
        throw new WorkspacePreparationException("Branch '%s' not found in %s".formatted(branch, source));
    }

    /**
     * Drops gitlink (mode 160000) index entries.
     *
     * @return number of submodules removed
     */
    private int removeSubmodules(Path root) throws IOException {
        ProcessResult staged = gitOrFail(root, "ls-files", "-s");
        List<String> gitlinks = new ArrayList<>();
        for (String line : staged.stdout().split("\n")) {
            int tab = line.indexOf('\t');
            if (tab > 0 && line.startsWith(GITLINK_MODE + " ")) {
                gitlinks.add(line.substring(tab + 1));
            }
        }
        for (String path : gitlinks) {
            gitOrFail(root, "rm", "--cached", "-q", "--", path);
            FileTrees.deleteTree(root.resolve(path));
        }
        return gitlinks.size();
    }

    private void commitIfChanged(Path root) {
        ProcessResult diff = git.run(root, timeout(), "diff", "--cached", "--quiet");
        if (diff.isSuccess()) {
            return;
        }
        gitOrFail(root, "-c", "user.name=" + properties.getCommitName(),
                "-c", "user.email=" + properties.getCommitEmail(),
                "-c", "commit.gpgsign=false",
                "commit", "-q", "--no-verify", "-m", "Prune workspace for safe-mode mining");
    }

    /**
     * Rewrites every commit of the pruned branch without the excluded paths.
     * Original authorship is kept by filter-branch.
     */
    private void rewriteHistory(Path root, SafeModeOptions options) throws IOException {
        Duration rewriteTimeout = Duration.ofSeconds(properties.getRewriteTimeoutSeconds());
        ProcessResult history = git.run(root, rewriteTimeout, "log", "--name-only", "--format=", PRUNED_BRANCH);
        if (!history.isSuccess()) {
            throw new WorkspacePreparationException("Cannot list history paths: " + history.stderr());
        }
        var purge = new TreeSet<String>();
        for (String path : history.stdout().split("\n")) {
            String trimmed = path.trim();
            if (!trimmed.isEmpty() && !options.allowsPath(trimmed)) {
                purge.add(trimmed);
            }
        }
        if (purge.isEmpty()) {
            log.debug("History of {} has nothing to purge", root);
            return;
        }

        Path pathspecs = Files.createTempFile("congruence-purge-", ".txt");
        try {
            Files.write(pathspecs, purge, StandardCharsets.UTF_8);
            String indexFilter = "git rm -r --cached --ignore-unmatch -q --pathspec-from-file='%s'"
                    .formatted(pathspecs.toAbsolutePath());
            ProcessResult rewrite = git.run(root, rewriteTimeout,
                    Map.of("FILTER_BRANCH_SQUELCH_WARNING", "1", "GIT_LITERAL_PATHSPECS", "1"),
                    "filter-branch", "--force", "--index-filter", indexFilter, "--prune-empty", "--", PRUNED_BRANCH);
            if (!rewrite.isSuccess()) {
                throw new WorkspacePreparationException("History rewrite failed: " + rewrite.stderr());
            }
            git.run(root, timeout(), "update-ref", "-d", "refs/original/refs/heads/" + PRUNED_BRANCH);
            log.info("Rewrote history of {}: purged {} paths", root, purge.size());
        } finally {
            Files.deleteIfExists(pathspecs);
        }
    }

    private ProcessResult gitOrFail(Path workDir, String... args) {
        ProcessResult result = git.run(workDir, timeout(), args);
        if (!result.isSuccess()) {
            throw new WorkspacePreparationException("git %s failed (exit %d): %s"
                    .formatted(args[0].equals("-c") ? "commit" : args[0], result.exitCode(), result.stderr().trim()));
        }
        return result;
    }

    private Path createTempDirectory() throws IOException {
        String parent = properties.getTempDir();
        if (parent == null || parent.isBlank()) {
            return Files.createTempDirectory("congruence-safe-");
        }
        Path dir = Path.of(parent);
        Files.createDirectories(dir);
        return Files.createTempDirectory(dir, "congruence-safe-");
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.getGitTimeoutSeconds());
    }
}
