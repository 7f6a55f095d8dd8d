package com.congruence.core.workspace;

import com.congruence.core.git.GitCli;
import com.congruence.core.process.ProcessResult;
import com.congruence.core.process.ProcessTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Git is faked here, so these run without a git binary.
 */
class WorkspacePreparerTimeoutTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("A hung branch lookup fails as a workspace error and creates nothing")
    void branchLookupTimeout() throws Exception {
        Files.createDirectories(tempDir.resolve("source/.git"));
        GitCli hangingGit = new GitCli(null) {
            @Override
            public ProcessResult run(Path workDir, Duration timeout, Map<String, String> environment, String... args) {
                throw new ProcessTimeoutException("git " + String.join(" ", args), timeout, "", "");
            }
        };
        var properties = new WorkspaceProperties();
        properties.setTempDir(tempDir.resolve("workspaces").toString());
        var preparer = new WorkspacePreparer(hangingGit, properties, null);

        var e = assertThrows(WorkspacePreparationException.class,
                () -> preparer.prepare(tempDir.resolve("source"), "main"));

        assertInstanceOf(ProcessTimeoutException.class, e.getCause());
        assertTrue(e.getMessage().contains("timed out"));
        assertFalse(Files.exists(tempDir.resolve("workspaces")));
    }
}
