package com.congruence.core.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Safe-mode workspace settings, bound from {@code congruence.workspace.*}.
 */
@Component
@ConfigurationProperties(prefix = "congruence.workspace")
public class WorkspaceProperties {

    private List<String> allowedExtensions = new ArrayList<>(List.of(
            ".java", ".kt", ".kts", ".scala", ".groovy", ".py", ".js", ".jsx", ".ts", ".tsx", ".mjs",
            ".go", ".rs", ".c", ".h", ".cc", ".cpp", ".hpp", ".cs", ".rb", ".php", ".swift", ".m",
            ".sql", ".sh", ".vue", ".svelte", ".dart", ".lua", ".r", ".pl", ".ex", ".exs", ".erl", ".clj"
    ));

    private List<String> excludedDirectories = new ArrayList<>(List.of(
            "node_modules", "vendor", "dist", "build", "target", ".idea", ".vscode", "__pycache__",
            ".gradle", ".venv", "venv", "out", ".next", "coverage", "third_party"
    ));

    /** Purge excluded paths from the whole history. Slow on large repositories. */
    private boolean rewriteHistory = false;

    private String commitName = "congruence-safe-mode";
    private String commitEmail = "safe-mode@congruence.local";

    /** Parent of temporary workspaces; empty for the system temp directory. */
    private String tempDir = "";

    private int gitTimeoutSeconds = 120;
    private int rewriteTimeoutSeconds = 1800;

    public List<String> getAllowedExtensions() { return allowedExtensions; }
    public void setAllowedExtensions(List<String> allowedExtensions) { this.allowedExtensions = allowedExtensions; }

    public List<String> getExcludedDirectories() { return excludedDirectories; }
    public void setExcludedDirectories(List<String> excludedDirectories) { this.excludedDirectories = excludedDirectories; }

    public boolean isRewriteHistory() { return rewriteHistory; }
    public void setRewriteHistory(boolean rewriteHistory) { this.rewriteHistory = rewriteHistory; }

    public String getCommitName() { return commitName; }
    public void setCommitName(String commitName) { this.commitName = commitName; }

    public String getCommitEmail() { return commitEmail; }
    public void setCommitEmail(String commitEmail) { this.commitEmail = commitEmail; }

    public String getTempDir() { return tempDir; }
    public void setTempDir(String tempDir) { this.tempDir = tempDir; }

    public int getGitTimeoutSeconds() { return gitTimeoutSeconds; }
    public void setGitTimeoutSeconds(int gitTimeoutSeconds) { this.gitTimeoutSeconds = gitTimeoutSeconds; }

    public int getRewriteTimeoutSeconds() { return rewriteTimeoutSeconds; }
    public void setRewriteTimeoutSeconds(int rewriteTimeoutSeconds) { this.rewriteTimeoutSeconds = rewriteTimeoutSeconds; }

    public SafeModeOptions toOptions() {
        return SafeModeOptions.of(allowedExtensions, excludedDirectories, rewriteHistory);
    }
}
