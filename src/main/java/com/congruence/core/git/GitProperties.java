package com.congruence.core.git;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Git transport settings, bound from {@code congruence.git.*}.
 */
@Component
@ConfigurationProperties(prefix = "congruence.git")
public class GitProperties {

    /** Root under which project clones live as {@code project_<id>}. */
    private String repositoriesDir = "/app/repositories";

    private int branchCacheTtlSeconds = 300;

    private final Timeouts timeouts = new Timeouts();

    public String getRepositoriesDir() { return repositoriesDir; }
    public void setRepositoriesDir(String repositoriesDir) { this.repositoriesDir = repositoriesDir; }

    public int getBranchCacheTtlSeconds() { return branchCacheTtlSeconds; }
    public void setBranchCacheTtlSeconds(int branchCacheTtlSeconds) { this.branchCacheTtlSeconds = branchCacheTtlSeconds; }

    public Timeouts getTimeouts() { return timeouts; }

    public Duration localTimeout() { return Duration.ofSeconds(timeouts.getLocalSeconds()); }
    public Duration remoteTimeout() { return Duration.ofSeconds(timeouts.getRemoteSeconds()); }
    public Duration cloneTimeout() { return Duration.ofSeconds(timeouts.getCloneSeconds()); }

    public static class Timeouts {
        private int localSeconds = 10;
        private int remoteSeconds = 30;
        private int cloneSeconds = 300;

        public int getLocalSeconds() { return localSeconds; }
        public void setLocalSeconds(int localSeconds) { this.localSeconds = localSeconds; }

        public int getRemoteSeconds() { return remoteSeconds; }
        public void setRemoteSeconds(int remoteSeconds) { this.remoteSeconds = remoteSeconds; }

        public int getCloneSeconds() { return cloneSeconds; }
        public void setCloneSeconds(int cloneSeconds) { this.cloneSeconds = cloneSeconds; }
    }
}
