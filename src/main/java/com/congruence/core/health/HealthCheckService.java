package com.congruence.core.health;

import com.congruence.core.git.GitCli;
import com.congruence.core.git.GitProperties;
import com.congruence.core.process.ProcessResult;
import com.congruence.mining.MiningBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final GitCli git;
    private final GitProperties gitProperties;
    private final MiningBackend miningBackend;

    public HealthCheckService(@Autowired(required = false) DataSource dataSource,
                              GitCli git,
                              GitProperties gitProperties,
                              @Autowired(required = false) MiningBackend miningBackend) {
        this.dataSource = dataSource;
        this.git = git;
        this.gitProperties = gitProperties;
        this.miningBackend = miningBackend;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkGit());
        results.add(checkMiner());
        return results;
    }

    public boolean isHealthy(List<HealthStatus> statuses) {
        return statuses.stream().noneMatch(s -> s.status() == HealthStatus.Status.DOWN);
    }

    HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of("product", conn.getMetaData().getDatabaseProductName()));
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkGit() {
        try {
            ProcessResult result = git.run(null, gitProperties.localTimeout(), "--version");
            if (result.isSuccess()) {
                return new HealthStatus("git", HealthStatus.Status.UP, result.stdout().trim(), Map.of());
            }
            return new HealthStatus("git", HealthStatus.Status.DOWN,
                    "git --version exited with " + result.exitCode(), Map.of());
        } catch (RuntimeException e) {
            log.warn("Git health check failed: {}", e.getMessage());
            return new HealthStatus("git", HealthStatus.Status.DOWN, "git unavailable: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkMiner() {
        if (miningBackend == null) {
            return new HealthStatus("miner", HealthStatus.Status.DOWN, "No mining backend configured", Map.of());
        }
        try {
            miningBackend.verifyReady();
            return new HealthStatus("miner", HealthStatus.Status.UP,
                    "Backend " + miningBackend.name() + " ready", Map.of("backend", miningBackend.name()));
        } catch (RuntimeException e) {
            log.warn("Miner health check failed: {}", e.getMessage());
            return new HealthStatus("miner", HealthStatus.Status.DEGRADED, e.getMessage(),
                    Map.of("backend", miningBackend.name()));
        }
    }
}
