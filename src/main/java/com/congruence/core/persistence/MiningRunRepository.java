package com.congruence.core.persistence;

import com.congruence.core.model.MiningDataType;
import com.congruence.core.model.MiningRun;
import com.congruence.core.model.MiningRunStatus;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Job-status store for mining runs.
 */
public class MiningRunRepository {

    /** Stored log keeps only the tail beyond this many characters. */
    static final int MAX_LOG_CHARS = 64 * 1024;

    private static final String COLUMNS = """
            id, project_id, repo_url, branch, data_type, command, options_json, status,
            created_at, started_at, finished_at, artifact_dir, error_code, error_message, run_log
            """;

    private static final String INSERT_SQL = """
            INSERT INTO mining_runs (project_id, repo_url, branch, data_type, status, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String MARK_RUNNING_SQL = """
            UPDATE mining_runs SET status = ?, started_at = ? WHERE id = ? AND status = ?
            """;

    private static final String RECORD_COMMAND_SQL = """
            UPDATE mining_runs SET command = ?, options_json = ?, artifact_dir = ? WHERE id = ?
            """;

    private static final String FINISH_SQL = """
            UPDATE mining_runs
            SET status = ?, finished_at = ?, error_code = ?, error_message = ?, run_log = ?
            WHERE id = ?
            """;

    private static final String CANCEL_QUEUED_SQL = """
            UPDATE mining_runs
            SET status = ?, finished_at = ?, error_code = ?, error_message = ?, run_log = ''
            WHERE id = ? AND status = ?
            """;

    private static final String SELECT_BY_ID_SQL = "SELECT " + COLUMNS + " FROM mining_runs WHERE id = ?";

    private static final String SELECT_RECENT_SQL = "SELECT " + COLUMNS + """
             FROM mining_runs
            WHERE project_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;

    private final TransactionRunner tx;

    public MiningRunRepository(TransactionRunner tx) {
        this.tx = tx;
    }

    public MiningRun create(long projectId, String repoUrl, String branch, MiningDataType dataType, Instant now) {
        long id = tx.withConnection("create mining run", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
                stmt.setLong(1, projectId);
                stmt.setString(2, repoUrl);
                stmt.setString(3, branch);
                stmt.setString(4, dataType.name());
                stmt.setString(5, MiningRunStatus.QUEUED.name());
                Jdbc.setInstant(stmt, 6, now);
                stmt.executeUpdate();
                return Jdbc.generatedId(stmt);
            }
        });
        return new MiningRun(id, projectId, repoUrl, branch, dataType, null, null,
                MiningRunStatus.QUEUED, now, null, null, null, null, null, null);
    }

    /**
     * Moves a QUEUED run to RUNNING.
     *
     * @return false when the run is no longer queued, e.g. it was cancelled meanwhile
     */
    public boolean markRunning(long id, Instant now) {
        int updated = tx.withConnection("mark run running", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(MARK_RUNNING_SQL)) {
                stmt.setString(1, MiningRunStatus.RUNNING.name());
                Jdbc.setInstant(stmt, 2, now);
                stmt.setLong(3, id);
                stmt.setString(4, MiningRunStatus.QUEUED.name());
                return stmt.executeUpdate();
            }
        });
        return updated == 1;
    }

    /**
     * Closes a run as FAILED only if it has not started yet.
     *
     * @return false when a worker already picked the run up
     */
    public boolean cancelQueued(long id, Instant now, String errorCode, String message) {
        int updated = tx.withConnection("cancel queued run", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(CANCEL_QUEUED_SQL)) {
                stmt.setString(1, MiningRunStatus.FAILED.name());
                Jdbc.setInstant(stmt, 2, now);
                stmt.setString(3, errorCode);
                stmt.setString(4, message);
                stmt.setLong(5, id);
                stmt.setString(6, MiningRunStatus.QUEUED.name());
                return stmt.executeUpdate();
            }
        });
        return updated == 1;
    }

    public void recordCommand(long id, String command, String optionsJson, String artifactDir) {
        tx.withConnection("record run command", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(RECORD_COMMAND_SQL)) {
                stmt.setString(1, command);
                stmt.setString(2, optionsJson);
                stmt.setString(3, artifactDir);
                stmt.setLong(4, id);
                return stmt.executeUpdate();
            }
        });
    }

    public void markSucceeded(long id, Instant now, String log) {
        finish(id, MiningRunStatus.SUCCEEDED, now, null, null, log);
    }

    public void markFailed(long id, Instant now, String errorCode, String message, String log) {
        finish(id, MiningRunStatus.FAILED, now, errorCode, message, log);
    }

    private void finish(long id, MiningRunStatus status, Instant now, String errorCode, String message, String log) {
        tx.withConnection("finish mining run", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(FINISH_SQL)) {
                stmt.setString(1, status.name());
                Jdbc.setInstant(stmt, 2, now);
                stmt.setString(3, errorCode);
                stmt.setString(4, message);
                stmt.setString(5, tail(log));
                stmt.setLong(6, id);
                return stmt.executeUpdate();
            }
        });
    }

    public Optional<MiningRun> findById(long id) {
        return tx.withConnection("find mining run", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
                stmt.setLong(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<MiningRun> findRecent(long projectId, int limit) {
        return tx.withConnection("list mining runs", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
                stmt.setLong(1, projectId);
                stmt.setInt(2, limit);
                List<MiningRun> runs = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        runs.add(fromResultSet(rs));
                    }
                }
                return runs;
            }
        });
    }

    static String tail(String log) {
        if (log == null || log.length() <= MAX_LOG_CHARS) {
            return log;
        }
        return log.substring(log.length() - MAX_LOG_CHARS);
    }

    private static MiningRun fromResultSet(ResultSet rs) throws SQLException {
        return new MiningRun(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getString("repo_url"),
                rs.getString("branch"),
                MiningDataType.valueOf(rs.getString("data_type")),
                rs.getString("command"),
                rs.getString("options_json"),
                MiningRunStatus.valueOf(rs.getString("status")),
                Jdbc.getInstant(rs, "created_at"),
                Jdbc.getInstant(rs, "started_at"),
                Jdbc.getInstant(rs, "finished_at"),
                rs.getString("artifact_dir"),
                rs.getString("error_code"),
                rs.getString("error_message"),
                rs.getString("run_log"));
    }
}
