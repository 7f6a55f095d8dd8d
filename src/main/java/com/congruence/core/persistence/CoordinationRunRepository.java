package com.congruence.core.persistence;

import com.congruence.core.model.Algorithm;
import com.congruence.core.model.CoordinationRun;
import com.congruence.core.model.CrEdge;
import com.congruence.core.model.TdSource;
import com.congruence.core.model.UnorderedPair;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of congruence runs and their CR edges.
 */
public class CoordinationRunRepository {

    private static final String COLUMNS = """
            SELECT id, project_id, branch, algorithm, td_source, ca_source, class_config, class_breakdown,
                   score, cr_count, diff_count, created_at
            FROM coordination_runs
            """;

    private static final String INSERT_RUN_SQL = """
            INSERT INTO coordination_runs (project_id, branch, algorithm, td_source, ca_source, class_config,
                class_breakdown, score, cr_count, diff_count, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_CR_SQL = """
            INSERT INTO cr_edges (run_id, contributor_i, contributor_j, weight) VALUES (?, ?, ?, ?)
            """;

    private static final String SELECT_CR_SQL = """
            SELECT contributor_i, contributor_j, weight FROM cr_edges
            WHERE run_id = ? ORDER BY weight DESC, contributor_i, contributor_j
            """;

    private final TransactionRunner tx;

    public CoordinationRunRepository(TransactionRunner tx) {
        this.tx = tx;
    }

    /**
     * Inserts the run and its CR edges. The id of {@code run} is ignored.
     */
    public CoordinationRun insert(Connection conn, CoordinationRun run, Collection<CrEdge> edges) throws SQLException {
        long id;
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_RUN_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setLong(1, run.projectId());
            stmt.setString(2, run.branch());
            stmt.setString(3, algorithmColumn(run.algorithm()));
            stmt.setString(4, run.tdSource().name());
            stmt.setString(5, run.caSource());
            stmt.setString(6, run.classConfig());
            stmt.setString(7, run.classBreakdown());
            stmt.setDouble(8, run.score());
            stmt.setInt(9, run.crCount());
            stmt.setInt(10, run.diffCount());
            Jdbc.setInstant(stmt, 11, run.createdAt());
            stmt.executeUpdate();
            id = Jdbc.generatedId(stmt);
        }
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_CR_SQL)) {
            for (CrEdge edge : edges) {
                stmt.setLong(1, id);
                stmt.setLong(2, edge.contributors().first());
                stmt.setLong(3, edge.contributors().second());
                stmt.setDouble(4, edge.weight());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
        return new CoordinationRun(id, run.projectId(), run.branch(), run.algorithm(), run.tdSource(),
                run.caSource(), run.classConfig(), run.classBreakdown(), run.score(), run.crCount(),
                run.diffCount(), run.createdAt());
    }

    public Optional<CoordinationRun> findById(long id) {
        return tx.withConnection("find coordination run", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(COLUMNS + " WHERE id = ?")) {
                stmt.setLong(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
                }
            }
        });
    }

    public Optional<CoordinationRun> findLatest(long projectId, Algorithm algorithm) {
        return tx.withConnection("find latest coordination run", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    COLUMNS + " WHERE project_id = ? AND algorithm = ? ORDER BY created_at DESC, id DESC LIMIT 1")) {
                stmt.setLong(1, projectId);
                stmt.setString(2, algorithmColumn(algorithm));
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<CoordinationRun> findByProject(long projectId, int limit) {
        return tx.withConnection("list coordination runs", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    COLUMNS + " WHERE project_id = ? ORDER BY created_at DESC, id DESC LIMIT ?")) {
                stmt.setLong(1, projectId);
                stmt.setInt(2, limit);
                List<CoordinationRun> runs = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        runs.add(fromResultSet(rs));
                    }
                }
                return runs;
            }
        });
    }

    public List<CrEdge> findCrEdges(long runId) {
        return tx.withConnection("list CR edges", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_CR_SQL)) {
                stmt.setLong(1, runId);
                List<CrEdge> edges = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        edges.add(new CrEdge(new UnorderedPair<>(rs.getLong(1), rs.getLong(2)), rs.getDouble(3)));
                    }
                }
                return edges;
            }
        });
    }

    private static String algorithmColumn(Algorithm algorithm) {
        return switch (algorithm) {
            case STC -> "STC";
            case MC_STC -> "MC_STC";
        };
    }

    private static CoordinationRun fromResultSet(ResultSet rs) throws SQLException {
        return new CoordinationRun(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getString("branch"),
                Algorithm.valueOf(rs.getString("algorithm")),
                TdSource.valueOf(rs.getString("td_source")),
                rs.getString("ca_source"),
                rs.getString("class_config"),
                rs.getString("class_breakdown"),
                rs.getDouble("score"),
                rs.getInt("cr_count"),
                rs.getInt("diff_count"),
                Jdbc.getInstant(rs, "created_at"));
    }
}
