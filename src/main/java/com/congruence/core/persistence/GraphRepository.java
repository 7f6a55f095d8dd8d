package com.congruence.core.persistence;

import com.congruence.core.model.CaEdge;
import com.congruence.core.model.Evidence;
import com.congruence.core.model.TaEntry;
import com.congruence.core.model.TdEdge;
import com.congruence.core.model.UnorderedPair;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * TA, TD and CA graphs, each scoped by project and branch and fully replaced per run.
 * Edge endpoints are written in the canonical order carried by {@link UnorderedPair};
 * the tables reject anything else.
 */
public class GraphRepository {

    private static final String DELETE_TA_SQL = "DELETE FROM ta_entries WHERE project_id = ? AND branch = ?";
    private static final String DELETE_TD_SQL = "DELETE FROM td_edges WHERE project_id = ? AND branch = ?";
    private static final String DELETE_CA_SQL = "DELETE FROM ca_edges WHERE project_id = ? AND branch = ?";

    private static final String INSERT_TA_SQL = """
            INSERT INTO ta_entries (project_id, branch, contributor_id, file_id, edit_count) VALUES (?, ?, ?, ?, ?)
            """;
    private static final String INSERT_TD_SQL = """
            INSERT INTO td_edges (project_id, branch, file_a, file_b, weight) VALUES (?, ?, ?, ?, ?)
            """;
    private static final String INSERT_CA_SQL = """
            INSERT INTO ca_edges (project_id, branch, contributor_i, contributor_j, weight, evidence)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_TA_SQL = """
            SELECT contributor_id, file_id, edit_count FROM ta_entries
            WHERE project_id = ? AND branch = ? ORDER BY contributor_id, file_id
            """;

    private final TransactionRunner tx;

    public GraphRepository(TransactionRunner tx) {
        this.tx = tx;
    }

    public void replaceTaEntries(Connection conn, long projectId, String branch, Collection<TaEntry> entries)
            throws SQLException {
        delete(conn, DELETE_TA_SQL, projectId, branch);
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_TA_SQL)) {
            for (TaEntry entry : entries) {
                stmt.setLong(1, projectId);
                stmt.setString(2, branch);
                stmt.setLong(3, entry.contributorId());
                stmt.setLong(4, entry.fileId());
                stmt.setInt(5, entry.editCount());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    public void replaceTdEdges(Connection conn, long projectId, String branch, Collection<TdEdge> edges)
            throws SQLException {
        delete(conn, DELETE_TD_SQL, projectId, branch);
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_TD_SQL)) {
            for (TdEdge edge : edges) {
                stmt.setLong(1, projectId);
                stmt.setString(2, branch);
                stmt.setLong(3, edge.files().first());
                stmt.setLong(4, edge.files().second());
                stmt.setDouble(5, edge.weight());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    public void replaceCaEdges(Connection conn, long projectId, String branch, Collection<CaEdge> edges)
            throws SQLException {
        delete(conn, DELETE_CA_SQL, projectId, branch);
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_CA_SQL)) {
            for (CaEdge edge : edges) {
                stmt.setLong(1, projectId);
                stmt.setString(2, branch);
                stmt.setLong(3, edge.contributors().first());
                stmt.setLong(4, edge.contributors().second());
                stmt.setDouble(5, edge.weight());
                stmt.setString(6, evidenceColumn(edge.evidence()));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    public List<TaEntry> findTaEntries(long projectId, String branch) {
        return tx.withConnection("load TA", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_TA_SQL)) {
                stmt.setLong(1, projectId);
                stmt.setString(2, branch);
                List<TaEntry> entries = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new TaEntry(rs.getLong(1), rs.getLong(2), rs.getInt(3)));
                    }
                }
                return entries;
            }
        });
    }

    private static String evidenceColumn(Evidence evidence) {
        return switch (evidence) {
            case SAME_COMMIT, SAME_FILE, CO_EDIT -> evidence.name();
        };
    }

    private static void delete(Connection conn, String sql, long projectId, String branch) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, projectId);
            stmt.setString(2, branch);
            stmt.executeUpdate();
        }
    }
}
