package com.congruence.core.persistence;

import com.congruence.core.error.PersistenceException;
import com.congruence.core.model.FunctionalRole;
import com.congruence.core.model.ProjectContributor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-project contributor snapshots for the classification-review surface.
 */
public class ProjectContributorRepository {

    private static final String SELECT_COLUMNS = """
            SELECT pc.project_id, pc.contributor_id, c.login, pc.miner_user_id, pc.files_modified,
                   pc.total_modifications, pc.avg_modifications_per_file, pc.functional_role,
                   pc.role_confidence, pc.is_core_contributor, pc.role_overridden, pc.mined_branch,
                   pc.last_analysis_at, pc.file_types
            FROM project_contributors pc
            JOIN contributors c ON c.id = pc.contributor_id
            """;

    private static final String SELECT_OVERRIDDEN_SQL = """
            SELECT role_overridden FROM project_contributors WHERE project_id = ? AND contributor_id = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO project_contributors (project_id, contributor_id, miner_user_id, files_modified,
                total_modifications, avg_modifications_per_file, functional_role, role_confidence,
                is_core_contributor, role_overridden, mined_branch, last_analysis_at, file_types)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE, ?, ?, ?)
            """;

    private static final String UPDATE_SQL = """
            UPDATE project_contributors
            SET miner_user_id = ?, files_modified = ?, total_modifications = ?,
                avg_modifications_per_file = ?, functional_role = ?, role_confidence = ?,
                is_core_contributor = ?, mined_branch = ?, last_analysis_at = ?, file_types = ?
            WHERE project_id = ? AND contributor_id = ?
            """;

    private static final String UPDATE_STATS_ONLY_SQL = """
            UPDATE project_contributors
            SET miner_user_id = ?, files_modified = ?, total_modifications = ?,
                avg_modifications_per_file = ?, mined_branch = ?, last_analysis_at = ?, file_types = ?
            WHERE project_id = ? AND contributor_id = ?
            """;

    private static final String SELECT_BRANCH_MEMBERS_SQL = """
            SELECT contributor_id FROM project_contributors WHERE project_id = ? AND mined_branch = ?
            """;

    private static final String DELETE_SQL = """
            DELETE FROM project_contributors WHERE project_id = ? AND contributor_id = ?
            """;

    private static final String OVERRIDE_SQL = """
            UPDATE project_contributors
            SET functional_role = ?, is_core_contributor = ?, role_confidence = 1.0, role_overridden = TRUE
            WHERE project_id = ? AND contributor_id = ?
            """;

    private static final TypeReference<Map<String, Integer>> FILE_TYPES = new TypeReference<>() {};

    private final TransactionRunner tx;
    private final ObjectMapper objectMapper;

    public ProjectContributorRepository(TransactionRunner tx, ObjectMapper objectMapper) {
        this.tx = tx;
        this.objectMapper = objectMapper;
    }

    /**
     * Overwrites the snapshot for this project and contributor. A role set by
     * manual review survives; the statistics are always replaced.
     */
    public void upsert(Connection conn, ProjectContributor pc) throws SQLException {
        Boolean overridden = null;
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_OVERRIDDEN_SQL)) {
            stmt.setLong(1, pc.projectId());
            stmt.setLong(2, pc.contributorId());
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    overridden = rs.getBoolean(1);
                }
            }
        }

        String fileTypes = writeFileTypes(pc.fileTypes());
        if (overridden == null) {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                stmt.setLong(1, pc.projectId());
                stmt.setLong(2, pc.contributorId());
                stmt.setString(3, pc.minerUserId());
                stmt.setInt(4, pc.filesModified());
                stmt.setInt(5, pc.totalModifications());
                stmt.setDouble(6, pc.avgModificationsPerFile());
                stmt.setString(7, pc.functionalRole().name());
                stmt.setDouble(8, pc.roleConfidence());
                stmt.setBoolean(9, pc.coreContributor());
                stmt.setString(10, pc.minedBranch());
                Jdbc.setInstant(stmt, 11, pc.lastAnalysisAt());
                stmt.setString(12, fileTypes);
                stmt.executeUpdate();
            }
        } else if (overridden) {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_STATS_ONLY_SQL)) {
                stmt.setString(1, pc.minerUserId());
                stmt.setInt(2, pc.filesModified());
                stmt.setInt(3, pc.totalModifications());
                stmt.setDouble(4, pc.avgModificationsPerFile());
                stmt.setString(5, pc.minedBranch());
                Jdbc.setInstant(stmt, 6, pc.lastAnalysisAt());
                stmt.setString(7, fileTypes);
                stmt.setLong(8, pc.projectId());
                stmt.setLong(9, pc.contributorId());
                stmt.executeUpdate();
            }
        } else {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                stmt.setString(1, pc.minerUserId());
                stmt.setInt(2, pc.filesModified());
                stmt.setInt(3, pc.totalModifications());
                stmt.setDouble(4, pc.avgModificationsPerFile());
                stmt.setString(5, pc.functionalRole().name());
                stmt.setDouble(6, pc.roleConfidence());
                stmt.setBoolean(7, pc.coreContributor());
                stmt.setString(8, pc.minedBranch());
                Jdbc.setInstant(stmt, 9, pc.lastAnalysisAt());
                stmt.setString(10, fileTypes);
                stmt.setLong(11, pc.projectId());
                stmt.setLong(12, pc.contributorId());
                stmt.executeUpdate();
            }
        }
    }

    /**
     * Removes snapshots of this project/branch whose contributor is not in {@code keep}.
     *
     * @return number of rows removed
     */
    public int deleteStale(Connection conn, long projectId, String branch, Set<Long> keep) throws SQLException {
        List<Long> stale = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_BRANCH_MEMBERS_SQL)) {
            stmt.setLong(1, projectId);
            stmt.setString(2, branch);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long id = rs.getLong(1);
                    if (!keep.contains(id)) {
                        stale.add(id);
                    }
                }
            }
        }
        if (stale.isEmpty()) {
            return 0;
        }
        try (PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            for (long id : stale) {
                stmt.setLong(1, projectId);
                stmt.setLong(2, id);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
        return stale.size();
    }

    public List<ProjectContributor> findByProject(long projectId) {
        return tx.withConnection("list project contributors", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    SELECT_COLUMNS + " WHERE pc.project_id = ? ORDER BY pc.total_modifications DESC, c.login")) {
                stmt.setLong(1, projectId);
                List<ProjectContributor> rows = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        rows.add(fromResultSet(rs));
                    }
                }
                return rows;
            }
        });
    }

    public Optional<ProjectContributor> find(long projectId, long contributorId) {
        return tx.withConnection("find project contributor", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    SELECT_COLUMNS + " WHERE pc.project_id = ? AND pc.contributor_id = ?")) {
                stmt.setLong(1, projectId);
                stmt.setLong(2, contributorId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
                }
            }
        });
    }

    /**
     * Manual classification. The row keeps this role on later ingestions.
     *
     * @return true if the row existed
     */
    public boolean overrideRole(long projectId, long contributorId, FunctionalRole role, boolean core) {
        return tx.withConnection("override contributor role", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(OVERRIDE_SQL)) {
                stmt.setString(1, role.name());
                stmt.setBoolean(2, core);
                stmt.setLong(3, projectId);
                stmt.setLong(4, contributorId);
                return stmt.executeUpdate() > 0;
            }
        });
    }

    private ProjectContributor fromResultSet(ResultSet rs) throws SQLException {
        return new ProjectContributor(
                rs.getLong("project_id"),
                rs.getLong("contributor_id"),
                rs.getString("login"),
                rs.getString("miner_user_id"),
                rs.getInt("files_modified"),
                rs.getInt("total_modifications"),
                rs.getDouble("avg_modifications_per_file"),
                FunctionalRole.valueOf(rs.getString("functional_role")),
                rs.getDouble("role_confidence"),
                rs.getBoolean("is_core_contributor"),
                rs.getBoolean("role_overridden"),
                rs.getString("mined_branch"),
                Jdbc.getInstant(rs, "last_analysis_at"),
                readFileTypes(rs.getString("file_types")));
    }

    private String writeFileTypes(Map<String, Integer> fileTypes) {
        try {
            return objectMapper.writeValueAsString(fileTypes == null ? Map.of() : new TreeMap<>(fileTypes));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize file types", e);
        }
    }

    private Map<String, Integer> readFileTypes(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, FILE_TYPES);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt file_types column", e);
        }
    }
}
