package com.congruence.core.persistence;

import com.congruence.core.model.Project;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Optional;

/**
 * Read-only view of the projects owned by the project-management subsystem.
 */
public class ProjectRepository {

    private static final String SELECT_BY_ID_SQL = """
            SELECT id, repo_url, default_branch, owner_id
            FROM projects
            WHERE id = ?
            """;

    private final TransactionRunner tx;

    public ProjectRepository(TransactionRunner tx) {
        this.tx = tx;
    }

    public Optional<Project> findById(long id) {
        return tx.withConnection("find project " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
                stmt.setLong(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new Project(
                            rs.getLong("id"),
                            rs.getString("repo_url"),
                            rs.getString("default_branch"),
                            rs.getString("owner_id")));
                }
            }
        });
    }
}
