package com.congruence.core.persistence;

import com.congruence.core.model.CodeFile;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Source files, unique per project and path.
 */
public class CodeFileRepository {

    private static final String SELECT_SQL = """
            SELECT id, project_id, file_path, language, loc
            FROM code_files
            WHERE project_id = ? AND file_path = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO code_files (project_id, file_path, language) VALUES (?, ?, ?)
            """;

    public CodeFile upsert(Connection conn, long projectId, String path, String language) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setLong(1, projectId);
            stmt.setString(2, path);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return new CodeFile(rs.getLong("id"), rs.getLong("project_id"), rs.getString("file_path"),
                            rs.getString("language"), Jdbc.getNullableInt(rs, "loc"));
                }
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setLong(1, projectId);
            stmt.setString(2, path);
            stmt.setString(3, language);
            stmt.executeUpdate();
            return new CodeFile(Jdbc.generatedId(stmt), projectId, path, language, null);
        }
    }
}
