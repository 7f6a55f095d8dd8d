package com.congruence.core.persistence;

import com.congruence.core.model.Contributor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Contributors keyed by normalized login. Rows are created on first sighting and never deleted.
 */
public class ContributorRepository {

    private static final String SELECT_BY_LOGIN_SQL = """
            SELECT id, login, email FROM contributors WHERE login = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO contributors (login, email) VALUES (?, ?)
            """;

    private static final String BACKFILL_EMAIL_SQL = """
            UPDATE contributors SET email = ? WHERE id = ? AND (email IS NULL OR email = '')
            """;

    private static final String SELECT_BY_PROJECT_SQL = """
            SELECT c.id, c.login, c.email
            FROM contributors c
            JOIN project_contributors pc ON pc.contributor_id = c.id
            WHERE pc.project_id = ?
            """;

    private final TransactionRunner tx;

    public ContributorRepository(TransactionRunner tx) {
        this.tx = tx;
    }

    /**
     * Finds or creates the contributor. The email is only filled in when the stored one is empty.
     */
    public Contributor upsert(Connection conn, String login, String email) throws SQLException {
        Optional<Contributor> existing = findByLogin(conn, login);
        if (existing.isPresent()) {
            Contributor contributor = existing.get();
            boolean emailMissing = contributor.email() == null || contributor.email().isEmpty();
            if (emailMissing && email != null && !email.isEmpty()) {
                try (PreparedStatement stmt = conn.prepareStatement(BACKFILL_EMAIL_SQL)) {
                    stmt.setString(1, email);
                    stmt.setLong(2, contributor.id());
                    stmt.executeUpdate();
                }
                return new Contributor(contributor.id(), login, email);
            }
            return contributor;
        }
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, login);
            stmt.setString(2, email);
            stmt.executeUpdate();
            return new Contributor(Jdbc.generatedId(stmt), login, email);
        }
    }

    public Optional<Contributor> findByLogin(String login) {
        return tx.withConnection("find contributor", conn -> findByLogin(conn, login));
    }

    /**
     * Contributors with a snapshot in the given project, by id.
     */
    public Map<Long, Contributor> findByProject(long projectId) {
        return tx.withConnection("list project contributors", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_BY_PROJECT_SQL)) {
                stmt.setLong(1, projectId);
                Map<Long, Contributor> byId = new HashMap<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        var contributor = new Contributor(rs.getLong("id"), rs.getString("login"), rs.getString("email"));
                        byId.put(contributor.id(), contributor);
                    }
                }
                return byId;
            }
        });
    }

    private static Optional<Contributor> findByLogin(Connection conn, String login) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_BY_LOGIN_SQL)) {
            stmt.setString(1, login);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Contributor(rs.getLong("id"), rs.getString("login"), rs.getString("email")));
            }
        }
    }
}
