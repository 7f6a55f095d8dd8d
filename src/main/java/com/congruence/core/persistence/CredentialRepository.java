package com.congruence.core.persistence;

import com.congruence.core.model.Credential;
import com.congruence.core.model.CredentialType;
import com.congruence.core.model.GitProvider;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads active credentials and records their usage. Secrets are never written here.
 */
public class CredentialRepository {

    private static final String SELECT_ACTIVE_SQL = """
            SELECT id, owner_id, provider, credential_type, encrypted_payload, username,
                   is_active, expires_at, last_used_at, use_count, last_error
            FROM git_credentials
            WHERE owner_id = ? AND provider = ? AND is_active = TRUE
            """;

    private static final String MARK_USED_SQL = """
            UPDATE git_credentials
            SET last_used_at = ?, use_count = use_count + 1, last_error = ?
            WHERE id = ?
            """;

    private final TransactionRunner tx;

    public CredentialRepository(TransactionRunner tx) {
        this.tx = tx;
    }

    public List<Credential> findActive(String ownerId, GitProvider provider) {
        return tx.withConnection("find credentials", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_ACTIVE_SQL)) {
                stmt.setString(1, ownerId);
                stmt.setString(2, provider.name());
                List<Credential> credentials = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        credentials.add(new Credential(
                                rs.getLong("id"),
                                rs.getString("owner_id"),
                                GitProvider.valueOf(rs.getString("provider")),
                                CredentialType.valueOf(rs.getString("credential_type")),
                                rs.getString("encrypted_payload"),
                                rs.getString("username"),
                                rs.getBoolean("is_active"),
                                Jdbc.getInstant(rs, "expires_at"),
                                Jdbc.getInstant(rs, "last_used_at"),
                                rs.getInt("use_count"),
                                rs.getString("last_error")));
                    }
                }
                return credentials;
            }
        });
    }

    /**
     * Bumps the use counter. A null error clears the previous one.
     */
    public void markUsed(long id, Instant usedAt, String error) {
        tx.withConnection("mark credential used", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(MARK_USED_SQL)) {
                Jdbc.setInstant(stmt, 1, usedAt);
                stmt.setString(2, error);
                stmt.setLong(3, id);
                return stmt.executeUpdate();
            }
        });
    }
}
