package com.congruence.core.model;

import java.time.Instant;

/**
 * Git credential owned by the account subsystem. The secret stays encrypted;
 * only usage metadata is written back by this service.
 *
 * @param encryptedPayload Base64 AES-GCM payload (IV + ciphertext)
 * @param username         user name for basic auth, may be null
 * @param expiresAt        expiry instant, null when the credential never expires
 */
public record Credential(
    long id,
    String ownerId,
    GitProvider provider,
    CredentialType type,
    String encryptedPayload,
    String username,
    boolean active,
    Instant expiresAt,
    Instant lastUsedAt,
    int useCount,
    String lastError
) {

    public boolean isUsableAt(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }
}
