package com.congruence.core.git;

import com.congruence.core.model.Credential;
import com.congruence.core.model.CredentialType;
import com.congruence.core.model.GitProvider;
import com.congruence.core.persistence.CredentialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CredentialResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private CredentialRepository repository;
    private CredentialResolver resolver;

    @BeforeEach
    void setUp() {
        repository = mock(CredentialRepository.class);
        resolver = new CredentialResolver(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Credential cred(long id, CredentialType type, boolean active, Instant expiresAt) {
        return new Credential(id, "alice", GitProvider.GITHUB, type, "payload", null, active, expiresAt, null, 0, null);
    }

    @Test
    @DisplayName("Token is preferred over basic auth and SSH key")
    void prefersToken() {
        when(repository.findActive("alice", GitProvider.GITHUB)).thenReturn(List.of(
                cred(1, CredentialType.SSH_KEY, true, null),
                cred(2, CredentialType.BASIC_AUTH, true, null),
                cred(3, CredentialType.HTTPS_TOKEN, true, null)));

        var resolved = resolver.resolveCredential("https://github.com/a/b", "alice");

        assertEquals(3, resolved.orElseThrow().id());
    }

    @Test
    @DisplayName("Expired and inactive credentials are skipped")
    void skipsUnusable() {
        when(repository.findActive("alice", GitProvider.GITHUB)).thenReturn(List.of(
                cred(1, CredentialType.HTTPS_TOKEN, true, NOW.minusSeconds(1)),
                cred(2, CredentialType.HTTPS_TOKEN, false, null),
                cred(3, CredentialType.BASIC_AUTH, true, NOW.plusSeconds(60))));

        assertEquals(3, resolver.resolveCredential("https://github.com/a/b", "alice").orElseThrow().id());
    }

    @Test
    @DisplayName("No owner means no lookup")
    void noOwner() {
        assertTrue(resolver.resolveCredential("https://github.com/a/b", null).isEmpty());
        assertTrue(resolver.resolveCredential("https://github.com/a/b", " ").isEmpty());
        verify(repository, never()).findActive(any(), any());
    }

    @Test
    @DisplayName("Lookup uses the provider inferred from the URL")
    void providerFromUrl() {
        when(repository.findActive("alice", GitProvider.GITLAB)).thenReturn(List.of());

        assertTrue(resolver.resolveCredential("https://gitlab.example.org/a/b", "alice").isEmpty());
        verify(repository).findActive("alice", GitProvider.GITLAB);
    }
}
