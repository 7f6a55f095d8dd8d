package com.congruence.core.git;

import com.congruence.core.model.Credential;
import com.congruence.core.model.GitProvider;
import com.congruence.core.persistence.CredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the credential an owner has stored for the provider hosting a repository.
 * Credentials are never used across providers.
 */
@Component
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final CredentialRepository credentialRepository;
    private final Clock clock;

    public CredentialResolver(CredentialRepository credentialRepository, Clock clock) {
        this.credentialRepository = credentialRepository;
        this.clock = clock;
    }

    /**
     * Active, non-expired credential for (owner, provider of {@code repoUrl}).
     * Tokens are preferred over basic auth, basic auth over SSH keys.
     */
    public Optional<Credential> resolveCredential(String repoUrl, String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            return Optional.empty();
        }
        GitProvider provider = GitProvider.fromUrl(repoUrl);
        Instant now = clock.instant();
        Optional<Credential> credential = credentialRepository.findActive(ownerId, provider).stream()
                .filter(c -> c.provider() == provider)
                .filter(c -> c.isUsableAt(now))
                .min(Comparator.comparing(Credential::type));
        log.debug("Credential for owner {} on {}: {}", ownerId, provider,
                credential.map(c -> c.type().name()).orElse("none"));
        return credential;
    }
}
