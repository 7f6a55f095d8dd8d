package com.congruence.core.git;

import com.congruence.core.model.Credential;
import com.congruence.core.model.GitProvider;
import com.congruence.core.security.CredentialCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Injects a decrypted credential into an HTTPS clone URL.
 *
 * <p>Conventions: GitHub {@code https://<token>@host/}, GitLab
 * {@code https://oauth2:<token>@host/}, Bitbucket {@code https://x-token-auth:<token>@host/},
 * anything else {@code https://<token>@host/}. Basic auth becomes
 * {@code https://<user>:<password>@host/}. SSH keys are not URL material.
 */
@Component
public class AuthenticatedUrlBuilder {

    private static final Logger log = LoggerFactory.getLogger(AuthenticatedUrlBuilder.class);

    private static final String HTTPS = "https://";

    private final CredentialCipher cipher;

    public AuthenticatedUrlBuilder(CredentialCipher cipher) {
        this.cipher = cipher;
    }

    /**
     * Authenticated URL, or the original URL when no credential can be applied.
     */
    public String buildAuthenticatedUrl(String url, Credential credential) {
        return tryAuthenticatedUrl(url, credential).orElse(url);
    }

    public Optional<String> tryAuthenticatedUrl(String url, Credential credential) {
        if (url == null || credential == null) {
            return Optional.empty();
        }
        if (!url.startsWith(HTTPS)) {
            log.debug("Credential {} not applied: {} is not an https URL", credential.id(), credential.type());
            return Optional.empty();
        }
        String rest = url.substring(HTTPS.length());
        int slash = rest.indexOf('/');
        String authority = slash < 0 ? rest : rest.substring(0, slash);
        if (authority.isEmpty() || authority.contains("@")) {
            return Optional.empty();
        }

        Optional<String> userInfo = switch (credential.type()) {
            case HTTPS_TOKEN -> secret(credential).map(token -> tokenUserInfo(credential.provider(), token));
            case BASIC_AUTH -> basicUserInfo(credential);
            case SSH_KEY -> Optional.empty();
        };
        return userInfo.map(info -> HTTPS + info + "@" + rest);
    }

    private Optional<String> secret(Credential credential) {
        return cipher.tryDecrypt(credential.encryptedPayload())
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    private Optional<String> basicUserInfo(Credential credential) {
        if (credential.username() == null || credential.username().isBlank()) {
            return Optional.empty();
        }
        return secret(credential).map(password -> encode(credential.username()) + ":" + encode(password));
    }

    static String tokenUserInfo(GitProvider provider, String token) {
        return switch (provider) {
            case GITHUB, GENERIC -> token;
            case GITLAB -> "oauth2:" + token;
            case BITBUCKET -> "x-token-auth:" + token;
        };
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
