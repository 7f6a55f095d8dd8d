package com.congruence.core.model;

import java.util.Locale;

/**
 * Hosting provider of a git remote, inferred from the URL host.
 */
public enum GitProvider {
    GITHUB("GitHub", "github.com",
            "https://github.com/settings/tokens", "https://github.com/settings/keys"),
    GITLAB("GitLab", "gitlab",
            "https://gitlab.com/-/user_settings/personal_access_tokens", "https://gitlab.com/-/user_settings/ssh_keys"),
    BITBUCKET("Bitbucket", "bitbucket",
            "https://bitbucket.org/account/settings/app-passwords/", "https://bitbucket.org/account/settings/ssh-keys/"),
    GENERIC("your git host", "", "", "");

    private final String displayName;
    private final String hostMarker;
    private final String tokenHelpUrl;
    private final String sshKeysUrl;

    GitProvider(String displayName, String hostMarker, String tokenHelpUrl, String sshKeysUrl) {
        this.displayName = displayName;
        this.hostMarker = hostMarker;
        this.tokenHelpUrl = tokenHelpUrl;
        this.sshKeysUrl = sshKeysUrl;
    }

    public String displayName() {
        return displayName;
    }

    public String tokenHelpUrl() {
        return tokenHelpUrl;
    }

    public String sshKeysUrl() {
        return sshKeysUrl;
    }

    /**
     * Infers the provider from a substring of the URL. Unknown hosts map to {@link #GENERIC}.
     */
    public static GitProvider fromUrl(String url) {
        if (url == null) {
            return GENERIC;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (GitProvider provider : values()) {
            if (!provider.hostMarker.isEmpty() && lower.contains(provider.hostMarker)) {
                return provider;
            }
        }
        return GENERIC;
    }
}
