package com.congruence.core.ingest;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns a commit author email into the login contributors are keyed by.
 */
@Component
public class LoginNormalizer {

    private final Pattern noreply;

    public LoginNormalizer(IngestProperties properties) {
        this(properties.getNoreplyPattern());
    }

    LoginNormalizer(String noreplyPattern) {
        this.noreply = Pattern.compile(noreplyPattern, Pattern.CASE_INSENSITIVE);
    }

    /**
     * {@code bob@company.com} gives {@code bob}; {@code 12345+alice@users.noreply.github.com}
     * gives {@code alice}. A value without {@code @} is used whole.
     */
    public String normalize(String email) {
        String value = email == null ? "" : email.trim();
        int at = value.indexOf('@');
        if (at < 0) {
            return value;
        }
        String local = value.substring(0, at);
        if (noreply.matcher(value).matches()) {
            int plus = local.indexOf('+');
            if (plus >= 0 && plus + 1 < local.length()) {
                return local.substring(plus + 1);
            }
        }
        return local;
    }
}
