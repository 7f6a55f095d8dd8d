package com.congruence.core.process;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks credentials embedded in URLs before they reach logs or stored output.
 */
public final class SensitiveData {

    private static final Pattern SENSITIVE_URL_PATTERN = Pattern.compile(
            "(https?://)([^@/\\s]+)@"
    );

    private SensitiveData() {}

    public static String mask(String input) {
        if (input == null) return null;
        return SENSITIVE_URL_PATTERN.matcher(input).replaceAll("$1***@");
    }

    public static String maskCommand(List<String> command) {
        return mask(String.join(" ", command));
    }
}
