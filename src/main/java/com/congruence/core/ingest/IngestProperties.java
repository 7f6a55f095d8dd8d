package com.congruence.core.ingest;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Artifact ingestion settings, bound from {@code congruence.ingest.*}.
 */
@Component
@ConfigurationProperties(prefix = "congruence.ingest")
public class IngestProperties {

    /** Regex over the full author email marking provider "noreply" addresses. */
    private String noreplyPattern = ".*noreply.*";

    /** Author emails that never become contributors, such as the safe-mode commit identity. */
    private List<String> ignoredEmails = new ArrayList<>(List.of("safe-mode@congruence.local"));

    public String getNoreplyPattern() { return noreplyPattern; }
    public void setNoreplyPattern(String noreplyPattern) { this.noreplyPattern = noreplyPattern; }

    public List<String> getIgnoredEmails() { return ignoredEmails; }
    public void setIgnoredEmails(List<String> ignoredEmails) { this.ignoredEmails = ignoredEmails; }
}
