package com.streamity.telemetry.agent;

import lombok.Builder;
import lombok.Value;

import java.net.URI;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of a capture agent, read once when the agent is created.
 *
 * The DNS/CORS/HTTPS values describe how the player reaches its IPTV provider
 * and are attached to every report as context.
 */
@Value
@Builder
public class CaptureAgentConfig {

    /** Placeholder DNS shipped with the player before it is configured. */
    public static final String PLACEHOLDER_DNS = "http://domain.com:80";

    @Builder.Default
    URI endpoint = URI.create("http://localhost:8080/logger");

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    boolean debugMode = false;

    String dns;

    Boolean cors;

    Boolean https;

    String pageUrl;

    @Builder.Default
    String userAgent = "Java/" + System.getProperty("java.version");

    @Builder.Default
    ZoneId zone = ZoneId.of("Europe/London");

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(10);

    @Builder.Default
    int maxStackLines = 50;

    public List<ConfigurationIssue> validate() {
        List<ConfigurationIssue> issues = new ArrayList<>();
        boolean placeholderDns = dns == null || dns.isBlank() || PLACEHOLDER_DNS.equals(dns);

        if (placeholderDns) {
            issues.add(new ConfigurationIssue(
                    ConfigurationIssue.Severity.WARNING,
                    "DNS is set to default value. Please configure your IPTV provider URL.",
                    "dns"));
        }
        if (Boolean.TRUE.equals(cors) && placeholderDns) {
            issues.add(new ConfigurationIssue(
                    ConfigurationIssue.Severity.ERROR,
                    "CORS is enabled but DNS is not configured. Player will not work.",
                    "dns and cors"));
        }
        return issues;
    }
}
