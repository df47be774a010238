package com.streamity.telemetry.agent;

/**
 * A problem found in a {@link CaptureAgentConfig}.
 */
public record ConfigurationIssue(Severity severity, String message, String setting) {

    public enum Severity {
        WARNING,
        ERROR
    }
}
