package com.streamity.telemetry.store;

import com.streamity.telemetry.model.ErrorRecord;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders log entries in the layout log viewers parse.
 * <p>
 * Field order and labels are fixed. A client error entry looks like:
 * <pre>
 * [19/10/2026, 14:03:22] [CLIENT ERROR]
 *   Source: app.js
 *   Context: render
 *   Message: TypeError: x is undefined
 *   URL: https://player.example/live
 *   User Agent: Mozilla/5.0
 *   DNS: https://iptv.example
 *   CORS: true
 *   HTTPS: false
 *   Stack Trace:
 *     at render (app.js:10:5)
 *   IP: 203.0.113.7
 * --------------------------------------------------------------------------------
 * </pre>
 */
public final class LogEntryFormatter {

    public static final String UNKNOWN = "Unknown";
    public static final String SEPARATOR = "-".repeat(80);
    public static final DateTimeFormatter SERVER_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");

    static final String FIELD_INDENT = "  ";
    static final String STACK_INDENT = "    ";
    static final String STACK_HEADER = "Stack Trace:";

    private LogEntryFormatter() {
    }

    public static String serverTimestamp(Instant instant, ZoneId zone) {
        return SERVER_TIME.format(instant.atZone(zone));
    }

    /**
     * Multi-line entry for one accepted client error. The record must already be sanitized
     * and carry its final timestamp.
     */
    public static String formatClientError(ErrorRecord record, String ip) {
        StringBuilder sb = new StringBuilder(512);
        sb.append('[').append(record.getTimestamp()).append("] [").append(LogLevel.CLIENT_ERROR.tag()).append("]\n");
        field(sb, "Source", record.sourceOrDefault());
        field(sb, "Context", record.contextOrDefault());
        field(sb, "Message", record.getMessage());
        field(sb, "URL", orUnknown(record.getPageUrl()));
        field(sb, "User Agent", orUnknown(record.getUserAgent()));
        field(sb, "DNS", orUnknown(record.getEndpointDns()));
        field(sb, "CORS", flag(record.getCorsEnabled()));
        field(sb, "HTTPS", flag(record.getHttpsEnabled()));

        if (record.hasStackTrace()) {
            sb.append(FIELD_INDENT).append(STACK_HEADER).append('\n');
            for (String line : record.getStackTrace()) {
                sb.append(STACK_INDENT).append(line.trim()).append('\n');
            }
        }

        field(sb, "IP", orUnknown(ip));
        sb.append(SEPARATOR).append('\n');
        return sb.toString();
    }

    /**
     * Single-line service event, e.g. {@code [19/10/2026 14:03:22] [WARNING] Rate limit exceeded for IP: 10.0.0.1}.
     */
    public static String formatEvent(String timestamp, LogLevel level, String message) {
        String flat = message == null ? "" : message.replaceAll("\\R", " ");
        return "[" + timestamp + "] [" + level.tag() + "] " + flat + "\n";
    }

    private static void field(StringBuilder sb, String label, String value) {
        sb.append(FIELD_INDENT).append(label).append(": ").append(value).append('\n');
    }

    private static String orUnknown(String value) {
        return value == null || value.isEmpty() ? UNKNOWN : value;
    }

    private static String flag(Boolean value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value ? "true" : "false";
    }
}
