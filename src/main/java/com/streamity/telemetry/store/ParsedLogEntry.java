package com.streamity.telemetry.store;

import java.util.List;
import java.util.Map;

/**
 * One entry read back from a log file.
 *
 * Single-line events carry their text in {@code message} and have no fields.
 * Client error entries carry labeled fields in file order and their stack lines.
 */
public record ParsedLogEntry(
        String timestamp,
        String level,
        String message,
        Map<String, String> fields,
        List<String> stackTrace
) {

    public String field(String label) {
        return fields.get(label);
    }

    public boolean isClientError() {
        return LogLevel.CLIENT_ERROR.tag().equals(level);
    }
}
