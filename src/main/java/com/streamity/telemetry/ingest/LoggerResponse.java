package com.streamity.telemetry.ingest;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON acknowledgement returned to reporting clients.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoggerResponse(String status, String message, String timestamp) {

    public static LoggerResponse success(String timestamp) {
        return new LoggerResponse("success", "Error logged successfully", timestamp);
    }

    public static LoggerResponse error(String message) {
        return new LoggerResponse("error", message, null);
    }
}
