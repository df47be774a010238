package com.streamity.telemetry.ingest;

/**
 * Outcome of ingesting one report.
 */
public record IngestionResult(Outcome outcome, String timestamp, String reason) {

    public enum Outcome {
        ACCEPTED,
        RATE_LIMITED,
        INVALID,
        STORAGE_FAILED
    }

    public static IngestionResult accepted(String timestamp) {
        return new IngestionResult(Outcome.ACCEPTED, timestamp, null);
    }

    public static IngestionResult rateLimited() {
        return new IngestionResult(Outcome.RATE_LIMITED, null, "Rate limit exceeded");
    }

    public static IngestionResult invalid(String reason) {
        return new IngestionResult(Outcome.INVALID, null, reason);
    }

    public static IngestionResult storageFailed(String reason) {
        return new IngestionResult(Outcome.STORAGE_FAILED, null, reason);
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
