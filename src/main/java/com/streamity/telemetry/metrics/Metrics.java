package com.streamity.telemetry.metrics;

/**
 * Lightweight metrics API used by the ingestion pipeline and exposed via /metrics.
 */
public interface Metrics {

    void onReportAccepted();

    void onReportRateLimited();

    void onReportInvalid();

    void onStorageFailure();

    void onLogRotated();

    void onTrackedIdentitiesUpdated(long count);

    MetricsSnapshot snapshot();
}
