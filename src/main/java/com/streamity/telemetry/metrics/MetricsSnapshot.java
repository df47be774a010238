package com.streamity.telemetry.metrics;

import java.time.Instant;

/**
 * Immutable snapshot of ingestion metrics.
 *
 * This is a READ MODEL:
 * - No logic
 * - Counters only grow, gauges reflect the last reported value
 */
public record MetricsSnapshot(

        /* -------- Outcomes -------- */
        long reportsAccepted,
        long reportsRateLimited,
        long reportsInvalid,
        long storageFailures,

        /* -------- Storage -------- */
        long logRotations,

        /* -------- Rate limiter state -------- */
        long trackedIdentities,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
