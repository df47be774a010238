package com.streamity.telemetry.metrics;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong reportsAccepted = new AtomicLong();
    private final AtomicLong reportsRateLimited = new AtomicLong();
    private final AtomicLong reportsInvalid = new AtomicLong();
    private final AtomicLong storageFailures = new AtomicLong();
    private final AtomicLong logRotations = new AtomicLong();

    private final AtomicLong trackedIdentities = new AtomicLong();

    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());

    @Override
    public void onReportAccepted() {
        reportsAccepted.incrementAndGet();
        touch();
    }

    @Override
    public void onReportRateLimited() {
        reportsRateLimited.incrementAndGet();
        touch();
    }

    @Override
    public void onReportInvalid() {
        reportsInvalid.incrementAndGet();
        touch();
    }

    @Override
    public void onStorageFailure() {
        storageFailures.incrementAndGet();
        touch();
    }

    @Override
    public void onLogRotated() {
        logRotations.incrementAndGet();
        touch();
    }

    @Override
    public void onTrackedIdentitiesUpdated(long count) {
        trackedIdentities.set(count);
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                reportsAccepted.get(),
                reportsRateLimited.get(),
                reportsInvalid.get(),
                storageFailures.get(),
                logRotations.get(),
                trackedIdentities.get(),
                lastUpdatedAt.get()
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
