package com.streamity.telemetry.ratelimit;

import com.streamity.telemetry.metrics.Metrics;
import com.streamity.telemetry.model.ClientIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-window admission control per caller identity.
 * <p>
 * Each identity may be admitted {@code maxRequests} times per window. The window starts
 * with the first admitted request and is replaced once more than {@code window} has
 * elapsed since its start. Denied requests do not count.
 */
@Slf4j
@Component
public class RateLimiter {

    private final RateLimitCounterStore store;
    private final Clock clock;
    private final Metrics metrics;
    private final Duration window;
    private final int maxRequests;

    public RateLimiter(
            RateLimitCounterStore store,
            Clock clock,
            Metrics metrics,
            @Value("${telemetry.rate-limit.window-seconds:60}") long windowSeconds,
            @Value("${telemetry.rate-limit.max-requests:10}") int maxRequests
    ) {
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
        this.window = Duration.ofSeconds(windowSeconds);
        this.maxRequests = maxRequests;
        log.info("Initialized RateLimiter: {} requests per {} seconds", maxRequests, windowSeconds);
    }

    /**
     * Decide whether the identity may log one more report now.
     *
     * @param identity caller identity; null or malformed values share the "unknown" identity
     * @return true if admitted
     */
    public boolean admit(String identity) {
        String key = ClientIdentity.of(identity).value();
        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean(false);

        RateLimitCounter counter = store.update(key, current -> {
            if (current == null || isExpired(current, now)) {
                if (maxRequests <= 0) {
                    admitted.set(false);
                    return current;
                }
                admitted.set(true);
                return RateLimitCounter.start(key, now);
            }
            if (current.count() < maxRequests) {
                admitted.set(true);
                return current.increment();
            }
            admitted.set(false);
            return current;
        });
        metrics.onTrackedIdentitiesUpdated(store.size());

        if (counter != null) {
            log.debug("Rate limit for {}: count={} windowStart={} admitted={}",
                    key, counter.count(), counter.windowStart(), admitted.get());
        }
        return admitted.get();
    }

    private boolean isExpired(RateLimitCounter counter, Instant now) {
        return Duration.between(counter.windowStart(), now).compareTo(window) > 0;
    }

    public Duration getWindow() {
        return window;
    }

    public int getMaxRequests() {
        return maxRequests;
    }
}
