package com.streamity.telemetry.ratelimit;

import java.time.Instant;

/**
 * Admission state of one caller identity inside its current fixed window.
 */
public record RateLimitCounter(String identity, Instant windowStart, int count) {

    public static RateLimitCounter start(String identity, Instant now) {
        return new RateLimitCounter(identity, now, 1);
    }

    public RateLimitCounter increment() {
        return new RateLimitCounter(identity, windowStart, count + 1);
    }
}
