package com.streamity.telemetry.ratelimit;

/**
 * The persistent counter store failed.
 */
public class RateLimitStoreException extends RuntimeException {

    public RateLimitStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
