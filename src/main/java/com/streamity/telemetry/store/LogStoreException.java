package com.streamity.telemetry.store;

/**
 * A log file could not be written or rotated.
 */
public class LogStoreException extends RuntimeException {

    public LogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
