package com.streamity.telemetry.model;

/**
 * Raised when an inbound body cannot be turned into an {@link ErrorRecord}.
 */
public class InvalidErrorRecordException extends RuntimeException {

    public InvalidErrorRecordException(String reason) {
        super(reason);
    }

    public InvalidErrorRecordException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
