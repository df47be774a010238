package com.streamity.telemetry.ingest;

import com.streamity.telemetry.store.LogCategory;
import com.streamity.telemetry.store.LogLevel;
import com.streamity.telemetry.store.LogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Any runtime exception escaping a handler is recorded in the runtime log
 * and answered with a JSON error instead of a container error page.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class TelemetryExceptionHandler {

    private final LogStore logStore;

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<LoggerResponse> handleUnexpected(RuntimeException e) {
        log.error("Unhandled exception while serving request", e);
        logStore.logEvent(LogCategory.RUNTIME, LogLevel.ERROR,
                "Unhandled " + e.getClass().getSimpleName() + ": " + e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(LoggerResponse.error("Internal server error"));
    }
}
