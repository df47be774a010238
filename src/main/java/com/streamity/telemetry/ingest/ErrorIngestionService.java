package com.streamity.telemetry.ingest;

import com.streamity.telemetry.metrics.Metrics;
import com.streamity.telemetry.model.ClientIdentity;
import com.streamity.telemetry.model.ErrorRecord;
import com.streamity.telemetry.model.ErrorRecordParser;
import com.streamity.telemetry.model.InvalidErrorRecordException;
import com.streamity.telemetry.ratelimit.RateLimitStoreException;
import com.streamity.telemetry.ratelimit.RateLimiter;
import com.streamity.telemetry.sanitize.ErrorRecordSanitizer;
import com.streamity.telemetry.store.LogCategory;
import com.streamity.telemetry.store.LogEntryFormatter;
import com.streamity.telemetry.store.LogLevel;
import com.streamity.telemetry.store.LogStore;
import com.streamity.telemetry.store.LogStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Ingestion pipeline for one client report:
 * admit, rotate if needed, parse, sanitize, format, append.
 * <p>
 * Every failure is contained in the returned {@link IngestionResult}; nothing thrown here
 * reaches the caller, and a failed report never touches another caller's state.
 */
@Slf4j
@Service
public class ErrorIngestionService {

    static final String STORAGE_UNAVAILABLE = "Log storage unavailable";

    private static final Pattern HEADER_BREAKING = Pattern.compile("[\\[\\]\\p{Cntrl}]");

    private final RateLimiter rateLimiter;
    private final ErrorRecordParser parser;
    private final ErrorRecordSanitizer sanitizer;
    private final LogStore logStore;
    private final Metrics metrics;
    private final Clock clock;
    private final boolean logDenials;

    public ErrorIngestionService(
            RateLimiter rateLimiter,
            ErrorRecordParser parser,
            ErrorRecordSanitizer sanitizer,
            LogStore logStore,
            Metrics metrics,
            Clock clock,
            @Value("${telemetry.rate-limit.log-denials:false}") boolean logDenials
    ) {
        this.rateLimiter = rateLimiter;
        this.parser = parser;
        this.sanitizer = sanitizer;
        this.logStore = logStore;
        this.metrics = metrics;
        this.clock = clock;
        this.logDenials = logDenials;
    }

    /**
     * Ingest one raw report body.
     *
     * @param body     raw JSON request body
     * @param callerIp network address of the caller
     */
    public IngestionResult ingest(String body, String callerIp) {
        String caller = ClientIdentity.of(callerIp).value();

        if (!admit(caller)) {
            metrics.onReportRateLimited();
            log.warn("Rate limit exceeded for IP: {}", caller);
            if (logDenials) {
                logStore.logEvent(LogCategory.APPLICATION, LogLevel.WARNING, "Rate limit exceeded for IP: " + caller);
            }
            return IngestionResult.rateLimited();
        }

        try {
            logStore.rotateIfOversize(LogCategory.APPLICATION);

            ErrorRecord record = sanitizer.sanitize(parser.parse(body));
            if (record.getMessage() == null || record.getMessage().isBlank()) {
                // nothing left once markup is stripped
                throw new InvalidErrorRecordException(ErrorRecordParser.INVALID_DATA_FORMAT);
            }
            String timestamp = entryTimestamp(record.getTimestamp());
            record = record.toBuilder().timestamp(timestamp).build();

            logStore.append(LogCategory.APPLICATION, LogEntryFormatter.formatClientError(record, caller));
            metrics.onReportAccepted();

            log.debug("Logged client error from {} (source={}, context={})",
                    caller, record.sourceOrDefault(), record.contextOrDefault());
            return IngestionResult.accepted(timestamp);

        } catch (InvalidErrorRecordException e) {
            metrics.onReportInvalid();
            logStore.logEvent(LogCategory.RUNTIME, LogLevel.ERROR, "Failed to log client error: " + e.getMessage());
            return IngestionResult.invalid(e.getMessage());

        } catch (LogStoreException e) {
            metrics.onStorageFailure();
            log.error("Failed to store client error from {}", caller, e);
            logStore.logEvent(LogCategory.RUNTIME, LogLevel.ERROR, "Failed to log client error: " + e.getMessage());
            return IngestionResult.storageFailed(STORAGE_UNAVAILABLE);
        }
    }

    /**
     * The client timestamp goes into the entry header, so it is only kept when it cannot
     * break the header framing. Otherwise server time is used.
     */
    private String entryTimestamp(String clientTimestamp) {
        if (clientTimestamp != null && !clientTimestamp.isBlank()
                && !HEADER_BREAKING.matcher(clientTimestamp).find()) {
            return clientTimestamp;
        }
        if (clientTimestamp != null) {
            log.debug("Replacing unusable client timestamp '{}' with server time", clientTimestamp);
        }
        return LogEntryFormatter.serverTimestamp(clock.instant(), clock.getZone());
    }

    /**
     * A broken counter store must not take telemetry down with it, so it admits.
     */
    private boolean admit(String caller) {
        try {
            return rateLimiter.admit(caller);
        } catch (RateLimitStoreException e) {
            log.error("Rate limiter unavailable, admitting report from {}", caller, e);
            return true;
        }
    }
}
