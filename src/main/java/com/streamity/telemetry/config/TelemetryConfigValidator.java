package com.streamity.telemetry.config;

import com.streamity.telemetry.ratelimit.RateLimiter;
import com.streamity.telemetry.store.LogCategory;
import com.streamity.telemetry.store.LogLevel;
import com.streamity.telemetry.store.LogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the telemetry settings once the application is up and records the outcome
 * in the application log, followed by a one-line configuration summary.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelemetryConfigValidator {

    private final LogStore logStore;
    private final RateLimiter rateLimiter;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        validate();
        logStore.logEvent(LogCategory.APPLICATION, LogLevel.INFO, summary());
    }

    /**
     * @return the problems found, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> issues = new ArrayList<>();

        if (rateLimiter.getMaxRequests() <= 0) {
            issues.add("Rate limit ceiling must be positive (all reports would be rejected)");
        }
        if (rateLimiter.getWindow().isZero() || rateLimiter.getWindow().isNegative()) {
            issues.add("Rate limit window must be positive");
        }
        if (logStore.getMaxFileSizeBytes() <= 0) {
            issues.add("Log rotation size must be positive (every append would rotate)");
        }
        for (LogCategory category : LogCategory.values()) {
            Path dir = logStore.activeFile(category).toAbsolutePath().getParent();
            if (!isWritableDirectory(dir)) {
                issues.add("Log directory is not writable: " + dir);
            }
        }

        for (String issue : issues) {
            logStore.logEvent(LogCategory.APPLICATION, LogLevel.WARNING, issue);
        }
        if (issues.isEmpty()) {
            logStore.logEvent(LogCategory.APPLICATION, LogLevel.INFO, "Configuration validation passed");
        } else {
            logStore.logEvent(LogCategory.APPLICATION, LogLevel.WARNING,
                    "Configuration validation found " + issues.size() + " issue(s): " + String.join(", ", issues));
        }
        return issues;
    }

    String summary() {
        return "Configuration loaded - Logs: " + logStore.activeFile(LogCategory.APPLICATION).toAbsolutePath().getParent()
                + ", Rate limit: " + rateLimiter.getMaxRequests() + "/" + rateLimiter.getWindow().toSeconds() + "s"
                + ", Rotation: " + logStore.getMaxFileSizeBytes() + " bytes"
                + ", Events: " + (logStore.isLoggingEnabled() ? "enabled" : "disabled");
    }

    private static boolean isWritableDirectory(Path dir) {
        if (dir == null) {
            return false;
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.warn("Cannot create log directory {}", dir, e);
            return false;
        }
        return Files.isWritable(dir);
    }
}
