package com.streamity.telemetry.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamity.telemetry.model.ErrorRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client-side capture of failures the host application did not handle itself.
 * <p>
 * Reports are best effort: {@link #report(Object, String, String)} never throws and never
 * waits for the network. Transport failures are dropped after a debug log line.
 * <p>
 * Typical wiring in a player process:
 * <pre>{@code
 * ErrorCaptureAgent agent = new ErrorCaptureAgent(config);
 * agent.installGlobalHandlers();
 * agent.reportConfigurationIssues();
 * }</pre>
 */
@Slf4j
public class ErrorCaptureAgent {

    static final String GLOBAL_CONTEXT = "Global Error Handler";
    static final String REJECTION_SOURCE = "CompletableFuture";
    static final String REJECTION_CONTEXT = "Unhandled Promise Rejection";
    static final String UNKNOWN_FILE = "Unknown file";

    private static final DateTimeFormatter CLIENT_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy, HH:mm:ss");

    // process-wide, whichever agent installs first owns the hooks
    private static final AtomicBoolean GLOBAL_HANDLERS_INSTALLED = new AtomicBoolean(false);
    private static volatile Thread.UncaughtExceptionHandler previousHandler;

    private final CaptureAgentConfig config;
    private final ErrorTransport transport;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorCaptureAgent(CaptureAgentConfig config) {
        this(config,
                new HttpErrorTransport(config.getEndpoint(), config.getRequestTimeout()),
                new ObjectMapper(),
                Clock.system(config.getZone()));
    }

    public ErrorCaptureAgent(CaptureAgentConfig config, ErrorTransport transport, ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Install the uncaught-exception handler and the unhandled-rejection listener.
     * Only the first call in the process installs anything.
     *
     * @return true if this call installed the handlers
     */
    public boolean installGlobalHandlers() {
        if (!GLOBAL_HANDLERS_INSTALLED.compareAndSet(false, true)) {
            log.debug("Global error handlers already installed");
            return false;
        }

        Thread.UncaughtExceptionHandler previous = Thread.getDefaultUncaughtExceptionHandler();
        previousHandler = previous;
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            report(throwable, sourceOf(throwable), GLOBAL_CONTEXT);
            if (previous != null) {
                previous.uncaughtException(thread, throwable);
            } else {
                System.err.print("Exception in thread \"" + thread.getName() + "\" ");
                throwable.printStackTrace(System.err);
            }
        });
        UnhandledRejections.setListener(failure -> report(failure, REJECTION_SOURCE, REJECTION_CONTEXT));

        log.info("Installed global error handlers (endpoint={}, enabled={})", config.getEndpoint(), config.isEnabled());
        return true;
    }

    /**
     * Remove the handlers and restore the previous default handler.
     */
    static void uninstallGlobalHandlers() {
        if (GLOBAL_HANDLERS_INSTALLED.compareAndSet(true, false)) {
            Thread.setDefaultUncaughtExceptionHandler(previousHandler);
            previousHandler = null;
            UnhandledRejections.clearListener();
        }
    }

    /**
     * Report a failure to the ingestion endpoint without blocking.
     *
     * @param error   a {@link Throwable}, or any value describing the failure
     * @param source  where the failure happened (file, component), may be null
     * @param context what the application was doing, may be null
     */
    public void report(Object error, String source, String context) {
        if (!config.isEnabled()) {
            return;
        }
        try {
            ErrorRecord record = buildRecord(error, source, context);
            log.warn("ERROR LOGGED [{}] source={} context={} message={}",
                    record.getTimestamp(), record.getSource(), record.getContext(), record.getMessage());

            String json = objectMapper.writeValueAsString(record);
            CompletableFuture<Integer> pending = transport.send(json);
            if (pending != null) {
                pending.whenComplete((status, failure) -> {
                    if (failure != null) {
                        transportFailed(failure);
                    } else if (status >= 300) {
                        log.debug("Server logger answered HTTP {}", status);
                    }
                });
            }
        } catch (Exception e) {
            transportFailed(e);
        }
    }

    /**
     * Log configuration problems and, if there are any, report them as one record.
     */
    public List<ConfigurationIssue> reportConfigurationIssues() {
        List<ConfigurationIssue> issues = config.validate();
        if (issues.isEmpty()) {
            log.debug("Configuration validated successfully");
            return issues;
        }
        for (ConfigurationIssue issue : issues) {
            log.warn("{}: {} (setting: {})", issue.severity(), issue.message(), issue.setting());
        }
        report(issues.size() + " configuration issue(s) detected", "config", "Configuration Validation");
        return issues;
    }

    ErrorRecord buildRecord(Object error, String source, String context) {
        String message;
        List<String> stack = List.of();

        if (error instanceof Throwable t) {
            message = t.getMessage() != null && !t.getMessage().isBlank() ? t.getMessage() : t.toString();
            stack = stackLines(t);
        } else {
            message = error == null ? null : String.valueOf(error);
        }
        if (message == null || message.isBlank()) {
            message = "Unknown error";
        }

        return ErrorRecord.builder()
                .timestamp(CLIENT_TIME.format(clock.instant().atZone(clock.getZone())))
                .message(message)
                .source(source != null ? source : ErrorRecord.DEFAULT_SOURCE)
                .context(context != null ? context : ErrorRecord.DEFAULT_CONTEXT)
                .userAgent(config.getUserAgent())
                .pageUrl(config.getPageUrl())
                .endpointDns(config.getDns())
                .corsEnabled(config.getCors())
                .httpsEnabled(config.getHttps())
                .stackTrace(stack)
                .build();
    }

    private List<String> stackLines(Throwable throwable) {
        List<String> lines = new ArrayList<>();
        Throwable current = throwable;
        boolean first = true;
        while (current != null && lines.size() < config.getMaxStackLines()) {
            lines.add(first ? current.toString() : "Caused by: " + current);
            for (StackTraceElement frame : current.getStackTrace()) {
                if (lines.size() >= config.getMaxStackLines()) {
                    break;
                }
                lines.add("at " + frame);
            }
            current = current.getCause() == current ? null : current.getCause();
            first = false;
        }
        return List.copyOf(lines);
    }

    private static String sourceOf(Throwable throwable) {
        StackTraceElement[] frames = throwable.getStackTrace();
        if (frames.length == 0 || frames[0].getFileName() == null) {
            return UNKNOWN_FILE;
        }
        return frames[0].getFileName();
    }

    private void transportFailed(Throwable failure) {
        if (config.isDebugMode()) {
            log.info("Note: Could not send error to server logger", failure);
        } else {
            log.debug("Could not send error to server logger", failure);
        }
    }
}
