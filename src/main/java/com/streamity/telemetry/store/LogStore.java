package com.streamity.telemetry.store;

import com.streamity.telemetry.metrics.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, size-bounded plain-text logs, one active file per {@link LogCategory}.
 * <p>
 * All writes of a category go through a single lock, so the rotate-check and the append
 * form one step and entries are totally ordered within the category. The OS-level file
 * lock additionally keeps other processes writing the same file from interleaving bytes.
 * Categories never block each other.
 * <p>
 * Rotation renames the active file to {@code <name>.<yyyyMMdd_HHmmss UTC>.old}; the next
 * append creates a fresh active file. Rotated files are never opened for writing again.
 */
@Slf4j
@Component
public class LogStore {

    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 10L * 1024 * 1024;

    private static final DateTimeFormatter ROTATION_SUFFIX =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Map<LogCategory, Path> activeFiles;
    private final Map<LogCategory, ReentrantLock> locks = new EnumMap<>(LogCategory.class);
    private final long maxFileSizeBytes;
    private final boolean loggingEnabled;
    private final Clock clock;
    private final Metrics metrics;

    @Autowired
    public LogStore(
            @Value("${telemetry.log.dir:./logs}") String logDir,
            @Value("${telemetry.log.application-file:app_errors.log}") String applicationFile,
            @Value("${telemetry.log.runtime-file:runtime_errors.log}") String runtimeFile,
            @Value("${telemetry.log.database-file:database_errors.log}") String databaseFile,
            @Value("${telemetry.log.max-file-size-bytes:10485760}") long maxFileSizeBytes,
            @Value("${telemetry.logging-enabled:true}") boolean loggingEnabled,
            Clock clock,
            Metrics metrics
    ) {
        this(fileMap(Paths.get(logDir), applicationFile, runtimeFile, databaseFile),
                maxFileSizeBytes, loggingEnabled, clock, metrics);
    }

    public LogStore(Path logDir, long maxFileSizeBytes, boolean loggingEnabled, Clock clock, Metrics metrics) {
        this(fileMap(logDir,
                        LogCategory.APPLICATION.defaultFileName(),
                        LogCategory.RUNTIME.defaultFileName(),
                        LogCategory.DATABASE.defaultFileName()),
                maxFileSizeBytes, loggingEnabled, clock, metrics);
    }

    private LogStore(Map<LogCategory, Path> activeFiles, long maxFileSizeBytes, boolean loggingEnabled,
                     Clock clock, Metrics metrics) {
        this.activeFiles = Collections.unmodifiableMap(activeFiles);
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.loggingEnabled = loggingEnabled;
        this.clock = clock;
        this.metrics = metrics;
        for (LogCategory category : LogCategory.values()) {
            locks.put(category, new ReentrantLock());
        }
        log.info("Initialized LogStore with files {} (rotation above {} bytes, events {})",
                activeFiles, maxFileSizeBytes, loggingEnabled ? "enabled" : "disabled");
    }

    /**
     * Append one fully formatted entry to the category's active file, rotating first if oversize.
     *
     * @throws LogStoreException if the file cannot be rotated or written
     */
    public void append(LogCategory category, String entryText) {
        ReentrantLock lock = locks.get(category);
        lock.lock();
        try {
            rotateIfOversizeLocked(category);
            write(activeFiles.get(category), entryText);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rotate the category's active file if it is larger than the configured ceiling.
     *
     * @return the path of the rotated file, or empty if no rotation was needed
     * @throws LogStoreException if the rename fails
     */
    public Optional<Path> rotateIfOversize(LogCategory category) {
        ReentrantLock lock = locks.get(category);
        lock.lock();
        try {
            return rotateIfOversizeLocked(category);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record a single-line service event. Mirrored to the application logger; written to the
     * file only when event logging is enabled. Storage failures are reported, never thrown.
     */
    public void logEvent(LogCategory category, LogLevel level, String message) {
        switch (level) {
            case ERROR -> log.error("[Streamity] {}: {}", level.tag(), message);
            case WARNING -> log.warn("[Streamity] {}: {}", level.tag(), message);
            default -> log.info("[Streamity] {}: {}", level.tag(), message);
        }
        if (!loggingEnabled) {
            return;
        }
        String line = LogEntryFormatter.formatEvent(
                LogEntryFormatter.serverTimestamp(clock.instant(), clock.getZone()), level, message);
        try {
            append(category, line);
        } catch (LogStoreException e) {
            log.error("Failed to write {} event to {} log", level.tag(), category, e);
        }
    }

    public Path activeFile(LogCategory category) {
        return activeFiles.get(category);
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public boolean isLoggingEnabled() {
        return loggingEnabled;
    }

    private Optional<Path> rotateIfOversizeLocked(LogCategory category) {
        Path active = activeFiles.get(category);
        try {
            if (!Files.exists(active) || Files.size(active) <= maxFileSizeBytes) {
                return Optional.empty();
            }
            Path rotated = rotatedName(active);
            try {
                Files.move(active, rotated, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(active, rotated);
            }
            metrics.onLogRotated();
            log.info("Rotated {} log to {}", category, rotated);

            if (loggingEnabled) {
                write(active, LogEntryFormatter.formatEvent(
                        LogEntryFormatter.serverTimestamp(clock.instant(), clock.getZone()),
                        LogLevel.INFO,
                        "Log file rotated to: " + rotated));
            }
            return Optional.of(rotated);
        } catch (IOException e) {
            throw new LogStoreException("Failed to rotate " + active, e);
        }
    }

    private Path rotatedName(Path active) {
        String base = active.getFileName() + "." + ROTATION_SUFFIX.format(clock.instant());
        Path candidate = active.resolveSibling(base + ".old");
        int n = 1;
        while (Files.exists(candidate)) {
            candidate = active.resolveSibling(base + "-" + n++ + ".old");
        }
        return candidate;
    }

    private static void write(Path file, String text) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ByteBuffer buffer = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                 FileLock fileLock = channel.lock()) {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
        } catch (IOException e) {
            throw new LogStoreException("Failed to append to " + file, e);
        }
    }

    private static Map<LogCategory, Path> fileMap(Path dir, String application, String runtime, String database) {
        Map<LogCategory, Path> files = new EnumMap<>(LogCategory.class);
        files.put(LogCategory.APPLICATION, dir.resolve(application));
        files.put(LogCategory.RUNTIME, dir.resolve(runtime));
        files.put(LogCategory.DATABASE, dir.resolve(database));
        return files;
    }
}
