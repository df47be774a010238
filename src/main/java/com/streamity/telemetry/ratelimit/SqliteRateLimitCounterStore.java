package com.streamity.telemetry.ratelimit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Counter store backed by an embedded SQLite database, so windows survive restarts.
 * <p>
 * A single connection is shared; updates are synchronized on the store.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "telemetry.rate-limit.store", havingValue = "sqlite")
public class SqliteRateLimitCounterStore implements RateLimitCounterStore {

    private final String databasePath;

    private Connection connection;
    private PreparedStatement selectStatement;
    private PreparedStatement upsertStatement;
    private PreparedStatement countStatement;

    public SqliteRateLimitCounterStore(
            @Value("${telemetry.rate-limit.sqlite-path:./data/rate_limits.db}") String databasePath
    ) {
        this.databasePath = databasePath;
    }

    @PostConstruct
    public void initialize() throws SQLException {
        log.info("Initializing rate limit counter store with database: {}", databasePath);

        File dbFile = new File(databasePath).getAbsoluteFile();
        if (dbFile.getParentFile() != null) {
            dbFile.getParentFile().mkdirs();
        }

        connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile.getPath());
        connection.setAutoCommit(true);

        createTable();

        selectStatement = connection.prepareStatement(
                "SELECT window_start_ms, request_count FROM rate_limit_counters WHERE identity = ?");
        upsertStatement = connection.prepareStatement("""
            INSERT OR REPLACE INTO rate_limit_counters (identity, window_start_ms, request_count)
            VALUES (?, ?, ?)
            """);
        countStatement = connection.prepareStatement("SELECT COUNT(*) FROM rate_limit_counters");

        log.info("Rate limit counter store initialized successfully");
    }

    private void createTable() throws SQLException {
        String createTableSql = """
            CREATE TABLE IF NOT EXISTS rate_limit_counters (
                identity TEXT PRIMARY KEY,
                window_start_ms INTEGER NOT NULL,
                request_count INTEGER NOT NULL
            )
            """;

        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
        }
    }

    @Override
    public synchronized RateLimitCounter update(String identity, UnaryOperator<RateLimitCounter> transition) {
        RateLimitCounter current = load(identity);
        RateLimitCounter next = transition.apply(current);
        if (next == null || next.equals(current)) {
            return current;
        }
        try {
            upsertStatement.setString(1, next.identity());
            upsertStatement.setLong(2, next.windowStart().toEpochMilli());
            upsertStatement.setInt(3, next.count());
            upsertStatement.executeUpdate();
            return next;
        } catch (SQLException e) {
            log.error("Failed to save rate limit counter for {}", identity, e);
            throw new RateLimitStoreException("Rate limit counter write failed", e);
        }
    }

    @Override
    public synchronized Optional<RateLimitCounter> find(String identity) {
        return Optional.ofNullable(load(identity));
    }

    @Override
    public synchronized long size() {
        try (ResultSet rs = countStatement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RateLimitStoreException("Rate limit counter count failed", e);
        }
    }

    private RateLimitCounter load(String identity) {
        try {
            selectStatement.setString(1, identity);
            try (ResultSet rs = selectStatement.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new RateLimitCounter(
                        identity,
                        Instant.ofEpochMilli(rs.getLong("window_start_ms")),
                        rs.getInt("request_count"));
            }
        } catch (SQLException e) {
            log.error("Failed to load rate limit counter for {}", identity, e);
            throw new RateLimitStoreException("Rate limit counter read failed", e);
        }
    }

    @PreDestroy
    public void close() {
        try {
            if (selectStatement != null) {
                selectStatement.close();
            }
            if (upsertStatement != null) {
                upsertStatement.close();
            }
            if (countStatement != null) {
                countStatement.close();
            }
            if (connection != null) {
                connection.close();
            }
            log.info("Rate limit counter store closed");
        } catch (SQLException e) {
            log.error("Error closing rate limit counter store", e);
        }
    }
}
