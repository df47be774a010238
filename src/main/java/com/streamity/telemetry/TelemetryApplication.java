package com.streamity.telemetry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Error telemetry service for the Streamity web player.
 *
 * Receives failures captured in player clients, rate-limits them per caller,
 * sanitizes them and appends them to rotating plain-text logs.
 */
@Slf4j
@SpringBootApplication
public class TelemetryApplication {

    public static void main(String[] args) {
        log.info("Starting Error Telemetry Application...");
        SpringApplication.run(TelemetryApplication.class, args);
        log.info("Error Telemetry Application started successfully");
    }
}
