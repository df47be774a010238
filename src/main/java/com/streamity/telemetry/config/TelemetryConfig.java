package com.streamity.telemetry.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class TelemetryConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Wall clock in the zone used for server-side timestamps (UK time by default).
     * Rate-limit windows only use its instants, so the zone does not affect them.
     */
    @Bean
    public Clock clock(@Value("${telemetry.timezone:Europe/London}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }
}
