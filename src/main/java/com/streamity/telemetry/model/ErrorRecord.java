package com.streamity.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One failure observed by a player client.
 *
 * Built once at the moment of failure, sent once, and on the server turned into
 * exactly one immutable log entry. Only {@code message} is mandatory.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorRecord {

    public static final String DEFAULT_SOURCE = "Unknown";
    public static final String DEFAULT_CONTEXT = "General";

    @JsonProperty("timestamp")
    String timestamp;

    @JsonProperty("message")
    String message;

    @JsonProperty("source")
    String source;

    @JsonProperty("context")
    String context;

    @JsonProperty("userAgent")
    String userAgent;

    @JsonProperty("url")
    String pageUrl;

    @JsonProperty("dns")
    String endpointDns;

    @JsonProperty("cors")
    Boolean corsEnabled;

    @JsonProperty("https")
    Boolean httpsEnabled;

    @JsonProperty("stack")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @Builder.Default
    List<String> stackTrace = List.of();

    public String sourceOrDefault() {
        return source != null ? source : DEFAULT_SOURCE;
    }

    public String contextOrDefault() {
        return context != null ? context : DEFAULT_CONTEXT;
    }

    public boolean hasStackTrace() {
        return stackTrace != null && !stackTrace.isEmpty();
    }
}
