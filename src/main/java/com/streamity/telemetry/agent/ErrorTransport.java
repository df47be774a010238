package com.streamity.telemetry.agent;

import java.util.concurrent.CompletableFuture;

/**
 * Network hop from a capture agent to the ingestion endpoint.
 */
public interface ErrorTransport {

    /**
     * Start sending one serialized report.
     *
     * @param json report body
     * @return future completing with the HTTP status, or exceptionally on transport failure
     */
    CompletableFuture<Integer> send(String json);
}
