package com.streamity.telemetry.agent;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Posts reports as JSON with the JDK HTTP client, asynchronously.
 */
public class HttpErrorTransport implements ErrorTransport {

    private final HttpClient client;
    private final URI endpoint;
    private final Duration timeout;

    public HttpErrorTransport(URI endpoint, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), endpoint, timeout);
    }

    public HttpErrorTransport(HttpClient client, URI endpoint, Duration timeout) {
        this.client = client;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<Integer> send(String json) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        return client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(HttpResponse::statusCode);
    }
}
