package com.autowake.core.health;

import com.autowake.core.catalog.ReadinessProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Readiness probe that issues a GET (e.g. {@code /api/tags} on the inference runtime,
 * {@code /collections} on the vector store) and treats any 2xx answer as ready.
 */
public class HttpReadinessProbe implements ReadinessProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpReadinessProbe.class);

    private final HttpClient httpClient;
    private final URI uri;
    private final Duration timeout;

    public HttpReadinessProbe(HttpClient httpClient, String url, Duration timeout) {
        this.httpClient = httpClient;
        this.uri = URI.create(url);
        this.timeout = timeout;
    }

    @Override
    public boolean isReady() {
        var request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            int code = response.statusCode();
            return code >= 200 && code < 300;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException e) {
            log.debug("Readiness probe {} failed: {}", uri, e.getMessage());
            return false;
        }
    }

    public URI getUri() {
        return uri;
    }

    @Override
    public String toString() {
        return "GET " + uri;
    }
}
