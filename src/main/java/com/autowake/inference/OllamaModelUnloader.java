package com.autowake.inference;

import com.autowake.core.idle.ModelUnloader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Unloads models from Ollama by sending a generate request with a zero keep-alive.
 *
 * <p>Ollama has not been consistent about which literal it accepts for "zero" keep-alive,
 * so the encodings in {@link #ZERO_KEEP_ALIVE_ENCODINGS} are tried in order until one
 * is answered with 200.
 */
public class OllamaModelUnloader implements ModelUnloader {

    private static final Logger log = LoggerFactory.getLogger(OllamaModelUnloader.class);

    static final List<Object> ZERO_KEEP_ALIVE_ENCODINGS = List.of(0, "0s", "0m");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI generateUri;
    private final Duration timeout;

    public OllamaModelUnloader(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.generateUri = URI.create(stripTrailingSlash(baseUrl) + "/api/generate");
        this.timeout = timeout;
    }

    @Override
    public boolean unload(String modelName) {
        for (Object keepAlive : ZERO_KEEP_ALIVE_ENCODINGS) {
            try {
                int status = post(modelName, keepAlive);
                if (status == 200) {
                    log.debug("Model {} unloaded with keep_alive={}", modelName, keepAlive);
                    return true;
                }
                log.debug("Unload of {} with keep_alive={} returned {}", modelName, keepAlive, status);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (IOException e) {
                log.debug("Unload of {} with keep_alive={} failed: {}", modelName, keepAlive, e.getMessage());
            }
        }
        log.warn("All keep_alive encodings rejected when unloading {}", modelName);
        return false;
    }

    private int post(String modelName, Object keepAlive) throws IOException, InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", modelName);
        if (keepAlive instanceof Integer number) {
            body.put("keep_alive", number);
        } else {
            body.put("keep_alive", keepAlive.toString());
        }

        var request = HttpRequest.newBuilder(generateUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
