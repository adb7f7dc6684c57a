package com.dvc.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal JSON client for the engine's REST API, used by the CLI commands.
 */
@Component
public class ApiClient {

    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(3);

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public ApiClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public Response get(String server, String path) {
        return send(builder(server, path).GET().build());
    }

    public Response delete(String server, String path) {
        return send(builder(server, path).DELETE().build());
    }

    public Response post(String server, String path, Object body) {
        try {
            String json = objectMapper.writeValueAsString(body);
            return send(builder(server, path)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build());
        } catch (IOException e) {
            throw new ApiException("Could not encode request: " + e.getMessage(), e);
        }
    }

    private HttpRequest.Builder builder(String server, String path) {
        String base = server.endsWith("/") ? server.substring(0, server.length() - 1) : server;
        return HttpRequest.newBuilder()
                .uri(URI.create(base + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json");
    }

    private Response send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            String body = response.body();
            JsonNode json = body == null || body.isBlank()
                    ? objectMapper.nullNode()
                    : objectMapper.readTree(body);
            return new Response(response.statusCode(), json);
        } catch (ConnectException e) {
            throw new ApiException("Cannot connect to DVC engine at " + request.uri().getHost()
                    + ":" + request.uri().getPort() + ". Start it first: dvc serve", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("Interrupted", e);
        } catch (IOException e) {
            throw new ApiException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        }
    }

    public record Response(int status, JsonNode body) {

        public boolean ok() {
            return status >= 200 && status < 300;
        }

        /**
         * The {@code message} of an error body, or the HTTP status when there is none.
         */
        public String errorMessage() {
            if (body != null && body.hasNonNull("message")) {
                return body.get("message").asText();
            }
            return "HTTP " + status;
        }
    }

    public static class ApiException extends RuntimeException {
        public ApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
