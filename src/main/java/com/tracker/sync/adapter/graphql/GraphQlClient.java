package com.tracker.sync.adapter.graphql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.adapter.TransientIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal GraphQL-over-HTTP client.
 *
 * <p>Rate limiting (HTTP 429 or a {@code RATE_LIMITED} error), server errors and timeouts
 * surface as {@link TransientIOException}; any other failure as {@link TrackerException}.</p>
 *
 * <pre>
 * GraphQlClient client = GraphQlClient.builder()
 *     .endpoint("https://api.github.com/graphql")
 *     .token(System.getenv("GITHUB_TOKEN"))
 *     .timeout(Duration.ofSeconds(180))
 *     .build();
 * JsonNode data = client.execute(query, Map.of("login", "acme"));
 * </pre>
 */
public class GraphQlClient {
    private static final Logger log = LoggerFactory.getLogger(GraphQlClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(180);

    private final URI endpoint;
    private final String token;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private GraphQlClient(Builder builder) {
        this.endpoint = URI.create(Objects.requireNonNull(builder.endpoint, "endpoint is required"));
        this.token = Objects.requireNonNull(builder.token, "token is required");
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs a query or mutation and returns its {@code data} node.
     */
    public JsonNode execute(String query, Map<String, ?> variables) {
        String requestBody = serialize(query, variables);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientIOException("Request to " + endpoint.getHost() + " timed out after " + timeout, e);
        } catch (IOException e) {
            throw new TransientIOException("Request to " + endpoint.getHost() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerException("Interrupted while calling " + endpoint.getHost(), e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientIOException(endpoint.getHost() + " returned status " + status);
        }
        if (status != 200) {
            throw new TrackerException(endpoint.getHost() + " returned status " + status + ": " + response.body());
        }
        return readData(response.body());
    }

    private String serialize(String query, Map<String, ?> variables) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("query", query);
        root.set("variables", objectMapper.valueToTree(variables != null ? variables : Map.of()));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new TrackerException("Could not serialize GraphQL request", e);
        }
    }

    private JsonNode readData(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TrackerException("Malformed GraphQL response from " + endpoint.getHost(), e);
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            StringBuilder messages = new StringBuilder();
            boolean rateLimited = false;
            for (JsonNode error : errors) {
                if ("RATE_LIMITED".equals(error.path("type").asText())) {
                    rateLimited = true;
                }
                if (messages.length() > 0) {
                    messages.append("; ");
                }
                messages.append(error.path("message").asText());
            }
            log.debug("graphql.errors host={} errors={}", endpoint.getHost(), messages);
            if (rateLimited) {
                throw new TransientIOException("Rate limited by " + endpoint.getHost() + ": " + messages);
            }
            throw new TrackerException("GraphQL error from " + endpoint.getHost() + ": " + messages);
        }
        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new TrackerException("GraphQL response from " + endpoint.getHost() + " has no data");
        }
        return data;
    }

    public static class Builder {
        private String endpoint;
        private String token;
        private Duration timeout;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public GraphQlClient build() {
            return new GraphQlClient(this);
        }
    }
}
