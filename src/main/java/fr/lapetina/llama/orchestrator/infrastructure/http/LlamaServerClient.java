package fr.lapetina.llama.orchestrator.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;
import fr.lapetina.llama.orchestrator.domain.model.TokenCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * HTTP client for a running llama-server process.
 *
 * Uses java.net.http.HttpClient. Every call has its own timeout, short for
 * probes and long for generation. Failures come back as {@link OperationResult}
 * values; nothing here throws for network or HTTP errors.
 */
public class LlamaServerClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlamaServerClient.class);

    /** Status codes meaning the server was built without the endpoint. */
    private static final Set<Integer> MISSING_ENDPOINT = Set.of(404, 405, 501);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Timeouts timeouts;

    public LlamaServerClient(Timeouts timeouts) {
        this.timeouts = timeouts;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeouts.connect())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public LlamaServerClient() {
        this(Timeouts.defaults());
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * GET /health. Succeeds only on HTTP 200; llama-server answers 503 while the model is loading.
     */
    public OperationResult<JsonNode> health(URI baseUrl) {
        return getJson(baseUrl, "/health", timeouts.health());
    }

    /**
     * Health probe reduced to a boolean.
     */
    public boolean isHealthy(URI baseUrl) {
        OperationResult<JsonNode> result = health(baseUrl);
        if (result.isFailure()) {
            log.debug("Health probe failed: baseUrl={}, error={}", baseUrl, result.message());
        }
        return result.success();
    }

    /**
     * GET /info.
     */
    public OperationResult<JsonNode> info(URI baseUrl) {
        return getJson(baseUrl, "/info", timeouts.info());
    }

    /**
     * GET /metrics as Prometheus text.
     */
    public OperationResult<String> metrics(URI baseUrl) {
        HttpRequest request = HttpRequest.newBuilder(resolve(baseUrl, "/metrics"))
                .timeout(timeouts.info())
                .GET()
                .build();
        return send(request, "/metrics");
    }

    /**
     * GET /v1/models.
     */
    public OperationResult<JsonNode> models(URI baseUrl) {
        return getJson(baseUrl, "/v1/models", timeouts.info());
    }

    /**
     * POST /v1/completions with {@code stream=false}.
     */
    public OperationResult<JsonNode> completion(URI baseUrl, Map<String, Object> body) {
        return postJson(baseUrl, "/v1/completions", withStream(body, false), timeouts.generation());
    }

    /**
     * POST /v1/chat/completions with {@code stream=false}.
     */
    public OperationResult<JsonNode> chatCompletion(URI baseUrl, Map<String, Object> body) {
        return postJson(baseUrl, "/v1/chat/completions", withStream(body, false), timeouts.generation());
    }

    /**
     * POST /v1/chat/completions with {@code stream=true}. The returned stream
     * owns the connection and must be exhausted or closed.
     */
    public OperationResult<SseChunkStream> chatCompletionStream(URI baseUrl, Map<String, Object> body) {
        return postStream(baseUrl, "/v1/chat/completions", body);
    }

    /**
     * POST /v1/completions with {@code stream=true}.
     */
    public OperationResult<SseChunkStream> completionStream(URI baseUrl, Map<String, Object> body) {
        return postStream(baseUrl, "/v1/completions", body);
    }

    /**
     * POST /v1/embeddings.
     */
    public OperationResult<JsonNode> embeddings(URI baseUrl, Map<String, Object> body) {
        return postJson(baseUrl, "/v1/embeddings", body, timeouts.embeddings());
    }

    /**
     * POST /tokenize and count the returned tokens. Falls back to a
     * character-based estimate only when the server has no usable tokenize
     * endpoint; an unreachable server is a failure.
     */
    public OperationResult<TokenCount> tokenizeCount(URI baseUrl, String text) {
        Map<String, Object> body = Map.of("content", text);
        OperationResult<JsonNode> result = postJson(baseUrl, "/tokenize", body, timeouts.tokenize());
        if (result.success()) {
            JsonNode tokens = result.value().path("tokens");
            if (tokens.isArray()) {
                return OperationResult.success(TokenCount.exact(tokens.size()));
            }
            log.debug("Tokenize response without tokens array, estimating: baseUrl={}", baseUrl);
        } else if (MISSING_ENDPOINT.contains(result.httpStatus())) {
            log.debug("Tokenize endpoint missing, estimating: baseUrl={}, status={}", baseUrl, result.httpStatus());
        } else {
            return result.asFailure();
        }
        return OperationResult.success(TokenCount.estimate(text), "Estimated from text length");
    }

    private OperationResult<JsonNode> getJson(URI baseUrl, String path, Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder(resolve(baseUrl, path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request, path).map(this::parseOrEmpty);
    }

    private OperationResult<JsonNode> postJson(URI baseUrl, String path, Map<String, Object> body, Duration timeout) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(resolve(baseUrl, path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            return OperationResult.failure(ErrorType.INTERNAL_ERROR, "Failed to encode request: " + e.getOriginalMessage());
        }
        OperationResult<String> response = send(request, path);
        if (response.isFailure()) {
            return response.asFailure();
        }
        try {
            return OperationResult.success(objectMapper.readTree(response.value()));
        } catch (JsonProcessingException e) {
            log.warn("Unparsable response: uri={}, error={}", request.uri(), e.getOriginalMessage());
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR, "Invalid JSON from " + path + ": " + e.getOriginalMessage());
        }
    }

    private OperationResult<String> send(HttpRequest request, String path) {
        long start = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            log.debug("HTTP call: method={}, uri={}, status={}, latencyMs={}",
                    request.method(), request.uri(), status, (System.nanoTime() - start) / 1_000_000);
            if (status >= 200 && status < 300) {
                return OperationResult.success(response.body());
            }
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR,
                    path + " returned HTTP " + status + ": " + extractError(response.body()), status);
        } catch (HttpTimeoutException e) {
            long timeoutMs = request.timeout().map(Duration::toMillis).orElse(timeouts.connect().toMillis());
            log.warn("HTTP call timed out: uri={}, timeoutMs={}", request.uri(), timeoutMs);
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR, path + " timed out after " + timeoutMs + "ms");
        } catch (ConnectException e) {
            log.debug("Connection refused: uri={}", request.uri());
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR, "Connection refused: " + request.uri());
        } catch (IOException e) {
            log.warn("HTTP call failed: uri={}, error={}", request.uri(), e.toString());
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR, path + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(ErrorType.CANCELLED, path + " interrupted");
        }
    }

    private OperationResult<SseChunkStream> postStream(URI baseUrl, String path, Map<String, Object> body) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(resolve(baseUrl, path))
                    .timeout(timeouts.generation())
                    .header("Content-Type", "application/json")
                    .header("Accept", "text/event-stream")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(withStream(body, true))))
                    .build();
        } catch (JsonProcessingException e) {
            return OperationResult.failure(ErrorType.INTERNAL_ERROR, "Failed to encode request: " + e.getOriginalMessage());
        }

        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                log.debug("Stream opened: uri={}", request.uri());
                return OperationResult.success(new SseChunkStream(response.body(), objectMapper));
            }
            String errorBody;
            try (InputStream in = response.body()) {
                errorBody = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR,
                    path + " returned HTTP " + status + ": " + extractError(errorBody), status);
        } catch (HttpTimeoutException e) {
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR,
                    path + " timed out after " + timeouts.generation().toMillis() + "ms");
        } catch (IOException e) {
            log.warn("Stream request failed: uri={}, error={}", request.uri(), e.toString());
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR, path + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(ErrorType.CANCELLED, path + " interrupted");
        }
    }

    private JsonNode parseOrEmpty(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON body, wrapping as text: length={}", body.length());
            return objectMapper.createObjectNode().put("text", body);
        }
    }

    /**
     * llama-server reports errors as {@code {"error": {"message": ...}}} or {@code {"error": "..."}}.
     */
    private String extractError(String body) {
        if (body == null || body.isBlank()) {
            return "empty body";
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.has("message")) {
                return error.path("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: length={}", body.length());
        }
        return body.length() > 500 ? body.substring(0, 500) : body;
    }

    private static Map<String, Object> withStream(Map<String, Object> body, boolean stream) {
        Map<String, Object> copy = new LinkedHashMap<>(body);
        copy.put("stream", stream);
        return copy;
    }

    private static URI resolve(URI baseUrl, String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }

    /**
     * Per-operation timeouts.
     */
    public record Timeouts(
            Duration connect,
            Duration health,
            Duration info,
            Duration tokenize,
            Duration embeddings,
            Duration generation
    ) {
        public static Timeouts defaults() {
            return new Timeouts(
                    Duration.ofSeconds(5),
                    Duration.ofSeconds(5),
                    Duration.ofSeconds(5),
                    Duration.ofSeconds(30),
                    Duration.ofSeconds(60),
                    Duration.ofSeconds(120)
            );
        }
    }
}
