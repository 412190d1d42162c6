package fr.lapetina.llama.orchestrator.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.llama.orchestrator.domain.exception.InferenceException;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.InferenceConfig;
import fr.lapetina.llama.orchestrator.infrastructure.process.ManagedProcess;
import fr.lapetina.llama.orchestrator.infrastructure.process.ProcessLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Child process speaking newline-delimited JSON over stdin and stdout.
 *
 * The child is started as {@code <command...> <modelPath> <configJson>},
 * reports {@code loading} then {@code ready} or {@code error}, and answers one
 * request at a time. Responses are read by a daemon thread into a queue so
 * every wait is bounded. A request that times out leaves the channel out of
 * step with the child, so the child is killed and the transport is dead from
 * then on. Not thread-safe; callers serialize requests.
 */
final class LegacyInferenceProcess implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LegacyInferenceProcess.class);
    private static final String END_OF_OUTPUT = "__eof";
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final ManagedProcess process;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final BufferedWriter writer;
    private final BlockingQueue<JsonNode> responses = new LinkedBlockingQueue<>();

    private LegacyInferenceProcess(ManagedProcess process, ObjectMapper objectMapper, Duration requestTimeout) {
        this.process = process;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.writer = new BufferedWriter(new OutputStreamWriter(process.stdin(), StandardCharsets.UTF_8));
        Thread reader = new Thread(this::readResponses, "legacy-inference-" + process.pid());
        reader.setDaemon(true);
        reader.start();
    }

    /**
     * Launches the child and waits for it to report the model loaded.
     */
    static LegacyInferenceProcess start(
            ProcessLauncher launcher,
            List<String> baseCommand,
            Path modelPath,
            InferenceConfig config,
            Duration readyTimeout,
            Duration requestTimeout,
            ObjectMapper objectMapper
    ) {
        if (baseCommand == null || baseCommand.isEmpty()) {
            throw new InferenceException(ErrorType.CONFIGURATION_ERROR, "No legacy inference process command configured");
        }
        List<String> command = new ArrayList<>(baseCommand);
        command.add(modelPath.toString());
        command.add(configJson(config, objectMapper));

        ManagedProcess process;
        try {
            process = launcher.launchInteractive(command, Map.of());
        } catch (IOException e) {
            throw new InferenceException(ErrorType.INTERNAL_ERROR,
                    "Failed to spawn inference process: " + e.getMessage(), e);
        }
        log.info("Inference process spawned: pid={}, model={}", process.pid(), modelPath);

        LegacyInferenceProcess child = new LegacyInferenceProcess(process, objectMapper, requestTimeout);
        try {
            child.awaitReady(readyTimeout);
        } catch (RuntimeException e) {
            child.abort();
            throw e;
        }
        return child;
    }

    private static String configJson(InferenceConfig config, ObjectMapper objectMapper) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("n_ctx", config.contextSize());
        json.put("n_gpu_layers", config.gpuLayers());
        json.put("n_threads", config.threads() > 0 ? config.threads() : null);
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize process config", e);
        }
    }

    private void awaitReady(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new InferenceException(ErrorType.STARTUP_TIMEOUT,
                        "Inference process not ready within " + timeout.toMillis() + "ms" + stderr());
            }
            JsonNode message = poll(Duration.ofNanos(remaining));
            if (message == null) {
                continue;
            }
            String type = message.path("type").asText();
            switch (type) {
                case "ready":
                    log.info("Inference process ready: pid={}", process.pid());
                    return;
                case "loading":
                    log.debug("Inference process loading: pid={}", process.pid());
                    break;
                case "error":
                    throw new InferenceException(ErrorType.CONFIGURATION_ERROR,
                            "Inference process failed to load model: " + message.path("error").asText());
                case END_OF_OUTPUT:
                    throw processDied();
                default:
                    log.debug("Ignoring message before ready: type={}", type);
            }
        }
    }

    void send(Map<String, Object> request) {
        discardStale();
        try {
            writer.write(objectMapper.writeValueAsString(request));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new InferenceException(ErrorType.PROCESS_DEATH,
                    "Cannot write to inference process: " + e.getMessage() + stderr(), e);
        }
    }

    /**
     * Next response within the request timeout. Failures are thrown: {@code error}
     * responses, a timeout, or the child exiting.
     */
    JsonNode receive() {
        JsonNode message = poll(requestTimeout);
        if (message == null) {
            log.warn("Inference process timed out, killing it: pid={}, timeoutMs={}",
                    process.pid(), requestTimeout.toMillis());
            process.forceKill();
            throw new InferenceException(ErrorType.TRANSPORT_ERROR,
                    "Inference process timed out after " + requestTimeout.toMillis() + "ms");
        }
        String type = message.path("type").asText();
        if (END_OF_OUTPUT.equals(type)) {
            throw processDied();
        }
        if ("error".equals(type)) {
            throw new InferenceException(ErrorType.INTERNAL_ERROR,
                    "Inference process error: " + message.path("error").asText("unknown error"));
        }
        return message;
    }

    /**
     * Next response of the expected type.
     */
    JsonNode receive(String expectedType) {
        JsonNode message = receive();
        String type = message.path("type").asText();
        if (!expectedType.equals(type)) {
            throw new InferenceException(ErrorType.INTERNAL_ERROR,
                    "Unexpected response from inference process: expected " + expectedType + ", got " + type);
        }
        return message;
    }

    boolean isAlive() {
        return process.isAlive();
    }

    long pid() {
        return process.pid();
    }

    // Replies nobody waits for any more; the end-of-output marker stays.
    private void discardStale() {
        JsonNode head;
        while ((head = responses.peek()) != null && !END_OF_OUTPUT.equals(head.path("type").asText())) {
            responses.poll();
            log.debug("Discarding stale response: pid={}, type={}", process.pid(), head.path("type").asText());
        }
    }

    private JsonNode poll(Duration timeout) {
        try {
            JsonNode message = responses.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (message != null && END_OF_OUTPUT.equals(message.path("type").asText())) {
                // keep the marker visible to later calls
                responses.offer(message);
            }
            return message;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException(ErrorType.CANCELLED, "Interrupted while waiting for inference process");
        }
    }

    private void readResponses() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.stdout(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    responses.offer(objectMapper.readTree(line));
                } catch (JsonProcessingException e) {
                    log.debug("Ignoring non-JSON output from inference process: {}", line);
                }
            }
        } catch (IOException e) {
            log.debug("Inference process output closed: pid={}, error={}", process.pid(), e.getMessage());
        }
        ObjectNode eof = objectMapper.createObjectNode();
        eof.put("type", END_OF_OUTPUT);
        responses.offer(eof);
    }

    private InferenceException processDied() {
        String exit = process.exitCode().isPresent() ? String.valueOf(process.exitCode().getAsInt()) : "unknown";
        return new InferenceException(ErrorType.PROCESS_DEATH,
                "Inference process exited with code " + exit + stderr());
    }

    private String stderr() {
        String tail = process.stderrTail();
        return tail == null || tail.isBlank() ? "" : "\nstderr:\n" + tail;
    }

    /**
     * Asks the child to unload, then escalates to a forced kill.
     */
    @Override
    public void close() {
        if (process.isAlive()) {
            try {
                send(Map.of("type", "unload"));
                if (!awaitUnload()) {
                    log.warn("Inference process did not confirm unload: pid={}", process.pid());
                }
            } catch (InferenceException e) {
                log.warn("Graceful unload failed: pid={}, error={}", process.pid(), e.getMessage());
            }
        }
        kill();
    }

    private boolean awaitUnload() {
        long deadline = System.nanoTime() + SHUTDOWN_WAIT.toNanos();
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            JsonNode reply = poll(Duration.ofNanos(remaining));
            if (reply == null) {
                return false;
            }
            String type = reply.path("type").asText();
            if ("unload_success".equals(type)) {
                return true;
            }
            if (END_OF_OUTPUT.equals(type)) {
                return false;
            }
            log.debug("Ignoring message while unloading: type={}", type);
        }
        return false;
    }

    private void abort() {
        process.forceKill();
        kill();
    }

    private void kill() {
        try {
            if (!process.waitFor(SHUTDOWN_WAIT)) {
                process.forceKill();
                process.waitFor(SHUTDOWN_WAIT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.forceKill();
        }
        log.info("Inference process stopped: pid={}", process.pid());
    }
}
