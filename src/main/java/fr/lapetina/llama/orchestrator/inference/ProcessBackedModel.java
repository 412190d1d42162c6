package fr.lapetina.llama.orchestrator.inference;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llama.orchestrator.domain.exception.InferenceException;
import fr.lapetina.llama.orchestrator.domain.model.ChatMessage;
import fr.lapetina.llama.orchestrator.domain.model.CompletionResult;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.InferenceMode;
import fr.lapetina.llama.orchestrator.domain.model.SamplingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.OptionalInt;

/**
 * Model held by a dedicated JSON-lines inference child process.
 */
final class ProcessBackedModel implements ModelTransport {

    private static final Logger log = LoggerFactory.getLogger(ProcessBackedModel.class);

    private final String modelId;
    private final LegacyInferenceProcess process;

    ProcessBackedModel(String modelId, LegacyInferenceProcess process) {
        this.modelId = modelId;
        this.process = process;
    }

    @Override
    public InferenceMode mode() {
        return InferenceMode.PROCESS_BACKED;
    }

    @Override
    public CompletionResult complete(String prompt, SamplingParameters params) {
        process.send(completionRequest(prompt, params, false));
        JsonNode response = process.receive("completion");
        return toResult(response.path("text").asText(""), response);
    }

    @Override
    public CompletionResult chat(List<ChatMessage> messages, SamplingParameters params) {
        process.send(chatRequest(messages, params, false));
        JsonNode response = process.receive("chat_completion");
        return toResult(response.path("message").path("content").asText(""), response);
    }

    @Override
    public TokenSource completeStream(String prompt, SamplingParameters params) {
        process.send(completionRequest(prompt, params, true));
        process.receive("stream_start");
        return new ProcessTokenSource();
    }

    @Override
    public TokenSource chatStream(List<ChatMessage> messages, SamplingParameters params) {
        process.send(chatRequest(messages, params, true));
        process.receive("stream_start");
        return new ProcessTokenSource();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public OptionalInt port() {
        return OptionalInt.empty();
    }

    @Override
    public void close() {
        log.info("Stopping inference process: modelId={}, pid={}", modelId, process.pid());
        process.close();
    }

    private static CompletionResult toResult(String content, JsonNode response) {
        JsonNode usage = response.path("usage");
        String finishReason = response.path("finish_reason").asText("stop");
        return new CompletionResult(
                content,
                finishReason,
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0),
                usage.path("total_tokens").asInt(0),
                null
        );
    }

    private static Map<String, Object> completionRequest(String prompt, SamplingParameters params, boolean stream) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("type", "completion");
        request.put("prompt", prompt);
        putSampling(request, params);
        request.put("stream", stream);
        return request;
    }

    private static Map<String, Object> chatRequest(List<ChatMessage> messages, SamplingParameters params, boolean stream) {
        List<Map<String, String>> wire = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            wire.add(message.toWire());
        }
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("type", "chat");
        request.put("messages", wire);
        putSampling(request, params);
        request.put("stream", stream);
        return request;
    }

    // The child understands a subset of the sampling knobs
    private static void putSampling(Map<String, Object> request, SamplingParameters params) {
        if (params.maxTokens() != null) {
            request.put("max_tokens", params.maxTokens());
        }
        if (params.temperature() != null) {
            request.put("temperature", params.temperature());
        }
        if (params.topP() != null) {
            request.put("top_p", params.topP());
        }
        if (params.stop() != null && !params.stop().isEmpty()) {
            request.put("stop", params.stop());
        }
    }

    /**
     * Reads {@code stream_token} messages up to {@code stream_end}.
     */
    private final class ProcessTokenSource implements TokenSource {
        private String pending;
        private boolean ended;

        @Override
        public boolean hasNext() {
            if (pending == null && !ended) {
                advance();
            }
            return pending != null;
        }

        private void advance() {
            while (pending == null && !ended) {
                JsonNode message = process.receive();
                String type = message.path("type").asText();
                if ("stream_token".equals(type)) {
                    String token = message.path("token").asText("");
                    if (!token.isEmpty()) {
                        pending = token;
                    }
                } else if ("stream_end".equals(type)) {
                    ended = true;
                } else {
                    ended = true;
                    throw new InferenceException(ErrorType.INTERNAL_ERROR,
                            "Unexpected message in stream from inference process: " + type);
                }
            }
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String token = pending;
            pending = null;
            return token;
        }

        /**
         * Drains the rest of the stream so the next request starts on a clean channel.
         */
        @Override
        public void close() {
            pending = null;
            if (ended || !process.isAlive()) {
                return;
            }
            try {
                while (!ended) {
                    advance();
                    pending = null;
                }
            } catch (InferenceException e) {
                log.warn("Failed to drain abandoned stream: modelId={}, error={}", modelId, e.getMessage());
            }
        }
    }
}
