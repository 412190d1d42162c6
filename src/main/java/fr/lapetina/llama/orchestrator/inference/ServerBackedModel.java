package fr.lapetina.llama.orchestrator.inference;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llama.orchestrator.domain.exception.InferenceException;
import fr.lapetina.llama.orchestrator.domain.model.ChatMessage;
import fr.lapetina.llama.orchestrator.domain.model.CompletionResult;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.InferenceMode;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;
import fr.lapetina.llama.orchestrator.domain.model.SamplingParameters;
import fr.lapetina.llama.orchestrator.domain.model.ServerInstance;
import fr.lapetina.llama.orchestrator.infrastructure.http.SseChunkStream;
import fr.lapetina.llama.orchestrator.orchestrator.ServerOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Model served by a native llama-server owned by the {@link ServerOrchestrator}.
 */
final class ServerBackedModel implements ModelTransport {

    private static final Logger log = LoggerFactory.getLogger(ServerBackedModel.class);

    private final String modelId;
    private final ServerOrchestrator orchestrator;

    ServerBackedModel(String modelId, ServerOrchestrator orchestrator) {
        this.modelId = modelId;
        this.orchestrator = orchestrator;
    }

    @Override
    public InferenceMode mode() {
        return InferenceMode.SERVER_BACKED;
    }

    @Override
    public CompletionResult complete(String prompt, SamplingParameters params) {
        OperationResult<JsonNode> result = orchestrator.completion(modelId, completionBody(prompt, params));
        return CompletionResult.fromOpenAiResponse(unwrap(result, "Completion failed"));
    }

    @Override
    public CompletionResult chat(List<ChatMessage> messages, SamplingParameters params) {
        OperationResult<JsonNode> result = orchestrator.chatCompletion(modelId, chatBody(messages, params));
        return CompletionResult.fromOpenAiResponse(unwrap(result, "Chat failed"));
    }

    @Override
    public TokenSource completeStream(String prompt, SamplingParameters params) {
        SseChunkStream chunks = unwrap(
                orchestrator.completionStream(modelId, completionBody(prompt, params)), "Completion stream failed");
        return new ChunkTokenSource(chunks, chunk -> chunk.path("text").asText(""));
    }

    @Override
    public TokenSource chatStream(List<ChatMessage> messages, SamplingParameters params) {
        SseChunkStream chunks = unwrap(
                orchestrator.chatCompletionStream(modelId, chatBody(messages, params)), "Chat stream failed");
        return new ChunkTokenSource(chunks, chunk -> chunk.path("delta").path("content").asText(""));
    }

    @Override
    public OptionalInt port() {
        return orchestrator.getServer(modelId)
                .map(ServerInstance::getPort)
                .map(OptionalInt::of)
                .orElse(OptionalInt.empty());
    }

    @Override
    public void close() {
        OperationResult<Void> stopped = orchestrator.stop(modelId);
        if (stopped.isFailure()) {
            log.debug("Server already gone on unload: modelId={}, reason={}", modelId, stopped.message());
        }
    }

    private static Map<String, Object> completionBody(String prompt, SamplingParameters params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", prompt);
        body.putAll(params.toRequestFields());
        return body;
    }

    private static Map<String, Object> chatBody(List<ChatMessage> messages, SamplingParameters params) {
        List<Map<String, String>> wire = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            wire.add(message.toWire());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messages", wire);
        body.putAll(params.toRequestFields());
        return body;
    }

    private <T> T unwrap(OperationResult<T> result, String context) {
        if (result.isFailure()) {
            throw InferenceException.from(result, context + " for model " + modelId);
        }
        return result.value();
    }

    /**
     * Text pieces of an SSE chunk stream. Chunks without text are skipped.
     */
    private static final class ChunkTokenSource implements TokenSource {
        private final SseChunkStream chunks;
        private final Function<JsonNode, String> choiceText;
        private String pending;

        private ChunkTokenSource(SseChunkStream chunks, Function<JsonNode, String> choiceText) {
            this.chunks = chunks;
            this.choiceText = choiceText;
        }

        @Override
        public boolean hasNext() {
            while (pending == null && chunks.hasNext()) {
                JsonNode choices = chunks.next().path("choices");
                if (choices.isArray() && choices.size() > 0) {
                    String text = choiceText.apply(choices.get(0));
                    if (!text.isEmpty()) {
                        pending = text;
                    }
                }
            }
            if (pending == null && chunks.transportError().isPresent()) {
                throw new InferenceException(ErrorType.TRANSPORT_ERROR,
                        "Stream interrupted: " + chunks.transportError().get());
            }
            return pending != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String text = pending;
            pending = null;
            return text;
        }

        @Override
        public void close() {
            chunks.close();
        }
    }
}
