package fr.lapetina.llama.orchestrator.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parsed outcome of one completion or chat request, independent of the transport.
 *
 * @param content          generated text (assistant message content for chat)
 * @param finishReason     why generation stopped, e.g. {@code stop} or {@code length}
 * @param promptTokens     tokens consumed by the prompt
 * @param completionTokens tokens generated
 * @param totalTokens      prompt plus completion tokens
 * @param raw              the server's full response body, null for non-HTTP transports
 */
public record CompletionResult(
        String content,
        String finishReason,
        int promptTokens,
        int completionTokens,
        int totalTokens,
        JsonNode raw
) {
    public CompletionResult {
        if (content == null) {
            content = "";
        }
        if (finishReason == null) {
            finishReason = "stop";
        }
    }

    /**
     * Builds a result from an OpenAI-compatible {@code /v1/completions} or
     * {@code /v1/chat/completions} response body.
     */
    public static CompletionResult fromOpenAiResponse(JsonNode body) {
        String content = "";
        String finishReason = "stop";
        JsonNode choices = body.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            if (choice.has("message")) {
                content = choice.path("message").path("content").asText("");
            } else {
                content = choice.path("text").asText("");
            }
            finishReason = choice.path("finish_reason").asText("stop");
        }
        JsonNode usage = body.path("usage");
        return new CompletionResult(
                content,
                finishReason,
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0),
                usage.path("total_tokens").asInt(0),
                body
        );
    }
}
