package fr.lapetina.llama.orchestrator.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One turn of a conversation.
 * Immutable and thread-safe.
 */
public record ChatMessage(String role, String content, Instant timestamp) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public ChatMessage {
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(content, "Content is required");
    }

    public ChatMessage(String role, String content) {
        this(role, content, Instant.now());
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content);
    }

    /**
     * Wire form used by OpenAI-compatible endpoints.
     */
    public Map<String, String> toWire() {
        return Map.of("role", role, "content", content);
    }
}
