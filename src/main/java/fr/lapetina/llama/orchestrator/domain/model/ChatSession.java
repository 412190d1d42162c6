package fr.lapetina.llama.orchestrator.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory conversation with one model. The message list is append-only.
 * Thread-safe.
 */
public final class ChatSession {
    private final String id;
    private final String modelId;
    private final String systemPrompt;
    private final Instant createdAt;
    private final List<ChatMessage> messages = new CopyOnWriteArrayList<>();
    private volatile Instant lastActivity;

    public ChatSession(String id, String modelId, String systemPrompt) {
        this.id = Objects.requireNonNull(id, "Session ID is required");
        this.modelId = Objects.requireNonNull(modelId, "Model ID is required");
        this.systemPrompt = systemPrompt;
        this.createdAt = Instant.now();
        this.lastActivity = createdAt;
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
    }

    public String getId() {
        return id;
    }

    public String getModelId() {
        return modelId;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * Snapshot of the transcript in insertion order.
     */
    public List<ChatMessage> getMessages() {
        return List.copyOf(messages);
    }

    public void append(ChatMessage message) {
        messages.add(Objects.requireNonNull(message, "Message is required"));
        lastActivity = Instant.now();
    }

    @Override
    public String toString() {
        return "ChatSession{" +
                "id='" + id + '\'' +
                ", modelId='" + modelId + '\'' +
                ", messages=" + messages.size() +
                '}';
    }
}
