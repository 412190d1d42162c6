package fr.lapetina.llama.orchestrator.support;

import java.util.List;

/**
 * Behavior of a {@link FakeLegacyChild}.
 */
public final class LegacyChildScript {

    private volatile String reply = "legacy reply";
    private volatile List<String> tokens = List.of("leg", "acy");
    private volatile boolean failLoad;
    private volatile boolean neverReady;
    private volatile String requestError;
    private volatile long replyDelayMs;

    public LegacyChildScript reply(String reply) {
        this.reply = reply;
        return this;
    }

    public LegacyChildScript tokens(List<String> tokens) {
        this.tokens = List.copyOf(tokens);
        return this;
    }

    /** Reports an error instead of ready. */
    public LegacyChildScript failLoad() {
        this.failLoad = true;
        return this;
    }

    /** Keeps reporting loading forever. */
    public LegacyChildScript neverReady() {
        this.neverReady = true;
        return this;
    }

    /** Answers every generation request with an error. */
    public LegacyChildScript requestError(String message) {
        this.requestError = message;
        return this;
    }

    /** Answers generation requests only after a delay, from another thread. */
    public LegacyChildScript replyDelayMs(long replyDelayMs) {
        this.replyDelayMs = replyDelayMs;
        return this;
    }

    String reply() {
        return reply;
    }

    List<String> tokens() {
        return tokens;
    }

    boolean isFailLoad() {
        return failLoad;
    }

    boolean isNeverReady() {
        return neverReady;
    }

    String requestError() {
        return requestError;
    }

    long replyDelayMs() {
        return replyDelayMs;
    }
}
