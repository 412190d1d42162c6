package fr.lapetina.llama.orchestrator.inference;

import fr.lapetina.llama.orchestrator.domain.model.InferenceConfig;
import fr.lapetina.llama.orchestrator.domain.model.InferenceMode;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalInt;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A model ready to serve requests, with its request mutex and counters.
 *
 * The mutex is a fair single-permit semaphore: waiters are served in arrival
 * order and a streaming request may release it from whichever thread drains
 * the stream.
 */
public final class LoadedModel {

    private final String modelId;
    private final Path modelPath;
    private final InferenceConfig config;
    private final ModelTransport transport;
    private final Instant loadedAt;
    private final Semaphore mutex = new Semaphore(1, true);
    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong totalTokensGenerated = new AtomicLong();
    private volatile boolean closed;

    LoadedModel(String modelId, Path modelPath, InferenceConfig config, ModelTransport transport) {
        this.modelId = modelId;
        this.modelPath = modelPath;
        this.config = config;
        this.transport = transport;
        this.loadedAt = Instant.now();
    }

    public String getModelId() {
        return modelId;
    }

    public Path getModelPath() {
        return modelPath;
    }

    public InferenceConfig getConfig() {
        return config;
    }

    public InferenceMode getMode() {
        return transport.mode();
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public long getTotalTokensGenerated() {
        return totalTokensGenerated.get();
    }

    /**
     * False once unloaded, once its backing server is gone, or once its
     * inference process has died.
     */
    public boolean isActive() {
        return !closed && transport.isAlive();
    }

    public ModelStats stats() {
        OptionalInt port = transport.port();
        return new ModelStats(
                modelId,
                transport.mode(),
                loadedAt,
                Duration.between(loadedAt, Instant.now()),
                requestCount.get(),
                totalTokensGenerated.get(),
                config,
                port.isPresent() ? port.getAsInt() : null
        );
    }

    ModelTransport transport() {
        return transport;
    }

    void acquire() throws InterruptedException {
        mutex.acquire();
    }

    void release() {
        mutex.release();
    }

    void recordRequest(int tokensGenerated) {
        requestCount.incrementAndGet();
        totalTokensGenerated.addAndGet(Math.max(0, tokensGenerated));
    }

    void markClosed() {
        closed = true;
    }

    @Override
    public String toString() {
        return "LoadedModel{" +
                "modelId='" + modelId + '\'' +
                ", mode=" + transport.mode() +
                ", requests=" + requestCount.get() +
                ", active=" + isActive() +
                '}';
    }
}
