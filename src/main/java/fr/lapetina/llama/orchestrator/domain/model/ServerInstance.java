package fr.lapetina.llama.orchestrator.domain.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A native llama-server process serving one model.
 * Identity fields are immutable; status and probe bookkeeping are thread-safe.
 */
public final class ServerInstance {
    private final String modelId;
    private final String modelPath;
    private final String host;
    private final int port;
    private final long pid;
    private final String backendId;
    private final Instant startedAt;
    private final int contextSize;
    private final int gpuLayers;

    // Mutable state - thread-safe
    private final AtomicReference<ServerStatus> status;
    private final AtomicInteger consecutiveProbeFailures = new AtomicInteger(0);
    private volatile Instant lastHealthyAt;

    private ServerInstance(Builder builder) {
        this.modelId = Objects.requireNonNull(builder.modelId, "Model ID is required");
        this.modelPath = Objects.requireNonNull(builder.modelPath, "Model path is required");
        this.host = Objects.requireNonNull(builder.host, "Host is required");
        this.port = builder.port;
        this.pid = builder.pid;
        this.backendId = builder.backendId != null ? builder.backendId : "unknown";
        this.startedAt = builder.startedAt != null ? builder.startedAt : Instant.now();
        this.contextSize = builder.contextSize;
        this.gpuLayers = builder.gpuLayers;
        this.status = new AtomicReference<>(builder.status);
        this.lastHealthyAt = builder.status == ServerStatus.RUNNING ? this.startedAt : null;
    }

    public String getModelId() {
        return modelId;
    }

    public String getModelPath() {
        return modelPath;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public long getPid() {
        return pid;
    }

    public String getBackendId() {
        return backendId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public int getContextSize() {
        return contextSize;
    }

    public int getGpuLayers() {
        return gpuLayers;
    }

    public URI getBaseUrl() {
        return URI.create("http://" + host + ":" + port);
    }

    public ServerStatus getStatus() {
        return status.get();
    }

    public void setStatus(ServerStatus newStatus) {
        status.set(newStatus);
    }

    public Instant getLastHealthyAt() {
        return lastHealthyAt;
    }

    public int getConsecutiveProbeFailures() {
        return consecutiveProbeFailures.get();
    }

    /**
     * Records a successful health probe.
     */
    public void markHealthy() {
        consecutiveProbeFailures.set(0);
        lastHealthyAt = Instant.now();
        status.set(ServerStatus.RUNNING);
    }

    /**
     * Records a failed health probe.
     *
     * @return consecutive failures including this one
     */
    public int markUnhealthy() {
        status.set(ServerStatus.UNHEALTHY);
        return consecutiveProbeFailures.incrementAndGet();
    }

    /**
     * RUNNING only counts while the last successful probe is within the staleness window.
     */
    public boolean isFresh(Duration staleness) {
        Instant healthy = lastHealthyAt;
        return status.get() == ServerStatus.RUNNING
                && healthy != null
                && !Instant.now().isAfter(healthy.plus(staleness));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerInstance that = (ServerInstance) o;
        return modelId.equals(that.modelId) && port == that.port && pid == that.pid;
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, port, pid);
    }

    @Override
    public String toString() {
        return "ServerInstance{" +
                "modelId='" + modelId + '\'' +
                ", baseUrl=" + getBaseUrl() +
                ", pid=" + pid +
                ", status=" + status.get() +
                ", backend=" + backendId +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String modelId;
        private String modelPath;
        private String host = ServerConfig.DEFAULT_HOST;
        private int port;
        private long pid;
        private String backendId;
        private Instant startedAt;
        private int contextSize = ServerConfig.DEFAULT_CONTEXT_SIZE;
        private int gpuLayers = ServerConfig.DEFAULT_GPU_LAYERS;
        private ServerStatus status = ServerStatus.STARTING;

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder modelPath(String modelPath) {
            this.modelPath = modelPath;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder pid(long pid) {
            this.pid = pid;
            return this;
        }

        public Builder backendId(String backendId) {
            this.backendId = backendId;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder contextSize(int contextSize) {
            this.contextSize = contextSize;
            return this;
        }

        public Builder gpuLayers(int gpuLayers) {
            this.gpuLayers = gpuLayers;
            return this;
        }

        public Builder status(ServerStatus status) {
            this.status = status;
            return this;
        }

        public ServerInstance build() {
            return new ServerInstance(this);
        }
    }
}
