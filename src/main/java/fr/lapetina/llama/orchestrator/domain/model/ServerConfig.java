package fr.lapetina.llama.orchestrator.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Launch options for one native llama-server process.
 *
 * Required options are always passed to the process. Every optional option is
 * either null or at its default value unless explicitly set, and is only
 * passed when it deviates, so the server's own defaults are never overridden.
 * Immutable and thread-safe.
 */
public final class ServerConfig {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_CONTEXT_SIZE = 4096;
    /** -1 offloads every layer to the accelerator. */
    public static final int DEFAULT_GPU_LAYERS = -1;
    public static final int DEFAULT_BATCH_SIZE = 512;
    public static final int DEFAULT_PARALLEL = 1;

    private final String modelPath;
    private final String host;
    private final int port;
    private final int contextSize;
    private final int gpuLayers;
    private final int threads;
    private final int batchSize;
    private final int parallel;

    private final Integer threadsBatch;
    private final Integer ubatchSize;
    private final boolean flashAttention;
    private final boolean noMmap;
    private final boolean mlock;
    private final String numa;
    private final List<Double> tensorSplit;
    private final Integer mainGpu;
    private final String splitMode;
    private final Long seed;
    private final String ropeScaling;
    private final Double ropeFreqBase;
    private final Double ropeFreqScale;
    private final String cacheTypeK;
    private final String cacheTypeV;
    private final boolean noContinuousBatching;
    private final boolean embedding;
    private final boolean metricsEndpoint;
    private final Integer keep;
    private final Integer predict;
    private final String chatTemplate;
    private final String alias;
    private final Double defragThreshold;

    private ServerConfig(Builder builder) {
        this.modelPath = builder.modelPath;
        this.host = Objects.requireNonNull(builder.host, "Host is required");
        this.port = builder.port;
        this.contextSize = builder.contextSize;
        this.gpuLayers = builder.gpuLayers;
        this.threads = builder.threads;
        this.batchSize = builder.batchSize;
        this.parallel = builder.parallel;
        this.threadsBatch = builder.threadsBatch;
        this.ubatchSize = builder.ubatchSize;
        this.flashAttention = builder.flashAttention;
        this.noMmap = builder.noMmap;
        this.mlock = builder.mlock;
        this.numa = builder.numa;
        this.tensorSplit = builder.tensorSplit != null ? List.copyOf(builder.tensorSplit) : List.of();
        this.mainGpu = builder.mainGpu;
        this.splitMode = builder.splitMode;
        this.seed = builder.seed;
        this.ropeScaling = builder.ropeScaling;
        this.ropeFreqBase = builder.ropeFreqBase;
        this.ropeFreqScale = builder.ropeFreqScale;
        this.cacheTypeK = builder.cacheTypeK;
        this.cacheTypeV = builder.cacheTypeV;
        this.noContinuousBatching = builder.noContinuousBatching;
        this.embedding = builder.embedding;
        this.metricsEndpoint = builder.metricsEndpoint;
        this.keep = builder.keep;
        this.predict = builder.predict;
        this.chatTemplate = builder.chatTemplate;
        this.alias = builder.alias;
        this.defragThreshold = builder.defragThreshold;
    }

    public String getModelPath() { return modelPath; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public int getContextSize() { return contextSize; }
    public int getGpuLayers() { return gpuLayers; }
    /** 0 lets the server pick. */
    public int getThreads() { return threads; }
    public int getBatchSize() { return batchSize; }
    public int getParallel() { return parallel; }
    public Integer getThreadsBatch() { return threadsBatch; }
    public Integer getUbatchSize() { return ubatchSize; }
    public boolean isFlashAttention() { return flashAttention; }
    public boolean isNoMmap() { return noMmap; }
    public boolean isMlock() { return mlock; }
    public String getNuma() { return numa; }
    public List<Double> getTensorSplit() { return tensorSplit; }
    public Integer getMainGpu() { return mainGpu; }
    public String getSplitMode() { return splitMode; }
    public Long getSeed() { return seed; }
    public String getRopeScaling() { return ropeScaling; }
    public Double getRopeFreqBase() { return ropeFreqBase; }
    public Double getRopeFreqScale() { return ropeFreqScale; }
    public String getCacheTypeK() { return cacheTypeK; }
    public String getCacheTypeV() { return cacheTypeV; }
    public boolean isNoContinuousBatching() { return noContinuousBatching; }
    public boolean isEmbedding() { return embedding; }
    public boolean isMetricsEndpoint() { return metricsEndpoint; }
    public Integer getKeep() { return keep; }
    public Integer getPredict() { return predict; }
    public String getChatTemplate() { return chatTemplate; }
    public String getAlias() { return alias; }
    public Double getDefragThreshold() { return defragThreshold; }

    public ServerConfig withModelPath(String modelPath) {
        return toBuilder().modelPath(modelPath).build();
    }

    public ServerConfig withPort(int port) {
        return toBuilder().port(port).build();
    }

    public ServerConfig withHost(String host) {
        return toBuilder().host(host).build();
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.modelPath = modelPath;
        b.host = host;
        b.port = port;
        b.contextSize = contextSize;
        b.gpuLayers = gpuLayers;
        b.threads = threads;
        b.batchSize = batchSize;
        b.parallel = parallel;
        b.threadsBatch = threadsBatch;
        b.ubatchSize = ubatchSize;
        b.flashAttention = flashAttention;
        b.noMmap = noMmap;
        b.mlock = mlock;
        b.numa = numa;
        b.tensorSplit = tensorSplit;
        b.mainGpu = mainGpu;
        b.splitMode = splitMode;
        b.seed = seed;
        b.ropeScaling = ropeScaling;
        b.ropeFreqBase = ropeFreqBase;
        b.ropeFreqScale = ropeFreqScale;
        b.cacheTypeK = cacheTypeK;
        b.cacheTypeV = cacheTypeV;
        b.noContinuousBatching = noContinuousBatching;
        b.embedding = embedding;
        b.metricsEndpoint = metricsEndpoint;
        b.keep = keep;
        b.predict = predict;
        b.chatTemplate = chatTemplate;
        b.alias = alias;
        b.defragThreshold = defragThreshold;
        return b;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "modelPath='" + modelPath + '\'' +
                ", host='" + host + '\'' +
                ", port=" + port +
                ", contextSize=" + contextSize +
                ", gpuLayers=" + gpuLayers +
                ", batchSize=" + batchSize +
                ", parallel=" + parallel +
                '}';
    }

    public static final class Builder {
        private String modelPath;
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int contextSize = DEFAULT_CONTEXT_SIZE;
        private int gpuLayers = DEFAULT_GPU_LAYERS;
        private int threads;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int parallel = DEFAULT_PARALLEL;
        private Integer threadsBatch;
        private Integer ubatchSize;
        private boolean flashAttention;
        private boolean noMmap;
        private boolean mlock;
        private String numa;
        private List<Double> tensorSplit;
        private Integer mainGpu;
        private String splitMode;
        private Long seed;
        private String ropeScaling;
        private Double ropeFreqBase;
        private Double ropeFreqScale;
        private String cacheTypeK;
        private String cacheTypeV;
        private boolean noContinuousBatching;
        private boolean embedding;
        private boolean metricsEndpoint;
        private Integer keep;
        private Integer predict;
        private String chatTemplate;
        private String alias;
        private Double defragThreshold;

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

        public Builder contextSize(int contextSize) {
            this.contextSize = contextSize;
            return this;
        }

        public Builder gpuLayers(int gpuLayers) {
            this.gpuLayers = gpuLayers;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder parallel(int parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder threadsBatch(Integer threadsBatch) {
            this.threadsBatch = threadsBatch;
            return this;
        }

        public Builder ubatchSize(Integer ubatchSize) {
            this.ubatchSize = ubatchSize;
            return this;
        }

        public Builder flashAttention(boolean flashAttention) {
            this.flashAttention = flashAttention;
            return this;
        }

        public Builder noMmap(boolean noMmap) {
            this.noMmap = noMmap;
            return this;
        }

        public Builder mlock(boolean mlock) {
            this.mlock = mlock;
            return this;
        }

        /**
         * NUMA strategy: {@code distribute}, {@code isolate} or {@code numactl}.
         */
        public Builder numa(String numa) {
            this.numa = numa;
            return this;
        }

        public Builder tensorSplit(List<Double> tensorSplit) {
            this.tensorSplit = tensorSplit;
            return this;
        }

        public Builder mainGpu(Integer mainGpu) {
            this.mainGpu = mainGpu;
            return this;
        }

        /**
         * Multi-GPU split mode: {@code none}, {@code layer} or {@code row}.
         */
        public Builder splitMode(String splitMode) {
            this.splitMode = splitMode;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * RoPE scaling: {@code none}, {@code linear} or {@code yarn}.
         */
        public Builder ropeScaling(String ropeScaling) {
            this.ropeScaling = ropeScaling;
            return this;
        }

        public Builder ropeFreqBase(Double ropeFreqBase) {
            this.ropeFreqBase = ropeFreqBase;
            return this;
        }

        public Builder ropeFreqScale(Double ropeFreqScale) {
            this.ropeFreqScale = ropeFreqScale;
            return this;
        }

        public Builder cacheTypeK(String cacheTypeK) {
            this.cacheTypeK = cacheTypeK;
            return this;
        }

        public Builder cacheTypeV(String cacheTypeV) {
            this.cacheTypeV = cacheTypeV;
            return this;
        }

        public Builder noContinuousBatching(boolean noContinuousBatching) {
            this.noContinuousBatching = noContinuousBatching;
            return this;
        }

        public Builder embedding(boolean embedding) {
            this.embedding = embedding;
            return this;
        }

        /**
         * Enables the Prometheus-compatible {@code /metrics} endpoint on the server.
         */
        public Builder metricsEndpoint(boolean metricsEndpoint) {
            this.metricsEndpoint = metricsEndpoint;
            return this;
        }

        public Builder keep(Integer keep) {
            this.keep = keep;
            return this;
        }

        public Builder predict(Integer predict) {
            this.predict = predict;
            return this;
        }

        public Builder chatTemplate(String chatTemplate) {
            this.chatTemplate = chatTemplate;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder defragThreshold(Double defragThreshold) {
            this.defragThreshold = defragThreshold;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
