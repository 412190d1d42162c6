package fr.lapetina.llama.orchestrator.domain.model;

import java.util.List;

/**
 * Runtime and sampling configuration a model is loaded with.
 * Immutable and thread-safe.
 *
 * @param contextSize   context window in tokens
 * @param batchSize     prompt processing batch size
 * @param threads       CPU threads, 0 lets the server decide
 * @param gpuLayers     layers offloaded to the accelerator, -1 for all
 * @param parallel      concurrent slots on the server
 * @param temperature   default sampling temperature
 * @param topP          default nucleus sampling threshold
 * @param topK          default top-k cutoff
 * @param repeatPenalty default repetition penalty
 * @param maxTokens     default generation limit
 * @param stopSequences default stop sequences
 * @param serverOptions optional native-server flags layered under the values above, may be null
 */
public record InferenceConfig(
        int contextSize,
        int batchSize,
        int threads,
        int gpuLayers,
        int parallel,
        double temperature,
        double topP,
        int topK,
        double repeatPenalty,
        int maxTokens,
        List<String> stopSequences,
        ServerConfig serverOptions
) {
    public InferenceConfig {
        stopSequences = stopSequences != null ? List.copyOf(stopSequences) : List.of();
    }

    /**
     * Maps the runtime part of this configuration onto launch options for one model file.
     */
    public ServerConfig toServerConfig(String modelPath) {
        ServerConfig.Builder builder = serverOptions != null ? serverOptions.toBuilder() : ServerConfig.builder();
        return builder
                .modelPath(modelPath)
                .contextSize(contextSize)
                .batchSize(batchSize)
                .threads(threads)
                .gpuLayers(gpuLayers)
                .parallel(parallel)
                .build();
    }

    public static InferenceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .contextSize(contextSize)
                .batchSize(batchSize)
                .threads(threads)
                .gpuLayers(gpuLayers)
                .parallel(parallel)
                .temperature(temperature)
                .topP(topP)
                .topK(topK)
                .repeatPenalty(repeatPenalty)
                .maxTokens(maxTokens)
                .stopSequences(stopSequences)
                .serverOptions(serverOptions);
    }

    public static final class Builder {
        private int contextSize = ServerConfig.DEFAULT_CONTEXT_SIZE;
        private int batchSize = ServerConfig.DEFAULT_BATCH_SIZE;
        private int threads;
        private int gpuLayers = ServerConfig.DEFAULT_GPU_LAYERS;
        private int parallel = ServerConfig.DEFAULT_PARALLEL;
        private double temperature = 0.7;
        private double topP = 0.95;
        private int topK = 40;
        private double repeatPenalty = 1.1;
        private int maxTokens = 2048;
        private List<String> stopSequences;
        private ServerConfig serverOptions;

        public Builder contextSize(int contextSize) {
            this.contextSize = contextSize;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder gpuLayers(int gpuLayers) {
            this.gpuLayers = gpuLayers;
            return this;
        }

        public Builder parallel(int parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(double topP) {
            this.topP = topP;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder repeatPenalty(double repeatPenalty) {
            this.repeatPenalty = repeatPenalty;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences;
            return this;
        }

        public Builder serverOptions(ServerConfig serverOptions) {
            this.serverOptions = serverOptions;
            return this;
        }

        public InferenceConfig build() {
            return new InferenceConfig(
                    contextSize, batchSize, threads, gpuLayers, parallel,
                    temperature, topP, topK, repeatPenalty, maxTokens,
                    stopSequences, serverOptions
            );
        }
    }
}
