package fr.lapetina.llama.orchestrator.infrastructure.process;

import fr.lapetina.llama.orchestrator.domain.model.ServerConfig;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps {@link ServerConfig} to a llama-server command line.
 *
 * Pure and stateless: no filesystem access, no process handling.
 * Required flags always come first, in a fixed order. Optional flags follow
 * and are only emitted when the option deviates from its default.
 */
public final class ServerArgumentBuilder {

    private ServerArgumentBuilder() {
    }

    /**
     * Builds the full command: executable followed by its arguments.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static List<String> buildCommand(Path executable, ServerConfig config) {
        Objects.requireNonNull(executable, "Executable is required");
        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(buildArguments(config));
        return command;
    }

    /**
     * Builds the argument list without the executable.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static List<String> buildArguments(ServerConfig config) {
        validate(config);

        List<String> args = new ArrayList<>();
        args.add("--model");
        args.add(config.getModelPath());
        args.add("--host");
        args.add(config.getHost());
        args.add("--port");
        args.add(Integer.toString(config.getPort()));
        args.add("--ctx-size");
        args.add(Integer.toString(config.getContextSize()));
        args.add("--n-gpu-layers");
        args.add(Integer.toString(config.getGpuLayers()));
        args.add("--batch-size");
        args.add(Integer.toString(config.getBatchSize()));
        args.add("--parallel");
        args.add(Integer.toString(config.getParallel()));

        if (config.getThreads() > 0) {
            option(args, "--threads", config.getThreads());
        }
        option(args, "--threads-batch", config.getThreadsBatch());
        option(args, "--ubatch-size", config.getUbatchSize());
        flag(args, "--flash-attn", config.isFlashAttention());
        flag(args, "--no-mmap", config.isNoMmap());
        flag(args, "--mlock", config.isMlock());
        option(args, "--numa", config.getNuma());
        if (!config.getTensorSplit().isEmpty()) {
            args.add("--tensor-split");
            args.add(config.getTensorSplit().stream()
                    .map(ServerArgumentBuilder::formatNumber)
                    .collect(Collectors.joining(",")));
        }
        option(args, "--main-gpu", config.getMainGpu());
        option(args, "--split-mode", config.getSplitMode());
        option(args, "--seed", config.getSeed());
        option(args, "--rope-scaling", config.getRopeScaling());
        option(args, "--rope-freq-base", config.getRopeFreqBase());
        option(args, "--rope-freq-scale", config.getRopeFreqScale());
        option(args, "--cache-type-k", config.getCacheTypeK());
        option(args, "--cache-type-v", config.getCacheTypeV());
        flag(args, "--no-cont-batching", config.isNoContinuousBatching());
        flag(args, "--embedding", config.isEmbedding());
        flag(args, "--metrics", config.isMetricsEndpoint());
        option(args, "--keep", config.getKeep());
        option(args, "--n-predict", config.getPredict());
        option(args, "--chat-template", config.getChatTemplate());
        option(args, "--alias", config.getAlias());
        option(args, "--defrag-thold", config.getDefragThreshold());

        return List.copyOf(args);
    }

    private static void validate(ServerConfig config) {
        Objects.requireNonNull(config, "Server config is required");
        if (config.getModelPath() == null || config.getModelPath().isBlank()) {
            throw new IllegalArgumentException("Model path is required");
        }
        if (config.getHost().isBlank()) {
            throw new IllegalArgumentException("Host must not be blank");
        }
        if (config.getPort() < 1 || config.getPort() > 65535) {
            throw new IllegalArgumentException("Port out of range: " + config.getPort());
        }
        if (config.getContextSize() <= 0) {
            throw new IllegalArgumentException("Context size must be positive: " + config.getContextSize());
        }
        if (config.getGpuLayers() < -1) {
            throw new IllegalArgumentException("GPU layers must be -1 or more: " + config.getGpuLayers());
        }
        if (config.getBatchSize() <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + config.getBatchSize());
        }
        if (config.getParallel() < 1) {
            throw new IllegalArgumentException("Parallel slots must be at least 1: " + config.getParallel());
        }
        if (config.getThreads() < 0) {
            throw new IllegalArgumentException("Threads must not be negative: " + config.getThreads());
        }
    }

    private static void flag(List<String> args, String name, boolean enabled) {
        if (enabled) {
            args.add(name);
        }
    }

    private static void option(List<String> args, String name, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String s && s.isBlank()) {
            return;
        }
        args.add(name);
        args.add(value instanceof Double d ? formatNumber(d) : value.toString());
    }

    static String formatNumber(Double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
