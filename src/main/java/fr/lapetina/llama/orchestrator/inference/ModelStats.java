package fr.lapetina.llama.orchestrator.inference;

import fr.lapetina.llama.orchestrator.domain.model.InferenceConfig;
import fr.lapetina.llama.orchestrator.domain.model.InferenceMode;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a loaded model.
 *
 * @param port server port, null for models without a server
 */
public record ModelStats(
        String modelId,
        InferenceMode mode,
        Instant loadedAt,
        Duration uptime,
        long requestCount,
        long totalTokensGenerated,
        InferenceConfig config,
        Integer port
) {
}
