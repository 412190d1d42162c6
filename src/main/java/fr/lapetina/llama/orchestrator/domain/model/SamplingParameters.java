package fr.lapetina.llama.orchestrator.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request generation knobs. Null fields fall back to the model's {@link InferenceConfig}.
 */
public record SamplingParameters(
        Integer maxTokens,
        Double temperature,
        Double topP,
        Integer topK,
        Double repeatPenalty,
        List<String> stop
) {
    public SamplingParameters {
        stop = stop != null ? List.copyOf(stop) : null;
    }

    public static SamplingParameters defaults() {
        return new SamplingParameters(null, null, null, null, null, null);
    }

    public static SamplingParameters of(int maxTokens, double temperature) {
        return new SamplingParameters(maxTokens, temperature, null, null, null, null);
    }

    /**
     * Fills every unset field from the given configuration.
     */
    public SamplingParameters resolve(InferenceConfig config) {
        return new SamplingParameters(
                maxTokens != null ? maxTokens : config.maxTokens(),
                temperature != null ? temperature : config.temperature(),
                topP != null ? topP : config.topP(),
                topK != null ? topK : config.topK(),
                repeatPenalty != null ? repeatPenalty : config.repeatPenalty(),
                stop != null ? stop : config.stopSequences()
        );
    }

    /**
     * Request body fields understood by llama-server. Unset fields are omitted.
     */
    public Map<String, Object> toRequestFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (maxTokens != null) {
            fields.put("max_tokens", maxTokens);
        }
        if (temperature != null) {
            fields.put("temperature", temperature);
        }
        if (topP != null) {
            fields.put("top_p", topP);
        }
        if (topK != null) {
            fields.put("top_k", topK);
        }
        if (repeatPenalty != null) {
            fields.put("repeat_penalty", repeatPenalty);
        }
        if (stop != null && !stop.isEmpty()) {
            fields.put("stop", stop);
        }
        return fields;
    }
}
