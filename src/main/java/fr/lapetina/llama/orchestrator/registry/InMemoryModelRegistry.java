package fr.lapetina.llama.orchestrator.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ModelRegistry} held in memory, seeded from configuration. Thread-safe.
 */
public final class InMemoryModelRegistry implements ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryModelRegistry.class);

    private final Map<String, Path> models = Collections.synchronizedMap(new LinkedHashMap<>());

    public InMemoryModelRegistry(Map<String, String> seed) {
        if (seed != null) {
            seed.forEach((id, path) -> register(id, Paths.get(path)));
        }
    }

    public InMemoryModelRegistry() {
        this(Map.of());
    }

    public void register(String modelId, Path path) {
        Objects.requireNonNull(modelId, "Model ID is required");
        Objects.requireNonNull(path, "Model path is required");
        models.put(modelId, path);
        log.debug("Model registered: modelId={}, path={}", modelId, path);
    }

    public boolean unregister(String modelId) {
        return models.remove(modelId) != null;
    }

    @Override
    public Optional<Path> resolvePath(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    @Override
    public Map<String, Path> listModels() {
        synchronized (models) {
            return Map.copyOf(new LinkedHashMap<>(models));
        }
    }
}
