package fr.lapetina.llama.orchestrator.registry;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Local model catalog: model id to model file.
 */
public interface ModelRegistry {

    Optional<Path> resolvePath(String modelId);

    /**
     * Every known model, in registration order.
     */
    Map<String, Path> listModels();
}
