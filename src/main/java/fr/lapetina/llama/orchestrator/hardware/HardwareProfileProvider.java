package fr.lapetina.llama.orchestrator.hardware;

import java.util.Optional;

/**
 * Source of hardware facts used to derive default inference settings.
 */
public interface HardwareProfileProvider {

    /**
     * Backend the host is set up to use, empty when none was detected.
     */
    Optional<String> detectedBackendId();

    /**
     * Suggested settings for a backend. A null id yields settings for an unknown host.
     */
    TuningHints tuningHints(String backendId);
}
