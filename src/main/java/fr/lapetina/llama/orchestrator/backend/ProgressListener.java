package fr.lapetina.llama.orchestrator.backend;

/**
 * Receives backend install progress.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, message) -> { };

    /**
     * @param percent 0 to 100
     * @param message what is happening
     */
    void onProgress(int percent, String message);
}
