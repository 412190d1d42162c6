package fr.lapetina.llama.orchestrator.domain.model;

/**
 * Calling convention a model was loaded with.
 */
public enum InferenceMode {
    /** Native llama-server process reached over its OpenAI-compatible HTTP API */
    SERVER_BACKED,

    /** Child process speaking newline-delimited JSON over stdin/stdout */
    PROCESS_BACKED,

    /** In-process inference library */
    LIBRARY_BACKED
}
