package fr.lapetina.llama.orchestrator.domain.model;

/**
 * Error taxonomy for orchestration and inference operations.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Nothing to run with (no backend installed, model file missing, bad config) */
    CONFIGURATION_ERROR,

    /** Health probe never succeeded within the startup bound */
    STARTUP_TIMEOUT,

    /** No free port in the candidate range */
    PORT_EXHAUSTION,

    /** HTTP call to a running server failed or timed out */
    TRANSPORT_ERROR,

    /** A previously healthy server or child process died */
    PROCESS_DEATH,

    /** No server is tracked for the requested model */
    NOT_RUNNING,

    /** The operation is not offered by the target transport */
    NOT_SUPPORTED,

    /** Cooperative cancellation was requested */
    CANCELLED,

    /** Internal system error */
    INTERNAL_ERROR
}
