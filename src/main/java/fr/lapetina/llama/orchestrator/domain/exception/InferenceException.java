package fr.lapetina.llama.orchestrator.domain.exception;

import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;

/**
 * Thrown by the inference facade when loading or generation fails.
 */
public final class InferenceException extends RuntimeException {

    private final ErrorType errorType;

    public InferenceException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public InferenceException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    /**
     * Wraps a failed operation result.
     */
    public static InferenceException from(OperationResult<?> result, String context) {
        return new InferenceException(result.errorType(), context + ": " + result.message());
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
