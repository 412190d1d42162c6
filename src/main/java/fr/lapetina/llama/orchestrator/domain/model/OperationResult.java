package fr.lapetina.llama.orchestrator.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an orchestrator or catalog operation.
 *
 * Expected failures (missing backend, startup timeout, HTTP errors...) are
 * reported through this value rather than thrown.
 * Immutable and thread-safe as long as the carried value is.
 *
 * @param success    whether the operation succeeded
 * @param value      result payload, may be null on success for void operations
 * @param message    human-readable outcome, always set on failure
 * @param errorType  failure category, null on success
 * @param httpStatus HTTP status of the underlying call, 0 when not applicable
 */
public record OperationResult<T>(
        boolean success,
        T value,
        String message,
        ErrorType errorType,
        int httpStatus
) {
    public OperationResult {
        if (!success) {
            Objects.requireNonNull(errorType, "Error type is required for failures");
            Objects.requireNonNull(message, "Message is required for failures");
        }
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(true, value, null, null, 0);
    }

    public static <T> OperationResult<T> success(T value, String message) {
        return new OperationResult<>(true, value, message, null, 0);
    }

    public static <T> OperationResult<T> failure(ErrorType errorType, String message) {
        return new OperationResult<>(false, null, message, errorType, 0);
    }

    public static <T> OperationResult<T> failure(ErrorType errorType, String message, int httpStatus) {
        return new OperationResult<>(false, null, message, errorType, httpStatus);
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<T> toOptional() {
        return success ? Optional.ofNullable(value) : Optional.empty();
    }

    /**
     * Transforms the value of a successful result, passing failures through.
     */
    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!success) {
            return new OperationResult<>(false, null, message, errorType, httpStatus);
        }
        return new OperationResult<>(true, mapper.apply(value), message, null, httpStatus);
    }

    /**
     * Re-types a failure. Only valid on failed results.
     */
    public <R> OperationResult<R> asFailure() {
        if (success) {
            throw new IllegalStateException("Cannot convert a successful result into a failure");
        }
        return new OperationResult<>(false, null, message, errorType, httpStatus);
    }
}
