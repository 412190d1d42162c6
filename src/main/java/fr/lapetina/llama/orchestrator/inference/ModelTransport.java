package fr.lapetina.llama.orchestrator.inference;

import fr.lapetina.llama.orchestrator.domain.model.ChatMessage;
import fr.lapetina.llama.orchestrator.domain.model.CompletionResult;
import fr.lapetina.llama.orchestrator.domain.model.InferenceMode;
import fr.lapetina.llama.orchestrator.domain.model.SamplingParameters;

import java.util.List;
import java.util.OptionalInt;

/**
 * One way of running a loaded model. Chosen once at load time.
 *
 * Implementations are not thread-safe; {@link LoadedModel} serializes calls.
 * Failures are thrown as {@link fr.lapetina.llama.orchestrator.domain.exception.InferenceException}.
 */
interface ModelTransport {

    InferenceMode mode();

    CompletionResult complete(String prompt, SamplingParameters params);

    CompletionResult chat(List<ChatMessage> messages, SamplingParameters params);

    TokenSource completeStream(String prompt, SamplingParameters params);

    TokenSource chatStream(List<ChatMessage> messages, SamplingParameters params);

    /**
     * Port of the backing server, empty for transports without one.
     */
    OptionalInt port();

    /**
     * False once the backing process has died on its own. Server-backed
     * models learn about dead servers through registry events instead.
     */
    default boolean isAlive() {
        return true;
    }

    /**
     * Releases the backing server, process or engine handle.
     */
    void close();
}
