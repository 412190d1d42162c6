package fr.lapetina.llama.orchestrator.inference;

import fr.lapetina.llama.orchestrator.domain.model.ChatMessage;
import fr.lapetina.llama.orchestrator.domain.model.CompletionResult;
import fr.lapetina.llama.orchestrator.domain.model.InferenceMode;
import fr.lapetina.llama.orchestrator.domain.model.SamplingParameters;

import java.util.Iterator;
import java.util.List;
import java.util.OptionalInt;

/**
 * Model held in-process by an {@link InferenceLibrary}.
 */
final class LibraryBackedModel implements ModelTransport {

    private final InferenceLibrary.Model model;

    LibraryBackedModel(InferenceLibrary.Model model) {
        this.model = model;
    }

    @Override
    public InferenceMode mode() {
        return InferenceMode.LIBRARY_BACKED;
    }

    @Override
    public CompletionResult complete(String prompt, SamplingParameters params) {
        return model.complete(prompt, params);
    }

    @Override
    public CompletionResult chat(List<ChatMessage> messages, SamplingParameters params) {
        return model.chat(messages, params);
    }

    @Override
    public TokenSource completeStream(String prompt, SamplingParameters params) {
        return wrap(model.completeStream(prompt, params));
    }

    @Override
    public TokenSource chatStream(List<ChatMessage> messages, SamplingParameters params) {
        return wrap(model.chatStream(messages, params));
    }

    @Override
    public OptionalInt port() {
        return OptionalInt.empty();
    }

    @Override
    public void close() {
        model.close();
    }

    private static TokenSource wrap(Iterator<String> tokens) {
        return new TokenSource() {
            @Override
            public boolean hasNext() {
                return tokens.hasNext();
            }

            @Override
            public String next() {
                return tokens.next();
            }

            @Override
            public void close() {
                // tokens are produced in-process, nothing to release
            }
        };
    }
}
