package fr.lapetina.llama.orchestrator.inference;

import fr.lapetina.llama.orchestrator.domain.model.ChatMessage;
import fr.lapetina.llama.orchestrator.domain.model.CompletionResult;
import fr.lapetina.llama.orchestrator.domain.model.InferenceConfig;
import fr.lapetina.llama.orchestrator.domain.model.SamplingParameters;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * In-process inference engine, used by models loaded in library mode.
 */
public interface InferenceLibrary {

    Model load(Path modelPath, InferenceConfig config);

    /**
     * A model held by the engine.
     */
    interface Model extends AutoCloseable {

        CompletionResult complete(String prompt, SamplingParameters params);

        CompletionResult chat(List<ChatMessage> messages, SamplingParameters params);

        Iterator<String> completeStream(String prompt, SamplingParameters params);

        Iterator<String> chatStream(List<ChatMessage> messages, SamplingParameters params);

        @Override
        void close();
    }
}
