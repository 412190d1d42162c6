package fr.lapetina.llama.orchestrator.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llama.orchestrator.domain.exception.InferenceException;
import fr.lapetina.llama.orchestrator.domain.model.ChatMessage;
import fr.lapetina.llama.orchestrator.domain.model.ChatSession;
import fr.lapetina.llama.orchestrator.domain.model.CompletionResult;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.InferenceConfig;
import fr.lapetina.llama.orchestrator.domain.model.InferenceMode;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;
import fr.lapetina.llama.orchestrator.domain.model.SamplingParameters;
import fr.lapetina.llama.orchestrator.domain.model.ServerConfig;
import fr.lapetina.llama.orchestrator.domain.model.ServerInstance;
import fr.lapetina.llama.orchestrator.hardware.HardwareProfileProvider;
import fr.lapetina.llama.orchestrator.hardware.TuningHints;
import fr.lapetina.llama.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.llama.orchestrator.infrastructure.health.ServerRegistry;
import fr.lapetina.llama.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llama.orchestrator.infrastructure.process.ProcessLauncher;
import fr.lapetina.llama.orchestrator.orchestrator.ServerOrchestrator;
import fr.lapetina.llama.orchestrator.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for loading models and running generation against them.
 *
 * A loaded model is reached through one transport, picked at load time.
 * Requests against one model are serialized in arrival order by its mutex;
 * streaming requests keep it until the stream is finished. Different models
 * never contend. Turns of one chat session are serialized the same way, so a
 * reply always follows the user turn it answers.
 *
 * A model stays loaded only while its server is tracked or its inference
 * process is alive.
 *
 * Failures of expected kinds are thrown as {@link InferenceException}.
 * Generating against a model that is not loaded is a caller error and throws
 * {@link IllegalStateException}.
 */
public final class InferenceFacade implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferenceFacade.class);
    private static final String MDC_MODEL_ID = "modelId";

    private final ServerOrchestrator orchestrator;
    private final ModelRegistry modelRegistry;
    private final HardwareProfileProvider hardwareProfile;
    private final ProcessLauncher processLauncher;
    private final OrchestratorConfig.LegacyConfig legacyConfig;
    private final InferenceLibrary inferenceLibrary;
    private final MetricsRegistry metricsRegistry;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<String, LoadedModel> models = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> loadLocks = new ConcurrentHashMap<>();
    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Semaphore> sessionTurns = new ConcurrentHashMap<>();

    private volatile OrchestratorConfig.DefaultsConfig defaultsConfig;
    private volatile InferenceConfig defaultConfig;

    /**
     * @param inferenceLibrary in-process engine for library mode, may be null
     */
    public InferenceFacade(
            ServerOrchestrator orchestrator,
            ServerRegistry serverRegistry,
            ModelRegistry modelRegistry,
            HardwareProfileProvider hardwareProfile,
            ProcessLauncher processLauncher,
            OrchestratorConfig.DefaultsConfig defaultsConfig,
            OrchestratorConfig.LegacyConfig legacyConfig,
            InferenceLibrary inferenceLibrary,
            MetricsRegistry metricsRegistry
    ) {
        this.orchestrator = orchestrator;
        this.modelRegistry = modelRegistry;
        this.hardwareProfile = hardwareProfile;
        this.processLauncher = processLauncher;
        this.legacyConfig = legacyConfig != null ? legacyConfig : new OrchestratorConfig.LegacyConfig();
        this.inferenceLibrary = inferenceLibrary;
        this.metricsRegistry = metricsRegistry;
        reloadDefaults(defaultsConfig);
        serverRegistry.addListener(this::onServerEvent);
    }

    // Defaults

    public InferenceConfig getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * Recomputes the default configuration from the current hardware profile.
     */
    public InferenceConfig reloadDefaults() {
        return reloadDefaults(defaultsConfig);
    }

    /**
     * Recomputes the default configuration from new configured values and the
     * current hardware profile. Explicitly configured values win over hints.
     */
    public InferenceConfig reloadDefaults(OrchestratorConfig.DefaultsConfig configured) {
        OrchestratorConfig.DefaultsConfig d = configured != null ? configured : new OrchestratorConfig.DefaultsConfig();
        String backendId = hardwareProfile.detectedBackendId().orElse(null);
        TuningHints hints = hardwareProfile.tuningHints(backendId);

        InferenceConfig computed = InferenceConfig.builder()
                .contextSize(orElse(d.getContextSize(), ServerConfig.DEFAULT_CONTEXT_SIZE))
                .batchSize(orElse(d.getBatchSize(), hints.batchSize()))
                .threads(orElse(d.getThreads(), hints.threads()))
                .gpuLayers(orElse(d.getGpuLayers(), hints.gpuLayers()))
                .parallel(orElse(d.getParallel(), ServerConfig.DEFAULT_PARALLEL))
                .temperature(d.getTemperature())
                .topP(d.getTopP())
                .topK(d.getTopK())
                .repeatPenalty(d.getRepeatPenalty())
                .maxTokens(d.getMaxTokens())
                .build();
        this.defaultsConfig = d;
        this.defaultConfig = computed;
        log.info("Default inference config: backend={}, contextSize={}, gpuLayers={}, threads={}, batchSize={}",
                backendId, computed.contextSize(), computed.gpuLayers(), computed.threads(), computed.batchSize());
        return computed;
    }

    private static int orElse(Integer configured, int fallback) {
        return configured != null ? configured : fallback;
    }

    // Lifecycle

    public LoadedModel load(String modelId) {
        return load(modelId, null, InferenceMode.SERVER_BACKED);
    }

    public LoadedModel load(String modelId, InferenceConfig config) {
        return load(modelId, config, InferenceMode.SERVER_BACKED);
    }

    /**
     * Loads a model, or returns it if already loaded. The configuration and
     * mode of an already loaded model are left unchanged.
     *
     * @param config runtime configuration, null for the defaults
     */
    public LoadedModel load(String modelId, InferenceConfig config, InferenceMode mode) {
        LoadedModel existing = models.get(modelId);
        if (existing != null && existing.isActive()) {
            return existing;
        }

        ReentrantLock lock = loadLocks.computeIfAbsent(modelId, id -> new ReentrantLock());
        lock.lock();
        try {
            existing = models.get(modelId);
            if (existing != null) {
                reapIfDead(modelId, existing);
                if (existing.isActive()) {
                    return existing;
                }
                models.remove(modelId, existing);
            }

            Path modelPath = modelRegistry.resolvePath(modelId)
                    .orElseThrow(() -> new InferenceException(ErrorType.CONFIGURATION_ERROR, "Unknown model: " + modelId));
            if (!Files.isRegularFile(modelPath)) {
                throw new InferenceException(ErrorType.CONFIGURATION_ERROR, "Model file not found: " + modelPath);
            }

            InferenceConfig effective = config != null ? config : defaultConfig;
            log.info("Loading model: modelId={}, mode={}, path={}", modelId, mode, modelPath);
            ModelTransport transport = openTransport(modelId, modelPath, effective, mode);
            LoadedModel loaded = new LoadedModel(modelId, modelPath, effective, transport);
            models.put(modelId, loaded);
            log.info("Model loaded: modelId={}, mode={}", modelId, mode);
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    private ModelTransport openTransport(String modelId, Path modelPath, InferenceConfig config, InferenceMode mode) {
        switch (mode) {
            case SERVER_BACKED: {
                OperationResult<ServerInstance> started =
                        orchestrator.start(modelId, modelPath, config.toServerConfig(modelPath.toString()), null);
                if (started.isFailure()) {
                    throw InferenceException.from(started, "Failed to load model " + modelId);
                }
                return new ServerBackedModel(modelId, orchestrator);
            }
            case PROCESS_BACKED: {
                LegacyInferenceProcess process = LegacyInferenceProcess.start(
                        processLauncher,
                        legacyConfig.getProcessCommand(),
                        modelPath,
                        config,
                        Duration.ofMillis(legacyConfig.getReadyTimeoutMs()),
                        Duration.ofMillis(legacyConfig.getRequestTimeoutMs()),
                        objectMapper
                );
                return new ProcessBackedModel(modelId, process);
            }
            case LIBRARY_BACKED: {
                if (inferenceLibrary == null) {
                    throw new InferenceException(ErrorType.CONFIGURATION_ERROR,
                            "No inference library available for library mode");
                }
                return new LibraryBackedModel(inferenceLibrary.load(modelPath, config));
            }
            default:
                throw new IllegalArgumentException("Unsupported inference mode: " + mode);
        }
    }

    /**
     * Unloads a model once its in-flight request, if any, has finished.
     *
     * @return false if the model was not loaded
     */
    public boolean unload(String modelId) {
        ReentrantLock lock = loadLocks.computeIfAbsent(modelId, id -> new ReentrantLock());
        lock.lock();
        try {
            LoadedModel model = models.get(modelId);
            if (model == null) {
                return false;
            }
            acquire(model);
            try {
                models.remove(modelId, model);
                model.markClosed();
                model.transport().close();
            } finally {
                model.release();
            }
            log.info("Model unloaded: modelId={}, requests={}, tokens={}",
                    modelId, model.getRequestCount(), model.getTotalTokensGenerated());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isLoaded(String modelId) {
        LoadedModel model = models.get(modelId);
        if (model == null) {
            return false;
        }
        reapIfDead(modelId, model);
        return model.isActive();
    }

    public Optional<LoadedModel> getLoadedModel(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public List<ModelStats> getLoadedModels() {
        reapDead();
        List<ModelStats> stats = new ArrayList<>();
        for (LoadedModel model : models.values()) {
            stats.add(model.stats());
        }
        stats.sort(Comparator.comparing(ModelStats::modelId));
        return stats;
    }

    public int loadedModelCount() {
        reapDead();
        return models.size();
    }

    // Drops models whose server was evicted or stopped behind the facade's back;
    // their transport has nothing left to close.
    private void onServerEvent(ServerRegistry.ServerRegistryEvent event) {
        ServerRegistry.ServerRegistryEvent.Type type = event.type();
        if (type != ServerRegistry.ServerRegistryEvent.Type.EVICTED
                && type != ServerRegistry.ServerRegistryEvent.Type.REMOVED) {
            return;
        }
        String modelId = event.instance().getModelId();
        LoadedModel model = models.get(modelId);
        if (model != null && model.getMode() == InferenceMode.SERVER_BACKED && models.remove(modelId, model)) {
            model.markClosed();
            log.warn("Model dropped after its server went away: modelId={}, event={}", modelId, type);
        }
    }

    private void reapDead() {
        for (Map.Entry<String, LoadedModel> entry : models.entrySet()) {
            reapIfDead(entry.getKey(), entry.getValue());
        }
    }

    // Drops a model whose inference process died and reaps the process.
    private void reapIfDead(String modelId, LoadedModel model) {
        if (model.transport().isAlive() || !models.remove(modelId, model)) {
            return;
        }
        model.markClosed();
        log.warn("Model dropped after its inference process died: modelId={}", modelId);
        try {
            model.transport().close();
        } catch (RuntimeException e) {
            log.warn("Failed to reap dead inference process: modelId={}", modelId, e);
        }
    }

    // Generation

    public CompletionResult complete(String modelId, String prompt) {
        return complete(modelId, prompt, SamplingParameters.defaults());
    }

    public CompletionResult complete(String modelId, String prompt, SamplingParameters params) {
        return execute(modelId, "complete", (model, resolved) -> model.transport().complete(prompt, resolved), params);
    }

    public CompletionResult chat(String modelId, List<ChatMessage> messages) {
        return chat(modelId, messages, SamplingParameters.defaults());
    }

    public CompletionResult chat(String modelId, List<ChatMessage> messages, SamplingParameters params) {
        List<ChatMessage> history = List.copyOf(messages);
        return execute(modelId, "chat", (model, resolved) -> model.transport().chat(history, resolved), params);
    }

    /**
     * Streams a completion. The model stays locked until the returned stream is
     * exhausted or closed.
     */
    public TokenStream completeStream(String modelId, String prompt, SamplingParameters params) {
        return stream(modelId, "complete_stream",
                (model, resolved) -> model.transport().completeStream(prompt, resolved), params, null);
    }

    /**
     * Streams a chat reply. The model stays locked until the returned stream is
     * exhausted or closed.
     */
    public TokenStream chatStream(String modelId, List<ChatMessage> messages, SamplingParameters params) {
        List<ChatMessage> history = List.copyOf(messages);
        return stream(modelId, "chat_stream",
                (model, resolved) -> model.transport().chatStream(history, resolved), params, null);
    }

    private CompletionResult execute(
            String modelId,
            String operation,
            Call<CompletionResult> call,
            SamplingParameters params
    ) {
        LoadedModel model = lockLoaded(modelId);
        long start = System.nanoTime();
        MDC.put(MDC_MODEL_ID, modelId);
        try {
            CompletionResult result = call.apply(model, resolve(params, model));
            model.recordRequest(result.completionTokens());
            log.debug("Request completed: operation={}, completionTokens={}", operation, result.completionTokens());
            return result;
        } catch (InferenceException e) {
            metricsRegistry.incrementErrorCount(modelId, e.getErrorType());
            throw e;
        } finally {
            metricsRegistry.recordLatency(modelId, operation, Duration.ofNanos(System.nanoTime() - start));
            MDC.remove(MDC_MODEL_ID);
            model.release();
        }
    }

    private TokenStream stream(
            String modelId,
            String operation,
            Call<TokenSource> call,
            SamplingParameters params,
            TokenStream.CompletionCallback onComplete
    ) {
        LoadedModel model = lockLoaded(modelId);
        long start = System.nanoTime();
        TokenSource source;
        MDC.put(MDC_MODEL_ID, modelId);
        try {
            source = call.apply(model, resolve(params, model));
        } catch (RuntimeException e) {
            if (e instanceof InferenceException) {
                metricsRegistry.incrementErrorCount(modelId, ((InferenceException) e).getErrorType());
            }
            model.release();
            throw e;
        } finally {
            MDC.remove(MDC_MODEL_ID);
        }
        return new TokenStream(source, (text, tokens, exhausted) -> {
            try {
                model.recordRequest(tokens);
                metricsRegistry.recordLatency(modelId, operation, Duration.ofNanos(System.nanoTime() - start));
                log.debug("Stream finished: modelId={}, operation={}, tokens={}, exhausted={}",
                        modelId, operation, tokens, exhausted);
                if (onComplete != null) {
                    onComplete.onComplete(text, tokens, exhausted);
                }
            } finally {
                model.release();
            }
        });
    }

    private static SamplingParameters resolve(SamplingParameters params, LoadedModel model) {
        return (params != null ? params : SamplingParameters.defaults()).resolve(model.getConfig());
    }

    /**
     * Waits for the model's mutex. The caller must release it.
     */
    private LoadedModel lockLoaded(String modelId) {
        LoadedModel model = models.get(modelId);
        if (model != null) {
            reapIfDead(modelId, model);
        }
        if (model == null || !model.isActive()) {
            throw new IllegalStateException("Model not loaded: " + modelId);
        }
        acquire(model);
        if (!model.isActive()) {
            model.release();
            reapIfDead(modelId, model);
            throw new IllegalStateException("Model was unloaded: " + modelId);
        }
        return model;
    }

    private static void acquire(LoadedModel model) {
        try {
            model.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException(ErrorType.CANCELLED, "Interrupted while waiting for model " + model.getModelId());
        }
    }

    // Sessions

    public ChatSession createSession(String modelId, String systemPrompt) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        ChatSession session = new ChatSession(id, modelId, systemPrompt);
        sessionTurns.put(id, new Semaphore(1, true));
        sessions.put(id, session);
        log.debug("Chat session created: sessionId={}, modelId={}", id, modelId);
        return session;
    }

    public Optional<ChatSession> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<ChatSession> listSessions() {
        List<ChatSession> all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparing(ChatSession::getCreatedAt));
        return all;
    }

    public boolean deleteSession(String sessionId) {
        sessionTurns.remove(sessionId);
        return sessions.remove(sessionId) != null;
    }

    /**
     * Appends a user turn, runs the whole transcript through the session's
     * model and appends the reply. Waits for any earlier turn of the same
     * session to finish first.
     */
    public CompletionResult sendMessage(String sessionId, String content, SamplingParameters params) {
        ChatSession session = requireSession(sessionId);
        Semaphore turn = acquireTurn(sessionId);
        try {
            session.append(ChatMessage.user(content));
            CompletionResult result = chat(session.getModelId(), session.getMessages(), params);
            session.append(ChatMessage.assistant(result.content()));
            return result;
        } finally {
            turn.release();
        }
    }

    /**
     * Streaming variant of {@link #sendMessage}. The reply is appended to the
     * transcript once the stream has been fully consumed; the session's next
     * turn waits until the stream is finished.
     */
    public TokenStream sendMessageStream(String sessionId, String content, SamplingParameters params) {
        ChatSession session = requireSession(sessionId);
        Semaphore turn = acquireTurn(sessionId);
        boolean handedOver = false;
        try {
            session.append(ChatMessage.user(content));
            List<ChatMessage> history = session.getMessages();
            TokenStream stream = stream(session.getModelId(), "chat_stream",
                    (model, resolved) -> model.transport().chatStream(history, resolved), params,
                    (text, tokens, exhausted) -> {
                        try {
                            if (exhausted) {
                                session.append(ChatMessage.assistant(text));
                            }
                        } finally {
                            turn.release();
                        }
                    });
            handedOver = true;
            return stream;
        } finally {
            if (!handedOver) {
                turn.release();
            }
        }
    }

    private Semaphore acquireTurn(String sessionId) {
        Semaphore turn = sessionTurns.computeIfAbsent(sessionId, id -> new Semaphore(1, true));
        try {
            turn.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException(ErrorType.CANCELLED, "Interrupted while waiting for chat session " + sessionId);
        }
        return turn;
    }

    private ChatSession requireSession(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            throw new IllegalArgumentException("Unknown chat session: " + sessionId);
        }
        return session;
    }

    /**
     * Unloads every model.
     */
    @Override
    public void close() {
        for (String modelId : new ArrayList<>(models.keySet())) {
            try {
                unload(modelId);
            } catch (RuntimeException e) {
                log.warn("Failed to unload model on close: modelId={}", modelId, e);
            }
        }
        sessions.clear();
        sessionTurns.clear();
    }

    @FunctionalInterface
    private interface Call<T> {
        T apply(LoadedModel model, SamplingParameters resolved);
    }
}
