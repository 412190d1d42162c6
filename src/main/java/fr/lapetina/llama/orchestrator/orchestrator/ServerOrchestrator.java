package fr.lapetina.llama.orchestrator.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llama.orchestrator.backend.BackendCatalog;
import fr.lapetina.llama.orchestrator.backend.HostPlatform;
import fr.lapetina.llama.orchestrator.domain.model.Backend;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;
import fr.lapetina.llama.orchestrator.domain.model.ServerConfig;
import fr.lapetina.llama.orchestrator.domain.model.ServerInstance;
import fr.lapetina.llama.orchestrator.domain.model.TokenCount;
import fr.lapetina.llama.orchestrator.infrastructure.health.ServerRegistry;
import fr.lapetina.llama.orchestrator.infrastructure.http.LlamaServerClient;
import fr.lapetina.llama.orchestrator.infrastructure.http.SseChunkStream;
import fr.lapetina.llama.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llama.orchestrator.infrastructure.process.ManagedProcess;
import fr.lapetina.llama.orchestrator.infrastructure.process.PortAllocator;
import fr.lapetina.llama.orchestrator.infrastructure.process.ProcessLauncher;
import fr.lapetina.llama.orchestrator.infrastructure.process.ServerArgumentBuilder;
import fr.lapetina.llama.orchestrator.infrastructure.state.ServerStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the native llama-server processes: one per model id.
 *
 * Every lifecycle operation for a model runs under that model's lock, from the
 * existence check to registration, so concurrent starts of the same model
 * spawn a single process. Different models never contend on it. Port
 * reservation is serialized separately by the {@link PortAllocator}.
 *
 * Expected failures are returned as {@link OperationResult} values.
 */
public final class ServerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ServerOrchestrator.class);
    private static final Duration KILL_WAIT = Duration.ofSeconds(5);

    private final BackendCatalog backendCatalog;
    private final ProcessLauncher processLauncher;
    private final PortAllocator portAllocator;
    private final ServerStateStore stateStore;
    private final ServerRegistry serverRegistry;
    private final LlamaServerClient httpClient;
    private final MetricsRegistry metricsRegistry;
    private final StartupSettings settings;
    private final HostPlatform platform;

    private final Map<String, ReentrantLock> modelLocks = new ConcurrentHashMap<>();
    private final Map<String, ManagedProcess> processes = new ConcurrentHashMap<>();

    public ServerOrchestrator(
            BackendCatalog backendCatalog,
            ProcessLauncher processLauncher,
            PortAllocator portAllocator,
            ServerStateStore stateStore,
            ServerRegistry serverRegistry,
            LlamaServerClient httpClient,
            MetricsRegistry metricsRegistry,
            StartupSettings settings,
            HostPlatform platform
    ) {
        this.backendCatalog = backendCatalog;
        this.processLauncher = processLauncher;
        this.portAllocator = portAllocator;
        this.stateStore = stateStore;
        this.serverRegistry = serverRegistry;
        this.httpClient = httpClient;
        this.metricsRegistry = metricsRegistry;
        this.settings = settings;
        this.platform = platform;
        recoverOrphans();
    }

    /**
     * Kills every server recorded by a previous run and clears the state file.
     * Servers never outlive the application, so any recorded pid is an orphan.
     */
    private void recoverOrphans() {
        Map<String, ServerStateStore.PersistedServer> persisted = stateStore.read();
        if (persisted.isEmpty()) {
            return;
        }
        log.info("Recovering orphaned servers: count={}", persisted.size());
        for (Map.Entry<String, ServerStateStore.PersistedServer> entry : persisted.entrySet()) {
            ServerStateStore.PersistedServer server = entry.getValue();
            boolean killed = processLauncher.killByPid(server.pid());
            metricsRegistry.incrementOrphanKill();
            log.info("Orphaned server killed: modelId={}, pid={}, port={}, accepted={}",
                    entry.getKey(), server.pid(), server.port(), killed);
        }
        try {
            stateStore.clear();
        } catch (UncheckedIOException e) {
            log.warn("Failed to clear server state: file={}", stateStore.getStateFile(), e);
        }
    }

    /**
     * Starts a server for a model, or returns the running one.
     *
     * @param backendId backend to run with, null for the active backend
     */
    public OperationResult<ServerInstance> start(String modelId, Path modelPath, ServerConfig config, String backendId) {
        ReentrantLock lock = lockFor(modelId);
        lock.lock();
        try {
            Optional<ServerInstance> existing = serverRegistry.get(modelId);
            if (existing.isPresent()) {
                ServerInstance instance = existing.get();
                if (httpClient.isHealthy(instance.getBaseUrl())) {
                    instance.markHealthy();
                    log.debug("Server already running: modelId={}, port={}", modelId, instance.getPort());
                    metricsRegistry.incrementServerStart("reused");
                    return OperationResult.success(instance, "Server already running on port " + instance.getPort());
                }
                evictLocked(instance, "Existing server failed its health probe");
            }
            OperationResult<ServerInstance> result = spawn(modelId, modelPath, config, backendId);
            metricsRegistry.incrementServerStart(result.success() ? "started" : result.errorType().name().toLowerCase(Locale.ROOT));
            return result;
        } finally {
            lock.unlock();
        }
    }

    private OperationResult<ServerInstance> spawn(String modelId, Path modelPath, ServerConfig config, String backendId) {
        Optional<Backend> backend = resolveBackend(backendId);
        Optional<Path> executable = backend.isPresent()
                ? backendCatalog.getServerExecutable(backend.get().id())
                : Optional.empty();
        if (executable.isEmpty()) {
            log.warn("Cannot start server, no executable: modelId={}, backend={}", modelId, backendId);
            String message = backendId != null
                    ? "Backend '" + backendId + "' is not installed or has no llama-server executable"
                    : "No llama.cpp backend installed. Install a backend first.";
            return OperationResult.failure(ErrorType.CONFIGURATION_ERROR, message);
        }
        if (modelPath == null || !Files.isRegularFile(modelPath)) {
            log.warn("Cannot start server, model file missing: modelId={}, path={}", modelId, modelPath);
            return OperationResult.failure(ErrorType.CONFIGURATION_ERROR, "Model file not found: " + modelPath);
        }

        OperationResult<Integer> port = portAllocator.allocate();
        if (port.isFailure()) {
            return port.asFailure();
        }

        ServerConfig effective = config.toBuilder()
                .modelPath(modelPath.toString())
                .host(settings.host())
                .port(port.value())
                .build();
        List<String> command;
        try {
            command = ServerArgumentBuilder.buildCommand(executable.get(), effective);
        } catch (IllegalArgumentException e) {
            portAllocator.release(port.value());
            return OperationResult.failure(ErrorType.CONFIGURATION_ERROR, "Invalid server configuration: " + e.getMessage());
        }

        ManagedProcess process;
        try {
            process = processLauncher.launch(command, environmentFor(backend.get()));
        } catch (IOException e) {
            portAllocator.release(port.value());
            log.error("Failed to spawn server: modelId={}, executable={}", modelId, executable.get(), e);
            return OperationResult.failure(ErrorType.INTERNAL_ERROR, "Failed to spawn llama-server: " + e.getMessage());
        }
        log.info("Server spawned: modelId={}, port={}, pid={}, backend={}",
                modelId, port.value(), process.pid(), backend.get().id());

        ServerInstance instance = ServerInstance.builder()
                .modelId(modelId)
                .modelPath(modelPath.toString())
                .host(settings.host())
                .port(port.value())
                .pid(process.pid())
                .backendId(backend.get().id())
                .startedAt(Instant.now())
                .contextSize(effective.getContextSize())
                .gpuLayers(effective.getGpuLayers())
                .build();

        OperationResult<Void> ready = awaitReady(instance, process);
        if (ready.isFailure()) {
            killQuietly(process, instance.getPid());
            portAllocator.release(instance.getPort());
            return ready.asFailure();
        }

        instance.markHealthy();
        processes.put(modelId, process);
        serverRegistry.register(instance);
        persist();
        log.info("Server started: modelId={}, port={}, pid={}", modelId, instance.getPort(), instance.getPid());
        return OperationResult.success(instance, "Server started on port " + instance.getPort());
    }

    private OperationResult<Void> awaitReady(ServerInstance instance, ManagedProcess process) {
        URI baseUrl = instance.getBaseUrl();
        long deadline = System.nanoTime() + settings.startupTimeout().toNanos();
        try {
            while (true) {
                if (!process.isAlive()) {
                    String exit = process.exitCode().isPresent() ? String.valueOf(process.exitCode().getAsInt()) : "unknown";
                    log.warn("Server exited during startup: modelId={}, exitCode={}", instance.getModelId(), exit);
                    return OperationResult.failure(ErrorType.PROCESS_DEATH,
                            "llama-server exited during startup with code " + exit + withStderr(process));
                }
                if (httpClient.isHealthy(baseUrl)) {
                    return OperationResult.success(null);
                }
                if (System.nanoTime() >= deadline) {
                    log.warn("Server startup timed out: modelId={}, port={}, timeout={}",
                            instance.getModelId(), instance.getPort(), settings.startupTimeout());
                    return OperationResult.failure(ErrorType.STARTUP_TIMEOUT,
                            "llama-server did not become healthy within " + settings.startupTimeout().toMillis() + "ms"
                                    + withStderr(process));
                }
                Thread.sleep(settings.pollInterval().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(ErrorType.CANCELLED, "Interrupted while waiting for llama-server to start");
        }
    }

    private static String withStderr(ManagedProcess process) {
        String tail = process.stderrTail();
        return tail == null || tail.isBlank() ? "" : "\nstderr:\n" + tail;
    }

    private Optional<Backend> resolveBackend(String backendId) {
        if (backendId == null) {
            return backendCatalog.getActiveBackend();
        }
        return backendCatalog.listInstalled().stream()
                .filter(b -> b.id().equals(backendId))
                .findFirst();
    }

    /**
     * Extra variables for the spawned process. GPU backends that ship their
     * runtime libraries get the install directory on the library search path.
     */
    Map<String, String> environmentFor(Backend backend) {
        Map<String, String> env = new HashMap<>();
        if (!backend.needsLibraryPath() || backend.installPath() == null) {
            return env;
        }
        String variable = platform.libraryPathVariable();
        Path installPath = backend.installPath();
        StringBuilder value = new StringBuilder()
                .append(installPath)
                .append(File.pathSeparator)
                .append(installPath.resolve("bin"));
        String current = System.getenv(variable);
        if (current != null && !current.isEmpty()) {
            value.append(File.pathSeparator).append(current);
        }
        env.put(variable, value.toString());
        return env;
    }

    /**
     * Stops a model's server. The port and registry entry are always released,
     * even if the process already exited.
     */
    public OperationResult<Void> stop(String modelId) {
        ReentrantLock lock = lockFor(modelId);
        lock.lock();
        try {
            Optional<ServerInstance> existing = serverRegistry.get(modelId);
            if (existing.isEmpty()) {
                return OperationResult.failure(ErrorType.NOT_RUNNING, "No server running for model: " + modelId);
            }
            ServerInstance instance = existing.get();
            ManagedProcess process = processes.remove(modelId);
            try {
                terminate(process, instance.getPid());
            } finally {
                portAllocator.release(instance.getPort());
                serverRegistry.remove(modelId);
                persist();
                metricsRegistry.incrementServerStop();
            }
            log.info("Server stopped: modelId={}, port={}, pid={}", modelId, instance.getPort(), instance.getPid());
            return OperationResult.success(null, "Server stopped");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops every tracked server.
     *
     * @return number of servers stopped
     */
    public int stopAll() {
        int stopped = 0;
        for (ServerInstance instance : serverRegistry.getAll()) {
            if (stop(instance.getModelId()).success()) {
                stopped++;
            }
        }
        log.info("All servers stopped: count={}", stopped);
        return stopped;
    }

    private void terminate(ManagedProcess process, long pid) {
        boolean gone = false;
        if (process != null) {
            try {
                process.terminate();
                gone = process.waitFor(settings.stopGrace());
                if (!gone) {
                    log.warn("Server ignored terminate, forcing kill: pid={}", pid);
                    process.forceKill();
                    gone = process.waitFor(KILL_WAIT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.forceKill();
            }
        }
        if (!gone) {
            processLauncher.killByPid(pid);
        }
    }

    private void killQuietly(ManagedProcess process, long pid) {
        process.forceKill();
        try {
            if (!process.waitFor(KILL_WAIT)) {
                processLauncher.killByPid(pid);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            processLauncher.killByPid(pid);
        }
    }

    /**
     * Removes a dead server. Ignored if the model has since been restarted
     * with a different instance.
     */
    public void evict(ServerInstance instance, String reason) {
        ReentrantLock lock = lockFor(instance.getModelId());
        lock.lock();
        try {
            Optional<ServerInstance> current = serverRegistry.get(instance.getModelId());
            if (current.isEmpty() || current.get() != instance) {
                log.debug("Skipping eviction of stale instance: {}", instance);
                return;
            }
            evictLocked(instance, reason);
        } finally {
            lock.unlock();
        }
    }

    private void evictLocked(ServerInstance instance, String reason) {
        log.warn("Evicting server: modelId={}, port={}, reason={}", instance.getModelId(), instance.getPort(), reason);
        ManagedProcess process = processes.remove(instance.getModelId());
        if (process != null) {
            killQuietly(process, instance.getPid());
        } else {
            processLauncher.killByPid(instance.getPid());
        }
        portAllocator.release(instance.getPort());
        serverRegistry.evict(instance.getModelId());
        persist();
        metricsRegistry.incrementEviction();
    }

    /**
     * Re-probes every tracked server, evicting the ones that fail.
     */
    public List<ServerInstance> listRunning() {
        List<ServerInstance> running = new ArrayList<>();
        for (ServerInstance instance : serverRegistry.getAll()) {
            if (httpClient.isHealthy(instance.getBaseUrl())) {
                instance.markHealthy();
                running.add(instance);
            } else {
                evict(instance, "Health probe failed");
            }
        }
        return running;
    }

    public Optional<ServerInstance> getServer(String modelId) {
        return serverRegistry.get(modelId);
    }

    /**
     * True if the model's server is RUNNING and was last probed healthy within
     * the staleness window. Does not probe; {@link #listRunning()} does.
     */
    public boolean isRunning(String modelId) {
        return serverRegistry.get(modelId)
                .map(i -> i.isFresh(settings.staleness()))
                .orElse(false);
    }

    public int usedPortCount() {
        return portAllocator.reservedPorts().size();
    }

    // HTTP surface

    public OperationResult<JsonNode> completion(String modelId, Map<String, Object> body) {
        return withServer(modelId, "completion", url -> httpClient.completion(url, body));
    }

    public OperationResult<JsonNode> chatCompletion(String modelId, Map<String, Object> body) {
        return withServer(modelId, "chat", url -> httpClient.chatCompletion(url, body));
    }

    /**
     * Opens a streaming chat completion. The caller must close the stream.
     */
    public OperationResult<SseChunkStream> chatCompletionStream(String modelId, Map<String, Object> body) {
        return withServer(modelId, "chat_stream", url -> httpClient.chatCompletionStream(url, body));
    }

    public OperationResult<SseChunkStream> completionStream(String modelId, Map<String, Object> body) {
        return withServer(modelId, "completion_stream", url -> httpClient.completionStream(url, body));
    }

    public OperationResult<JsonNode> embeddings(String modelId, Map<String, Object> body) {
        return withServer(modelId, "embeddings", url -> httpClient.embeddings(url, body));
    }

    public OperationResult<TokenCount> tokenizeCount(String modelId, String text) {
        return withServer(modelId, "tokenize", url -> httpClient.tokenizeCount(url, text));
    }

    public OperationResult<JsonNode> health(String modelId) {
        return withServer(modelId, "health", httpClient::health);
    }

    public OperationResult<JsonNode> info(String modelId) {
        return withServer(modelId, "info", httpClient::info);
    }

    public OperationResult<JsonNode> models(String modelId) {
        return withServer(modelId, "models", httpClient::models);
    }

    /**
     * Prometheus metrics of a server, or its health document when the server
     * was started without its metrics endpoint.
     */
    public OperationResult<MetricsSnapshot> metrics(String modelId) {
        return withServer(modelId, "metrics", url -> {
            OperationResult<String> prometheus = httpClient.metrics(url);
            if (prometheus.success()) {
                return prometheus.map(body -> new MetricsSnapshot(MetricsSnapshot.Format.PROMETHEUS, body));
            }
            log.debug("Metrics endpoint unavailable, falling back to health: modelId={}, reason={}",
                    modelId, prometheus.message());
            return httpClient.health(url)
                    .map(node -> new MetricsSnapshot(MetricsSnapshot.Format.HEALTH_JSON, node.toString()));
        });
    }

    private <T> OperationResult<T> withServer(String modelId, String operation, Function<URI, OperationResult<T>> call) {
        Optional<ServerInstance> instance = serverRegistry.get(modelId);
        if (instance.isEmpty()) {
            return OperationResult.failure(ErrorType.NOT_RUNNING, "No server running for model: " + modelId);
        }
        long start = System.nanoTime();
        OperationResult<T> result = call.apply(instance.get().getBaseUrl());
        metricsRegistry.recordLatency(modelId, operation, Duration.ofNanos(System.nanoTime() - start));
        if (result.isFailure()) {
            metricsRegistry.incrementErrorCount(modelId, result.errorType());
            log.warn("Server call failed: modelId={}, operation={}, error={}, message={}",
                    modelId, operation, result.errorType(), result.message());
        }
        return result;
    }

    private void persist() {
        try {
            stateStore.write(serverRegistry.getAll());
        } catch (UncheckedIOException e) {
            log.warn("Failed to persist server state: file={}", stateStore.getStateFile(), e);
        }
    }

    private ReentrantLock lockFor(String modelId) {
        return modelLocks.computeIfAbsent(modelId, id -> new ReentrantLock(true));
    }

    /**
     * Metrics text of one server.
     */
    public record MetricsSnapshot(Format format, String body) {
        public enum Format {
            PROMETHEUS,
            HEALTH_JSON
        }
    }
}
