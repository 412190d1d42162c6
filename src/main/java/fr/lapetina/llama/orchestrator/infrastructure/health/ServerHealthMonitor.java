package fr.lapetina.llama.orchestrator.infrastructure.health;

import fr.lapetina.llama.orchestrator.domain.model.ServerInstance;
import fr.lapetina.llama.orchestrator.domain.model.ServerStatus;
import fr.lapetina.llama.orchestrator.infrastructure.http.LlamaServerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background prober for running llama-server instances.
 *
 * Periodically probes each registered instance. A healthy probe refreshes
 * the instance; reaching the failure threshold hands it to the
 * {@link DeadServerHandler}, which stops and evicts it.
 */
public final class ServerHealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServerHealthMonitor.class);

    private final ServerRegistry serverRegistry;
    private final LlamaServerClient httpClient;
    private final DeadServerHandler deadServerHandler;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final int failureThreshold;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ServerHealthMonitor(
            ServerRegistry serverRegistry,
            LlamaServerClient httpClient,
            DeadServerHandler deadServerHandler,
            Duration checkInterval,
            int failureThreshold
    ) {
        this.serverRegistry = serverRegistry;
        this.httpClient = httpClient;
        this.deadServerHandler = deadServerHandler;
        this.checkInterval = checkInterval;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "server-health-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts periodic probing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllServers,
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started with interval: {}", checkInterval);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Probes every registered instance once.
     */
    public void checkAllServers() {
        List<ServerInstance> servers = serverRegistry.getAll();
        log.debug("Starting health check cycle: serverCount={}", servers.size());
        for (ServerInstance instance : servers) {
            try {
                checkServer(instance);
            } catch (Exception e) {
                log.error("Health check crashed: modelId={}", instance.getModelId(), e);
            }
        }
    }

    /**
     * Probes a single instance.
     *
     * @return true if the instance answered healthy
     */
    public boolean checkServer(ServerInstance instance) {
        if (instance.getStatus() == ServerStatus.STARTING || instance.getStatus() == ServerStatus.STOPPED) {
            return false;
        }

        if (httpClient.isHealthy(instance.getBaseUrl())) {
            ServerStatus previous = instance.getStatus();
            instance.markHealthy();
            if (previous != ServerStatus.RUNNING) {
                log.info("Server recovered: modelId={}, port={}", instance.getModelId(), instance.getPort());
            }
            return true;
        }

        int failures = instance.markUnhealthy();
        log.warn("Health check failed: modelId={}, port={}, consecutiveFailures={}",
                instance.getModelId(), instance.getPort(), failures);
        if (failures >= failureThreshold) {
            deadServerHandler.onDeadServer(instance, "Health probe failed " + failures + " time(s)");
        }
        return false;
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health monitor stopped");
    }

    /**
     * Receives instances that failed their probes.
     */
    @FunctionalInterface
    public interface DeadServerHandler {
        void onDeadServer(ServerInstance instance, String reason);
    }
}
