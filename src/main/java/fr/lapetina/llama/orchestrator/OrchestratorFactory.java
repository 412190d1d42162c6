package fr.lapetina.llama.orchestrator;

import fr.lapetina.llama.orchestrator.backend.BackendCatalog;
import fr.lapetina.llama.orchestrator.backend.BackendInstaller;
import fr.lapetina.llama.orchestrator.backend.HostPlatform;
import fr.lapetina.llama.orchestrator.backend.LocalBackendCatalog;
import fr.lapetina.llama.orchestrator.hardware.DefaultHardwareProfile;
import fr.lapetina.llama.orchestrator.hardware.HardwareProfileProvider;
import fr.lapetina.llama.orchestrator.inference.InferenceFacade;
import fr.lapetina.llama.orchestrator.inference.InferenceLibrary;
import fr.lapetina.llama.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.llama.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.llama.orchestrator.infrastructure.health.ServerHealthMonitor;
import fr.lapetina.llama.orchestrator.infrastructure.health.ServerRegistry;
import fr.lapetina.llama.orchestrator.infrastructure.http.LlamaServerClient;
import fr.lapetina.llama.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llama.orchestrator.infrastructure.process.NativeProcessLauncher;
import fr.lapetina.llama.orchestrator.infrastructure.process.PortAllocator;
import fr.lapetina.llama.orchestrator.infrastructure.process.ProcessLauncher;
import fr.lapetina.llama.orchestrator.infrastructure.state.ServerStateStore;
import fr.lapetina.llama.orchestrator.orchestrator.ServerOrchestrator;
import fr.lapetina.llama.orchestrator.orchestrator.StartupSettings;
import fr.lapetina.llama.orchestrator.registry.InMemoryModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Builds and owns every service of the orchestrator from one configuration file.
 * Services are plain objects wired here; nothing is reachable globally.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("orchestrator.yaml").start()) {
 *     InferenceFacade inference = factory.getInferenceFacade();
 *     inference.load("m1");
 *     // use inference...
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final ConfigLoader configLoader;
    private final OrchestratorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final BackendCatalog backendCatalog;
    private final HardwareProfileProvider hardwareProfile;
    private final InMemoryModelRegistry modelRegistry;
    private final ServerRegistry serverRegistry;
    private final LlamaServerClient httpClient;
    private final ServerOrchestrator orchestrator;
    private final ServerHealthMonitor healthMonitor;
    private final InferenceFacade inferenceFacade;

    /**
     * @param launcherOverride process launcher to use instead of spawning native processes, may be null
     * @param catalogOverride  backend catalog to use instead of the on-disk one, may be null
     * @param libraryOverride  in-process engine for library mode, may be null
     */
    protected OrchestratorFactory(
            String configPath,
            ProcessLauncher launcherOverride,
            BackendCatalog catalogOverride,
            InferenceLibrary libraryOverride
    ) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        HostPlatform platform = HostPlatform.current();
        this.backendCatalog = catalogOverride != null ? catalogOverride : createBackendCatalog(platform);
        this.hardwareProfile = new DefaultHardwareProfile(backendCatalog);
        this.modelRegistry = new InMemoryModelRegistry(config.getModels());

        ProcessLauncher launcher = launcherOverride != null
                ? launcherOverride
                : new NativeProcessLauncher(config.getStartup().getStderrTailChars());

        this.serverRegistry = new ServerRegistry();
        this.httpClient = new LlamaServerClient(createTimeouts());

        OrchestratorConfig.PortsConfig ports = config.getPorts();
        PortAllocator portAllocator = new PortAllocator(ports.getHost(), ports.getRangeStart(), ports.getRangeEnd());

        this.orchestrator = new ServerOrchestrator(
                backendCatalog,
                launcher,
                portAllocator,
                new ServerStateStore(config.stateFilePath()),
                serverRegistry,
                httpClient,
                metricsRegistry,
                StartupSettings.from(config),
                platform
        );

        this.healthMonitor = new ServerHealthMonitor(
                serverRegistry,
                httpClient,
                orchestrator::evict,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()),
                config.getHealthCheck().getFailureThreshold()
        );

        this.inferenceFacade = new InferenceFacade(
                orchestrator,
                serverRegistry,
                modelRegistry,
                hardwareProfile,
                launcher,
                config.getDefaults(),
                config.getLegacy(),
                libraryOverride,
                metricsRegistry
        );

        configLoader.addListener(this::onConfigChanged);

        metricsRegistry.registerGauge("running_servers", "Tracked llama-server instances", serverRegistry::size);
        metricsRegistry.registerGauge("loaded_models", "Models ready to serve requests", inferenceFacade::loadedModelCount);
        metricsRegistry.registerGauge("used_ports", "Ports reserved for servers", orchestrator::usedPortCount);

        log.info("OrchestratorFactory initialized: backends={}, models={}",
                backendCatalog.listInstalled().size(), modelRegistry.listModels().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        return new OrchestratorFactory(configPath, null, null, null);
    }

    /**
     * Creates a factory from the default configuration (orchestrator.yaml).
     */
    public static OrchestratorFactory create() {
        return create("orchestrator.yaml");
    }

    /**
     * Starts background health checking and configuration watching.
     */
    public OrchestratorFactory start() {
        if (config.getHealthCheck().isEnabled()) {
            healthMonitor.start();
        }
        configLoader.startWatching();
        log.info("Orchestrator started");
        return this;
    }

    public InferenceFacade getInferenceFacade() {
        return inferenceFacade;
    }

    public ServerOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public BackendCatalog getBackendCatalog() {
        return backendCatalog;
    }

    public InMemoryModelRegistry getModelRegistry() {
        return modelRegistry;
    }

    public ServerRegistry getServerRegistry() {
        return serverRegistry;
    }

    public ServerHealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private BackendCatalog createBackendCatalog(HostPlatform platform) {
        OrchestratorConfig.BackendsConfig backends = config.getBackends();
        BackendInstaller installer = new BackendInstaller(
                config.backendsPath(),
                platform,
                URI.create(backends.getReleasesApiUrl()),
                Duration.ofMillis(backends.getReleaseCacheMs())
        );
        return new LocalBackendCatalog(config.backendsPath(), platform, installer);
    }

    private LlamaServerClient.Timeouts createTimeouts() {
        OrchestratorConfig.TimeoutsConfig timeouts = config.getTimeouts();
        return new LlamaServerClient.Timeouts(
                Duration.ofMillis(timeouts.getConnectMs()),
                Duration.ofMillis(timeouts.getHealthMs()),
                Duration.ofMillis(timeouts.getInfoMs()),
                Duration.ofMillis(timeouts.getTokenizeMs()),
                Duration.ofMillis(timeouts.getEmbeddingsMs()),
                Duration.ofMillis(timeouts.getGenerationMs())
        );
    }

    private void onConfigChanged(OrchestratorConfig oldConfig, OrchestratorConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        if (newConfig.getModels() != null) {
            newConfig.getModels().forEach((modelId, path) -> modelRegistry.register(modelId, Paths.get(path)));
        }
        inferenceFacade.reloadDefaults(newConfig.getDefaults());

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            healthMonitor.close();
        } catch (Exception e) {
            log.warn("Error closing health monitor", e);
        }

        try {
            inferenceFacade.close();
        } catch (Exception e) {
            log.warn("Error closing inference facade", e);
        }

        try {
            orchestrator.stopAll();
        } catch (Exception e) {
            log.warn("Error stopping servers", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("OrchestratorFactory shut down");
    }
}
