package fr.lapetina.llama.orchestrator.infrastructure.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the orchestrator.
 * Designed to be populated from YAML.
 */
public class OrchestratorConfig {

    private String home;
    private PortsConfig ports = new PortsConfig();
    private StartupConfig startup = new StartupConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private BackendsConfig backends = new BackendsConfig();
    private DefaultsConfig defaults = new DefaultsConfig();
    private LegacyConfig legacy = new LegacyConfig();
    private Map<String, String> models = new LinkedHashMap<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public String getHome() { return home; }
    public void setHome(String home) { this.home = home; }

    public PortsConfig getPorts() { return ports; }
    public void setPorts(PortsConfig ports) { this.ports = ports; }

    public StartupConfig getStartup() { return startup; }
    public void setStartup(StartupConfig startup) { this.startup = startup; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public BackendsConfig getBackends() { return backends; }
    public void setBackends(BackendsConfig backends) { this.backends = backends; }

    public DefaultsConfig getDefaults() { return defaults; }
    public void setDefaults(DefaultsConfig defaults) { this.defaults = defaults; }

    public LegacyConfig getLegacy() { return legacy; }
    public void setLegacy(LegacyConfig legacy) { this.legacy = legacy; }

    public Map<String, String> getModels() { return models; }
    public void setModels(Map<String, String> models) { this.models = models; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * State directory; {@code ~/.llama-orchestrator} unless configured.
     */
    public Path homePath() {
        if (home == null || home.isBlank()) {
            return Paths.get(System.getProperty("user.home"), ".llama-orchestrator");
        }
        if (home.startsWith("~")) {
            return Paths.get(System.getProperty("user.home") + home.substring(1));
        }
        return Paths.get(home);
    }

    /**
     * Backend install directory; {@code <home>/backends} unless configured.
     */
    public Path backendsPath() {
        String directory = backends.getDirectory();
        return directory == null || directory.isBlank() ? homePath().resolve("backends") : Paths.get(directory);
    }

    public Path stateFilePath() {
        return homePath().resolve("server_state.json");
    }

    /**
     * Port range handed out to spawned servers.
     */
    public static class PortsConfig {
        private String host = "127.0.0.1";
        private int rangeStart = 8080;
        private int rangeEnd = 8180;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getRangeStart() { return rangeStart; }
        public void setRangeStart(int rangeStart) { this.rangeStart = rangeStart; }

        /** Exclusive. */
        public int getRangeEnd() { return rangeEnd; }
        public void setRangeEnd(int rangeEnd) { this.rangeEnd = rangeEnd; }
    }

    /**
     * Server startup and shutdown bounds.
     */
    public static class StartupConfig {
        private long timeoutMs = 60000;
        private long pollIntervalMs = 500;
        private long stopGraceMs = 10000;
        private int stderrTailChars = 2000;

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        public long getStopGraceMs() { return stopGraceMs; }
        public void setStopGraceMs(long stopGraceMs) { this.stopGraceMs = stopGraceMs; }

        public int getStderrTailChars() { return stderrTailChars; }
        public void setStderrTailChars(int stderrTailChars) { this.stderrTailChars = stderrTailChars; }
    }

    /**
     * Per-operation HTTP timeouts.
     */
    public static class TimeoutsConfig {
        private long connectMs = 5000;
        private long healthMs = 5000;
        private long infoMs = 5000;
        private long tokenizeMs = 30000;
        private long embeddingsMs = 60000;
        private long generationMs = 120000;

        public long getConnectMs() { return connectMs; }
        public void setConnectMs(long connectMs) { this.connectMs = connectMs; }

        public long getHealthMs() { return healthMs; }
        public void setHealthMs(long healthMs) { this.healthMs = healthMs; }

        public long getInfoMs() { return infoMs; }
        public void setInfoMs(long infoMs) { this.infoMs = infoMs; }

        public long getTokenizeMs() { return tokenizeMs; }
        public void setTokenizeMs(long tokenizeMs) { this.tokenizeMs = tokenizeMs; }

        public long getEmbeddingsMs() { return embeddingsMs; }
        public void setEmbeddingsMs(long embeddingsMs) { this.embeddingsMs = embeddingsMs; }

        public long getGenerationMs() { return generationMs; }
        public void setGenerationMs(long generationMs) { this.generationMs = generationMs; }
    }

    /**
     * Background health monitoring.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 30000;
        private long stalenessMs = 90000;
        private int failureThreshold = 1;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getStalenessMs() { return stalenessMs; }
        public void setStalenessMs(long stalenessMs) { this.stalenessMs = stalenessMs; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
    }

    /**
     * Backend binaries.
     */
    public static class BackendsConfig {
        private String directory;
        private String releasesApiUrl = "https://api.github.com/repos/ggml-org/llama.cpp/releases/latest";
        private long releaseCacheMs = 300000;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getReleasesApiUrl() { return releasesApiUrl; }
        public void setReleasesApiUrl(String releasesApiUrl) { this.releasesApiUrl = releasesApiUrl; }

        public long getReleaseCacheMs() { return releaseCacheMs; }
        public void setReleaseCacheMs(long releaseCacheMs) { this.releaseCacheMs = releaseCacheMs; }
    }

    /**
     * Default inference settings. Unset runtime values come from hardware hints.
     */
    public static class DefaultsConfig {
        private Integer contextSize;
        private Integer batchSize;
        private Integer threads;
        private Integer gpuLayers;
        private Integer parallel;
        private double temperature = 0.7;
        private double topP = 0.95;
        private int topK = 40;
        private double repeatPenalty = 1.1;
        private int maxTokens = 2048;

        public Integer getContextSize() { return contextSize; }
        public void setContextSize(Integer contextSize) { this.contextSize = contextSize; }

        public Integer getBatchSize() { return batchSize; }
        public void setBatchSize(Integer batchSize) { this.batchSize = batchSize; }

        public Integer getThreads() { return threads; }
        public void setThreads(Integer threads) { this.threads = threads; }

        public Integer getGpuLayers() { return gpuLayers; }
        public void setGpuLayers(Integer gpuLayers) { this.gpuLayers = gpuLayers; }

        public Integer getParallel() { return parallel; }
        public void setParallel(Integer parallel) { this.parallel = parallel; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public double getTopP() { return topP; }
        public void setTopP(double topP) { this.topP = topP; }

        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }

        public double getRepeatPenalty() { return repeatPenalty; }
        public void setRepeatPenalty(double repeatPenalty) { this.repeatPenalty = repeatPenalty; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    }

    /**
     * Legacy child-process transport.
     */
    public static class LegacyConfig {
        private List<String> processCommand = new ArrayList<>();
        private long readyTimeoutMs = 60000;
        private long requestTimeoutMs = 120000;

        /** Command prefix; model path and a JSON config are appended. */
        public List<String> getProcessCommand() { return processCommand; }
        public void setProcessCommand(List<String> processCommand) { this.processCommand = processCommand; }

        public long getReadyTimeoutMs() { return readyTimeoutMs; }
        public void setReadyTimeoutMs(long readyTimeoutMs) { this.readyTimeoutMs = readyTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llama_orch";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
