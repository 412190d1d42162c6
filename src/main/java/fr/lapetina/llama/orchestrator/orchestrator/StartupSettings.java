package fr.lapetina.llama.orchestrator.orchestrator;

import fr.lapetina.llama.orchestrator.infrastructure.config.OrchestratorConfig;

import java.time.Duration;

/**
 * Timing knobs for spawning and stopping servers.
 *
 * @param host           interface spawned servers bind to
 * @param startupTimeout bound on the readiness poll
 * @param pollInterval   delay between readiness probes
 * @param stopGrace      wait after a graceful terminate before forcing a kill
 * @param staleness      how long a successful probe keeps a server counted as running
 */
public record StartupSettings(
        String host,
        Duration startupTimeout,
        Duration pollInterval,
        Duration stopGrace,
        Duration staleness
) {

    public static StartupSettings defaults() {
        return new StartupSettings("127.0.0.1", Duration.ofSeconds(60), Duration.ofMillis(500), Duration.ofSeconds(10),
                Duration.ofSeconds(90));
    }

    public static StartupSettings from(OrchestratorConfig config) {
        OrchestratorConfig.StartupConfig startup = config.getStartup();
        return new StartupSettings(
                config.getPorts().getHost(),
                Duration.ofMillis(startup.getTimeoutMs()),
                Duration.ofMillis(startup.getPollIntervalMs()),
                Duration.ofMillis(startup.getStopGraceMs()),
                Duration.ofMillis(config.getHealthCheck().getStalenessMs())
        );
    }
}
