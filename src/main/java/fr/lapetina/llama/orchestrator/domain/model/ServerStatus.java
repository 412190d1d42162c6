package fr.lapetina.llama.orchestrator.domain.model;

/**
 * Lifecycle status of a native server instance.
 *
 * STARTING: process spawned, waiting for the first successful health probe
 * RUNNING: last health probe succeeded
 * UNHEALTHY: last health probe failed, eviction pending
 * STOPPED: process terminated and registry entry released
 */
public enum ServerStatus {
    STARTING,
    RUNNING,
    UNHEALTHY,
    STOPPED
}
