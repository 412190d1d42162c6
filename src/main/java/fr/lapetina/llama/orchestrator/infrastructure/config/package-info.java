/**
 * Configuration loading and hot-reload support.
 *
 * <p>YAML configuration is parsed into
 * {@link fr.lapetina.llama.orchestrator.infrastructure.config.OrchestratorConfig} by
 * {@link fr.lapetina.llama.orchestrator.infrastructure.config.ConfigLoader}. When the file
 * changes on disk, registered
 * {@link fr.lapetina.llama.orchestrator.infrastructure.config.ConfigChangeListener}s are notified.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code home} - state directory (server table, backends)</li>
 *   <li>{@code ports} - bind host and candidate port range for spawned servers</li>
 *   <li>{@code startup} - startup timeout, probe interval, stop grace period</li>
 *   <li>{@code timeouts} - per-operation HTTP timeouts</li>
 *   <li>{@code healthCheck} - background probing</li>
 *   <li>{@code backends} - install directory and release source</li>
 *   <li>{@code defaults} - default runtime and sampling settings</li>
 *   <li>{@code legacy} - child-process transport command</li>
 *   <li>{@code models} - model id to file path</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.llama.orchestrator.infrastructure.config;
