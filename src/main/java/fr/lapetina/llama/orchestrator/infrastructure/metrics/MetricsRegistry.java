package fr.lapetina.llama.orchestrator.infrastructure.metrics;

import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Server lifecycle counters (starts by outcome, stops, evictions, orphan kills)
 * - Request latency timers per model and operation
 * - Error counters by type
 * - Gauges for running servers, loaded models and reserved ports
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> startCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    private final Counter stopCounter;
    private final Counter evictionCounter;
    private final Counter orphanKillCounter;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.stopCounter = Counter.builder(prefix + "_server_stops_total")
                .description("Servers stopped on request")
                .register(registry);
        this.evictionCounter = Counter.builder(prefix + "_server_evictions_total")
                .description("Servers evicted after a failed health probe")
                .register(registry);
        this.orphanKillCounter = Counter.builder(prefix + "_orphan_kills_total")
                .description("Kill attempts against servers left over from a previous run")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("llama_orch");
    }

    /**
     * Counts a start attempt. Outcome is {@code started}, {@code reused} or an error type name.
     */
    public void incrementServerStart(String outcome) {
        startCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_server_starts_total")
                        .description("Server start attempts by outcome")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void incrementServerStop() {
        stopCounter.increment();
    }

    public void incrementEviction() {
        evictionCounter.increment();
    }

    public void incrementOrphanKill() {
        orphanKillCounter.increment();
    }

    /**
     * Records the latency of one request against a model.
     */
    public void recordLatency(String modelId, String operation, Duration latency) {
        String key = modelId + ":" + operation;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency")
                        .tag("model", modelId)
                        .tag("operation", operation)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the error counter.
     */
    public void incrementErrorCount(String modelId, ErrorType errorType) {
        String key = modelId + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("model", modelId)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge backed by a supplier, e.g. the number of running servers.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
