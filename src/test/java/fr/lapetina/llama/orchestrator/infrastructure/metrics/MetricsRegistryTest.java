package fr.lapetina.llama.orchestrator.infrastructure.metrics;

import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;
    private MeterRegistry registry;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test");
        registry = metrics.getRegistry();
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count server starts per outcome")
    void shouldCountStartsByOutcome() {
        metrics.incrementServerStart("started");
        metrics.incrementServerStart("started");
        metrics.incrementServerStart("startup_timeout");

        assertThat(registry.get("test_server_starts_total").tag("outcome", "started").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_server_starts_total").tag("outcome", "startup_timeout").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count lifecycle events")
    void shouldCountLifecycleEvents() {
        metrics.incrementServerStop();
        metrics.incrementEviction();
        metrics.incrementOrphanKill();
        metrics.incrementOrphanKill();

        assertThat(registry.get("test_server_stops_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_server_evictions_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_orphan_kills_total").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should record latency and errors per model")
    void shouldRecordLatencyAndErrors() {
        metrics.recordLatency("m1", "chat", Duration.ofMillis(120));
        metrics.recordLatency("m1", "chat", Duration.ofMillis(80));
        metrics.incrementErrorCount("m1", ErrorType.TRANSPORT_ERROR);

        assertThat(registry.get("test_request_latency").tags("model", "m1", "operation", "chat").timer().count()).isEqualTo(2);
        assertThat(registry.get("test_errors_total").tags("model", "m1", "type", "TRANSPORT_ERROR").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should expose gauges in the Prometheus scrape")
    void shouldExposeGauges() {
        AtomicInteger running = new AtomicInteger(3);
        metrics.registerGauge("running_servers", "Running servers", running::get);

        assertThat(registry.get("test_running_servers").gauge().value()).isEqualTo(3.0);
        assertThat(metrics.scrape()).contains("test_running_servers 3.0");
    }
}
