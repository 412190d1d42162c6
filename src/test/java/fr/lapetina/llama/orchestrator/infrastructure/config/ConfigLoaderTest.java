package fr.lapetina.llama.orchestrator.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        try (ConfigLoader loader = new ConfigLoader("test-orchestrator.yaml")) {
            OrchestratorConfig config = loader.load();

            assertThat(config.getPorts().getRangeStart()).isEqualTo(9000);
            assertThat(config.getPorts().getRangeEnd()).isEqualTo(9010);
            assertThat(config.getStartup().getTimeoutMs()).isEqualTo(1500);
            assertThat(config.getStartup().getStopGraceMs()).isEqualTo(10000);
            assertThat(config.getHealthCheck().isEnabled()).isFalse();
            assertThat(config.getDefaults().getContextSize()).isEqualTo(2048);
            assertThat(config.getDefaults().getGpuLayers()).isNull();
            assertThat(config.getLegacy().getProcessCommand()).containsExactly("python3", "-m", "inference_worker");
            assertThat(config.getModels()).containsEntry("tiny", "/models/tiny.gguf");
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_orch");
            assertThat(config.stateFilePath()).isEqualTo(Path.of("/tmp/llama-orchestrator-test/server_state.json"));
            assertThat(loader.getCurrentConfig()).isSameAs(config);
        }
    }

    @Test
    @DisplayName("should prefer a file on disk")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "ports:\n  rangeStart: 10000\n  rangeEnd: 10100\n");

        try (ConfigLoader loader = new ConfigLoader(file.toString())) {
            OrchestratorConfig config = loader.load();

            assertThat(config.getPorts().getRangeStart()).isEqualTo(10000);
            assertThat(config.getStartup().getTimeoutMs()).isEqualTo(60000);
        }
    }

    @Test
    @DisplayName("should use defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
            OrchestratorConfig config = loader.loadFromStream(new ByteArrayInputStream(new byte[0]));

            assertThat(config.getPorts().getRangeStart()).isEqualTo(8080);
            assertThat(config.getPorts().getRangeEnd()).isEqualTo(8180);
            assertThat(config.getStartup().getTimeoutMs()).isEqualTo(60000);
            assertThat(config.backendsPath()).isEqualTo(config.homePath().resolve("backends"));
        }
    }

    @Test
    @DisplayName("should reject an inverted port range")
    void shouldRejectInvertedPortRange() {
        String yaml = "ports:\n  rangeStart: 9000\n  rangeEnd: 8000\n";
        try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
            assertThatThrownBy(() -> loader.loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Invalid port range");
        }
    }

    @Test
    @DisplayName("should fail when the file exists nowhere")
    void shouldFailWhenMissing() {
        try (ConfigLoader loader = new ConfigLoader(tempDir.resolve("absent.yaml").toString())) {
            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }

    @Test
    @DisplayName("should notify listeners and keep the current config when a reload fails")
    void shouldKeepCurrentConfigOnFailedReload() throws IOException {
        Path file = tempDir.resolve("orchestrator.yaml");
        Files.writeString(file, "ports:\n  rangeStart: 9100\n  rangeEnd: 9200\n");
        List<Integer> seen = new ArrayList<>();

        try (ConfigLoader loader = new ConfigLoader(file.toString())) {
            loader.addListener((oldConfig, newConfig) -> seen.add(newConfig.getPorts().getRangeStart()));
            OrchestratorConfig first = loader.load();

            Files.writeString(file, "ports: [this is not a mapping");
            OrchestratorConfig afterFailure = loader.reload();

            Files.writeString(file, "ports:\n  rangeStart: 9300\n  rangeEnd: 9400\n");
            OrchestratorConfig afterFix = loader.reload();

            assertThat(afterFailure).isSameAs(first);
            assertThat(afterFix.getPorts().getRangeStart()).isEqualTo(9300);
            assertThat(seen).containsExactly(9100, 9300);
        }
    }
}
