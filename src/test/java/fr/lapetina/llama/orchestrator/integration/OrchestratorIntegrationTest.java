package fr.lapetina.llama.orchestrator.integration;

import fr.lapetina.llama.orchestrator.domain.model.CompletionResult;
import fr.lapetina.llama.orchestrator.domain.model.ServerInstance;
import fr.lapetina.llama.orchestrator.inference.InferenceFacade;
import fr.lapetina.llama.orchestrator.support.TestOrchestratorFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the wired orchestrator against fake llama-server processes.
 * Configuration is written per test under a temporary home.
 */
class OrchestratorIntegrationTest {

    @TempDir
    Path tempDir;

    private TestOrchestratorFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestOrchestratorFactory.create(tempDir);
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should serve a model from load to shutdown")
    void shouldServeModelLifecycle() {
        InferenceFacade facade = factory.getInferenceFacade();

        facade.load("m1");
        CompletionResult result = facade.complete("m1", "Hello");
        ServerInstance server = factory.getOrchestrator().getServer("m1").orElseThrow();
        factory.close();
        factory = null;

        assertThat(result.content()).isEqualTo("Hello from llama");
        assertThat(server.getPort()).isBetween(18080, 18179);
        assertThat(tempDir.resolve("server_state.json")).content().doesNotContain("\"m1\"");
    }

    @Test
    @DisplayName("should expose gauges for servers, models and ports")
    void shouldExposeGauges() {
        factory.getInferenceFacade().load("m1");
        MeterRegistry registry = factory.getMetricsRegistry().getRegistry();

        assertThat(registry.get("llama_orch_running_servers").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("llama_orch_loaded_models").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("llama_orch_used_ports").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should kill servers left behind by a crashed run")
    void shouldKillServersOfCrashedRun() throws IOException {
        factory.getInferenceFacade().load("m1");
        Path stateFile = tempDir.resolve("server_state.json");
        String crashedState = Files.readString(stateFile);
        long pid = factory.getOrchestrator().getServer("m1").orElseThrow().getPid();
        factory.close();
        Files.writeString(stateFile, crashedState);

        factory = TestOrchestratorFactory.create(tempDir);

        assertThat(factory.getLauncher().getKilledPids()).containsExactly(pid);
        assertThat(factory.getOrchestrator().listRunning()).isEmpty();
        assertThat(stateFile).content().doesNotContain("\"m1\"");
    }

    @Test
    @DisplayName("should apply reloaded models and defaults")
    void shouldApplyReloadedConfig() throws IOException {
        Path config = tempDir.resolve("orchestrator.yaml");
        Path extraModel = Files.writeString(tempDir.resolve("models").resolve("m3.gguf"), "GGUF");
        Files.writeString(config, Files.readString(config)
                + "  m3: '" + extraModel.toString().replace("'", "''") + "'\n"
                + "defaults:\n"
                + "  contextSize: 2048\n");

        factory.getConfigLoader().reload();

        assertThat(factory.getModelRegistry().resolvePath("m3")).contains(extraModel);
        assertThat(factory.getInferenceFacade().getDefaultConfig().contextSize()).isEqualTo(2048);
        assertThat(factory.getInferenceFacade().load("m3").getConfig().contextSize()).isEqualTo(2048);
    }
}
