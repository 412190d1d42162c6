package fr.lapetina.llama.orchestrator.hardware;

import fr.lapetina.llama.orchestrator.support.StubBackendCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultHardwareProfileTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should offload everything on GPU backends")
    void shouldTuneForGpu() {
        DefaultHardwareProfile profile = new DefaultHardwareProfile(new StubBackendCatalog(tempDir), 16);

        assertThat(profile.tuningHints("cuda")).isEqualTo(new TuningHints(-1, 4, 1024, true));
        assertThat(profile.tuningHints("cuda-12.4")).isEqualTo(new TuningHints(-1, 4, 1024, true));
        assertThat(profile.tuningHints("Vulkan").accelerated()).isTrue();
    }

    @Test
    @DisplayName("should keep layers on the host and leave one core free on CPU backends")
    void shouldTuneForCpu() {
        DefaultHardwareProfile profile = new DefaultHardwareProfile(new StubBackendCatalog(tempDir), 8);

        assertThat(profile.tuningHints("cpu")).isEqualTo(new TuningHints(0, 7, 512, false));
        assertThat(new DefaultHardwareProfile(new StubBackendCatalog(tempDir), 1).tuningHints("cpu").threads())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should fall back to auto values without a backend")
    void shouldUseAutoValuesWithoutBackend() {
        DefaultHardwareProfile profile = new DefaultHardwareProfile(new StubBackendCatalog(tempDir), 8);

        assertThat(profile.detectedBackendId()).isEmpty();
        assertThat(profile.tuningHints(null)).isEqualTo(new TuningHints(-1, 0, 512, false));
    }

    @Test
    @DisplayName("should detect the active backend")
    void shouldDetectActiveBackend() {
        StubBackendCatalog catalog = new StubBackendCatalog(tempDir).install("cpu", false).install("metal", true);

        assertThat(new DefaultHardwareProfile(catalog, 8).detectedBackendId()).contains("metal");
    }
}
