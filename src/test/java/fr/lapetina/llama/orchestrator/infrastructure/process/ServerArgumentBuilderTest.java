package fr.lapetina.llama.orchestrator.infrastructure.process;

import fr.lapetina.llama.orchestrator.domain.model.ServerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerArgumentBuilderTest {

    private static ServerConfig.Builder base() {
        return ServerConfig.builder()
                .modelPath("/models/m1.gguf")
                .port(8081);
    }

    @Test
    @DisplayName("should emit only required flags for a default configuration")
    void shouldEmitOnlyRequiredFlagsForDefaults() {
        List<String> args = ServerArgumentBuilder.buildArguments(base().build());

        assertThat(args).containsExactly(
                "--model", "/models/m1.gguf",
                "--host", "127.0.0.1",
                "--port", "8081",
                "--ctx-size", "4096",
                "--n-gpu-layers", "-1",
                "--batch-size", "512",
                "--parallel", "1"
        );
    }

    @Test
    @DisplayName("should prefix the executable when building a command")
    void shouldPrefixExecutable() {
        List<String> command = ServerArgumentBuilder.buildCommand(Path.of("/opt/llama/llama-server"), base().build());

        assertThat(command.get(0)).isEqualTo(Path.of("/opt/llama/llama-server").toString());
        assertThat(command.subList(1, 3)).containsExactly("--model", "/models/m1.gguf");
    }

    @Test
    @DisplayName("should append optional flags that deviate from defaults")
    void shouldAppendDeviatingOptionalFlags() {
        ServerConfig config = base()
                .threads(6)
                .flashAttention(true)
                .noMmap(true)
                .mlock(true)
                .numa("distribute")
                .tensorSplit(List.of(3.0, 1.5))
                .seed(42L)
                .ropeFreqBase(10000.0)
                .metricsEndpoint(true)
                .alias("chat")
                .build();

        List<String> args = ServerArgumentBuilder.buildArguments(config);

        assertThat(args).containsSequence("--threads", "6");
        assertThat(args).contains("--flash-attn", "--no-mmap", "--mlock", "--metrics");
        assertThat(args).containsSequence("--numa", "distribute");
        assertThat(args).containsSequence("--tensor-split", "3,1.5");
        assertThat(args).containsSequence("--seed", "42");
        assertThat(args).containsSequence("--rope-freq-base", "10000");
        assertThat(args).containsSequence("--alias", "chat");
        assertThat(args).doesNotContain("--embedding", "--no-cont-batching", "--main-gpu", "--split-mode");
    }

    @Test
    @DisplayName("should leave thread count to the server when zero")
    void shouldOmitThreadsWhenZero() {
        List<String> args = ServerArgumentBuilder.buildArguments(base().threads(0).build());

        assertThat(args).doesNotContain("--threads");
    }

    @Test
    @DisplayName("should skip blank string options")
    void shouldSkipBlankStringOptions() {
        List<String> args = ServerArgumentBuilder.buildArguments(base().chatTemplate("  ").build());

        assertThat(args).doesNotContain("--chat-template");
    }

    @Test
    @DisplayName("should reject a missing model path")
    void shouldRejectMissingModelPath() {
        ServerConfig config = ServerConfig.builder().port(8080).build();

        assertThatThrownBy(() -> ServerArgumentBuilder.buildArguments(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Model path");
    }

    @Test
    @DisplayName("should reject out of range values")
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> ServerArgumentBuilder.buildArguments(base().port(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerArgumentBuilder.buildArguments(base().gpuLayers(-2).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerArgumentBuilder.buildArguments(base().contextSize(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerArgumentBuilder.buildArguments(base().parallel(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should format doubles without trailing zeros")
    void shouldFormatDoubles() {
        assertThat(ServerArgumentBuilder.formatNumber(0.10)).isEqualTo("0.1");
        assertThat(ServerArgumentBuilder.formatNumber(2.0)).isEqualTo("2");
        assertThat(ServerArgumentBuilder.formatNumber(0.25)).isEqualTo("0.25");
    }
}
