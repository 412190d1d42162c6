package fr.lapetina.llama.orchestrator.inference;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llama.orchestrator.domain.exception.InferenceException;
import fr.lapetina.llama.orchestrator.domain.model.ChatMessage;
import fr.lapetina.llama.orchestrator.domain.model.ChatSession;
import fr.lapetina.llama.orchestrator.domain.model.CompletionResult;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.InferenceConfig;
import fr.lapetina.llama.orchestrator.domain.model.InferenceMode;
import fr.lapetina.llama.orchestrator.domain.model.SamplingParameters;
import fr.lapetina.llama.orchestrator.domain.model.ServerInstance;
import fr.lapetina.llama.orchestrator.support.FakeLlamaServer;
import fr.lapetina.llama.orchestrator.support.LegacyChildScript;
import fr.lapetina.llama.orchestrator.support.TestOrchestratorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InferenceFacadeTest {

    @TempDir
    Path tempDir;

    private TestOrchestratorFactory factory;

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private InferenceFacade facade() {
        if (factory == null) {
            factory = TestOrchestratorFactory.create(tempDir);
        }
        return factory.getInferenceFacade();
    }

    private FakeLlamaServer serverOf(String modelId) {
        ServerInstance instance = factory.getOrchestrator().getServer(modelId).orElseThrow();
        return factory.getLauncher().serverOnPort(instance.getPort());
    }

    @Nested
    class ServerBacked {

        @Test
        @DisplayName("should load a model and complete a prompt")
        void shouldLoadAndComplete() {
            InferenceFacade facade = facade();

            LoadedModel model = facade.load("m1");
            CompletionResult result = facade.complete("m1", "Hi");

            assertThat(model.getMode()).isEqualTo(InferenceMode.SERVER_BACKED);
            assertThat(result.content()).isEqualTo("Hello from llama");
            assertThat(result.completionTokens()).isEqualTo(3);
            assertThat(facade.isLoaded("m1")).isTrue();
            ModelStats stats = facade.getLoadedModels().get(0);
            assertThat(stats.requestCount()).isEqualTo(1);
            assertThat(stats.totalTokensGenerated()).isEqualTo(3);
            assertThat(stats.port()).isEqualTo(factory.getOrchestrator().getServer("m1").orElseThrow().getPort());
        }

        @Test
        @DisplayName("should return the loaded model on a repeated load")
        void shouldLoadIdempotently() {
            InferenceFacade facade = facade();

            LoadedModel first = facade.load("m1");
            LoadedModel second = facade.load("m1", InferenceConfig.builder().contextSize(1024).build());

            assertThat(second).isSameAs(first);
            assertThat(factory.getLauncher().getLaunchCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should send resolved sampling parameters and chat history")
        void shouldSendChatRequest() {
            InferenceFacade facade = facade();
            facade.load("m1");

            facade.chat("m1", List.of(ChatMessage.system("Be brief"), ChatMessage.user("Hi")),
                    SamplingParameters.of(16, 0.2));

            JsonNode request = serverOf("m1").getRequests().get(0);
            assertThat(request.path("messages")).hasSize(2);
            assertThat(request.path("messages").get(1).path("content").asText()).isEqualTo("Hi");
            assertThat(request.path("max_tokens").asInt()).isEqualTo(16);
            assertThat(request.path("temperature").asDouble()).isEqualTo(0.2);
            assertThat(request.path("top_p").asDouble()).isEqualTo(facade.getDefaultConfig().topP());
        }

        @Test
        @DisplayName("should serialize concurrent requests against one model")
        void shouldSerializeRequests() throws Exception {
            InferenceFacade facade = facade();
            facade.load("m1");
            serverOf("m1").setGenerationDelayMs(50);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Callable<CompletionResult>> calls = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    String prompt = "p" + i;
                    calls.add(() -> facade.complete("m1", prompt));
                }
                for (Future<CompletionResult> future : pool.invokeAll(calls)) {
                    assertThat(future.get(10, TimeUnit.SECONDS).content()).isEqualTo("Hello from llama");
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(serverOf("m1").getMaxInFlight()).isEqualTo(1);
            assertThat(facade.getLoadedModel("m1").orElseThrow().getRequestCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should stream tokens and hold the model until the stream is finished")
        void shouldHoldLockWhileStreaming() throws Exception {
            InferenceFacade facade = facade();
            facade.load("m1");
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                TokenStream stream = facade.completeStream("m1", "first", null);
                Future<CompletionResult> waiting = pool.submit(() -> facade.complete("m1", "second"));

                Thread.sleep(200);
                assertThat(waiting.isDone()).isFalse();

                List<String> tokens = new ArrayList<>();
                try (stream) {
                    stream.forEachRemaining(tokens::add);
                }

                assertThat(tokens).containsExactly("Hel", "lo", "!");
                assertThat(waiting.get(5, TimeUnit.SECONDS).content()).isEqualTo("Hello from llama");
                assertThat(serverOf("m1").getEvents())
                        .containsSubsequence("start:first", "end:first", "start:second");
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("should release the model when a stream is closed early")
        void shouldReleaseOnEarlyClose() {
            InferenceFacade facade = facade();
            facade.load("m1");

            try (TokenStream stream = facade.chatStream("m1", List.of(ChatMessage.user("Hi")), null)) {
                assertThat(stream.next()).isEqualTo("Hel");
            }

            assertThat(facade.complete("m1", "again").content()).isEqualTo("Hello from llama");
        }

        @Test
        @DisplayName("should drop the model when its server is evicted")
        void shouldDropEvictedModel() {
            InferenceFacade facade = facade();
            facade.load("m1");
            serverOf("m1").setHealthy(false);

            factory.getOrchestrator().listRunning();

            assertThat(facade.isLoaded("m1")).isFalse();
            assertThatThrownBy(() -> facade.complete("m1", "Hi"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Model not loaded: m1");
        }

        @Test
        @DisplayName("should drop the model when its server is stopped directly")
        void shouldDropModelOnServerStop() {
            InferenceFacade facade = facade();
            facade.load("m1");

            assertThat(factory.getOrchestrator().stop("m1").success()).isTrue();

            assertThat(facade.isLoaded("m1")).isFalse();
            assertThat(facade.loadedModelCount()).isZero();
            assertThatThrownBy(() -> facade.complete("m1", "Hi"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Model not loaded: m1");

            facade.load("m1");
            assertThat(facade.complete("m1", "Hi").content()).isEqualTo("Hello from llama");
            assertThat(factory.getLauncher().getLaunchCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should unload a model and stop its server")
        void shouldUnload() {
            InferenceFacade facade = facade();
            facade.load("m1");

            assertThat(facade.unload("m1")).isTrue();
            assertThat(facade.unload("m1")).isFalse();
            assertThat(factory.getOrchestrator().isRunning("m1")).isFalse();
            assertThat(facade.loadedModelCount()).isZero();
        }

        @Test
        @DisplayName("should reject unknown models and generation before load")
        void shouldRejectUnknownModels() {
            InferenceFacade facade = facade();

            assertThatThrownBy(() -> facade.load("nope"))
                    .isInstanceOfSatisfying(InferenceException.class,
                            e -> assertThat(e.getErrorType()).isEqualTo(ErrorType.CONFIGURATION_ERROR));
            assertThatThrownBy(() -> facade.complete("m1", "Hi")).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should surface a failed server start")
        void shouldSurfaceStartFailure() {
            InferenceFacade facade = facade();
            factory.getCatalog().clear();

            assertThatThrownBy(() -> facade.load("m1"))
                    .isInstanceOfSatisfying(InferenceException.class,
                            e -> assertThat(e.getErrorType()).isEqualTo(ErrorType.CONFIGURATION_ERROR))
                    .hasMessageContaining("No llama.cpp backend installed");
            assertThat(facade.isLoaded("m1")).isFalse();
        }
    }

    @Nested
    class Defaults {

        @Test
        @DisplayName("should derive defaults from the CPU backend")
        void shouldDeriveCpuDefaults() {
            InferenceConfig defaults = facade().getDefaultConfig();

            assertThat(defaults.contextSize()).isEqualTo(4096);
            assertThat(defaults.gpuLayers()).isZero();
            assertThat(defaults.batchSize()).isEqualTo(512);
            assertThat(defaults.threads()).isEqualTo(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        }

        @Test
        @DisplayName("should switch to GPU defaults once a GPU backend is installed")
        void shouldDeriveGpuDefaults() {
            InferenceFacade facade = facade();
            factory.getCatalog().install("cuda", true);

            InferenceConfig defaults = facade.reloadDefaults();

            assertThat(defaults.gpuLayers()).isEqualTo(-1);
            assertThat(defaults.batchSize()).isEqualTo(1024);
            assertThat(defaults.threads()).isEqualTo(4);
        }
    }

    @Nested
    class Sessions {

        @Test
        @DisplayName("should keep the transcript of a session")
        void shouldKeepTranscript() {
            InferenceFacade facade = facade();
            facade.load("m1");
            ChatSession session = facade.createSession("m1", "You are terse");

            facade.sendMessage(session.getId(), "Hi", null);
            facade.sendMessage(session.getId(), "Again", null);

            assertThat(session.getId()).hasSize(8);
            assertThat(session.getMessages()).extracting(ChatMessage::role)
                    .containsExactly("system", "user", "assistant", "user", "assistant");
            assertThat(serverOf("m1").getRequests().get(1).path("messages")).hasSize(4);
        }

        @Test
        @DisplayName("should append a streamed reply only once fully consumed")
        void shouldAppendStreamedReply() {
            InferenceFacade facade = facade();
            facade.load("m1");
            ChatSession session = facade.createSession("m1", null);

            try (TokenStream stream = facade.sendMessageStream(session.getId(), "Hi", null)) {
                stream.forEachRemaining(token -> { });
            }
            try (TokenStream stream = facade.sendMessageStream(session.getId(), "Cut", null)) {
                stream.next();
            }

            assertThat(session.getMessages()).extracting(ChatMessage::content)
                    .containsExactly("Hi", "Hello!", "Cut");
        }

        @Test
        @DisplayName("should serialize concurrent turns of one session")
        void shouldSerializeSessionTurns() throws Exception {
            InferenceFacade facade = facade();
            facade.load("m1");
            serverOf("m1").setGenerationDelayMs(100);
            ChatSession session = facade.createSession("m1", null);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                List<Callable<CompletionResult>> turns = List.of(
                        () -> facade.sendMessage(session.getId(), "first", null),
                        () -> facade.sendMessage(session.getId(), "second", null));
                for (Future<CompletionResult> future : pool.invokeAll(turns)) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(session.getMessages()).extracting(ChatMessage::role)
                    .containsExactly("user", "assistant", "user", "assistant");
            assertThat(serverOf("m1").getRequests())
                    .extracting(request -> request.path("messages").size())
                    .containsExactly(1, 3);
        }

        @Test
        @DisplayName("should list, find and delete sessions")
        void shouldManageSessions() {
            InferenceFacade facade = facade();
            ChatSession first = facade.createSession("m1", null);
            ChatSession second = facade.createSession("m2", null);

            assertThat(facade.listSessions()).containsExactlyInAnyOrder(first, second);
            assertThat(facade.deleteSession(first.getId())).isTrue();
            assertThat(facade.getSession(first.getId())).isEmpty();
            assertThat(facade.getSession(second.getId())).contains(second);
            assertThatThrownBy(() -> facade.sendMessage("missing", "Hi", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Unknown chat session: missing");
        }
    }

    @Nested
    class ProcessBacked {

        @Test
        @DisplayName("should generate through a child process")
        void shouldGenerateThroughChildProcess() {
            InferenceFacade facade = facade();
            factory.getLauncher().setLegacyScript(new LegacyChildScript().reply("from child").tokens(List.of("a", "b")));

            LoadedModel model = facade.load("m2", null, InferenceMode.PROCESS_BACKED);
            CompletionResult completion = facade.complete("m2", "Hi");
            CompletionResult chat = facade.chat("m2", List.of(ChatMessage.user("Hi")));
            List<String> tokens = new ArrayList<>();
            try (TokenStream stream = facade.completeStream("m2", "Hi", null)) {
                stream.forEachRemaining(tokens::add);
            }

            assertThat(model.getMode()).isEqualTo(InferenceMode.PROCESS_BACKED);
            assertThat(model.stats().port()).isNull();
            assertThat(completion.content()).isEqualTo("from child");
            assertThat(completion.completionTokens()).isEqualTo(2);
            assertThat(chat.content()).isEqualTo("from child");
            assertThat(tokens).containsExactly("a", "b");
            assertThat(factory.getLauncher().getCommands().get(0)).startsWith("fake-inference");
            assertThat(facade.unload("m2")).isTrue();
        }

        @Test
        @DisplayName("should fail the load when the child cannot load the model")
        void shouldFailLoad() {
            InferenceFacade facade = facade();
            factory.getLauncher().setLegacyScript(new LegacyChildScript().failLoad());

            assertThatThrownBy(() -> facade.load("m2", null, InferenceMode.PROCESS_BACKED))
                    .isInstanceOfSatisfying(InferenceException.class,
                            e -> assertThat(e.getErrorType()).isEqualTo(ErrorType.CONFIGURATION_ERROR));
            assertThat(facade.isLoaded("m2")).isFalse();
        }

        @Test
        @DisplayName("should drop the model when its inference process dies")
        void shouldDropModelWhenChildDies() {
            InferenceFacade facade = facade();
            facade.load("m2", null, InferenceMode.PROCESS_BACKED);

            factory.getLauncher().lastInteractive().exit(1);

            assertThat(facade.isLoaded("m2")).isFalse();
            assertThat(facade.getLoadedModels()).isEmpty();
            assertThatThrownBy(() -> facade.complete("m2", "Hi"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Model not loaded: m2");
        }

        @Test
        @DisplayName("should kill a child that misses the request timeout instead of reusing its late reply")
        void shouldKillChildOnRequestTimeout() {
            InferenceFacade facade = facade();
            factory.getLauncher().setLegacyScript(new LegacyChildScript().reply("late").replyDelayMs(2500));
            facade.load("m2", null, InferenceMode.PROCESS_BACKED);

            assertThatThrownBy(() -> facade.complete("m2", "first"))
                    .isInstanceOfSatisfying(InferenceException.class,
                            e -> assertThat(e.getErrorType()).isEqualTo(ErrorType.TRANSPORT_ERROR))
                    .hasMessageContaining("timed out");

            assertThat(factory.getLauncher().lastInteractive().exitCode()).hasValue(137);
            assertThat(facade.isLoaded("m2")).isFalse();
            assertThatThrownBy(() -> facade.complete("m2", "second"))
                    .isInstanceOf(IllegalStateException.class);

            factory.getLauncher().setLegacyScript(new LegacyChildScript().reply("fresh"));
            facade.load("m2", null, InferenceMode.PROCESS_BACKED);
            assertThat(facade.complete("m2", "third").content()).isEqualTo("fresh");
        }

        @Test
        @DisplayName("should report request errors from the child")
        void shouldReportRequestErrors() {
            InferenceFacade facade = facade();
            factory.getLauncher().setLegacyScript(new LegacyChildScript().requestError("KV cache full"));
            facade.load("m2", null, InferenceMode.PROCESS_BACKED);

            assertThatThrownBy(() -> facade.complete("m2", "Hi"))
                    .isInstanceOf(InferenceException.class)
                    .hasMessageContaining("KV cache full");
        }
    }

    @Nested
    class LibraryBacked {

        @Test
        @DisplayName("should generate through the in-process library")
        void shouldGenerateThroughLibrary() {
            StubLibrary library = new StubLibrary();
            factory = TestOrchestratorFactory.create(tempDir, library);
            InferenceFacade facade = factory.getInferenceFacade();

            facade.load("m1", null, InferenceMode.LIBRARY_BACKED);
            CompletionResult result = facade.complete("m1", "Hi");
            List<String> tokens = new ArrayList<>();
            try (TokenStream stream = facade.chatStream("m1", List.of(ChatMessage.user("Hi")), null)) {
                stream.forEachRemaining(tokens::add);
            }
            facade.unload("m1");

            assertThat(result.content()).isEqualTo("lib:Hi");
            assertThat(tokens).containsExactly("x", "y");
            assertThat(library.closed).isTrue();
            assertThat(factory.getLauncher().getLaunchCount()).isZero();
        }

        @Test
        @DisplayName("should refuse library mode without a library")
        void shouldRefuseWithoutLibrary() {
            assertThatThrownBy(() -> facade().load("m1", null, InferenceMode.LIBRARY_BACKED))
                    .isInstanceOf(InferenceException.class)
                    .hasMessage("No inference library available for library mode");
        }
    }

    private static final class StubLibrary implements InferenceLibrary {
        private volatile boolean closed;

        @Override
        public Model load(Path modelPath, InferenceConfig config) {
            return new Model() {
                @Override
                public CompletionResult complete(String prompt, SamplingParameters params) {
                    return new CompletionResult("lib:" + prompt, "stop", 1, 1, 2, null);
                }

                @Override
                public CompletionResult chat(List<ChatMessage> messages, SamplingParameters params) {
                    return new CompletionResult("lib-chat", "stop", 1, 1, 2, null);
                }

                @Override
                public Iterator<String> completeStream(String prompt, SamplingParameters params) {
                    return List.of("x", "y").iterator();
                }

                @Override
                public Iterator<String> chatStream(List<ChatMessage> messages, SamplingParameters params) {
                    return List.of("x", "y").iterator();
                }

                @Override
                public void close() {
                    closed = true;
                }
            };
        }
    }
}
