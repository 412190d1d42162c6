package fr.lapetina.llama.orchestrator.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SseChunkStreamTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SseChunkStream streamOf(String text) {
        return new SseChunkStream(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), objectMapper);
    }

    private static List<JsonNode> drain(SseChunkStream stream) {
        List<JsonNode> chunks = new ArrayList<>();
        stream.forEachRemaining(chunks::add);
        return chunks;
    }

    @Test
    @DisplayName("should yield chunks in order and stop on the sentinel")
    void shouldYieldChunksUntilSentinel() {
        SseChunkStream stream = streamOf("data: {\"i\":1}\n\ndata: {\"i\":2}\n\ndata: [DONE]\n\ndata: {\"i\":3}\n\n");

        List<JsonNode> chunks = drain(stream);

        assertThat(chunks).extracting(c -> c.path("i").asInt()).containsExactly(1, 2);
        assertThat(stream.endedWithSentinel()).isTrue();
        assertThat(stream.isFinished()).isTrue();
        assertThat(stream.hasNext()).isFalse();
    }

    @Test
    @DisplayName("should end cleanly when the connection closes without sentinel")
    void shouldEndOnStreamClose() {
        SseChunkStream stream = streamOf("data: {\"i\":1}\n\n");

        List<JsonNode> chunks = drain(stream);

        assertThat(chunks).hasSize(1);
        assertThat(stream.endedWithSentinel()).isFalse();
        assertThat(stream.transportError()).isEmpty();
    }

    @Test
    @DisplayName("should skip malformed JSON chunks")
    void shouldSkipMalformedChunks() {
        SseChunkStream stream = streamOf("data: {\"i\":1}\n\ndata: {not json\n\ndata: {\"i\":2}\n\ndata: [DONE]\n\n");

        assertThat(drain(stream)).extracting(c -> c.path("i").asInt()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("should skip empty payloads and payloads with trailing content")
    void shouldSkipEmptyAndTrailingPayloads() {
        SseChunkStream stream = streamOf("data:\n\ndata: {\"i\":1}\n\ndata: {\"i\":9}garbage\n\n"
                + "data:   \n\ndata: {\"i\":2}\n\ndata: [DONE]\n\n");

        List<JsonNode> chunks = drain(stream);

        assertThat(chunks).extracting(c -> c.path("i").asInt()).containsExactly(1, 2);
        assertThat(chunks).allMatch(JsonNode::isObject);
    }

    @Test
    @DisplayName("should record a read failure as a transport error")
    void shouldRecordReadFailure() {
        InputStream failing = new InputStream() {
            private final byte[] first = "data: {\"i\":1}\n\n".getBytes(StandardCharsets.UTF_8);
            private int position;

            @Override
            public int read() throws IOException {
                if (position < first.length) {
                    return first[position++];
                }
                throw new IOException("connection reset");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                if (position < first.length) {
                    int count = Math.min(len, first.length - position);
                    System.arraycopy(first, position, b, off, count);
                    position += count;
                    return count;
                }
                throw new IOException("connection reset");
            }
        };
        SseChunkStream stream = new SseChunkStream(failing, objectMapper);

        List<JsonNode> chunks = drain(stream);

        assertThat(chunks).hasSize(1);
        assertThat(stream.transportError()).contains("connection reset");
    }

    @Test
    @DisplayName("should stop yielding after close")
    void shouldStopAfterClose() {
        SseChunkStream stream = streamOf("data: {\"i\":1}\n\ndata: {\"i\":2}\n\n");
        assertThat(stream.next().path("i").asInt()).isEqualTo(1);

        stream.close();

        assertThat(stream.hasNext()).isFalse();
        assertThatThrownBy(stream::next).isInstanceOf(NoSuchElementException.class);
    }
}
