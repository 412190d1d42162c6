package fr.lapetina.llama.orchestrator.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Decoded JSON chunks of one streaming response.
 *
 * Chunks come out in arrival order. Payloads that are not exactly one JSON
 * value (empty, malformed or followed by trailing content) are logged and
 * skipped. The stream terminates exactly once, on the
 * {@code [DONE]} sentinel, on end of input or on a read failure; the
 * underlying input is closed at that point. Not thread-safe.
 */
public final class SseChunkStream implements Iterator<JsonNode>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SseChunkStream.class);
    private static final int READ_BUFFER_SIZE = 8192;

    private final InputStream input;
    private final ObjectReader reader;
    private final SseStreamParser parser = new SseStreamParser();
    private final Deque<JsonNode> pending = new ArrayDeque<>();
    private final byte[] buffer = new byte[READ_BUFFER_SIZE];

    private boolean finished;
    private boolean sentinelSeen;
    private String transportError;

    public SseChunkStream(InputStream input, ObjectMapper objectMapper) {
        this.input = input;
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !finished) {
            readMore();
        }
        return !pending.isEmpty();
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream exhausted");
        }
        return pending.poll();
    }

    private void readMore() {
        int read;
        try {
            read = input.read(buffer);
        } catch (IOException e) {
            log.warn("Stream read failed: error={}", e.getMessage());
            transportError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            terminate();
            return;
        }

        if (read == -1) {
            enqueue(parser.finish());
            terminate();
            return;
        }

        enqueue(parser.feed(buffer, 0, read));
        if (parser.isDone()) {
            sentinelSeen = true;
            terminate();
        }
    }

    private void enqueue(Iterable<String> payloads) {
        for (String payload : payloads) {
            try {
                JsonNode chunk = reader.readTree(payload);
                if (chunk == null || chunk.isMissingNode()) {
                    log.warn("Skipping empty stream chunk");
                    continue;
                }
                pending.add(chunk);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed stream chunk: length={}, error={}", payload.length(), e.getOriginalMessage());
            }
        }
    }

    private void terminate() {
        if (finished) {
            return;
        }
        finished = true;
        try {
            input.close();
        } catch (IOException e) {
            log.debug("Error closing stream: {}", e.getMessage());
        }
    }

    /**
     * True once no more input will be read.
     */
    public boolean isFinished() {
        return finished;
    }

    /**
     * True if the stream ended on the {@code [DONE]} sentinel rather than on end of input.
     */
    public boolean endedWithSentinel() {
        return sentinelSeen;
    }

    /**
     * Read failure that ended the stream early, if any.
     */
    public Optional<String> transportError() {
        return Optional.ofNullable(transportError);
    }

    /**
     * Stops reading and releases the connection. Chunks already decoded are discarded.
     */
    @Override
    public void close() {
        pending.clear();
        terminate();
    }
}
