package fr.lapetina.llama.orchestrator.infrastructure.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a process stream on a daemon thread, keeping only its last characters.
 * Keeping the pipe drained stops the child from blocking on a full buffer.
 */
public final class OutputTail {

    private static final Logger log = LoggerFactory.getLogger(OutputTail.class);

    private final int maxChars;
    private final StringBuilder buffer = new StringBuilder();
    private final Thread drainer;

    private OutputTail(InputStream stream, int maxChars, String threadName) {
        this.maxChars = maxChars;
        this.drainer = new Thread(() -> drain(stream), threadName);
        this.drainer.setDaemon(true);
    }

    /**
     * Starts draining the stream in the background.
     */
    public static OutputTail start(InputStream stream, int maxChars, String threadName) {
        OutputTail tail = new OutputTail(stream, maxChars, threadName);
        tail.drainer.start();
        return tail;
    }

    private void drain(InputStream stream) {
        char[] chunk = new char[4096];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(chunk)) != -1) {
                append(chunk, read);
            }
        } catch (IOException e) {
            log.debug("Output stream closed: thread={}, error={}", drainer.getName(), e.getMessage());
        }
    }

    private synchronized void append(char[] chunk, int length) {
        buffer.append(chunk, 0, length);
        int overflow = buffer.length() - maxChars;
        if (overflow > 0) {
            buffer.delete(0, overflow);
        }
    }

    public synchronized String get() {
        return buffer.toString();
    }

    /**
     * Waits briefly for the drainer to reach end of stream, so the tail is
     * complete after the process exits.
     */
    public String awaitAndGet(long millis) {
        try {
            drainer.join(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return get();
    }
}
