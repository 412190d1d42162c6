package fr.lapetina.llama.orchestrator.infrastructure.http;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental Server-Sent-Events parser.
 *
 * Bytes are fed in whatever chunks the network delivers; the parser
 * accumulates them into lines (LF, CR or CRLF terminated), collects
 * {@code data:} fields and dispatches one payload per blank line. Lines are
 * decoded as UTF-8 only once complete, so multi-byte characters split across
 * chunks survive. The payload {@code [DONE]} moves the parser to a terminal
 * state in which all further input is ignored.
 *
 * Not thread-safe; one instance per stream.
 */
public final class SseStreamParser {

    public static final String DONE_SENTINEL = "[DONE]";

    enum State {
        /** Accumulating bytes of the current line. */
        IN_LINE,
        /** A CR ended the previous line; a directly following LF belongs to it. */
        AFTER_CR,
        /** The sentinel was seen. */
        DONE
    }

    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);
    private final StringBuilder data = new StringBuilder();
    private boolean hasData;
    private State state = State.IN_LINE;

    /**
     * Feeds the next chunk of raw bytes.
     *
     * @return payloads completed by this chunk, in arrival order, sentinel excluded
     */
    public List<String> feed(byte[] chunk, int offset, int length) {
        List<String> payloads = new ArrayList<>();
        for (int i = offset; i < offset + length && state != State.DONE; i++) {
            byte b = chunk[i];
            switch (state) {
                case AFTER_CR -> {
                    state = State.IN_LINE;
                    if (b != '\n') {
                        consume(b, payloads);
                    }
                }
                case IN_LINE -> consume(b, payloads);
                default -> {
                    // terminal
                }
            }
        }
        return payloads;
    }

    public List<String> feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    /**
     * Signals end of stream. A trailing line without terminator and a
     * pending event without blank line are still dispatched.
     */
    public List<String> finish() {
        List<String> payloads = new ArrayList<>();
        if (state == State.DONE) {
            return payloads;
        }
        if (line.size() > 0) {
            endLine(payloads);
        }
        if (state != State.DONE) {
            dispatch(payloads);
        }
        return payloads;
    }

    public boolean isDone() {
        return state == State.DONE;
    }

    State state() {
        return state;
    }

    private void consume(byte b, List<String> payloads) {
        if (b == '\n') {
            endLine(payloads);
        } else if (b == '\r') {
            endLine(payloads);
            if (state != State.DONE) {
                state = State.AFTER_CR;
            }
        } else {
            line.write(b);
        }
    }

    private void endLine(List<String> payloads) {
        String text = line.toString(StandardCharsets.UTF_8);
        line.reset();

        if (text.isEmpty()) {
            dispatch(payloads);
            return;
        }
        if (text.charAt(0) == ':') {
            return;
        }

        int colon = text.indexOf(':');
        String field = colon >= 0 ? text.substring(0, colon) : text;
        String value = colon >= 0 ? text.substring(colon + 1) : "";
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }

        // event, id and retry carry nothing for llama-server streams
        if ("data".equals(field)) {
            if (hasData) {
                data.append('\n');
            }
            data.append(value);
            hasData = true;
        }
    }

    private void dispatch(List<String> payloads) {
        if (!hasData) {
            return;
        }
        String payload = data.toString();
        data.setLength(0);
        hasData = false;

        if (DONE_SENTINEL.equals(payload.trim())) {
            state = State.DONE;
            return;
        }
        payloads.add(payload);
    }
}
