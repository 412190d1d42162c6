package fr.lapetina.llama.orchestrator.inference;

import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streaming generation handed to callers.
 *
 * The model stays locked while the stream is open. The lock is released
 * exactly once, when the stream is exhausted, fails, or is closed, whichever
 * comes first. Consume it on any thread but always close it, preferably with
 * try-with-resources.
 */
public final class TokenStream implements TokenSource {

    private final TokenSource source;
    private final CompletionCallback callback;
    private final StringBuilder text = new StringBuilder();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private int tokenCount;
    private boolean exhausted;

    TokenStream(TokenSource source, CompletionCallback callback) {
        this.source = source;
        this.callback = callback;
    }

    @Override
    public boolean hasNext() {
        if (finished.get()) {
            return false;
        }
        boolean more;
        try {
            more = source.hasNext();
        } catch (RuntimeException e) {
            finish();
            throw e;
        }
        if (!more) {
            exhausted = true;
            finish();
        }
        return more;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream is finished");
        }
        String token;
        try {
            token = source.next();
        } catch (RuntimeException e) {
            finish();
            throw e;
        }
        text.append(token);
        tokenCount++;
        return token;
    }

    /**
     * Text produced so far.
     */
    public String getText() {
        return text.toString();
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public boolean isFinished() {
        return finished.get();
    }

    @Override
    public void close() {
        finish();
    }

    private void finish() {
        if (finished.compareAndSet(false, true)) {
            try {
                source.close();
            } finally {
                callback.onComplete(text.toString(), tokenCount, exhausted);
            }
        }
    }

    @FunctionalInterface
    interface CompletionCallback {
        /**
         * @param exhausted true if the source ran to its natural end
         */
        void onComplete(String text, int tokenCount, boolean exhausted);
    }
}
