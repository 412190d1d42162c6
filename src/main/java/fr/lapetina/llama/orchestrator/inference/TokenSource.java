package fr.lapetina.llama.orchestrator.inference;

import java.util.Iterator;

/**
 * Incremental text output of one generation request.
 * Closing before exhaustion abandons the rest of the output.
 */
public interface TokenSource extends Iterator<String>, AutoCloseable {

    @Override
    void close();
}
