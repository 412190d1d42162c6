package fr.lapetina.llama.orchestrator.infrastructure.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.OptionalInt;

/**
 * Handle on a spawned child process.
 */
public interface ManagedProcess {

    long pid();

    boolean isAlive();

    /**
     * Requests a graceful shutdown (SIGTERM or platform equivalent).
     */
    void terminate();

    /**
     * Kills the process and its descendants without waiting.
     */
    void forceKill();

    /**
     * Waits up to the given duration for the process to exit.
     *
     * @return true if the process has exited
     * @throws InterruptedException if interrupted while waiting
     */
    boolean waitFor(Duration timeout) throws InterruptedException;

    /**
     * Exit code, empty while the process is still running.
     */
    OptionalInt exitCode();

    /**
     * Most recent standard-error output, bounded in size.
     */
    String stderrTail();

    /**
     * Standard output, only readable for interactive launches.
     */
    InputStream stdout();

    /**
     * Standard input, only writable for interactive launches.
     */
    OutputStream stdin();
}
