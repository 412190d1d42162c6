package fr.lapetina.llama.orchestrator.infrastructure.process;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Seam between the orchestrator and the operating system.
 */
public interface ProcessLauncher {

    /**
     * Spawns a background server process. Standard output is discarded and
     * standard error is captured into a bounded tail.
     *
     * @param command     executable followed by its arguments
     * @param environment variables layered over the inherited environment
     */
    ManagedProcess launch(List<String> command, Map<String, String> environment) throws IOException;

    /**
     * Spawns a process whose standard input and output are kept open for a
     * line-based protocol.
     */
    ManagedProcess launchInteractive(List<String> command, Map<String, String> environment) throws IOException;

    /**
     * Forcibly kills a process by id, including processes from a previous run.
     *
     * @return true if a kill was issued
     */
    boolean killByPid(long pid);
}
