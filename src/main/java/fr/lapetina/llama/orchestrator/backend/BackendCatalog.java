package fr.lapetina.llama.orchestrator.backend;

import fr.lapetina.llama.orchestrator.domain.model.Backend;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Inventory of llama-server builds for this host.
 *
 * Absence is never an error here: lookups return empty when nothing is
 * installed and callers decide what that means.
 */
public interface BackendCatalog {

    /**
     * Backends offered for this platform, with their install state.
     */
    List<Backend> listAvailable();

    /**
     * Backends with an install marker on disk.
     */
    List<Backend> listInstalled();

    /**
     * The preferred installed backend: the first one requiring a GPU, else the first installed.
     */
    Optional<Backend> getActiveBackend();

    /**
     * Resolves the server executable of a backend.
     *
     * @param backendId backend to resolve, or null for the active backend
     */
    Optional<Path> getServerExecutable(String backendId);

    /**
     * Highest-priority backend offered on this platform, {@code cpu} as a last resort.
     */
    String getRecommended();

    /**
     * Downloads and installs a backend.
     *
     * @param cancel checked between download chunks; setting it aborts the install
     */
    OperationResult<Backend> download(String backendId, ProgressListener progress, AtomicBoolean cancel);

    /**
     * Removes an installed backend.
     */
    OperationResult<Void> uninstall(String backendId);
}
