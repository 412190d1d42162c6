package fr.lapetina.llama.orchestrator.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A build of the native inference server targeting one acceleration technology
 * (CPU, CUDA, Vulkan, Metal, HIP, SYCL...).
 *
 * @param id               catalog key, e.g. {@code cuda}, {@code vulkan}, {@code cpu}
 * @param displayName      human-readable name
 * @param description      short description
 * @param size             approximate download size, informational only
 * @param requiresGpu      whether the backend needs an accelerator
 * @param installed        whether an install marker was found on disk
 * @param installedVersion release tag of the installed build, null when not installed
 * @param installPath      backend directory, null when not installed
 */
public record Backend(
        String id,
        String displayName,
        String description,
        String size,
        boolean requiresGpu,
        boolean installed,
        String installedVersion,
        Path installPath
) {
    public Backend {
        Objects.requireNonNull(id, "Backend ID is required");
        if (displayName == null) {
            displayName = id;
        }
        if (description == null) {
            description = "";
        }
        if (size == null) {
            size = "Unknown";
        }
    }

    /**
     * Whether spawned servers need the install directory on the native library path.
     */
    public boolean needsLibraryPath() {
        return id.startsWith("cuda") || id.startsWith("hip");
    }
}
