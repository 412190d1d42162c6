package fr.lapetina.llama.orchestrator.hardware;

import fr.lapetina.llama.orchestrator.backend.BackendCatalog;
import fr.lapetina.llama.orchestrator.domain.model.Backend;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Hardware profile derived from the installed backends and the CPU count.
 *
 * GPU backends get every layer offloaded, few CPU threads and larger
 * batches. CPU backends keep all layers on the host and use all cores but one.
 */
public final class DefaultHardwareProfile implements HardwareProfileProvider {

    private static final Set<String> GPU_BACKENDS = Set.of("cuda", "rocm", "vulkan", "metal", "hip", "sycl", "opencl-adreno");

    private final BackendCatalog backendCatalog;
    private final int cpuCores;

    public DefaultHardwareProfile(BackendCatalog backendCatalog, int cpuCores) {
        this.backendCatalog = backendCatalog;
        this.cpuCores = Math.max(1, cpuCores);
    }

    public DefaultHardwareProfile(BackendCatalog backendCatalog) {
        this(backendCatalog, Runtime.getRuntime().availableProcessors());
    }

    @Override
    public Optional<String> detectedBackendId() {
        return backendCatalog.getActiveBackend().map(Backend::id);
    }

    @Override
    public TuningHints tuningHints(String backendId) {
        if (backendId == null) {
            return new TuningHints(-1, 0, 512, false);
        }
        if (isGpuBackend(backendId)) {
            return new TuningHints(-1, 4, 1024, true);
        }
        return new TuningHints(0, Math.max(1, cpuCores - 1), 512, false);
    }

    static boolean isGpuBackend(String backendId) {
        String id = backendId.toLowerCase(Locale.ROOT);
        return GPU_BACKENDS.contains(id) || id.startsWith("cuda-") || id.startsWith("hip-");
    }
}
