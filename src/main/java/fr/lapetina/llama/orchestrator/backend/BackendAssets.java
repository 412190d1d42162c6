package fr.lapetina.llama.orchestrator.backend;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static knowledge about llama.cpp release builds: which backend ids exist on
 * which platform, the asset name pattern of each, and display information.
 *
 * Patterns use {@code {version}} for the release tag and
 * {@code {cuda_version}} for the CUDA toolkit version.
 */
final class BackendAssets {

    record Info(String name, String description, String size, boolean requiresGpu) {
    }

    private static final Map<String, Info> INFO = Map.of(
            "cpu", new Info("CPU (OpenBLAS)", "CPU-only inference with OpenBLAS optimization", "~17 MB", false),
            "cuda", new Info("NVIDIA CUDA", "GPU acceleration for NVIDIA GPUs (latest CUDA version)", "~200 MB (includes runtime)", true),
            "vulkan", new Info("Vulkan", "Cross-platform GPU (NVIDIA, AMD, Intel)", "~32 MB", true),
            "hip", new Info("AMD ROCm/HIP (Radeon)", "GPU acceleration for AMD Radeon GPUs", "~340 MB", true),
            "sycl", new Info("Intel SYCL/OneAPI", "GPU acceleration for Intel Arc/Xe GPUs", "~106 MB", true),
            "metal", new Info("Apple Metal", "GPU acceleration for Apple Silicon", "~14 MB", true),
            "opencl-adreno", new Info("OpenCL Adreno (Windows ARM)", "GPU acceleration for Qualcomm Adreno GPUs", "~14 MB", true)
    );

    private BackendAssets() {
    }

    /**
     * Backend ids offered for a platform, in table order, mapped to their asset pattern.
     */
    static Map<String, String> patternsFor(HostPlatform platform) {
        Map<String, String> patterns = new LinkedHashMap<>();
        switch (platform.os()) {
            case WINDOWS -> {
                if ("arm64".equals(platform.arch())) {
                    patterns.put("cpu", "llama-{version}-bin-win-cpu-arm64.zip");
                    patterns.put("opencl-adreno", "llama-{version}-bin-win-opencl-adreno-arm64.zip");
                } else {
                    patterns.put("cpu", "llama-{version}-bin-win-cpu-x64.zip");
                    patterns.put("cuda", "llama-{version}-bin-win-cuda-{cuda_version}-x64.zip");
                    patterns.put("vulkan", "llama-{version}-bin-win-vulkan-x64.zip");
                    patterns.put("sycl", "llama-{version}-bin-win-sycl-x64.zip");
                    patterns.put("hip", "llama-{version}-bin-win-hip-radeon-x64.zip");
                }
            }
            case LINUX -> {
                if ("s390x".equals(platform.arch())) {
                    patterns.put("cpu", "llama-{version}-bin-ubuntu-s390x.zip");
                } else if ("x64".equals(platform.arch())) {
                    patterns.put("cpu", "llama-{version}-bin-ubuntu-x64.zip");
                    patterns.put("vulkan", "llama-{version}-bin-ubuntu-vulkan-x64.zip");
                }
            }
            case MACOS -> patterns.put("metal", "llama-{version}-bin-macos-" + platform.arch() + ".zip");
        }
        return patterns;
    }

    /**
     * Preferred backend order for a platform.
     */
    static List<String> priorityFor(HostPlatform platform) {
        return switch (platform.os()) {
            case WINDOWS -> List.of("cuda", "vulkan", "hip", "sycl", "cpu");
            case MACOS -> List.of("metal", "cpu");
            case LINUX -> List.of("vulkan", "cpu");
        };
    }

    static Info infoFor(String backendId) {
        return INFO.getOrDefault(backendId, new Info(backendId, "", "Unknown", false));
    }
}
