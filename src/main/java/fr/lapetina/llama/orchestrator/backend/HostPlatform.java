package fr.lapetina.llama.orchestrator.backend;

import java.util.Locale;

/**
 * Operating system and CPU architecture the catalog resolves assets for.
 *
 * @param os   host operating system
 * @param arch normalized architecture: {@code x64}, {@code arm64} or {@code s390x}
 */
public record HostPlatform(Os os, String arch) {

    public enum Os {
        WINDOWS,
        LINUX,
        MACOS
    }

    /**
     * Detects the platform of the running JVM.
     */
    public static HostPlatform current() {
        return of(System.getProperty("os.name", ""), System.getProperty("os.arch", ""));
    }

    /**
     * Normalizes JVM {@code os.name} and {@code os.arch} values.
     */
    public static HostPlatform of(String osName, String osArch) {
        String name = osName.toLowerCase(Locale.ROOT);
        Os os;
        if (name.startsWith("windows")) {
            os = Os.WINDOWS;
        } else if (name.startsWith("mac") || name.contains("darwin")) {
            os = Os.MACOS;
        } else {
            os = Os.LINUX;
        }

        String arch = switch (osArch.toLowerCase(Locale.ROOT)) {
            case "aarch64", "arm64" -> "arm64";
            case "s390x" -> "s390x";
            default -> "x64";
        };
        return new HostPlatform(os, arch);
    }

    public boolean isWindows() {
        return os == Os.WINDOWS;
    }

    /**
     * File name of the server executable on this platform.
     */
    public String serverExecutableName() {
        return isWindows() ? "llama-server.exe" : "llama-server";
    }

    /**
     * Environment variable the dynamic linker searches for shared libraries.
     */
    public String libraryPathVariable() {
        return switch (os) {
            case WINDOWS -> "PATH";
            case MACOS -> "DYLD_LIBRARY_PATH";
            case LINUX -> "LD_LIBRARY_PATH";
        };
    }

    public String displayName() {
        return switch (os) {
            case WINDOWS -> "Windows";
            case MACOS -> "Darwin";
            case LINUX -> "Linux";
        };
    }
}
