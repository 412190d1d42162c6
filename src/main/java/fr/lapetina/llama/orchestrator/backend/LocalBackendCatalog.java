package fr.lapetina.llama.orchestrator.backend;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llama.orchestrator.domain.model.Backend;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link BackendCatalog} over a directory of installed backends.
 *
 * Layout: {@code <backendsDir>/<backendId>/installed.json} marks an install;
 * the server executable lives somewhere below that directory.
 */
public final class LocalBackendCatalog implements BackendCatalog {

    private static final Logger log = LoggerFactory.getLogger(LocalBackendCatalog.class);
    private static final Pattern BACKEND_ID = Pattern.compile("[a-z0-9][a-z0-9.-]*");

    private final Path backendsDir;
    private final HostPlatform platform;
    private final BackendInstaller installer;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public LocalBackendCatalog(Path backendsDir, HostPlatform platform, BackendInstaller installer) {
        this.backendsDir = Objects.requireNonNull(backendsDir, "Backends directory is required");
        this.platform = Objects.requireNonNull(platform, "Platform is required");
        this.installer = installer;
    }

    public Path getBackendsDir() {
        return backendsDir;
    }

    public HostPlatform getPlatform() {
        return platform;
    }

    @Override
    public List<Backend> listAvailable() {
        List<Backend> available = new ArrayList<>();
        for (String backendId : BackendAssets.patternsFor(platform).keySet()) {
            available.add(toBackend(backendId, readMarker(backendId)));
        }
        return available;
    }

    @Override
    public List<Backend> listInstalled() {
        if (!Files.isDirectory(backendsDir)) {
            return List.of();
        }
        List<String> priority = BackendAssets.priorityFor(platform);
        Comparator<String> order = Comparator
                .comparingInt((String id) -> priority.contains(id) ? priority.indexOf(id) : priority.size())
                .thenComparing(Comparator.naturalOrder());

        try (Stream<Path> dirs = Files.list(backendsDir)) {
            return dirs.filter(Files::isDirectory)
                    .map(dir -> dir.getFileName().toString())
                    .filter(id -> !id.startsWith("."))
                    .sorted(order)
                    .map(id -> readMarker(id).map(marker -> toBackend(id, Optional.of(marker))))
                    .flatMap(Optional::stream)
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list backends: dir={}, error={}", backendsDir, e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<Backend> getActiveBackend() {
        List<Backend> installed = listInstalled();
        return installed.stream()
                .filter(Backend::requiresGpu)
                .findFirst()
                .or(() -> installed.stream().findFirst());
    }

    @Override
    public Optional<Path> getServerExecutable(String backendId) {
        String id = backendId;
        if (id == null || id.isBlank()) {
            Optional<Backend> active = getActiveBackend();
            if (active.isEmpty()) {
                log.debug("No backend installed: dir={}", backendsDir);
                return Optional.empty();
            }
            id = active.get().id();
        }
        if (!BACKEND_ID.matcher(id).matches()) {
            return Optional.empty();
        }

        Path backendDir = backendsDir.resolve(id);
        if (!Files.isDirectory(backendDir)) {
            return Optional.empty();
        }

        String executableName = platform.serverExecutableName();
        for (Path candidate : List.of(backendDir.resolve("bin").resolve(executableName), backendDir.resolve(executableName))) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }

        try (Stream<Path> files = Files.walk(backendDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.equals("llama-server") || name.equals("llama-server.exe");
                    })
                    .findFirst();
        } catch (IOException e) {
            log.warn("Cannot search backend directory: dir={}, error={}", backendDir, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String getRecommended() {
        Map<String, String> offered = BackendAssets.patternsFor(platform);
        return BackendAssets.priorityFor(platform).stream()
                .filter(offered::containsKey)
                .findFirst()
                .orElse("cpu");
    }

    @Override
    public OperationResult<Backend> download(String backendId, ProgressListener progress, AtomicBoolean cancel) {
        if (backendId == null || !BACKEND_ID.matcher(backendId).matches()) {
            return OperationResult.failure(ErrorType.CONFIGURATION_ERROR, "Invalid backend id: " + backendId);
        }
        if (installer == null) {
            return OperationResult.failure(ErrorType.NOT_SUPPORTED, "Backend downloads are disabled");
        }
        log.info("Installing backend: backendId={}, platform={}/{}", backendId, platform.displayName(), platform.arch());
        OperationResult<Path> installed = installer.install(
                backendId,
                progress != null ? progress : ProgressListener.NONE,
                cancel != null ? cancel : new AtomicBoolean(false)
        );
        if (installed.isFailure()) {
            log.warn("Backend install failed: backendId={}, errorType={}, error={}",
                    backendId, installed.errorType(), installed.message());
            return installed.asFailure();
        }
        return OperationResult.success(toBackend(backendId, readMarker(backendId)), installed.message());
    }

    @Override
    public OperationResult<Void> uninstall(String backendId) {
        if (backendId == null || !BACKEND_ID.matcher(backendId).matches()) {
            return OperationResult.failure(ErrorType.CONFIGURATION_ERROR, "Invalid backend id: " + backendId);
        }
        Path backendDir = backendsDir.resolve(backendId);
        if (!Files.exists(backendDir)) {
            return OperationResult.failure(ErrorType.CONFIGURATION_ERROR, "Backend " + backendId + " not installed");
        }
        try {
            BackendInstaller.deleteRecursively(backendDir);
            log.info("Backend uninstalled: backendId={}", backendId);
            return OperationResult.success(null, backendId + " uninstalled successfully");
        } catch (IOException e) {
            log.warn("Backend uninstall failed: backendId={}, error={}", backendId, e.getMessage());
            return OperationResult.failure(ErrorType.INTERNAL_ERROR, "Failed to uninstall " + backendId + ": " + e.getMessage());
        }
    }

    private Optional<InstallMarker> readMarker(String backendId) {
        Path marker = backendsDir.resolve(backendId).resolve(InstallMarker.FILE_NAME);
        if (!Files.isRegularFile(marker)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(marker.toFile(), InstallMarker.class));
        } catch (IOException e) {
            log.warn("Unreadable install marker: file={}, error={}", marker, e.getMessage());
            return Optional.empty();
        }
    }

    private Backend toBackend(String backendId, Optional<InstallMarker> marker) {
        BackendAssets.Info info = BackendAssets.infoFor(backendId);
        return new Backend(
                backendId,
                info.name(),
                info.description(),
                info.size(),
                info.requiresGpu(),
                marker.isPresent(),
                marker.map(InstallMarker::version).orElse(null),
                marker.isPresent() ? backendsDir.resolve(backendId) : null
        );
    }
}
