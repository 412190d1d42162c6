package fr.lapetina.llama.orchestrator.backend;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Downloads prebuilt llama.cpp binaries from the latest GitHub release and
 * installs them under {@code <backendsDir>/<backendId>}.
 *
 * Archives are extracted into a staging directory that replaces the backend
 * directory only once complete; the install marker is written last, so a
 * backend never looks installed before it is usable.
 */
public class BackendInstaller {

    private static final Logger log = LoggerFactory.getLogger(BackendInstaller.class);

    static final int CHUNK_SIZE = 128 * 1024;
    private static final Pattern CUDA_VERSION = Pattern.compile("win-cuda-(\\d+)\\.(\\d+)-x64");
    private static final String CUDART_PATTERN = "cudart-llama-bin-win-cuda-{cuda_version}-x64.zip";

    private final Path backendsDir;
    private final HostPlatform platform;
    private final URI releasesApiUrl;
    private final Duration releaseCacheTtl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private JsonNode cachedRelease;
    private Instant cachedAt;

    public BackendInstaller(Path backendsDir, HostPlatform platform, URI releasesApiUrl, Duration releaseCacheTtl) {
        this.backendsDir = backendsDir;
        this.platform = platform;
        this.releasesApiUrl = releasesApiUrl;
        this.releaseCacheTtl = releaseCacheTtl;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Installs a backend, replacing any previous install of the same id.
     *
     * @return the backend directory
     */
    public OperationResult<Path> install(String backendId, ProgressListener progress, AtomicBoolean cancel) {
        Map<String, String> patterns = BackendAssets.patternsFor(platform);
        String pattern = patterns.get(backendId);
        if (pattern == null) {
            return OperationResult.failure(ErrorType.CONFIGURATION_ERROR,
                    "Backend " + backendId + " not available for " + platform.displayName() + "/" + platform.arch());
        }

        progress.onProgress(5, "Fetching release information...");
        OperationResult<JsonNode> release = latestRelease();
        if (release.isFailure()) {
            return release.asFailure();
        }

        String version = release.value().path("tag_name").asText("unknown");
        Map<String, JsonNode> assets = new LinkedHashMap<>();
        for (JsonNode asset : release.value().path("assets")) {
            assets.put(asset.path("name").asText(), asset);
        }

        String cudaVersion = null;
        if ("cuda".equals(backendId)) {
            Optional<String> latestCuda = findLatestCudaVersion(assets.keySet());
            if (latestCuda.isEmpty()) {
                return OperationResult.failure(ErrorType.CONFIGURATION_ERROR, "No CUDA binaries found in release " + version);
            }
            cudaVersion = latestCuda.get();
            progress.onProgress(8, "Found latest CUDA version: " + cudaVersion);
        }

        String assetName = pattern
                .replace("{version}", version)
                .replace("{cuda_version}", cudaVersion != null ? cudaVersion : "");
        Optional<JsonNode> asset = findAsset(backendId, assetName, assets);
        if (asset.isEmpty()) {
            return OperationResult.failure(ErrorType.CONFIGURATION_ERROR,
                    "Asset not found for " + backendId + ". Looking for: " + assetName);
        }

        String downloadName = asset.get().path("name").asText();
        long downloadSize = asset.get().path("size").asLong(0);
        progress.onProgress(10, String.format(Locale.ROOT, "Downloading %s (%.1f MB)...", downloadName, downloadSize / 1048576.0));

        Path downloads = backendsDir.resolve(".downloads");
        Path archive = downloads.resolve(downloadName);
        Path staging = backendsDir.resolve("." + backendId + ".staging");
        try {
            Files.createDirectories(downloads);
            OperationResult<Path> downloaded = downloadFile(
                    URI.create(asset.get().path("browser_download_url").asText()), archive, downloadSize, progress, cancel, true);
            if (downloaded.isFailure()) {
                return downloaded;
            }

            progress.onProgress(70, "Extracting files...");
            deleteRecursively(staging);
            Files.createDirectories(staging);
            extractZip(archive, staging);

            if (platform.isWindows() && cudaVersion != null) {
                installCudaRuntime(cudaVersion, assets, downloads, staging, progress, cancel);
            }

            progress.onProgress(90, "Configuring environment...");
            markServerExecutable(staging);

            Path backendDir = backendsDir.resolve(backendId);
            deleteRecursively(backendDir);
            Files.move(staging, backendDir, StandardCopyOption.ATOMIC_MOVE);
            writeMarker(backendDir, new InstallMarker(
                    version, backendId, cudaVersion, downloadName,
                    LocalDateTime.now().toString(), platform.displayName(), platform.arch()));

            progress.onProgress(100, backendId + " installed successfully!");
            log.info("Backend installed: backendId={}, version={}, path={}", backendId, version, backendDir);
            return OperationResult.success(backendDir, backendId + " backend installed successfully");
        } catch (IOException e) {
            if (cancel.get()) {
                return OperationResult.failure(ErrorType.CANCELLED, "Install of " + backendId + " cancelled");
            }
            log.warn("Backend install failed: backendId={}, error={}", backendId, e.getMessage());
            return OperationResult.failure(ErrorType.INTERNAL_ERROR, "Install of " + backendId + " failed: " + e.getMessage());
        } finally {
            cleanup(archive);
            cleanup(staging);
        }
    }

    private void installCudaRuntime(
            String cudaVersion,
            Map<String, JsonNode> assets,
            Path downloads,
            Path staging,
            ProgressListener progress,
            AtomicBoolean cancel
    ) throws IOException {
        String cudartName = CUDART_PATTERN.replace("{cuda_version}", cudaVersion);
        JsonNode cudart = assets.get(cudartName);
        if (cudart == null) {
            log.warn("CUDA runtime asset missing from release: asset={}", cudartName);
            return;
        }
        progress.onProgress(80, "Downloading CUDA " + cudaVersion + " runtime libraries...");
        Path cudartArchive = downloads.resolve(cudartName);
        try {
            OperationResult<Path> result = downloadFile(URI.create(cudart.path("browser_download_url").asText()),
                    cudartArchive, cudart.path("size").asLong(0), progress, cancel, false);
            if (result.isFailure()) {
                throw new IOException(result.message());
            }
            progress.onProgress(85, "Extracting CUDA runtime...");
            extractZip(cudartArchive, staging);
        } finally {
            cleanup(cudartArchive);
        }
    }

    /**
     * Latest release JSON, cached for the configured time.
     */
    synchronized OperationResult<JsonNode> latestRelease() {
        if (cachedRelease != null && Instant.now().isBefore(cachedAt.plus(releaseCacheTtl))) {
            return OperationResult.success(cachedRelease);
        }
        HttpRequest request = HttpRequest.newBuilder(releasesApiUrl)
                .timeout(Duration.ofSeconds(10))
                .header("Accept", "application/vnd.github.v3+json")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                return OperationResult.failure(ErrorType.TRANSPORT_ERROR,
                        "Failed to fetch release information: HTTP " + response.statusCode(), response.statusCode());
            }
            cachedRelease = objectMapper.readTree(response.body());
            cachedAt = Instant.now();
            return OperationResult.success(cachedRelease);
        } catch (IOException e) {
            log.warn("Release lookup failed: url={}, error={}", releasesApiUrl, e.getMessage());
            return OperationResult.failure(ErrorType.TRANSPORT_ERROR, "Failed to fetch release information: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(ErrorType.CANCELLED, "Release lookup interrupted");
        }
    }

    /**
     * Highest {@code win-cuda-X.Y-x64} version among the asset names, compared numerically.
     */
    static Optional<String> findLatestCudaVersion(Iterable<String> assetNames) {
        int[] best = null;
        for (String name : assetNames) {
            Matcher matcher = CUDA_VERSION.matcher(name);
            if (matcher.find()) {
                int[] candidate = {Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))};
                if (best == null || candidate[0] > best[0] || (candidate[0] == best[0] && candidate[1] > best[1])) {
                    best = candidate;
                }
            }
        }
        return best == null ? Optional.empty() : Optional.of(best[0] + "." + best[1]);
    }

    private Optional<JsonNode> findAsset(String backendId, String assetName, Map<String, JsonNode> assets) {
        for (String name : List.of(assetName, assetName.replace("-x64", "-x86_64"))) {
            if (assets.containsKey(name)) {
                return Optional.of(assets.get(name));
            }
        }
        if ("cuda".equals(backendId)) {
            return Optional.empty();
        }
        // Release naming drifts between tags; fall back to a loose match
        String wanted = backendId.replace("-", "");
        String osToken = switch (platform.os()) {
            case WINDOWS -> "win";
            case MACOS -> "macos";
            case LINUX -> "ubuntu";
        };
        return assets.entrySet().stream()
                .filter(e -> {
                    String normalized = e.getKey().toLowerCase(Locale.ROOT).replace("-", "");
                    return normalized.contains(wanted)
                            && e.getKey().contains(osToken)
                            && e.getKey().endsWith(".zip")
                            && !e.getKey().startsWith("cudart");
                })
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private OperationResult<Path> downloadFile(
            URI url,
            Path target,
            long expectedSize,
            ProgressListener progress,
            AtomicBoolean cancel,
            boolean reportProgress
    ) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(Duration.ofMinutes(10))
                .GET()
                .build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(ErrorType.CANCELLED, "Download interrupted");
        }

        try (InputStream in = response.body()) {
            if (response.statusCode() != 200) {
                return OperationResult.failure(ErrorType.TRANSPORT_ERROR,
                        "Download failed: HTTP " + response.statusCode(), response.statusCode());
            }
            long total = expectedSize > 0
                    ? expectedSize
                    : response.headers().firstValueAsLong("Content-Length").orElse(0);

            byte[] buffer = new byte[CHUNK_SIZE];
            long downloaded = 0;
            int lastPercent = -1;
            try (OutputStream out = Files.newOutputStream(target)) {
                while (true) {
                    if (cancel.get()) {
                        log.info("Download cancelled: url={}, bytes={}", url, downloaded);
                        return OperationResult.failure(ErrorType.CANCELLED, "Download cancelled");
                    }
                    int read = in.readNBytes(buffer, 0, buffer.length);
                    if (read <= 0) {
                        break;
                    }
                    out.write(buffer, 0, read);
                    downloaded += read;
                    if (reportProgress && total > 0) {
                        int percent = 10 + (int) (downloaded * 60 / total);
                        if (percent != lastPercent) {
                            lastPercent = percent;
                            progress.onProgress(Math.min(percent, 70), String.format(Locale.ROOT,
                                    "Downloading: %.1f / %.1f MB", downloaded / 1048576.0, total / 1048576.0));
                        }
                    }
                }
            }
            log.debug("Download complete: url={}, bytes={}", url, downloaded);
            return OperationResult.success(target);
        }
    }

    /**
     * Extracts a zip archive, refusing entries that would land outside the target.
     */
    static void extractZip(Path archive, Path target) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path destination = root.resolve(entry.getName()).normalize();
                if (!destination.startsWith(root)) {
                    throw new IOException("Blocked archive entry outside target: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else {
                    Files.createDirectories(destination.getParent());
                    Files.copy(zip, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    private static void markServerExecutable(Path dir) throws IOException {
        try (Stream<Path> files = Files.walk(dir)) {
            files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith("llama-server"))
                    .forEach(p -> {
                        if (!p.toFile().setExecutable(true, false)) {
                            log.warn("Could not mark executable: {}", p);
                        }
                    });
        }
    }

    private void writeMarker(Path backendDir, InstallMarker marker) throws IOException {
        objectMapper.writeValue(backendDir.resolve(InstallMarker.FILE_NAME).toFile(), marker);
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    private static void cleanup(Path path) {
        try {
            deleteRecursively(path);
        } catch (IOException e) {
            log.warn("Failed to clean up: path={}, error={}", path, e.getMessage());
        }
    }
}
