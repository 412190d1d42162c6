package fr.lapetina.llama.orchestrator.infrastructure.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llama.orchestrator.domain.model.ServerInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Durable copy of the running-server table.
 *
 * File layout: {@code {"servers": {"<modelId>": {...}}}}. The file is only
 * read at startup, for orphan cleanup, and rewritten after every start or stop.
 * Writes go through a temporary file and a rename.
 */
public final class ServerStateStore {

    private static final Logger log = LoggerFactory.getLogger(ServerStateStore.class);

    private final Path stateFile;
    private final ObjectMapper objectMapper;

    public ServerStateStore(Path stateFile) {
        this.stateFile = stateFile;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path getStateFile() {
        return stateFile;
    }

    /**
     * Reads the persisted table. A missing or unreadable file yields an empty table.
     */
    public Map<String, PersistedServer> read() {
        if (!Files.exists(stateFile)) {
            return Map.of();
        }
        try {
            ServerTable table = objectMapper.readValue(stateFile.toFile(), ServerTable.class);
            return table.servers() != null ? table.servers() : Map.of();
        } catch (IOException e) {
            log.warn("Unreadable server state, ignoring: file={}, error={}", stateFile, e.getMessage());
            return Map.of();
        }
    }

    /**
     * Replaces the persisted table with the given instances.
     */
    public void write(Collection<ServerInstance> instances) {
        Map<String, PersistedServer> servers = new LinkedHashMap<>();
        for (ServerInstance instance : instances) {
            servers.put(instance.getModelId(), PersistedServer.from(instance));
        }
        writeTable(new ServerTable(servers));
        log.debug("Server state persisted: file={}, servers={}", stateFile, servers.size());
    }

    /**
     * Persists an empty table.
     */
    public void clear() {
        writeTable(new ServerTable(Map.of()));
    }

    private void writeTable(ServerTable table) {
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), table);
            try {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write server state: " + stateFile, e);
        }
    }

    /**
     * Root object of the state file.
     */
    public record ServerTable(@JsonProperty("servers") Map<String, PersistedServer> servers) {
    }

    /**
     * One persisted server entry.
     */
    public record PersistedServer(
            @JsonProperty("model_id") String modelId,
            @JsonProperty("model_path") String modelPath,
            @JsonProperty("port") int port,
            @JsonProperty("host") String host,
            @JsonProperty("pid") long pid,
            @JsonProperty("status") String status,
            @JsonProperty("backend") String backend,
            @JsonProperty("started_at") Instant startedAt,
            @JsonProperty("context_size") int contextSize,
            @JsonProperty("gpu_layers") int gpuLayers
    ) {
        public static PersistedServer from(ServerInstance instance) {
            return new PersistedServer(
                    instance.getModelId(),
                    instance.getModelPath(),
                    instance.getPort(),
                    instance.getHost(),
                    instance.getPid(),
                    instance.getStatus().name().toLowerCase(Locale.ROOT),
                    instance.getBackendId(),
                    instance.getStartedAt(),
                    instance.getContextSize(),
                    instance.getGpuLayers()
            );
        }
    }
}
