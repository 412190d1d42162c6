package fr.lapetina.llama.orchestrator.infrastructure.health;

import fr.lapetina.llama.orchestrator.domain.model.ServerInstance;
import fr.lapetina.llama.orchestrator.domain.model.ServerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Live llama-server instances keyed by model id.
 *
 * Thread-safe storage with change notifications. At most one instance is
 * registered per model id.
 */
public final class ServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

    private final Map<String, ServerInstance> servers = new ConcurrentHashMap<>();
    private final List<Consumer<ServerRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a freshly started instance, replacing any previous entry for the model.
     */
    public void register(ServerInstance instance) {
        ServerInstance previous = servers.put(instance.getModelId(), instance);
        if (previous != null && previous != instance) {
            log.warn("Server entry replaced: modelId={}, previousPort={}, newPort={}",
                    instance.getModelId(), previous.getPort(), instance.getPort());
        }
        log.info("Server registered: {}", instance);
        notifyListeners(new ServerRegistryEvent(ServerRegistryEvent.Type.REGISTERED, instance));
    }

    /**
     * Removes an instance after an explicit stop.
     */
    public Optional<ServerInstance> remove(String modelId) {
        return removeWith(modelId, ServerRegistryEvent.Type.REMOVED);
    }

    /**
     * Removes an instance after it was found dead.
     */
    public Optional<ServerInstance> evict(String modelId) {
        return removeWith(modelId, ServerRegistryEvent.Type.EVICTED);
    }

    private Optional<ServerInstance> removeWith(String modelId, ServerRegistryEvent.Type type) {
        ServerInstance removed = servers.remove(modelId);
        if (removed == null) {
            return Optional.empty();
        }
        removed.setStatus(ServerStatus.STOPPED);
        log.info("Server {}: {}", type == ServerRegistryEvent.Type.EVICTED ? "evicted" : "removed", removed);
        notifyListeners(new ServerRegistryEvent(type, removed));
        return Optional.of(removed);
    }

    public Optional<ServerInstance> get(String modelId) {
        return Optional.ofNullable(servers.get(modelId));
    }

    public boolean contains(String modelId) {
        return servers.containsKey(modelId);
    }

    public List<ServerInstance> getAll() {
        return new ArrayList<>(servers.values());
    }

    /**
     * Updates an instance status and notifies listeners when it changed.
     */
    public void updateStatus(String modelId, ServerStatus status) {
        ServerInstance instance = servers.get(modelId);
        if (instance != null) {
            ServerStatus previous = instance.getStatus();
            instance.setStatus(status);
            if (previous != status) {
                log.info("Server status changed: modelId={}, {} -> {}", modelId, previous, status);
                notifyListeners(new ServerRegistryEvent(ServerRegistryEvent.Type.STATUS_CHANGED, instance));
            }
        }
    }

    public void addListener(Consumer<ServerRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ServerRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ServerRegistryEvent event) {
        for (Consumer<ServerRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener: event={}", event.type(), e);
            }
        }
    }

    public int size() {
        return servers.size();
    }

    /**
     * Event for server registry changes.
     */
    public record ServerRegistryEvent(Type type, ServerInstance instance) {
        public enum Type {
            REGISTERED,
            REMOVED,
            EVICTED,
            STATUS_CHANGED
        }
    }
}
