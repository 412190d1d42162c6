package fr.lapetina.llama.orchestrator.infrastructure.process;

import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Set;
import java.util.TreeSet;

/**
 * Hands out local TCP ports from a fixed range.
 *
 * A port is reserved at allocation time, before any process binds it, so two
 * concurrent starts never receive the same port. Candidates are bind-tested
 * and the first free one wins. Thread-safe.
 */
public final class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    private final String host;
    private final int rangeStart;
    private final int rangeEnd;
    private final Set<Integer> reserved = new TreeSet<>();

    /**
     * @param host       interface the bind test runs against
     * @param rangeStart first candidate port, inclusive
     * @param rangeEnd   last candidate port, exclusive
     */
    public PortAllocator(String host, int rangeStart, int rangeEnd) {
        if (rangeStart < 1 || rangeEnd > 65536 || rangeStart >= rangeEnd) {
            throw new IllegalArgumentException("Invalid port range: [" + rangeStart + ", " + rangeEnd + ")");
        }
        this.host = host;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    /**
     * Reserves the first port in range that is neither reserved nor bound by another process.
     */
    public synchronized OperationResult<Integer> allocate() {
        for (int port = rangeStart; port < rangeEnd; port++) {
            if (reserved.contains(port)) {
                continue;
            }
            if (isBindable(port)) {
                reserved.add(port);
                log.debug("Port reserved: port={}", port);
                return OperationResult.success(port);
            }
        }
        log.warn("Port range exhausted: range=[{}, {}), reserved={}", rangeStart, rangeEnd, reserved.size());
        return OperationResult.failure(
                ErrorType.PORT_EXHAUSTION,
                "No free port in range [" + rangeStart + ", " + rangeEnd + ")"
        );
    }

    /**
     * Releases a port. Releasing a port that is not reserved is a no-op.
     */
    public synchronized void release(int port) {
        if (reserved.remove(port)) {
            log.debug("Port released: port={}", port);
        }
    }

    public synchronized boolean isReserved(int port) {
        return reserved.contains(port);
    }

    public synchronized Set<Integer> reservedPorts() {
        return Set.copyOf(reserved);
    }

    public boolean inRange(int port) {
        return port >= rangeStart && port < rangeEnd;
    }

    private boolean isBindable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(host, port));
            return true;
        } catch (IOException e) {
            log.debug("Port busy: port={}, error={}", port, e.getMessage());
            return false;
        }
    }
}
