package fr.lapetina.llama.orchestrator.infrastructure.process;

import fr.lapetina.llama.orchestrator.domain.model.ErrorType;
import fr.lapetina.llama.orchestrator.domain.model.OperationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortAllocatorTest {

    private static final String HOST = "127.0.0.1";

    @Test
    @DisplayName("should hand out distinct ports")
    void shouldHandOutDistinctPorts() {
        PortAllocator allocator = new PortAllocator(HOST, 18300, 18310);

        OperationResult<Integer> first = allocator.allocate();
        OperationResult<Integer> second = allocator.allocate();

        assertThat(first.success()).isTrue();
        assertThat(second.success()).isTrue();
        assertThat(first.value()).isNotEqualTo(second.value());
        assertThat(allocator.reservedPorts()).containsExactlyInAnyOrder(first.value(), second.value());
    }

    @Test
    @DisplayName("should skip ports bound by another process")
    void shouldSkipBoundPorts() throws Exception {
        PortAllocator allocator = new PortAllocator(HOST, 18320, 18330);
        try (ServerSocket occupied = new ServerSocket(18320, 1, InetAddress.getByName(HOST))) {
            OperationResult<Integer> port = allocator.allocate();

            assertThat(port.success()).isTrue();
            assertThat(port.value()).isNotEqualTo(occupied.getLocalPort());
        }
    }

    @Test
    @DisplayName("should report exhaustion when the range is used up")
    void shouldReportExhaustion() {
        PortAllocator allocator = new PortAllocator(HOST, 18340, 18342);
        allocator.allocate();
        allocator.allocate();

        OperationResult<Integer> third = allocator.allocate();

        assertThat(third.isFailure()).isTrue();
        assertThat(third.errorType()).isEqualTo(ErrorType.PORT_EXHAUSTION);
        assertThat(third.message()).contains("18340").contains("18342");
    }

    @Test
    @DisplayName("should reuse a released port")
    void shouldReuseReleasedPort() {
        PortAllocator allocator = new PortAllocator(HOST, 18350, 18351);
        int port = allocator.allocate().value();

        allocator.release(port);

        assertThat(allocator.isReserved(port)).isFalse();
        assertThat(allocator.allocate().value()).isEqualTo(port);
    }

    @Test
    @DisplayName("should never hand the same port to concurrent callers")
    void shouldNotDuplicateUnderConcurrency() throws Exception {
        PortAllocator allocator = new PortAllocator(HOST, 18360, 18380);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch startGate = new CountDownLatch(1);
        Set<Integer> ports = ConcurrentHashMap.newKeySet();
        List<Integer> all = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                executor.submit(() -> {
                    startGate.await();
                    OperationResult<Integer> result = allocator.allocate();
                    if (result.success()) {
                        ports.add(result.value());
                        synchronized (all) {
                            all.add(result.value());
                        }
                    }
                    return null;
                });
            }
            startGate.countDown();
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(all).hasSize(16);
        assertThat(ports).hasSize(16);
    }

    @Test
    @DisplayName("should reject an empty range")
    void shouldRejectEmptyRange() {
        assertThatThrownBy(() -> new PortAllocator(HOST, 9000, 9000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
