package com.mailmind.pool;

import com.mailmind.backend.FakeInferenceBackend;
import com.mailmind.exception.BackendUnavailableException;
import com.mailmind.exception.ResourceExhaustedException;
import com.mailmind.exception.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultInferencePool.
 */
class DefaultInferencePoolTest {

    private final FakeInferenceBackend backend = new FakeInferenceBackend();
    private DefaultInferencePool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    // =====================================================================
    // Construction and initialization
    // =====================================================================

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5})
    @DisplayName("Should expose all clients as idle after initialization")
    void shouldInitializeAllClients(int size) {
        pool = new DefaultInferencePool(backend, size);
        pool.initialize();

        assertEquals(new PoolStats(size, 0, size), pool.stats());
        assertEquals(size, backend.getConnectCount());
        assertTrue(pool.healthCheck());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 6, 10, -1})
    @DisplayName("Should reject pool sizes outside 2-5")
    void shouldRejectInvalidSize(int size) {
        ValidationException e = assertThrows(ValidationException.class,
                () -> new DefaultInferencePool(backend, size));
        assertTrue(e.getMessage().startsWith("Pool size must be between 2 and 5"));
    }

    @Test
    @DisplayName("Should default to three clients")
    void shouldDefaultToThree() {
        pool = new DefaultInferencePool(backend);
        pool.initialize();

        assertEquals(3, pool.size());
        assertEquals(3, pool.stats().total());
    }

    @Test
    @DisplayName("Should connect only once when initialized twice")
    void shouldInitializeIdempotently() {
        pool = new DefaultInferencePool(backend, 2);
        pool.initialize();
        pool.initialize();

        assertEquals(2, backend.getConnectCount());
        assertEquals(2, pool.stats().total());
    }

    @Test
    @DisplayName("Should reject acquire before initialization")
    void shouldRejectAcquireBeforeInitialize() {
        pool = new DefaultInferencePool(backend, 2);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> pool.acquire(Duration.ofSeconds(1)));
        assertEquals("Connection pool not initialized", e.getMessage());
        assertFalse(pool.healthCheck());
    }

    @Test
    @DisplayName("Should close opened clients when a connect fails")
    void shouldCleanUpOnPartialInitialization() {
        backend.failOnConnect(3);
        pool = new DefaultInferencePool(backend, 4);

        assertThrows(BackendUnavailableException.class, () -> pool.initialize());
        assertEquals(2, backend.getClients().size());
        assertEquals(2, backend.getClosedCount());
        assertFalse(pool.healthCheck());
    }

    // =====================================================================
    // Leases
    // =====================================================================

    @Test
    @DisplayName("Should track active and idle clients across acquire and release")
    void shouldTrackLeases() {
        pool = new DefaultInferencePool(backend, 3);
        pool.initialize();

        PooledClient first = pool.acquire(Duration.ofSeconds(1));
        PooledClient second = pool.acquire(Duration.ofSeconds(1));
        assertEquals(new PoolStats(3, 2, 1), pool.stats());
        assertNotEquals(first.handleId(), second.handleId());

        first.close();
        first.close();
        assertEquals(new PoolStats(3, 1, 2), pool.stats());

        second.close();
        assertEquals(new PoolStats(3, 0, 3), pool.stats());
    }

    @Test
    @DisplayName("Should return the client when the scoped body throws")
    void shouldReleaseOnException() {
        pool = new DefaultInferencePool(backend, 2);
        pool.initialize();

        assertThrows(IllegalArgumentException.class, () -> {
            try (PooledClient lease = pool.acquire(Duration.ofSeconds(1))) {
                lease.client().listModels();
                throw new IllegalArgumentException("boom");
            }
        });

        assertEquals(new PoolStats(2, 0, 2), pool.stats());
    }

    @Test
    @DisplayName("Should refuse use of a released lease")
    void shouldRefuseReleasedLease() {
        pool = new DefaultInferencePool(backend, 2);
        pool.initialize();

        PooledClient lease = pool.acquire(Duration.ofSeconds(1));
        lease.close();

        assertTrue(lease.isReleased());
        assertThrows(IllegalStateException.class, lease::client);
    }

    @Test
    @DisplayName("Should fail with resource exhausted when no client frees up in time")
    void shouldTimeOutWhenExhausted() {
        pool = new DefaultInferencePool(backend, 2);
        pool.initialize();
        PooledClient a = pool.acquire(Duration.ofSeconds(1));
        PooledClient b = pool.acquire(Duration.ofSeconds(1));

        long start = System.nanoTime();
        assertThrows(ResourceExhaustedException.class, () -> pool.acquire(Duration.ofMillis(100)));
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(waitedMillis >= 90, "Should wait for the timeout, waited " + waitedMillis + "ms");
        assertEquals(new PoolStats(2, 2, 0), pool.stats());
        a.close();
        b.close();
    }

    @Test
    @DisplayName("Should hand a released client to a waiting acquirer")
    void shouldWakeWaiter() throws Exception {
        pool = new DefaultInferencePool(backend, 2);
        pool.initialize();
        PooledClient a = pool.acquire(Duration.ofSeconds(1));
        PooledClient b = pool.acquire(Duration.ofSeconds(1));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> waiter = executor.submit(() -> {
                try (PooledClient lease = pool.acquire(Duration.ofSeconds(5))) {
                    return lease.handleId();
                }
            });
            Thread.sleep(50);
            a.close();

            assertEquals(a.handleId(), waiter.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
            b.close();
        }
    }

    @Test
    @DisplayName("Should never lend more clients than the pool size under contention")
    void shouldBoundConcurrentLeases() throws Exception {
        pool = new DefaultInferencePool(backend, 3);
        pool.initialize();

        int threads = 12;
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Set<Integer> handlesInUse = ConcurrentHashMap.newKeySet();
        AtomicInteger doubleIssued = new AtomicInteger();
        CountDownLatch startGate = new CountDownLatch(1);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    startGate.await();
                    for (int i = 0; i < 20; i++) {
                        try (PooledClient lease = pool.acquire(Duration.ofSeconds(10))) {
                            if (!handlesInUse.add(lease.handleId())) {
                                doubleIssued.incrementAndGet();
                            }
                            peak.accumulateAndGet(current.incrementAndGet(), Math::max);
                            Thread.sleep(1);
                            current.decrementAndGet();
                            handlesInUse.remove(lease.handleId());
                        }
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(peak.get() <= 3, "Peak concurrent leases was " + peak.get());
        assertEquals(0, doubleIssued.get());
        assertEquals(new PoolStats(3, 0, 3), pool.stats());
    }

    // =====================================================================
    // Shutdown
    // =====================================================================

    @Test
    @DisplayName("Should close idle clients and clients returned after close")
    void shouldCloseClients() {
        pool = new DefaultInferencePool(backend, 3);
        pool.initialize();
        PooledClient lease = pool.acquire(Duration.ofSeconds(1));

        pool.close();
        assertEquals(2, backend.getClosedCount());
        assertEquals(new PoolStats(1, 1, 0), pool.stats());
        assertFalse(pool.healthCheck());

        lease.close();
        assertEquals(3, backend.getClosedCount());
        assertEquals(new PoolStats(0, 0, 0), pool.stats());
        assertThrows(IllegalStateException.class, () -> pool.acquire(Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("Should give every client a distinct handle id")
    void shouldAssignDistinctHandles() {
        pool = new DefaultInferencePool(backend, 5);
        pool.initialize();

        List<PooledClient> leases = new ArrayList<>();
        Set<Integer> ids = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            PooledClient lease = pool.acquire(Duration.ofSeconds(1));
            leases.add(lease);
            ids.add(lease.handleId());
        }

        assertEquals(5, ids.size());
        leases.forEach(PooledClient::close);
    }
}
