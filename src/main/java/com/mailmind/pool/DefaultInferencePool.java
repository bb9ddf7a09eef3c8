package com.mailmind.pool;

import com.mailmind.backend.InferenceBackend;
import com.mailmind.backend.InferenceClient;
import com.mailmind.exception.BackendUnavailableException;
import com.mailmind.exception.ResourceExhaustedException;
import com.mailmind.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of InferencePool.
 *
 * <p>Idle clients sit in a bounded queue. A semaphore with one permit per client
 * is the only place a caller blocks; the queue transfer and the active counter
 * are updated together under {@code lock}, so {@link #stats()} always sees
 * {@code active + idle == total}. The lock is never held while waiting or while
 * a client is in use.
 */
public class DefaultInferencePool implements InferencePool {

    private static final Logger log = LoggerFactory.getLogger(DefaultInferencePool.class);

    public static final int MIN_SIZE = 2;
    public static final int MAX_SIZE = 5;
    public static final int DEFAULT_SIZE = 3;

    private final InferenceBackend backend;
    private final int size;
    private final BlockingQueue<Slot> idle;
    private final Semaphore permits;
    private final Object lock = new Object();

    private int total;
    private int active;
    private boolean initialized;
    private boolean closed;

    public DefaultInferencePool(InferenceBackend backend) {
        this(backend, DEFAULT_SIZE);
    }

    public DefaultInferencePool(InferenceBackend backend, int size) {
        if (backend == null) {
            throw new NullPointerException("Backend cannot be null");
        }
        if (size < MIN_SIZE || size > MAX_SIZE) {
            throw new ValidationException("Pool size must be between " + MIN_SIZE + " and " + MAX_SIZE
                    + ", got " + size);
        }
        this.backend = backend;
        this.size = size;
        this.idle = new ArrayBlockingQueue<>(size);
        this.permits = new Semaphore(0);
    }

    @Override
    public void initialize() {
        synchronized (lock) {
            if (initialized) {
                log.debug("Pool already initialized, skipping");
                return;
            }
            if (closed) {
                throw new IllegalStateException("Pool is closed");
            }

            log.info("Initializing {} pool with {} clients", backend.name(), size);
            List<InferenceClient> connected = new ArrayList<>(size);
            try {
                for (int i = 0; i < size; i++) {
                    connected.add(backend.connect());
                }
            } catch (RuntimeException e) {
                connected.forEach(DefaultInferencePool::closeQuietly);
                log.error("Failed to initialize {} pool after {} of {} clients: {}",
                        backend.name(), connected.size(), size, e.getMessage());
                if (e instanceof BackendUnavailableException unavailable) {
                    throw unavailable;
                }
                throw new BackendUnavailableException("Failed to connect to " + backend.name() + ": " + e.getMessage(), e);
            }

            for (int i = 0; i < connected.size(); i++) {
                idle.add(new Slot(connected.get(i), i + 1));
            }
            total = connected.size();
            initialized = true;
            permits.release(total);
            log.info("{} pool initialized with {} clients", backend.name(), total);
        }
    }

    @Override
    public PooledClient acquire(Duration timeout) {
        synchronized (lock) {
            if (!initialized) {
                throw new IllegalStateException("Connection pool not initialized");
            }
            if (closed) {
                throw new IllegalStateException("Pool is closed");
            }
        }

        boolean permitted;
        try {
            permitted = permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceExhaustedException("Interrupted while waiting for an inference client", e);
        }
        if (!permitted) {
            throw new ResourceExhaustedException("No inference client available within " + timeout.toMillis()
                    + "ms (pool size " + size + ")");
        }

        Slot slot;
        int inUse;
        synchronized (lock) {
            if (closed) {
                permits.release();
                throw new IllegalStateException("Pool is closed");
            }
            slot = idle.poll();
            if (slot == null) {
                // A permit is only issued for a queued client
                permits.release();
                throw new IllegalStateException("Pool bookkeeping out of sync: permit without idle client");
            }
            inUse = ++active;
        }
        log.debug("Acquired client {} (active={})", slot.id(), inUse);
        return new PooledClient(slot.client(), slot.id(), this::release);
    }

    private void release(PooledClient lease) {
        Slot slot = new Slot(lease.rawClient(), lease.handleId());
        boolean discard;
        synchronized (lock) {
            active--;
            discard = closed;
            if (discard) {
                total--;
            } else {
                idle.add(slot);
            }
        }
        if (discard) {
            closeQuietly(slot.client());
            log.debug("Closed client {} returned after pool shutdown", slot.id());
        } else {
            permits.release();
            log.debug("Released client {}", slot.id());
        }
    }

    @Override
    public PoolStats stats() {
        synchronized (lock) {
            return new PoolStats(total, active, idle.size());
        }
    }

    @Override
    public boolean healthCheck() {
        synchronized (lock) {
            return initialized && total > 0 && !closed;
        }
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void close() {
        List<Slot> drained = new ArrayList<>();
        int inUse;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            idle.drainTo(drained);
            total -= drained.size();
            inUse = active;
        }
        drained.forEach(slot -> closeQuietly(slot.client()));
        log.info("{} pool closed ({} idle clients closed, {} still in use)", backend.name(), drained.size(), inUse);
    }

    private static void closeQuietly(InferenceClient client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close inference client: {}", e.getMessage());
        }
    }

    private record Slot(InferenceClient client, int id) {}
}
