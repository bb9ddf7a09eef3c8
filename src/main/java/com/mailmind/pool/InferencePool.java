package com.mailmind.pool;

import java.time.Duration;

/**
 * Bounded pool of reusable inference clients.
 * A client is held by at most one caller at a time.
 */
public interface InferencePool extends AutoCloseable {

    /**
     * Eagerly connect all clients. Calling it again has no effect.
     *
     * @throws com.mailmind.exception.BackendUnavailableException if any client cannot connect
     */
    void initialize();

    /**
     * Borrow a client, waiting up to {@code timeout} for one to become idle.
     * The returned lease must be closed to hand the client back; use try-with-resources.
     *
     * @param timeout Maximum wait
     * @return Lease over an exclusively held client
     * @throws com.mailmind.exception.ResourceExhaustedException if the timeout elapses
     * @throws IllegalStateException if the pool is not initialized or already closed
     */
    PooledClient acquire(Duration timeout);

    /**
     * Snapshot of pool usage. {@code active + idle == total} in every snapshot.
     */
    PoolStats stats();

    /**
     * True if the pool was initialized with at least one client.
     */
    boolean healthCheck();

    /**
     * Configured number of clients.
     */
    int size();

    /**
     * Close idle clients now and in-use clients as they are returned.
     */
    @Override
    void close();
}
