package com.mailmind.pool;

import com.mailmind.backend.InferenceClient;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Lease over a pooled {@link InferenceClient}.
 * Closing the lease returns the client to its pool; closing twice is a no-op.
 */
public final class PooledClient implements AutoCloseable {

    private final InferenceClient client;
    private final int handleId;
    private final Consumer<PooledClient> releaser;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PooledClient(InferenceClient client, int handleId, Consumer<PooledClient> releaser) {
        this.client = client;
        this.handleId = handleId;
        this.releaser = releaser;
    }

    /**
     * The borrowed client.
     *
     * @throws IllegalStateException if the lease was already closed
     */
    public InferenceClient client() {
        if (released.get()) {
            throw new IllegalStateException("Lease on handle " + handleId + " already released");
        }
        return client;
    }

    public int handleId() {
        return handleId;
    }

    public boolean isReleased() {
        return released.get();
    }

    InferenceClient rawClient() {
        return client;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            releaser.accept(this);
        }
    }
}
