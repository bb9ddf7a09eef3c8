package com.mailmind.dispatch;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs batches of work items concurrently over an inference pool.
 *
 * @param <P> Payload type
 * @param <R> Result type
 */
public interface BatchDispatcher<P, R> {

    /**
     * Process a batch. Item failures and timeouts are captured in their result slots
     * and never thrown.
     *
     * @param items          Items to process; an empty list returns immediately
     * @param perItemTimeout Maximum time per item, including the wait for a client
     * @param progress       Optional progress listener, may be null
     * @return Aggregated result with one entry per item, in input order
     * @throws com.mailmind.exception.TaskRejectedException if the dispatcher is shutdown
     * @throws com.mailmind.exception.ValidationException if the timeout is not positive
     */
    default BatchResult<R> processBatch(List<WorkItem<P>> items, Duration perItemTimeout, ProgressListener progress) {
        return processBatch(items, perItemTimeout, progress, BatchCancellation.none());
    }

    /**
     * Process a batch that can be cancelled through {@code cancellation}.
     */
    BatchResult<R> processBatch(List<WorkItem<P>> items, Duration perItemTimeout,
                                ProgressListener progress, BatchCancellation cancellation);

    /**
     * Register a lifecycle listener.
     *
     * @return Subscription that removes the listener when closed
     */
    Subscription subscribe(BatchListener listener);

    /**
     * Graceful shutdown - running batches complete, new batches are rejected.
     */
    void shutdown();

    /**
     * Immediate shutdown - interrupts running items.
     */
    void shutdownNow();

    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    boolean isShutdown();
}
