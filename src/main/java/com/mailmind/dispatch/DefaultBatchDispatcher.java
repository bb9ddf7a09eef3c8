package com.mailmind.dispatch;

import com.mailmind.exception.TaskRejectedException;
import com.mailmind.exception.ValidationException;
import com.mailmind.pool.InferencePool;
import com.mailmind.pool.PooledClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of BatchDispatcher.
 *
 * <p>A fixed worker set, one worker per pooled client, walks the batch. Each worker
 * hands its item to a call thread that leases a client, runs the processor and
 * returns the client, while the worker waits at most the per-item timeout. On
 * timeout the call is interrupted and the worker moves on; the client goes back
 * to the pool only when the call thread actually leaves the lease.
 *
 * <p>Finished items flow back to the calling thread through a completion queue,
 * which is where result slots are filled and listeners are notified. Items that
 * never start, because the dispatcher was shut down mid-batch, still report a
 * {@link ItemStatus#CANCELLED} slot, so a batch always returns.
 */
public class DefaultBatchDispatcher<P, R> implements BatchDispatcher<P, R> {

    private static final Logger log = LoggerFactory.getLogger(DefaultBatchDispatcher.class);

    private static final double MIN_ELAPSED_SECONDS = 0.001;

    private final InferencePool pool;
    private final ItemProcessor<P, R> processor;
    private final ExecutorService workers;
    private final ExecutorService calls;
    private final List<BatchListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicLong batchCounter = new AtomicLong(0);

    public DefaultBatchDispatcher(InferencePool pool, ItemProcessor<P, R> processor) {
        this(pool, processor, "batch-");
    }

    public DefaultBatchDispatcher(InferencePool pool, ItemProcessor<P, R> processor, String threadNamePrefix) {
        if (pool == null) {
            throw new NullPointerException("Pool cannot be null");
        }
        if (processor == null) {
            throw new NullPointerException("Processor cannot be null");
        }
        this.pool = pool;
        this.processor = processor;
        this.workers = Executors.newFixedThreadPool(pool.size(), namedThreads(threadNamePrefix + "worker-"));
        this.calls = Executors.newCachedThreadPool(namedThreads(threadNamePrefix + "call-"));

        log.info("BatchDispatcher initialized with {} workers", pool.size());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public BatchResult<R> processBatch(List<WorkItem<P>> items, Duration perItemTimeout,
                                       ProgressListener progress, BatchCancellation cancellation) {
        if (items == null) {
            throw new NullPointerException("Items cannot be null");
        }
        if (perItemTimeout == null || perItemTimeout.isNegative() || perItemTimeout.isZero()) {
            throw new ValidationException("Per-item timeout must be positive, got " + perItemTimeout);
        }
        if (shutdown.get()) {
            throw new TaskRejectedException("Dispatcher is shutdown");
        }
        if (items.isEmpty()) {
            log.warn("processBatch called with empty item list");
            return BatchResult.empty();
        }

        BatchCancellation flag = cancellation != null ? cancellation : BatchCancellation.none();
        long batchId = batchCounter.incrementAndGet();
        int total = items.size();

        log.info("Processing batch {} of {} items with {} workers", batchId, total, pool.size());
        long start = System.nanoTime();
        notifyStarted(batchId, total);

        BlockingQueue<IndexedResult<R>> completed = new LinkedBlockingQueue<>();
        for (int i = 0; i < total; i++) {
            int index = i;
            WorkItem<P> item = items.get(i);
            ItemTask<R> task = new ItemTask<>(index, item.id(), () -> runItem(item, perItemTimeout, flag), completed);
            try {
                workers.execute(task);
            } catch (RejectedExecutionException e) {
                log.warn("Item {} rejected: dispatcher shut down during submission", item.id());
                task.cancel(false);
            }
        }

        List<ItemResult<R>> slots = new ArrayList<>(Collections.nCopies(total, null));
        int success = 0;
        int failed = 0;
        boolean interrupted = false;

        for (int done = 1; done <= total; done++) {
            IndexedResult<R> indexed;
            try {
                indexed = completed.take();
            } catch (InterruptedException e) {
                // Stop issuing new items, keep collecting the ones already queued
                interrupted = true;
                flag.cancel();
                done--;
                continue;
            }

            ItemResult<R> result = indexed.result();
            slots.set(indexed.index(), result);
            if (result.isSuccess()) {
                success++;
                log.debug("Item {}/{} ({}) processed successfully", indexed.index() + 1, total, result.itemId());
            } else {
                failed++;
                log.warn("Item {}/{} ({}) failed [{}]: {}",
                        indexed.index() + 1, total, result.itemId(), result.status(), result.error());
            }

            notifyProgress(progress, done, total);
            notifyItemCompleted(batchId, indexed.index(), result);
        }

        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
        double throughput = (total / Math.max(elapsed, MIN_ELAPSED_SECONDS)) * 60;

        BatchResult<R> batchResult = new BatchResult<>(total, success, failed, slots, elapsed, throughput);
        log.info("Batch {} complete: {}/{} successful, {} failed in {}s ({} items/minute)",
                batchId, success, total, failed,
                String.format("%.2f", elapsed), String.format("%.1f", throughput));
        notifyCompleted(batchId, batchResult);

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return batchResult;
    }

    /**
     * Run one item on a call thread, waiting at most {@code timeout}. Never throws.
     */
    private ItemResult<R> runItem(WorkItem<P> item, Duration timeout, BatchCancellation cancellation) {
        if (cancellation.isCancelled()) {
            log.debug("Skipping item {}: batch cancelled", item.id());
            return ItemResult.cancelled(item.id());
        }

        Callable<R> call = () -> {
            try (PooledClient lease = pool.acquire(timeout)) {
                return processor.process(lease.client(), item);
            }
        };

        Future<R> future;
        try {
            future = calls.submit(call);
        } catch (RuntimeException e) {
            return ItemResult.error(item.id(), describe(e));
        }

        try {
            R value = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return ItemResult.success(item.id(), value);
        } catch (TimeoutException e) {
            future.cancel(true);
            return ItemResult.timeout(item.id(), "Timeout after " + formatSeconds(timeout) + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("Item {} raised {}", item.id(), cause.toString(), cause);
            return ItemResult.error(item.id(), describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ItemResult.error(item.id(), "Interrupted");
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }

    private static String formatSeconds(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? Long.toString(millis / 1000) : String.format("%.3f", millis / 1000.0);
    }

    private void notifyProgress(ProgressListener progress, int done, int total) {
        if (progress == null) {
            return;
        }
        try {
            progress.onProgress(done, total);
        } catch (RuntimeException e) {
            log.warn("Progress callback failed: {}", e.getMessage(), e);
        }
    }

    private void notifyStarted(long batchId, int total) {
        for (BatchListener listener : listeners) {
            try {
                listener.onBatchStarted(batchId, total);
            } catch (RuntimeException e) {
                log.warn("Batch listener failed on start of batch {}: {}", batchId, e.getMessage(), e);
            }
        }
    }

    private void notifyItemCompleted(long batchId, int index, ItemResult<R> result) {
        for (BatchListener listener : listeners) {
            try {
                listener.onItemCompleted(batchId, index, result);
            } catch (RuntimeException e) {
                log.warn("Batch listener failed on item {} of batch {}: {}", index, batchId, e.getMessage(), e);
            }
        }
    }

    private void notifyCompleted(long batchId, BatchResult<R> result) {
        for (BatchListener listener : listeners) {
            try {
                listener.onBatchCompleted(batchId, result);
            } catch (RuntimeException e) {
                log.warn("Batch listener failed on completion of batch {}: {}", batchId, e.getMessage(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(BatchListener listener) {
        if (listener == null) {
            throw new NullPointerException("Listener cannot be null");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Number of currently registered listeners.
     */
    public int getListenerCount() {
        return listeners.size();
    }

    @Override
    public void shutdown() {
        log.info("Shutting down BatchDispatcher");
        shutdown.set(true);
        workers.shutdown();
        calls.shutdown();
    }

    @Override
    public void shutdownNow() {
        log.info("Shutting down BatchDispatcher immediately");
        shutdown.set(true);
        for (Runnable pending : workers.shutdownNow()) {
            // Queued items never started; cancelling them reports a CANCELLED slot to their batch
            if (pending instanceof Future<?> future) {
                future.cancel(false);
            }
        }
        calls.shutdownNow();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        if (!workers.awaitTermination(timeout, unit)) {
            return false;
        }
        return calls.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    @Override
    public boolean isShutdown() {
        return shutdown.get();
    }

    private record IndexedResult<R>(int index, ItemResult<R> result) {}

    /**
     * Worker task that reports its slot exactly once, whether it ran or was cancelled before starting.
     */
    private static final class ItemTask<R> extends FutureTask<ItemResult<R>> {

        private final int index;
        private final String itemId;
        private final BlockingQueue<IndexedResult<R>> completed;

        ItemTask(int index, String itemId, Callable<ItemResult<R>> body, BlockingQueue<IndexedResult<R>> completed) {
            super(body);
            this.index = index;
            this.itemId = itemId;
            this.completed = completed;
        }

        @Override
        protected void done() {
            completed.add(new IndexedResult<>(index, outcome()));
        }

        private ItemResult<R> outcome() {
            if (isCancelled()) {
                return ItemResult.cancelled(itemId);
            }
            try {
                return get();
            } catch (ExecutionException e) {
                // runItem converts every failure
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                return ItemResult.error(itemId, describe(cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ItemResult.error(itemId, "Interrupted");
            }
        }
    }
}
