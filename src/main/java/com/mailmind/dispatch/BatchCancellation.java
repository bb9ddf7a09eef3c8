package com.mailmind.dispatch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag scoped to one batch. Items that have not started when the flag
 * is raised are skipped; items already running finish or time out normally.
 */
public final class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static BatchCancellation none() {
        return new BatchCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
