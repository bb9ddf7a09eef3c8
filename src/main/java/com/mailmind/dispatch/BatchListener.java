package com.mailmind.dispatch;

/**
 * Observer of batch lifecycle events. Events are delivered on the coordinating thread.
 */
public interface BatchListener {

    default void onBatchStarted(long batchId, int total) {
    }

    default void onItemCompleted(long batchId, int index, ItemResult<?> result) {
    }

    default void onBatchCompleted(long batchId, BatchResult<?> result) {
    }
}
