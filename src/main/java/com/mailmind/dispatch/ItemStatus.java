package com.mailmind.dispatch;

/**
 * Outcome of a single batch item.
 */
public enum ItemStatus {
    SUCCESS,
    ERROR,
    TIMEOUT,
    /** Batch was cancelled before the item started. */
    CANCELLED
}
