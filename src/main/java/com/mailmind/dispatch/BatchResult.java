package com.mailmind.dispatch;

import java.util.List;

/**
 * Aggregated outcome of a batch.
 *
 * @param total          Number of submitted items
 * @param success        Items that completed successfully
 * @param failed         Items that errored, timed out or were cancelled
 * @param results        One entry per item, in input order
 * @param elapsedSeconds Wall-clock duration of the whole batch
 * @param throughput     Items per minute
 * @param <R>            Result type
 */
public record BatchResult<R>(
        int total,
        int success,
        int failed,
        List<ItemResult<R>> results,
        double elapsedSeconds,
        double throughput
) {
    public BatchResult {
        results = List.copyOf(results);
        if (total != success + failed || total != results.size()) {
            throw new IllegalArgumentException("Inconsistent batch result: total=" + total
                    + ", success=" + success + ", failed=" + failed + ", results=" + results.size());
        }
    }

    /**
     * Zero-valued result for an empty batch.
     */
    public static <R> BatchResult<R> empty() {
        return new BatchResult<>(0, 0, 0, List.of(), 0.0, 0.0);
    }
}
