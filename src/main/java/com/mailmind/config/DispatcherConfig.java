package com.mailmind.config;

import java.time.Duration;

/**
 * Batch dispatcher configuration.
 *
 * @param itemTimeoutSeconds Per-item timeout
 * @param threadNamePrefix   Prefix for worker and call thread names
 */
public record DispatcherConfig(
        int itemTimeoutSeconds,
        String threadNamePrefix
) {
    public static DispatcherConfig defaults() {
        return new DispatcherConfig(30, "batch-");
    }

    public Duration itemTimeout() {
        return Duration.ofSeconds(itemTimeoutSeconds);
    }
}
