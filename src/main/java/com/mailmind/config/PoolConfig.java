package com.mailmind.config;

/**
 * Inference pool configuration.
 *
 * @param size                  Number of pooled clients (2-5)
 * @param acquireTimeoutSeconds Default wait for a free client
 * @param initializeOnStartup   Connect all clients when the pool is created by Spring
 */
public record PoolConfig(
        int size,
        int acquireTimeoutSeconds,
        boolean initializeOnStartup
) {
    public static PoolConfig defaults() {
        return new PoolConfig(3, 30, true);
    }
}
