package com.mailmind.pool;

/**
 * Point-in-time pool usage.
 *
 * @param total  Clients owned by the pool
 * @param active Clients currently leased
 * @param idle   Clients waiting in the pool
 */
public record PoolStats(
        int total,
        int active,
        int idle
) {}
