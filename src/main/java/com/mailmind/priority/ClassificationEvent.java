package com.mailmind.priority;

import java.time.Instant;

/**
 * One classification performed by the classifier. Append-only.
 */
public record ClassificationEvent(
        String messageId,
        String sender,
        Priority priority,
        Priority basePriority,
        double confidence,
        Instant timestamp
) {}
