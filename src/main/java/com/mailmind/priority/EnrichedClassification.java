package com.mailmind.priority;

/**
 * Classification after sender learning.
 *
 * @param messageId        Message identifier
 * @param sender           Sender key the profile was looked up with
 * @param priority         Final tier
 * @param confidence       Confidence passed through from the base classification
 * @param basePriority     Tier before adjustment, kept for audit
 * @param senderImportance Importance score at classification time
 * @param vip              Whether the sender is flagged VIP
 * @param adjustment       Tier shift applied: +1, 0 or -1
 * @param visualIndicator  Indicator for {@code priority}
 */
public record EnrichedClassification(
        String messageId,
        String sender,
        Priority priority,
        double confidence,
        Priority basePriority,
        double senderImportance,
        boolean vip,
        int adjustment,
        String visualIndicator
) {}
