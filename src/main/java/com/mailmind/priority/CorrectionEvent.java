package com.mailmind.priority;

import java.time.Instant;

/**
 * A user override of a classification. Append-only.
 */
public record CorrectionEvent(
        String messageId,
        String sender,
        Priority originalPriority,
        double originalConfidence,
        Priority userPriority,
        String reason,
        CorrectionType correctionType,
        Instant timestamp
) {
    /**
     * +1 if the user raised the tier, -1 if lowered, 0 if unchanged.
     */
    public int direction() {
        if (userPriority.isAbove(originalPriority)) {
            return 1;
        }
        return userPriority.isBelow(originalPriority) ? -1 : 0;
    }
}
