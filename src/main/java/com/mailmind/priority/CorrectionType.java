package com.mailmind.priority;

import java.util.Locale;

/**
 * Category of a user correction, derived from the free-text reason.
 */
public enum CorrectionType {
    PRIORITY_OVERRIDE,
    SENDER_IMPORTANCE,
    URGENCY_MISDETECTION,
    CATEGORY_ADJUSTMENT;

    /**
     * Classify a correction reason by keyword; no reason means a plain override.
     */
    public static CorrectionType fromReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return PRIORITY_OVERRIDE;
        }
        String text = reason.toLowerCase(Locale.ROOT);
        if (containsAny(text, "sender", "vip", "importance")) {
            return SENDER_IMPORTANCE;
        }
        if (containsAny(text, "urgent", "deadline", "misdetect")) {
            return URGENCY_MISDETECTION;
        }
        if (containsAny(text, "category", "newsletter", "incorrect")) {
            return CATEGORY_ADJUSTMENT;
        }
        return PRIORITY_OVERRIDE;
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
