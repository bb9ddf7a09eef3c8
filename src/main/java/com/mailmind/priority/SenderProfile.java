package com.mailmind.priority;

import java.time.Instant;
import java.util.Locale;

/**
 * Learned state for one sender.
 *
 * @param senderKey       Normalized sender address
 * @param importance      Learned importance in [0, 1]
 * @param correctionCount Number of user corrections recorded
 * @param emailCount      Number of classifications
 * @param vip             Manual VIP flag
 * @param lastUpdated     Last time the profile was written
 */
public record SenderProfile(
        String senderKey,
        double importance,
        int correctionCount,
        long emailCount,
        boolean vip,
        Instant lastUpdated
) {
    public static final double NEUTRAL_IMPORTANCE = 0.5;

    /**
     * Profile of a sender nothing is known about yet.
     */
    public static SenderProfile neutral(String senderKey, Instant now) {
        return new SenderProfile(senderKey, NEUTRAL_IMPORTANCE, 0, 0, false, now);
    }

    /**
     * Normalize a sender address into a profile key.
     */
    public static String keyOf(String sender) {
        return sender.trim().toLowerCase(Locale.ROOT);
    }

    public SenderProfile withVip(boolean vip, Instant now) {
        return new SenderProfile(senderKey, importance, correctionCount, emailCount, vip, now);
    }

    public SenderProfile withEmailCount(long emailCount) {
        return new SenderProfile(senderKey, importance, correctionCount, emailCount, vip, lastUpdated);
    }

    public SenderProfile withCorrection(double importance, Instant now) {
        return new SenderProfile(senderKey, importance, correctionCount + 1, emailCount, vip, now);
    }
}
