package com.mailmind.priority;

/**
 * Classification accuracy over a trailing window.
 *
 * @param periodDays         Window length in days
 * @param totalClassified    Classifications in the window
 * @param totalCorrected     User corrections in the window
 * @param accuracyPercentage {@code (classified - corrected) / classified * 100}
 * @param targetMet          Whether the accuracy target was reached
 * @param trend              First half versus second half of the window
 */
public record AccuracyReport(
        int periodDays,
        long totalClassified,
        long totalCorrected,
        double accuracyPercentage,
        boolean targetMet,
        AccuracyTrend trend
) {}
