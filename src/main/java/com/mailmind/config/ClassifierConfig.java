package com.mailmind.config;

import com.mailmind.exception.ConfigurationException;

/**
 * Priority classifier configuration.
 *
 * @param upperThreshold   Importance above which a sender's messages are upgraded
 * @param lowerThreshold   Importance below which a sender's messages are downgraded
 * @param baseLearningRate First-correction step of the diminishing learning curve
 * @param accuracyTarget   Accuracy percentage that counts as on target
 * @param trendTolerance   Percentage points between window halves treated as stable
 */
public record ClassifierConfig(
        double upperThreshold,
        double lowerThreshold,
        double baseLearningRate,
        double accuracyTarget,
        double trendTolerance
) {
    public ClassifierConfig {
        if (lowerThreshold < 0.0 || upperThreshold > 1.0 || lowerThreshold >= upperThreshold) {
            throw new ConfigurationException("Classifier thresholds must satisfy 0 <= lower < upper <= 1, got lower="
                    + lowerThreshold + ", upper=" + upperThreshold);
        }
        if (!(baseLearningRate > 0.0 && baseLearningRate <= 0.5)) {
            throw new ConfigurationException("Base learning rate must be in (0, 0.5], got " + baseLearningRate);
        }
        if (accuracyTarget < 0.0 || accuracyTarget > 100.0) {
            throw new ConfigurationException("Accuracy target must be a percentage, got " + accuracyTarget);
        }
        if (trendTolerance < 0.0) {
            throw new ConfigurationException("Trend tolerance cannot be negative, got " + trendTolerance);
        }
    }

    public static ClassifierConfig defaults() {
        return new ClassifierConfig(0.8, 0.3, 0.1, 85.0, 5.0);
    }
}
