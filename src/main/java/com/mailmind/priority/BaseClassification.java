package com.mailmind.priority;

import com.mailmind.exception.ValidationException;

/**
 * Priority produced by the model before sender learning is applied.
 *
 * @param priority   Base tier
 * @param confidence Model confidence in [0, 1]
 */
public record BaseClassification(
        Priority priority,
        double confidence
) {
    public BaseClassification {
        if (priority == null) {
            throw new ValidationException("Base priority cannot be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("Confidence must be within [0, 1], got " + confidence);
        }
    }

    /**
     * Neutral classification used when the model answer cannot be read.
     */
    public static BaseClassification neutral() {
        return new BaseClassification(Priority.MEDIUM, 0.5);
    }
}
