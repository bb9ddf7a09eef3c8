package com.mailmind.priority;

import com.mailmind.exception.ValidationException;

/**
 * {@code step(n) = baseRate / (1 + n)}.
 *
 * <p>Steps shrink harmonically, so consistent feedback keeps moving a sender
 * in one direction with ever smaller moves, and a single contrary correction
 * on an established sender moves it by little.
 */
public class DiminishingLearningCurve implements LearningCurve {

    public static final double DEFAULT_BASE_RATE = 0.1;

    private final double baseRate;

    public DiminishingLearningCurve() {
        this(DEFAULT_BASE_RATE);
    }

    public DiminishingLearningCurve(double baseRate) {
        if (!(baseRate > 0.0 && baseRate <= 0.5)) {
            throw new ValidationException("Base learning rate must be in (0, 0.5], got " + baseRate);
        }
        this.baseRate = baseRate;
    }

    @Override
    public double step(int correctionCount) {
        return baseRate / (1 + Math.max(0, correctionCount));
    }
}
