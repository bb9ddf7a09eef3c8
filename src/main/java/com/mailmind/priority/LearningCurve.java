package com.mailmind.priority;

/**
 * Size of the importance nudge applied by one correction.
 */
@FunctionalInterface
public interface LearningCurve {

    /**
     * @param correctionCount Corrections already recorded for the sender
     * @return Non-negative step size
     */
    double step(int correctionCount);
}
