package com.mailmind.store;

import com.mailmind.priority.ClassificationEvent;
import com.mailmind.priority.CorrectionEvent;

import java.time.Instant;
import java.util.List;

/**
 * Append-only log of classifications and user corrections.
 *
 * <p>Range queries cover {@code after < timestamp <= until}, so adjacent
 * windows never count an event twice.
 */
public interface ClassificationLog {

    void appendClassification(ClassificationEvent event);

    void appendCorrection(CorrectionEvent event);

    long countClassifications(Instant after, Instant until);

    long countCorrections(Instant after, Instant until);

    /**
     * Corrections for one sender in the range, oldest first.
     */
    List<CorrectionEvent> correctionsForSender(String sender, Instant after, Instant until);

    /**
     * Classifications for one sender in the range, oldest first.
     */
    List<ClassificationEvent> classificationsForSender(String sender, Instant after, Instant until);
}
