package com.mailmind.priority;

import java.util.Optional;

/**
 * Adjusts base priorities per sender and learns from user corrections.
 */
public interface PriorityClassifier extends AutoCloseable {

    /**
     * Enrich a base classification with what is known about the sender.
     * Counts the classification; never changes learned importance.
     *
     * @param message Message and sender
     * @param base    Classification from the model
     * @return Enriched classification; confidence is passed through unchanged
     */
    EnrichedClassification classifyPriority(MessageRef message, BaseClassification base);

    /**
     * Record that the user changed a message's priority and learn from it.
     *
     * @param messageId          Message identifier
     * @param sender             Sender address
     * @param originalPriority   Priority the classifier produced
     * @param originalConfidence Confidence of that classification
     * @param userPriority       Priority chosen by the user
     * @param reason             Optional free-text reason
     * @throws com.mailmind.exception.ValidationException on invalid arguments, before any state change
     */
    void recordUserOverride(String messageId, String sender, Priority originalPriority,
                            double originalConfidence, Priority userPriority, String reason);

    /**
     * Set or clear the VIP flag. Does not change importance.
     */
    void setSenderVip(String sender, boolean vip);

    /**
     * Current profile of a sender, empty if the sender was never seen.
     */
    Optional<SenderProfile> getSenderStats(String sender);

    /**
     * Accuracy over the trailing {@code days}.
     */
    AccuracyReport getClassificationAccuracy(int days);

    /**
     * Write pending email counts of tracked senders to the preference store.
     */
    void flush();

    @Override
    void close();
}
