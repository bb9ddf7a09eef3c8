package com.mailmind.triage;

import com.mailmind.dispatch.ItemStatus;
import com.mailmind.priority.EnrichedClassification;

/**
 * Result of triaging one message.
 *
 * @param messageId      Message identifier
 * @param status         Status of the inference call
 * @param classification Enriched classification, null unless the call succeeded
 * @param error          Failure description, null on success
 */
public record TriageOutcome(
        String messageId,
        ItemStatus status,
        EnrichedClassification classification,
        String error
) {
    public boolean isSuccess() {
        return status == ItemStatus.SUCCESS;
    }
}
