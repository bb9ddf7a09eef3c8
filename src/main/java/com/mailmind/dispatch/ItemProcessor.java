package com.mailmind.dispatch;

import com.mailmind.backend.InferenceClient;

/**
 * Processes one work item with a leased inference client.
 *
 * @param <P> Payload type
 * @param <R> Result type
 */
@FunctionalInterface
public interface ItemProcessor<P, R> {

    /**
     * @param client Client leased for the duration of this call only
     * @param item   Item to process
     * @return Result stored in the item's slot
     * @throws Exception any failure; it is captured into the item's slot
     */
    R process(InferenceClient client, WorkItem<P> item) throws Exception;
}
