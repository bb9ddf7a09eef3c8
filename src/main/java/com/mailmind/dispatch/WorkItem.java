package com.mailmind.dispatch;

/**
 * A unit of work submitted in a batch.
 *
 * @param id      Identifier reported back in the item's result slot
 * @param payload Item payload handed to the processor
 * @param <P>     Payload type
 */
public record WorkItem<P>(
        String id,
        P payload
) {
    public WorkItem {
        if (id == null) {
            throw new NullPointerException("Work item id cannot be null");
        }
    }

    public static <P> WorkItem<P> of(String id, P payload) {
        return new WorkItem<>(id, payload);
    }
}
