package com.mailmind.dispatch;

/**
 * Tagged per-item outcome. Exactly one is produced for every submitted item.
 *
 * @param itemId Id of the originating work item
 * @param status Outcome tag
 * @param value  Processor result, only set on {@link ItemStatus#SUCCESS}
 * @param error  Error description, set for every other status
 * @param <R>    Result type
 */
public record ItemResult<R>(
        String itemId,
        ItemStatus status,
        R value,
        String error
) {
    public static <R> ItemResult<R> success(String itemId, R value) {
        return new ItemResult<>(itemId, ItemStatus.SUCCESS, value, null);
    }

    public static <R> ItemResult<R> error(String itemId, String error) {
        return new ItemResult<>(itemId, ItemStatus.ERROR, null, error);
    }

    public static <R> ItemResult<R> timeout(String itemId, String error) {
        return new ItemResult<>(itemId, ItemStatus.TIMEOUT, null, error);
    }

    public static <R> ItemResult<R> cancelled(String itemId) {
        return new ItemResult<>(itemId, ItemStatus.CANCELLED, null, "Batch cancelled before item started");
    }

    public boolean isSuccess() {
        return status == ItemStatus.SUCCESS;
    }

    /**
     * True if the item exceeded its per-item timeout.
     */
    public boolean isTimeout() {
        return status == ItemStatus.TIMEOUT;
    }
}
