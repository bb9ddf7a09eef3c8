package com.mailmind.priority;

import com.mailmind.exception.ValidationException;

/**
 * Identifies the message being classified and its sender.
 *
 * @param messageId Message identifier
 * @param sender    Sender address
 */
public record MessageRef(
        String messageId,
        String sender
) {
    public MessageRef {
        if (messageId == null || messageId.isBlank()) {
            throw new ValidationException("Message id cannot be blank");
        }
        if (sender == null || sender.isBlank()) {
            throw new ValidationException("Sender cannot be blank");
        }
    }
}
