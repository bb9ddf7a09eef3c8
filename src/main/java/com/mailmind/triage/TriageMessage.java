package com.mailmind.triage;

import com.mailmind.exception.ValidationException;

/**
 * A message submitted for triage.
 *
 * @param messageId Message identifier
 * @param sender    Sender address
 * @param subject   Subject line, may be empty
 * @param body      Plain text body, may be empty
 */
public record TriageMessage(
        String messageId,
        String sender,
        String subject,
        String body
) {
    public TriageMessage {
        if (messageId == null || messageId.isBlank()) {
            throw new ValidationException("Message id cannot be blank");
        }
        if (sender == null || sender.isBlank()) {
            throw new ValidationException("Sender cannot be blank");
        }
        subject = subject != null ? subject : "";
        body = body != null ? body : "";
    }
}
