package com.mailmind.exception;

/**
 * Exception thrown when no pooled handle became available within the acquire timeout.
 * Not retried internally.
 */
public class ResourceExhaustedException extends MailMindException {

    public ResourceExhaustedException(String message) {
        super(message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
