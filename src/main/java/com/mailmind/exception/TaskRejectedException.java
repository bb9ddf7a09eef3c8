package com.mailmind.exception;

/**
 * Exception thrown when a batch cannot be accepted by the dispatcher.
 * Typically due to the dispatcher being shutdown.
 */
public class TaskRejectedException extends MailMindException {

    public TaskRejectedException(String message) {
        super(message);
    }

    public TaskRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
