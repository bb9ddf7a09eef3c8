package com.mailmind.exception;

/**
 * Exception thrown when the inference backend cannot be reached or has no usable model.
 * Fatal for the subsystem that raised it.
 */
public class BackendUnavailableException extends MailMindException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
