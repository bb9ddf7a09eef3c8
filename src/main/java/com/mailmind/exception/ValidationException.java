package com.mailmind.exception;

/**
 * Exception thrown for invalid arguments at the API boundary.
 * Raised before any state is changed.
 */
public class ValidationException extends MailMindException {

    public ValidationException(String message) {
        super(message);
    }
}
