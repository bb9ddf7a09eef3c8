package com.mailmind.exception;

/**
 * Base exception for MailMind core.
 */
public class MailMindException extends RuntimeException {

    public MailMindException(String message) {
        super(message);
    }

    public MailMindException(String message, Throwable cause) {
        super(message, cause);
    }
}
