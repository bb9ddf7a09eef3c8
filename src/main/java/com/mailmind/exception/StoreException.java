package com.mailmind.exception;

/**
 * Unchecked exception wrapping JDBC errors thrown by the persistent stores.
 */
public class StoreException extends MailMindException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
