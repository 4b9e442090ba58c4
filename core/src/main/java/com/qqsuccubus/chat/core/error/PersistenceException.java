package com.qqsuccubus.chat.core.error;

/**
 * Raised by a storage collaborator when a durable operation is rejected or fails.
 */
public class PersistenceException extends ChatException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
