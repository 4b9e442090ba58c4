package com.qqsuccubus.chat.core.error;

/**
 * Base type for every failure the chat socket layer reports.
 * <p>
 * None of these are fatal to the process: each one is scoped to a single upgrade request
 * or a single inbound frame.
 * </p>
 */
public abstract class ChatException extends RuntimeException {

    protected ChatException(String message) {
        super(message);
    }

    protected ChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
