package com.qqsuccubus.chat.core.error;

/**
 * Raised when an upgrade request carries a malformed or unknown identity.
 * The connection is refused with HTTP 401 and never reaches the registry.
 */
public class UnauthorizedException extends ChatException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
