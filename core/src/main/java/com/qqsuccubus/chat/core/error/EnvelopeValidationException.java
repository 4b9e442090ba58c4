package com.qqsuccubus.chat.core.error;

/**
 * Raised when an inbound frame cannot be decoded: not JSON, unknown type, missing or blank field.
 * Reported back to the sender as an {@code error} envelope; the connection stays open.
 */
public class EnvelopeValidationException extends ChatException {

    public EnvelopeValidationException(String message) {
        super(message);
    }

    public EnvelopeValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
