package com.qqsuccubus.chat.core.msg;

/**
 * A decoded client-to-server frame. One implementation per inbound {@link EnvelopeType},
 * see {@link InboundFrames}.
 */
public interface InboundFrame {

    EnvelopeType getType();

    /**
     * Checks required fields after Jackson binding.
     *
     * @throws com.qqsuccubus.chat.core.error.EnvelopeValidationException when a field is missing or blank
     */
    void validate();
}
