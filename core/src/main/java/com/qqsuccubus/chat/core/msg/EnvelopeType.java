package com.qqsuccubus.chat.core.msg;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every {@code type} value the chat socket recognises on the wire.
 */
public enum EnvelopeType {
    CONNECTED("connected", false, true),
    MESSAGE("message", true, true),
    MESSAGE_SENT("message_sent", false, true),
    GROUP_MESSAGE("group_message", true, true),
    GROUP_MESSAGE_SENT("group_message_sent", false, true),
    TYPING("typing", true, true),
    READ_MESSAGES("read_messages", true, false),
    MESSAGES_READ("messages_read", false, true),
    ERROR("error", false, true);

    private final String wireName;
    private final boolean inbound;
    private final boolean outbound;

    EnvelopeType(String wireName, boolean inbound, boolean outbound) {
        this.wireName = wireName;
        this.inbound = inbound;
        this.outbound = outbound;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isInbound() {
        return inbound;
    }

    public boolean isOutbound() {
        return outbound;
    }

    /**
     * Resolves a client-sent {@code type}; outbound-only names are not accepted.
     *
     * @param wireName raw type string
     * @return the inbound type, or empty when the name is unknown or outbound-only
     */
    public static Optional<EnvelopeType> inboundOf(String wireName) {
        return Arrays.stream(values())
                .filter(EnvelopeType::isInbound)
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
