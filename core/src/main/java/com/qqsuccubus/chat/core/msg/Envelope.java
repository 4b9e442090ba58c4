package com.qqsuccubus.chat.core.msg;

import com.qqsuccubus.chat.core.model.DirectMessage;
import com.qqsuccubus.chat.core.model.GroupMessage;
import lombok.Value;

import java.util.Map;

/**
 * Outbound frame written to a client socket: {@code {"type": ..., "data": {...}}}.
 * <p>
 * <b>Delivery:</b> at-least-once to peers that are connected at fan-out time. Nothing is queued
 * for offline peers; they read history from the durable store on their next login.
 * </p>
 * <p>
 * Instances are immutable and serialised once per fan-out, so one envelope can be shared
 * across all recipients.
 * </p>
 */
@Value
public class Envelope {
    EnvelopeType type;
    Object data;

    public static Envelope connected(long userId) {
        return new Envelope(EnvelopeType.CONNECTED, Map.of(
                "message", "Connected to chat WebSocket",
                "userId", userId
        ));
    }

    public static Envelope message(DirectMessage message) {
        return new Envelope(EnvelopeType.MESSAGE, message);
    }

    public static Envelope messageSent(DirectMessage message) {
        return new Envelope(EnvelopeType.MESSAGE_SENT, message);
    }

    public static Envelope groupMessage(GroupMessage message) {
        return new Envelope(EnvelopeType.GROUP_MESSAGE, message);
    }

    public static Envelope groupMessageSent(GroupMessage message) {
        return new Envelope(EnvelopeType.GROUP_MESSAGE_SENT, message);
    }

    public static Envelope typing(long senderId) {
        return new Envelope(EnvelopeType.TYPING, Map.of("senderId", senderId));
    }

    public static Envelope messagesRead(long readerId) {
        return new Envelope(EnvelopeType.MESSAGES_READ, Map.of("readerId", readerId));
    }

    public static Envelope error(String message) {
        return new Envelope(EnvelopeType.ERROR, Map.of("message", message));
    }
}
