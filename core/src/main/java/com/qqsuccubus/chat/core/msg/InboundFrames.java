package com.qqsuccubus.chat.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.chat.core.error.EnvelopeValidationException;
import lombok.Value;

/**
 * Client-to-server frames.
 * <p>
 * Identity fields are boxed so that a missing field binds to {@code null} and is reported by
 * {@link InboundFrame#validate()} instead of silently defaulting to zero. The sender identity is
 * never read from the frame; it is the identity the connection was admitted with.
 * </p>
 */
public final class InboundFrames {
    private InboundFrames() {
    }

    /**
     * {@code {"type": "message", "receiverId": 2, "content": "hi"}}
     */
    @Value
    public static class DirectMessage implements InboundFrame {
        Long receiverId;
        String content;

        @JsonCreator
        public DirectMessage(
            @JsonProperty("receiverId") Long receiverId,
            @JsonProperty("content") String content
        ) {
            this.receiverId = receiverId;
            this.content = content;
        }

        @Override
        public EnvelopeType getType() {
            return EnvelopeType.MESSAGE;
        }

        @Override
        public void validate() {
            requireId("receiverId", receiverId);
            requireContent(content);
        }
    }

    /**
     * {@code {"type": "group_message", "groupId": 7, "content": "hi all"}}
     */
    @Value
    public static class GroupMessage implements InboundFrame {
        Long groupId;
        String content;

        @JsonCreator
        public GroupMessage(
            @JsonProperty("groupId") Long groupId,
            @JsonProperty("content") String content
        ) {
            this.groupId = groupId;
            this.content = content;
        }

        @Override
        public EnvelopeType getType() {
            return EnvelopeType.GROUP_MESSAGE;
        }

        @Override
        public void validate() {
            requireId("groupId", groupId);
            requireContent(content);
        }
    }

    /**
     * {@code {"type": "typing", "receiverId": 2}}
     */
    @Value
    public static class Typing implements InboundFrame {
        Long receiverId;

        @JsonCreator
        public Typing(@JsonProperty("receiverId") Long receiverId) {
            this.receiverId = receiverId;
        }

        @Override
        public EnvelopeType getType() {
            return EnvelopeType.TYPING;
        }

        @Override
        public void validate() {
            requireId("receiverId", receiverId);
        }
    }

    /**
     * {@code {"type": "read_messages", "senderId": 1}}: marks everything the given sender
     * sent to this connection's user as read.
     */
    @Value
    public static class ReadMessages implements InboundFrame {
        Long senderId;

        @JsonCreator
        public ReadMessages(@JsonProperty("senderId") Long senderId) {
            this.senderId = senderId;
        }

        @Override
        public EnvelopeType getType() {
            return EnvelopeType.READ_MESSAGES;
        }

        @Override
        public void validate() {
            requireId("senderId", senderId);
        }
    }

    private static void requireId(String field, Long value) {
        if (value == null) {
            throw new EnvelopeValidationException("Missing required field '" + field + "'");
        }
        if (value <= 0) {
            throw new EnvelopeValidationException("Field '" + field + "' must be a positive id");
        }
    }

    private static void requireContent(String content) {
        if (content == null) {
            throw new EnvelopeValidationException("Missing required field 'content'");
        }
        if (content.isBlank()) {
            throw new EnvelopeValidationException("Message content must not be empty");
        }
    }
}
