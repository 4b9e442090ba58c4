package com.qqsuccubus.chat.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Durable one-to-one message.
 * <p>
 * Created with {@code isRead=false}; the only mutation this layer performs is flipping
 * {@code isRead} on a {@code read_messages} frame. Never deleted here.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class DirectMessage {
    long id;
    long senderId;
    long receiverId;
    String content;

    @JsonProperty("isRead")
    boolean read;

    Instant createdAt;
}
