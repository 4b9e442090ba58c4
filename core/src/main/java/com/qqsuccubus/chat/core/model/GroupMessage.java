package com.qqsuccubus.chat.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Durable group message.
 */
@Value
@Builder(toBuilder = true)
public class GroupMessage {
    long id;
    long groupId;
    long senderId;
    String content;
    Instant createdAt;
}
