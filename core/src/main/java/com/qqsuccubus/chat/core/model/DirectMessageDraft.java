package com.qqsuccubus.chat.core.model;

import lombok.Value;

/**
 * Insert request for a {@link DirectMessage}; id, read flag and timestamp are assigned by the store.
 */
@Value
public class DirectMessageDraft {
    long senderId;
    long receiverId;
    String content;
}
