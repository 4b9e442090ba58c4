package com.qqsuccubus.chat.core.model;

import lombok.Value;

/**
 * Insert request for a {@link GroupMessage}.
 */
@Value
public class GroupMessageDraft {
    long groupId;
    long senderId;
    String content;
}
