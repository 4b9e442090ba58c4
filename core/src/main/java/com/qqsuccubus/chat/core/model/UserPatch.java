package com.qqsuccubus.chat.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial user update. Only non-null fields are written.
 */
@Value
@Builder
public class UserPatch {
    String displayName;
    String bio;
    String avatar;
    Boolean online;
    Instant lastSeen;

    public static UserPatch online() {
        return UserPatch.builder().online(true).build();
    }

    public static UserPatch offline(Instant lastSeen) {
        return UserPatch.builder().online(false).lastSeen(lastSeen).build();
    }
}
