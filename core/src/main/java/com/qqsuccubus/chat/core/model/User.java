package com.qqsuccubus.chat.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * User record as seen by the socket layer.
 * <p>
 * Credentials never leave the CRUD layer; only profile and presence fields are carried here.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class User {
    long id;
    String username;
    String displayName;
    String bio;
    String avatar;

    @JsonProperty("isOnline")
    boolean online;

    /**
     * Last disconnect time; set to the creation time until the first disconnect.
     */
    Instant lastSeen;

    Instant createdAt;

    /**
     * Returns a copy of this user with every non-null field of the patch applied.
     *
     * @param patch partial update
     * @return patched copy
     */
    public User apply(UserPatch patch) {
        UserBuilder builder = toBuilder();
        if (patch.getDisplayName() != null) {
            builder.displayName(patch.getDisplayName());
        }
        if (patch.getBio() != null) {
            builder.bio(patch.getBio());
        }
        if (patch.getAvatar() != null) {
            builder.avatar(patch.getAvatar());
        }
        if (patch.getOnline() != null) {
            builder.online(patch.getOnline());
        }
        if (patch.getLastSeen() != null) {
            builder.lastSeen(patch.getLastSeen());
        }
        return builder.build();
    }
}
