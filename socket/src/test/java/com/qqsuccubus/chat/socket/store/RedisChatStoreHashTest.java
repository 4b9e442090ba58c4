package com.qqsuccubus.chat.socket.store;

import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.core.model.UserPatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hash layout checks for the Redis store; no Redis server needed.
 */
class RedisChatStoreHashTest {

    @Test
    @DisplayName("Should write only the fields a patch sets")
    void testPatchHashIsPartial() {
        Map<String, String> online = RedisChatStore.toHash(UserPatch.online());
        assertEquals(Map.of("isOnline", "true"), online);

        Instant lastSeen = Instant.parse("2024-06-01T12:00:00Z");
        Map<String, String> offline = RedisChatStore.toHash(UserPatch.offline(lastSeen));
        assertEquals(Map.of("isOnline", "false", "lastSeen", String.valueOf(lastSeen.toEpochMilli())), offline);
    }

    @Test
    @DisplayName("Should read a user hash with optional fields absent")
    void testUserWithoutOptionalFields() {
        User user = RedisChatStore.toUser(Map.of(
            "id", "5",
            "username", "eve",
            "isOnline", "false",
            "createdAt", "1700000000000"
        ));

        assertEquals(5L, user.getId());
        assertEquals("eve", user.getUsername());
        assertNull(user.getBio());
        assertNull(user.getLastSeen());
        assertEquals(Instant.ofEpochMilli(1700000000000L), user.getCreatedAt());
    }
}
