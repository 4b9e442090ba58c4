package com.qqsuccubus.chat.core.redis;

/**
 * Redis keyspace for the Redis-backed storage collaborator.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions (user:, dm:, gm:, group:, seq:)</li>
 *   <li>Hashes hold records, lists hold ordered history, sets hold unread and membership indexes</li>
 *   <li>Ids come from {@code INCR} sequences so they are monotonic per record kind</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Id sequence for a record kind: {@code seq:{kind}} (String, INCR).
     *
     * @param kind record kind (user/dm/gm)
     * @return Redis key
     */
    public static String seq(String kind) {
        return "seq:" + kind;
    }

    /**
     * User record: {@code user:{userId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> id, username, displayName, bio, avatar, isOnline, lastSeen, createdAt
     * (timestamps as epoch millis)
     * </p>
     *
     * @param userId user identifier
     * @return Redis key
     */
    public static String user(long userId) {
        return "user:" + userId;
    }

    /**
     * Direct message record: {@code dm:{messageId}} (Hash).
     *
     * @param messageId message identifier
     * @return Redis key
     */
    public static String directMessage(long messageId) {
        return "dm:" + messageId;
    }

    /**
     * Conversation history between two users: {@code dm:conv:{low}:{high}}
     * <p>
     * <b>Type:</b> List of message ids in creation order. The pair is ordered so both
     * participants resolve the same key.
     * </p>
     *
     * @param userId   one participant
     * @param friendId other participant
     * @return Redis key
     */
    public static String conversation(long userId, long friendId) {
        return "dm:conv:" + Math.min(userId, friendId) + ":" + Math.max(userId, friendId);
    }

    /**
     * Unread ids from one sender to one receiver: {@code dm:unread:{receiverId}:{senderId}} (Set).
     *
     * @param receiverId reader
     * @param senderId   author
     * @return Redis key
     */
    public static String unreadFrom(long receiverId, long senderId) {
        return "dm:unread:" + receiverId + ":" + senderId;
    }

    /**
     * All unread ids for a receiver: {@code dm:unread:{receiverId}} (Set).
     *
     * @param receiverId reader
     * @return Redis key
     */
    public static String unread(long receiverId) {
        return "dm:unread:" + receiverId;
    }

    /**
     * Group message record: {@code gm:{messageId}} (Hash).
     *
     * @param messageId message identifier
     * @return Redis key
     */
    public static String groupMessage(long messageId) {
        return "gm:" + messageId;
    }

    /**
     * Group members: {@code group:{groupId}:members} (Set of user ids).
     *
     * @param groupId group identifier
     * @return Redis key
     */
    public static String groupMembers(long groupId) {
        return "group:" + groupId + ":members";
    }

    /**
     * Group history: {@code group:{groupId}:messages} (List of message ids).
     *
     * @param groupId group identifier
     * @return Redis key
     */
    public static String groupMessages(long groupId) {
        return "group:" + groupId + ":messages";
    }

}
