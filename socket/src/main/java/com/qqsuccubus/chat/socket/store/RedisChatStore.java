package com.qqsuccubus.chat.socket.store;

import com.qqsuccubus.chat.core.error.PersistenceException;
import com.qqsuccubus.chat.core.model.DirectMessage;
import com.qqsuccubus.chat.core.model.DirectMessageDraft;
import com.qqsuccubus.chat.core.model.GroupMessage;
import com.qqsuccubus.chat.core.model.GroupMessageDraft;
import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.core.model.UserPatch;
import com.qqsuccubus.chat.core.redis.Keys;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.Value;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Reactive Redis storage collaborator.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API. Records are hashes, history is
 * kept in lists of ids, unread and membership indexes are sets (see {@link Keys}).
 * Multi-key writes are not transactional: the record hash is written first, indexes after, so a
 * partially failed write leaves an unindexed record rather than a dangling index entry.
 * </p>
 */
public class RedisChatStore implements IChatStore {
    private static final Logger log = LoggerFactory.getLogger(RedisChatStore.class);

    private static final String USER_SEQ = "user";
    private static final String DM_SEQ = "dm";
    private static final String GM_SEQ = "gm";

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final Clock clock;

    public RedisChatStore(SocketConfig config) {
        this(RedisClient.create(config.getRedisUrl()), Clock.systemUTC());
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    RedisChatStore(RedisClient client, Clock clock) {
        this.client = client;
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.clock = clock;
    }

    @Override
    public Mono<User> getUser(long userId) {
        return readHash(Keys.user(userId))
            .map(RedisChatStore::toUser)
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to load user " + userId, err));
    }

    @Override
    public Mono<User> updateUser(long userId, UserPatch patch) {
        String key = Keys.user(userId);
        Map<String, String> fields = toHash(patch);

        return commands.exists(key)
            .flatMap(exists -> {
                if (exists == 0) {
                    return Mono.<User>empty();
                }
                if (fields.isEmpty()) {
                    return getUser(userId);
                }
                return commands.hset(key, fields).then(getUser(userId));
            })
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to update user " + userId, err))
            .doOnError(err -> log.error("Failed to update user {}", userId, err));
    }

    @Override
    public Mono<DirectMessage> createMessage(DirectMessageDraft draft) {
        return requireUser(draft.getSenderId())
            .then(requireUser(draft.getReceiverId()))
            .then(commands.incr(Keys.seq(DM_SEQ)))
            .flatMap(id -> {
                DirectMessage message = DirectMessage.builder()
                    .id(id)
                    .senderId(draft.getSenderId())
                    .receiverId(draft.getReceiverId())
                    .content(draft.getContent())
                    .read(false)
                    .createdAt(clock.instant())
                    .build();

                String idValue = String.valueOf(id);
                return commands.hset(Keys.directMessage(id), toHash(message))
                    .then(Mono.when(
                        commands.rpush(Keys.conversation(message.getSenderId(), message.getReceiverId()), idValue),
                        commands.sadd(Keys.unreadFrom(message.getReceiverId(), message.getSenderId()), idValue),
                        commands.sadd(Keys.unread(message.getReceiverId()), idValue)
                    ))
                    .thenReturn(message);
            })
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to create message", err))
            .doOnError(err -> log.error("Failed to create message from {} to {}",
                draft.getSenderId(), draft.getReceiverId(), err));
    }

    @Override
    public Mono<GroupMessage> createGroupMessage(GroupMessageDraft draft) {
        return requireUser(draft.getSenderId())
            .then(commands.scard(Keys.groupMembers(draft.getGroupId())))
            .flatMap(members -> members == 0
                ? Mono.<Long>error(new PersistenceException("Unknown group " + draft.getGroupId()))
                : commands.incr(Keys.seq(GM_SEQ)))
            .flatMap(id -> {
                GroupMessage message = GroupMessage.builder()
                    .id(id)
                    .groupId(draft.getGroupId())
                    .senderId(draft.getSenderId())
                    .content(draft.getContent())
                    .createdAt(clock.instant())
                    .build();

                return commands.hset(Keys.groupMessage(id), toHash(message))
                    .then(commands.rpush(Keys.groupMessages(message.getGroupId()), String.valueOf(id)))
                    .thenReturn(message);
            })
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to create group message", err))
            .doOnError(err -> log.error("Failed to create group message in {} from {}",
                draft.getGroupId(), draft.getSenderId(), err));
    }

    @Override
    public Flux<User> getGroupMembers(long groupId) {
        return commands.smembers(Keys.groupMembers(groupId))
            .flatMapSequential(id -> getUser(Long.parseLong(id)))
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to load members of group " + groupId, err));
    }

    @Override
    public Mono<Void> markMessagesAsRead(long receiverId, long senderId) {
        String unreadFrom = Keys.unreadFrom(receiverId, senderId);

        return commands.smembers(unreadFrom)
            .collectList()
            .flatMap(ids -> {
                if (ids.isEmpty()) {
                    return Mono.<Void>empty();
                }
                String[] idArray = ids.toArray(String[]::new);
                return Flux.fromIterable(ids)
                    .flatMap(id -> commands.hset(Keys.directMessage(Long.parseLong(id)), "isRead", "true"))
                    .then(commands.srem(Keys.unread(receiverId), idArray))
                    // srem rather than del: ids added after smembers stay unread
                    .then(commands.srem(unreadFrom, idArray))
                    .then();
            })
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to mark messages as read", err))
            .doOnError(err -> log.error("Failed to mark messages from {} to {} as read", senderId, receiverId, err));
    }

    @Override
    public Flux<DirectMessage> getMessagesBetweenUsers(long userId, long friendId) {
        return commands.lrange(Keys.conversation(userId, friendId), 0, -1)
            .concatMap(id -> readHash(Keys.directMessage(Long.parseLong(id))))
            .map(RedisChatStore::toDirectMessage)
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to load conversation", err));
    }

    @Override
    public Mono<Long> getUnreadMessageCount(long receiverId) {
        return commands.scard(Keys.unread(receiverId))
            .onErrorMap(err -> new PersistenceException("Failed to count unread messages", err));
    }

    @Override
    public Flux<GroupMessage> getGroupMessages(long groupId) {
        return commands.lrange(Keys.groupMessages(groupId), 0, -1)
            .concatMap(id -> readHash(Keys.groupMessage(Long.parseLong(id))))
            .map(RedisChatStore::toGroupMessage)
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to load group history", err));
    }

    @Override
    public Mono<User> createUser(User user) {
        return commands.incr(Keys.seq(USER_SEQ))
            .flatMap(id -> {
                Instant now = clock.instant();
                User stored = user.toBuilder()
                    .id(id)
                    .online(false)
                    .lastSeen(now)
                    .createdAt(now)
                    .build();
                return commands.hset(Keys.user(id), toHash(stored)).thenReturn(stored);
            })
            .onErrorMap(err -> new PersistenceException("Failed to create user", err));
    }

    @Override
    public Mono<Void> addUserToGroup(long groupId, long userId) {
        return requireUser(userId)
            .then(commands.sadd(Keys.groupMembers(groupId), String.valueOf(userId)))
            .then()
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to add user to group", err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }

    private Mono<Map<String, String>> readHash(String key) {
        return commands.hgetall(key)
            .collectMap(KeyValue::getKey, Value::getValue)
            .filter(fields -> !fields.isEmpty());
    }

    private Mono<Void> requireUser(long userId) {
        return commands.exists(Keys.user(userId))
            .flatMap(exists -> exists > 0
                ? Mono.<Void>empty()
                : Mono.error(new PersistenceException("Unknown user " + userId)));
    }

    static Map<String, String> toHash(User user) {
        Map<String, String> fields = new HashMap<>();
        fields.put("id", String.valueOf(user.getId()));
        putIfPresent(fields, "username", user.getUsername());
        putIfPresent(fields, "displayName", user.getDisplayName());
        putIfPresent(fields, "bio", user.getBio());
        putIfPresent(fields, "avatar", user.getAvatar());
        fields.put("isOnline", String.valueOf(user.isOnline()));
        putInstant(fields, "lastSeen", user.getLastSeen());
        putInstant(fields, "createdAt", user.getCreatedAt());
        return fields;
    }

    static Map<String, String> toHash(UserPatch patch) {
        Map<String, String> fields = new HashMap<>();
        putIfPresent(fields, "displayName", patch.getDisplayName());
        putIfPresent(fields, "bio", patch.getBio());
        putIfPresent(fields, "avatar", patch.getAvatar());
        if (patch.getOnline() != null) {
            fields.put("isOnline", String.valueOf(patch.getOnline()));
        }
        putInstant(fields, "lastSeen", patch.getLastSeen());
        return fields;
    }

    static Map<String, String> toHash(DirectMessage message) {
        Map<String, String> fields = new HashMap<>();
        fields.put("id", String.valueOf(message.getId()));
        fields.put("senderId", String.valueOf(message.getSenderId()));
        fields.put("receiverId", String.valueOf(message.getReceiverId()));
        fields.put("content", message.getContent());
        fields.put("isRead", String.valueOf(message.isRead()));
        putInstant(fields, "createdAt", message.getCreatedAt());
        return fields;
    }

    static Map<String, String> toHash(GroupMessage message) {
        Map<String, String> fields = new HashMap<>();
        fields.put("id", String.valueOf(message.getId()));
        fields.put("groupId", String.valueOf(message.getGroupId()));
        fields.put("senderId", String.valueOf(message.getSenderId()));
        fields.put("content", message.getContent());
        putInstant(fields, "createdAt", message.getCreatedAt());
        return fields;
    }

    static User toUser(Map<String, String> fields) {
        return User.builder()
            .id(Long.parseLong(fields.get("id")))
            .username(fields.get("username"))
            .displayName(fields.get("displayName"))
            .bio(fields.get("bio"))
            .avatar(fields.get("avatar"))
            .online(Boolean.parseBoolean(fields.get("isOnline")))
            .lastSeen(parseInstant(fields.get("lastSeen")))
            .createdAt(parseInstant(fields.get("createdAt")))
            .build();
    }

    static DirectMessage toDirectMessage(Map<String, String> fields) {
        return DirectMessage.builder()
            .id(Long.parseLong(fields.get("id")))
            .senderId(Long.parseLong(fields.get("senderId")))
            .receiverId(Long.parseLong(fields.get("receiverId")))
            .content(fields.get("content"))
            .read(Boolean.parseBoolean(fields.get("isRead")))
            .createdAt(parseInstant(fields.get("createdAt")))
            .build();
    }

    static GroupMessage toGroupMessage(Map<String, String> fields) {
        return GroupMessage.builder()
            .id(Long.parseLong(fields.get("id")))
            .groupId(Long.parseLong(fields.get("groupId")))
            .senderId(Long.parseLong(fields.get("senderId")))
            .content(fields.get("content"))
            .createdAt(parseInstant(fields.get("createdAt")))
            .build();
    }

    private static void putIfPresent(Map<String, String> fields, String name, String value) {
        if (value != null) {
            fields.put(name, value);
        }
    }

    private static void putInstant(Map<String, String> fields, String name, Instant value) {
        if (value != null) {
            fields.put(name, String.valueOf(value.toEpochMilli()));
        }
    }

    private static Instant parseInstant(String epochMillis) {
        return epochMillis == null ? null : Instant.ofEpochMilli(Long.parseLong(epochMillis));
    }
}
