package com.qqsuccubus.chat.socket.store;

import com.qqsuccubus.chat.core.error.PersistenceException;
import com.qqsuccubus.chat.core.model.DirectMessage;
import com.qqsuccubus.chat.core.model.DirectMessageDraft;
import com.qqsuccubus.chat.core.model.GroupMessage;
import com.qqsuccubus.chat.core.model.GroupMessageDraft;
import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.core.model.UserPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local storage collaborator.
 * <p>
 * Mirrors the relational constraints of the production schema: messages must reference existing
 * users and groups, ids are monotonic per record kind. Used as the default store and by tests.
 * </p>
 */
public class InMemoryChatStore implements IChatStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChatStore.class);

    private final Clock clock;

    private final AtomicLong userSeq = new AtomicLong();
    private final AtomicLong messageSeq = new AtomicLong();
    private final AtomicLong groupMessageSeq = new AtomicLong();

    private final Map<Long, User> users = new ConcurrentHashMap<>();
    private final Map<Long, DirectMessage> messages = new ConcurrentHashMap<>();
    private final Map<Long, GroupMessage> groupMessages = new ConcurrentHashMap<>();
    // groupId -> member ids
    private final Map<Long, Set<Long>> groups = new ConcurrentHashMap<>();

    public InMemoryChatStore() {
        this(Clock.systemUTC());
    }

    public InMemoryChatStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<User> getUser(long userId) {
        return Mono.fromSupplier(() -> users.get(userId));
    }

    @Override
    public Mono<User> updateUser(long userId, UserPatch patch) {
        return Mono.fromSupplier(() -> users.computeIfPresent(userId, (id, user) -> user.apply(patch)));
    }

    @Override
    public Mono<DirectMessage> createMessage(DirectMessageDraft draft) {
        return Mono.fromCallable(() -> {
            requireUser(draft.getSenderId());
            requireUser(draft.getReceiverId());

            DirectMessage message = DirectMessage.builder()
                    .id(messageSeq.incrementAndGet())
                    .senderId(draft.getSenderId())
                    .receiverId(draft.getReceiverId())
                    .content(draft.getContent())
                    .read(false)
                    .createdAt(clock.instant())
                    .build();
            messages.put(message.getId(), message);
            return message;
        });
    }

    @Override
    public Mono<GroupMessage> createGroupMessage(GroupMessageDraft draft) {
        return Mono.fromCallable(() -> {
            requireUser(draft.getSenderId());
            if (!groups.containsKey(draft.getGroupId())) {
                throw new PersistenceException("Unknown group " + draft.getGroupId());
            }

            GroupMessage message = GroupMessage.builder()
                    .id(groupMessageSeq.incrementAndGet())
                    .groupId(draft.getGroupId())
                    .senderId(draft.getSenderId())
                    .content(draft.getContent())
                    .createdAt(clock.instant())
                    .build();
            groupMessages.put(message.getId(), message);
            return message;
        });
    }

    @Override
    public Flux<User> getGroupMembers(long groupId) {
        return Flux.defer(() -> Flux.fromIterable(groups.getOrDefault(groupId, Set.of())))
                .mapNotNull(users::get);
    }

    @Override
    public Mono<Void> markMessagesAsRead(long receiverId, long senderId) {
        return Mono.fromRunnable(() -> messages.replaceAll((id, message) ->
                !message.isRead() && message.getSenderId() == senderId && message.getReceiverId() == receiverId
                        ? message.withRead(true)
                        : message
        ));
    }

    @Override
    public Flux<DirectMessage> getMessagesBetweenUsers(long userId, long friendId) {
        return Flux.defer(() -> Flux.fromStream(messages.values().stream()
                .filter(m -> (m.getSenderId() == userId && m.getReceiverId() == friendId)
                        || (m.getSenderId() == friendId && m.getReceiverId() == userId))
                .sorted(Comparator.comparing(DirectMessage::getCreatedAt).thenComparing(DirectMessage::getId))));
    }

    @Override
    public Mono<Long> getUnreadMessageCount(long receiverId) {
        return Mono.fromSupplier(() -> messages.values().stream()
                .filter(m -> m.getReceiverId() == receiverId && !m.isRead())
                .count());
    }

    @Override
    public Flux<GroupMessage> getGroupMessages(long groupId) {
        return Flux.defer(() -> Flux.fromStream(groupMessages.values().stream()
                .filter(m -> m.getGroupId() == groupId)
                .sorted(Comparator.comparing(GroupMessage::getCreatedAt).thenComparing(GroupMessage::getId))));
    }

    @Override
    public Mono<User> createUser(User user) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            User stored = user.toBuilder()
                    .id(userSeq.incrementAndGet())
                    .online(false)
                    .lastSeen(now)
                    .createdAt(now)
                    .build();
            users.put(stored.getId(), stored);
            log.debug("Created user {} ({})", stored.getId(), stored.getUsername());
            return stored;
        });
    }

    @Override
    public Mono<Void> addUserToGroup(long groupId, long userId) {
        return Mono.fromRunnable(() -> {
            requireUser(userId);
            groups.computeIfAbsent(groupId, id -> ConcurrentHashMap.newKeySet()).add(userId);
        });
    }

    @Override
    public void close() {
        log.info("In-memory store closed ({} users, {} messages, {} group messages)",
                users.size(), messages.size(), groupMessages.size());
    }

    private void requireUser(long userId) {
        if (!users.containsKey(userId)) {
            throw new PersistenceException("Unknown user " + userId);
        }
    }
}
