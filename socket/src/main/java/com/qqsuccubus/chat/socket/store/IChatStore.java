package com.qqsuccubus.chat.socket.store;

import com.qqsuccubus.chat.core.model.DirectMessage;
import com.qqsuccubus.chat.core.model.DirectMessageDraft;
import com.qqsuccubus.chat.core.model.GroupMessage;
import com.qqsuccubus.chat.core.model.GroupMessageDraft;
import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.core.model.UserPatch;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable storage collaborator (Dependency Inversion Principle).
 * <p>
 * The socket layer only consumes this contract; profile editing, friendships and authentication
 * live in the CRUD layer that owns the same store. Implementations must be safe for concurrent
 * invocation and signal failures as {@link com.qqsuccubus.chat.core.error.PersistenceException}.
 * </p>
 */
public interface IChatStore {

    /**
     * @param userId user identifier
     * @return the user, or empty if unknown
     */
    Mono<User> getUser(long userId);

    /**
     * Applies the non-null fields of a patch.
     *
     * @param userId user identifier
     * @param patch  partial update
     * @return the updated user, or empty if unknown
     */
    Mono<User> updateUser(long userId, UserPatch patch);

    /**
     * Persists a direct message with {@code isRead=false}.
     *
     * @param draft sender, receiver and content
     * @return the stored record with id and timestamp assigned
     */
    Mono<DirectMessage> createMessage(DirectMessageDraft draft);

    /**
     * Persists a group message.
     *
     * @param draft group, sender and content
     * @return the stored record with id and timestamp assigned
     */
    Mono<GroupMessage> createGroupMessage(GroupMessageDraft draft);

    /**
     * Resolves the current members of a group. Always read through, never cached.
     *
     * @param groupId group identifier
     * @return members, empty for an unknown group
     */
    Flux<User> getGroupMembers(long groupId);

    /**
     * Marks every unread message from {@code senderId} to {@code receiverId} as read.
     *
     * @param receiverId reader
     * @param senderId   author
     * @return Mono completing when updated
     */
    Mono<Void> markMessagesAsRead(long receiverId, long senderId);

    /**
     * Conversation history in both directions, oldest first.
     */
    Flux<DirectMessage> getMessagesBetweenUsers(long userId, long friendId);

    Mono<Long> getUnreadMessageCount(long receiverId);

    /**
     * Group history, oldest first.
     */
    Flux<GroupMessage> getGroupMessages(long groupId);

    /**
     * Provisions a user; the id is assigned by the store.
     *
     * @param user profile fields
     * @return the stored user
     */
    Mono<User> createUser(User user);

    Mono<Void> addUserToGroup(long groupId, long userId);

    /**
     * Releases underlying resources.
     */
    void close();
}
