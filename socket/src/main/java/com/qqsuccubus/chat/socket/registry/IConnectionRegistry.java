package com.qqsuccubus.chat.socket.registry;

import java.util.Optional;
import java.util.Set;

/**
 * Interface for the connection registry (Dependency Inversion Principle).
 * <p>
 * Maps a user identity to at most one live connection. Presence side effects are not performed
 * here; callers invoke the presence notifier after {@link #add} / {@link #remove} succeed.
 * </p>
 */
public interface IConnectionRegistry {

    /**
     * Registers a connection, replacing and closing any prior connection for the same user.
     *
     * @param userId     user identifier
     * @param connection new live handle
     * @return the superseded connection, if there was one
     */
    Optional<Connection> add(long userId, Connection connection);

    /**
     * Removes the entry only if it still points at {@code connection}. A disconnect callback for a
     * superseded handle is therefore a no-op.
     *
     * @param userId     user identifier
     * @param connection handle that disconnected
     * @return {@code true} if the entry was removed
     */
    boolean remove(long userId, Connection connection);

    /**
     * @param userId user identifier
     * @return the live (open) connection, or empty
     */
    Optional<Connection> lookup(long userId);

    boolean isOnline(long userId);

    /**
     * @return snapshot of users with a registered connection
     */
    Set<Long> getOnlineUserIds();

    int size();

    /**
     * Closes every registered connection; entries are removed by the disconnect path.
     *
     * @param code   WebSocket close status
     * @param reason close reason
     * @return number of connections asked to close
     */
    int closeAll(int code, String reason);
}
