package com.qqsuccubus.chat.socket.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process connection registry.
 * <p>
 * The map is never exposed. Every mutation is one atomic map operation ({@code put},
 * {@code remove(key, value)}), so concurrent connects, and a connect racing a disconnect for the
 * same user, cannot leave two entries or evict a newer handle.
 * </p>
 */
public class ConnectionRegistry implements IConnectionRegistry {
	private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

	// userId -> live connection
	private final Map<Long, Connection> connections = new ConcurrentHashMap<>();

	@Override
	public Optional<Connection> add(long userId, Connection connection) {
		Connection previous = connections.put(userId, connection);
		if (previous == null || previous == connection) {
			log.debug("Registered connection {} for user {}", connection.getConnectionId(), userId);
			return Optional.empty();
		}

		log.info("User {} reconnected, closing superseded connection {}", userId, previous.getConnectionId());
		previous.close(CloseCodes.SUPERSEDED, "Superseded by a newer connection");
		return Optional.of(previous);
	}

	@Override
	public boolean remove(long userId, Connection connection) {
		boolean removed = connections.remove(userId, connection);
		if (removed) {
			log.debug("Removed connection {} for user {}", connection.getConnectionId(), userId);
		} else {
			log.debug("Ignoring stale removal of connection {} for user {}", connection.getConnectionId(), userId);
		}
		return removed;
	}

	@Override
	public Optional<Connection> lookup(long userId) {
		return Optional.ofNullable(connections.get(userId)).filter(Connection::isOpen);
	}

	@Override
	public boolean isOnline(long userId) {
		return lookup(userId).isPresent();
	}

	@Override
	public Set<Long> getOnlineUserIds() {
		return Set.copyOf(connections.keySet());
	}

	@Override
	public int size() {
		return connections.size();
	}

	@Override
	public int closeAll(int code, String reason) {
		int closed = 0;
		for (Connection connection : connections.values()) {
			if (connection.close(code, reason)) {
				closed++;
			}
		}
		log.info("Closing {} connections: {}", closed, reason);
		return closed;
	}
}
