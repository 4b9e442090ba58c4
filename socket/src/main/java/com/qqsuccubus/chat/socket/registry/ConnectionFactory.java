package com.qqsuccubus.chat.socket.registry;

import com.qqsuccubus.chat.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;

import java.util.UUID;

/**
 * Factory for creating Connection objects (Single Responsibility Principle).
 * <p>
 * Separated from the registry to isolate buffer sizing and handle construction.
 * </p>
 */
public class ConnectionFactory {
    private final SocketConfig config;

    public ConnectionFactory(SocketConfig config) {
        this.config = config;
    }

    /**
     * Creates a new open connection handle.
     *
     * @param userId verified user identifier
     * @param closer transport close callback
     * @return Connection instance
     */
    public Connection create(long userId, Connection.Closer closer) {
        // Outbound sink with bounded backpressure buffer; frames queued before the transport
        // subscribes are kept
        Sinks.Many<String> sink = Sinks.many().multicast().onBackpressureBuffer(
            config.getPerConnBufferSize(), false
        );

        return new Connection(userId, UUID.randomUUID().toString(), sink, closer);
    }

}
