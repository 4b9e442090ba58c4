package com.qqsuccubus.chat.socket.registry;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Live handle for one admitted WebSocket.
 * <p>
 * Outbound frames go through a bounded sink that the transport drains; {@link #send(String)} is
 * serialised per connection so concurrent fan-outs never interleave, and fails fast once the
 * connection has left {@link ConnectionState#OPEN}. Identity is reference identity: two handles
 * for the same user are never equal.
 * </p>
 */
public class Connection {

    /**
     * Transport-level close, supplied by the WebSocket layer.
     */
    @FunctionalInterface
    public interface Closer {
        void close(int code, String reason);
    }

    @Getter
    private final long userId;
    @Getter
    private final String connectionId;
    private final Sinks.Many<String> sink;
    private final Closer closer;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.OPEN);

    public Connection(long userId, String connectionId, Sinks.Many<String> sink, Closer closer) {
        this.userId = userId;
        this.connectionId = connectionId;
        this.sink = sink;
        this.closer = closer;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    /**
     * Frames queued for the socket, in send order.
     */
    public Flux<String> outboundFrames() {
        return sink.asFlux();
    }

    /**
     * Queues one serialised frame.
     *
     * @param frame JSON text
     * @return {@link Sinks.EmitResult#OK} when queued; {@link Sinks.EmitResult#FAIL_TERMINATED} when the
     * connection is no longer open; {@link Sinks.EmitResult#FAIL_OVERFLOW} when the buffer is full
     */
    public Sinks.EmitResult send(String frame) {
        synchronized (sink) {
            if (!isOpen()) {
                return Sinks.EmitResult.FAIL_TERMINATED;
            }
            return sink.tryEmitNext(frame);
        }
    }

    /**
     * Starts closing. Only the first call has an effect.
     *
     * @param code   WebSocket close status
     * @param reason close reason
     * @return {@code true} if this call initiated the close
     */
    public boolean close(int code, String reason) {
        if (!state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSING)) {
            return false;
        }
        synchronized (sink) {
            sink.tryEmitComplete();
        }
        closer.close(code, reason);
        return true;
    }

    /**
     * Records that the transport is gone. Called from the transport's dispose hook.
     */
    public void markClosed() {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.OPEN) {
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
    }

    @Override
    public String toString() {
        return "Connection{userId=" + userId + ", id=" + connectionId + ", state=" + state.get() + "}";
    }
}
