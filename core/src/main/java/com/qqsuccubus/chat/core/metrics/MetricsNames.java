package com.qqsuccubus.chat.core.metrics;

/**
 * Micrometer metric names used by the chat socket node.
 * <p>
 * <b>Naming convention:</b> {@code chat.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Live connections in the registry.
     */
    public static final String CONNECTIONS_ACTIVE = "chat.socket.connections.active";

    /**
     * Counter: Upgrade requests admitted.
     */
    public static final String CONNECTIONS_ACCEPTED_TOTAL = "chat.socket.connections.accepted.total";

    /**
     * Counter: Upgrade requests refused.
     * <p>
     * Tags: reason (unauthorized/draining)
     * </p>
     */
    public static final String CONNECTIONS_REJECTED_TOTAL = "chat.socket.connections.rejected.total";

    /**
     * Counter: Connections evicted because the same user connected again.
     */
    public static final String CONNECTIONS_SUPERSEDED_TOTAL = "chat.socket.connections.superseded.total";

    /**
     * Counter: Envelopes handed to a live connection.
     * <p>
     * Tags: type
     * </p>
     */
    public static final String DELIVERED_TOTAL = "chat.socket.delivered.total";

    /**
     * Counter: Fan-out targets that were not connected.
     * <p>
     * Tags: type
     * </p>
     */
    public static final String DELIVERY_MISS_TOTAL = "chat.socket.delivery.miss.total";

    /**
     * Counter: Envelopes dropped by a connection that could not accept them.
     * <p>
     * Tags: reason (buffer_full/closed)
     * </p>
     */
    public static final String DROPS_TOTAL = "chat.socket.drops.total";

    /**
     * Counter: Inbound frames answered with an error envelope.
     * <p>
     * Tags: reason (validation/persistence)
     * </p>
     */
    public static final String FRAMES_REJECTED_TOTAL = "chat.socket.frames.rejected.total";

    /**
     * Counter: Presence writes that failed and were skipped.
     */
    public static final String PRESENCE_FAILURES_TOTAL = "chat.socket.presence.failures.total";

    /**
     * Timer: Storage collaborator call latency.
     * <p>
     * Tags: operation
     * </p>
     */
    public static final String STORE_LATENCY = "chat.store.latency";

    /**
     * Counter: Network traffic inbound from WebSocket (bytes).
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "chat.socket.network.inbound.ws.bytes";

    /**
     * Counter: Network traffic outbound to WebSocket (bytes).
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "chat.socket.network.outbound.ws.bytes";
}
