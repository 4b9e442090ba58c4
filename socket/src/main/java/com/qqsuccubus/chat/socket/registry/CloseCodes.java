package com.qqsuccubus.chat.socket.registry;

/**
 * WebSocket close status codes used by the chat node.
 */
public final class CloseCodes {
    private CloseCodes() {
    }

    public static final int NORMAL = 1000;

    /**
     * Node shutting down or draining; clients should reconnect.
     */
    public static final int GOING_AWAY = 1001;

    /**
     * The outbound channel broke while sending.
     */
    public static final int INTERNAL_ERROR = 1011;

    /**
     * The same user opened a newer connection.
     */
    public static final int SUPERSEDED = 4001;

    /**
     * Outbound buffer overflowed; the client is not reading fast enough.
     */
    public static final int SLOW_CONSUMER = 4002;
}
