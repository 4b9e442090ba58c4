package com.qqsuccubus.chat.socket.registry;

/**
 * Lifecycle of a {@link Connection}: {@code OPEN -> CLOSING -> CLOSED}. Transitions only move forward.
 */
public enum ConnectionState {
    /**
     * Accepting inbound frames and outbound sends.
     */
    OPEN,
    /**
     * Close initiated by the peer, by eviction or by drain; sends fail fast.
     */
    CLOSING,
    /**
     * Transport disposed. Terminal.
     */
    CLOSED
}
