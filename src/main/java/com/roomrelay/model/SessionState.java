package com.roomrelay.model;

/**
 * Lifecycle of a {@link ChatSession}. CLOSED is terminal.
 */
public enum SessionState {
    CONNECTING,
    ACTIVE,
    CLOSED
}
