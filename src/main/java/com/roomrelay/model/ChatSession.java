package com.roomrelay.model;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One connection's identity inside a room.
 *
 * Created in CONNECTING when the WebSocket is upgraded, moved to ACTIVE by the hub once
 * the member is added to its room, and closed exactly once. A session is never reused.
 */
public class ChatSession {
    private final long id;
    private final String requestedUsername;
    private final ClientConnection connection;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);

    private volatile Room room;
    private volatile String username;

    public ChatSession(long id, String requestedUsername, Room room, ClientConnection connection) {
        this.id = id;
        this.requestedUsername = requestedUsername;
        this.room = room;
        this.connection = connection;
    }

    /**
     * Move CONNECTING -> ACTIVE.
     * @return false if the session already left CONNECTING
     */
    public boolean activate() {
        return state.compareAndSet(SessionState.CONNECTING, SessionState.ACTIVE);
    }

    /**
     * Move to CLOSED.
     * @return the state before closing; CLOSED means this call changed nothing
     */
    public SessionState close() {
        return state.getAndSet(SessionState.CLOSED);
    }

    public boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    public SessionState getState() {
        return state.get();
    }

    /**
     * Rebind to the replacement of a room that was retired before this session joined it
     */
    public void bindRoom(Room room) {
        this.room = room;
    }

    public void assignUsername(String username) {
        this.username = username;
    }

    // Getters
    public long getId() {
        return id;
    }

    public String getRequestedUsername() {
        return requestedUsername;
    }

    public String getUsername() {
        return username;
    }

    public Room getRoom() {
        return room;
    }

    public ClientConnection getConnection() {
        return connection;
    }

    @Override
    public String toString() {
        return "ChatSession{id=" + id + ", username=" + username + ", room=" +
                (room != null ? room.getName() : null) + ", state=" + state.get() + "}";
    }
}
