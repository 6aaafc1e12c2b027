package com.roomrelay.dto;

import com.roomrelay.model.Room;

/**
 * Result of a successful handshake admission: the room the connection may join and
 * the username it asked for (already defaulted to a guest name when empty).
 *
 * @param createdRoom true if admitting this connection created the room
 */
public record Admission(Room room, String requestedUsername, boolean createdRoom) {
}
