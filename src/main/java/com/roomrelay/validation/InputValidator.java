package com.roomrelay.validation;

import com.roomrelay.dto.ErrorResponse.ErrorCode;
import com.roomrelay.exception.RoomException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Centralized input validation for handshake parameters.
 * Names may be any length but must be printable; a room password is only limited
 * where it is hashed or checked against a hash.
 */
@Component
public class InputValidator {

    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");

    // BCrypt only uses the first 72 bytes of its input
    private static final int MAX_PASSWORD_BYTES = 72;

    /**
     * Validate room name (empty is allowed; it selects the default room).
     */
    public void validateRoomName(String roomName) {
        if (roomName == null || roomName.isEmpty()) {
            return;
        }

        if (CONTROL_CHARS.matcher(roomName).find()) {
            throw new RoomException(ErrorCode.ROOM_008, "Room name contains control characters");
        }
    }

    /**
     * Validate username (empty is allowed; a guest name is generated).
     */
    public void validateUsername(String username) {
        if (username == null || username.isEmpty()) {
            return;
        }

        if (CONTROL_CHARS.matcher(username).find()) {
            throw new RoomException(ErrorCode.VAL_004, "Username contains control characters");
        }
    }

    /**
     * Validate a room password that is about to be hashed or matched against a hash.
     */
    public void validateRoomPassword(String password) {
        if (password != null && password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            throw new RoomException(ErrorCode.VAL_003, "Password exceeds maximum length of " + MAX_PASSWORD_BYTES + " bytes");
        }
    }
}
