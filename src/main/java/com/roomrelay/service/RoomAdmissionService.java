package com.roomrelay.service;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.roomrelay.config.RelayProperties;
import com.roomrelay.dto.Admission;
import com.roomrelay.dto.ConnectRequest;
import com.roomrelay.dto.ErrorResponse.ErrorCode;
import com.roomrelay.exception.RoomException;
import com.roomrelay.model.Room;
import com.roomrelay.validation.InputValidator;

/**
 * Decides, before the WebSocket upgrade, which room a connection may enter.
 *
 * - action=create: creates the room, conflict if the name is taken
 * - any other action: joins the room, creating a public room without password if missing;
 *   an existing room must accept the password
 *
 * Password hashing makes this blocking; call it off the event loop.
 */
@Service
public class RoomAdmissionService {
    private static final Logger logger = LoggerFactory.getLogger(RoomAdmissionService.class);

    private final RoomRegistry registry;
    private final UsernameAllocator usernameAllocator;
    private final InputValidator validator;
    private final RelayProperties properties;

    public RoomAdmissionService(RoomRegistry registry,
                                UsernameAllocator usernameAllocator,
                                InputValidator validator,
                                RelayProperties properties) {
        this.registry = registry;
        this.usernameAllocator = usernameAllocator;
        this.validator = validator;
        this.properties = properties;
    }

    /**
     * @throws RoomException ROOM_002 on create conflict, ROOM_003 on a bad password,
     *         VAL_003/VAL_004/ROOM_008 on invalid input, SRV_001 if hashing fails
     */
    public Admission admit(ConnectRequest request) {
        validator.validateRoomName(request.room());
        validator.validateUsername(request.username());

        String roomName = isEmpty(request.room()) ? properties.getDefaultRoom() : request.room();
        String username = isEmpty(request.username()) ? usernameAllocator.guestName() : request.username();

        if (request.isCreate()) {
            validator.validateRoomPassword(request.password());
            Room room = registry.createRoom(roomName, request.password(), request.privateRoom())
                    .orElseThrow(() -> new RoomException(ErrorCode.ROOM_002, roomName));
            return new Admission(room, username, true);
        }

        Room room = registry.getRoom(roomName).orElse(null);
        if (room == null) {
            Optional<Room> created = registry.createRoom(roomName, null, false);
            if (created.isPresent()) {
                logger.debug("Room {} created implicitly by {}", roomName, username);
                return new Admission(created.get(), username, true);
            }
            // Lost a race with another creator; join whatever is registered now
            room = registry.getRoom(roomName)
                    .orElseThrow(() -> new RoomException(ErrorCode.SRV_002, "room " + roomName + " is being replaced"));
        }

        // A room without a password admits whatever was sent
        if (room.hasPassword()) {
            validator.validateRoomPassword(request.password());
        }
        if (!registry.verifyPassword(room, request.password())) {
            logger.debug("Wrong password for room {} from {}", roomName, username);
            throw new RoomException(ErrorCode.ROOM_003, roomName);
        }
        return new Admission(room, username, false);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
