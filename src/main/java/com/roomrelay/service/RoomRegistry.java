package com.roomrelay.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.roomrelay.dto.RoomInfo;
import com.roomrelay.model.Room;

/**
 * Owns the room name -> Room map.
 *
 * Creation and deletion take the write lock; lookups and the directory projection take
 * the read lock. Lock order is always registry before room.
 */
@Service
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    private final Map<String, Room> rooms = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final RoomSecurityService securityService;

    public RoomRegistry(RoomSecurityService securityService) {
        this.securityService = securityService;
    }

    /**
     * Create an empty room.
     * The password is hashed outside the lock; uniqueness is checked again before insert.
     *
     * @return the new room, or empty if the name is already registered
     * @throws com.roomrelay.exception.RoomException with SRV_001 if hashing fails; nothing is registered
     */
    public Optional<Room> createRoom(String name, String password, boolean isPrivate) {
        if (getRoom(name).isPresent()) {
            logger.debug("Room {} already exists", name);
            return Optional.empty();
        }

        String passwordHash = securityService.hashPassword(password);

        lock.writeLock().lock();
        try {
            if (rooms.containsKey(name)) {
                logger.debug("Room {} was created concurrently", name);
                return Optional.empty();
            }
            Room room = new Room(name, passwordHash, isPrivate);
            rooms.put(name, room);
            logger.info("🏠 Room created: {} (password: {}, private: {}, total rooms: {})",
                       name, room.hasPassword(), isPrivate, rooms.size());
            return Optional.of(room);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Get room by name
     */
    public Optional<Room> getRoom(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rooms.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True if the room has no password or the password matches; false if the room is absent
     */
    public boolean verifyPassword(String name, String password) {
        return getRoom(name)
                .map(room -> verifyPassword(room, password))
                .orElse(false);
    }

    public boolean verifyPassword(Room room, String password) {
        return securityService.verifyPassword(password, room.getPasswordHash());
    }

    /**
     * Remove the named room if it has no members
     */
    public boolean removeIfEmpty(String name) {
        return getRoom(name).map(this::removeIfEmpty).orElse(false);
    }

    /**
     * Remove this room if it is still the registered one and has no members.
     * The emptiness check and the removal happen under both locks.
     */
    public boolean removeIfEmpty(Room room) {
        lock.writeLock().lock();
        try {
            if (rooms.get(room.getName()) != room) {
                return false;
            }
            if (!room.retireIfEmpty()) {
                return false;
            }
            rooms.remove(room.getName());
            logger.info("🗑️ Room removed: {} (remaining rooms: {})", room.getName(), rooms.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Find a live room for a connection admitted to a room that was retired before it
     * could join. If the name is free, a successor with the same credentials is
     * registered. If another room took the name meanwhile, it is only usable when it has
     * no password, since the connection was never checked against it.
     */
    public Optional<Room> reinstate(Room retired) {
        lock.writeLock().lock();
        try {
            Room current = rooms.get(retired.getName());
            if (current == null) {
                Room successor = retired.successor();
                rooms.put(successor.getName(), successor);
                logger.info("♻️ Room reinstated: {}", successor.getName());
                return Optional.of(successor);
            }
            if (current == retired || !current.hasPassword()) {
                return Optional.of(current);
            }
            logger.warn("Room {} was replaced by a password-protected room", retired.getName());
            return Optional.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Point-in-time listing of public rooms, sorted by name
     */
    public List<RoomInfo> listPublicRooms() {
        lock.readLock().lock();
        try {
            List<RoomInfo> result = new ArrayList<>(rooms.size());
            for (Room room : rooms.values()) {
                if (room.isPrivate()) {
                    continue;
                }
                result.add(new RoomInfo(room.getName(), room.hasPassword(), room.memberCount()));
            }
            result.sort(Comparator.comparing(RoomInfo::name));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get all registered rooms
     */
    public List<Room> getAllRooms() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(rooms.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getRoomCount() {
        lock.readLock().lock();
        try {
            return rooms.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
