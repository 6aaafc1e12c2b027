package com.roomrelay.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named chat room: its members, an optional password hash and a privacy flag.
 *
 * Membership changes take the write lock; broadcast, listing and username snapshots
 * take the read lock so they can run side by side.
 */
public class Room {
    private static final Logger logger = LoggerFactory.getLogger(Room.class);

    private final String name;
    private final String passwordHash;
    private final boolean privateRoom;

    // Connection ID -> session
    private final Map<String, ChatSession> members = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock. A retired room has been removed from the registry.
    private boolean retired;

    public Room(String name, String passwordHash, boolean privateRoom) {
        this.name = name;
        this.passwordHash = passwordHash;
        this.privateRoom = privateRoom;
    }

    /**
     * Add a member
     * @return the new member count, or -1 if the room is retired
     */
    public int add(ChatSession session) {
        lock.writeLock().lock();
        try {
            if (retired) {
                return -1;
            }
            members.put(session.getConnection().getId(), session);
            return members.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a member if present
     * @return the member count after removal
     */
    public int remove(ChatSession session) {
        lock.writeLock().lock();
        try {
            members.remove(session.getConnection().getId(), session);
            return members.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Write a frame to every member. Members whose write fails are removed and their
     * connections closed before this method returns.
     */
    public BroadcastResult broadcast(String payload) {
        List<ChatSession> failed = new ArrayList<>();
        int delivered = 0;

        lock.readLock().lock();
        try {
            for (ChatSession member : members.values()) {
                if (member.getConnection().send(payload)) {
                    delivered++;
                } else {
                    failed.add(member);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (!failed.isEmpty()) {
            lock.writeLock().lock();
            try {
                for (ChatSession member : failed) {
                    members.remove(member.getConnection().getId(), member);
                }
            } finally {
                lock.writeLock().unlock();
            }
            for (ChatSession member : failed) {
                logger.debug("Dropping member {} from room {} after failed write", member.getId(), name);
                member.getConnection().close();
            }
        }

        return new BroadcastResult(delivered, failed);
    }

    /**
     * Snapshot of the usernames currently in use
     */
    public Set<String> usernames() {
        lock.readLock().lock();
        try {
            Set<String> names = new HashSet<>();
            for (ChatSession member : members.values()) {
                names.add(member.getUsername());
            }
            return names;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of the current members
     */
    public List<ChatSession> members() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(members.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int memberCount() {
        lock.readLock().lock();
        try {
            return members.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Mark the room retired if it has no members. Called by the registry while it holds
     * its own write lock, so emptiness and removal are decided together.
     */
    public boolean retireIfEmpty() {
        lock.writeLock().lock();
        try {
            if (!members.isEmpty()) {
                return false;
            }
            retired = true;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isRetired() {
        lock.readLock().lock();
        try {
            return retired;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A fresh, empty room with the same name, password hash and visibility
     */
    public Room successor() {
        return new Room(name, passwordHash, privateRoom);
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isEmpty();
    }

    // Getters
    public String getName() {
        return name;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public boolean isPrivate() {
        return privateRoom;
    }

    /**
     * Outcome of one broadcast pass
     */
    public record BroadcastResult(int delivered, List<ChatSession> dropped) {
        public BroadcastResult {
            dropped = Collections.unmodifiableList(dropped);
        }
    }
}
