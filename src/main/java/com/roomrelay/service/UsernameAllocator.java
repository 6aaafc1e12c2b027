package com.roomrelay.service;

import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

/**
 * Picks display names that are unique within a room.
 */
@Component
public class UsernameAllocator {

    static final int MAX_NUMERIC_SUFFIX = 100;
    static final String GUEST_PREFIX = "Guest";

    private final AtomicLong guestCounter = new AtomicLong();

    /**
     * Name for a connection that did not ask for one
     */
    public String guestName() {
        return GUEST_PREFIX + guestCounter.incrementAndGet();
    }

    /**
     * Return {@code requested} if unused, else the first unused of requested1..requested100,
     * else requested followed by a nanosecond-clock hex token.
     */
    public String allocate(String requested, Set<String> taken) {
        if (!taken.contains(requested)) {
            return requested;
        }
        for (int i = 1; i <= MAX_NUMERIC_SUFFIX; i++) {
            String candidate = requested + i;
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
        return requested + Long.toHexString(System.nanoTime());
    }
}
