package com.roomrelay.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import com.roomrelay.dto.ErrorResponse.ErrorCode;
import com.roomrelay.exception.RoomException;

import java.nio.charset.StandardCharsets;

/**
 * Service for room-level security operations.
 * Handles room password hashing and verification, and directory token checks.
 */
@Service
public class RoomSecurityService {

    private static final Logger log = LoggerFactory.getLogger(RoomSecurityService.class);

    private final PasswordEncoder passwordEncoder;

    public RoomSecurityService(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Hash a room password.
     * @return the hash, or null when the password is empty (room without password)
     * @throws RoomException with SRV_001 if the encoder fails
     */
    public String hashPassword(String password) {
        if (password == null || password.isEmpty()) {
            return null;
        }
        try {
            return passwordEncoder.encode(password);
        } catch (RuntimeException e) {
            log.error("Failed to hash room password: {}", e.getMessage());
            throw new RoomException(ErrorCode.SRV_001, "password hashing failed", e);
        }
    }

    /**
     * Verify a password against a stored hash.
     * A room without a hash accepts any password.
     */
    public boolean verifyPassword(String inputPassword, String storedHash) {
        if (storedHash == null || storedHash.isEmpty()) {
            return true;
        }
        if (inputPassword == null || inputPassword.isEmpty()) {
            return false;
        }
        try {
            return passwordEncoder.matches(inputPassword, storedHash);
        } catch (RuntimeException e) {
            log.warn("Room password check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Compare a supplied access token with the expected one in constant time.
     */
    public boolean tokenMatches(String supplied, String expected) {
        if (supplied == null || supplied.isEmpty() || expected == null) {
            return false;
        }
        return timingSafeEquals(supplied, expected);
    }

    /**
     * Timing-safe string comparison to prevent timing attacks.
     */
    private boolean timingSafeEquals(String a, String b) {
        byte[] aBytes = a.getBytes(StandardCharsets.UTF_8);
        byte[] bBytes = b.getBytes(StandardCharsets.UTF_8);

        if (aBytes.length != bBytes.length) {
            return false;
        }

        int result = 0;
        for (int i = 0; i < aBytes.length; i++) {
            result |= aBytes[i] ^ bBytes[i];
        }
        return result == 0;
    }
}
