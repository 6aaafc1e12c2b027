package com.roomrelay.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.roomrelay.dto.RoomInfo;
import com.roomrelay.exception.RoomException;
import com.roomrelay.model.ChatSession;
import com.roomrelay.model.Room;
import com.roomrelay.support.RecordingConnection;

class RoomRegistryTest {

    private final RoomRegistry registry = new RoomRegistry(new RoomSecurityService(new BCryptPasswordEncoder(4)));

    private static ChatSession memberOf(Room room, String username) {
        ChatSession session = new ChatSession(System.nanoTime(), username, room, new RecordingConnection());
        session.assignUsername(username);
        room.add(session);
        return session;
    }

    @Test
    void createThenGet() {
        Room room = registry.createRoom("r1", "", false).orElseThrow();

        assertThat(registry.getRoom("r1")).containsSame(room);
        assertThat(room.hasPassword()).isFalse();
        assertThat(room.memberCount()).isZero();
    }

    @Test
    void duplicateCreateIsConflict() {
        assertThat(registry.createRoom("r1", "", false)).isPresent();
        assertThat(registry.createRoom("r1", "other", true)).isEmpty();
    }

    @Test
    void concurrentCreateYieldsExactlyOneSuccess() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<Room>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return registry.createRoom("r1", "pw", false);
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<Optional<Room>> result : results) {
                if (result.get(10, TimeUnit.SECONDS).isPresent()) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
            assertThat(registry.getRoomCount()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void passwordRoundTrip() {
        Room room = registry.createRoom("locked", "secret", false).orElseThrow();

        assertThat(room.hasPassword()).isTrue();
        assertThat(room.getPasswordHash()).isNotEqualTo("secret");
        assertThat(registry.verifyPassword("locked", "secret")).isTrue();
        assertThat(registry.verifyPassword("locked", "wrong")).isFalse();
        assertThat(registry.verifyPassword("locked", "")).isFalse();
    }

    @Test
    void openRoomAcceptsAnyPassword() {
        registry.createRoom("open", null, false);

        assertThat(registry.verifyPassword("open", "whatever")).isTrue();
        assertThat(registry.verifyPassword("open", "")).isTrue();
    }

    @Test
    void missingRoomFailsVerification() {
        assertThat(registry.verifyPassword("nowhere", "")).isFalse();
    }

    @Test
    void hashFailureAbortsCreation() {
        PasswordEncoder failing = mock(PasswordEncoder.class);
        when(failing.encode(anyString())).thenThrow(new IllegalArgumentException("password too long"));
        RoomRegistry failingRegistry = new RoomRegistry(new RoomSecurityService(failing));

        assertThatThrownBy(() -> failingRegistry.createRoom("r1", "secret", false))
                .isInstanceOf(RoomException.class);
        assertThat(failingRegistry.getRoom("r1")).isEmpty();
        assertThat(failingRegistry.getRoomCount()).isZero();
    }

    @Test
    void removeIfEmptyOnlyRemovesEmptyRooms() {
        Room room = registry.createRoom("r1", null, false).orElseThrow();
        ChatSession member = memberOf(room, "alice");

        assertThat(registry.removeIfEmpty("r1")).isFalse();
        assertThat(registry.getRoom("r1")).isPresent();

        room.remove(member);
        assertThat(registry.removeIfEmpty("r1")).isTrue();
        assertThat(registry.getRoom("r1")).isEmpty();
        assertThat(room.isRetired()).isTrue();
    }

    @Test
    void removeIfEmptyIgnoresStaleInstance() {
        Room stale = registry.createRoom("r1", null, false).orElseThrow();
        registry.removeIfEmpty(stale);
        Room current = registry.createRoom("r1", null, false).orElseThrow();

        assertThat(registry.removeIfEmpty(stale)).isFalse();
        assertThat(registry.getRoom("r1")).containsSame(current);
    }

    @Test
    void reinstateRegistersSuccessorWhenNameIsFree() {
        Room room = registry.createRoom("r1", "secret", true).orElseThrow();
        registry.removeIfEmpty(room);

        Room successor = registry.reinstate(room).orElseThrow();

        assertThat(successor).isNotSameAs(room);
        assertThat(successor.getPasswordHash()).isEqualTo(room.getPasswordHash());
        assertThat(successor.isPrivate()).isTrue();
        assertThat(registry.getRoom("r1")).containsSame(successor);
    }

    @Test
    void reinstateRefusesPasswordProtectedReplacement() {
        Room room = registry.createRoom("r1", null, false).orElseThrow();
        registry.removeIfEmpty(room);
        registry.createRoom("r1", "secret", false);

        assertThat(registry.reinstate(room)).isEmpty();
    }

    @Test
    void reinstateJoinsOpenReplacement() {
        Room room = registry.createRoom("r1", null, false).orElseThrow();
        registry.removeIfEmpty(room);
        Room replacement = registry.createRoom("r1", null, false).orElseThrow();

        assertThat(registry.reinstate(room)).containsSame(replacement);
    }

    @Test
    void directoryListsPublicRoomsOnly() {
        Room lobby = registry.createRoom("lobby", null, false).orElseThrow();
        registry.createRoom("attic", "secret", false);
        Room hidden = registry.createRoom("hidden", null, true).orElseThrow();
        memberOf(lobby, "alice");
        memberOf(lobby, "bob");
        memberOf(hidden, "carol");

        List<RoomInfo> rooms = registry.listPublicRooms();

        assertThat(rooms).containsExactly(
                new RoomInfo("attic", true, 0),
                new RoomInfo("lobby", false, 2));
        assertThat(registry.verifyPassword("hidden", "")).isTrue();
    }
}
