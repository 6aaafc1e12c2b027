package com.roomrelay.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.roomrelay.dto.ErrorResponse.ErrorCode;
import com.roomrelay.exception.RoomException;
import com.roomrelay.model.ChatSession;
import com.roomrelay.model.ClientConnection;
import com.roomrelay.model.Room;
import com.roomrelay.model.SessionState;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

/**
 * Single serialization point for everything that changes room membership or fans out
 * messages.
 *
 * Register, unregister and broadcast requests are queued and processed one at a time,
 * in arrival order, on the "chat-hub" thread. Each request returns a future completed
 * once the hub has processed it. A failure while processing one event fails only that
 * event's future.
 */
@Service
public class ChatHub {
    private static final Logger logger = LoggerFactory.getLogger(ChatHub.class);

    public static final String SYSTEM_PREFIX = "SYS: ";
    public static final String COUNT_PHRASE = "Users in room: ";

    private static final long STOP_TIMEOUT_MS = 5000;

    private final RoomRegistry registry;
    private final UsernameAllocator usernameAllocator;

    private final BlockingQueue<HubEvent> events = new LinkedBlockingQueue<>();
    private final AtomicLong sessionIds = new AtomicLong();

    private volatile boolean isRunning = false;
    private Thread worker;

    public ChatHub(RoomRegistry registry, UsernameAllocator usernameAllocator) {
        this.registry = registry;
        this.usernameAllocator = usernameAllocator;
    }

    @PostConstruct
    public synchronized void start() {
        if (isRunning) {
            logger.warn("Chat hub already running");
            return;
        }
        isRunning = true;
        worker = new Thread(this::run, "chat-hub");
        worker.setDaemon(true);
        worker.start();
        logger.info("✅ Chat hub started");
    }

    @PreDestroy
    public synchronized void stop() {
        if (!isRunning) {
            return;
        }
        isRunning = false;
        events.add(new Stop());
        try {
            worker.join(STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("🛑 Chat hub stopped");
    }

    public boolean isRunning() {
        return isRunning;
    }

    // ==========================================
    // PUBLIC API (any thread)
    // ==========================================

    /**
     * Create a session in CONNECTING state for a freshly upgraded connection
     */
    public ChatSession openSession(Room room, String requestedUsername, ClientConnection connection) {
        return new ChatSession(sessionIds.incrementAndGet(), requestedUsername, room, connection);
    }

    /**
     * Queue the session for joining its room.
     * Completes with the session once it is ACTIVE and its username is assigned.
     */
    public CompletableFuture<ChatSession> register(ChatSession session) {
        Register event = new Register(session, new CompletableFuture<>());
        submit(event);
        return event.completion();
    }

    /**
     * Queue the session's departure. Safe to call more than once.
     */
    public CompletableFuture<Void> unregister(ChatSession session) {
        Unregister event = new Unregister(session, new CompletableFuture<>());
        submit(event);
        return event.completion();
    }

    /**
     * Queue a chat message from {@code sender} for every member of its room.
     * Completes with the number of members the frame was written to.
     */
    public CompletableFuture<Integer> broadcast(ChatSession sender, String body) {
        Broadcast event = new Broadcast(sender, body, new CompletableFuture<>());
        submit(event);
        return event.completion();
    }

    private synchronized void submit(HubEvent event) {
        if (!isRunning) {
            reject(event, new IllegalStateException("Chat hub is not running"));
            return;
        }
        events.add(event);
    }

    // ==========================================
    // EVENT LOOP (chat-hub thread only)
    // ==========================================

    private void run() {
        while (true) {
            HubEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event instanceof Stop) {
                break;
            }
            process(event);
        }
        shutdown();
    }

    private void process(HubEvent event) {
        try {
            if (event instanceof Register register) {
                register.completion().complete(handleRegister(register.session()));
            } else if (event instanceof Unregister unregister) {
                handleUnregister(unregister.session());
                unregister.completion().complete(null);
            } else if (event instanceof Broadcast broadcast) {
                broadcast.completion().complete(handleBroadcast(broadcast.sender(), broadcast.body()));
            }
        } catch (RoomException e) {
            logger.warn("Rejected {}: {}", event.getClass().getSimpleName(), e.getMessage());
            event.completion().completeExceptionally(e);
        } catch (RuntimeException e) {
            logger.error("Error processing {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            event.completion().completeExceptionally(e);
        }
    }

    private ChatSession handleRegister(ChatSession session) {
        if (session.getState() != SessionState.CONNECTING) {
            throw new IllegalStateException("Session " + session.getId() + " is " + session.getState());
        }

        Room room = session.getRoom();
        int count = -1;
        // A room can be retired between admission and registration; retry once on its successor
        for (int attempt = 0; attempt < 2 && count < 0; attempt++) {
            if (room.isRetired()) {
                room = registry.reinstate(room).orElse(null);
                if (room == null) {
                    break;
                }
                session.bindRoom(room);
            }
            session.assignUsername(usernameAllocator.allocate(session.getRequestedUsername(), room.usernames()));
            count = room.add(session);
        }

        if (count < 0) {
            session.close();
            session.getConnection().close();
            throw new RoomException(ErrorCode.SRV_002, "room " + session.getRoom().getName() + " was replaced");
        }

        session.activate();
        logger.info("👋 {} joined room {} (session {}, members: {})",
                   session.getUsername(), room.getName(), session.getId(), count);
        fanOut(room, systemNotice(session.getUsername() + " joined", count));
        return session;
    }

    private void handleUnregister(ChatSession session) {
        SessionState previous = session.close();
        if (previous == SessionState.CLOSED) {
            return;
        }
        Room room = session.getRoom();
        int remaining = room.remove(session);
        session.getConnection().close();

        if (previous == SessionState.ACTIVE) {
            logger.info("🚪 {} left room {} (session {}, members: {})",
                       session.getUsername(), room.getName(), session.getId(), remaining);
            fanOut(room, systemNotice(session.getUsername() + " left", remaining));
        }
        if (remaining == 0) {
            registry.removeIfEmpty(room);
        }
    }

    private int handleBroadcast(ChatSession sender, String body) {
        if (!sender.isActive()) {
            logger.debug("Ignoring message from inactive session {}", sender.getId());
            return 0;
        }
        return fanOut(sender.getRoom(), "[" + sender.getUsername() + "] " + body);
    }

    /**
     * Broadcast and treat every failed write as that member's departure: it is closed,
     * the room is told it left, and an emptied room is removed.
     */
    private int fanOut(Room room, String payload) {
        Room.BroadcastResult result = room.broadcast(payload);
        Deque<ChatSession> departures = new ArrayDeque<>(result.dropped());

        while (!departures.isEmpty()) {
            ChatSession gone = departures.poll();
            if (gone.close() != SessionState.ACTIVE) {
                continue;
            }
            // Members dropped in the same pass but not yet announced still count
            int remaining = room.memberCount() + pendingDepartures(departures);
            logger.warn("⚠️ Write to {} in room {} failed, dropped (members: {})",
                       gone.getUsername(), room.getName(), remaining);
            departures.addAll(room.broadcast(systemNotice(gone.getUsername() + " left", remaining)).dropped());
            if (remaining == 0) {
                registry.removeIfEmpty(room);
            }
        }
        return result.delivered();
    }

    private static int pendingDepartures(Deque<ChatSession> departures) {
        int pending = 0;
        for (ChatSession session : departures) {
            if (session.isActive()) {
                pending++;
            }
        }
        return pending;
    }

    private void shutdown() {
        List<HubEvent> pending = new ArrayList<>();
        events.drainTo(pending);
        for (HubEvent event : pending) {
            reject(event, new IllegalStateException("Chat hub stopped"));
        }

        int closed = 0;
        for (Room room : registry.getAllRooms()) {
            for (ChatSession member : room.members()) {
                member.close();
                room.remove(member);
                member.getConnection().close();
                closed++;
            }
            registry.removeIfEmpty(room);
        }
        if (closed > 0) {
            logger.info("Closed {} sessions on shutdown", closed);
        }
    }

    private void reject(HubEvent event, RuntimeException cause) {
        if (event instanceof Register register) {
            register.session().close();
            register.session().getConnection().close();
        }
        event.completion().completeExceptionally(cause);
    }

    static String systemNotice(String what, int count) {
        return SYSTEM_PREFIX + what + ". " + COUNT_PHRASE + count;
    }

    // ==========================================
    // EVENTS
    // ==========================================

    private interface HubEvent {
        CompletableFuture<?> completion();
    }

    private record Register(ChatSession session, CompletableFuture<ChatSession> completion) implements HubEvent {}

    private record Unregister(ChatSession session, CompletableFuture<Void> completion) implements HubEvent {}

    private record Broadcast(ChatSession sender, String body, CompletableFuture<Integer> completion) implements HubEvent {}

    private record Stop() implements HubEvent {
        @Override
        public CompletableFuture<?> completion() {
            return CompletableFuture.completedFuture(null);
        }
    }
}
