package com.roomrelay.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.roomrelay.config.RelayProperties;
import com.roomrelay.dto.Admission;
import com.roomrelay.model.ChatSession;
import com.roomrelay.service.ChatHub;
import com.roomrelay.service.RoomRegistry;

import reactor.core.publisher.Mono;

/**
 * Reactive WebSocket handler for room chat.
 *
 * Each connection arrives already admitted to a room: {@link RoomHandshakeWebSocketService}
 * calls {@link #handle(WebSocketSession, Admission)} with the admission it granted.
 * The handler:
 * - registers the session with the hub
 * - turns every inbound frame into a hub broadcast
 * - unregisters the session when the inbound stream ends, whatever the reason
 */
@Component
public class ChatRelayHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ChatRelayHandler.class);

    private final ChatHub hub;
    private final RoomRegistry registry;
    private final RelayProperties properties;

    public ChatRelayHandler(ChatHub hub, RoomRegistry registry, RelayProperties properties) {
        this.hub = hub;
        this.registry = registry;
        this.properties = properties;
    }

    /**
     * Reached only if the connection bypassed room admission
     */
    @Override
    public Mono<Void> handle(WebSocketSession session) {
        logger.warn("❌ Connection {} arrived without admission, closing", session.getId());
        return session.close(CloseStatus.POLICY_VIOLATION);
    }

    /**
     * Run an admitted connection until either side closes it
     */
    public Mono<Void> handle(WebSocketSession session, Admission admission) {
        ReactiveClientConnection connection =
                new ReactiveClientConnection(session, properties.getWebsocket().getOutboundBufferSize());
        ChatSession chatSession = hub.openSession(admission.room(), admission.requestedUsername(), connection);
        logger.info("🔌 New WebSocket connection: {} for room {}", session.getId(), admission.room().getName());

        hub.register(chatSession).whenComplete((registered, error) -> {
            if (error != null) {
                logger.warn("Registration of session {} failed: {}", chatSession.getId(), error.getMessage());
                if (admission.createdRoom()) {
                    registry.removeIfEmpty(admission.room());
                }
            }
        });

        // Handle incoming messages
        Mono<Void> input = session.receive()
            .filter(message -> message.getType() == WebSocketMessage.Type.TEXT
                    || message.getType() == WebSocketMessage.Type.BINARY)
            .map(WebSocketMessage::getPayloadAsText)
            .doOnNext(text -> hub.broadcast(chatSession, text))
            .onErrorResume(error -> {
                logger.debug("Read error on session {}: {}", session.getId(), error.getMessage());
                return Mono.empty();
            })
            .doFinally(signalType -> hub.unregister(chatSession))
            .then();

        // Send outbound messages
        Mono<Void> output = session.send(connection.getOutbound().asFlux());

        return Mono.zip(input, output).then();
    }
}
