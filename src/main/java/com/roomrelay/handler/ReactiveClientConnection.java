package com.roomrelay.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.roomrelay.model.ClientConnection;

import reactor.core.publisher.Sinks;

/**
 * {@link ClientConnection} over a WebFlux WebSocket session.
 * Frames go into a bounded sink that the session's outbound stream drains, so a write
 * never blocks; a full, cancelled or completed sink is a failed write.
 */
public class ReactiveClientConnection implements ClientConnection {
    private static final Logger logger = LoggerFactory.getLogger(ReactiveClientConnection.class);

    private final WebSocketSession session;
    private final Sinks.Many<WebSocketMessage> outbound;

    public ReactiveClientConnection(WebSocketSession session, int bufferSize) {
        this.session = session;
        this.outbound = Sinks.many().multicast().onBackpressureBuffer(bufferSize);
    }

    /**
     * Stream of frames for {@code session.send(...)}
     */
    public Sinks.Many<WebSocketMessage> getOutbound() {
        return outbound;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean send(String frame) {
        if (!session.isOpen()) {
            return false;
        }
        Sinks.EmitResult result = outbound.tryEmitNext(session.textMessage(frame));
        if (result.isFailure()) {
            logger.debug("Failed to emit to session {}: {}", session.getId(), result);
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        outbound.tryEmitComplete();
        session.close().subscribe(
                null,
                error -> logger.debug("Error closing session {}: {}", session.getId(), error.getMessage()));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
