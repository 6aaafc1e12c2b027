package com.roomrelay.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.server.RequestUpgradeStrategy;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.server.ServerWebExchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomrelay.dto.Admission;
import com.roomrelay.dto.ConnectRequest;
import com.roomrelay.dto.ErrorResponse;
import com.roomrelay.exception.RoomException;
import com.roomrelay.service.RoomAdmissionService;
import com.roomrelay.service.RoomRegistry;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Handshake service that admits the connection to a room before upgrading.
 *
 * Rejected handshakes never reach the WebSocket handler: the HTTP response carries
 * 409 (room exists), 401 (wrong password), 400 (invalid input) or 500 with an
 * {@link ErrorResponse} body. An accepted connection is handed to
 * {@link ChatRelayHandler#handle(WebSocketSession, Admission)} together with its admission.
 */
public class RoomHandshakeWebSocketService extends HandshakeWebSocketService {

    private static final Logger logger = LoggerFactory.getLogger(RoomHandshakeWebSocketService.class);

    private final ChatRelayHandler chatRelayHandler;
    private final RoomAdmissionService admissionService;
    private final RoomRegistry registry;
    private final ObjectMapper objectMapper;

    public RoomHandshakeWebSocketService(RequestUpgradeStrategy upgradeStrategy,
                                         ChatRelayHandler chatRelayHandler,
                                         RoomAdmissionService admissionService,
                                         RoomRegistry registry,
                                         ObjectMapper objectMapper) {
        super(upgradeStrategy);
        this.chatRelayHandler = chatRelayHandler;
        this.admissionService = admissionService;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handleRequest(ServerWebExchange exchange, WebSocketHandler handler) {
        ConnectRequest request = ConnectRequest.fromQueryParams(exchange.getRequest().getQueryParams());

        // Admission may hash a password, keep it off the event loop
        return Mono.fromCallable(() -> admissionService.admit(request))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(admission -> upgrade(exchange, handler, admission))
                .onErrorResume(RoomException.class, e -> reject(exchange, e));
    }

    private Mono<Void> upgrade(ServerWebExchange exchange, WebSocketHandler handler, Admission admission) {
        // Only the chat handler knows what to do with an admission
        WebSocketHandler target = handler == chatRelayHandler
                ? session -> chatRelayHandler.handle(session, admission)
                : handler;
        return super.handleRequest(exchange, target)
                .doOnError(error -> {
                    logger.debug("Upgrade failed for room {}: {}", admission.room().getName(), error.getMessage());
                    if (admission.createdRoom()) {
                        registry.removeIfEmpty(admission.room());
                    }
                });
    }

    private Mono<Void> reject(ServerWebExchange exchange, RoomException e) {
        HttpStatus status = switch (e.getErrorCode()) {
            case ROOM_002 -> HttpStatus.CONFLICT;
            case ROOM_003 -> HttpStatus.UNAUTHORIZED;
            case SRV_001 -> HttpStatus.INTERNAL_SERVER_ERROR;
            case SRV_002 -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_REQUEST;
        };
        logger.warn("❌ Handshake rejected with {} ({}): {}", status.value(), e.getCode(), e.getMessage());

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);

        ErrorResponse body = ErrorResponse.of(e.getErrorCode(), e.getDetails());
        body.setPath(exchange.getRequest().getPath().value());
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException jsonError) {
            logger.error("Failed to serialize error response: {}", jsonError.getMessage());
            return response.setComplete();
        }
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }
}
