package com.roomrelay.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomrelay.handler.ChatRelayHandler;
import com.roomrelay.handler.RoomHandshakeWebSocketService;
import com.roomrelay.service.RoomAdmissionService;
import com.roomrelay.service.RoomRegistry;

/**
 * WebFlux WebSocket Configuration
 * Uses Netty for non-blocking WebSocket handling
 */
@Configuration
public class WebFluxWebSocketConfig {

    private final ChatRelayHandler chatRelayHandler;
    private final RelayProperties properties;

    public WebFluxWebSocketConfig(ChatRelayHandler chatRelayHandler, RelayProperties properties) {
        this.chatRelayHandler = chatRelayHandler;
        this.properties = properties;
    }

    /**
     * Map WebSocket handlers to URL paths
     */
    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        Map<String, WebSocketHandler> map = new HashMap<>();
        map.put(properties.getWebsocket().getPath(), chatRelayHandler);

        SimpleUrlHandlerMapping handlerMapping = new SimpleUrlHandlerMapping();
        handlerMapping.setOrder(Ordered.HIGHEST_PRECEDENCE);
        handlerMapping.setUrlMap(map);
        return handlerMapping;
    }

    /**
     * WebSocket handler adapter using the room-admitting handshake service.
     * Ordered ahead of the default adapter WebFlux registers.
     */
    @Bean
    public WebSocketHandlerAdapter handlerAdapter(WebSocketService webSocketService) {
        WebSocketHandlerAdapter adapter = new WebSocketHandlerAdapter(webSocketService);
        adapter.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return adapter;
    }

    /**
     * Handshake service with Netty-specific settings: max frame size from configuration
     */
    @Bean
    public WebSocketService webSocketService(RoomAdmissionService admissionService,
                                             RoomRegistry registry,
                                             ObjectMapper objectMapper) {
        int maxFramePayloadLength = properties.getWebsocket().getMaxFramePayloadLength();
        ReactorNettyRequestUpgradeStrategy strategy = new ReactorNettyRequestUpgradeStrategy(
            () -> reactor.netty.http.server.WebsocketServerSpec.builder()
                .maxFramePayloadLength(maxFramePayloadLength)
        );
        return new RoomHandshakeWebSocketService(strategy, chatRelayHandler, admissionService, registry, objectMapper);
    }
}
