package com.roomrelay.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ReactiveClientConnectionTest {

    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        when(session.close()).thenReturn(Mono.empty());
        when(session.textMessage(anyString())).thenAnswer(invocation -> new WebSocketMessage(
                WebSocketMessage.Type.TEXT,
                DefaultDataBufferFactory.sharedInstance.wrap(
                        invocation.getArgument(0, String.class).getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void framesAreDeliveredInOrderUntilClose() {
        ReactiveClientConnection connection = new ReactiveClientConnection(session, 16);

        assertThat(connection.send("first")).isTrue();
        assertThat(connection.send("second")).isTrue();
        connection.close();

        StepVerifier.create(connection.getOutbound().asFlux().map(WebSocketMessage::getPayloadAsText))
                .expectNext("first", "second")
                .verifyComplete();
        verify(session).close();
    }

    @Test
    void sendFailsOnClosedSession() {
        ReactiveClientConnection connection = new ReactiveClientConnection(session, 16);
        when(session.isOpen()).thenReturn(false);

        assertThat(connection.send("lost")).isFalse();
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    void sendFailsAfterClose() {
        ReactiveClientConnection connection = new ReactiveClientConnection(session, 16);
        connection.close();

        assertThat(connection.send("late")).isFalse();
    }

    @Test
    void fullBufferIsAFailedWrite() {
        ReactiveClientConnection connection = new ReactiveClientConnection(session, 4);

        int accepted = 0;
        while (accepted < 1000 && connection.send("frame " + accepted)) {
            accepted++;
        }

        assertThat(accepted).isBetween(4, 999);
    }
}
