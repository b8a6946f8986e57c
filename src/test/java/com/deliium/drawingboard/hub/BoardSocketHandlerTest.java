package com.deliium.drawingboard.hub;

import static com.deliium.drawingboard.hub.HubTestSupport.openSession;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import jakarta.websocket.Session;

import com.deliium.drawingboard.config.BoardProperties;
import com.deliium.drawingboard.protocol.EnvelopeCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;

class BoardSocketHandlerTest {

    private ConnectionRegistry registry;
    private LivenessSupervisor supervisor;
    private EnvelopeRouter router;
    private BoardSocketHandler handler;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(new EnvelopeCodec(new ObjectMapper()));
        supervisor = mock(LivenessSupervisor.class);
        router = mock(EnvelopeRouter.class);
        BoardProperties properties = new BoardProperties(Duration.ofSeconds(60), Duration.ofSeconds(30),
            Duration.ofSeconds(5), 1 << 20, 512 * 1024, 300, 300, "raster");
        handler = new BoardSocketHandler(registry, supervisor, router, properties);
    }

    private PeerConnection connect(WebSocketSession session) {
        handler.afterConnectionEstablished(session);
        return (PeerConnection) session.getAttributes().get(BoardSocketHandler.CONNECTION_ATTRIBUTE);
    }

    // ── lifecycle ───────────────────────────────────────────────────────────

    @Test
    void acceptedConnectionIsRegisteredAndWatched() {
        WebSocketSession session = openSession("s1");

        PeerConnection conn = connect(session);

        assertThat(conn).isNotNull();
        assertThat(conn.id()).isEqualTo("s1");
        assertThat(conn.isActive()).isTrue();
        assertThat(registry.contains(conn)).isTrue();
        verify(supervisor).watch(conn);
    }

    @Test
    void writeDeadlineIsHandedToNativeSession() {
        Map<String, Object> userProperties = new HashMap<>();
        Session nativeSession = mock(Session.class);
        when(nativeSession.getUserProperties()).thenReturn(userProperties);
        NativeWebSocketSession session = mock(NativeWebSocketSession.class);
        when(session.getId()).thenReturn("native");
        when(session.getAttributes()).thenReturn(new HashMap<>());
        when(session.getNativeSession(Session.class)).thenReturn(nativeSession);

        PeerConnection conn = connect(session);

        assertThat(userProperties).containsEntry(BoardSocketHandler.BLOCKING_SEND_TIMEOUT, 5000L);
        assertThat(registry.contains(conn)).isTrue();
    }

    @Test
    void peerCloseTerminatesWithPeerStatus() {
        WebSocketSession session = openSession("s1");
        PeerConnection conn = connect(session);

        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        verify(supervisor).terminate(conn, CloseStatus.GOING_AWAY);
    }

    @Test
    void transportErrorTerminatesConnection() {
        WebSocketSession session = openSession("s1");
        PeerConnection conn = connect(session);

        handler.handleTransportError(session, new IOException("Connection reset by peer"));

        verify(supervisor).terminate(conn, CloseStatus.SERVER_ERROR);
    }

    @Test
    void closeOfUnknownSessionIsHarmless() {
        handler.afterConnectionClosed(openSession("never-opened"), CloseStatus.NORMAL);

        verify(supervisor, never()).terminate(any(), any());
    }

    // ── inbound frames ──────────────────────────────────────────────────────

    @Test
    void textFrameTouchesAndRoutes() throws Exception {
        WebSocketSession session = openSession("s1");
        PeerConnection conn = connect(session);

        handler.handleMessage(session, new TextMessage("{\"type\":\"delete\",\"delete\":1}"));

        verify(supervisor).touch(conn);
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(router).route(eq(conn), payload.capture());
        assertThat(payload.getValue()).isEqualTo("{\"type\":\"delete\",\"delete\":1}");
    }

    @Test
    void pongOnlyTouches() throws Exception {
        WebSocketSession session = openSession("s1");
        PeerConnection conn = connect(session);

        handler.handleMessage(session, new PongMessage());

        verify(supervisor).touch(conn);
        verify(router, never()).route(any(), any());
    }

    @Test
    void framesAfterShutdownAreIgnored() throws Exception {
        WebSocketSession session = openSession("s1");
        PeerConnection conn = connect(session);
        conn.shutdown(CloseStatus.NORMAL);

        handler.handleMessage(session, new TextMessage("{\"type\":\"delete\",\"delete\":1}"));

        verify(router, never()).route(any(), any());
    }
}
