package com.deliium.drawingboard.hub;

import jakarta.websocket.Session;

import com.deliium.drawingboard.config.BoardProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * The push-channel session loop.
 *
 * <p>The container delivers frames for a given session one at a time, so everything a session
 * does (decode, persist, broadcast) is serialized per connection while sessions run
 * independently of each other. Each accepted connection is wrapped in a {@link PeerConnection},
 * registered for fan-out and handed to the {@link LivenessSupervisor}. Any way the connection
 * ends (peer close, transport error, read timeout, failed ping or failed broadcast send) goes
 * through {@link LivenessSupervisor#terminate}, which tears down exactly this one connection.
 */
@Component
public class BoardSocketHandler extends TextWebSocketHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(BoardSocketHandler.class);

    static final String CONNECTION_ATTRIBUTE = BoardSocketHandler.class.getName() + ".connection";
    /** Tomcat's per-session bound on a blocking send. */
    static final String BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final ConnectionRegistry registry;
    private final LivenessSupervisor supervisor;
    private final EnvelopeRouter router;
    private final int writeDeadlineMillis;
    private final int sendBufferBytes;

    public BoardSocketHandler(ConnectionRegistry registry, LivenessSupervisor supervisor, EnvelopeRouter router,
                              BoardProperties properties) {
        this.registry = registry;
        this.supervisor = supervisor;
        this.router = router;
        this.writeDeadlineMillis = (int) properties.writeDeadline().toMillis();
        this.sendBufferBytes = properties.sendBufferBytes();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        applyWriteDeadline(session);
        PeerConnection connection = new PeerConnection(
            new ConcurrentWebSocketSessionDecorator(session, writeDeadlineMillis, sendBufferBytes));
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        registry.register(connection);
        supervisor.watch(connection);
        LOGGER.info("ws connected: id={}, remote={}", connection.id(), connection.remoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PeerConnection connection = connectionOf(session);
        if (connection == null || !connection.isActive()) {
            return;
        }
        supervisor.touch(connection);
        router.route(connection, message.getPayload());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        PeerConnection connection = connectionOf(session);
        if (connection != null) {
            supervisor.touch(connection);
        }
    }

    /** Binary frames count as activity but carry nothing for us. */
    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        PeerConnection connection = connectionOf(session);
        if (connection != null) {
            supervisor.touch(connection);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        PeerConnection connection = connectionOf(session);
        if (TransportErrors.isBenign(exception)) {
            LOGGER.debug("ws transport closed: id={}", session.getId());
        } else {
            LOGGER.warn("ws read error: id={}, reason={}", session.getId(), exception.getMessage());
        }
        if (connection != null) {
            supervisor.terminate(connection, CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        PeerConnection connection = connectionOf(session);
        if (connection != null) {
            supervisor.terminate(connection, status);
        }
        if (TransportErrors.isBenign(status)) {
            LOGGER.info("ws disconnected: id={}", session.getId());
        } else {
            LOGGER.info("ws disconnected: id={}, status={}", session.getId(), status);
        }
    }

    private static PeerConnection connectionOf(WebSocketSession session) {
        return (PeerConnection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
    }

    private void applyWriteDeadline(WebSocketSession session) {
        if (session instanceof NativeWebSocketSession) {
            Session nativeSession = ((NativeWebSocketSession) session).getNativeSession(Session.class);
            if (nativeSession != null) {
                nativeSession.getUserProperties().put(BLOCKING_SEND_TIMEOUT, (long) writeDeadlineMillis);
            }
        }
    }
}
