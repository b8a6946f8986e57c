package com.deliium.drawingboard.hub;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * One live push-channel peer: the WebSocket session plus its liveness state.
 *
 * <p>A connection starts {@link State#ACTIVE} and moves to {@link State#DEAD} exactly once, via
 * {@link #shutdown(CloseStatus)}. Shutting down cancels the heartbeat and read-deadline timers
 * and closes the underlying session. There is no way back to {@code ACTIVE}.
 *
 * <p>The session handed in must be safe for concurrent sends (the socket handler wraps it in a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}), since the
 * heartbeat and broadcasts from other sessions write to it from different threads.
 */
public class PeerConnection {
    private static final Logger LOGGER = LoggerFactory.getLogger(PeerConnection.class);
    private static final byte[] PING_PAYLOAD = "ping".getBytes(StandardCharsets.US_ASCII);

    public enum State { ACTIVE, DEAD }

    private final WebSocketSession session;
    private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);

    private volatile long readDeadlineMillis;
    private volatile Future<?> heartbeat;
    private volatile Future<?> readWatch;

    public PeerConnection(WebSocketSession session) {
        this.session = session;
    }

    public String id() {
        return session.getId();
    }

    /** Handshake attributes, including whatever the HTTP session carried at upgrade time. */
    public Map<String, Object> attributes() {
        return session.getAttributes();
    }

    public String remoteAddress() {
        return session.getRemoteAddress() == null ? "unknown" : session.getRemoteAddress().toString();
    }

    public State state() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == State.ACTIVE;
    }

    public void send(TextMessage message) throws IOException {
        session.sendMessage(message);
    }

    public void ping() throws IOException {
        session.sendMessage(new PingMessage(ByteBuffer.wrap(PING_PAYLOAD)));
    }

    long readDeadlineMillis() {
        return readDeadlineMillis;
    }

    void armReadDeadline(long deadlineMillis) {
        this.readDeadlineMillis = deadlineMillis;
    }

    void heartbeat(Future<?> future) {
        this.heartbeat = future;
        if (!isActive()) {
            future.cancel(false);
        }
    }

    void readWatch(Future<?> future) {
        this.readWatch = future;
        if (!isActive()) {
            future.cancel(false);
        }
    }

    /**
     * Moves the connection to {@code DEAD}, cancels its timers and closes the session.
     *
     * @return {@code true} if this call performed the transition, {@code false} if the
     *         connection was already dead
     */
    public boolean shutdown(CloseStatus status) {
        if (!state.compareAndSet(State.ACTIVE, State.DEAD)) {
            return false;
        }
        cancel(heartbeat);
        cancel(readWatch);
        if (session.isOpen()) {
            try {
                session.close(status);
            } catch (IOException e) {
                LOGGER.debug("ws close failed: id={}, reason={}", id(), e.getMessage());
            }
        }
        return true;
    }

    private static void cancel(Future<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "PeerConnection[" + id() + ", " + state.get() + "]";
    }
}
