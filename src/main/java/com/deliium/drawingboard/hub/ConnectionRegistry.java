package com.deliium.drawingboard.hub;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import com.deliium.drawingboard.protocol.Envelope;
import com.deliium.drawingboard.protocol.EnvelopeCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

/**
 * The shared set of live push connections used for fan-out.
 *
 * <p>A single lock guards the set. {@link #broadcast(Envelope)} holds it for the whole send
 * loop, so no connection is added or removed while a broadcast is in flight and each broadcast
 * reaches every member exactly once. A send that fails removes only the failing member; the
 * remaining members still receive the message. Per-send blocking is bounded by the session's
 * write deadline.
 */
@Component
public class ConnectionRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final EnvelopeCodec codec;
    private final ReentrantLock lock = new ReentrantLock();
    /** Guarded by {@link #lock}. */
    private final Set<PeerConnection> connections = new LinkedHashSet<>();

    public ConnectionRegistry(EnvelopeCodec codec) {
        this.codec = codec;
    }

    /** @return {@code true} if the connection was not already registered */
    public boolean register(PeerConnection connection) {
        lock.lock();
        try {
            return connections.add(connection);
        } finally {
            lock.unlock();
        }
    }

    /** Removes the connection; removing an absent connection is a no-op. */
    public boolean unregister(PeerConnection connection) {
        lock.lock();
        try {
            return connections.remove(connection);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(PeerConnection connection) {
        lock.lock();
        try {
            return connections.contains(connection);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Serializes the envelope once and sends it to every registered connection.
     *
     * @return the number of connections the message was delivered to
     */
    public int broadcast(Envelope envelope) {
        TextMessage message;
        try {
            message = new TextMessage(codec.encode(envelope));
        } catch (JsonProcessingException e) {
            LOGGER.error("Dropping unserializable envelope: type={}", envelope.type(), e);
            return 0;
        }

        int delivered = 0;
        List<PeerConnection> failed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<PeerConnection> it = connections.iterator();
            while (it.hasNext()) {
                PeerConnection connection = it.next();
                if (!connection.isActive()) {
                    it.remove();
                    continue;
                }
                try {
                    connection.send(message);
                    delivered++;
                } catch (IOException | RuntimeException e) {
                    if (TransportErrors.isBenign(e)) {
                        LOGGER.debug("ws write to closed peer: id={}", connection.id());
                    } else {
                        LOGGER.warn("ws write error: id={}, reason={}", connection.id(), e.getMessage());
                    }
                    it.remove();
                    failed.add(connection);
                }
            }
        } finally {
            lock.unlock();
        }

        for (PeerConnection connection : failed) {
            connection.shutdown(CloseStatus.SESSION_NOT_RELIABLE);
        }
        return delivered;
    }
}
