package com.deliium.drawingboard.hub;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;

import com.deliium.drawingboard.auth.IdentityResolver;
import com.deliium.drawingboard.protocol.Envelope;
import com.deliium.drawingboard.protocol.EnvelopeCodec;
import com.deliium.drawingboard.protocol.MalformedEnvelopeException;
import com.deliium.drawingboard.protocol.Stroke;
import com.deliium.drawingboard.store.StrokeStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Handles one inbound frame for a session: decode, authorize, persist, relay.
 *
 * <h3>Per envelope</h3>
 * <ul>
 *   <li><strong>stroke</strong>: when the stroke has points and the caller is known, the stroke is
 *       saved for that caller and the store's id is set on the outgoing stroke. An unknown caller's
 *       stroke is relayed unsaved with its id untouched.</li>
 *   <li><strong>delete</strong>: when the caller is known, the stroke is deleted within the caller's
 *       own strokes; a foreign id simply matches nothing. The envelope is relayed either way.</li>
 * </ul>
 * Persistence is best effort: a store failure is logged and the envelope is still broadcast,
 * exactly once. Malformed frames are logged and dropped; unknown types are ignored. Nothing here
 * closes the connection.
 */
@Component
public class EnvelopeRouter {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopeRouter.class);

    private final EnvelopeCodec codec;
    private final ConnectionRegistry registry;
    private final IdentityResolver identity;
    private final StrokeStore store;
    private final Clock clock;

    public EnvelopeRouter(EnvelopeCodec codec, ConnectionRegistry registry, IdentityResolver identity,
                          StrokeStore store, Clock clock) {
        this.codec = codec;
        this.registry = registry;
        this.identity = identity;
        this.store = store;
        this.clock = clock;
    }

    public void route(PeerConnection connection, String payload) {
        Optional<Envelope> decoded;
        try {
            decoded = codec.decode(payload);
        } catch (MalformedEnvelopeException e) {
            LOGGER.warn("ws bad envelope: id={}, reason={}", connection.id(), e.getMessage());
            return;
        }
        if (decoded.isEmpty()) {
            LOGGER.debug("ws ignoring envelope of unknown type: id={}", connection.id());
            return;
        }

        Envelope envelope = decoded.get();
        Envelope outgoing = envelope.carriesStroke()
            ? handleStroke(connection, envelope.stroke())
            : handleDelete(connection, envelope.delete());
        registry.broadcast(outgoing);
    }

    private Envelope handleStroke(PeerConnection connection, Stroke received) {
        Stroke stroke = received.normalized(clock.millis());
        if (!stroke.hasPoints()) {
            return Envelope.ofStroke(stroke);
        }
        OptionalLong userId = identity.resolve(connection.attributes());
        if (userId.isEmpty()) {
            return Envelope.ofStroke(stroke);
        }
        try {
            long id = store.saveStroke(userId.getAsLong(), stroke.color(), stroke.width(),
                stroke.startedAtUnixMs(), stroke.points());
            return Envelope.ofStroke(stroke.withId(id));
        } catch (DataAccessException e) {
            LOGGER.warn("save stroke failed: user={}, clientId={}", userId.getAsLong(), stroke.clientId(), e);
            return Envelope.ofStroke(stroke);
        }
    }

    private Envelope handleDelete(PeerConnection connection, long strokeId) {
        OptionalLong userId = identity.resolve(connection.attributes());
        if (userId.isPresent()) {
            try {
                store.deleteStroke(userId.getAsLong(), strokeId);
            } catch (DataAccessException e) {
                LOGGER.warn("delete stroke failed: user={}, stroke={}", userId.getAsLong(), strokeId, e);
            }
        }
        return Envelope.ofDelete(strokeId);
    }
}
