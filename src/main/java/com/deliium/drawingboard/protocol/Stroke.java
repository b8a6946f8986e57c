package com.deliium.drawingboard.protocol;

import java.util.List;

/**
 * A drawn stroke as it travels over the push channel and the REST surface.
 *
 * @param id              server-assigned id, {@code 0} until the stroke has been persisted
 * @param points          drawing path; order is significant
 * @param color           display hint, opaque to the server
 * @param width           pen width in pixels
 * @param clientId        client-assigned correlation id used to reconcile the local copy
 * @param startedAtUnixMs client-local creation time
 */
public record Stroke(long id, List<Point> points, String color, int width, String clientId, long startedAtUnixMs) {

    static final String DEFAULT_COLOR = "#000000";

    public Stroke {
        points = points == null ? List.of() : List.copyOf(points);
    }

    public boolean hasPoints() {
        return !points.isEmpty();
    }

    /** Returns a copy carrying the id the store assigned. */
    public Stroke withId(long newId) {
        return new Stroke(newId, points, color, width, clientId, startedAtUnixMs);
    }

    /**
     * Fills in the fields a client may leave out: a zero start time becomes {@code nowMillis},
     * a width below one becomes one and a missing color becomes black.
     */
    public Stroke normalized(long nowMillis) {
        return new Stroke(
            id,
            points,
            color == null || color.isBlank() ? DEFAULT_COLOR : color,
            Math.max(width, 1),
            clientId,
            startedAtUnixMs == 0 ? nowMillis : startedAtUnixMs
        );
    }
}
