package com.deliium.drawingboard.store;

import java.time.Instant;
import java.util.List;

import com.deliium.drawingboard.protocol.Point;
import com.deliium.drawingboard.protocol.Stroke;

/** A persisted stroke row together with its points, in drawing order. */
public record StoredStroke(long id, long userId, String color, int width, long startedAtUnixMs,
                           List<Point> points, Instant createdAt) {

    public StoredStroke {
        points = List.copyOf(points);
    }

    /** Wire form; the client correlation id is not stored and comes back empty. */
    public Stroke toWire() {
        return new Stroke(id, points, color, width, "", startedAtUnixMs);
    }
}
