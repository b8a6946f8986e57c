package com.deliium.drawingboard.store;

import java.util.List;

import com.deliium.drawingboard.protocol.Point;

/**
 * Owner-scoped stroke persistence. Every operation takes the owning user's id and never touches
 * another owner's rows: deleting a stroke id that belongs to someone else is a silent no-op.
 * Failures are reported as {@link org.springframework.dao.DataAccessException}.
 */
public interface StrokeStore {

    /** Stores the stroke and all of its points atomically and returns the assigned id. */
    long saveStroke(long userId, String color, int width, long startedAtUnixMs, List<Point> points);

    /** The owner's strokes in id order, points in drawing order. */
    List<StoredStroke> listStrokes(long userId);

    void deleteStroke(long userId, long strokeId);

    void clearStrokes(long userId);
}
