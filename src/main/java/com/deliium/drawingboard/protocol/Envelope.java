package com.deliium.drawingboard.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single push-channel message. Exactly one of {@code stroke} / {@code delete} is populated,
 * and {@code type} says which.
 *
 * <pre>
 * {"type":"stroke","stroke":{"id":0,"points":[{"x":10,"y":20}],"color":"#1d4ed8","width":4,"clientId":"abc123","startedAtUnixMs":1690000000000}}
 * {"type":"delete","delete":123}
 * </pre>
 *
 * Instances are only created through {@link #ofStroke(Stroke)}, {@link #ofDelete(long)} or
 * {@link EnvelopeCodec#decode(String)}, so the tag and the payload always agree.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(String type, Stroke stroke, Long delete) {

    public static final String STROKE = "stroke";
    public static final String DELETE = "delete";

    public static Envelope ofStroke(Stroke stroke) {
        if (stroke == null) {
            throw new IllegalArgumentException("stroke envelope requires a stroke");
        }
        return new Envelope(STROKE, stroke, null);
    }

    public static Envelope ofDelete(long strokeId) {
        return new Envelope(DELETE, null, strokeId);
    }

    public boolean carriesStroke() {
        return STROKE.equals(type);
    }

    public boolean carriesDelete() {
        return DELETE.equals(type);
    }
}
