package com.deliium.drawingboard.protocol;

/** Raised when an inbound frame is not a well-formed {@link Envelope}. */
public class MalformedEnvelopeException extends RuntimeException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
