package com.deliium.drawingboard.hub;

import java.io.EOFException;
import java.net.SocketException;
import java.nio.channels.ClosedChannelException;

import org.springframework.web.socket.CloseStatus;

/** Classifies transport failures that are just a peer going away. */
final class TransportErrors {

    private TransportErrors() {
    }

    /** Normal closure and going-away are ordinary disconnects. */
    static boolean isBenign(CloseStatus status) {
        return status == null
            || status.getCode() == CloseStatus.NORMAL.getCode()
            || status.getCode() == CloseStatus.GOING_AWAY.getCode();
    }

    /** Resets, broken pipes, EOFs and writes to an already closed channel anywhere in the cause chain. */
    static boolean isBenign(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketException || t instanceof EOFException || t instanceof ClosedChannelException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && (message.contains("Connection reset")
                    || message.contains("Broken pipe")
                    || message.contains("closed"))) {
                return true;
            }
        }
        return false;
    }
}
