package com.deliium.drawingboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the collaborative drawing board.
 *
 * <p>Authenticated users draw strokes on a shared canvas. Every stroke is persisted for its
 * owner and relayed to every connected client over a plain WebSocket push channel; a one-shot
 * REST call classifies the caller's strokes against a small set of character shapes.
 *
 * @see com.deliium.drawingboard.web.WebSocketConfig  push-channel wiring
 * @see com.deliium.drawingboard.hub.BoardSocketHandler  per-connection session handling
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DrawingBoardServer {
    public static void main(String[] args) {
        SpringApplication.run(DrawingBoardServer.class, args);
    }
}
