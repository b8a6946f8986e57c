package com.deliium.drawingboard.web;

import com.deliium.drawingboard.config.BoardProperties;
import com.deliium.drawingboard.hub.BoardSocketHandler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;
import org.springframework.web.socket.server.support.HttpSessionHandshakeInterceptor;

/**
 * Wires the raw WebSocket push channel.
 *
 * <h3>How messages flow</h3>
 * <ol>
 *   <li>A logged-in browser opens a WebSocket to {@code /ws}. The handshake request passes the
 *       auth filter like any other protected path.</li>
 *   <li>{@link HttpSessionHandshakeInterceptor} copies the HTTP session attributes, including the
 *       user id, onto the new connection.</li>
 *   <li>Every text frame goes to {@link BoardSocketHandler}, which persists and re-broadcasts it
 *       to all connected clients.</li>
 * </ol>
 *
 * <h3>Frames</h3>
 * <table>
 *   <tr><th>Frame</th><th>Direction</th><th>Purpose</th></tr>
 *   <tr><td>{@code {"type":"stroke","stroke":{...}}}</td><td>both</td><td>new stroke; server fills in {@code id}</td></tr>
 *   <tr><td>{@code {"type":"delete","delete":N}}</td><td>both</td><td>stroke N removed</td></tr>
 *   <tr><td>ping / pong</td><td>both</td><td>liveness</td></tr>
 * </table>
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final BoardSocketHandler handler;
    private final BoardProperties properties;

    public WebSocketConfig(BoardSocketHandler handler, BoardProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws")
            .addInterceptors(new HttpSessionHandshakeInterceptor())
            .setAllowedOriginPatterns("*");
    }

    /** Frames above the configured size close the connection. */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.maxMessageBytes());
        container.setMaxBinaryMessageBufferSize(properties.maxMessageBytes());
        return container;
    }
}
