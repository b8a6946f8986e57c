package com.deliium.drawingboard.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Host-supplied settings for the push hub and the recognizer, bound from {@code drawingboard.*}.
 *
 * @param readTimeout       a connection with no inbound traffic for this long is considered dead
 * @param heartbeatInterval period of the server's heartbeat ping
 * @param writeDeadline     a single send that takes longer than this counts as a failed send
 * @param maxMessageBytes   largest inbound text frame accepted
 * @param sendBufferBytes   per-connection outbound buffer before a slow peer is dropped
 * @param rasterWidth       default classification raster width
 * @param rasterHeight      default classification raster height
 * @param recognizer        {@code raster} or {@code direction}
 */
@ConfigurationProperties("drawingboard")
public record BoardProperties(
    @DefaultValue("60s") Duration readTimeout,
    @DefaultValue("30s") Duration heartbeatInterval,
    @DefaultValue("5s") Duration writeDeadline,
    @DefaultValue("1048576") int maxMessageBytes,
    @DefaultValue("524288") int sendBufferBytes,
    @DefaultValue("300") int rasterWidth,
    @DefaultValue("300") int rasterHeight,
    @DefaultValue("raster") String recognizer
) {}
