package com.deliium.drawingboard.hub;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.deliium.drawingboard.config.BoardProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/**
 * Keeps track of whether each peer is still there.
 *
 * <p>Two timers run per connection:
 * <ul>
 *   <li>a read deadline, armed on {@link #watch} and pushed forward by {@link #touch} whenever
 *       anything arrives from the peer (text frames and pongs alike); if it lapses the peer is
 *       dead;</li>
 *   <li>a heartbeat that pings the peer every interval; a failed ping kills the connection right
 *       away instead of waiting for the read deadline.</li>
 * </ul>
 * {@link #terminate} is the single way out: it removes the connection from the registry and shuts
 * it down, which cancels both timers. It is safe to call any number of times from any thread.
 */
@Component
public class LivenessSupervisor {
    private static final Logger LOGGER = LoggerFactory.getLogger(LivenessSupervisor.class);

    private final ScheduledExecutorService scheduler;
    private final ConnectionRegistry registry;
    private final Clock clock;
    private final long readTimeoutMillis;
    private final long heartbeatIntervalMillis;

    @Autowired
    public LivenessSupervisor(ScheduledExecutorService livenessScheduler, ConnectionRegistry registry,
                              Clock clock, BoardProperties properties) {
        this(livenessScheduler, registry, clock, properties.readTimeout(), properties.heartbeatInterval());
    }

    LivenessSupervisor(ScheduledExecutorService scheduler, ConnectionRegistry registry, Clock clock,
                       Duration readTimeout, Duration heartbeatInterval) {
        this.scheduler = scheduler;
        this.registry = registry;
        this.clock = clock;
        this.readTimeoutMillis = readTimeout.toMillis();
        this.heartbeatIntervalMillis = heartbeatInterval.toMillis();
    }

    /** Arms the read deadline and starts the heartbeat for a freshly registered connection. */
    public void watch(PeerConnection connection) {
        connection.armReadDeadline(clock.millis() + readTimeoutMillis);
        scheduleReadCheck(connection, readTimeoutMillis);
        connection.heartbeat(scheduler.scheduleAtFixedRate(
            () -> ping(connection), heartbeatIntervalMillis, heartbeatIntervalMillis, TimeUnit.MILLISECONDS));
    }

    /** Records inbound activity, pushing the read deadline forward. */
    public void touch(PeerConnection connection) {
        connection.armReadDeadline(clock.millis() + readTimeoutMillis);
    }

    /**
     * Moves the connection to DEAD: unregisters it and closes it.
     *
     * @return {@code true} if this call did the teardown
     */
    public boolean terminate(PeerConnection connection, CloseStatus status) {
        registry.unregister(connection);
        return connection.shutdown(status);
    }

    private void scheduleReadCheck(PeerConnection connection, long delayMillis) {
        connection.readWatch(scheduler.schedule(
            () -> checkReadDeadline(connection), delayMillis, TimeUnit.MILLISECONDS));
    }

    /** Kills the connection if its read deadline has passed, otherwise checks again when it would. */
    void checkReadDeadline(PeerConnection connection) {
        if (!connection.isActive()) {
            return;
        }
        long remaining = connection.readDeadlineMillis() - clock.millis();
        if (remaining > 0) {
            scheduleReadCheck(connection, remaining);
            return;
        }
        LOGGER.info("ws read timeout: id={}", connection.id());
        terminate(connection, CloseStatus.SESSION_NOT_RELIABLE);
    }

    private void ping(PeerConnection connection) {
        if (!connection.isActive()) {
            return;
        }
        try {
            connection.ping();
        } catch (IOException | RuntimeException e) {
            if (TransportErrors.isBenign(e)) {
                LOGGER.debug("ws ping to closed peer: id={}", connection.id());
            } else {
                LOGGER.warn("ws ping write error: id={}, reason={}", connection.id(), e.getMessage());
            }
            terminate(connection, CloseStatus.SESSION_NOT_RELIABLE);
        }
    }
}
