package com.deliium.drawingboard.config;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import com.deliium.drawingboard.recognize.DirectionRecognizer;
import com.deliium.drawingboard.recognize.RasterRecognizer;
import com.deliium.drawingboard.recognize.Recognizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/** Shared infrastructure beans. */
@Configuration
public class BoardConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(BoardConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs heartbeats and read-deadline checks for every push connection. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService livenessScheduler() {
        CustomizableThreadFactory threads = new CustomizableThreadFactory("liveness-");
        threads.setDaemon(true);
        return Executors.newScheduledThreadPool(2, threads);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public Recognizer recognizer(BoardProperties properties) {
        String kind = properties.recognizer() == null ? "raster" : properties.recognizer().trim().toLowerCase(Locale.ROOT);
        switch (kind) {
            case "direction":
                LOGGER.info("Using direction recognizer");
                return new DirectionRecognizer();
            case "raster":
                LOGGER.info("Using raster recognizer");
                return new RasterRecognizer();
            default:
                throw new IllegalStateException("Unknown drawingboard.recognizer: " + properties.recognizer());
        }
    }
}
