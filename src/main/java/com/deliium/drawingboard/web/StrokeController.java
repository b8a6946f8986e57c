package com.deliium.drawingboard.web;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import jakarta.servlet.http.HttpServletRequest;

import com.deliium.drawingboard.auth.IdentityResolver;
import com.deliium.drawingboard.protocol.Stroke;
import com.deliium.drawingboard.recognize.Candidate;
import com.deliium.drawingboard.recognize.FeatureExtractor;
import com.deliium.drawingboard.recognize.RecognitionService;
import com.deliium.drawingboard.store.StoredStroke;
import com.deliium.drawingboard.store.StrokeStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Owner-scoped stroke history and recognition. Every endpoint acts on the caller's own strokes
 * only; the auth filter has already rejected anonymous callers.
 */
@RestController
@RequestMapping("/api")
public class StrokeController {
    private static final Logger LOGGER = LoggerFactory.getLogger(StrokeController.class);

    private final StrokeStore store;
    private final RecognitionService recognition;
    private final IdentityResolver identity;

    public StrokeController(StrokeStore store, RecognitionService recognition, IdentityResolver identity) {
        this.store = store;
        this.recognition = recognition;
        this.identity = identity;
    }

    /**
     * Body of {@code POST /api/recognize}; zero or missing fields mean "use the default". Width and
     * height above {@value FeatureExtractor#MAX_RASTER_SIDE} are rejected.
     */
    public record RecognizeRequest(int topN, int width, int height) {}

    public record RecognizeResponse(List<Candidate> candidates) {}

    @GetMapping("/strokes")
    public List<Stroke> list(HttpServletRequest request) {
        return store.listStrokes(callerId(request)).stream()
            .map(StoredStroke::toWire)
            .collect(Collectors.toList());
    }

    @PostMapping("/strokes/clear")
    public Map<String, Object> clear(HttpServletRequest request) {
        long userId = callerId(request);
        store.clearStrokes(userId);
        LOGGER.info("Strokes cleared: user={}", userId);
        return Map.of("ok", true);
    }

    @PostMapping("/strokes/delete")
    public Map<String, Object> delete(@RequestParam(name = "id", required = false) String id,
                                      HttpServletRequest request) {
        long strokeId = parseStrokeId(id);
        store.deleteStroke(callerId(request), strokeId);
        return Map.of("ok", true, "id", strokeId);
    }

    @PostMapping("/recognize")
    public RecognizeResponse recognize(@RequestBody(required = false) RecognizeRequest body,
                                       HttpServletRequest request) {
        RecognizeRequest req = body == null ? new RecognizeRequest(0, 0, 0) : body;
        if (req.width() > FeatureExtractor.MAX_RASTER_SIDE || req.height() > FeatureExtractor.MAX_RASTER_SIDE) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "bad size");
        }
        return new RecognizeResponse(recognition.recognize(callerId(request), req.width(), req.height(), req.topN()));
    }

    private long callerId(HttpServletRequest request) {
        return identity.resolve(request)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "unauthorized"));
    }

    static long parseStrokeId(String raw) {
        long id;
        try {
            id = Long.parseLong(raw == null ? "" : raw.trim());
        } catch (NumberFormatException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "bad id");
        }
        if (id <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "bad id");
        }
        return id;
    }
}
