package com.deliium.drawingboard.recognize;

import java.util.List;
import java.util.stream.Collectors;

import com.deliium.drawingboard.config.BoardProperties;
import com.deliium.drawingboard.protocol.Stroke;
import com.deliium.drawingboard.store.StoredStroke;
import com.deliium.drawingboard.store.StrokeStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** One-shot classification of a user's whole stroke history. */
@Service
public class RecognitionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecognitionService.class);

    private final StrokeStore store;
    private final Recognizer recognizer;
    private final int defaultWidth;
    private final int defaultHeight;

    public RecognitionService(StrokeStore store, Recognizer recognizer, BoardProperties properties) {
        this.store = store;
        this.recognizer = recognizer;
        this.defaultWidth = properties.rasterWidth();
        this.defaultHeight = properties.rasterHeight();
    }

    /**
     * Classifies everything the user has drawn. A width or height of zero or less falls back to
     * the configured raster size.
     */
    public List<Candidate> recognize(long userId, int width, int height, int topN) {
        List<Stroke> strokes = store.listStrokes(userId).stream()
            .map(StoredStroke::toWire)
            .collect(Collectors.toList());
        int w = width > 0 ? width : defaultWidth;
        int h = height > 0 ? height : defaultHeight;
        LOGGER.debug("Recognition request: user={}, strokes={}, canvas={}x{}", userId, strokes.size(), w, h);
        List<Candidate> candidates = recognizer.recognize(strokes, w, h, topN);
        LOGGER.debug("Recognition result: user={}, candidates={}", userId, candidates.size());
        return candidates;
    }
}
