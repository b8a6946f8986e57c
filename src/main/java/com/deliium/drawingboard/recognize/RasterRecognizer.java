package com.deliium.drawingboard.recognize;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.deliium.drawingboard.protocol.Stroke;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rasterizes the strokes, extracts geometric features and runs them through the
 * {@link ShapeClassifier} table. Strokes without points are left out, including from the stroke
 * count; if nothing is left the result is empty. The canvas size is clamped to
 * 1..{@value FeatureExtractor#MAX_RASTER_SIDE} on each side.
 */
public class RasterRecognizer implements Recognizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(RasterRecognizer.class);

    @Override
    public List<Candidate> recognize(List<Stroke> strokes, int width, int height, int topN) {
        List<Stroke> drawn = strokes.stream().filter(Stroke::hasPoints).collect(Collectors.toList());
        if (drawn.isEmpty()) {
            return List.of();
        }

        int w = clampSide(width);
        int h = clampSide(height);
        Raster raster = FeatureExtractor.rasterize(drawn, w, h);
        Map<String, Double> features = FeatureExtractor.extract(raster);
        LOGGER.debug("Raster features: strokes={}, canvas={}x{}, features={}", drawn.size(), w, h, features);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Raster preview:\n{}", raster.render(80, 40));
        }

        List<Candidate> candidates = ShapeClassifier.classify(features, drawn.size(), topN);
        LOGGER.debug("Raster candidates: {}", candidates);
        return candidates;
    }

    private static int clampSide(int side) {
        return Math.max(1, Math.min(side, FeatureExtractor.MAX_RASTER_SIDE));
    }
}
