package com.deliium.drawingboard.recognize;

import java.util.List;

import com.deliium.drawingboard.protocol.Stroke;

/**
 * Turns a set of strokes into ranked character candidates.
 *
 * <p>Implementations are deterministic: the same strokes, canvas size and cap always give the same
 * list in the same order. An empty stroke list gives an empty list. A {@code topN} of zero or less
 * means the default of {@value #DEFAULT_TOP_N}.
 */
public interface Recognizer {

    int DEFAULT_TOP_N = 10;

    List<Candidate> recognize(List<Stroke> strokes, int width, int height, int topN);

    static int effectiveTopN(int topN) {
        return topN <= 0 ? DEFAULT_TOP_N : topN;
    }
}
