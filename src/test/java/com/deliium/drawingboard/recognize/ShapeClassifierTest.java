package com.deliium.drawingboard.recognize;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ShapeClassifierTest {

    private static Map<String, Double> features(Object... pairs) {
        Map<String, Double> out = new HashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            out.put((String) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        return out;
    }

    // ── pattern rules ───────────────────────────────────────────────────────

    @Test
    void crossWithTwoStrokes() {
        List<Candidate> out = ShapeClassifier.classify(features(FeatureExtractor.HAS_CROSS, 1), 2, 10);

        assertThat(out).containsExactly(new Candidate("十", 0.95), new Candidate("＋", 0.8));
    }

    @Test
    void crossWithOtherStrokeCountDoesNotFire() {
        List<Candidate> out = ShapeClassifier.classify(features(FeatureExtractor.HAS_CROSS, 1), 3, 10);

        assertThat(out).extracting(Candidate::text).doesNotContain("十");
    }

    @Test
    void rulesAppendIndependentlyInTableOrder() {
        List<Candidate> out = ShapeClassifier.classify(features(
            FeatureExtractor.HAS_CROSS, 1, FeatureExtractor.HAS_TWO_HORIZONTAL, 1), 2, 10);

        assertThat(out).extracting(Candidate::text).containsExactly("十", "＋", "二", "ニ");
    }

    @Test
    void singleVerticalWithOneStroke() {
        List<Candidate> out = ShapeClassifier.classify(features(FeatureExtractor.HAS_SINGLE_VERTICAL, 1), 1, 10);

        assertThat(out).containsExactly(new Candidate("丨", 0.9), new Candidate("｜", 0.7));
    }

    // ── fallback ────────────────────────────────────────────────────────────

    @Test
    void sparseSingleStrokeIsADot() {
        List<Candidate> out = ShapeClassifier.classify(features(FeatureExtractor.DENSITY, 0.001), 1, 10);

        assertThat(out).containsExactly(new Candidate("丶", 0.8), new Candidate("。", 0.6));
    }

    @Test
    void inkySingleStrokeWithoutLinesIsACurve() {
        List<Candidate> out = ShapeClassifier.classify(features(FeatureExtractor.DENSITY, 0.05), 1, 10);

        assertThat(out).containsExactly(new Candidate("し", 0.6), new Candidate("く", 0.4));
    }

    @Test
    void twoStrokesWithoutLinesFallBackToPerson() {
        List<Candidate> out = ShapeClassifier.classify(features(FeatureExtractor.DIAGONAL_LINES, 40), 2, 10);

        assertThat(out).extracting(Candidate::text).containsExactly("人", "入");
    }

    @Test
    void threeStrokesWithMixedLines() {
        List<Candidate> out = ShapeClassifier.classify(features(
            FeatureExtractor.HORIZONTAL_LINES, 1, FeatureExtractor.VERTICAL_LINES, 2), 3, 10);

        assertThat(out).containsExactly(new Candidate("大", 0.6), new Candidate("太", 0.4));
    }

    @Test
    void threeStrokesWithoutLines() {
        List<Candidate> out = ShapeClassifier.classify(features(), 3, 10);

        assertThat(out).extracting(Candidate::text).containsExactly("小", "川");
    }

    @Test
    void gridOfFourStrokes() {
        List<Candidate> out = ShapeClassifier.classify(features(
            FeatureExtractor.HORIZONTAL_LINES, 2, FeatureExtractor.VERTICAL_LINES, 2), 4, 10);

        assertThat(out).containsExactly(
            new Candidate("中", 0.6), new Candidate("田", 0.5),
            new Candidate("国", 0.5), new Candidate("学", 0.4), new Candidate("生", 0.3));
    }

    @Test
    void manyStrokesWithoutGridStillGuess() {
        List<Candidate> out = ShapeClassifier.classify(features(), 7, 10);

        assertThat(out).extracting(Candidate::text).containsExactly("国", "学", "生");
    }

    // ── density and final fallback ──────────────────────────────────────────

    @Test
    void denseDrawingAddsComplexCharacters() {
        List<Candidate> out = ShapeClassifier.classify(features(
            FeatureExtractor.HAS_SINGLE_HORIZONTAL, 1, FeatureExtractor.DENSITY, 0.2), 1, 10);

        assertThat(out).containsExactly(
            new Candidate("一", 0.9), new Candidate("ー", 0.7),
            new Candidate("書", 0.3), new Candidate("字", 0.2));
    }

    @Test
    void zeroStrokesGetGenericGuess() {
        assertThat(ShapeClassifier.classify(features(), 0, 10)).containsExactly(new Candidate("中", 0.4));
    }

    @Test
    void resultIsNotResortedByScore() {
        List<Candidate> out = ShapeClassifier.classify(features(
            FeatureExtractor.HORIZONTAL_LINES, 2, FeatureExtractor.VERTICAL_LINES, 2), 4, 10);

        assertThat(out.get(1).score()).isEqualTo(out.get(2).score());
        assertThat(out.get(1).text()).isEqualTo("田");
    }

    // ── topN ────────────────────────────────────────────────────────────────

    @Test
    void topNTruncates() {
        List<Candidate> out = ShapeClassifier.classify(features(
            FeatureExtractor.HORIZONTAL_LINES, 2, FeatureExtractor.VERTICAL_LINES, 2), 4, 2);

        assertThat(out).extracting(Candidate::text).containsExactly("中", "田");
    }

    @Test
    void nonPositiveTopNMeansDefault() {
        List<Candidate> out = ShapeClassifier.classify(features(
            FeatureExtractor.HORIZONTAL_LINES, 2, FeatureExtractor.VERTICAL_LINES, 2,
            FeatureExtractor.DENSITY, 0.5), 4, 0);

        assertThat(out).hasSize(7);
    }
}
