package com.deliium.drawingboard.recognize;

import static com.deliium.drawingboard.recognize.FeatureExtractor.DENSITY;
import static com.deliium.drawingboard.recognize.FeatureExtractor.HAS_CROSS;
import static com.deliium.drawingboard.recognize.FeatureExtractor.HAS_SINGLE_HORIZONTAL;
import static com.deliium.drawingboard.recognize.FeatureExtractor.HAS_SINGLE_VERTICAL;
import static com.deliium.drawingboard.recognize.FeatureExtractor.HAS_THREE_HORIZONTAL;
import static com.deliium.drawingboard.recognize.FeatureExtractor.HAS_TWO_HORIZONTAL;
import static com.deliium.drawingboard.recognize.FeatureExtractor.HORIZONTAL_LINES;
import static com.deliium.drawingboard.recognize.FeatureExtractor.VERTICAL_LINES;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fixed decision table from extracted features and stroke count to ranked candidates.
 *
 * <ol>
 *   <li>Pattern rules, each appending independently: cross with two strokes (十), three horizontal
 *       with three strokes (三), two horizontal with two strokes (二), single horizontal (一) and
 *       single vertical (丨) with one stroke.</li>
 *   <li>If none fired, a fallback keyed on stroke count using the raw line counts and density.</li>
 *   <li>Dense drawings (density above 0.1) always get 書 and 字 appended.</li>
 *   <li>If the list is still empty, one generic guess by stroke count.</li>
 * </ol>
 * The result keeps generation order and is cut to {@code topN}; it is never re-sorted by score.
 */
public final class ShapeClassifier {

    private ShapeClassifier() {
    }

    public static List<Candidate> classify(Map<String, Double> features, int strokeCount, int topN) {
        int limit = Recognizer.effectiveTopN(topN);
        List<Candidate> out = new ArrayList<>();

        if (strokeCount == 2 && isSet(features, HAS_CROSS)) {
            add(out, "十", 0.95, "＋", 0.8);
        }
        if (strokeCount == 3 && isSet(features, HAS_THREE_HORIZONTAL)) {
            add(out, "三", 0.95, "ミ", 0.7);
        }
        if (strokeCount == 2 && isSet(features, HAS_TWO_HORIZONTAL)) {
            add(out, "二", 0.9, "ニ", 0.7);
        }
        if (strokeCount == 1 && isSet(features, HAS_SINGLE_HORIZONTAL)) {
            add(out, "一", 0.9, "ー", 0.7);
        }
        if (strokeCount == 1 && isSet(features, HAS_SINGLE_VERTICAL)) {
            add(out, "丨", 0.9, "｜", 0.7);
        }

        if (out.isEmpty()) {
            fallback(out, features, strokeCount);
        }

        if (value(features, DENSITY) > 0.1) {
            add(out, "書", 0.3, "字", 0.2);
        }

        if (out.isEmpty()) {
            if (strokeCount == 1) {
                out.add(new Candidate("一", 0.5));
            } else if (strokeCount == 2) {
                out.add(new Candidate("二", 0.5));
            } else if (strokeCount == 3) {
                out.add(new Candidate("三", 0.5));
            } else {
                out.add(new Candidate("中", 0.4));
            }
        }

        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : List.copyOf(out);
    }

    private static void fallback(List<Candidate> out, Map<String, Double> features, int strokeCount) {
        double horizontal = value(features, HORIZONTAL_LINES);
        double vertical = value(features, VERTICAL_LINES);

        if (strokeCount == 1) {
            if (horizontal > 0.5) {
                add(out, "一", 0.7, "ー", 0.5);
            } else if (vertical > 0.5) {
                add(out, "丨", 0.7, "｜", 0.5);
            } else if (value(features, DENSITY) < 0.01) {
                add(out, "丶", 0.8, "。", 0.6);
            } else {
                add(out, "し", 0.6, "く", 0.4);
            }
        } else if (strokeCount == 2) {
            if (horizontal >= 2) {
                add(out, "二", 0.7, "ニ", 0.5);
            } else if (horizontal >= 1 && vertical >= 1) {
                add(out, "十", 0.7, "＋", 0.5);
            } else {
                add(out, "人", 0.6, "入", 0.4);
            }
        } else if (strokeCount == 3) {
            if (horizontal >= 3) {
                add(out, "三", 0.7, "ミ", 0.5);
            } else if (horizontal >= 1 && vertical >= 1) {
                add(out, "大", 0.6, "太", 0.4);
            } else {
                add(out, "小", 0.5, "川", 0.3);
            }
        } else if (strokeCount >= 4) {
            if (horizontal >= 2 && vertical >= 2) {
                add(out, "中", 0.6, "田", 0.5);
            }
            out.add(new Candidate("国", 0.5));
            out.add(new Candidate("学", 0.4));
            out.add(new Candidate("生", 0.3));
        }
    }

    private static boolean isSet(Map<String, Double> features, String name) {
        return value(features, name) > 0.5;
    }

    private static double value(Map<String, Double> features, String name) {
        Double v = features.get(name);
        return v == null ? 0.0 : v;
    }

    private static void add(List<Candidate> out, String first, double firstScore, String second, double secondScore) {
        out.add(new Candidate(first, firstScore));
        out.add(new Candidate(second, secondScore));
    }
}
