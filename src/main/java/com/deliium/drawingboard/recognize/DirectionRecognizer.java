package com.deliium.drawingboard.recognize;

import java.util.ArrayList;
import java.util.List;

import com.deliium.drawingboard.protocol.Point;
import com.deliium.drawingboard.protocol.Stroke;

/**
 * Lightweight recognizer that looks at each stroke on its own instead of rasterizing.
 *
 * <p>Each stroke gets a direction from its start and end points (a dot when it moves less than
 * five pixels on both axes, otherwise horizontal or vertical by the nearer axis) and a shape from
 * the mean distance of its interior points to the start-end chord (straight under 5, slightly
 * curved under 15, curved beyond). The canvas size is not used.
 */
public class DirectionRecognizer implements Recognizer {

    enum Direction { DOT, HORIZONTAL, VERTICAL }

    enum Shape { STRAIGHT, SLIGHTLY_CURVED, CURVED }

    @Override
    public List<Candidate> recognize(List<Stroke> strokes, int width, int height, int topN) {
        int limit = Recognizer.effectiveTopN(topN);
        if (strokes.isEmpty()) {
            return List.of();
        }

        int count = strokes.size();
        int totalPoints = 0;
        List<Direction> directions = new ArrayList<>(count);
        List<Shape> shapes = new ArrayList<>(count);
        for (Stroke stroke : strokes) {
            totalPoints += stroke.points().size();
            directions.add(direction(stroke.points()));
            shapes.add(shape(stroke.points()));
        }

        List<Candidate> out = new ArrayList<>();
        if (count == 1) {
            Direction dir = directions.get(0);
            Shape shape = shapes.get(0);
            if (dir == Direction.HORIZONTAL && shape == Shape.STRAIGHT) {
                add(out, "一", 0.9, "ー", 0.7);
            } else if (dir == Direction.VERTICAL && shape == Shape.STRAIGHT) {
                add(out, "丨", 0.9, "｜", 0.7);
            } else if (dir == Direction.DOT) {
                add(out, "丶", 0.8, "。", 0.6);
            } else if (shape == Shape.CURVED) {
                add(out, "し", 0.7, "く", 0.5);
            }
        } else if (count == 2) {
            Direction first = directions.get(0);
            Direction second = directions.get(1);
            if (first == Direction.HORIZONTAL && second == Direction.HORIZONTAL) {
                add(out, "二", 0.8, "ニ", 0.6);
            } else if ((first == Direction.HORIZONTAL && second == Direction.VERTICAL)
                    || (first == Direction.VERTICAL && second == Direction.HORIZONTAL)) {
                add(out, "十", 0.8, "＋", 0.6);
            }
        } else if (count == 3) {
            if (directions.stream().allMatch(d -> d == Direction.HORIZONTAL)) {
                add(out, "三", 0.8, "ミ", 0.6);
            }
        } else {
            long horizontal = directions.stream().filter(d -> d == Direction.HORIZONTAL).count();
            long vertical = directions.stream().filter(d -> d == Direction.VERTICAL).count();
            if (horizontal >= 2 && vertical >= 2) {
                add(out, "中", 0.6, "田", 0.5);
            }
            out.add(new Candidate("国", 0.5));
            out.add(new Candidate("学", 0.4));
            out.add(new Candidate("生", 0.3));
        }

        if (totalPoints > 20) {
            add(out, "書", 0.3, "字", 0.2);
        }

        if (out.isEmpty()) {
            if (count == 1) {
                out.add(new Candidate("一", 0.5));
            } else if (count == 2) {
                out.add(new Candidate("二", 0.5));
            } else if (count == 3) {
                out.add(new Candidate("三", 0.5));
            } else {
                out.add(new Candidate("中", 0.4));
            }
        }

        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : List.copyOf(out);
    }

    static Direction direction(List<Point> points) {
        if (points.size() < 2) {
            return Direction.DOT;
        }
        Point start = points.get(0);
        Point end = points.get(points.size() - 1);
        double dx = end.x() - start.x();
        double dy = end.y() - start.y();
        if (Math.abs(dx) < 5 && Math.abs(dy) < 5) {
            return Direction.DOT;
        }
        double angle = Math.toDegrees(Math.atan2(dy, dx));
        if (angle < 0) {
            angle += 360;
        }
        boolean horizontal = angle >= 315 || angle < 45 || (angle >= 135 && angle < 225);
        return horizontal ? Direction.HORIZONTAL : Direction.VERTICAL;
    }

    static Shape shape(List<Point> points) {
        if (points.size() < 3) {
            return Shape.STRAIGHT;
        }
        Point start = points.get(0);
        Point end = points.get(points.size() - 1);
        double dx = end.x() - start.x();
        double dy = end.y() - start.y();
        double chord = Math.hypot(dx, dy);

        double total = 0;
        for (int i = 1; i < points.size() - 1; i++) {
            Point p = points.get(i);
            if (chord == 0) {
                total += Math.hypot(p.x() - start.x(), p.y() - start.y());
            } else {
                total += Math.abs(dy * p.x() - dx * p.y() + end.x() * start.y() - end.y() * start.x()) / chord;
            }
        }
        double mean = total / (points.size() - 2);
        if (mean < 5) {
            return Shape.STRAIGHT;
        }
        return mean < 15 ? Shape.SLIGHTLY_CURVED : Shape.CURVED;
    }

    private static void add(List<Candidate> out, String first, double firstScore, String second, double secondScore) {
        out.add(new Candidate(first, firstScore));
        out.add(new Candidate(second, secondScore));
    }
}
