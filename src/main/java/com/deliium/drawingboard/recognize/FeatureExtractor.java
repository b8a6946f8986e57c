package com.deliium.drawingboard.recognize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.deliium.drawingboard.protocol.Point;
import com.deliium.drawingboard.protocol.Stroke;

/**
 * Rasterizes strokes and measures simple geometry on the result.
 *
 * <h3>Rasterization</h3>
 * Every point inks the 3×3 block around its truncated integer coordinates. Consecutive points are
 * also joined by stepping along the segment in roughly one-pixel increments and inking the same
 * block at each step, so fast pointer motion still gives a continuous line. Anything outside the
 * grid is clipped; a segment that leaves the grid is cut to the part that can still leave ink
 * before it is walked. Neither side may exceed {@value #MAX_RASTER_SIDE} cells.
 *
 * <h3>Features</h3>
 * <ul>
 *   <li>{@code density}: inked cells over all cells.</li>
 *   <li>{@code aspect_ratio}, {@code center_offset_x}, {@code center_offset_y}: from the bounding
 *       box of inked cells; all zero when nothing is inked.</li>
 *   <li>{@code horizontal_lines}: bands of consecutive rows whose longest run is at least
 *       width/10. {@code vertical_lines} is the same over columns with height/10.</li>
 *   <li>{@code diagonal_lines}: runs of at least hypot(width, height)/8 along the four diagonal
 *       directions, started from every cell. Overlapping runs are counted again, so this
 *       over-counts on purpose.</li>
 *   <li>{@code has_cross}: the longest horizontal run exceeds width/3 and the longest vertical run
 *       exceeds height/3.</li>
 *   <li>{@code has_three_horizontal}, {@code has_two_horizontal}, {@code has_single_horizontal},
 *       {@code has_single_vertical}: flags derived from the line counts.</li>
 * </ul>
 * Flags are 1.0 or 0.0.
 */
public final class FeatureExtractor {

    public static final String DENSITY = "density";
    public static final String ASPECT_RATIO = "aspect_ratio";
    public static final String CENTER_OFFSET_X = "center_offset_x";
    public static final String CENTER_OFFSET_Y = "center_offset_y";
    public static final String HORIZONTAL_LINES = "horizontal_lines";
    public static final String VERTICAL_LINES = "vertical_lines";
    public static final String DIAGONAL_LINES = "diagonal_lines";
    public static final String HAS_CROSS = "has_cross";
    public static final String HAS_THREE_HORIZONTAL = "has_three_horizontal";
    public static final String HAS_TWO_HORIZONTAL = "has_two_horizontal";
    public static final String HAS_SINGLE_HORIZONTAL = "has_single_horizontal";
    public static final String HAS_SINGLE_VERTICAL = "has_single_vertical";

    /** Largest accepted raster width or height. */
    public static final int MAX_RASTER_SIDE = 512;

    private static final int[][] DIAGONALS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};

    private FeatureExtractor() {
    }

    public static Raster rasterize(List<Stroke> strokes, int width, int height) {
        if (width <= 0 || height <= 0 || width > MAX_RASTER_SIDE || height > MAX_RASTER_SIDE) {
            throw new IllegalArgumentException(
                "raster size must be within 1.." + MAX_RASTER_SIDE + ": " + width + "x" + height);
        }
        Raster raster = new Raster(width, height);
        for (Stroke stroke : strokes) {
            List<Point> points = stroke.points();
            for (Point p : points) {
                stamp(raster, (int) p.x(), (int) p.y());
            }
            for (int i = 0; i + 1 < points.size(); i++) {
                drawSegment(raster, points.get(i), points.get(i + 1));
            }
        }
        return raster;
    }

    public static Map<String, Double> extract(Raster raster) {
        int width = raster.width();
        int height = raster.height();
        Map<String, Double> features = new LinkedHashMap<>();

        int active = 0;
        int minX = width;
        int minY = height;
        int maxX = -1;
        int maxY = -1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (raster.isActive(x, y)) {
                    active++;
                    minX = Math.min(minX, x);
                    maxX = Math.max(maxX, x);
                    minY = Math.min(minY, y);
                    maxY = Math.max(maxY, y);
                }
            }
        }

        features.put(DENSITY, (double) active / ((double) width * height));
        if (active == 0) {
            features.put(ASPECT_RATIO, 0.0);
            features.put(CENTER_OFFSET_X, 0.0);
            features.put(CENTER_OFFSET_Y, 0.0);
        } else {
            double centerX = width / 2.0;
            double centerY = height / 2.0;
            features.put(ASPECT_RATIO, (double) (maxX - minX + 1) / (maxY - minY + 1));
            features.put(CENTER_OFFSET_X, Math.abs((minX + maxX) / 2.0 - centerX) / centerX);
            features.put(CENTER_OFFSET_Y, Math.abs((minY + maxY) / 2.0 - centerY) / centerY);
        }

        int horizontal = horizontalLines(raster);
        int vertical = verticalLines(raster);
        features.put(HORIZONTAL_LINES, (double) horizontal);
        features.put(VERTICAL_LINES, (double) vertical);
        features.put(DIAGONAL_LINES, (double) diagonalLines(raster));

        boolean cross = longestRowRun(raster) > width / 3 && longestColumnRun(raster) > height / 3;
        features.put(HAS_CROSS, flag(cross));
        features.put(HAS_THREE_HORIZONTAL, flag(horizontal >= 3));
        features.put(HAS_TWO_HORIZONTAL, flag(horizontal >= 2));
        features.put(HAS_SINGLE_HORIZONTAL, flag(horizontal >= 1 && vertical == 0));
        features.put(HAS_SINGLE_VERTICAL, flag(vertical >= 1 && horizontal == 0));
        return Collections.unmodifiableMap(features);
    }

    static int horizontalLines(Raster raster) {
        int minRun = raster.width() / 10;
        int lines = 0;
        boolean inLine = false;
        for (int y = 0; y < raster.height(); y++) {
            boolean qualifies = rowRun(raster, y) >= minRun;
            if (qualifies && !inLine) {
                lines++;
            }
            inLine = qualifies;
        }
        return lines;
    }

    static int verticalLines(Raster raster) {
        int minRun = raster.height() / 10;
        int lines = 0;
        boolean inLine = false;
        for (int x = 0; x < raster.width(); x++) {
            boolean qualifies = columnRun(raster, x) >= minRun;
            if (qualifies && !inLine) {
                lines++;
            }
            inLine = qualifies;
        }
        return lines;
    }

    static int diagonalLines(Raster raster) {
        int width = raster.width();
        int height = raster.height();
        int minRun = (int) Math.sqrt((double) width * width + (double) height * height) / 8;
        int lines = 0;
        for (int[] dir : DIAGONALS) {
            for (int startY = 0; startY < height; startY++) {
                for (int startX = 0; startX < width; startX++) {
                    int run = 0;
                    int x = startX;
                    int y = startY;
                    while (x >= 0 && x < width && y >= 0 && y < height) {
                        if (raster.isActive(x, y)) {
                            run++;
                        } else {
                            if (run >= minRun) {
                                lines++;
                            }
                            run = 0;
                        }
                        x += dir[0];
                        y += dir[1];
                    }
                    if (run >= minRun) {
                        lines++;
                    }
                }
            }
        }
        return lines;
    }

    static int longestRowRun(Raster raster) {
        int best = 0;
        for (int y = 0; y < raster.height(); y++) {
            best = Math.max(best, rowRun(raster, y));
        }
        return best;
    }

    static int longestColumnRun(Raster raster) {
        int best = 0;
        for (int x = 0; x < raster.width(); x++) {
            best = Math.max(best, columnRun(raster, x));
        }
        return best;
    }

    /** Longest run of inked cells in row {@code y}. */
    private static int rowRun(Raster raster, int y) {
        int run = 0;
        int best = 0;
        for (int x = 0; x < raster.width(); x++) {
            run = raster.isActive(x, y) ? run + 1 : 0;
            best = Math.max(best, run);
        }
        return best;
    }

    /** Longest run of inked cells in column {@code x}. */
    private static int columnRun(Raster raster, int x) {
        int run = 0;
        int best = 0;
        for (int y = 0; y < raster.height(); y++) {
            run = raster.isActive(x, y) ? run + 1 : 0;
            best = Math.max(best, run);
        }
        return best;
    }

    private static void drawSegment(Raster raster, Point from, Point to) {
        if (!inkable(raster, from) || !inkable(raster, to)) {
            double[] clipped = clip(raster, from.x(), from.y(), to.x(), to.y());
            if (clipped == null) {
                return;
            }
            from = new Point(clipped[0], clipped[1]);
            to = new Point(clipped[2], clipped[3]);
        }
        double dx = to.x() - from.x();
        double dy = to.y() - from.y();
        int steps = (int) Math.sqrt(dx * dx + dy * dy) + 1;
        for (int i = 0; i <= steps; i++) {
            double t = (double) i / steps;
            stamp(raster, (int) (from.x() + t * dx), (int) (from.y() + t * dy));
        }
    }

    /** Whether a stamp centered on the point can touch the grid. */
    private static boolean inkable(Raster raster, Point p) {
        return p.x() > -2 && p.x() < raster.width() + 1 && p.y() > -2 && p.y() < raster.height() + 1;
    }

    /**
     * Liang-Barsky clip of a segment to the box a stamp can still ink from, or {@code null} when
     * the segment misses it.
     */
    private static double[] clip(Raster raster, double x0, double y0, double x1, double y1) {
        double minX = -2;
        double minY = -2;
        double maxX = raster.width() + 1;
        double maxY = raster.height() + 1;
        double dx = x1 - x0;
        double dy = y1 - y0;
        double[] p = {-dx, dx, -dy, dy};
        double[] q = {x0 - minX, maxX - x0, y0 - minY, maxY - y0};
        double enter = 0.0;
        double leave = 1.0;
        for (int i = 0; i < 4; i++) {
            if (p[i] == 0) {
                if (q[i] < 0) {
                    return null;
                }
            } else {
                double r = q[i] / p[i];
                if (p[i] < 0) {
                    enter = Math.max(enter, r);
                } else {
                    leave = Math.min(leave, r);
                }
            }
        }
        if (enter > leave || Double.isNaN(enter) || Double.isNaN(leave)) {
            return null;
        }
        return new double[] {x0 + enter * dx, y0 + enter * dy, x0 + leave * dx, y0 + leave * dy};
    }

    private static void stamp(Raster raster, int x, int y) {
        for (int oy = -1; oy <= 1; oy++) {
            for (int ox = -1; ox <= 1; ox++) {
                raster.mark(x + ox, y + oy);
            }
        }
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
