package com.deliium.drawingboard.recognize;

/**
 * Row-major occupancy grid with cell values in [0,1]. A cell counts as inked when its value
 * exceeds {@value #ACTIVE_THRESHOLD}.
 */
public final class Raster {

    static final float ACTIVE_THRESHOLD = 0.1f;

    private final int width;
    private final int height;
    private final float[] cells;

    Raster(int width, int height) {
        this.width = width;
        this.height = height;
        this.cells = new float[Math.multiplyExact(width, height)];
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float get(int x, int y) {
        return cells[y * width + x];
    }

    public boolean isActive(int x, int y) {
        return cells[y * width + x] > ACTIVE_THRESHOLD;
    }

    /** Copy of the flattened grid. */
    public float[] cells() {
        return cells.clone();
    }

    /** Sets a cell to full intensity; coordinates outside the grid are ignored. */
    void mark(int x, int y) {
        if (x >= 0 && x < width && y >= 0 && y < height) {
            cells[y * width + x] = 1.0f;
        }
    }

    /** Downsampled text picture of the grid, for trace logging. */
    String render(int maxColumns, int maxRows) {
        int stepX = Math.max(1, width / maxColumns);
        int stepY = Math.max(1, height / maxRows);
        StringBuilder out = new StringBuilder();
        for (int y = 0; y < height; y += stepY) {
            for (int x = 0; x < width; x += stepX) {
                out.append(isActive(x, y) ? '#' : '.');
            }
            out.append('\n');
        }
        return out.toString();
    }
}
