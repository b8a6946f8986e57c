package com.deliium.drawingboard.protocol;

/** A single sampled pointer position on the canvas, in canvas pixels. */
public record Point(double x, double y) {}
