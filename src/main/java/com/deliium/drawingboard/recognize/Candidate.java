package com.deliium.drawingboard.recognize;

/** A recognition guess: a label and a confidence in [0,1]. */
public record Candidate(String text, double score) {}
