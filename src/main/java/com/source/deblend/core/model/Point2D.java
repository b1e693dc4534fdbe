package com.source.deblend.core.model;

/**
 * Floating-point position in pixel coordinates.
 */
public record Point2D(double x, double y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
