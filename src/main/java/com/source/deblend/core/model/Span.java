package com.source.deblend.core.model;

/**
 * A horizontal run of pixels on row {@code y} from {@code x0} to {@code x1} inclusive.
 */
public record Span(int y, int x0, int x1) {

    public Span {
        if (x1 < x0) {
            throw new IllegalArgumentException("Span end " + x1 + " precedes start " + x0);
        }
    }

    public int getWidth() {
        return x1 - x0 + 1;
    }

    public boolean contains(int x, int y) {
        return y == this.y && x >= x0 && x <= x1;
    }
}
