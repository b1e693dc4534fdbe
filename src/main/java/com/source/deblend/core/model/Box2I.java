package com.source.deblend.core.model;

/**
 * Integer bounding box with inclusive corners.
 *
 * @param minX first column
 * @param minY first row
 * @param maxX last column (inclusive)
 * @param maxY last row (inclusive)
 */
public record Box2I(int minX, int minY, int maxX, int maxY) {

    public Box2I {
        if (maxX < minX || maxY < minY) {
            throw new IllegalArgumentException(
                    "Invalid box: (" + minX + "," + minY + ")-(" + maxX + "," + maxY + ")");
        }
    }

    public int getWidth() {
        return maxX - minX + 1;
    }

    public int getHeight() {
        return maxY - minY + 1;
    }

    public Point2D getCenter() {
        return new Point2D((minX + maxX) / 2.0, (minY + maxY) / 2.0);
    }

    public boolean contains(int x, int y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /**
     * Returns the smallest box containing both this box and {@code other}.
     */
    public Box2I union(Box2I other) {
        return new Box2I(
                Math.min(minX, other.minX),
                Math.min(minY, other.minY),
                Math.max(maxX, other.maxX),
                Math.max(maxY, other.maxY));
    }
}
