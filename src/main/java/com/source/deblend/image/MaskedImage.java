package com.source.deblend.image;

import com.source.deblend.core.model.Box2I;

import java.util.Arrays;
import java.util.Objects;

/**
 * Image with its mask and variance planes, stored row-major over {@link #getBBox()}.
 * Arrays are copied on construction; the planes are read-only afterwards.
 */
public final class MaskedImage {

    private final Box2I bbox;
    private final float[] image;
    private final int[] mask;
    private final float[] variance;

    public MaskedImage(Box2I bbox, float[] image, int[] mask, float[] variance) {
        this.bbox = Objects.requireNonNull(bbox, "bbox is required");
        int n = bbox.getWidth() * bbox.getHeight();
        this.image = checkLength(image, n, "image").clone();
        this.mask = mask != null ? checkLength(mask, n, "mask").clone() : new int[n];
        this.variance = checkLength(variance, n, "variance").clone();
    }

    /**
     * Creates an image of constant value and variance with origin at (0,0).
     */
    public static MaskedImage uniform(int width, int height, float value, float variance) {
        int n = width * height;
        float[] img = new float[n];
        float[] vars = new float[n];
        Arrays.fill(img, value);
        Arrays.fill(vars, variance);
        return new MaskedImage(new Box2I(0, 0, width - 1, height - 1), img, null, vars);
    }

    public Box2I getBBox() {
        return bbox;
    }

    public int getWidth() {
        return bbox.getWidth();
    }

    public int getHeight() {
        return bbox.getHeight();
    }

    public int getPixelCount() {
        return image.length;
    }

    public float getImage(int x, int y) {
        return image[index(x, y)];
    }

    public int getMask(int x, int y) {
        return mask[index(x, y)];
    }

    public float getVariance(int x, int y) {
        return variance[index(x, y)];
    }

    /**
     * Variance value of the pixel at flat row-major position {@code i}.
     */
    public float varianceAt(int i) {
        return variance[i];
    }

    /**
     * Mask bits of the pixel at flat row-major position {@code i}.
     */
    public int maskAt(int i) {
        return mask[i];
    }

    private int index(int x, int y) {
        if (!bbox.contains(x, y)) {
            throw new IndexOutOfBoundsException("Pixel (" + x + "," + y + ") outside " + bbox);
        }
        return (y - bbox.minY()) * bbox.getWidth() + (x - bbox.minX());
    }

    private static float[] checkLength(float[] plane, int n, String name) {
        Objects.requireNonNull(plane, name + " plane is required");
        if (plane.length != n) {
            throw new IllegalArgumentException(name + " plane has " + plane.length + " pixels, expected " + n);
        }
        return plane;
    }

    private static int[] checkLength(int[] plane, int n, String name) {
        if (plane.length != n) {
            throw new IllegalArgumentException(name + " plane has " + plane.length + " pixels, expected " + n);
        }
        return plane;
    }
}
