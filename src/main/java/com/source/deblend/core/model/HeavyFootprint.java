package com.source.deblend.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * Footprint that also carries one flux value per pixel, in span order.
 * The deblender hands these back as each peak's flux portion.
 */
public final class HeavyFootprint extends Footprint {

    private final float[] values;

    public HeavyFootprint(Footprint footprint, float[] values) {
        this(footprint.getSpans(), footprint.getPeaks(), values);
    }

    public HeavyFootprint(List<Span> spans, List<Peak> peaks, float[] values) {
        super(spans, peaks);
        if (values == null || values.length != getArea()) {
            throw new IllegalArgumentException("Expected " + getArea() + " flux values, got "
                    + (values == null ? "null" : values.length));
        }
        this.values = values.clone();
    }

    public float[] getValues() {
        return values.clone();
    }

    /**
     * Sum of the flux values over all pixels.
     */
    public double getTotalFlux() {
        double sum = 0;
        for (float v : values) {
            sum += v;
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HeavyFootprint that = (HeavyFootprint) o;
        return getSpans().equals(that.getSpans())
                && getPeaks().equals(that.getPeaks())
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * getSpans().hashCode() + Arrays.hashCode(values);
    }
}
