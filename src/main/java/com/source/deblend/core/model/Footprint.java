package com.source.deblend.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Set of pixels belonging to one detection, stored as row spans, together with
 * the local intensity peaks found inside it.
 *
 * Footprints are immutable. Spans are kept sorted by row then column; the
 * bounding box and area are derived from them.
 */
public class Footprint {

    private final List<Span> spans;
    private final List<Peak> peaks;
    private final Box2I bbox;
    private final int area;

    protected Footprint(List<Span> spans, List<Peak> peaks) {
        Objects.requireNonNull(spans, "spans is required");
        if (spans.isEmpty()) {
            throw new IllegalArgumentException("Footprint must contain at least one span");
        }
        List<Span> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt(Span::y).thenComparingInt(Span::x0));
        this.spans = List.copyOf(sorted);
        this.peaks = peaks != null ? List.copyOf(peaks) : List.of();

        Box2I box = null;
        int pixels = 0;
        for (Span span : this.spans) {
            Box2I spanBox = new Box2I(span.x0(), span.y(), span.x1(), span.y());
            box = box == null ? spanBox : box.union(spanBox);
            pixels += span.getWidth();
        }
        this.bbox = box;
        this.area = pixels;
    }

    public List<Span> getSpans() {
        return spans;
    }

    public List<Peak> getPeaks() {
        return peaks;
    }

    public int getPeakCount() {
        return peaks.size();
    }

    public Box2I getBBox() {
        return bbox;
    }

    public int getArea() {
        return area;
    }

    public boolean contains(int x, int y) {
        if (!bbox.contains(x, y)) {
            return false;
        }
        for (Span span : spans) {
            if (span.contains(x, y)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Creates a rectangular footprint covering {@code box}, with the given peaks.
     */
    public static Footprint ofBox(Box2I box, List<Peak> peaks) {
        Builder builder = builder();
        for (int y = box.minY(); y <= box.maxY(); y++) {
            builder.addSpan(y, box.minX(), box.maxX());
        }
        peaks.forEach(builder::addPeak);
        return builder.build();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "bbox=" + bbox +
                ", area=" + area +
                ", peaks=" + peaks.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Span> spans = new ArrayList<>();
        private final List<Peak> peaks = new ArrayList<>();

        public Builder addSpan(int y, int x0, int x1) {
            spans.add(new Span(y, x0, x1));
            return this;
        }

        public Builder addSpan(Span span) {
            spans.add(Objects.requireNonNull(span, "span is required"));
            return this;
        }

        public Builder addPeak(Peak peak) {
            peaks.add(Objects.requireNonNull(peak, "peak is required"));
            return this;
        }

        public Builder addPeak(int ix, int iy, double value) {
            return addPeak(new Peak(ix, iy, value));
        }

        public Footprint build() {
            return new Footprint(spans, peaks);
        }
    }
}
