package com.source.deblend.api;

import com.source.deblend.deblender.DeblenderParameters;
import com.source.deblend.deblender.StrayFluxPolicy;

import java.util.Objects;

/**
 * Options for deblending runs.
 * Configures the deblender's algorithm knobs and how many sources are processed at once.
 */
public class DeblendOptions {

    private static final double DEFAULT_PSF_CHISQ = 1.5;
    private static final double DEFAULT_CLIP_STRAY_FLUX_FRACTION = 0.001;
    private static final int DEFAULT_TINY_FOOTPRINT_SIZE = 2;

    private final EdgeHandling edgeHandling;
    private final StrayFluxPolicy strayFluxToPointSources;
    private final boolean findStrayFlux;
    private final boolean assignStrayFlux;
    private final double clipStrayFluxFraction;
    private final double psfChisq1;
    private final double psfChisq2;
    private final double psfChisq2b;
    private final int maxNumberOfPeaks;
    private final int tinyFootprintSize;
    private final int parallelism;

    private DeblendOptions(Builder builder) {
        this.edgeHandling = builder.edgeHandling;
        this.strayFluxToPointSources = builder.strayFluxToPointSources;
        this.findStrayFlux = builder.findStrayFlux;
        this.assignStrayFlux = builder.assignStrayFlux;
        this.clipStrayFluxFraction = builder.clipStrayFluxFraction;
        this.psfChisq1 = builder.psfChisq1;
        this.psfChisq2 = builder.psfChisq2;
        this.psfChisq2b = builder.psfChisq2b;
        this.maxNumberOfPeaks = builder.maxNumberOfPeaks;
        this.tinyFootprintSize = builder.tinyFootprintSize;
        this.parallelism = builder.parallelism;
    }

    public EdgeHandling getEdgeHandling() {
        return edgeHandling;
    }

    public StrayFluxPolicy getStrayFluxToPointSources() {
        return strayFluxToPointSources;
    }

    public boolean isFindStrayFlux() {
        return findStrayFlux;
    }

    public boolean isAssignStrayFlux() {
        return assignStrayFlux;
    }

    public double getClipStrayFluxFraction() {
        return clipStrayFluxFraction;
    }

    public double getPsfChisq1() {
        return psfChisq1;
    }

    public double getPsfChisq2() {
        return psfChisq2;
    }

    public double getPsfChisq2b() {
        return psfChisq2b;
    }

    public int getMaxNumberOfPeaks() {
        return maxNumberOfPeaks;
    }

    public int getTinyFootprintSize() {
        return tinyFootprintSize;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Returns true if {@code peakCount} exceeds the peak cap. A cap of 0 or less never trips.
     */
    public boolean exceedsPeakCap(int peakCount) {
        return maxNumberOfPeaks > 0 && peakCount > maxNumberOfPeaks;
    }

    /**
     * Derives the knobs passed to the deblender. Assigning stray flux implies finding it,
     * and the edge-handling choice becomes the ramp / patch pair.
     */
    public DeblenderParameters toDeblenderParameters() {
        return new DeblenderParameters(
                psfChisq1,
                psfChisq2,
                psfChisq2b,
                maxNumberOfPeaks,
                strayFluxToPointSources,
                assignStrayFlux,
                assignStrayFlux || findStrayFlux,
                edgeHandling == EdgeHandling.RAMP,
                edgeHandling == EdgeHandling.NOCLIP,
                tinyFootprintSize,
                clipStrayFluxFraction
        );
    }

    /**
     * Creates default options.
     */
    public static DeblendOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with these options.
     */
    public Builder toBuilder() {
        return new Builder()
                .edgeHandling(edgeHandling)
                .strayFluxToPointSources(strayFluxToPointSources)
                .findStrayFlux(findStrayFlux)
                .assignStrayFlux(assignStrayFlux)
                .clipStrayFluxFraction(clipStrayFluxFraction)
                .psfChisq1(psfChisq1)
                .psfChisq2(psfChisq2)
                .psfChisq2b(psfChisq2b)
                .maxNumberOfPeaks(maxNumberOfPeaks)
                .tinyFootprintSize(tinyFootprintSize)
                .parallelism(parallelism);
    }

    public static class Builder {
        private EdgeHandling edgeHandling = EdgeHandling.RAMP;
        private StrayFluxPolicy strayFluxToPointSources = StrayFluxPolicy.NECESSARY;
        private boolean findStrayFlux = true;
        private boolean assignStrayFlux = true;
        private double clipStrayFluxFraction = DEFAULT_CLIP_STRAY_FLUX_FRACTION;
        private double psfChisq1 = DEFAULT_PSF_CHISQ;
        private double psfChisq2 = DEFAULT_PSF_CHISQ;
        private double psfChisq2b = DEFAULT_PSF_CHISQ;
        private int maxNumberOfPeaks = 0;
        private int tinyFootprintSize = DEFAULT_TINY_FOOTPRINT_SIZE;
        private int parallelism = 1;

        public Builder edgeHandling(EdgeHandling edgeHandling) {
            this.edgeHandling = Objects.requireNonNull(edgeHandling, "edgeHandling is required");
            return this;
        }

        public Builder strayFluxToPointSources(StrayFluxPolicy strayFluxToPointSources) {
            this.strayFluxToPointSources = Objects.requireNonNull(strayFluxToPointSources,
                    "strayFluxToPointSources is required");
            return this;
        }

        public Builder findStrayFlux(boolean findStrayFlux) {
            this.findStrayFlux = findStrayFlux;
            return this;
        }

        public Builder assignStrayFlux(boolean assignStrayFlux) {
            this.assignStrayFlux = assignStrayFlux;
            return this;
        }

        public Builder clipStrayFluxFraction(double clipStrayFluxFraction) {
            if (!(clipStrayFluxFraction >= 0.0)) {
                throw new IllegalArgumentException("clipStrayFluxFraction must be >= 0");
            }
            this.clipStrayFluxFraction = clipStrayFluxFraction;
            return this;
        }

        public Builder psfChisq1(double psfChisq1) {
            validateChisq(psfChisq1, "psfChisq1");
            this.psfChisq1 = psfChisq1;
            return this;
        }

        public Builder psfChisq2(double psfChisq2) {
            validateChisq(psfChisq2, "psfChisq2");
            this.psfChisq2 = psfChisq2;
            return this;
        }

        public Builder psfChisq2b(double psfChisq2b) {
            validateChisq(psfChisq2b, "psfChisq2b");
            this.psfChisq2b = psfChisq2b;
            return this;
        }

        /**
         * Only the brightest {@code maxNumberOfPeaks} peaks are deblended; 0 or less is unlimited.
         */
        public Builder maxNumberOfPeaks(int maxNumberOfPeaks) {
            this.maxNumberOfPeaks = maxNumberOfPeaks;
            return this;
        }

        public Builder tinyFootprintSize(int tinyFootprintSize) {
            if (tinyFootprintSize < 0) {
                throw new IllegalArgumentException("tinyFootprintSize must be >= 0");
            }
            this.tinyFootprintSize = tinyFootprintSize;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public DeblendOptions build() {
            return new DeblendOptions(this);
        }

        private void validateChisq(double value, String name) {
            if (!(value > 0.0)) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
        }
    }

    @Override
    public String toString() {
        return "DeblendOptions{" +
                "edgeHandling=" + edgeHandling +
                ", strayFluxToPointSources=" + strayFluxToPointSources +
                ", findStrayFlux=" + findStrayFlux +
                ", assignStrayFlux=" + assignStrayFlux +
                ", clipStrayFluxFraction=" + clipStrayFluxFraction +
                ", psfChisq1=" + psfChisq1 +
                ", psfChisq2=" + psfChisq2 +
                ", psfChisq2b=" + psfChisq2b +
                ", maxNumberOfPeaks=" + maxNumberOfPeaks +
                ", tinyFootprintSize=" + tinyFootprintSize +
                ", parallelism=" + parallelism +
                '}';
    }
}
