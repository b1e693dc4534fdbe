package com.source.deblend.deblender;

import com.source.deblend.core.model.Footprint;
import com.source.deblend.core.model.HeavyFootprint;
import com.source.deblend.core.model.Point2D;

import java.util.Optional;

/**
 * What the deblender produced for one peak.
 *
 * A peak yields a child only when it is not skipped and carries a flux portion.
 * The flux portion can be absent without the skip flag, for instance for peaks
 * past the {@code maxNumberOfPeaks} cap.
 */
public final class PeakOutcome {

    private final boolean skip;
    private final HeavyFootprint fluxPortion;
    private final boolean deblendedAsPsf;
    private final Point2D psfFitCenter;
    private final double psfFitFlux;
    private final boolean rampedTemplate;
    private final boolean patched;
    private final Footprint strayFlux;

    private PeakOutcome(Builder builder) {
        this.skip = builder.skip;
        this.fluxPortion = builder.fluxPortion;
        this.deblendedAsPsf = builder.deblendedAsPsf;
        this.psfFitCenter = builder.psfFitCenter;
        this.psfFitFlux = builder.psfFitFlux;
        this.rampedTemplate = builder.rampedTemplate;
        this.patched = builder.patched;
        this.strayFlux = builder.strayFlux;
        if (deblendedAsPsf && psfFitCenter == null) {
            throw new IllegalArgumentException("psfFitCenter is required when deblendedAsPsf is set");
        }
    }

    public boolean isSkip() {
        return skip;
    }

    public Optional<HeavyFootprint> getFluxPortion() {
        return Optional.ofNullable(fluxPortion);
    }

    public boolean isDeblendedAsPsf() {
        return deblendedAsPsf;
    }

    /**
     * PSF fit centroid; meaningful only when {@link #isDeblendedAsPsf()}.
     */
    public Point2D getPsfFitCenter() {
        return psfFitCenter;
    }

    /**
     * PSF fit flux; meaningful only when {@link #isDeblendedAsPsf()}.
     */
    public double getPsfFitFlux() {
        return psfFitFlux;
    }

    public boolean hasRampedTemplate() {
        return rampedTemplate;
    }

    public boolean isPatched() {
        return patched;
    }

    public Optional<Footprint> getStrayFlux() {
        return Optional.ofNullable(strayFlux);
    }

    public boolean hasStrayFlux() {
        return strayFlux != null;
    }

    /**
     * Outcome for a peak the deblender declined to materialise.
     */
    public static PeakOutcome skipped() {
        return builder().skip(true).build();
    }

    /**
     * Outcome of a peak that was not given a flux portion.
     */
    public static PeakOutcome withoutFluxPortion() {
        return builder().build();
    }

    /**
     * Plain extended child with the given flux portion.
     */
    public static PeakOutcome of(HeavyFootprint fluxPortion) {
        return builder().fluxPortion(fluxPortion).build();
    }

    @Override
    public String toString() {
        return "PeakOutcome{" +
                "skip=" + skip +
                ", fluxPortion=" + (fluxPortion != null) +
                ", deblendedAsPsf=" + deblendedAsPsf +
                ", ramped=" + rampedTemplate +
                ", patched=" + patched +
                ", strayFlux=" + (strayFlux != null) +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean skip;
        private HeavyFootprint fluxPortion;
        private boolean deblendedAsPsf;
        private Point2D psfFitCenter;
        private double psfFitFlux = Double.NaN;
        private boolean rampedTemplate;
        private boolean patched;
        private Footprint strayFlux;

        public Builder skip(boolean skip) {
            this.skip = skip;
            return this;
        }

        public Builder fluxPortion(HeavyFootprint fluxPortion) {
            this.fluxPortion = fluxPortion;
            return this;
        }

        /**
         * Marks the peak as PSF-like with the fitted centroid and flux.
         */
        public Builder psfFit(Point2D center, double flux) {
            this.deblendedAsPsf = true;
            this.psfFitCenter = center;
            this.psfFitFlux = flux;
            return this;
        }

        public Builder rampedTemplate(boolean rampedTemplate) {
            this.rampedTemplate = rampedTemplate;
            return this;
        }

        public Builder patched(boolean patched) {
            this.patched = patched;
            return this;
        }

        public Builder strayFlux(Footprint strayFlux) {
            this.strayFlux = strayFlux;
            return this;
        }

        public PeakOutcome build() {
            return new PeakOutcome(this);
        }
    }
}
