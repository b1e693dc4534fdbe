package com.source.deblend.deblender;

import java.util.Objects;

/**
 * Algorithm knobs handed to the {@link Deblender} for every footprint.
 *
 * @param psfChisqCut1          chi-squared/DOF cut for the un-shifted PSF test
 * @param psfChisqCut2          chi-squared/DOF cut for the shifted PSF test
 * @param psfChisqCut2b         chi-squared/DOF cut for the second shifted PSF test
 * @param maxNumberOfPeaks      only the brightest peaks up to this count are deblended; {@code <= 0} is unlimited
 * @param strayFluxToPointSources when stray flux may go to point-source children
 * @param assignStrayFlux       apportion unclaimed flux to children
 * @param findStrayFlux         search for unclaimed flux
 * @param rampFluxAtEdge        ramp templates down at the image edge using the PSF
 * @param patchEdges            ignore the edge when building symmetric templates
 * @param tinyFootprintSize     footprints narrower or shorter than this are ignored; 0 never ignores
 * @param clipStrayFluxFraction stray-flux fractions below this are set to zero
 */
public record DeblenderParameters(
        double psfChisqCut1,
        double psfChisqCut2,
        double psfChisqCut2b,
        int maxNumberOfPeaks,
        StrayFluxPolicy strayFluxToPointSources,
        boolean assignStrayFlux,
        boolean findStrayFlux,
        boolean rampFluxAtEdge,
        boolean patchEdges,
        int tinyFootprintSize,
        double clipStrayFluxFraction
) {
    public DeblenderParameters {
        Objects.requireNonNull(strayFluxToPointSources, "strayFluxToPointSources is required");
        if (rampFluxAtEdge && patchEdges) {
            throw new IllegalArgumentException("rampFluxAtEdge and patchEdges are mutually exclusive");
        }
    }

    public boolean isPeakCountLimited() {
        return maxNumberOfPeaks > 0;
    }
}
