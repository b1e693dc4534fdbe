package com.source.deblend.api;

import com.source.deblend.core.model.Peak;

/**
 * A peak of a deblended parent that produced no child, and why.
 *
 * @param peakIndex index into the parent's peak list
 * @param peak      the peak, or null when the deblender returned more outcomes than peaks
 * @param reason    why no child was created
 */
public record PeakSkip(int peakIndex, Peak peak, Reason reason) {

    public enum Reason {
        /** The deblender flagged the peak as skipped (e.g. out of bounds). */
        SKIPPED_BY_DEBLENDER,
        /** The peak has no flux portion, typically past the peak cap. */
        NO_FLUX_PORTION
    }
}
