package com.source.deblend.deblender;

import java.util.List;

/**
 * Per-peak outcomes for one footprint, index-aligned with the footprint's peak list.
 */
public record DeblendResult(List<PeakOutcome> peaks) {

    public DeblendResult {
        peaks = peaks != null ? List.copyOf(peaks) : List.of();
    }

    public static DeblendResult of(PeakOutcome... peaks) {
        return new DeblendResult(List.of(peaks));
    }

    public int size() {
        return peaks.size();
    }
}
