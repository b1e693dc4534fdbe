package com.source.deblend.api;

import java.util.List;

/**
 * Outcome of deblending one parent source: either it was split into children
 * or the deblender failed on it. Exactly one outcome exists per candidate.
 */
public interface DeblendOutcome {

    long sourceId();

    /**
     * Position of the parent in the catalog at run time.
     */
    int index();

    int peakCount();

    boolean isSuccess();

    /**
     * The parent was deblended; {@code childIds} may be empty when every peak was skipped.
     */
    record Deblended(
            long sourceId,
            int index,
            int peakCount,
            List<Long> childIds,
            List<PeakSkip> skippedPeaks
    ) implements DeblendOutcome {
        public Deblended {
            childIds = childIds != null ? List.copyOf(childIds) : List.of();
            skippedPeaks = skippedPeaks != null ? List.copyOf(skippedPeaks) : List.of();
        }

        public int nChild() {
            return childIds.size();
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * The deblender (or a pre-deblend hook) threw; the parent is flagged {@code deblend.failed}.
     */
    record Failed(
            long sourceId,
            int index,
            int peakCount,
            String message,
            Throwable cause
    ) implements DeblendOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
