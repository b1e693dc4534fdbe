package com.source.deblend.api;

import com.source.deblend.catalog.SourceCatalog;
import com.source.deblend.catalog.SourceRecord;
import com.source.deblend.core.model.HeavyFootprint;
import com.source.deblend.core.model.Peak;
import com.source.deblend.deblender.DeblendResult;
import com.source.deblend.deblender.PeakOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a deblender result into child records of the parent.
 *
 * A peak yields a child only if it is neither skipped nor missing its flux portion.
 * {@code deblend.skipped} on the parent is rewritten for every peak examined, so it
 * reflects the last one; the full per-peak detail is in {@link Mapping#skippedPeaks()}.
 */
public class ResultMapper {
    private static final Logger log = LoggerFactory.getLogger(ResultMapper.class);

    private final DeblendKeys keys;

    public ResultMapper(DeblendKeys keys) {
        this.keys = keys;
    }

    /**
     * Appends the children of {@code parent} to {@code catalog} and writes {@code deblend.nchild}.
     *
     * @param peaks the peak list the deblender was given, index-aligned with {@code result}
     */
    public Mapping map(SourceCatalog catalog, SourceRecord parent, List<Peak> peaks, DeblendResult result) {
        List<PeakOutcome> outcomes = result.peaks();
        List<SourceRecord> children = new ArrayList<>();
        List<PeakSkip> skipped = new ArrayList<>();

        if (outcomes.size() != peaks.size()) {
            log.debug("Parent {}: deblender returned {} outcomes for {} peaks",
                    parent.getId(), outcomes.size(), peaks.size());
        }

        for (int j = 0; j < outcomes.size(); j++) {
            PeakOutcome outcome = outcomes.get(j);
            Peak peak = j < peaks.size() ? peaks.get(j) : null;

            if (outcome.isSkip()) {
                log.debug("Skipping out-of-bounds peak at {}", describe(peak));
                parent.set(keys.skipped(), true);
                skipped.add(new PeakSkip(j, peak, PeakSkip.Reason.SKIPPED_BY_DEBLENDER));
                continue;
            }

            Optional<HeavyFootprint> heavy = outcome.getFluxPortion();
            if (heavy.isEmpty()) {
                log.debug("Skipping peak at {}, child {} of {}: no flux portion",
                        describe(peak), j + 1, outcomes.size());
                parent.set(keys.skipped(), true);
                skipped.add(new PeakSkip(j, peak, PeakSkip.Reason.NO_FLUX_PORTION));
                continue;
            }

            parent.set(keys.skipped(), false);

            SourceRecord child = catalog.addNew();
            child.setParent(parent.getId());
            child.setFootprint(heavy.get());
            child.set(keys.deblendedAsPsf(), outcome.isDeblendedAsPsf());
            child.set(keys.hasStrayFlux(), outcome.hasStrayFlux());
            if (outcome.isDeblendedAsPsf()) {
                child.set(keys.psfCenter(), outcome.getPsfFitCenter());
                child.set(keys.psfFlux(), outcome.getPsfFitFlux());
            }
            child.set(keys.rampedTemplate(), outcome.hasRampedTemplate());
            child.set(keys.patchedTemplate(), outcome.isPatched());
            children.add(child);
        }

        parent.set(keys.nChild(), children.size());
        return new Mapping(children, skipped);
    }

    private static String describe(Peak peak) {
        return peak == null ? "(unknown)" : "(" + peak.ix() + "," + peak.iy() + ")";
    }

    /**
     * Children created for one parent and the peaks that produced none.
     */
    public record Mapping(List<SourceRecord> children, List<PeakSkip> skippedPeaks) {
        public Mapping {
            children = List.copyOf(children);
            skippedPeaks = List.copyOf(skippedPeaks);
        }

        public List<Long> childIds() {
            return children.stream().map(SourceRecord::getId).toList();
        }
    }
}
