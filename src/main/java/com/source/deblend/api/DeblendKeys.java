package com.source.deblend.api;

import com.source.deblend.catalog.Key;
import com.source.deblend.catalog.Schema;
import com.source.deblend.core.model.Point2D;

/**
 * Catalog fields written by the deblender.
 * Obtain through {@link #register(Schema)} before any catalog using the schema is deblended.
 */
public final class DeblendKeys {

    public static final String NCHILD = "deblend.nchild";
    public static final String DEBLENDED_AS_PSF = "deblend.deblended-as-psf";
    public static final String PSF_CENTER = "deblend.psf-center";
    public static final String PSF_FLUX = "deblend.psf-flux";
    public static final String TOO_MANY_PEAKS = "deblend.too-many-peaks";
    public static final String FAILED = "deblend.failed";
    public static final String SKIPPED = "deblend.skipped";
    public static final String RAMPED_TEMPLATE = "deblend.ramped_template";
    public static final String PATCHED_TEMPLATE = "deblend.patched_template";
    public static final String HAS_STRAY_FLUX = "deblend.has_stray_flux";

    private final Schema schema;
    private final Key<Integer> nChild;
    private final Key<Boolean> deblendedAsPsf;
    private final Key<Point2D> psfCenter;
    private final Key<Double> psfFlux;
    private final Key<Boolean> tooManyPeaks;
    private final Key<Boolean> failed;
    private final Key<Boolean> skipped;
    private final Key<Boolean> rampedTemplate;
    private final Key<Boolean> patchedTemplate;
    private final Key<Boolean> hasStrayFlux;

    private DeblendKeys(Schema schema) {
        this.schema = schema;
        this.nChild = schema.addInt(NCHILD, "Number of children this object has (defaults to 0)");
        this.deblendedAsPsf = schema.addFlag(DEBLENDED_AS_PSF, "Deblender thought this source looked like a PSF");
        this.psfCenter = schema.addPoint(PSF_CENTER, "If deblended-as-psf, the PSF centroid");
        this.psfFlux = schema.addDouble(PSF_FLUX, "If deblended-as-psf, the PSF flux");
        this.tooManyPeaks = schema.addFlag(TOO_MANY_PEAKS,
                "Source had too many peaks; only the brightest were included");
        this.failed = schema.addFlag(FAILED, "Deblending failed on source");
        this.skipped = schema.addFlag(SKIPPED, "Deblender skipped this source");
        this.rampedTemplate = schema.addFlag(RAMPED_TEMPLATE,
                "This source was near an image edge and the deblender used \"ramp\" edge-handling.");
        this.patchedTemplate = schema.addFlag(PATCHED_TEMPLATE,
                "This source was near an image edge and the deblender used \"patched\" edge-handling.");
        this.hasStrayFlux = schema.addFlag(HAS_STRAY_FLUX, "This source was assigned some stray flux");
    }

    /**
     * Adds the deblend fields to {@code schema}, reusing any that are already registered.
     */
    public static DeblendKeys register(Schema schema) {
        return new DeblendKeys(schema);
    }

    public Schema getSchema() {
        return schema;
    }

    public Key<Integer> nChild() {
        return nChild;
    }

    public Key<Boolean> deblendedAsPsf() {
        return deblendedAsPsf;
    }

    public Key<Point2D> psfCenter() {
        return psfCenter;
    }

    public Key<Double> psfFlux() {
        return psfFlux;
    }

    public Key<Boolean> tooManyPeaks() {
        return tooManyPeaks;
    }

    public Key<Boolean> failed() {
        return failed;
    }

    public Key<Boolean> skipped() {
        return skipped;
    }

    public Key<Boolean> rampedTemplate() {
        return rampedTemplate;
    }

    public Key<Boolean> patchedTemplate() {
        return patchedTemplate;
    }

    public Key<Boolean> hasStrayFlux() {
        return hasStrayFlux;
    }

    @Override
    public String toString() {
        return "DeblendKeys{" + nChild + ", " + deblendedAsPsf + ", " + psfCenter + ", "
                + psfFlux + ", " + tooManyPeaks + '}';
    }
}
