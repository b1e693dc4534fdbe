package com.source.deblend.api;

import com.source.deblend.catalog.SourceCatalog;
import com.source.deblend.catalog.SourceRecord;
import com.source.deblend.core.model.Footprint;
import com.source.deblend.image.MaskedImage;
import com.source.deblend.psf.Psf;

/**
 * Inputs for deblending one parent, as seen by {@link PreDeblendHook} and {@link PostDeblendHook}.
 *
 * @param image     image being processed
 * @param catalog   catalog being processed
 * @param index     position of the parent in the catalog
 * @param source    the parent record
 * @param footprint footprint handed to the deblender
 * @param psf       PSF model
 * @param psfFwhm   PSF full width at half maximum at the footprint
 * @param sigma1    noise level of the image
 */
public record DeblendContext(
        MaskedImage image,
        SourceCatalog catalog,
        int index,
        SourceRecord source,
        Footprint footprint,
        Psf psf,
        double psfFwhm,
        double sigma1
) {
    public DeblendContext withFootprint(Footprint footprint) {
        return new DeblendContext(image, catalog, index, source, footprint, psf, psfFwhm, sigma1);
    }

    public DeblendContext withPsfFwhm(double psfFwhm) {
        return new DeblendContext(image, catalog, index, source, footprint, psf, psfFwhm, sigma1);
    }

    public DeblendContext withSigma1(double sigma1) {
        return new DeblendContext(image, catalog, index, source, footprint, psf, psfFwhm, sigma1);
    }
}
