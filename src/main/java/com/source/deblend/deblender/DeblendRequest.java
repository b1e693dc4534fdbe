package com.source.deblend.deblender;

import com.source.deblend.core.model.Footprint;
import com.source.deblend.image.MaskedImage;
import com.source.deblend.psf.Psf;

import java.util.Objects;

/**
 * Everything the deblender needs to split one footprint.
 *
 * @param footprint  parent footprint with two or more peaks
 * @param image      image, mask and variance planes
 * @param psf        PSF model
 * @param psfFwhm    PSF full width at half maximum in pixels
 * @param sigma1     per-pixel noise level of the image
 * @param parameters algorithm knobs
 */
public record DeblendRequest(
        Footprint footprint,
        MaskedImage image,
        Psf psf,
        double psfFwhm,
        double sigma1,
        DeblenderParameters parameters
) {
    public DeblendRequest {
        Objects.requireNonNull(footprint, "footprint is required");
        Objects.requireNonNull(image, "image is required");
        Objects.requireNonNull(psf, "psf is required");
        Objects.requireNonNull(parameters, "parameters is required");
    }
}
