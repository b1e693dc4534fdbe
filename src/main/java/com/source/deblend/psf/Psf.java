package com.source.deblend.psf;

import com.source.deblend.core.model.Box2I;

/**
 * Point-spread-function model. Only the shape query is needed to drive deblending;
 * the model itself is passed through to the {@link com.source.deblend.deblender.Deblender}.
 */
public interface Psf {

    /**
     * Returns the PSF shape evaluated over {@code bbox}.
     * Spatially constant models may ignore the box.
     */
    PsfShape computeShape(Box2I bbox);
}
