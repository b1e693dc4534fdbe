package com.source.deblend.psf;

import com.source.deblend.core.model.Box2I;

/**
 * Spatially constant circular Gaussian PSF.
 */
public class GaussianPsf implements Psf {

    private final double sigma;
    private final PsfShape shape;

    public GaussianPsf(double sigma) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("sigma must be > 0");
        }
        this.sigma = sigma;
        this.shape = PsfShape.circular(sigma);
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public PsfShape computeShape(Box2I bbox) {
        return shape;
    }

    @Override
    public String toString() {
        return "GaussianPsf{sigma=" + sigma + '}';
    }
}
