package com.source.deblend.image;

/**
 * Estimates a single per-pixel noise level (standard deviation) for an image.
 */
@FunctionalInterface
public interface NoiseEstimator {

    /**
     * @return the noise sigma, or {@code NaN} if no pixel is usable
     */
    double estimate(MaskedImage image);
}
