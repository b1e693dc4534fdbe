package com.source.deblend.image;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Noise estimate as the square root of the median variance.
 *
 * Pixels whose mask intersects {@code badMask}, or whose variance is not finite,
 * are left out of the median. The default bad mask is 0, so every finite pixel counts.
 */
public class MedianNoiseEstimator implements NoiseEstimator {
    private static final Logger log = LoggerFactory.getLogger(MedianNoiseEstimator.class);

    private final int badMask;

    public MedianNoiseEstimator() {
        this(0);
    }

    public MedianNoiseEstimator(int badMask) {
        this.badMask = badMask;
    }

    public int getBadMask() {
        return badMask;
    }

    @Override
    public double estimate(MaskedImage image) {
        int n = image.getPixelCount();
        double[] usable = new double[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            float v = image.varianceAt(i);
            if ((image.maskAt(i) & badMask) != 0 || !Float.isFinite(v)) {
                continue;
            }
            usable[count++] = v;
        }
        if (count == 0) {
            log.warn("noise.estimate no usable variance pixels among {} (badMask=0x{})",
                    n, Integer.toHexString(badMask));
            return Double.NaN;
        }

        double median = new Median().evaluate(Arrays.copyOf(usable, count));
        double sigma = Math.sqrt(median);
        log.debug("noise.estimate medianVariance={} sigma={} pixels={}", median, sigma, count);
        return sigma;
    }
}
