package com.source.deblend.image;

import com.source.deblend.core.model.Box2I;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MedianNoiseEstimator Tests")
class MedianNoiseEstimatorTest {

    private static final Box2I BOX = new Box2I(0, 0, 2, 1);

    @Test
    @DisplayName("Uniform variance gives its square root")
    void uniformVariance() {
        MaskedImage image = MaskedImage.uniform(10, 10, 5f, 9f);

        assertEquals(3.0, new MedianNoiseEstimator().estimate(image), 1e-12);
    }

    @Test
    @DisplayName("Median is robust to a few outliers")
    void robustToOutliers() {
        float[] variance = {4f, 4f, 4f, 4f, 1e6f, 1e6f};
        MaskedImage image = new MaskedImage(BOX, new float[6], null, variance);

        assertEquals(2.0, new MedianNoiseEstimator().estimate(image), 1e-12);
    }

    @Test
    @DisplayName("Masked pixels are excluded when their bits intersect the bad mask")
    void maskedPixelsExcluded() {
        float[] variance = {100f, 100f, 100f, 16f, 16f, 16f};
        int[] mask = {0x1, 0x1, 0x1, 0x0, 0x2, 0x0};
        MaskedImage image = new MaskedImage(BOX, new float[6], mask, variance);

        assertEquals(4.0, new MedianNoiseEstimator(0x1).estimate(image), 1e-12);
        // default bad mask keeps every pixel: median of {16,16,16,100,100,100} is 58
        assertEquals(Math.sqrt(58.0), new MedianNoiseEstimator().estimate(image), 1e-12);
    }

    @Test
    @DisplayName("Non-finite variances are ignored")
    void nonFiniteIgnored() {
        float[] variance = {Float.NaN, Float.POSITIVE_INFINITY, 25f, 25f, 25f, Float.NaN};
        MaskedImage image = new MaskedImage(BOX, new float[6], null, variance);

        assertEquals(5.0, new MedianNoiseEstimator().estimate(image), 1e-12);
    }

    @Test
    @DisplayName("No usable pixel gives NaN")
    void noUsablePixel() {
        int[] mask = {1, 1, 1, 1, 1, 1};
        MaskedImage image = new MaskedImage(BOX, new float[6], mask, new float[6]);

        assertTrue(Double.isNaN(new MedianNoiseEstimator(1).estimate(image)));
    }

    @Test
    @DisplayName("Plane sizes must match the bounding box")
    void planeSizeChecked() {
        assertThrows(IllegalArgumentException.class,
                () -> new MaskedImage(BOX, new float[5], null, new float[6]));
        assertThrows(NullPointerException.class,
                () -> new MaskedImage(BOX, new float[6], null, null));
    }
}
