package com.source.deblend.api;

import com.source.deblend.core.model.Box2I;
import com.source.deblend.core.model.Footprint;
import com.source.deblend.core.model.HeavyFootprint;
import com.source.deblend.core.model.Peak;
import com.source.deblend.deblender.DeblendResult;
import com.source.deblend.deblender.PeakOutcome;
import com.source.deblend.image.MaskedImage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared builders for deblending tests.
 */
final class DeblendFixtures {

    private DeblendFixtures() {
    }

    /**
     * 100x100 image, value 0, variance 4 (noise sigma 2).
     */
    static MaskedImage image() {
        return MaskedImage.uniform(100, 100, 0f, 4f);
    }

    /**
     * Square footprint of side 10 at (x0, y0) with {@code peaks} peaks on its diagonal.
     */
    static Footprint footprint(int x0, int y0, int peaks) {
        List<Peak> list = new ArrayList<>();
        for (int i = 0; i < peaks; i++) {
            list.add(new Peak(x0 + 1 + 2 * i, y0 + 1 + 2 * i, 100.0 - i));
        }
        return Footprint.ofBox(new Box2I(x0, y0, x0 + 9, y0 + 9), list);
    }

    /**
     * Flux portion covering {@code parent} with every pixel set to {@code value}.
     */
    static HeavyFootprint portion(Footprint parent, float value) {
        float[] values = new float[parent.getArea()];
        Arrays.fill(values, value);
        return new HeavyFootprint(parent, values);
    }

    /**
     * Result with one plain child per peak.
     */
    static DeblendResult allChildren(Footprint parent) {
        List<PeakOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < parent.getPeakCount(); i++) {
            outcomes.add(PeakOutcome.of(portion(parent, i + 1)));
        }
        return new DeblendResult(outcomes);
    }
}
