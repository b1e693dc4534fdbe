package com.source.deblend.api;

import com.source.deblend.deblender.DeblenderParameters;
import com.source.deblend.deblender.StrayFluxPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeblendOptions Tests")
class DeblendOptionsTest {

    @Test
    @DisplayName("Defaults match the standard deblender configuration")
    void defaults() {
        DeblendOptions options = DeblendOptions.defaults();

        assertEquals(EdgeHandling.RAMP, options.getEdgeHandling());
        assertEquals(StrayFluxPolicy.NECESSARY, options.getStrayFluxToPointSources());
        assertTrue(options.isFindStrayFlux());
        assertTrue(options.isAssignStrayFlux());
        assertEquals(0.001, options.getClipStrayFluxFraction());
        assertEquals(1.5, options.getPsfChisq1());
        assertEquals(1.5, options.getPsfChisq2());
        assertEquals(1.5, options.getPsfChisq2b());
        assertEquals(0, options.getMaxNumberOfPeaks());
        assertEquals(2, options.getTinyFootprintSize());
        assertEquals(1, options.getParallelism());
    }

    @ParameterizedTest
    @CsvSource({
            "CLIP, false, false",
            "RAMP, true, false",
            "NOCLIP, false, true"
    })
    @DisplayName("Edge handling maps to the ramp / patch pair")
    void edgeHandlingMapping(EdgeHandling edgeHandling, boolean ramp, boolean patch) {
        DeblenderParameters params = DeblendOptions.builder()
                .edgeHandling(edgeHandling)
                .build()
                .toDeblenderParameters();

        assertEquals(ramp, params.rampFluxAtEdge());
        assertEquals(patch, params.patchEdges());
    }

    @ParameterizedTest
    @CsvSource({
            "true, false, true",
            "true, true, true",
            "false, true, true",
            "false, false, false"
    })
    @DisplayName("Assigning stray flux implies finding it")
    void assignImpliesFind(boolean assign, boolean find, boolean expectedFind) {
        DeblenderParameters params = DeblendOptions.builder()
                .assignStrayFlux(assign)
                .findStrayFlux(find)
                .build()
                .toDeblenderParameters();

        assertEquals(assign, params.assignStrayFlux());
        assertEquals(expectedFind, params.findStrayFlux());
    }

    @Test
    @DisplayName("Remaining knobs pass through unchanged")
    void knobsPassThrough() {
        DeblenderParameters params = DeblendOptions.builder()
                .psfChisq1(1.1).psfChisq2(1.2).psfChisq2b(1.3)
                .maxNumberOfPeaks(7)
                .strayFluxToPointSources(StrayFluxPolicy.NEVER)
                .tinyFootprintSize(0)
                .clipStrayFluxFraction(0.05)
                .build()
                .toDeblenderParameters();

        assertEquals(1.1, params.psfChisqCut1());
        assertEquals(1.2, params.psfChisqCut2());
        assertEquals(1.3, params.psfChisqCut2b());
        assertEquals(7, params.maxNumberOfPeaks());
        assertTrue(params.isPeakCountLimited());
        assertEquals(StrayFluxPolicy.NEVER, params.strayFluxToPointSources());
        assertEquals(0, params.tinyFootprintSize());
        assertEquals(0.05, params.clipStrayFluxFraction());
    }

    @ParameterizedTest
    @CsvSource({
            "0, 50, false",
            "-1, 50, false",
            "2, 2, false",
            "2, 3, true"
    })
    @DisplayName("Peak cap trips only when positive and exceeded")
    void peakCap(int cap, int peaks, boolean exceeded) {
        assertEquals(exceeded, DeblendOptions.builder().maxNumberOfPeaks(cap).build().exceedsPeakCap(peaks));
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().psfChisq1(0.0));
        assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().psfChisq2(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().clipStrayFluxFraction(-0.1));
        assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().tinyFootprintSize(-1));
        assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().parallelism(0));
        assertThrows(NullPointerException.class, () -> DeblendOptions.builder().edgeHandling(null));
    }

    @Test
    @DisplayName("toBuilder copies every option")
    void toBuilderCopies() {
        DeblendOptions original = DeblendOptions.builder()
                .edgeHandling(EdgeHandling.CLIP)
                .maxNumberOfPeaks(4)
                .parallelism(3)
                .build();

        assertEquals(original.toString(), original.toBuilder().build().toString());
    }
}
