package com.source.deblend.api;

import com.source.deblend.deblender.StrayFluxPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeblendOptionsLoader Tests")
class DeblendOptionsLoaderTest {

    private final DeblendOptionsLoader loader = new DeblendOptionsLoader();

    @Test
    @DisplayName("Empty object gives defaults")
    void emptyObjectDefaults() {
        assertEquals(DeblendOptions.defaults().toString(), loader.load("{}").toString());
    }

    @Test
    @DisplayName("Values override defaults; enums are case-insensitive")
    void overrides() {
        DeblendOptions options = loader.load("""
                {"edgeHandling": "Clip", "strayFluxToPointSources": "never",
                 "maxNumberOfPeaks": 5, "clipStrayFluxFraction": 0.01, "assignStrayFlux": false}
                """);

        assertEquals(EdgeHandling.CLIP, options.getEdgeHandling());
        assertEquals(StrayFluxPolicy.NEVER, options.getStrayFluxToPointSources());
        assertEquals(5, options.getMaxNumberOfPeaks());
        assertEquals(0.01, options.getClipStrayFluxFraction());
        assertFalse(options.isAssignStrayFlux());
        assertEquals(1.5, options.getPsfChisq1());
    }

    @Test
    @DisplayName("Loads from a classpath resource")
    void loadsResource() {
        DeblendOptions options = loader.loadResource("deblend-options.json");

        assertEquals(EdgeHandling.NOCLIP, options.getEdgeHandling());
        assertEquals(StrayFluxPolicy.ALWAYS, options.getStrayFluxToPointSources());
        assertEquals(10, options.getMaxNumberOfPeaks());
        assertEquals(0, options.getTinyFootprintSize());
        assertEquals(2.0, options.getPsfChisq1());
        assertEquals(2, options.getParallelism());
        assertTrue(options.toDeblenderParameters().findStrayFlux());
        assertTrue(options.toDeblenderParameters().patchEdges());
    }

    @Test
    @DisplayName("Loads from an input stream")
    void loadsStream() {
        DeblendOptions options = loader.load(new ByteArrayInputStream(
                "{\"parallelism\": 4}".getBytes(StandardCharsets.UTF_8)));

        assertEquals(4, options.getParallelism());
    }

    @Test
    @DisplayName("Unknown keys, bad types and bad values are rejected")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> loader.load("{\"edgeHandlng\": \"ramp\"}"));
        assertThrows(IllegalArgumentException.class, () -> loader.load("{\"edgeHandling\": \"wrap\"}"));
        assertThrows(IllegalArgumentException.class, () -> loader.load("{\"maxNumberOfPeaks\": 2.5}"));
        assertThrows(IllegalArgumentException.class, () -> loader.load("{\"findStrayFlux\": \"yes\"}"));
        assertThrows(IllegalArgumentException.class, () -> loader.load("{\"psfChisq1\": -1}"));
        assertThrows(IllegalArgumentException.class, () -> loader.load("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> loader.load("{not json"));
        assertThrows(IllegalArgumentException.class, () -> loader.loadResource("missing.json"));
    }
}
