package com.source.deblend.api;

/**
 * What the deblender does when a peak lies close to the image edge.
 */
public enum EdgeHandling {
    /** Clip the template at the edge and at the mirror of the edge. */
    CLIP,
    /** Ramp flux down at the image edge using the PSF. */
    RAMP,
    /** Ignore the edge when building the symmetric template. */
    NOCLIP
}
