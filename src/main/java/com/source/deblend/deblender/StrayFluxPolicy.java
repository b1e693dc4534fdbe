package com.source.deblend.deblender;

/**
 * When stray flux may be attributed to children that look like point sources.
 */
public enum StrayFluxPolicy {
    /** Only when the footprint holds no extended child. */
    NECESSARY,
    ALWAYS,
    /** Never; if every peak looks like a point source, stray flux is left unassigned. */
    NEVER
}
