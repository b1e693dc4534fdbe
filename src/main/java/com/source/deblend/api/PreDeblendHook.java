package com.source.deblend.api;

/**
 * Called for each parent right before the deblender runs.
 *
 * The returned context is what the deblender receives, so a hook may replace the
 * footprint, PSF width or noise level. An exception thrown here is handled like
 * a deblender failure: the parent is flagged failed and the run continues.
 * With parallelism above 1 the hook is called from worker threads.
 */
@FunctionalInterface
public interface PreDeblendHook {

    DeblendContext beforeDeblend(DeblendContext context);

    /**
     * A hook that passes the context through unchanged.
     */
    PreDeblendHook NOOP = context -> context;
}
