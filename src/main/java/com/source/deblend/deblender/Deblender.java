package com.source.deblend.deblender;

/**
 * Template deblending routine: splits one multi-peak footprint into per-peak flux portions.
 *
 * Implementations should signal failure by throwing {@link DeblendException}; the
 * orchestrator contains any exception to the footprint being processed.
 * Implementations must be safe for concurrent calls when used with parallelism above 1.
 */
@FunctionalInterface
public interface Deblender {

    DeblendResult deblend(DeblendRequest request);
}
