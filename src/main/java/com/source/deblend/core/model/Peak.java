package com.source.deblend.core.model;

/**
 * Local intensity maximum inside a footprint.
 *
 * @param ix    integer column of the peak pixel
 * @param iy    integer row of the peak pixel
 * @param value image value at the peak
 */
public record Peak(int ix, int iy, double value) {
}
