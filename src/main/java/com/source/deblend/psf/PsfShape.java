package com.source.deblend.psf;

/**
 * Second-moment (quadrupole) description of a PSF.
 *
 * @param ixx second moment in x
 * @param iyy second moment in y
 * @param ixy cross moment
 */
public record PsfShape(double ixx, double iyy, double ixy) {

    public PsfShape {
        if (ixx < 0 || iyy < 0) {
            throw new IllegalArgumentException("Second moments must be non-negative");
        }
    }

    /**
     * Circular shape of Gaussian width {@code sigma}.
     */
    public static PsfShape circular(double sigma) {
        double s2 = sigma * sigma;
        return new PsfShape(s2, s2, 0.0);
    }

    public double getDeterminant() {
        return ixx * iyy - ixy * ixy;
    }

    /**
     * Fourth root of the moment-matrix determinant; equals sigma for a circular Gaussian.
     */
    public double getDeterminantRadius() {
        return Math.pow(getDeterminant(), 0.25);
    }

    /**
     * Square root of the mean of the second moments.
     */
    public double getTraceRadius() {
        return Math.sqrt(0.5 * (ixx + iyy));
    }
}
