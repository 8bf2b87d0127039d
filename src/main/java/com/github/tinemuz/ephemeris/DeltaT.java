/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.tinemuz.ephemeris;

/**
 * Difference between terrestrial (dynamical) time and universal time.
 *
 * <p>Uses the piecewise polynomial fits published by Espenak and Meeus, one
 * polynomial per historical era. Outside 500 BCE .. 2150 CE the long-term
 * parabola of Morrison and Stephenson takes over.</p>
 */
public final class DeltaT {

    private DeltaT() {}

    /**
     * Delta-T in seconds for the given universal time.
     *
     * @param ut universal time in days since J2000 (2000-01-01T12:00Z)
     * @return TT - UT in seconds
     */
    public static double seconds(double ut) {
        double y = 2000.0 + (ut - 14.0) / AstroConstants.DAYS_PER_TROPICAL_YEAR;
        double u;

        if (y < -500.0) {
            u = (y - 1820.0) / 100.0;
            return -20.0 + 32.0 * u * u;
        }
        if (y < 500.0) {
            u = y / 100.0;
            return 10583.6 + u * (-1014.41 + u * (33.78311 + u * (-5.952053
                    + u * (-0.1798452 + u * (0.022174192 + u * 0.0090316521)))));
        }
        if (y < 1600.0) {
            u = (y - 1000.0) / 100.0;
            return 1574.2 + u * (-556.01 + u * (71.23472 + u * (0.319781
                    + u * (-0.8503463 + u * (-0.005050998 + u * 0.0083572073)))));
        }
        if (y < 1700.0) {
            u = y - 1600.0;
            return 120.0 + u * (-0.9808 + u * (-0.01532 + u / 7129.0));
        }
        if (y < 1800.0) {
            u = y - 1700.0;
            return 8.83 + u * (0.1603 + u * (-0.0059285 + u * (0.00013336 - u / 1174000.0)));
        }
        if (y < 1860.0) {
            u = y - 1800.0;
            return 13.72 + u * (-0.332447 + u * (0.0068612 + u * (0.0041116 + u * (-0.00037436
                    + u * (0.0000121272 + u * (-0.0000001699 + u * 0.000000000875))))));
        }
        if (y < 1900.0) {
            u = y - 1860.0;
            return 7.62 + u * (0.5737 + u * (-0.251754 + u * (0.01680668
                    + u * (-0.0004473624 + u / 233174.0))));
        }
        if (y < 1920.0) {
            u = y - 1900.0;
            return -2.79 + u * (1.494119 + u * (-0.0598939 + u * (0.0061966 - u * 0.000197)));
        }
        if (y < 1941.0) {
            u = y - 1920.0;
            return 21.20 + u * (0.84493 + u * (-0.076100 + u * 0.0020936));
        }
        if (y < 1961.0) {
            u = y - 1950.0;
            return 29.07 + u * (0.407 + u * (-1.0 / 233.0 + u / 2547.0));
        }
        if (y < 1986.0) {
            u = y - 1975.0;
            return 45.45 + u * (1.067 + u * (-1.0 / 260.0 - u / 718.0));
        }
        if (y < 2005.0) {
            u = y - 2000.0;
            return 63.86 + u * (0.3345 + u * (-0.060374 + u * (0.0017275
                    + u * (0.000651814 + u * 0.00002373599))));
        }
        if (y < 2050.0) {
            u = y - 2000.0;
            return 62.92 + u * (0.32217 + u * 0.005589);
        }
        if (y < 2150.0) {
            u = (y - 1820.0) / 100.0;
            return -20.0 + 32.0 * u * u - 0.5628 * (2150.0 - y);
        }
        u = (y - 1820.0) / 100.0;
        return -20.0 + 32.0 * u * u;
    }

    /** Terrestrial time (days since J2000) for the given universal time. */
    public static double terrestrialTime(double ut) {
        return ut + seconds(ut) / AstroConstants.SECONDS_PER_DAY;
    }

    /**
     * Inverse of {@link #terrestrialTime}: solve for universal time by
     * fixed-point iteration. The relationship is almost linear, so a couple of
     * passes are enough; the ceiling only guards against a broken model.
     *
     * @throws IllegalStateException if the iteration does not converge
     */
    public static double universalTime(double tt) {
        double dt = terrestrialTime(tt) - tt;
        for (int iter = 0; iter < 20; iter++) {
            double ut = tt - dt;
            double err = terrestrialTime(ut) - tt;
            if (Math.abs(err) < 1.0e-12) {
                return ut;
            }
            dt += err;
        }
        throw new IllegalStateException("Universal time did not converge for tt=" + tt);
    }
}
