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
 * Atmospheric refraction model selection, with the refraction formula itself.
 *
 * <p>The formula is Saemundsson's, evaluated at an altitude clamped to no
 * lower than -1 degree.</p>
 */
public enum Refraction {
    /** No correction; altitudes are geometric. */
    NONE,
    /** Saemundsson's formula, tapered linearly to zero between -1 degree and the nadir. */
    NORMAL,
    /** Saemundsson's formula without the taper below the horizon, for comparison with JPL Horizons. */
    JPLHOR;

    private static final int MAX_INVERSE_ITERATIONS = 100;

    /**
     * Amount (degrees) by which the atmosphere lifts an object at a given
     * geometric altitude. Zero for altitudes outside [-90, +90].
     */
    public double angle(double altitude) {
        if (this == NONE || altitude < -90.0 || altitude > +90.0) {
            return 0.0;
        }
        double hd = Math.max(altitude, -1.0);
        double refr = (1.02 / Math.tan(Math.toRadians(hd + 10.3 / (hd + 5.11)))) / 60.0;
        if (this == NORMAL && altitude < -1.0) {
            refr *= (altitude + 90.0) / 89.0;
        }
        return refr;
    }

    /**
     * Correction (degrees, zero or negative) that turns an apparent altitude
     * back into the geometric one: {@code geometric = bent + inverseAngle(bent)}.
     *
     * @throws IllegalStateException if the fixed-point iteration does not settle
     */
    public double inverseAngle(double bentAltitude) {
        if (this == NONE || bentAltitude < -90.0 || bentAltitude > +90.0) {
            return 0.0;
        }
        double altitude = bentAltitude - angle(bentAltitude);
        // Below one ulp of the altitude the difference cannot shrink further
        double tolerance = 1.0e-14 * Math.max(1.0, Math.abs(bentAltitude));
        for (int iter = 0; iter < MAX_INVERSE_ITERATIONS; iter++) {
            double diff = (altitude + angle(altitude)) - bentAltitude;
            if (Math.abs(diff) < tolerance) {
                return altitude - bentAltitude;
            }
            altitude -= diff;
        }
        throw new IllegalStateException("Inverse refraction did not converge for altitude " + bentAltitude);
    }
}
