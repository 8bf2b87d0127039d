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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NutationTest {

    private static final double ARCSEC_TOLERANCE = 0.01;
    private static final double DEGREE_TOLERANCE = 1.0e-4;

    // 1987-04-10 0h TT
    private static final double TT = -4649.5;

    @Test
    @DisplayName("Nutation angles match the worked 1987 example")
    void nutationAngles() {
        EarthTilt tilt = Nutation.tilt(TT);
        assertEquals(-3.788, tilt.dpsi, ARCSEC_TOLERANCE);
        assertEquals(+9.443, tilt.deps, ARCSEC_TOLERANCE);
    }

    @Test
    @DisplayName("Full series reproduces the SOFA iauNut80 reference at MJD 53736")
    void fullSeriesReference() {
        // iauNut80(2400000.5, 53736.0): dpsi = -0.9643658353226563966e-5 rad,
        // deps = 0.4060051006879713322e-4 rad. Dropping the small terms shifts
        // dpsi by about 3e-4 arcseconds.
        double arcsecPerRadian = 180.0 * 3600.0 / Math.PI;
        EarthTilt tilt = Nutation.tilt(2191.5);
        assertEquals(-0.9643658353226563966e-5 * arcsecPerRadian, tilt.dpsi, 1.0e-5);
        assertEquals(0.4060051006879713322e-4 * arcsecPerRadian, tilt.deps, 1.0e-5);
    }

    @Test
    @DisplayName("Mean and true obliquity are about 23.44 degrees and differ by deps")
    void obliquity() {
        EarthTilt tilt = Nutation.tilt(TT);
        assertEquals(23.440946, tilt.meanObliquity, DEGREE_TOLERANCE);
        assertEquals(23.443569, tilt.trueObliquity, DEGREE_TOLERANCE);
        assertEquals(tilt.deps / 3600.0, tilt.trueObliquity - tilt.meanObliquity, 1.0e-12);
    }

    @Test
    @DisplayName("Equation of the equinoxes is dpsi projected on the equator")
    void equationOfEquinoxes() {
        EarthTilt tilt = Nutation.tilt(TT);
        double expected = tilt.dpsi * Math.cos(Math.toRadians(tilt.meanObliquity)) / 15.0;
        assertEquals(expected, tilt.equationOfEquinoxes, 1.0e-6);
    }

    @Test
    @DisplayName("AstroTime exposes the same tilt")
    void astroTimeTilt() {
        AstroTime time = AstroTime.fromTerrestrial(TT);
        assertEquals(Nutation.tilt(TT).dpsi, time.tilt().dpsi, 0.0);
        assertSame(time.tilt(), EarthOrientation.tilt(time));
    }
}
