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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LunarTheoryTest {

    private static final double ANGLE_TOLERANCE = 1.0e-5;  // degrees
    private static final double DISTANCE_TOLERANCE = 0.1;  // km

    // 1992-04-12 0h TT
    private static final double TT = -2820.5;

    @Nested
    @DisplayName("Moon position")
    class PositionTests {

        @Test
        @DisplayName("Ecliptic coordinates match the worked 1992 example")
        void workedExample() {
            LunarTheory.MoonEcliptic m = LunarTheory.eclipticOfDate(TT);
            assertEquals(133.162655, m.longitude(), ANGLE_TOLERANCE);
            assertEquals(-3.229126, m.latitude(), ANGLE_TOLERANCE);
            assertEquals(368409.7, m.distanceKm(), DISTANCE_TOLERANCE);
        }

        @Test
        @DisplayName("Public accessors agree with the ecliptic coordinates")
        void accessors() {
            AstroTime time = AstroTime.fromTerrestrial(TT);
            assertEquals(368409.7, LunarTheory.distanceKm(time), DISTANCE_TOLERANCE);
            assertEquals(-3.229126, LunarTheory.eclipticLatitude(time), ANGLE_TOLERANCE);
            double km = LunarTheory.geoMoon(time).length() * AstroConstants.KM_PER_AU;
            assertEquals(368409.7, km, DISTANCE_TOLERANCE);
        }

        @Test
        @DisplayName("Distance stays between perigee and apogee limits")
        void distanceRange() {
            for (double tt = -3000.0; tt <= 3000.0; tt += 0.37) {
                double km = LunarTheory.distanceKm(AstroTime.fromTerrestrial(tt));
                assertTrue(km > 356000.0 && km < 407000.0, "distance " + km + " at tt=" + tt);
            }
        }

        @Test
        @DisplayName("State velocity is about 1 km/s relative to the Earth")
        void velocity() {
            StateVector s = LunarTheory.geoMoonState(AstroTime.fromTerrestrial(TT));
            double kmPerSec = Math.sqrt(s.vx * s.vx + s.vy * s.vy + s.vz * s.vz)
                    * AstroConstants.KM_PER_AU / AstroConstants.SECONDS_PER_DAY;
            assertEquals(1.02, kmPerSec, 0.1);
            AstroVector p = LunarTheory.geoMoon(AstroTime.fromTerrestrial(TT));
            assertEquals(p.x, s.x, 0.0);
        }
    }

    @Nested
    @DisplayName("Libration")
    class LibrationTests {

        @Test
        @DisplayName("Libration angles stay within their physical limits")
        void limits() {
            for (double tt = 0.0; tt < 400.0; tt += 1.7) {
                LunarTheory.LibrationInfo lib = LunarTheory.libration(AstroTime.fromTerrestrial(tt));
                assertTrue(Math.abs(lib.elat) < 7.5, "elat " + lib.elat);
                assertTrue(Math.abs(lib.elon) < 8.5, "elon " + lib.elon);
                assertTrue(lib.diamDeg > 0.48 && lib.diamDeg < 0.57, "diameter " + lib.diamDeg);
            }
        }

        @Test
        @DisplayName("Libration reports the Moon's position of date")
        void moonPosition() {
            AstroTime time = AstroTime.fromTerrestrial(TT);
            LunarTheory.LibrationInfo lib = LunarTheory.libration(time);
            assertEquals(133.162655, lib.mlon, ANGLE_TOLERANCE);
            assertEquals(-3.229126, lib.mlat, ANGLE_TOLERANCE);
            assertEquals(368409.7, lib.distKm, DISTANCE_TOLERANCE);
        }
    }
}
