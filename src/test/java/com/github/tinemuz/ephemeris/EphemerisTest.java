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

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EphemerisTest {

    private static final double STATE_TOLERANCE = 1.0e-12;
    private static final Observer GEOCENTER = new Observer(0.0, 0.0, 0.0);
    private static final AstroTime TIME = AstroTime.fromCalendar(2024, 6, 20, 20, 51, 0.0);

    @BeforeAll
    static void setUp() {
        Ephemeris.preload();
    }

    @Nested
    @DisplayName("Heliocentric and barycentric states")
    class StateTests {

        @Test
        @DisplayName("The Sun sits at the heliocentric origin")
        void sunAtOrigin() {
            AstroVector sun = Ephemeris.helioVector(Body.SUN, TIME);
            assertEquals(0.0, sun.length(), 0.0);
            assertEquals(0.0, Ephemeris.helioState(Body.SUN, TIME).vx, 0.0);
        }

        @Test
        @DisplayName("The Earth/Moon barycenter lies on the Earth-Moon line near the Earth")
        void earthMoonBarycenter() {
            AstroVector earth = Ephemeris.helioVector(Body.EARTH, TIME);
            AstroVector moon = Ephemeris.helioVector(Body.MOON, TIME);
            AstroVector emb = Ephemeris.helioVector(Body.EMB, TIME);
            AstroVector expected = earth.add(moon.sub(earth).scale(1.0 / (1.0 + AstroConstants.EARTH_MOON_MASS_RATIO)));
            assertEquals(expected.x, emb.x, STATE_TOLERANCE);
            assertEquals(expected.y, emb.y, STATE_TOLERANCE);
            assertEquals(expected.z, emb.z, STATE_TOLERANCE);
        }

        @Test
        @DisplayName("Barycentric minus the Sun's barycentric state is heliocentric")
        void baryConsistency() {
            for (Body body : new Body[] {Body.MERCURY, Body.EARTH, Body.MOON, Body.JUPITER, Body.EMB}) {
                StateVector helio = Ephemeris.helioState(body, TIME);
                StateVector bary = Ephemeris.baryState(body, TIME).sub(Ephemeris.baryState(Body.SUN, TIME));
                assertEquals(helio.x, bary.x, STATE_TOLERANCE, body.toString());
                assertEquals(helio.vy, bary.vy, STATE_TOLERANCE, body.toString());
            }
            StateVector ssb = Ephemeris.baryState(Body.SSB, TIME);
            assertEquals(0.0, ssb.x, 0.0);
            AstroVector ssbHelio = Ephemeris.helioVector(Body.SSB, TIME);
            assertEquals(-Ephemeris.baryState(Body.SUN, TIME).x, ssbHelio.x, STATE_TOLERANCE);
        }

        @Test
        @DisplayName("The Sun wanders no more than about 0.01 AU from the barycenter")
        void sunWobble() {
            StateVector sun = Ephemeris.baryState(Body.SUN, TIME);
            double r = Math.sqrt(sun.x * sun.x + sun.y * sun.y + sun.z * sun.z);
            assertTrue(r < 0.011, "Sun offset " + r);
        }
    }

    @Nested
    @DisplayName("Geocentric and topocentric coordinates")
    class GeocentricTests {

        @Test
        @DisplayName("The Sun is at right ascension 6h and declination +23.44 at the June solstice")
        void solsticeSun() {
            Ephemeris.Equatorial eq = Ephemeris.equator(Body.SUN, TIME, GEOCENTER, true, true);
            assertEquals(6.0, eq.ra, 0.01);
            assertEquals(23.44, eq.dec, 0.01);
            assertEquals(1.016, eq.dist, 0.001);
        }

        @Test
        @DisplayName("The geocentric Moon needs no light-time correction")
        void moon() {
            AstroVector a = Ephemeris.geoVector(Body.MOON, TIME, true);
            AstroVector b = Ephemeris.geoMoon(TIME);
            assertEquals(b.x, a.x, 0.0);
            assertEquals(b.z, a.z, 0.0);
        }

        @Test
        @DisplayName("Light time pulls a planet back along its path")
        void lightTime() {
            AstroVector apparent = Ephemeris.geoVector(Body.JUPITER, TIME, false);
            AstroVector earth = Ephemeris.helioVector(Body.EARTH, TIME);
            AstroVector instant = Ephemeris.helioVector(Body.JUPITER, TIME).sub(earth);
            double shift = apparent.sub(instant).length();
            assertTrue(shift > 1.0e-5 && shift < 1.0e-3, "shift " + shift);
        }

        @Test
        @DisplayName("Sun's apparent longitude at J2000")
        void sunPositionAtJ2000() {
            Ephemeris.Ecliptic ecl = Ephemeris.sunPosition(AstroTime.fromTerrestrial(0.0));
            assertEquals(280.37, ecl.elon, 0.01);
            assertEquals(0.0, ecl.elat, 1.0e-3);
        }

        @Test
        @DisplayName("Mars is opposite the Sun at its 2025 opposition")
        void marsOpposition() {
            AstroTime time = AstroTime.fromCalendar(2025, 1, 16, 2, 30, 0.0);
            assertEquals(180.0, Ephemeris.pairLongitude(Body.MARS, Body.SUN, time), 0.5);
            assertTrue(Ephemeris.angleFromSun(Body.MARS, time) > 170.0);
        }

        @Test
        @DisplayName("Refraction lifts the horizontal altitude")
        void horizonRefraction() {
            Observer obs = new Observer(40.7, -74.0, 0.0);
            AstroTime time = AstroTime.fromCalendar(2024, 6, 21, 9, 40, 0.0);
            Ephemeris.Equatorial eq = Ephemeris.equator(Body.SUN, time, obs, true, true);
            Ephemeris.Horizontal plain = Ephemeris.horizon(time, obs, eq.ra, eq.dec, Refraction.NONE);
            Ephemeris.Horizontal bent = Ephemeris.horizon(time, obs, eq.ra, eq.dec, Refraction.NORMAL);
            assertTrue(bent.altitude > plain.altitude);
            assertEquals(plain.azimuth, bent.azimuth, 1.0e-9);
            assertTrue(bent.dec > plain.dec, "refraction should pull the apparent position north toward the zenith");
        }
    }

    @Test
    @DisplayName("Undefined combinations are rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Ephemeris.eclipticLongitude(Body.SUN, TIME));
        assertThrows(IllegalArgumentException.class, () -> Ephemeris.pairLongitude(Body.EARTH, Body.SUN, TIME));
        assertThrows(IllegalArgumentException.class, () -> Ephemeris.angleFromSun(Body.EARTH, TIME));
    }

    @Test
    @DisplayName("Angles are normalized to [0, 360)")
    void normalizeDegrees() {
        assertEquals(330.0, Ephemeris.normalizeDegrees(-30.0), 1.0e-12);
        assertEquals(0.0, Ephemeris.normalizeDegrees(720.0), 0.0);
    }
}
