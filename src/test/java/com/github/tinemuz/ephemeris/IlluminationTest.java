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

class IlluminationTest {

    @Nested
    @DisplayName("Magnitudes")
    class MagnitudeTests {

        @Test
        @DisplayName("The Sun is about magnitude -26.7")
        void sun() {
            Illumination.IllumInfo info = Illumination.illumination(Body.SUN, AstroTime.fromCalendar(2024, 4, 1));
            assertEquals(-26.7, info.mag, 0.1);
            assertEquals(0.0, info.phaseAngle, 0.0);
            assertEquals(1.0, info.phaseFraction, 0.0);
            assertEquals(0.0, info.helioDist, 0.0);
        }

        @Test
        @DisplayName("The full Moon is about magnitude -12.7 and fully lit")
        void fullMoon() {
            AstroTime full = MoonPhases.searchMoonPhase(180.0, AstroTime.fromCalendar(2000, 1, 1), 40.0);
            Illumination.IllumInfo info = Illumination.illumination(Body.MOON, full);
            assertEquals(-12.7, info.mag, 0.3);
            assertTrue(info.phaseFraction > 0.99, "fraction " + info.phaseFraction);
        }

        @Test
        @DisplayName("Planets fall in their familiar brightness ranges")
        void planetRanges() {
            AstroTime time = AstroTime.fromCalendar(2024, 4, 1);
            assertInRange(Illumination.illumination(Body.VENUS, time).mag, -4.9, -3.6, "Venus");
            assertInRange(Illumination.illumination(Body.JUPITER, time).mag, -2.9, -1.6, "Jupiter");
            assertInRange(Illumination.illumination(Body.NEPTUNE, time).mag, 7.6, 8.1, "Neptune");
            assertInRange(Illumination.illumination(Body.PLUTO, time).mag, 13.5, 15.5, "Pluto");
        }

        @Test
        @DisplayName("Saturn reports its ring tilt")
        void saturnRings() {
            Illumination.IllumInfo info = Illumination.illumination(Body.SATURN, AstroTime.fromCalendar(2017, 10, 1));
            assertTrue(Math.abs(info.ringTilt) > 20.0 && Math.abs(info.ringTilt) < 28.1, "tilt " + info.ringTilt);
            Illumination.IllumInfo edgeOn = Illumination.illumination(Body.SATURN, AstroTime.fromCalendar(2025, 3, 23));
            assertTrue(Math.abs(edgeOn.ringTilt) < 2.0, "tilt " + edgeOn.ringTilt);
            assertEquals(0.0, Illumination.illumination(Body.MARS, AstroTime.fromCalendar(2017, 10, 1)).ringTilt, 0.0);
        }

        @Test
        @DisplayName("The Earth has no magnitude")
        void earth() {
            assertThrows(IllegalArgumentException.class,
                    () -> Illumination.illumination(Body.EARTH, AstroTime.fromCalendar(2024, 1, 1)));
        }
    }

    @Nested
    @DisplayName("Peak magnitude")
    class PeakTests {

        @Test
        @DisplayName("Venus is brightest in February 2025")
        void venusPeak() {
            Illumination.IllumInfo info = Illumination.searchPeakMagnitude(Body.VENUS, AstroTime.fromCalendar(2025, 1, 1));
            assertTrue(info.time.compareTo(AstroTime.fromCalendar(2025, 1, 20)) > 0, "too early: " + info.time);
            assertTrue(info.time.compareTo(AstroTime.fromCalendar(2025, 3, 10)) < 0, "too late: " + info.time);
            assertTrue(info.mag < -4.5, "magnitude " + info.mag);
        }

        @Test
        @DisplayName("Other bodies are rejected")
        void otherBodies() {
            assertThrows(IllegalArgumentException.class,
                    () -> Illumination.searchPeakMagnitude(Body.MERCURY, AstroTime.fromCalendar(2025, 1, 1)));
        }
    }

    private static void assertInRange(double value, double lo, double hi, String label) {
        assertTrue(value >= lo && value <= hi, label + " magnitude " + value + " not in [" + lo + ", " + hi + "]");
    }
}
