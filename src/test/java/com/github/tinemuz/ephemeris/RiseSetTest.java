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

import static com.github.tinemuz.ephemeris.SeasonsTest.assertTime;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RiseSetTest {

    private static final Observer NEW_YORK = new Observer(40.7, -74.0, 0.0);
    private static final Observer ARCTIC = new Observer(70.0, 20.0, 0.0);
    private static final AstroTime START = AstroTime.fromCalendar(2024, 6, 21);

    @Nested
    @DisplayName("Rise and set")
    class RiseSetTests {

        @Test
        @DisplayName("Sunrise in New York on the June solstice")
        void sunrise() {
            AstroTime rise = RiseSet.searchRiseSet(Body.SUN, NEW_YORK, RiseSet.Direction.RISE, START, 1.0);
            assertTime(AstroTime.fromCalendar(2024, 6, 21, 9, 25, 11.0), rise, "sunrise");

            Ephemeris.Equatorial eq = Ephemeris.equator(Body.SUN, rise, NEW_YORK, true, true);
            Ephemeris.Horizontal hor = Ephemeris.horizon(rise, NEW_YORK, eq.ra, eq.dec, Refraction.NONE);
            // Upper limb on the horizon after 34 arcminutes of refraction
            assertEquals(-0.83, hor.altitude, 0.02);
            assertEquals(57.5, hor.azimuth, 0.5);
        }

        @Test
        @DisplayName("Refracted upper limb of the rising Sun is on the horizon")
        void sunriseRefractedLimb() {
            AstroTime rise = RiseSet.searchRiseSet(Body.SUN, NEW_YORK, RiseSet.Direction.RISE, START, 1.0);
            Ephemeris.Equatorial eq = Ephemeris.equator(Body.SUN, rise, NEW_YORK, true, true);

            Ephemeris.Horizontal hor = Ephemeris.horizon(rise, NEW_YORK, eq.ra, eq.dec, Refraction.NONE);
            double limb = hor.altitude + Math.toDegrees(Math.asin(AstroConstants.SUN_RADIUS_AU / eq.dist));
            assertEquals(0.0, limb + Refraction.NORMAL.angle(limb), 0.05);

            // Refraction applied to the centre instead of the limb
            Ephemeris.Horizontal bent = Ephemeris.horizon(rise, NEW_YORK, eq.ra, eq.dec, Refraction.NORMAL);
            assertEquals(-0.21, bent.altitude, 0.02);
        }

        @Test
        @DisplayName("Sunset follows within the same UT day")
        void sunset() {
            AstroTime set = RiseSet.searchRiseSet(Body.SUN, NEW_YORK, RiseSet.Direction.SET, START, 1.0);
            assertTime(AstroTime.fromCalendar(2024, 6, 21, 0, 30, 32.0), set, "sunset");
        }

        @Test
        @DisplayName("Moonrise after the full moon")
        void moonrise() {
            AstroTime rise = RiseSet.searchRiseSet(Body.MOON, NEW_YORK, RiseSet.Direction.RISE, START, 2.0);
            assertTime(AstroTime.fromCalendar(2024, 6, 22, 0, 49, 0.0), rise, "moonrise");
        }

        @Test
        @DisplayName("No sunrise or sunset during the polar day")
        void polarDay() {
            assertNull(RiseSet.searchRiseSet(Body.SUN, ARCTIC, RiseSet.Direction.RISE, START, 2.0));
            assertNull(RiseSet.searchRiseSet(Body.SUN, ARCTIC, RiseSet.Direction.SET, START, 2.0));
        }

        @Test
        @DisplayName("Civil twilight ends after sunset")
        void civilTwilight() {
            AstroTime set = RiseSet.searchRiseSet(Body.SUN, NEW_YORK, RiseSet.Direction.SET, START, 1.0);
            AstroTime dusk = RiseSet.searchAltitude(Body.SUN, NEW_YORK, RiseSet.Direction.SET, START, 1.0, -6.0);
            assertNotNull(dusk);
            double minutes = (dusk.ut - set.ut) * 1440.0;
            assertTrue(minutes > 20.0 && minutes < 60.0, "twilight lasted " + minutes + " minutes");

            Ephemeris.Equatorial eq = Ephemeris.equator(Body.SUN, dusk, NEW_YORK, true, true);
            Ephemeris.Horizontal hor = Ephemeris.horizon(dusk, NEW_YORK, eq.ra, eq.dec, Refraction.NONE);
            assertEquals(-6.0, hor.altitude, 0.01);
        }
    }

    @Nested
    @DisplayName("Hour angles")
    class HourAngleTests {

        @Test
        @DisplayName("Solar culmination in New York")
        void culmination() {
            RiseSet.HourAngleInfo info = RiseSet.searchHourAngle(Body.SUN, NEW_YORK, 0.0, START);
            assertTime(AstroTime.fromCalendar(2024, 6, 21, 16, 57, 58.0), info.time, "culmination");
            assertEquals(90.0 - 40.7 + 23.44, info.hor.altitude, 0.1);

            double ha = RiseSet.hourAngle(Body.SUN, info.time, NEW_YORK);
            assertTrue(Math.min(ha, 24.0 - ha) < 1.0e-4, "hour angle " + ha);
        }

        @Test
        @DisplayName("Lower culmination comes about 12 hours later")
        void lowerCulmination() {
            AstroTime upper = RiseSet.searchHourAngle(Body.MARS, NEW_YORK, 0.0, START).time;
            AstroTime lower = RiseSet.searchHourAngle(Body.MARS, NEW_YORK, 12.0, upper).time;
            assertEquals(0.5, lower.ut - upper.ut, 0.01);
        }
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> RiseSet.searchRiseSet(Body.EARTH, NEW_YORK, RiseSet.Direction.RISE, START, 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> RiseSet.searchRiseSet(Body.SUN, NEW_YORK, RiseSet.Direction.RISE, START, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> RiseSet.searchAltitude(Body.SUN, NEW_YORK, RiseSet.Direction.RISE, START, 1.0, 91.0));
        assertThrows(IllegalArgumentException.class,
                () -> RiseSet.searchHourAngle(Body.SUN, NEW_YORK, 24.0, START));
        assertThrows(IllegalArgumentException.class,
                () -> RiseSet.hourAngle(Body.EARTH, START, NEW_YORK));
    }
}
