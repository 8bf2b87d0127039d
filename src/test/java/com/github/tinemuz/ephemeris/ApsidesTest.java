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

class ApsidesTest {

    @Nested
    @DisplayName("Lunar apsides")
    class LunarTests {

        @Test
        @DisplayName("Apogee on the first of January 2024")
        void firstApogee() {
            Apsides.ApsisInfo apsis = Apsides.searchLunarApsis(AstroTime.fromCalendar(2024, 1, 1));
            assertEquals(Apsides.ApsisKind.APOCENTER, apsis.kind);
            double expected = AstroTime.fromCalendar(2024, 1, 1, 15, 28, 0.0).ut;
            assertEquals(expected, apsis.time.ut, 0.3);
            assertEquals(404909.0, apsis.distKm, 500.0);
            assertEquals(apsis.distAu * AstroConstants.KM_PER_AU, apsis.distKm, 1.0e-6);
        }

        @Test
        @DisplayName("Perigee and apogee alternate")
        void alternate() {
            Apsides.ApsisInfo apsis = Apsides.searchLunarApsis(AstroTime.fromCalendar(2024, 1, 1));
            for (int i = 0; i < 12; i++) {
                Apsides.ApsisInfo next = Apsides.nextLunarApsis(apsis);
                assertNotEquals(apsis.kind, next.kind);
                double gap = next.time.ut - apsis.time.ut;
                assertTrue(gap > 10.0 && gap < 18.0, "gap " + gap + " days");
                if (next.kind == Apsides.ApsisKind.PERICENTER) {
                    assertTrue(next.distKm < 371000.0, "perigee at " + next.distKm + " km");
                } else {
                    assertTrue(next.distKm > 403000.0, "apogee at " + next.distKm + " km");
                }
                apsis = next;
            }
        }
    }

    @Nested
    @DisplayName("Planet apsides")
    class PlanetTests {

        @Test
        @DisplayName("Earth's perihelion of January 2024")
        void earthPerihelion() {
            Apsides.ApsisInfo apsis = Apsides.searchPlanetApsis(Body.EARTH, AstroTime.fromCalendar(2023, 12, 1));
            assertEquals(Apsides.ApsisKind.PERICENTER, apsis.kind);
            assertEquals(AstroTime.fromCalendar(2024, 1, 3).ut, apsis.time.ut, 1.0);
            assertEquals(0.9833, apsis.distAu, 1.0e-4);
        }

        @Test
        @DisplayName("Mars perihelion and aphelion alternate")
        void marsAlternates() {
            Apsides.ApsisInfo apsis = Apsides.searchPlanetApsis(Body.MARS, AstroTime.fromCalendar(2020, 1, 1));
            for (int i = 0; i < 4; i++) {
                Apsides.ApsisInfo next = Apsides.nextPlanetApsis(Body.MARS, apsis);
                assertNotEquals(apsis.kind, next.kind);
                assertEquals(Body.MARS.orbitalPeriod() / 2.0, next.time.ut - apsis.time.ut, 30.0);
                apsis = next;
            }
        }

        @Test
        @DisplayName("Neptune's next perihelion is around 2042")
        void neptunePerihelion() {
            Apsides.ApsisInfo apsis = Apsides.searchPlanetApsis(Body.NEPTUNE, AstroTime.fromCalendar(2000, 1, 1));
            assertEquals(Apsides.ApsisKind.PERICENTER, apsis.kind);
            assertTrue(apsis.time.compareTo(AstroTime.fromCalendar(2030, 1, 1)) > 0, "too early: " + apsis.time);
            assertTrue(apsis.time.compareTo(AstroTime.fromCalendar(2055, 1, 1)) < 0, "too late: " + apsis.time);
            assertTrue(apsis.distAu > 29.7 && apsis.distAu < 29.95, "distance " + apsis.distAu);
        }

        @Test
        @DisplayName("Non-planets are rejected")
        void nonPlanet() {
            AstroTime start = AstroTime.fromCalendar(2020, 1, 1);
            assertThrows(IllegalArgumentException.class, () -> Apsides.searchPlanetApsis(Body.MOON, start));
            assertThrows(IllegalArgumentException.class, () -> Apsides.searchPlanetApsis(Body.SUN, start));
        }
    }
}
