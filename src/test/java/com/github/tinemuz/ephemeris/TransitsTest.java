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
import org.junit.jupiter.api.Test;

class TransitsTest {

    private static final double SEPARATION_TOLERANCE = 0.1; // arcminutes

    @Test
    @DisplayName("Transit of Venus in June 2004, then June 2012")
    void venus() {
        Transits.TransitInfo transit = Transits.searchTransit(Body.VENUS, AstroTime.fromCalendar(2004, 1, 1));
        assertTime(AstroTime.fromCalendar(2004, 6, 8, 5, 13, 21.0), transit.start, "2004 start");
        assertTime(AstroTime.fromCalendar(2004, 6, 8, 8, 19, 28.0), transit.peak, "2004 peak");
        assertTime(AstroTime.fromCalendar(2004, 6, 8, 11, 25, 35.0), transit.finish, "2004 finish");
        assertEquals(10.44, transit.separation, SEPARATION_TOLERANCE);

        Transits.TransitInfo next = Transits.nextTransit(Body.VENUS, transit.finish);
        assertEquals(AstroTime.fromCalendar(2012, 6, 6, 1, 29, 0.0).ut, next.peak.ut, 5.0 / 1440.0);
    }

    @Test
    @DisplayName("Transit of Mercury in November 2019")
    void mercury() {
        Transits.TransitInfo transit = Transits.searchTransit(Body.MERCURY, AstroTime.fromCalendar(2019, 1, 1));
        assertTime(AstroTime.fromCalendar(2019, 11, 11, 12, 35, 30.0), transit.start, "2019 start");
        assertTime(AstroTime.fromCalendar(2019, 11, 11, 15, 19, 46.0), transit.peak, "2019 peak");
        assertTime(AstroTime.fromCalendar(2019, 11, 11, 18, 4, 6.0), transit.finish, "2019 finish");
        assertEquals(1.27, transit.separation, SEPARATION_TOLERANCE);
        assertTrue(transit.start.compareTo(transit.peak) < 0 && transit.peak.compareTo(transit.finish) < 0);
    }

    @Test
    @DisplayName("Only Mercury and Venus transit the Sun")
    void otherBodies() {
        assertThrows(IllegalArgumentException.class,
                () -> Transits.searchTransit(Body.MARS, AstroTime.fromCalendar(2020, 1, 1)));
    }
}
