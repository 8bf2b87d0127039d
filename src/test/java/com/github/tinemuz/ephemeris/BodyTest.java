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

class BodyTest {

    @Test
    @DisplayName("Planets and superior planets are classified")
    void classification() {
        assertTrue(Body.EARTH.isPlanet());
        assertTrue(Body.PLUTO.isPlanet());
        assertFalse(Body.MOON.isPlanet());
        assertFalse(Body.SUN.isPlanet());
        assertFalse(Body.EMB.isPlanet());
        assertTrue(Body.MARS.isSuperiorPlanet());
        assertFalse(Body.VENUS.isSuperiorPlanet());
        assertFalse(Body.EARTH.isSuperiorPlanet());
    }

    @Test
    @DisplayName("Synodic periods of Venus, Mars and the Moon")
    void synodicPeriods() {
        assertEquals(583.92, Body.VENUS.synodicPeriod(), 0.05);
        assertEquals(779.94, Body.MARS.synodicPeriod(), 0.05);
        assertEquals(AstroConstants.MEAN_SYNODIC_MONTH, Body.MOON.synodicPeriod(), 0.0);
    }

    @Test
    @DisplayName("Bodies without a heliocentric period are rejected")
    void noPeriod() {
        assertThrows(IllegalArgumentException.class, Body.SUN::orbitalPeriod);
        assertThrows(IllegalArgumentException.class, Body.SSB::synodicPeriod);
        assertThrows(IllegalArgumentException.class, Body.EARTH::synodicPeriod);
    }
}
