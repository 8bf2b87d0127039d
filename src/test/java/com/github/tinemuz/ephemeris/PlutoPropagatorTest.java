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

class PlutoPropagatorTest {

    private static final double CONTINUITY_TOLERANCE = 1.0e-7;  // AU
    private static final double VELOCITY_TOLERANCE = 1.0e-6;    // AU/day

    @Nested
    @DisplayName("Cached span")
    class CachedSpanTests {

        @Test
        @DisplayName("Pluto is about 30.2 AU from the Sun at J2000")
        void distanceAtJ2000() {
            AstroVector v = PlutoPropagator.helioVector(AstroTime.fromTerrestrial(0.0));
            assertEquals(30.2, v.length(), 0.1);
        }

        @Test
        @DisplayName("State is continuous across a segment boundary")
        void segmentBoundary() {
            double boundary = PlutoPropagator.FIRST_ANCHOR_TT + 26 * PlutoPropagator.TIME_STEP;
            StateVector before = PlutoPropagator.baryState(AstroTime.fromTerrestrial(boundary - 1.0e-6));
            StateVector after = PlutoPropagator.baryState(AstroTime.fromTerrestrial(boundary + 1.0e-6));
            assertEquals(before.x, after.x, CONTINUITY_TOLERANCE);
            assertEquals(before.y, after.y, CONTINUITY_TOLERANCE);
            assertEquals(before.z, after.z, CONTINUITY_TOLERANCE);
            assertEquals(before.vx, after.vx, 1.0e-9);
        }

        @Test
        @DisplayName("Velocity agrees with the position's finite difference")
        void velocity() {
            double tt = 4321.0;
            double h = 1.0;
            StateVector s = PlutoPropagator.baryState(AstroTime.fromTerrestrial(tt));
            StateVector p1 = PlutoPropagator.baryState(AstroTime.fromTerrestrial(tt - h));
            StateVector p2 = PlutoPropagator.baryState(AstroTime.fromTerrestrial(tt + h));
            assertEquals((p2.x - p1.x) / (2 * h), s.vx, VELOCITY_TOLERANCE);
            assertEquals((p2.y - p1.y) / (2 * h), s.vy, VELOCITY_TOLERANCE);
            assertEquals((p2.z - p1.z) / (2 * h), s.vz, VELOCITY_TOLERANCE);
        }

        @Test
        @DisplayName("Heliocentric state is the barycentric one minus the Sun")
        void heliocentric() {
            AstroTime time = AstroTime.fromTerrestrial(-12345.0);
            StateVector helio = PlutoPropagator.helioState(time);
            AstroVector vec = PlutoPropagator.helioVector(time);
            assertEquals(vec.x, helio.x, 1.0e-12);
            assertEquals(vec.y, helio.y, 1.0e-12);
            assertEquals(vec.z, helio.z, 1.0e-12);
        }

        @Test
        @DisplayName("Indices are clamped into range")
        void clampIndex() {
            assertEquals(0, PlutoPropagator.clampIndex(-0.5, 10));
            assertEquals(9, PlutoPropagator.clampIndex(10.0, 10));
            assertEquals(3, PlutoPropagator.clampIndex(3.7, 10));
        }
    }

    @Nested
    @DisplayName("Reference orbit")
    class ReferenceOrbitTests {

        private static final double POSITION_TOLERANCE = 2.0e-4;  // AU

        @Test
        @DisplayName("State table loads from the classpath")
        void preload() {
            assertDoesNotThrow(PlutoPropagator::preload);
        }

        @Test
        @DisplayName("Heliocentric position at J2000 matches JPL")
        void helioVectorAtJ2000() {
            AstroVector v = PlutoPropagator.helioVector(AstroTime.fromTerrestrial(0.0));
            assertEquals(-9.8754, v.x, POSITION_TOLERANCE);
            assertEquals(-27.9789, v.y, POSITION_TOLERANCE);
            assertEquals(-5.7537, v.z, POSITION_TOLERANCE);
        }

        @Test
        @DisplayName("Perihelion falls on 1989-09-05")
        void perihelion1989() {
            Apsides.ApsisInfo apsis = Apsides.searchPlanetApsis(Body.PLUTO, AstroTime.fromCalendar(1980, 1, 1, 0, 0, 0.0));
            assertEquals(Apsides.ApsisKind.PERICENTER, apsis.kind);
            double days = apsis.time.tt - AstroTime.fromCalendar(1989, 9, 5, 12, 0, 0.0).tt;
            assertEquals(0.0, days, 4.0, "perihelion at " + apsis.time);
            assertEquals(29.65, apsis.distAu, 0.01);
        }
    }

    @Test
    @DisplayName("Times outside the cached span are integrated and finite")
    void outOfRange() {
        double tt = PlutoPropagator.LAST_ANCHOR_TT + 3000.0;
        StateVector s = PlutoPropagator.baryState(AstroTime.fromTerrestrial(tt));
        assertFinite(s.x, "x");
        assertFinite(s.vz, "vz");
        double r = Math.sqrt(s.x * s.x + s.y * s.y + s.z * s.z);
        assertTrue(r > 29.0 && r < 50.0, "distance " + r);
    }

    @Test
    @DisplayName("Concurrent requests simulate a segment once and agree")
    void concurrentSegment() throws InterruptedException {
        double tt = PlutoPropagator.FIRST_ANCHOR_TT + 10.5 * PlutoPropagator.TIME_STEP;
        int before = PlutoPropagator.simulatedSegmentCount();

        Thread[] threads = new Thread[8];
        StateVector[] results = new StateVector[threads.length];
        for (int i = 0; i < threads.length; i++) {
            final int idx = i;
            threads[i] = new Thread(() -> results[idx] = PlutoPropagator.baryState(AstroTime.fromTerrestrial(tt)));
            threads[i].start();
        }
        for (Thread t : threads) {
            t.join();
        }

        assertTrue(PlutoPropagator.simulatedSegmentCount() - before <= 1, "segment simulated more than once");
        for (StateVector r : results) {
            assertNotNull(r);
            assertEquals(results[0].x, r.x, 0.0);
            assertEquals(results[0].vy, r.vy, 0.0);
        }
    }

    private static void assertFinite(double value, String label) {
        assertTrue(Double.isFinite(value), label + " should be finite");
        assertFalse(Double.isNaN(value), label + " should not be NaN");
        assertFalse(Double.isInfinite(value), label + " should not be infinite");
    }
}
