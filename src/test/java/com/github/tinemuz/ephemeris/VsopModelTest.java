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

class VsopModelTest {

    private static final double POSITION_TOLERANCE = 1.0e-4;  // AU
    private static final double VELOCITY_TOLERANCE = 1.0e-7;  // AU/day

    private static final Body[] PLANETS = {
        Body.MERCURY, Body.VENUS, Body.EARTH, Body.MARS,
        Body.JUPITER, Body.SATURN, Body.URANUS, Body.NEPTUNE
    };

    @BeforeAll
    static void setUp() {
        VsopModel.preload();
    }

    @Nested
    @DisplayName("Positions")
    class PositionTests {

        @Test
        @DisplayName("Earth at J2000 matches the reference vector")
        void earthAtJ2000() {
            // JPL Horizons heliocentric Earth, ICRF, 2000-01-01 12:00 TDB
            AstroVector earth = VsopModel.helioVector(Body.EARTH, AstroTime.fromTerrestrial(0.0));
            assertEquals(-0.177134, earth.x, POSITION_TOLERANCE);
            assertEquals(+0.887428, earth.y, POSITION_TOLERANCE);
            assertEquals(+0.384744, earth.z, POSITION_TOLERANCE);
        }

        @Test
        @DisplayName("Heliocentric distances fall inside each planet's orbit range")
        void distances() {
            double[][] ranges = {
                {0.30, 0.47}, {0.71, 0.73}, {0.98, 1.02}, {1.37, 1.68},
                {4.90, 5.50}, {8.90, 10.2}, {18.2, 20.2}, {29.6, 30.5}
            };
            for (double tt = -36525.0; tt <= 36525.0; tt += 3652.5) {
                AstroTime time = AstroTime.fromTerrestrial(tt);
                for (int i = 0; i < PLANETS.length; i++) {
                    double r = VsopModel.helioVector(PLANETS[i], time).length();
                    assertTrue(r > ranges[i][0] && r < ranges[i][1], PLANETS[i] + " at tt=" + tt + " r=" + r);
                }
            }
        }

        @Test
        @DisplayName("State position matches the plain position")
        void stateMatchesVector() {
            AstroTime time = AstroTime.fromTerrestrial(1234.5);
            for (Body body : PLANETS) {
                AstroVector v = VsopModel.helioVector(body, time);
                StateVector s = VsopModel.helioState(body, time);
                assertEquals(v.x, s.x, 1.0e-15, body.toString());
                assertEquals(v.y, s.y, 1.0e-15, body.toString());
                assertEquals(v.z, s.z, 1.0e-15, body.toString());
            }
        }

        @Test
        @DisplayName("Bodies outside the series are rejected")
        void uncoveredBodies() {
            AstroTime time = AstroTime.fromTerrestrial(0.0);
            assertFalse(VsopModel.covers(Body.PLUTO));
            assertFalse(VsopModel.covers(Body.MOON));
            assertTrue(VsopModel.covers(Body.NEPTUNE));
            assertThrows(IllegalArgumentException.class, () -> VsopModel.helioVector(Body.PLUTO, time));
            assertThrows(IllegalArgumentException.class, () -> VsopModel.helioState(Body.SUN, time));
        }
    }

    @Nested
    @DisplayName("Velocities")
    class VelocityTests {

        @Test
        @DisplayName("Analytic velocity agrees with the position's finite difference")
        void velocityMatchesFiniteDifference() {
            double h = 0.01;
            for (double tt : new double[] {100.0, -20000.0, 15000.0}) {
                for (Body body : PLANETS) {
                    StateVector s = VsopModel.helioState(body, AstroTime.fromTerrestrial(tt));
                    double[] p1 = VsopModel.helioPosition(body, tt - h);
                    double[] p2 = VsopModel.helioPosition(body, tt + h);
                    String label = body + " at tt=" + tt;
                    assertEquals((p2[0] - p1[0]) / (2 * h), s.vx, VELOCITY_TOLERANCE, label);
                    assertEquals((p2[1] - p1[1]) / (2 * h), s.vy, VELOCITY_TOLERANCE, label);
                    assertEquals((p2[2] - p1[2]) / (2 * h), s.vz, VELOCITY_TOLERANCE, label);
                }
            }
        }

        @Test
        @DisplayName("Earth moves about 2 pi AU per year")
        void earthSpeed() {
            StateVector s = VsopModel.helioState(Body.EARTH, AstroTime.fromTerrestrial(0.0));
            double speed = Math.sqrt(s.vx * s.vx + s.vy * s.vy + s.vz * s.vz);
            assertEquals(2.0 * Math.PI / 365.25, speed, 0.0006);
        }
    }

    @Test
    @DisplayName("Concurrent first use loads the series once and agrees")
    void concurrentAccess() throws InterruptedException {
        Thread[] threads = new Thread[8];
        double[][] results = new double[threads.length][];
        for (int i = 0; i < threads.length; i++) {
            final int idx = i;
            threads[i] = new Thread(() -> results[idx] = VsopModel.helioPosition(Body.MARS, 5000.0));
            threads[i].start();
        }
        for (Thread t : threads) {
            t.join();
        }
        for (double[] r : results) {
            assertArrayEquals(results[0], r, 0.0);
        }
    }
}
