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

/**
 * Solar System bodies and reference points known to the engine.
 */
public enum Body {
    SUN(Double.NaN),
    MERCURY(87.969),
    VENUS(224.701),
    EARTH(365.256),
    MARS(686.980),
    JUPITER(4332.589),
    SATURN(10759.22),
    URANUS(30685.4),
    NEPTUNE(60189.0),
    PLUTO(90560.0),
    MOON(Double.NaN),
    /** Earth/Moon barycenter. */
    EMB(365.256),
    /** Solar System barycenter. */
    SSB(Double.NaN);

    private final double orbitalPeriod;

    Body(double orbitalPeriod) {
        this.orbitalPeriod = orbitalPeriod;
    }

    /** True for Mercury through Pluto, Earth included. */
    public boolean isPlanet() {
        return ordinal() >= MERCURY.ordinal() && ordinal() <= PLUTO.ordinal();
    }

    /** True for planets whose orbits lie outside Earth's. */
    public boolean isSuperiorPlanet() {
        return isPlanet() && ordinal() > EARTH.ordinal();
    }

    /**
     * Mean sidereal orbital period around the Sun, in days.
     *
     * @throws IllegalArgumentException if the body does not orbit the Sun
     */
    public double orbitalPeriod() {
        if (Double.isNaN(orbitalPeriod)) {
            throw new IllegalArgumentException("No heliocentric orbital period for " + this);
        }
        return orbitalPeriod;
    }

    /**
     * Mean time between successive identical Sun/Earth/body configurations,
     * in days.
     *
     * @throws IllegalArgumentException for Earth and bodies without a period
     */
    public double synodicPeriod() {
        if (this == EARTH) {
            throw new IllegalArgumentException("The Earth has no synodic period as seen from itself");
        }
        if (this == MOON) {
            return AstroConstants.MEAN_SYNODIC_MONTH;
        }
        double earth = EARTH.orbitalPeriod;
        return Math.abs(earth / (earth / orbitalPeriod() - 1.0));
    }
}
