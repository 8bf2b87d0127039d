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
 * Nutation angles and obliquity of the Earth's axis at one instant.
 */
public final class EarthTilt {
    /** Nutation in longitude, arcseconds. */
    public final double dpsi;

    /** Nutation in obliquity, arcseconds. */
    public final double deps;

    /** Mean obliquity of the ecliptic, degrees. */
    public final double meanObliquity;

    /** True obliquity of the ecliptic (mean plus nutation), degrees. */
    public final double trueObliquity;

    /** Equation of the equinoxes, seconds of time. */
    public final double equationOfEquinoxes;

    EarthTilt(double dpsi, double deps, double meanObliquity, double trueObliquity,
            double equationOfEquinoxes) {
        this.dpsi = dpsi;
        this.deps = deps;
        this.meanObliquity = meanObliquity;
        this.trueObliquity = trueObliquity;
        this.equationOfEquinoxes = equationOfEquinoxes;
    }
}
