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
 * Barycentric states of the Sun and the four giant planets.
 *
 * <p>Each giant planet pulls the Sun around the Solar System barycenter by an
 * amount proportional to its mass ratio; summing those shifts gives the
 * barycenter relative to the Sun, and from it every barycentric state.</p>
 */
final class MajorBodies {
    static final Body[] GIANTS = {Body.JUPITER, Body.SATURN, Body.URANUS, Body.NEPTUNE};
    static final double[] GIANT_GM = {
        AstroConstants.JUPITER_GM,
        AstroConstants.SATURN_GM,
        AstroConstants.URANUS_GM,
        AstroConstants.NEPTUNE_GM
    };

    private MajorBodies() {}

    /**
     * Barycentric positions at a terrestrial time: index 0 is the Sun, then
     * Jupiter, Saturn, Uranus and Neptune.
     */
    static double[][] positions(double tt) {
        double[][] helio = new double[GIANTS.length][];
        double[] ssb = new double[3];
        for (int i = 0; i < GIANTS.length; i++) {
            helio[i] = VsopModel.helioPosition(GIANTS[i], tt);
            double shift = GIANT_GM[i] / (GIANT_GM[i] + AstroConstants.SUN_GM);
            for (int k = 0; k < 3; k++) ssb[k] += shift * helio[i][k];
        }
        double[][] bary = new double[GIANTS.length + 1][3];
        for (int k = 0; k < 3; k++) bary[0][k] = -ssb[k];
        for (int i = 0; i < GIANTS.length; i++) {
            for (int k = 0; k < 3; k++) bary[i + 1][k] = helio[i][k] + bary[0][k];
        }
        return bary;
    }

    /** Barycentric state of the Sun as {x, y, z, vx, vy, vz}. */
    static double[] sunState(double tt) {
        double[] ssb = new double[6];
        for (int i = 0; i < GIANTS.length; i++) {
            double[] s = VsopModel.helioStateArray(GIANTS[i], tt);
            double shift = GIANT_GM[i] / (GIANT_GM[i] + AstroConstants.SUN_GM);
            for (int k = 0; k < 6; k++) ssb[k] += shift * s[k];
        }
        for (int k = 0; k < 6; k++) ssb[k] = -ssb[k];
        return ssb;
    }

    /** Barycentric state of the Sun. */
    static StateVector sunBaryState(AstroTime time) {
        double[] s = sunState(time.tt);
        return new StateVector(s[0], s[1], s[2], s[3], s[4], s[5], time);
    }

    /**
     * Acceleration (AU/day^2) of a massless body at {@code pos} due to the Sun
     * and the giant planets at the positions returned by {@link #positions}.
     */
    static double[] acceleration(double[] pos, double[][] major) {
        double[] acc = new double[3];
        accelerationIncrement(acc, pos, AstroConstants.SUN_GM, major[0]);
        for (int i = 0; i < GIANTS.length; i++) {
            accelerationIncrement(acc, pos, GIANT_GM[i], major[i + 1]);
        }
        return acc;
    }

    private static void accelerationIncrement(double[] acc, double[] small, double gm, double[] major) {
        double dx = major[0] - small[0];
        double dy = major[1] - small[1];
        double dz = major[2] - small[2];
        double r2 = dx * dx + dy * dy + dz * dz;
        double pull = gm / (r2 * Math.sqrt(r2));
        acc[0] += pull * dx;
        acc[1] += pull * dy;
        acc[2] += pull * dz;
    }
}
