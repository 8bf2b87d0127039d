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
 * IAU 1980 nutation in longitude and obliquity, the full series of 106
 * lunisolar terms (Seidelmann 1982), largest first.
 */
final class Nutation {

    // Multipliers of D, M, M', F, Omega, then the longitude coefficient and its
    // rate, then the obliquity coefficient and its rate (units of 0.0001").
    private static final double[][] TERMS = {
            {0, 0, 0, 0, 1, -171996.0, -174.2, 92025.0, 8.9},
            {-2, 0, 0, 2, 2, -13187.0, -1.6, 5736.0, -3.1},
            {0, 0, 0, 2, 2, -2274.0, -0.2, 977.0, -0.5},
            {0, 0, 0, 0, 2, 2062.0, 0.2, -895.0, 0.5},
            {0, 1, 0, 0, 0, 1426.0, -3.4, 54.0, -0.1},
            {0, 0, 1, 0, 0, 712.0, 0.1, -7.0, 0.0},
            {-2, 1, 0, 2, 2, -517.0, 1.2, 224.0, -0.6},
            {0, 0, 0, 2, 1, -386.0, -0.4, 200.0, 0.0},
            {0, 0, 1, 2, 2, -301.0, 0.0, 129.0, -0.1},
            {-2, -1, 0, 2, 2, 217.0, -0.5, -95.0, 0.3},
            {-2, 0, 1, 0, 0, -158.0, 0.0, -1.0, 0.0},
            {-2, 0, 0, 2, 1, 129.0, 0.1, -70.0, 0.0},
            {0, 0, -1, 2, 2, 123.0, 0.0, -53.0, 0.0},
            {0, 0, 1, 0, 1, 63.0, 0.1, -33.0, 0.0},
            {2, 0, 0, 0, 0, 63.0, 0.0, -2.0, 0.0},
            {2, 0, -1, 2, 2, -59.0, 0.0, 26.0, 0.0},
            {0, 0, -1, 0, 1, -58.0, -0.1, 32.0, 0.0},
            {0, 0, 1, 2, 1, -51.0, 0.0, 27.0, 0.0},
            {-2, 0, 2, 0, 0, 48.0, 0.0, 1.0, 0.0},
            {0, 0, -2, 2, 1, 46.0, 0.0, -24.0, 0.0},
            {2, 0, 0, 2, 2, -38.0, 0.0, 16.0, 0.0},
            {0, 0, 2, 2, 2, -31.0, 0.0, 13.0, 0.0},
            {-2, 0, 1, 2, 2, 29.0, 0.0, -12.0, 0.0},
            {0, 0, 2, 0, 0, 29.0, 0.0, -1.0, 0.0},
            {0, 0, 0, 2, 0, 26.0, 0.0, -1.0, 0.0},
            {-2, 0, 0, 2, 0, -22.0, 0.0, 0.0, 0.0},
            {0, 0, -1, 2, 1, 21.0, 0.0, -10.0, 0.0},
            {0, 2, 0, 0, 0, 17.0, -0.1, 0.0, 0.0},
            {2, 0, -1, 0, 1, 16.0, 0.0, -8.0, 0.0},
            {-2, 2, 0, 2, 2, -16.0, 0.1, 7.0, 0.0},
            {0, 1, 0, 0, 1, -15.0, 0.0, 9.0, 0.0},
            {-2, 0, 1, 0, 1, -13.0, 0.0, 7.0, 0.0},
            {0, -1, 0, 0, 1, -12.0, 0.0, 6.0, 0.0},
            {0, 0, 2, -2, 0, 11.0, 0.0, 0.0, 0.0},
            {2, 0, -1, 2, 1, -10.0, 0.0, 5.0, 0.0},
            {2, 0, 1, 2, 2, -8.0, 0.0, 3.0, 0.0},
            {0, 1, 0, 2, 2, 7.0, 0.0, -3.0, 0.0},
            {0, -1, 0, 2, 2, -7.0, 0.0, 3.0, 0.0},
            {2, 0, 0, 2, 1, -7.0, 0.0, 3.0, 0.0},
            {-2, 1, 1, 0, 0, -7.0, 0.0, 0.0, 0.0},
            {2, 0, -2, 0, 1, -6.0, 0.0, 3.0, 0.0},
            {-2, 0, 2, 2, 2, 6.0, 0.0, -3.0, 0.0},
            {2, 0, 0, 0, 1, -6.0, 0.0, 3.0, 0.0},
            {-2, 0, 1, 2, 1, 6.0, 0.0, -3.0, 0.0},
            {2, 0, 1, 0, 0, 6.0, 0.0, 0.0, 0.0},
            {-2, -1, 0, 2, 1, -5.0, 0.0, 3.0, 0.0},
            {-2, 0, 0, 0, 1, -5.0, 0.0, 3.0, 0.0},
            {0, 0, 2, 2, 1, -5.0, 0.0, 3.0, 0.0},
            {0, -1, 1, 0, 0, 5.0, 0.0, 0.0, 0.0},
            {-2, 0, 2, 0, 1, 4.0, 0.0, -2.0, 0.0},
            {-2, 1, 0, 2, 1, 4.0, 0.0, -2.0, 0.0},
            {-1, 0, 1, 0, 0, -4.0, 0.0, 0.0, 0.0},
            {-2, 1, 0, 0, 0, -4.0, 0.0, 0.0, 0.0},
            {0, 0, 1, -2, 0, 4.0, 0.0, 0.0, 0.0},
            {1, 0, 0, 0, 0, -4.0, 0.0, 0.0, 0.0},
            {0, 0, -2, 2, 2, -3.0, 0.0, 1.0, 0.0},
            {0, -1, 1, 2, 2, -3.0, 0.0, 1.0, 0.0},
            {2, -1, -1, 2, 2, -3.0, 0.0, 1.0, 0.0},
            {0, 0, 3, 2, 2, -3.0, 0.0, 1.0, 0.0},
            {2, -1, 0, 2, 2, -3.0, 0.0, 1.0, 0.0},
            {-1, -1, 1, 0, 0, -3.0, 0.0, 0.0, 0.0},
            {0, 1, 1, 0, 0, -3.0, 0.0, 0.0, 0.0},
            {0, 0, 1, 2, 0, 3.0, 0.0, 0.0, 0.0},
            {-2, -2, 0, 2, 1, -2.0, 0.0, 1.0, 0.0},
            {0, 0, -2, 0, 1, -2.0, 0.0, 1.0, 0.0},
            {0, 1, 1, 2, 2, 2.0, 0.0, -1.0, 0.0},
            {-2, 0, -1, 2, 1, -2.0, 0.0, 1.0, 0.0},
            {0, 0, 2, 0, 1, 2.0, 0.0, -1.0, 0.0},
            {0, 0, 1, 0, 2, -2.0, 0.0, 1.0, 0.0},
            {1, 0, 0, 2, 2, 2.0, 0.0, -1.0, 0.0},
            {4, 0, -1, 2, 2, -2.0, 0.0, 1.0, 0.0},
            {0, 0, 3, 0, 0, 2.0, 0.0, 0.0, 0.0},
            {0, 0, -1, 0, 2, 1.0, 0.0, -1.0, 0.0},
            {2, 0, -2, 2, 2, 1.0, 0.0, -1.0, 0.0},
            {-2, 1, 1, 2, 2, 1.0, 0.0, -1.0, 0.0},
            {2, 0, 1, 2, 1, -1.0, 0.0, 1.0, 0.0},
            {4, 0, -2, 2, 2, -1.0, 0.0, 1.0, 0.0},
            {-2, 0, 2, 2, 1, 1.0, 0.0, -1.0, 0.0},
            {0, 0, 2, -2, 1, 1.0, 0.0, 0.0, 0.0},
            {-2, 1, 2, 0, 0, 1.0, 0.0, 0.0, 0.0},
            {2, 0, 0, -2, 1, 1.0, 0.0, 0.0, 0.0},
            {2, 1, 0, -2, 0, -1.0, 0.0, 0.0, 0.0},
            {0, 1, 0, 0, 2, 1.0, 0.0, 0.0, 0.0},
            {1, 0, -1, 0, 1, 1.0, 0.0, 0.0, 0.0},
            {-2, 1, 0, 2, 0, -1.0, 0.0, 0.0, 0.0},
            {-4, 0, 1, 0, 0, -1.0, 0.0, 0.0, 0.0},
            {-4, 0, 2, 0, 0, -1.0, 0.0, 0.0, 0.0},
            {0, 0, -1, 4, 2, 1.0, 0.0, 0.0, 0.0},
            {-2, -1, 1, 0, 0, 1.0, 0.0, 0.0, 0.0},
            {2, 0, 2, 2, 2, -1.0, 0.0, 0.0, 0.0},
            {2, 0, 1, 0, 1, -1.0, 0.0, 0.0, 0.0},
            {-2, 0, 0, 4, 2, 1.0, 0.0, 0.0, 0.0},
            {-2, 0, 3, 2, 2, 1.0, 0.0, 0.0, 0.0},
            {-2, 0, 1, 2, 0, -1.0, 0.0, 0.0, 0.0},
            {0, 1, 0, 2, 1, 1.0, 0.0, 0.0, 0.0},
            {2, -1, -1, 0, 1, 1.0, 0.0, 0.0, 0.0},
            {0, 0, 0, -2, 1, -1.0, 0.0, 0.0, 0.0},
            {-1, 0, 0, 2, 2, -1.0, 0.0, 0.0, 0.0},
            {2, 1, 0, 0, 0, -1.0, 0.0, 0.0, 0.0},
            {-2, 0, 1, -2, 0, -1.0, 0.0, 0.0, 0.0},
            {0, -1, 0, 2, 1, -1.0, 0.0, 0.0, 0.0},
            {-2, 1, 1, 0, 1, -1.0, 0.0, 0.0, 0.0},
            {2, 0, 1, -2, 0, -1.0, 0.0, 0.0, 0.0},
            {2, 0, 2, 0, 0, 1.0, 0.0, 0.0, 0.0},
            {4, 0, 0, 2, 2, -1.0, 0.0, 0.0, 0.0},
            {1, 1, 0, 0, 0, 1.0, 0.0, 0.0, 0.0}
    };

    private Nutation() {}

    /**
     * Computes the Earth tilt quantities for a terrestrial time.
     *
     * @param tt terrestrial time in days since J2000
     */
    static EarthTilt tilt(double tt) {
        double t = tt / AstroConstants.DAYS_PER_CENTURY;
        double t2 = t * t;
        double t3 = t2 * t;

        double d = Math.toRadians(297.85036 + 445267.111480 * t - 0.0019142 * t2 + t3 / 189474.0);
        double m = Math.toRadians(357.52772 + 35999.050340 * t - 0.0001603 * t2 - t3 / 300000.0);
        double mp = Math.toRadians(134.96298 + 477198.867398 * t + 0.0086972 * t2 + t3 / 56250.0);
        double f = Math.toRadians(93.27191 + 483202.017538 * t - 0.0036825 * t2 + t3 / 327270.0);
        double om = Math.toRadians(125.04452 - 1934.136261 * t + 0.0020708 * t2 + t3 / 450000.0);

        double dpsi = 0.0;
        double deps = 0.0;
        for (double[] row : TERMS) {
            double arg = row[0] * d + row[1] * m + row[2] * mp + row[3] * f + row[4] * om;
            dpsi += (row[5] + row[6] * t) * Math.sin(arg);
            deps += (row[7] + row[8] * t) * Math.cos(arg);
        }
        dpsi *= 1.0e-4;
        deps *= 1.0e-4;

        double meanOb = EarthOrientation.meanObliquityArcsec(tt);
        return new EarthTilt(dpsi, deps, meanOb / 3600.0, (meanOb + deps) / 3600.0,
                dpsi * Math.cos(Math.toRadians(meanOb / 3600.0)) / 15.0);
    }
}
