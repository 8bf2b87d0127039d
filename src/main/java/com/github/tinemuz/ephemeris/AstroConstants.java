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
 * Physical and conventional constants shared across the engine.
 *
 * <p>Distances are in kilometers unless the name says otherwise; times are in
 * days; masses are gravitational parameters (GM) in AU^3/day^2.</p>
 */
public final class AstroConstants {
    /** Kilometers per astronomical unit. */
    public static final double KM_PER_AU = 1.4959787069098932e+8;

    /** Speed of light in AU per day. */
    public static final double C_AUDAY = 173.1446326846693;

    /** Astronomical units per parsec. */
    public static final double AU_PER_PARSEC = 206264.80624709636;

    public static final double SECONDS_PER_DAY = 86400.0;
    public static final double DAYS_PER_CENTURY = 36525.0;
    public static final double DAYS_PER_MILLENNIUM = 365250.0;
    public static final double DAYS_PER_TROPICAL_YEAR = 365.24217;

    /** Mean time between consecutive new moons, in days. */
    public static final double MEAN_SYNODIC_MONTH = 29.530588;

    public static final double SOLAR_DAYS_PER_SIDEREAL_DAY = 0.9972695717592592;

    /** Earth's rotation rate in radians per second. */
    public static final double EARTH_ANGULAR_VELOCITY = 7.2921150e-5;

    // Body radii (km)
    public static final double SUN_RADIUS_KM = 695700.0;
    public static final double MERCURY_EQUATORIAL_RADIUS_KM = 2440.5;
    public static final double VENUS_EQUATORIAL_RADIUS_KM = 6051.8;
    public static final double EARTH_EQUATORIAL_RADIUS_KM = 6378.1366;
    public static final double EARTH_MEAN_RADIUS_KM = 6371.0;
    public static final double MOON_EQUATORIAL_RADIUS_KM = 1738.1;
    public static final double MOON_MEAN_RADIUS_KM = 1737.4;
    public static final double MOON_POLAR_RADIUS_KM = 1736.0;

    /** Ratio of polar to equatorial Earth radius (1 - flattening). */
    public static final double EARTH_FLATTENING = 0.996647180302104;
    public static final double EARTH_FLATTENING_SQUARED = EARTH_FLATTENING * EARTH_FLATTENING;
    public static final double EARTH_POLAR_RADIUS_KM = EARTH_EQUATORIAL_RADIUS_KM * EARTH_FLATTENING;

    /** Height of the atmosphere layer that enlarges Earth's shadow during lunar eclipses. */
    public static final double EARTH_ATMOSPHERE_KM = 88.0;
    public static final double EARTH_ECLIPSE_RADIUS_KM = EARTH_MEAN_RADIUS_KM + EARTH_ATMOSPHERE_KM;

    public static final double SUN_RADIUS_AU = SUN_RADIUS_KM / KM_PER_AU;
    public static final double MOON_EQUATORIAL_RADIUS_AU = MOON_EQUATORIAL_RADIUS_KM / KM_PER_AU;

    /** Apparent lift of a body at the horizon assumed by rise/set searches, in degrees. */
    public static final double REFRACTION_NEAR_HORIZON = 34.0 / 60.0;

    // Gravitational parameters (AU^3/day^2)
    public static final double SUN_GM = 0.2959122082855911e-03;
    public static final double JUPITER_GM = 0.2825345909524226e-06;
    public static final double SATURN_GM = 0.8459715185680659e-07;
    public static final double URANUS_GM = 0.1292024916781969e-07;
    public static final double NEPTUNE_GM = 0.1524358900784276e-07;
    public static final double PLUTO_GM = 0.2188699765425970e-11;

    public static final double EARTH_MOON_MASS_RATIO = 81.30056;

    private AstroConstants() {}
}
