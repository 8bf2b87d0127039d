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

import java.util.Objects;

/**
 * Relative longitude, elongation and greatest elongation of planets.
 */
public final class Elongations {
    private static final int MAX_RELATIVE_LONGITUDE_ITERATIONS = 100;
    private static final double ELONGATION_SLOPE_DT_DAYS = 0.1;

    /** Where in the sky a planet appears relative to the Sun. */
    public enum Visibility {
        /** West of the Sun, seen before sunrise. */
        MORNING,
        /** East of the Sun, seen after sunset. */
        EVENING
    }

    private Elongations() {}

    /**
     * When the Earth-minus-planet heliocentric ecliptic longitude next equals
     * {@code targetRelLon}: 0 gives an opposition of a superior planet or an
     * inferior conjunction of an inferior one, 180 the opposite configuration.
     *
     * @throws IllegalArgumentException if {@code body} is not a planet other than the Earth
     * @throws IllegalStateException if the iteration does not converge
     */
    public static AstroTime searchRelativeLongitude(Body body, double targetRelLon, AstroTime start) {
        Objects.requireNonNull(body, "body");
        if (!body.isPlanet() || body == Body.EARTH) {
            throw new IllegalArgumentException("Relative longitude is not defined for " + body);
        }
        double syn = body.synodicPeriod();
        double direction = body.isSuperiorPlanet() ? +1.0 : -1.0;

        double errorAngle = relativeLongitudeOffset(body, start, direction, targetRelLon);
        if (errorAngle > 0.0) {
            // Always search forward in time
            errorAngle -= 360.0;
        }

        AstroTime time = start;
        for (int iter = 0; iter < MAX_RELATIVE_LONGITUDE_ITERATIONS; iter++) {
            double dayAdjust = (-errorAngle / 360.0) * syn;
            time = time.addDays(dayAdjust);
            if (Math.abs(dayAdjust) * AstroConstants.SECONDS_PER_DAY < 1.0) {
                return time;
            }
            double prevAngle = errorAngle;
            errorAngle = relativeLongitudeOffset(body, time, direction, targetRelLon);
            if (Math.abs(prevAngle) < 30.0 && prevAngle != errorAngle) {
                // Scale the period by the observed rate near the target
                double ratio = prevAngle / (prevAngle - errorAngle);
                if (ratio > 0.5 && ratio < 2.0) {
                    syn *= ratio;
                }
            }
        }
        throw new IllegalStateException("Relative longitude search did not converge for " + body);
    }

    /**
     * Angular separation of a body from the Sun, and on which side of it the
     * body appears.
     */
    public static ElongationInfo elongation(Body body, AstroTime time) {
        double relativeLongitude = Ephemeris.pairLongitude(body, Body.SUN, time);
        Visibility visibility;
        double eclipticSeparation;
        if (relativeLongitude > 180.0) {
            visibility = Visibility.MORNING;
            eclipticSeparation = 360.0 - relativeLongitude;
        } else {
            visibility = Visibility.EVENING;
            eclipticSeparation = relativeLongitude;
        }
        double angle = Ephemeris.angleFromSun(body, time);
        return new ElongationInfo(time, visibility, angle, eclipticSeparation);
    }

    /**
     * Next greatest elongation of Mercury or Venus after {@code start}.
     *
     * @throws IllegalArgumentException for any other body
     */
    public static ElongationInfo searchMaxElongation(Body body, AstroTime start) {
        double s1;
        double s2;
        if (body == Body.MERCURY) {
            s1 = 50.0;
            s2 = 85.0;
        } else if (body == Body.VENUS) {
            s1 = 40.0;
            s2 = 50.0;
        } else {
            throw new IllegalArgumentException("Maximum elongation is only searched for Mercury and Venus, not " + body);
        }
        AstroTime time = searchSlopeZero(body, start, s1, s2, t -> negativeElongationSlope(body, t), "elongation");
        return elongation(body, time);
    }

    /**
     * Shared bracket logic for extremes of an inferior planet's apparent
     * behaviour: the extreme lies where the relative longitude is between
     * {@code s1} and {@code s2} degrees on one side of the Sun or the other.
     * {@code slope} must go from negative to positive across it.
     */
    static AstroTime searchSlopeZero(Body body, AstroTime start, double s1, double s2,
                                     Search.SearchFunction slope, String what) {
        double syn = body.synodicPeriod();
        for (int iter = 1; iter <= 2; iter++) {
            double plon = Ephemeris.eclipticLongitude(body, start);
            double elon = Ephemeris.eclipticLongitude(Body.EARTH, start);
            double rlon = Seasons.longitudeOffset(plon - elon);

            double adjustDays;
            double rlonLo;
            double rlonHi;
            if (rlon >= -s1 && rlon < +s1) {
                adjustDays = 0.0;
                rlonLo = +s1;
                rlonHi = +s2;
            } else if (rlon >= +s2 || rlon < -s2) {
                adjustDays = 0.0;
                rlonLo = -s2;
                rlonHi = -s1;
            } else if (rlon >= 0.0) {
                adjustDays = -syn / 4.0;
                rlonLo = +s1;
                rlonHi = +s2;
            } else {
                adjustDays = -syn / 4.0;
                rlonLo = -s2;
                rlonHi = -s1;
            }

            AstroTime tStart = start.addDays(adjustDays);
            AstroTime t1 = searchRelativeLongitude(body, rlonLo, tStart);
            AstroTime t2 = searchRelativeLongitude(body, rlonHi, t1);

            if (slope.apply(t1) >= 0.0) {
                throw new IllegalStateException("Slope of " + what + " for " + body + " should be negative at " + t1);
            }
            if (slope.apply(t2) <= 0.0) {
                throw new IllegalStateException("Slope of " + what + " for " + body + " should be positive at " + t2);
            }
            AstroTime found = Search.search(slope, t1, t2, 10.0);
            if (found == null) {
                throw new IllegalStateException("Search for peak " + what + " of " + body + " failed");
            }
            if (found.tt >= start.tt) {
                return found;
            }
            // The extreme was in the past; retry from just after this window
            start = t2.addDays(1.0);
        }
        throw new IllegalStateException("Peak " + what + " of " + body + " not found after " + start);
    }

    private static double relativeLongitudeOffset(Body body, AstroTime time, double direction, double targetRelLon) {
        double plon = Ephemeris.eclipticLongitude(body, time);
        double elon = Ephemeris.eclipticLongitude(Body.EARTH, time);
        double diff = direction * (elon - plon);
        return Seasons.longitudeOffset(diff - targetRelLon);
    }

    private static double negativeElongationSlope(Body body, AstroTime time) {
        AstroTime t1 = time.addDays(-ELONGATION_SLOPE_DT_DAYS / 2.0);
        AstroTime t2 = time.addDays(+ELONGATION_SLOPE_DT_DAYS / 2.0);
        double e1 = Ephemeris.angleFromSun(body, t1);
        double e2 = Ephemeris.angleFromSun(body, t2);
        return (e1 - e2) / ELONGATION_SLOPE_DT_DAYS;
    }

    /** A planet's apparent position relative to the Sun at one instant. */
    public static final class ElongationInfo {
        /** When the elongation was measured. */
        public final AstroTime time;
        /** Morning or evening sky. */
        public final Visibility visibility;
        /** Angle from the Sun, degrees. */
        public final double elongation;
        /** Difference in ecliptic longitude from the Sun, degrees [0, 180]. */
        public final double eclipticSeparation;

        ElongationInfo(AstroTime time, Visibility visibility, double elongation, double eclipticSeparation) {
            this.time = time;
            this.visibility = visibility;
            this.elongation = elongation;
            this.eclipticSeparation = eclipticSeparation;
        }
    }
}
