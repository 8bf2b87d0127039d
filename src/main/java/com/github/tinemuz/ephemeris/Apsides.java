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
 * Closest and farthest points of the Moon's orbit around the Earth and of the
 * planets' orbits around the Sun.
 *
 * <p>Distance slopes are sampled at a fixed step until they change sign; the
 * bracket is then refined by {@link Search}. Neptune and Pluto move too slowly
 * for the slope to be reliable, so their distance is sampled directly.</p>
 */
public final class Apsides {
    private static final double LUNAR_STEP_DAYS = 5.0;
    private static final double LUNAR_SKIP_DAYS = 11.0;
    private static final double SLOPE_DT_DAYS = 0.001;
    private static final int BRUTE_POINTS = 100;
    private static final int EXTREME_POINTS = 10;

    /** Which end of the orbit. */
    public enum ApsisKind {
        /** Closest approach: perigee or perihelion. */
        PERICENTER,
        /** Farthest point: apogee or aphelion. */
        APOCENTER
    }

    private Apsides() {}

    /**
     * First lunar perigee or apogee after {@code start}.
     *
     * @throws IllegalStateException if none is found within two synodic months
     */
    public static ApsisInfo searchLunarApsis(AstroTime start) {
        Search.SearchFunction slope = Apsides::moonDistanceSlope;
        AstroTime t1 = start;
        double m1 = slope.apply(t1);
        for (int iter = 0; iter * LUNAR_STEP_DAYS < 2.0 * AstroConstants.MEAN_SYNODIC_MONTH; iter++) {
            AstroTime t2 = t1.addDays(LUNAR_STEP_DAYS);
            double m2 = slope.apply(t2);
            if (m1 * m2 <= 0.0) {
                if (m1 < 0.0 || m2 > 0.0) {
                    AstroTime time = requireFound(Search.search(slope, t1, t2, 1.0), "lunar perigee");
                    return new ApsisInfo(time, ApsisKind.PERICENTER, LunarTheory.geoMoon(time).length());
                }
                if (m1 > 0.0 || m2 < 0.0) {
                    AstroTime time = requireFound(Search.search(t -> -moonDistanceSlope(t), t1, t2, 1.0), "lunar apogee");
                    return new ApsisInfo(time, ApsisKind.APOCENTER, LunarTheory.geoMoon(time).length());
                }
                throw new IllegalStateException("Lunar distance slope is flat at both ends of a search step");
            }
            t1 = t2;
            m1 = m2;
        }
        throw new IllegalStateException("No lunar apsis found within two synodic months of " + start);
    }

    /** The lunar apsis after {@code previous}; perigee and apogee alternate. */
    public static ApsisInfo nextLunarApsis(ApsisInfo previous) {
        ApsisInfo next = searchLunarApsis(previous.time.addDays(LUNAR_SKIP_DAYS));
        requireAlternating(previous, next);
        return next;
    }

    /**
     * First perihelion or aphelion of a planet after {@code start}.
     *
     * @throws IllegalArgumentException if {@code body} is not a planet
     * @throws IllegalStateException if none is found within two orbits
     */
    public static ApsisInfo searchPlanetApsis(Body body, AstroTime start) {
        Objects.requireNonNull(body, "body");
        if (!body.isPlanet()) {
            throw new IllegalArgumentException("Planet apsis is not defined for " + body);
        }
        if (body == Body.NEPTUNE || body == Body.PLUTO) {
            return bruteSearchPlanetApsis(body, start);
        }
        double period = body.orbitalPeriod();
        double increment = period / 6.0;
        AstroTime t1 = start;
        double m1 = planetDistanceSlope(+1.0, body, t1);
        for (int iter = 0; iter * increment < 2.0 * period; iter++) {
            AstroTime t2 = t1.addDays(increment);
            double m2 = planetDistanceSlope(+1.0, body, t2);
            if (m1 * m2 <= 0.0) {
                double direction;
                ApsisKind kind;
                if (m1 < 0.0 || m2 > 0.0) {
                    direction = +1.0;
                    kind = ApsisKind.PERICENTER;
                } else if (m1 > 0.0 || m2 < 0.0) {
                    direction = -1.0;
                    kind = ApsisKind.APOCENTER;
                } else {
                    throw new IllegalStateException("Distance slope of " + body + " is flat at both ends of a search step");
                }
                AstroTime time = requireFound(
                        Search.search(t -> planetDistanceSlope(direction, body, t), t1, t2, 1.0),
                        body + " apsis");
                return new ApsisInfo(time, kind, Ephemeris.helioDistance(body, time));
            }
            t1 = t2;
            m1 = m2;
        }
        throw new IllegalStateException("No apsis of " + body + " found within two orbits of " + start);
    }

    /** The planet apsis after {@code previous}; perihelion and aphelion alternate. */
    public static ApsisInfo nextPlanetApsis(Body body, ApsisInfo previous) {
        double skip = 0.25 * body.orbitalPeriod();
        ApsisInfo next = searchPlanetApsis(body, previous.time.addDays(skip));
        requireAlternating(previous, next);
        return next;
    }

    private static double moonDistanceSlope(AstroTime time) {
        AstroTime t1 = time.addDays(-SLOPE_DT_DAYS / 2.0);
        AstroTime t2 = time.addDays(+SLOPE_DT_DAYS / 2.0);
        double r1 = LunarTheory.geoMoon(t1).length();
        double r2 = LunarTheory.geoMoon(t2).length();
        return (r2 - r1) / SLOPE_DT_DAYS;
    }

    private static double planetDistanceSlope(double direction, Body body, AstroTime time) {
        AstroTime t1 = time.addDays(-SLOPE_DT_DAYS / 2.0);
        AstroTime t2 = time.addDays(+SLOPE_DT_DAYS / 2.0);
        double r1 = Ephemeris.helioDistance(body, t1);
        double r2 = Ephemeris.helioDistance(body, t2);
        return direction * (r2 - r1) / SLOPE_DT_DAYS;
    }

    /**
     * Samples distance over most of an orbit starting a little before
     * {@code start}, then refines the coarse extremes.
     */
    private static ApsisInfo bruteSearchPlanetApsis(Body body, AstroTime start) {
        double period = body.orbitalPeriod();
        AstroTime t1 = start.addDays(period * (-30.0 / 360.0));
        AstroTime t2 = start.addDays(period * (+270.0 / 360.0));
        AstroTime tMin = t1;
        AstroTime tMax = t1;
        double minDist = -1.0;
        double maxDist = -1.0;
        double interval = (t2.ut - t1.ut) / (BRUTE_POINTS - 1.0);

        for (int i = 0; i < BRUTE_POINTS; i++) {
            AstroTime time = t1.addDays(i * interval);
            double dist = Ephemeris.helioDistance(body, time);
            if (i == 0) {
                maxDist = minDist = dist;
            } else {
                if (dist > maxDist) {
                    maxDist = dist;
                    tMax = time;
                }
                if (dist < minDist) {
                    minDist = dist;
                    tMin = time;
                }
            }
        }

        ApsisInfo perihelion = planetExtreme(body, ApsisKind.PERICENTER, tMin.addDays(-2.0 * interval), 4.0 * interval);
        ApsisInfo aphelion = planetExtreme(body, ApsisKind.APOCENTER, tMax.addDays(-2.0 * interval), 4.0 * interval);
        if (perihelion.time.tt >= start.tt) {
            if (aphelion.time.tt >= start.tt && aphelion.time.tt < perihelion.time.tt) {
                return aphelion;
            }
            return perihelion;
        }
        if (aphelion.time.tt >= start.tt) {
            return aphelion;
        }
        throw new IllegalStateException("Failed to find an apsis of " + body + " after " + start);
    }

    // Narrow a window around a distance extreme until it is under one day wide
    private static ApsisInfo planetExtreme(Body body, ApsisKind kind, AstroTime startTime, double dayspan) {
        double direction = kind == ApsisKind.APOCENTER ? +1.0 : -1.0;
        for (;;) {
            double interval = dayspan / (EXTREME_POINTS - 1);
            if (interval < 1.0) {
                AstroTime median = startTime.addDays(0.5 * dayspan);
                return new ApsisInfo(median, kind, Ephemeris.helioDistance(body, median));
            }
            int bestIndex = -1;
            double bestDist = 0.0;
            for (int i = 0; i < EXTREME_POINTS; i++) {
                double dist = direction * Ephemeris.helioDistance(body, startTime.addDays(i * interval));
                if (i == 0 || dist > bestDist) {
                    bestIndex = i;
                    bestDist = dist;
                }
            }
            startTime = startTime.addDays((bestIndex - 1) * interval);
            dayspan = 2.0 * interval;
        }
    }

    private static AstroTime requireFound(AstroTime time, String what) {
        if (time == null) {
            throw new IllegalStateException("Search for " + what + " failed inside a bracket that must contain it");
        }
        return time;
    }

    private static void requireAlternating(ApsisInfo previous, ApsisInfo next) {
        if (next.kind == previous.kind) {
            throw new IllegalStateException("Found two consecutive " + next.kind + " apsides at "
                    + previous.time + " and " + next.time);
        }
    }

    /** A pericenter or apocenter event. */
    public static final class ApsisInfo {
        /** When the apsis occurs. */
        public final AstroTime time;
        /** Pericenter or apocenter. */
        public final ApsisKind kind;
        /** Distance between the centers of the two bodies, AU. */
        public final double distAu;
        /** Same distance in km. */
        public final double distKm;

        ApsisInfo(AstroTime time, ApsisKind kind, double distAu) {
            this.time = time;
            this.kind = kind;
            this.distAu = distAu;
            this.distKm = distAu * AstroConstants.KM_PER_AU;
        }
    }
}
