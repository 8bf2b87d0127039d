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
 * Transits of Mercury and Venus across the Sun's disc, as seen from the
 * center of the Earth.
 */
public final class Transits {
    // Inferior conjunctions farther than this from the Sun cannot produce a transit
    private static final double THRESHOLD_ANGLE = 0.4;
    private static final double BOUNDARY_WINDOW_DAYS = 1.0;
    private static final double SKIP_DAYS = 10.0;
    private static final int MAX_CONJUNCTIONS = 100;

    private Transits() {}

    /**
     * First transit of {@code body} after {@code start}.
     *
     * @throws IllegalArgumentException for bodies other than Mercury and Venus
     * @throws IllegalStateException if no transit is found within 100 inferior conjunctions
     */
    public static TransitInfo searchTransit(Body body, AstroTime start) {
        double planetRadiusKm = planetRadius(body);
        AstroTime searchTime = start;
        for (int count = 0; count < MAX_CONJUNCTIONS; count++) {
            AstroTime conj = Elongations.searchRelativeLongitude(body, 0.0, searchTime);
            double separation = Ephemeris.angleFromSun(body, conj);
            if (separation < THRESHOLD_ANGLE) {
                Shadows.ShadowInfo shadow = Shadows.peakPlanetShadow(body, planetRadiusKm, conj);
                if (shadow.r < shadow.p) {
                    AstroTime timeBefore = shadow.time.addDays(-BOUNDARY_WINDOW_DAYS);
                    AstroTime begin = boundary(body, planetRadiusKm, timeBefore, shadow.time, -1.0);
                    AstroTime timeAfter = shadow.time.addDays(+BOUNDARY_WINDOW_DAYS);
                    AstroTime finish = boundary(body, planetRadiusKm, shadow.time, timeAfter, +1.0);
                    double minSeparation = 60.0 * Ephemeris.angleFromSun(body, shadow.time);
                    return new TransitInfo(begin, shadow.time, finish, minSeparation);
                }
            }
            searchTime = conj.addDays(SKIP_DAYS);
        }
        throw new IllegalStateException("No transit of " + body + " found within " + MAX_CONJUNCTIONS
                + " inferior conjunctions of " + start);
    }

    /** The transit after the one that finished at {@code prevFinish}. */
    public static TransitInfo nextTransit(Body body, AstroTime prevFinish) {
        return searchTransit(body, prevFinish.addDays(100.0));
    }

    private static double planetRadius(Body body) {
        Objects.requireNonNull(body, "body");
        switch (body) {
            case MERCURY:
                return AstroConstants.MERCURY_EQUATORIAL_RADIUS_KM;
            case VENUS:
                return AstroConstants.VENUS_EQUATORIAL_RADIUS_KM;
            default:
                throw new IllegalArgumentException("Transits are only searched for Mercury and Venus, not " + body);
        }
    }

    // Time the planet's disc center crosses the edge of the Sun's penumbral disc
    private static AstroTime boundary(Body body, double planetRadiusKm, AstroTime t1, AstroTime t2, double direction) {
        AstroTime time = Search.search(t -> {
            Shadows.ShadowInfo shadow = Shadows.planetShadow(body, planetRadiusKm, t);
            return direction * (shadow.r - shadow.p);
        }, t1, t2, 1.0);
        if (time == null) {
            throw new IllegalStateException("Transit boundary search for " + body + " failed between " + t1 + " and " + t2);
        }
        return time;
    }

    /** A transit of a planet across the Sun. */
    public static final class TransitInfo {
        /** When the planet's disc first touches the Sun's. */
        public final AstroTime start;
        /** When the planet is closest to the Sun's center. */
        public final AstroTime peak;
        /** When the planet's disc last touches the Sun's. */
        public final AstroTime finish;
        /** Angle between the centers of the planet and the Sun at peak, arcminutes. */
        public final double separation;

        TransitInfo(AstroTime start, AstroTime peak, AstroTime finish, double separation) {
            this.start = start;
            this.peak = peak;
            this.finish = finish;
            this.separation = separation;
        }
    }
}
