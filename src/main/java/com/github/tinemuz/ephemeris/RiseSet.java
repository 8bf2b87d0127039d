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
 * Rising, setting, culmination and altitude crossings for an observer.
 *
 * <p>Every altitude search is bracketed by the body's lower and upper
 * culminations (hour angles 12 and 0), between which its altitude changes
 * monotonically, so the generic search sees exactly one crossing per bracket.</p>
 */
public final class RiseSet {
    private static final int MAX_HOUR_ANGLE_ITERATIONS = 50;

    /** Which way a body crosses the horizon. */
    public enum Direction {
        RISE(+1),
        SET(-1);

        final int sign;

        Direction(int sign) {
            this.sign = sign;
        }
    }

    private RiseSet() {}

    /**
     * The body's local hour angle in sidereal hours [0, 24): the sidereal
     * time elapsed since it last crossed the observer's meridian.
     *
     * @throws IllegalArgumentException for the Earth
     */
    public static double hourAngle(Body body, AstroTime time, Observer observer) {
        requireNotEarth(body);
        double gast = EarthOrientation.siderealTime(time);
        Ephemeris.Equatorial ofdate = Ephemeris.equator(body, time, observer, true, true);
        double ha = (observer.longitude / 15.0 + gast - ofdate.ra) % 24.0;
        if (ha < 0.0) ha += 24.0;
        return ha;
    }

    /**
     * The next time after {@code start} that the body reaches the given hour
     * angle. Hour angle 0 is upper culmination, 12 lower culmination.
     *
     * @throws IllegalArgumentException for the Earth or an hour angle outside [0, 24)
     */
    public static HourAngleInfo searchHourAngle(Body body, Observer observer, double hourAngle, AstroTime start) {
        requireNotEarth(body);
        Objects.requireNonNull(observer, "observer");
        if (!(hourAngle >= 0.0 && hourAngle < 24.0)) {
            throw new IllegalArgumentException("Invalid hour angle " + hourAngle);
        }

        AstroTime time = start;
        for (int iter = 1; iter <= MAX_HOUR_ANGLE_ITERATIONS; iter++) {
            double gast = EarthOrientation.siderealTime(time);
            Ephemeris.Equatorial ofdate = Ephemeris.equator(body, time, observer, true, true);

            double deltaSiderealHours = ((hourAngle + ofdate.ra - observer.longitude / 15.0) - gast) % 24.0;
            if (iter == 1) {
                // First step always goes forward in time
                if (deltaSiderealHours < 0.0) deltaSiderealHours += 24.0;
            } else {
                // Later steps correct in whichever direction is shorter
                if (deltaSiderealHours < -12.0) deltaSiderealHours += 24.0;
                else if (deltaSiderealHours > +12.0) deltaSiderealHours -= 24.0;
            }

            if (Math.abs(deltaSiderealHours) * 3600.0 < 0.1) {
                Ephemeris.Horizontal hor = Ephemeris.horizon(time, observer, ofdate.ra, ofdate.dec, Refraction.NORMAL);
                return new HourAngleInfo(time, hor);
            }
            time = time.addDays((deltaSiderealHours / 24.0) * AstroConstants.SOLAR_DAYS_PER_SIDEREAL_DAY);
        }
        throw new IllegalStateException("Hour angle search did not converge for " + body + " after " + start);
    }

    /**
     * Next rise or set of a body's upper limb after {@code start}, using the
     * conventional 34 arcminutes of horizon refraction.
     *
     * <p>At the returned time the unrefracted upper limb sits 34 arcminutes
     * below the horizon, so the limb refracted at its own altitude with
     * {@link Refraction#NORMAL} is on the horizon. The body's centre is lower
     * by its angular radius: refracting the centre alone leaves the Sun about
     * 0.2 degrees below the horizon at sunrise.</p>
     *
     * @return the event time, or {@code null} if it does not happen within
     *         {@code limitDays} (for example polar day or night)
     * @throws IllegalArgumentException for the Earth or a non-positive limit
     */
    public static AstroTime searchRiseSet(Body body, Observer observer, Direction direction,
                                          AstroTime start, double limitDays) {
        double radiusAu;
        if (body == Body.SUN) {
            radiusAu = AstroConstants.SUN_RADIUS_AU;
        } else if (body == Body.MOON) {
            radiusAu = AstroConstants.MOON_EQUATORIAL_RADIUS_AU;
        } else {
            radiusAu = 0.0;
        }
        return searchAltitudeInternal(body, observer, direction, start, limitDays, radiusAu,
                -AstroConstants.REFRACTION_NEAR_HORIZON);
    }

    /**
     * Next time the body's center passes a given geometric altitude, such as
     * -6, -12 or -18 degrees for the Sun at civil, nautical or astronomical
     * twilight.
     *
     * @return the event time, or {@code null} if it does not happen within {@code limitDays}
     * @throws IllegalArgumentException for the Earth, a non-positive limit or
     *         an altitude outside [-90, +90]
     */
    public static AstroTime searchAltitude(Body body, Observer observer, Direction direction,
                                           AstroTime start, double limitDays, double altitude) {
        if (!(altitude >= -90.0 && altitude <= +90.0)) {
            throw new IllegalArgumentException("Invalid altitude angle " + altitude);
        }
        return searchAltitudeInternal(body, observer, direction, start, limitDays, 0.0, altitude);
    }

    private static AstroTime searchAltitudeInternal(Body body, Observer observer, Direction direction,
                                                    AstroTime start, double limitDays,
                                                    double bodyRadiusAu, double targetAltitude) {
        requireNotEarth(body);
        Objects.requireNonNull(observer, "observer");
        Objects.requireNonNull(direction, "direction");
        if (!(limitDays > 0.0)) {
            throw new IllegalArgumentException("Search limit must be positive: " + limitDays);
        }

        double haBefore = direction == Direction.RISE ? 12.0 : 0.0;
        double haAfter = direction == Direction.RISE ? 0.0 : 12.0;
        Search.SearchFunction altitudeError = t -> {
            Ephemeris.Equatorial ofdate = Ephemeris.equator(body, t, observer, true, true);
            Ephemeris.Horizontal hor = Ephemeris.horizon(t, observer, ofdate.ra, ofdate.dec, Refraction.NONE);
            double limb = Math.toDegrees(Math.asin(bodyRadiusAu / ofdate.dist));
            return direction.sign * (hor.altitude + limb - targetAltitude);
        };

        AstroTime timeBefore;
        double altBefore = altitudeError.apply(start);
        if (altBefore > 0.0) {
            // Already past the crossing; start from the culmination that precedes the next one
            timeBefore = searchHourAngle(body, observer, haBefore, start).time;
            altBefore = altitudeError.apply(timeBefore);
        } else {
            timeBefore = start;
        }
        AstroTime timeAfter = searchHourAngle(body, observer, haAfter, timeBefore).time;
        double altAfter = altitudeError.apply(timeAfter);

        for (;;) {
            if (altBefore <= 0.0 && altAfter > 0.0) {
                AstroTime time = Search.search(altitudeError, timeBefore, timeAfter, 1.0);
                if (time != null) {
                    return time.ut < start.ut + limitDays ? time : null;
                }
            }
            timeBefore = searchHourAngle(body, observer, haBefore, timeAfter).time;
            timeAfter = searchHourAngle(body, observer, haAfter, timeBefore).time;
            if (timeBefore.ut >= start.ut + limitDays) {
                return null;
            }
            altBefore = altitudeError.apply(timeBefore);
            altAfter = altitudeError.apply(timeAfter);
        }
    }

    private static void requireNotEarth(Body body) {
        Objects.requireNonNull(body, "body");
        if (body == Body.EARTH) {
            throw new IllegalArgumentException("The Earth has no position relative to an observer on it");
        }
    }

    /** Time and sky position of a body at a given hour angle. */
    public static final class HourAngleInfo {
        /** When the hour angle is reached. */
        public final AstroTime time;
        /** Refracted horizontal coordinates at that time. */
        public final Ephemeris.Horizontal hor;

        HourAngleInfo(AstroTime time, Ephemeris.Horizontal hor) {
            this.time = time;
            this.hor = hor;
        }
    }
}
