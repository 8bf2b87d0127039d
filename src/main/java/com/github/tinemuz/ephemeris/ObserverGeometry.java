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
 * Geocentric position of an observer on the Earth's ellipsoid, and back.
 *
 * <p>The Earth is modelled as an oblate spheroid with the IERS equatorial
 * radius and flattening. Vectors are in AU; heights in meters.</p>
 */
public final class ObserverGeometry {
    private static final int MAX_LATITUDE_ITERATIONS = 20;
    private static final double POLE_DISTANCE_KM = 1.0e-6;

    private ObserverGeometry() {}

    /**
     * Geocentric position of an observer.
     *
     * @param ofDate {@code true} for the equator of date (EQD), {@code false} for EQJ
     */
    public static AstroVector observerVector(AstroTime time, Observer observer, boolean ofDate) {
        StateVector s = terra(observer, time);
        AstroVector pos = s.position();
        return ofDate ? pos : EarthOrientation.gyrate(pos, EarthOrientation.Direction.INTO_J2000);
    }

    /**
     * Geocentric position and velocity of an observer, the velocity coming
     * from the Earth's rotation alone.
     *
     * @param ofDate {@code true} for the equator of date (EQD), {@code false} for EQJ
     */
    public static StateVector observerState(AstroTime time, Observer observer, boolean ofDate) {
        StateVector s = terra(observer, time);
        return ofDate ? s : EarthOrientation.gyrate(s, EarthOrientation.Direction.INTO_J2000);
    }

    /**
     * Geographic location under a geocentric vector, with the height of the
     * vector's tip above the ellipsoid.
     *
     * @param ofDate {@code true} if {@code vector} is in EQD, {@code false} for EQJ
     * @throws IllegalStateException if the latitude solution does not converge
     */
    public static Observer vectorObserver(AstroVector vector, boolean ofDate) {
        Objects.requireNonNull(vector, "vector");
        AstroVector eqd = ofDate ? vector : EarthOrientation.gyrate(vector, EarthOrientation.Direction.FROM_J2000);
        return inverseTerra(eqd, EarthOrientation.siderealTime(vector.t));
    }

    /**
     * Effective gravitational acceleration (m/s^2) at an observer's location,
     * combining gravity and the centrifugal effect of the Earth's rotation
     * (WGS 84 normal gravity with a height correction).
     */
    public static double observerGravity(double latitude, double height) {
        double s = Math.sin(Math.toRadians(latitude));
        double s2 = s * s;
        double g0 = 9.7803253359 * (1.0 + 0.00193185265241 * s2) / Math.sqrt(1.0 - 0.00669437999013 * s2);
        return g0 * (1.0 - (3.15704e-07 - 2.10269e-09 * s2) * height + 7.37452e-14 * height * height);
    }

    static StateVector terra(Observer observer, AstroTime time) {
        double st = EarthOrientation.siderealTime(time);
        double phi = Math.toRadians(observer.latitude);
        double sinphi = Math.sin(phi);
        double cosphi = Math.cos(phi);
        double c = 1.0 / Math.hypot(cosphi, AstroConstants.EARTH_FLATTENING * sinphi);
        double s = AstroConstants.EARTH_FLATTENING_SQUARED * c;
        double heightKm = observer.height / 1000.0;
        double ach = AstroConstants.EARTH_EQUATORIAL_RADIUS_KM * c + heightKm;
        double ash = AstroConstants.EARTH_EQUATORIAL_RADIUS_KM * s + heightKm;
        double stlocl = Math.toRadians(15.0 * st + observer.longitude);
        double sinst = Math.sin(stlocl);
        double cosst = Math.cos(stlocl);
        // Rotation speed in km/day
        double spin = AstroConstants.EARTH_ANGULAR_VELOCITY * AstroConstants.SECONDS_PER_DAY;

        return new StateVector(
                ach * cosphi * cosst / AstroConstants.KM_PER_AU,
                ach * cosphi * sinst / AstroConstants.KM_PER_AU,
                ash * sinphi / AstroConstants.KM_PER_AU,
                -spin * ach * cosphi * sinst / AstroConstants.KM_PER_AU,
                +spin * ach * cosphi * cosst / AstroConstants.KM_PER_AU,
                0.0,
                time);
    }

    /** Newton iteration on the meridian-plane ellipse equation for geodetic latitude. */
    static Observer inverseTerra(AstroVector eqd, double siderealHours) {
        double x = eqd.x * AstroConstants.KM_PER_AU;
        double y = eqd.y * AstroConstants.KM_PER_AU;
        double z = eqd.z * AstroConstants.KM_PER_AU;
        double p = Math.hypot(x, y);
        double lonDeg;
        double latDeg;
        double heightKm;

        if (p < POLE_DISTANCE_KM) {
            lonDeg = 0.0;
            latDeg = z > 0.0 ? +90.0 : -90.0;
            heightKm = Math.abs(z) - AstroConstants.EARTH_POLAR_RADIUS_KM;
        } else {
            double stlocl = Math.atan2(y, x);
            lonDeg = normalizeLongitude(Math.toDegrees(stlocl) - 15.0 * siderealHours);

            double f = AstroConstants.EARTH_FLATTENING_SQUARED;
            double factor = (f - 1.0) * AstroConstants.EARTH_EQUATORIAL_RADIUS_KM;
            double lat = Math.atan(z / p);
            double cos;
            double sin;
            double denom;
            for (int iter = 0; ; iter++) {
                if (iter == MAX_LATITUDE_ITERATIONS) {
                    throw new IllegalStateException("Geodetic latitude solution did not converge");
                }
                cos = Math.cos(lat);
                sin = Math.sin(lat);
                double cos2 = cos * cos;
                double sin2 = sin * sin;
                denom = Math.sqrt(cos2 + f * sin2);
                double w = (factor * sin * cos) / denom - z * cos + p * sin;
                if (Math.abs(w) < 1.0e-8) {
                    break;
                }
                double d = factor * ((cos2 - sin2) / denom - sin2 * cos2 * (f - 1.0) / (denom * denom * denom))
                        + z * sin + p * cos;
                lat -= w / d;
            }
            latDeg = Math.toDegrees(lat);
            double adjust = AstroConstants.EARTH_EQUATORIAL_RADIUS_KM / denom;
            if (Math.abs(sin) > Math.abs(cos)) {
                heightKm = z / sin - f * adjust;
            } else {
                heightKm = p / cos - adjust;
            }
        }
        return new Observer(latDeg, lonDeg, 1000.0 * heightKm);
    }

    // (-180, +180]
    static double normalizeLongitude(double lon) {
        lon %= 360.0;
        if (lon <= -180.0) lon += 360.0;
        else if (lon > 180.0) lon -= 360.0;
        return lon;
    }
}
