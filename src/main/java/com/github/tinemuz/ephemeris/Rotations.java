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
 * Rotation matrices between the supported reference frames.
 *
 * <ul>
 *   <li>EQJ: mean equator and equinox of J2000</li>
 *   <li>EQD: true equator and equinox of date</li>
 *   <li>ECL: mean ecliptic and equinox of J2000</li>
 *   <li>HOR: observer's horizon, x north, y west, z zenith</li>
 *   <li>GAL: IAU galactic coordinates (Hipparcos definition)</li>
 * </ul>
 *
 * <p>Every {@code a_b} rotation has a {@code b_a} counterpart that is its inverse.</p>
 */
public final class Rotations {
    private static final RotationMatrix EQJ_GAL = new RotationMatrix(new double[][] {
        {-0.0548755604, -0.8734370902, -0.4838350155},
        {+0.4941094279, -0.4448296300, +0.7469822445},
        {-0.8676661490, -0.1980763734, +0.4559837762}
    });

    private Rotations() {}

    public static RotationMatrix eqjToEcl() {
        double ob = Math.toRadians(EarthOrientation.obliquityJ2000());
        double c = Math.cos(ob);
        double s = Math.sin(ob);
        return new RotationMatrix(new double[][] {
            {1, 0, 0},
            {0, c, s},
            {0, -s, c}
        });
    }

    public static RotationMatrix eclToEqj() {
        return eqjToEcl().inverse();
    }

    public static RotationMatrix eqjToEqd(AstroTime time) {
        return EarthOrientation.gyration(time, EarthOrientation.Direction.FROM_J2000);
    }

    public static RotationMatrix eqdToEqj(AstroTime time) {
        return EarthOrientation.gyration(time, EarthOrientation.Direction.INTO_J2000);
    }

    /** Equator of date to the observer's horizon; depends on sidereal time. */
    public static RotationMatrix eqdToHor(AstroTime time, Observer observer) {
        double[][] basis = horizonBasis(time, observer);
        // rows: north, west, zenith
        return new RotationMatrix(new double[][] {basis[1], basis[2], basis[0]});
    }

    public static RotationMatrix horToEqd(AstroTime time, Observer observer) {
        return eqdToHor(time, observer).inverse();
    }

    public static RotationMatrix eqjToHor(AstroTime time, Observer observer) {
        return RotationMatrix.combine(eqjToEqd(time), eqdToHor(time, observer));
    }

    public static RotationMatrix horToEqj(AstroTime time, Observer observer) {
        return eqjToHor(time, observer).inverse();
    }

    public static RotationMatrix eqdToEcl(AstroTime time) {
        return RotationMatrix.combine(eqdToEqj(time), eqjToEcl());
    }

    public static RotationMatrix eclToEqd(AstroTime time) {
        return eqdToEcl(time).inverse();
    }

    public static RotationMatrix eclToHor(AstroTime time, Observer observer) {
        return RotationMatrix.combine(eclToEqd(time), eqdToHor(time, observer));
    }

    public static RotationMatrix horToEcl(AstroTime time, Observer observer) {
        return eclToHor(time, observer).inverse();
    }

    public static RotationMatrix eqjToGal() {
        return EQJ_GAL;
    }

    public static RotationMatrix galToEqj() {
        return EQJ_GAL.inverse();
    }

    /**
     * Horizontal angles of a HOR vector: {@code lat} is altitude and
     * {@code lon} azimuth measured clockwise from north, with refraction applied.
     */
    public static Spherical horizonFromVector(AstroVector vector, Refraction refraction) {
        Spherical s = Spherical.fromVector(vector);
        return new Spherical(s.lat + refraction.angle(s.lat), toggleAzimuth(s.lon), s.dist);
    }

    /**
     * HOR vector for horizontal angles as produced by
     * {@link #horizonFromVector}, removing the refraction that was applied.
     */
    public static AstroVector vectorFromHorizon(Spherical horizontal, AstroTime time, Refraction refraction) {
        double lat = horizontal.lat + refraction.inverseAngle(horizontal.lat);
        return new Spherical(lat, toggleAzimuth(horizontal.lon), horizontal.dist).toVector(time);
    }

    /**
     * Zenith, north and west unit vectors of an observer's horizon expressed
     * in the equator of date, in that order.
     */
    static double[][] horizonBasis(AstroTime time, Observer observer) {
        double latRad = Math.toRadians(observer.latitude);
        double lonRad = Math.toRadians(observer.longitude);
        double sinlat = Math.sin(latRad);
        double coslat = Math.cos(latRad);
        double sinlon = Math.sin(lonRad);
        double coslon = Math.cos(lonRad);

        double[] uze = {coslat * coslon, coslat * sinlon, sinlat};
        double[] une = {-sinlat * coslon, -sinlat * sinlon, coslat};
        double[] uwe = {sinlon, -coslon, 0.0};

        double spinAngle = -15.0 * EarthOrientation.siderealTime(time);
        return new double[][] {spin(spinAngle, uze), spin(spinAngle, une), spin(spinAngle, uwe)};
    }

    // Turn an Earth-fixed vector by the given angle (degrees) about the z axis
    private static double[] spin(double angle, double[] pos) {
        double rad = Math.toRadians(angle);
        double c = Math.cos(rad);
        double s = Math.sin(rad);
        return new double[] {c * pos[0] + s * pos[1], c * pos[1] - s * pos[0], pos[2]};
    }

    private static double toggleAzimuth(double az) {
        az = 360.0 - az;
        if (az >= 360.0) az -= 360.0;
        else if (az < 0.0) az += 360.0;
        return az;
    }
}
