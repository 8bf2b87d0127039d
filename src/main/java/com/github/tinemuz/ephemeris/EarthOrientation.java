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
 * Orientation of the Earth's axis and rotation: precession, nutation, their
 * composition ("gyration") and sidereal time.
 *
 * <p>Precession uses the IAU 2006 angles (Capitaine et al. 2003); nutation
 * comes from {@link Nutation}. Equator-of-date here always means the true
 * equator and equinox of date.</p>
 */
public final class EarthOrientation {

    /** Which way a precession or nutation matrix converts. */
    public enum Direction {
        /** From the J2000 mean equator to the equator of date. */
        FROM_J2000,
        /** From the equator of date back to the J2000 mean equator. */
        INTO_J2000
    }

    private static final double ASEC2RAD = Math.PI / (180.0 * 3600.0);

    private EarthOrientation() {}

    /** Mean obliquity of the ecliptic in arcseconds for a terrestrial time. */
    static double meanObliquityArcsec(double tt) {
        double t = tt / AstroConstants.DAYS_PER_CENTURY;
        return ((((-0.0000000434 * t - 0.000000576) * t + 0.00200340) * t
                - 0.0001831) * t - 46.836769) * t + 84381.406;
    }

    /** Mean obliquity of the ecliptic in degrees. */
    public static double meanObliquity(AstroTime time) {
        return meanObliquityArcsec(time.tt) / 3600.0;
    }

    /** Obliquity of the mean ecliptic of J2000 in degrees. */
    public static double obliquityJ2000() {
        return 84381.406 / 3600.0;
    }

    /** Nutation angles and obliquity; same as {@link AstroTime#tilt()}. */
    public static EarthTilt tilt(AstroTime time) {
        return time.tilt();
    }

    /** Precession matrix between the J2000 mean equator and the mean equator of date. */
    public static RotationMatrix precession(AstroTime time, Direction dir) {
        return precession(time.tt, dir);
    }

    static RotationMatrix precession(double tt, Direction dir) {
        double t = tt / AstroConstants.DAYS_PER_CENTURY;
        double eps0 = 84381.406;

        double psia = ((((-0.0000000951 * t + 0.000132851) * t - 0.00114045) * t
                - 1.0790069) * t + 5038.481507) * t;
        double omegaa = ((((+0.0000003337 * t - 0.000000467) * t - 0.00772503) * t
                + 0.0512623) * t - 0.025754) * t + eps0;
        double chia = ((((-0.0000000560 * t + 0.000170663) * t - 0.00121197) * t
                - 2.3814292) * t + 10.556403) * t;

        eps0 *= ASEC2RAD;
        psia *= ASEC2RAD;
        omegaa *= ASEC2RAD;
        chia *= ASEC2RAD;

        double sa = Math.sin(eps0);
        double ca = Math.cos(eps0);
        double sb = Math.sin(-psia);
        double cb = Math.cos(-psia);
        double sc = Math.sin(-omegaa);
        double cc = Math.cos(-omegaa);
        double sd = Math.sin(chia);
        double cd = Math.cos(chia);

        double xx = cd * cb - sb * sd * cc;
        double yx = cd * sb * ca + sd * cc * cb * ca - sa * sd * sc;
        double zx = cd * sb * sa + sd * cc * cb * sa + ca * sd * sc;
        double xy = -sd * cb - sb * cd * cc;
        double yy = -sd * sb * ca + cd * cc * cb * ca - sa * cd * sc;
        double zy = -sd * sb * sa + cd * cc * cb * sa + ca * cd * sc;
        double xz = sb * sc;
        double yz = -sc * cb * ca - sa * cc;
        double zz = -sc * cb * sa + cc * ca;

        RotationMatrix fromJ2000 = new RotationMatrix(new double[][] {
            {xx, yx, zx},
            {xy, yy, zy},
            {xz, yz, zz}
        });
        return dir == Direction.FROM_J2000 ? fromJ2000 : fromJ2000.inverse();
    }

    /** Nutation matrix between the mean and true equator of date. */
    public static RotationMatrix nutation(AstroTime time, Direction dir) {
        EarthTilt tilt = time.tilt();
        double oblm = Math.toRadians(tilt.meanObliquity);
        double oblt = Math.toRadians(tilt.trueObliquity);
        double psi = tilt.dpsi * ASEC2RAD;
        double cobm = Math.cos(oblm);
        double sobm = Math.sin(oblm);
        double cobt = Math.cos(oblt);
        double sobt = Math.sin(oblt);
        double cpsi = Math.cos(psi);
        double spsi = Math.sin(psi);

        RotationMatrix meanToTrue = new RotationMatrix(new double[][] {
            {cpsi, -spsi * cobm, -spsi * sobm},
            {spsi * cobt, cpsi * cobm * cobt + sobm * sobt, cpsi * sobm * cobt - cobm * sobt},
            {spsi * sobt, cpsi * cobm * sobt - sobm * cobt, cpsi * sobm * sobt + cobm * cobt}
        });
        return dir == Direction.FROM_J2000 ? meanToTrue : meanToTrue.inverse();
    }

    /**
     * Precession and nutation composed in the order that makes the two
     * directions exact inverses of each other.
     */
    public static RotationMatrix gyration(AstroTime time, Direction dir) {
        if (dir == Direction.FROM_J2000) {
            return RotationMatrix.combine(precession(time, dir), nutation(time, dir));
        }
        return RotationMatrix.combine(nutation(time, dir), precession(time, dir));
    }

    /** Applies {@link #gyration} to a position. */
    public static AstroVector gyrate(AstroVector v, Direction dir) {
        return gyration(v.t, dir).rotate(v);
    }

    /** Applies {@link #gyration} to a state; the frame's own rotation rate is neglected. */
    public static StateVector gyrate(StateVector s, Direction dir) {
        return gyration(s.t, dir).rotate(s);
    }

    /**
     * Rotation from the mean ecliptic and equinox of a date to the J2000 mean
     * equator, as needed by series whose output is referred to the ecliptic
     * of date.
     */
    static RotationMatrix eclipticOfDateToJ2000(double tt) {
        double eps = meanObliquityArcsec(tt) * ASEC2RAD;
        double c = Math.cos(eps);
        double s = Math.sin(eps);
        RotationMatrix eclToEqu = new RotationMatrix(new double[][] {
            {1, 0, 0},
            {0, c, -s},
            {0, s, c}
        });
        return RotationMatrix.combine(eclToEqu, precession(tt, Direction.INTO_J2000));
    }

    /** Earth Rotation Angle in degrees [0, 360). */
    public static double earthRotationAngle(AstroTime time) {
        double thet1 = 0.7790572732640 + 0.00273781191135448 * time.ut;
        double thet3 = time.ut % 1.0;
        double theta = 360.0 * ((thet1 + thet3) % 1.0);
        if (theta < 0.0) theta += 360.0;
        return theta;
    }

    /** Greenwich apparent sidereal time in hours [0, 24). */
    public static double siderealTime(AstroTime time) {
        return time.siderealTime();
    }

    static double computeSiderealTime(AstroTime time) {
        double t = time.julianCenturies();
        double eqeq = 15.0 * time.tilt().equationOfEquinoxes;
        double theta = earthRotationAngle(time);
        double st = eqeq + 0.014506
                + ((((-0.0000000368 * t - 0.000029956) * t - 0.00000044) * t
                + 1.3915817) * t + 4612.156534) * t;
        double gst = ((st / 3600.0 + theta) % 360.0) / 15.0;
        if (gst < 0.0) gst += 24.0;
        return gst;
    }
}
