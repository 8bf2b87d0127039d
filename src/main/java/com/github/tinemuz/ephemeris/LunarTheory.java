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
 * Geocentric Moon from the truncated ELP-2000/82 theory as tabulated by
 * Meeus (Astronomical Algorithms, ch. 47), plus the Moon's optical and
 * physical libration (ch. 53).
 *
 * <p>The series yields ecliptic longitude and latitude referred to the mean
 * equinox of date, and the Earth-Moon distance. Positions are converted to
 * EQJ; velocities are symmetric finite differences of positions.</p>
 */
public final class LunarTheory {
    // Step for finite-difference velocity: 1e-5 day is 0.864 seconds
    private static final double VELOCITY_STEP_DAYS = 1.0e-5;

    // Multipliers of D, M, M', F; sine coefficient of longitude (1e-6 deg);
    // cosine coefficient of distance (1e-3 km)
    private static final int[][] LONGITUDE_DISTANCE = {
        {0, 0, 1, 0, 6288774, -20905355},
        {2, 0, -1, 0, 1274027, -3699111},
        {2, 0, 0, 0, 658314, -2955968},
        {0, 0, 2, 0, 213618, -569925},
        {0, 1, 0, 0, -185116, 48888},
        {0, 0, 0, 2, -114332, -3149},
        {2, 0, -2, 0, 58793, 246158},
        {2, -1, -1, 0, 57066, -152138},
        {2, 0, 1, 0, 53322, -170733},
        {2, -1, 0, 0, 45758, -204586},
        {0, 1, -1, 0, -40923, -129620},
        {1, 0, 0, 0, -34720, 108743},
        {0, 1, 1, 0, -30383, 104755},
        {2, 0, 0, -2, 15327, 10321},
        {0, 0, 1, 2, -12528, 0},
        {0, 0, 1, -2, 10980, 79661},
        {4, 0, -1, 0, 10675, -34782},
        {0, 0, 3, 0, 10034, -23210},
        {4, 0, -2, 0, 8548, -21636},
        {2, 1, -1, 0, -7888, 24208},
        {2, 1, 0, 0, -6766, 30824},
        {1, 0, -1, 0, -5163, -8379},
        {1, 1, 0, 0, 4987, -16675},
        {2, -1, 1, 0, 4036, -12831},
        {2, 0, 2, 0, 3994, -10445},
        {4, 0, 0, 0, 3861, -11650},
        {2, 0, -3, 0, 3665, 14403},
        {0, 1, -2, 0, -2689, -7003},
        {2, 0, -1, 2, -2602, 0},
        {2, -1, -2, 0, 2390, 10056},
        {1, 0, 1, 0, -2348, 6322},
        {2, -2, 0, 0, 2236, -9884},
        {0, 1, 2, 0, -2120, 5751},
        {0, 2, 0, 0, -2069, 0},
        {2, -2, -1, 0, 2048, -4950},
        {2, 0, 1, -2, -1773, 4130},
        {2, 0, 0, 2, -1595, 0},
        {4, -1, -1, 0, 1215, -3958},
        {0, 0, 2, 2, -1110, 0},
        {3, 0, -1, 0, -892, 3258},
        {2, 1, 1, 0, -810, 2616},
        {4, -1, -2, 0, 759, -1897},
        {0, 2, -1, 0, -713, -2117},
        {2, 2, -1, 0, -700, 2354},
        {2, 1, -2, 0, 691, 0},
        {2, -1, 0, -2, 596, 0},
        {4, 0, 1, 0, 549, -1423},
        {0, 0, 4, 0, 537, -1117},
        {4, -1, 0, 0, 520, -1571},
        {1, 0, -2, 0, -487, -1739},
        {2, 1, 0, -2, -399, 0},
        {0, 0, 2, -2, -381, -4421},
        {1, 1, 1, 0, 351, 0},
        {3, 0, -2, 0, -340, 0},
        {4, 0, -3, 0, 330, 0},
        {2, -1, 2, 0, 327, 0},
        {0, 2, 1, 0, -323, 1165},
        {1, 1, -1, 0, 299, 0},
        {2, 0, 3, 0, 294, 0},
        {2, 0, -1, -2, 0, 8752}
    };

    // Multipliers of D, M, M', F; sine coefficient of latitude (1e-6 deg)
    private static final int[][] LATITUDE = {
        {0, 0, 0, 1, 5128122},
        {0, 0, 1, 1, 280602},
        {0, 0, 1, -1, 277693},
        {2, 0, 0, -1, 173237},
        {2, 0, -1, 1, 55413},
        {2, 0, -1, -1, 46271},
        {2, 0, 0, 1, 32573},
        {0, 0, 2, 1, 17198},
        {2, 0, 1, -1, 9266},
        {0, 0, 2, -1, 8822},
        {2, -1, 0, -1, 8216},
        {2, 0, -2, -1, 4324},
        {2, 0, 1, 1, 4200},
        {2, 1, 0, -1, -3359},
        {2, -1, -1, 1, 2463},
        {2, -1, 0, 1, 2211},
        {2, -1, -1, -1, 2065},
        {0, 1, -1, -1, -1870},
        {4, 0, -1, -1, 1828},
        {0, 1, 0, 1, -1794},
        {0, 0, 0, 3, -1749},
        {0, 1, -1, 1, -1565},
        {1, 0, 0, 1, -1491},
        {0, 1, 1, 1, -1475},
        {0, 1, 1, -1, -1410},
        {0, 1, 0, -1, -1344},
        {1, 0, 0, -1, -1335},
        {0, 0, 3, 1, 1107},
        {4, 0, 0, -1, 1021},
        {4, 0, -1, 1, 833},
        {0, 0, 1, -3, 777},
        {4, 0, -2, 1, 671},
        {2, 0, 0, -3, 607},
        {2, 0, 2, -1, 596},
        {2, -1, 1, -1, 491},
        {2, 0, -2, 1, -451},
        {0, 0, 3, -1, 439},
        {2, 0, 2, 1, 422},
        {2, 0, -3, -1, 421},
        {2, 1, -1, 1, -366},
        {2, 1, 0, 1, -351},
        {4, 0, 0, 1, 331},
        {2, -1, 1, 1, 315},
        {2, -2, 0, -1, 302},
        {0, 0, 1, 3, -283},
        {2, 1, 1, -1, -229},
        {1, 1, 0, -1, 223},
        {1, 1, 0, 1, 223},
        {0, 1, -2, -1, -220},
        {2, 1, -1, -1, -220},
        {1, 0, 1, 1, -185},
        {2, -1, -2, -1, 181},
        {0, 1, 2, 1, -177},
        {4, 0, -2, -1, 176},
        {4, -1, -1, -1, 166},
        {1, 0, 1, -1, -164},
        {4, 0, 1, -1, 132},
        {1, 0, -1, -1, -119},
        {4, -1, 0, -1, 115},
        {2, -2, 0, 1, 107}
    };

    private LunarTheory() {}

    /** Geocentric Moon position in EQJ, not corrected for light time. */
    public static AstroVector geoMoon(AstroTime time) {
        double[] p = geoMoonPosition(time.tt);
        return new AstroVector(p[0], p[1], p[2], time);
    }

    /** Geocentric Moon position and velocity in EQJ. */
    public static StateVector geoMoonState(AstroTime time) {
        double dt = VELOCITY_STEP_DAYS;
        double[] p = geoMoonPosition(time.tt);
        double[] p1 = geoMoonPosition(time.tt - dt);
        double[] p2 = geoMoonPosition(time.tt + dt);
        return new StateVector(
                p[0], p[1], p[2],
                (p2[0] - p1[0]) / (2.0 * dt),
                (p2[1] - p1[1]) / (2.0 * dt),
                (p2[2] - p1[2]) / (2.0 * dt),
                time);
    }

    /** Earth-Moon center distance in kilometers. */
    public static double distanceKm(AstroTime time) {
        return eclipticOfDate(time.tt).distanceKm();
    }

    /** Moon's ecliptic latitude referred to the mean ecliptic of date, degrees. */
    public static double eclipticLatitude(AstroTime time) {
        return eclipticOfDate(time.tt).latitude();
    }

    static double[] geoMoonPosition(double tt) {
        MoonEcliptic m = eclipticOfDate(tt);
        double lon = Math.toRadians(m.longitude());
        double lat = Math.toRadians(m.latitude());
        double r = m.distanceKm() / AstroConstants.KM_PER_AU;
        double[] ecl = {
            r * Math.cos(lat) * Math.cos(lon),
            r * Math.cos(lat) * Math.sin(lon),
            r * Math.sin(lat)
        };
        RotationMatrix rot = EarthOrientation.eclipticOfDateToJ2000(tt);
        return new double[] {
            rot.get(0, 0) * ecl[0] + rot.get(0, 1) * ecl[1] + rot.get(0, 2) * ecl[2],
            rot.get(1, 0) * ecl[0] + rot.get(1, 1) * ecl[1] + rot.get(1, 2) * ecl[2],
            rot.get(2, 0) * ecl[0] + rot.get(2, 1) * ecl[1] + rot.get(2, 2) * ecl[2]
        };
    }

    /** Mean-equinox-of-date ecliptic coordinates of the Moon for a terrestrial time. */
    static MoonEcliptic eclipticOfDate(double tt) {
        double t = tt / AstroConstants.DAYS_PER_CENTURY;
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t3 * t;

        double lp = 218.3164477 + 481267.88123421 * t - 0.0015786 * t2 + t3 / 538841.0 - t4 / 65194000.0;
        double d = 297.8501921 + 445267.1114034 * t - 0.0018819 * t2 + t3 / 545868.0 - t4 / 113065000.0;
        double m = 357.5291092 + 35999.0502909 * t - 0.0001536 * t2 + t3 / 24490000.0;
        double mp = 134.9633964 + 477198.8675055 * t + 0.0087414 * t2 + t3 / 69699.0 - t4 / 14712000.0;
        double f = 93.2720950 + 483202.0175233 * t - 0.0036539 * t2 - t3 / 3526000.0 + t4 / 863310000.0;
        double a1 = 119.75 + 131.849 * t;
        double a2 = 53.09 + 479264.290 * t;
        double a3 = 313.45 + 481266.484 * t;
        // Decreasing eccentricity of Earth's orbit scales terms involving M
        double e = 1.0 - 0.002516 * t - 0.0000074 * t2;

        double sl = 0.0;
        double sr = 0.0;
        for (int[] row : LONGITUDE_DISTANCE) {
            double arg = Math.toRadians(row[0] * d + row[1] * m + row[2] * mp + row[3] * f);
            double factor = eccentricityFactor(e, row[1]);
            sl += row[4] * factor * Math.sin(arg);
            sr += row[5] * factor * Math.cos(arg);
        }
        double sb = 0.0;
        for (int[] row : LATITUDE) {
            double arg = Math.toRadians(row[0] * d + row[1] * m + row[2] * mp + row[3] * f);
            sb += row[4] * eccentricityFactor(e, row[1]) * Math.sin(arg);
        }

        // Venus, Jupiter and flattening of the Earth
        sl += 3958.0 * sinDeg(a1) + 1962.0 * sinDeg(lp - f) + 318.0 * sinDeg(a2);
        sb += -2235.0 * sinDeg(lp) + 382.0 * sinDeg(a3) + 175.0 * sinDeg(a1 - f)
                + 175.0 * sinDeg(a1 + f) + 127.0 * sinDeg(lp - mp) - 115.0 * sinDeg(lp + mp);

        double lon = (lp + sl / 1.0e6) % 360.0;
        if (lon < 0.0) lon += 360.0;
        return new MoonEcliptic(lon, sb / 1.0e6, 385000.56 + sr / 1000.0);
    }

    private static double eccentricityFactor(double e, int mMultiplier) {
        switch (Math.abs(mMultiplier)) {
            case 0: return 1.0;
            case 1: return e;
            default: return e * e;
        }
    }

    private static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    /**
     * Lunar libration: the apparent wobble that lets an Earth-bound observer
     * see about 59% of the Moon's surface.
     */
    public static LibrationInfo libration(AstroTime time) {
        double t = time.julianCenturies();
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t2 * t2;

        MoonEcliptic moon = eclipticOfDate(time.tt);
        double mlon = Math.toRadians(moon.longitude());
        double mlat = Math.toRadians(moon.latitude());
        double distKm = moon.distanceKm();
        double r = AstroConstants.MOON_MEAN_RADIUS_KM;
        double diamDeg = 2.0 * Math.toDegrees(Math.atan(r / Math.sqrt(distKm * distKm - r * r)));

        // Inclination of the lunar equator to the ecliptic
        double inc = Math.toRadians(1.543);

        double f = Math.toRadians(normalize(93.2720950 + 483202.0175233 * t - 0.0036539 * t2 - t3 / 3526000.0 + t4 / 863310000.0));
        double omega = Math.toRadians(normalize(125.0445479 - 1934.1362891 * t + 0.0020754 * t2 + t3 / 467441.0 - t4 / 60616000.0));
        double m = Math.toRadians(normalize(357.5291092 + 35999.0502909 * t - 0.0001536 * t2 + t3 / 24490000.0));
        double mdash = Math.toRadians(normalize(134.9633964 + 477198.8675055 * t + 0.0087414 * t2 + t3 / 69699.0 - t4 / 14712000.0));
        double d = Math.toRadians(normalize(297.8501921 + 445267.1114034 * t - 0.0018819 * t2 + t3 / 545868.0 - t4 / 113065000.0));
        double e = 1.0 - 0.002516 * t - 0.0000074 * t2;

        // Optical libration
        double w = mlon - omega;
        double a = Math.atan2(
                Math.sin(w) * Math.cos(mlat) * Math.cos(inc) - Math.sin(mlat) * Math.sin(inc),
                Math.cos(w) * Math.cos(mlat));
        double ldash = longitudeOffset(Math.toDegrees(a - f));
        double bdash = Math.asin(-Math.sin(w) * Math.cos(mlat) * Math.sin(inc) - Math.sin(mlat) * Math.cos(inc));

        // Physical libration
        double k1 = Math.toRadians(119.75 + 131.849 * t);
        double k2 = Math.toRadians(72.56 + 20.186 * t);

        double rho = -0.02752 * Math.cos(mdash)
                - 0.02245 * Math.sin(f)
                + 0.00684 * Math.cos(mdash - 2 * f)
                - 0.00293 * Math.cos(2 * f)
                - 0.00085 * Math.cos(2 * f - 2 * d)
                - 0.00054 * Math.cos(mdash - 2 * d)
                - 0.00020 * Math.sin(mdash + f)
                - 0.00020 * Math.cos(mdash + 2 * f)
                - 0.00020 * Math.cos(mdash - f)
                + 0.00014 * Math.cos(mdash + 2 * f - 2 * d);

        double sigma = -0.02816 * Math.sin(mdash)
                + 0.02244 * Math.cos(f)
                - 0.00682 * Math.sin(mdash - 2 * f)
                - 0.00279 * Math.sin(2 * f)
                - 0.00083 * Math.sin(2 * f - 2 * d)
                + 0.00069 * Math.sin(mdash - 2 * d)
                + 0.00040 * Math.cos(mdash + f)
                - 0.00025 * Math.sin(2 * mdash)
                - 0.00023 * Math.sin(mdash + 2 * f)
                + 0.00020 * Math.cos(mdash - f)
                + 0.00019 * Math.sin(mdash - f)
                + 0.00013 * Math.sin(mdash + 2 * f - 2 * d)
                - 0.00010 * Math.cos(mdash - 3 * f);

        double tau = 0.02520 * e * Math.sin(m)
                + 0.00473 * Math.sin(2 * mdash - 2 * f)
                - 0.00467 * Math.sin(mdash)
                + 0.00396 * Math.sin(k1)
                + 0.00276 * Math.sin(2 * mdash - 2 * d)
                + 0.00196 * Math.sin(omega)
                - 0.00183 * Math.cos(mdash - f)
                + 0.00115 * Math.sin(mdash - 2 * d)
                - 0.00096 * Math.sin(mdash - d)
                + 0.00046 * Math.sin(2 * f - 2 * d)
                - 0.00039 * Math.sin(mdash - f)
                - 0.00032 * Math.sin(mdash - m - d)
                + 0.00027 * Math.sin(2 * mdash - m - 2 * d)
                + 0.00023 * Math.sin(k2)
                - 0.00014 * Math.sin(2 * d)
                + 0.00014 * Math.cos(2 * mdash - 2 * f)
                - 0.00012 * Math.sin(mdash - 2 * f)
                - 0.00012 * Math.sin(2 * mdash)
                + 0.00011 * Math.sin(2 * mdash - 2 * m - 2 * d);

        double ldash2 = -tau + (rho * Math.cos(a) + sigma * Math.sin(a)) * Math.tan(bdash);
        double bdash2 = sigma * Math.cos(a) - rho * Math.sin(a);

        return new LibrationInfo(
                Math.toDegrees(bdash) + bdash2,
                ldash + ldash2,
                moon.latitude(),
                moon.longitude(),
                distKm,
                diamDeg);
    }

    private static double normalize(double degrees) {
        double lon = degrees % 360.0;
        if (lon < 0.0) lon += 360.0;
        return lon;
    }

    private static double longitudeOffset(double diff) {
        double offset = diff;
        while (offset <= -180.0) offset += 360.0;
        while (offset > 180.0) offset -= 360.0;
        return offset;
    }

    /**
     * Libration angles and related geometry of the Moon at one instant.
     */
    public static final class LibrationInfo {
        /** Sub-Earth libration ecliptic latitude angle, degrees. */
        public final double elat;

        /** Sub-Earth libration ecliptic longitude angle, degrees. */
        public final double elon;

        /** Moon's geocentric ecliptic latitude (mean equinox of date), degrees. */
        public final double mlat;

        /** Moon's geocentric ecliptic longitude (mean equinox of date), degrees. */
        public final double mlon;

        /** Distance between the centers of the Earth and Moon, kilometers. */
        public final double distKm;

        /** Apparent angular diameter of the Moon, degrees. */
        public final double diamDeg;

        LibrationInfo(double elat, double elon, double mlat, double mlon, double distKm, double diamDeg) {
            this.elat = elat;
            this.elon = elon;
            this.mlat = mlat;
            this.mlon = mlon;
            this.distKm = distKm;
            this.diamDeg = diamDeg;
        }
    }

    // Longitude/latitude in degrees, distance in km
    record MoonEcliptic(double longitude, double latitude, double distanceKm) {}
}
