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
 * Positions of Solar System bodies.
 *
 * <p>Heliocentric and barycentric vectors come from {@link VsopModel} for
 * Mercury through Neptune, {@link PlutoPropagator} for Pluto and
 * {@link LunarTheory} for the Moon. Geocentric vectors are corrected for
 * light travel time, and optionally for aberration; observer-relative
 * coordinates add parallax, precession, nutation and refraction.</p>
 *
 * <p>All vectors are in AU, J2000 mean equator (EQJ), unless stated otherwise.</p>
 */
public final class Ephemeris {
    private static final int MAX_LIGHT_TIME_ITERATIONS = 10;

    private Ephemeris() {}

    /**
     * Loads every classpath table eagerly: the planetary series, Pluto's
     * states, the Jovian moon orbits and the constellation boundaries. Call at
     * startup to surface a missing or malformed resource before the first
     * computation.
     *
     * @throws IllegalStateException if a resource cannot be loaded
     */
    public static void preload() {
        VsopModel.preload();
        PlutoPropagator.preload();
        JupiterMoons.preload();
        Constellations.preload();
    }

    /** Heliocentric position of any body; the Sun yields the zero vector. */
    public static AstroVector helioVector(Body body, AstroTime time) {
        Objects.requireNonNull(body, "body");
        switch (body) {
            case SUN:
                return AstroVector.zero(time);
            case PLUTO:
                return PlutoPropagator.helioVector(time);
            case MOON:
                return VsopModel.helioVector(Body.EARTH, time).add(LunarTheory.geoMoon(time));
            case EMB:
                return VsopModel.helioVector(Body.EARTH, time)
                        .add(LunarTheory.geoMoon(time).scale(1.0 / (1.0 + AstroConstants.EARTH_MOON_MASS_RATIO)));
            case SSB: {
                double[] sun = MajorBodies.sunState(time.tt);
                return new AstroVector(-sun[0], -sun[1], -sun[2], time);
            }
            default:
                return VsopModel.helioVector(body, time);
        }
    }

    /** Heliocentric position and velocity of any body. */
    public static StateVector helioState(Body body, AstroTime time) {
        Objects.requireNonNull(body, "body");
        switch (body) {
            case SUN:
                return new StateVector(0, 0, 0, 0, 0, 0, time);
            case PLUTO:
                return PlutoPropagator.helioState(time);
            case MOON:
                return VsopModel.helioState(Body.EARTH, time).add(LunarTheory.geoMoonState(time));
            case EMB:
                return VsopModel.helioState(Body.EARTH, time)
                        .add(LunarTheory.geoMoonState(time).scale(1.0 / (1.0 + AstroConstants.EARTH_MOON_MASS_RATIO)));
            case SSB:
                return MajorBodies.sunBaryState(time).neg();
            default:
                return VsopModel.helioState(body, time);
        }
    }

    /** Distance from the Sun in AU. */
    public static double helioDistance(Body body, AstroTime time) {
        return helioVector(body, time).length();
    }

    /** Position and velocity relative to the Solar System barycenter. */
    public static StateVector baryState(Body body, AstroTime time) {
        Objects.requireNonNull(body, "body");
        switch (body) {
            case SSB:
                return new StateVector(0, 0, 0, 0, 0, 0, time);
            case SUN:
                return MajorBodies.sunBaryState(time);
            case PLUTO:
                return PlutoPropagator.baryState(time);
            default:
                return helioState(body, time).add(MajorBodies.sunBaryState(time));
        }
    }

    /** Geocentric Moon position; same as {@link LunarTheory#geoMoon}. */
    public static AstroVector geoMoon(AstroTime time) {
        return LunarTheory.geoMoon(time);
    }

    /**
     * Geocentric position of a body as seen at {@code time}, i.e. where the
     * body was when the light now arriving left it.
     *
     * @param aberration if {@code true}, the Earth is also backdated by the
     *        light time, which approximates annual aberration
     * @throws IllegalStateException if the light-time iteration does not settle
     */
    public static AstroVector geoVector(Body body, AstroTime time, boolean aberration) {
        Objects.requireNonNull(body, "body");
        if (body == Body.MOON) {
            return LunarTheory.geoMoon(time);
        }
        if (body == Body.EARTH) {
            return AstroVector.zero(time);
        }

        AstroVector earth = aberration ? null : VsopModel.helioVector(Body.EARTH, time);
        AstroTime ltime = time;
        for (int iter = 0; iter < MAX_LIGHT_TIME_ITERATIONS; iter++) {
            AstroVector pos = helioVector(body, ltime);
            if (aberration) {
                earth = VsopModel.helioVector(Body.EARTH, ltime);
            }
            AstroVector geo = new AstroVector(pos.x - earth.x, pos.y - earth.y, pos.z - earth.z, time);
            AstroTime ltime2 = time.addDays(-geo.length() / AstroConstants.C_AUDAY);
            if (Math.abs(ltime2.tt - ltime.tt) < 1.0e-9) {
                return geo;
            }
            ltime = ltime2;
        }
        throw new IllegalStateException("Light-travel time solution did not converge for " + body);
    }

    /**
     * Right ascension and declination of a body seen by an observer.
     *
     * @param ofDate {@code true} for the true equator of date, {@code false} for J2000
     */
    public static Equatorial equator(Body body, AstroTime time, Observer observer, boolean ofDate, boolean aberration) {
        Objects.requireNonNull(observer, "observer");
        AstroVector observerPos = ObserverGeometry.observerVector(time, observer, false);
        AstroVector topo = geoVector(body, time, aberration).sub(observerPos);
        AstroVector vec = ofDate ? EarthOrientation.gyrate(topo, EarthOrientation.Direction.FROM_J2000) : topo;
        return Equatorial.fromVector(vec);
    }

    /**
     * Horizontal coordinates of a point given by equator-of-date right
     * ascension and declination. With refraction, the returned RA/Dec are the
     * apparent ones, lifted along the vertical circle by the refraction angle.
     */
    public static Horizontal horizon(AstroTime time, Observer observer, double ra, double dec, Refraction refraction) {
        Objects.requireNonNull(observer, "observer");
        Objects.requireNonNull(refraction, "refraction");
        double[][] basis = Rotations.horizonBasis(time, observer);
        double[] uz = basis[0];
        double[] un = basis[1];
        double[] uw = basis[2];

        double coslat = Math.cos(Math.toRadians(dec));
        double[] p = {
            coslat * Math.cos(Math.toRadians(15.0 * ra)),
            coslat * Math.sin(Math.toRadians(15.0 * ra)),
            Math.sin(Math.toRadians(dec))
        };
        double pz = dot(p, uz);
        double pn = dot(p, un);
        double pw = dot(p, uw);

        double proj = Math.hypot(pn, pw);
        double az = 0.0;
        if (proj > 0.0) {
            az = -Math.toDegrees(Math.atan2(pw, pn));
            if (az < 0.0) az += 360.0;
        }
        double zd = Math.toDegrees(Math.atan2(proj, pz));
        double outRa = ra;
        double outDec = dec;

        if (refraction != Refraction.NONE) {
            double zd0 = zd;
            double refr = refraction.angle(90.0 - zd);
            zd -= refr;
            if (refr > 0.0 && zd > 3.0e-4) {
                double sinzd = Math.sin(Math.toRadians(zd));
                double coszd = Math.cos(Math.toRadians(zd));
                double sinzd0 = Math.sin(Math.toRadians(zd0));
                double coszd0 = Math.cos(Math.toRadians(zd0));
                double[] pr = new double[3];
                for (int j = 0; j < 3; j++) {
                    pr[j] = ((p[j] - coszd0 * uz[j]) / sinzd0) * sinzd + uz[j] * coszd;
                }
                proj = Math.hypot(pr[0], pr[1]);
                if (proj > 0.0) {
                    outRa = Math.toDegrees(Math.atan2(pr[1], pr[0])) / 15.0;
                    if (outRa < 0.0) outRa += 24.0;
                } else {
                    outRa = 0.0;
                }
                outDec = Math.toDegrees(Math.atan2(pr[2], proj));
            }
        }
        return new Horizontal(az, 90.0 - zd, outRa, outDec);
    }

    /** Converts an EQJ vector to the mean ecliptic and equinox of J2000. */
    public static Ecliptic ecliptic(AstroVector eqj) {
        AstroVector ecl = Rotations.eqjToEcl().rotate(eqj);
        Spherical s = Spherical.fromVector(ecl);
        return new Ecliptic(ecl, s.lat, s.lon);
    }

    /**
     * Geocentric Sun position in the true ecliptic and equinox of date,
     * corrected for light time and aberration.
     */
    public static Ecliptic sunPosition(AstroTime time) {
        AstroTime adjusted = time.addDays(-1.0 / AstroConstants.C_AUDAY);
        AstroVector earth = VsopModel.helioVector(Body.EARTH, adjusted);
        AstroVector sun2000 = new AstroVector(-earth.x, -earth.y, -earth.z, time);
        AstroVector eqd = EarthOrientation.gyrate(sun2000, EarthOrientation.Direction.FROM_J2000);
        AstroVector ecl = RotationMatrix.identity()
                .pivot(0, -time.tilt().trueObliquity)
                .rotate(eqd);
        Spherical s = Spherical.fromVector(ecl);
        return new Ecliptic(ecl, s.lat, s.lon);
    }

    /**
     * Heliocentric ecliptic longitude (J2000) of a body in degrees [0, 360).
     *
     * @throws IllegalArgumentException for the Sun
     */
    public static double eclipticLongitude(Body body, AstroTime time) {
        if (body == Body.SUN) {
            throw new IllegalArgumentException("The Sun has no heliocentric ecliptic longitude");
        }
        return ecliptic(helioVector(body, time)).elon;
    }

    /**
     * Geocentric ecliptic longitude of {@code body1} minus that of
     * {@code body2}, in degrees [0, 360). Aberration is not applied.
     *
     * @throws IllegalArgumentException if either body is the Earth
     */
    public static double pairLongitude(Body body1, Body body2, AstroTime time) {
        if (body1 == Body.EARTH || body2 == Body.EARTH) {
            throw new IllegalArgumentException("The Earth does not have a longitude as seen from itself");
        }
        double lon1 = ecliptic(geoVector(body1, time, false)).elon;
        double lon2 = ecliptic(geoVector(body2, time, false)).elon;
        return normalizeDegrees(lon1 - lon2);
    }

    /**
     * Angle in degrees [0, 180] between a body and the Sun as seen from the
     * center of the Earth.
     *
     * @throws IllegalArgumentException for the Earth
     */
    public static double angleFromSun(Body body, AstroTime time) {
        if (body == Body.EARTH) {
            throw new IllegalArgumentException("The Earth does not have an angle from the Sun as seen from itself");
        }
        AstroVector sv = geoVector(Body.SUN, time, true);
        AstroVector bv = geoVector(body, time, true);
        return sv.angleWith(bv);
    }

    /** [0, 360) */
    static double normalizeDegrees(double angle) {
        angle %= 360.0;
        if (angle < 0.0) angle += 360.0;
        return angle;
    }

    private static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    /** Equatorial angular coordinates together with the vector they describe. */
    public static final class Equatorial {
        /** Right ascension in sidereal hours [0, 24). */
        public final double ra;
        /** Declination in degrees [-90, +90]. */
        public final double dec;
        /** Distance in AU. */
        public final double dist;
        /** Cartesian vector in the same frame. */
        public final AstroVector vec;

        Equatorial(double ra, double dec, double dist, AstroVector vec) {
            this.ra = ra;
            this.dec = dec;
            this.dist = dist;
            this.vec = vec;
        }

        static Equatorial fromVector(AstroVector vec) {
            Spherical s = Spherical.fromVector(vec);
            return new Equatorial(s.lon / 15.0, s.lat, s.dist, vec);
        }
    }

    /** Altitude and azimuth, with the right ascension and declination they were computed from. */
    public static final class Horizontal {
        /** Degrees clockwise from north [0, 360). */
        public final double azimuth;
        /** Degrees above the horizon. */
        public final double altitude;
        /** Right ascension in hours, refraction-adjusted when refraction is on. */
        public final double ra;
        /** Declination in degrees, refraction-adjusted when refraction is on. */
        public final double dec;

        Horizontal(double azimuth, double altitude, double ra, double dec) {
            this.azimuth = azimuth;
            this.altitude = altitude;
            this.ra = ra;
            this.dec = dec;
        }
    }

    /** Ecliptic coordinates. */
    public static final class Ecliptic {
        /** Cartesian vector in the ecliptic frame. */
        public final AstroVector vec;
        /** Latitude in degrees. */
        public final double elat;
        /** Longitude in degrees [0, 360). */
        public final double elon;

        Ecliptic(AstroVector vec, double elat, double elon) {
            this.vec = vec;
            this.elat = elat;
            this.elon = elon;
        }
    }
}
