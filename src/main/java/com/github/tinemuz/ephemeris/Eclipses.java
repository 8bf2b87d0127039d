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
 * Lunar eclipses, solar eclipses seen anywhere on Earth, and solar eclipses
 * seen from one location.
 *
 * <p>Candidates are full or new moons close enough to the ecliptic; the
 * shadow geometry at the moment of closest approach to the shadow axis then
 * decides whether, and what kind of, eclipse occurs.</p>
 */
public final class Eclipses {
    static final double PRUNE_LATITUDE = 1.8;
    // Added to the umbra radius when telling total from annular; matches published eclipse tables
    static final double UMBRA_BIAS_KM = 0.014;
    private static final double PHASE_LIMIT_DAYS = 40.0;
    private static final double SKIP_DAYS = 10.0;
    private static final int MAX_GLOBAL_CANDIDATES = 12;
    private static final int MAX_LOCAL_CANDIDATES = 1000;
    private static final double PENUMBRAL_WINDOW_MINUTES = 200.0;
    private static final double LOCAL_PARTIAL_WINDOW_DAYS = 0.2;
    private static final double LOCAL_TOTAL_WINDOW_DAYS = 0.01;
    private static final double MOON_POLAR_RADIUS_AU = AstroConstants.MOON_POLAR_RADIUS_KM / AstroConstants.KM_PER_AU;

    /** The kind of an eclipse. */
    public enum EclipseKind {
        /** Only the penumbra touches the target (lunar eclipses). */
        PENUMBRAL,
        PARTIAL,
        /** The Moon is inside the Sun's disc without covering it (solar eclipses). */
        ANNULAR,
        TOTAL
    }

    private Eclipses() {}

    /**
     * First lunar eclipse after {@code start}.
     *
     * @throws IllegalStateException if no eclipse is found within 12 full moons
     */
    public static LunarEclipseInfo searchLunarEclipse(AstroTime start) {
        double moonRadius = AstroConstants.MOON_MEAN_RADIUS_KM;
        AstroTime fmtime = start;
        for (int fmcount = 0; fmcount < MAX_GLOBAL_CANDIDATES; fmcount++) {
            AstroTime fullmoon = requirePhase(MoonPhases.searchMoonPhase(180.0, fmtime, PHASE_LIMIT_DAYS), fmtime);
            if (Math.abs(LunarTheory.eclipticLatitude(fullmoon)) < PRUNE_LATITUDE) {
                Shadows.ShadowInfo shadow = Shadows.peakEarthShadow(fullmoon);
                if (shadow.r < shadow.p + moonRadius) {
                    EclipseKind kind = EclipseKind.PENUMBRAL;
                    double obscuration = 0.0;
                    double sdTotal = 0.0;
                    double sdPartial = 0.0;
                    double sdPenum = shadowSemiDurationMinutes(shadow.time, shadow.p + moonRadius, PENUMBRAL_WINDOW_MINUTES);

                    if (shadow.r < shadow.k + moonRadius) {
                        kind = EclipseKind.PARTIAL;
                        sdPartial = shadowSemiDurationMinutes(shadow.time, shadow.k + moonRadius, sdPenum);
                        if (shadow.r + moonRadius < shadow.k) {
                            kind = EclipseKind.TOTAL;
                            obscuration = 1.0;
                            sdTotal = shadowSemiDurationMinutes(shadow.time, shadow.k - moonRadius, sdPartial);
                        } else {
                            obscuration = obscuration(moonRadius, shadow.k, shadow.r);
                        }
                    }
                    return new LunarEclipseInfo(kind, obscuration, shadow.time, sdPenum, sdPartial, sdTotal);
                }
            }
            fmtime = fullmoon.addDays(SKIP_DAYS);
        }
        throw new IllegalStateException("No lunar eclipse found within " + MAX_GLOBAL_CANDIDATES + " full moons of " + start);
    }

    /** The lunar eclipse after the one peaking at {@code prevPeak}. */
    public static LunarEclipseInfo nextLunarEclipse(AstroTime prevPeak) {
        return searchLunarEclipse(prevPeak.addDays(SKIP_DAYS));
    }

    /**
     * First solar eclipse visible anywhere on Earth after {@code start}.
     *
     * @throws IllegalStateException if no eclipse is found within 12 new moons
     */
    public static GlobalSolarEclipseInfo searchGlobalSolarEclipse(AstroTime start) {
        AstroTime nmtime = start;
        for (int nmcount = 0; nmcount < MAX_GLOBAL_CANDIDATES; nmcount++) {
            AstroTime newmoon = requirePhase(MoonPhases.searchMoonPhase(0.0, nmtime, PHASE_LIMIT_DAYS), nmtime);
            if (Math.abs(LunarTheory.eclipticLatitude(newmoon)) < PRUNE_LATITUDE) {
                Shadows.ShadowInfo shadow = Shadows.peakMoonShadow(newmoon);
                if (shadow.r < shadow.p + AstroConstants.EARTH_MEAN_RADIUS_KM) {
                    return geoidIntersect(shadow);
                }
            }
            nmtime = newmoon.addDays(SKIP_DAYS);
        }
        throw new IllegalStateException("No solar eclipse found within " + MAX_GLOBAL_CANDIDATES + " new moons of " + start);
    }

    /** The global solar eclipse after the one peaking at {@code prevPeak}. */
    public static GlobalSolarEclipseInfo nextGlobalSolarEclipse(AstroTime prevPeak) {
        return searchGlobalSolarEclipse(prevPeak.addDays(SKIP_DAYS));
    }

    /**
     * First solar eclipse after {@code start} that is visible from the
     * observer, i.e. with the Sun above the horizon at the beginning or end
     * of the partial phase.
     *
     * @throws IllegalStateException if none is found within 1000 new moons
     */
    public static LocalSolarEclipseInfo searchLocalSolarEclipse(AstroTime start, Observer observer) {
        Objects.requireNonNull(observer, "observer");
        AstroTime nmtime = start;
        for (int nmcount = 0; nmcount < MAX_LOCAL_CANDIDATES; nmcount++) {
            AstroTime newmoon = requirePhase(MoonPhases.searchMoonPhase(0.0, nmtime, PHASE_LIMIT_DAYS), nmtime);
            if (Math.abs(LunarTheory.eclipticLatitude(newmoon)) < PRUNE_LATITUDE) {
                Shadows.ShadowInfo shadow = Shadows.peakLocalMoonShadow(newmoon, observer);
                if (shadow.r < shadow.p) {
                    LocalSolarEclipseInfo eclipse = localEclipse(shadow, observer);
                    if (eclipse.partialBegin.altitude > 0.0 || eclipse.partialEnd.altitude > 0.0) {
                        return eclipse;
                    }
                }
            }
            nmtime = newmoon.addDays(SKIP_DAYS);
        }
        throw new IllegalStateException("No local solar eclipse found within " + MAX_LOCAL_CANDIDATES
                + " new moons of " + start + " for " + observer);
    }

    /** The local solar eclipse after the one peaking at {@code prevPeak}. */
    public static LocalSolarEclipseInfo nextLocalSolarEclipse(AstroTime prevPeak, Observer observer) {
        return searchLocalSolarEclipse(prevPeak.addDays(SKIP_DAYS), observer);
    }

    /**
     * Fraction of the area of a disc of radius {@code a} covered by a disc
     * of radius {@code b} whose center is {@code c} away. Any consistent unit
     * works, angular or linear.
     */
    static double obscuration(double a, double b, double c) {
        if (a <= 0.0) throw new IllegalArgumentException("Radius of first disc must be positive: " + a);
        if (b <= 0.0) throw new IllegalArgumentException("Radius of second disc must be positive: " + b);
        if (c < 0.0) throw new IllegalArgumentException("Distance between discs must be non-negative: " + c);

        if (c >= a + b) {
            return 0.0;
        }
        if (c == 0.0) {
            return a <= b ? 1.0 : (b * b) / (a * a);
        }
        double x = (a * a - b * b + c * c) / (2.0 * c);
        double radicand = a * a - x * x;
        if (radicand <= 0.0) {
            // One disc lies wholly inside the other
            return a <= b ? 1.0 : (b * b) / (a * a);
        }
        double y = Math.sqrt(radicand);
        double lens1 = a * a * Math.acos(x / a) - x * y;
        double lens2 = b * b * Math.acos((c - x) / b) - (c - x) * y;
        return (lens1 + lens2) / (Math.PI * a * a);
    }

    /**
     * Fraction of the Sun's disc covered by the Moon for an observer.
     *
     * @param hm heliocentric Moon
     * @param lo observer relative to the Moon
     */
    static double solarEclipseObscuration(AstroVector hm, AstroVector lo) {
        AstroVector ho = hm.add(lo);
        double sunRadius = Math.asin(AstroConstants.SUN_RADIUS_AU / ho.length());
        double moonRadius = Math.asin(MOON_POLAR_RADIUS_AU / lo.length());
        double separation = Math.toRadians(lo.angleWith(ho));
        // A central annular eclipse never quite reaches full coverage
        return Math.min(0.9999, obscuration(sunRadius, moonRadius, separation));
    }

    static EclipseKind kindFromUmbra(double k) {
        return k > UMBRA_BIAS_KM ? EclipseKind.TOTAL : EclipseKind.ANNULAR;
    }

    private static double shadowSemiDurationMinutes(AstroTime center, double radiusLimit, double windowMinutes) {
        double window = windowMinutes / (24.0 * 60.0);
        AstroTime before = center.addDays(-window);
        AstroTime after = center.addDays(+window);
        AstroTime t1 = Search.search(t -> -(Shadows.earthShadow(t).r - radiusLimit), before, center, 1.0);
        AstroTime t2 = Search.search(t -> +(Shadows.earthShadow(t).r - radiusLimit), center, after, 1.0);
        if (t1 == null || t2 == null) {
            throw new IllegalStateException("Failed to find shadow semiduration around " + center);
        }
        return (t2.ut - t1.ut) * ((24.0 * 60.0) / 2.0);
    }

    /** Where the Moon's shadow axis meets the Earth's ellipsoid, if it does. */
    private static GlobalSolarEclipseInfo geoidIntersect(Shadows.ShadowInfo shadow) {
        EclipseKind kind = EclipseKind.PARTIAL;
        AstroTime peak = shadow.time;
        double distance = shadow.r;
        double latitude = Double.NaN;
        double longitude = Double.NaN;
        double obscuration = Double.NaN;

        // Work in the equator of date with z stretched so the ellipsoid becomes a sphere
        RotationMatrix rot = Rotations.eqjToEqd(peak);
        AstroVector v = rot.rotate(shadow.dir);
        AstroVector e = rot.rotate(shadow.target);
        double km = AstroConstants.KM_PER_AU;
        double flat = AstroConstants.EARTH_FLATTENING;
        double vx = v.x * km;
        double vy = v.y * km;
        double vz = v.z * km / flat;
        double ex = e.x * km;
        double ey = e.y * km;
        double ez = e.z * km / flat;

        double radius = AstroConstants.EARTH_EQUATORIAL_RADIUS_KM;
        double a = vx * vx + vy * vy + vz * vz;
        double b = -2.0 * (vx * ex + vy * ey + vz * ez);
        double c = (ex * ex + ey * ey + ez * ez) - radius * radius;
        double radic = b * b - 4.0 * a * c;

        if (radic > 0.0) {
            // Nearer of the two intersections
            double u = (-b - Math.sqrt(radic)) / (2.0 * a);
            double px = u * vx - ex;
            double py = u * vy - ey;
            double pz = (u * vz - ez) * flat;

            double proj = Math.hypot(px, py) * AstroConstants.EARTH_FLATTENING_SQUARED;
            if (proj == 0.0) {
                latitude = pz > 0.0 ? +90.0 : -90.0;
            } else {
                latitude = Math.toDegrees(Math.atan(pz / proj));
            }
            double gast = EarthOrientation.siderealTime(peak);
            longitude = ObserverGeometry.normalizeLongitude(Math.toDegrees(Math.atan2(py, px)) - 15.0 * gast);

            // Surface point relative to the Moon, back in EQJ
            AstroVector o = Rotations.eqdToEqj(peak)
                    .rotate(new AstroVector(px / km, py / km, pz / km, peak))
                    .add(shadow.target);

            Shadows.ShadowInfo surface = Shadows.calcShadow(AstroConstants.MOON_POLAR_RADIUS_KM, peak, o, shadow.dir);
            if (surface.r > 1.0e-9 || surface.r < 0.0) {
                throw new IllegalStateException("Shadow axis intersection is " + surface.r + " km off the axis");
            }
            kind = kindFromUmbra(surface.k);
            obscuration = kind == EclipseKind.TOTAL ? 1.0 : solarEclipseObscuration(shadow.dir, o);
        }
        return new GlobalSolarEclipseInfo(kind, obscuration, peak, distance, latitude, longitude);
    }

    private static LocalSolarEclipseInfo localEclipse(Shadows.ShadowInfo shadow, Observer observer) {
        EclipseEvent peak = calcEvent(observer, shadow.time);
        AstroTime t1 = shadow.time.addDays(-LOCAL_PARTIAL_WINDOW_DAYS);
        AstroTime t2 = shadow.time.addDays(+LOCAL_PARTIAL_WINDOW_DAYS);
        EclipseEvent partialBegin = localTransition(observer, +1.0, false, t1, shadow.time);
        EclipseEvent partialEnd = localTransition(observer, -1.0, false, shadow.time, t2);
        EclipseEvent totalBegin = null;
        EclipseEvent totalEnd = null;
        EclipseKind kind;

        if (shadow.r < Math.abs(shadow.k)) {
            AstroTime tt1 = shadow.time.addDays(-LOCAL_TOTAL_WINDOW_DAYS);
            AstroTime tt2 = shadow.time.addDays(+LOCAL_TOTAL_WINDOW_DAYS);
            totalBegin = localTransition(observer, +1.0, true, tt1, shadow.time);
            totalEnd = localTransition(observer, -1.0, true, shadow.time, tt2);
            kind = kindFromUmbra(shadow.k);
        } else {
            kind = EclipseKind.PARTIAL;
        }
        double obscuration = kind == EclipseKind.TOTAL ? 1.0 : solarEclipseObscuration(shadow.dir, shadow.target);
        return new LocalSolarEclipseInfo(kind, obscuration, partialBegin, totalBegin, peak, totalEnd, partialEnd);
    }

    private static EclipseEvent localTransition(Observer observer, double direction, boolean total,
                                                AstroTime t1, AstroTime t2) {
        AstroTime time = Search.search(t -> {
            Shadows.ShadowInfo shadow = Shadows.localMoonShadow(t, observer);
            double distance = total ? Math.abs(shadow.k) - shadow.r : shadow.p - shadow.r;
            return direction * distance;
        }, t1, t2, 1.0);
        if (time == null) {
            throw new IllegalStateException("Local eclipse transition search failed between " + t1 + " and " + t2);
        }
        return calcEvent(observer, time);
    }

    private static EclipseEvent calcEvent(Observer observer, AstroTime time) {
        Ephemeris.Equatorial equ = Ephemeris.equator(Body.SUN, time, observer, true, true);
        Ephemeris.Horizontal hor = Ephemeris.horizon(time, observer, equ.ra, equ.dec, Refraction.NORMAL);
        return new EclipseEvent(time, hor.altitude);
    }

    private static AstroTime requirePhase(AstroTime time, AstroTime searchStart) {
        if (time == null) {
            throw new IllegalStateException("Moon phase search failed after " + searchStart);
        }
        return time;
    }

    /** A lunar eclipse. */
    public static final class LunarEclipseInfo {
        /** Penumbral, partial or total. */
        public final EclipseKind kind;
        /** Fraction of the Moon's disc inside the umbra at peak; zero for penumbral eclipses. */
        public final double obscuration;
        /** Time of greatest eclipse. */
        public final AstroTime peak;
        /** Half the duration of the penumbral phase, minutes. */
        public final double sdPenum;
        /** Half the duration of the partial phase, minutes; zero if there is none. */
        public final double sdPartial;
        /** Half the duration of totality, minutes; zero if there is none. */
        public final double sdTotal;

        LunarEclipseInfo(EclipseKind kind, double obscuration, AstroTime peak,
                         double sdPenum, double sdPartial, double sdTotal) {
            this.kind = kind;
            this.obscuration = obscuration;
            this.peak = peak;
            this.sdPenum = sdPenum;
            this.sdPartial = sdPartial;
            this.sdTotal = sdTotal;
        }
    }

    /** A solar eclipse as seen from the Earth as a whole. */
    public static final class GlobalSolarEclipseInfo {
        /** Partial, annular or total. */
        public final EclipseKind kind;
        /** Fraction of the Sun covered at the peak location; NaN for partial eclipses. */
        public final double obscuration;
        /** When the shadow axis passes closest to the Earth's center. */
        public final AstroTime peak;
        /** Distance of the shadow axis from the Earth's center at peak, km. */
        public final double distance;
        /** Geodetic latitude where the axis meets the surface; NaN for partial eclipses. */
        public final double latitude;
        /** Longitude where the axis meets the surface; NaN for partial eclipses. */
        public final double longitude;

        GlobalSolarEclipseInfo(EclipseKind kind, double obscuration, AstroTime peak,
                               double distance, double latitude, double longitude) {
            this.kind = kind;
            this.obscuration = obscuration;
            this.peak = peak;
            this.distance = distance;
            this.latitude = latitude;
            this.longitude = longitude;
        }
    }

    /** A moment in a local solar eclipse with the Sun's altitude then. */
    public static final class EclipseEvent {
        public final AstroTime time;
        /** Refracted altitude of the Sun's center, degrees. */
        public final double altitude;

        EclipseEvent(AstroTime time, double altitude) {
            this.time = time;
            this.altitude = altitude;
        }
    }

    /** A solar eclipse as seen by one observer. */
    public static final class LocalSolarEclipseInfo {
        public final EclipseKind kind;
        /** Fraction of the Sun's disc covered at peak. */
        public final double obscuration;
        public final EclipseEvent partialBegin;
        /** Start of totality or annularity; {@code null} for partial eclipses. */
        public final EclipseEvent totalBegin;
        public final EclipseEvent peak;
        /** End of totality or annularity; {@code null} for partial eclipses. */
        public final EclipseEvent totalEnd;
        public final EclipseEvent partialEnd;

        LocalSolarEclipseInfo(EclipseKind kind, double obscuration, EclipseEvent partialBegin,
                              EclipseEvent totalBegin, EclipseEvent peak,
                              EclipseEvent totalEnd, EclipseEvent partialEnd) {
            this.kind = kind;
            this.obscuration = obscuration;
            this.partialBegin = partialBegin;
            this.totalBegin = totalBegin;
            this.peak = peak;
            this.totalEnd = totalEnd;
            this.partialEnd = partialEnd;
        }
    }
}
