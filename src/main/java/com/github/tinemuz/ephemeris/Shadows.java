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

import java.util.function.Function;

/**
 * Shadow cone geometry shared by eclipses and transits.
 *
 * <p>A body between the Sun and a target casts a shadow along the Sun-body
 * axis. Projecting the target onto that axis gives the miss distance and the
 * umbra and penumbra radii at that point of the axis.</p>
 */
public final class Shadows {
    static final double EARTH_PEAK_WINDOW_DAYS = 0.03;
    static final double MOON_PEAK_WINDOW_DAYS = 0.03;
    static final double LOCAL_PEAK_WINDOW_DAYS = 0.2;
    static final double PLANET_PEAK_WINDOW_DAYS = 1.0;

    private Shadows() {}

    /**
     * Shadow geometry for a caster of radius {@code bodyRadiusKm}.
     *
     * @param target target position relative to the caster
     * @param dir caster position relative to the Sun
     */
    public static ShadowInfo calcShadow(double bodyRadiusKm, AstroTime time, AstroVector target, AstroVector dir) {
        double u = (dir.x * target.x + dir.y * target.y + dir.z * target.z)
                / (dir.x * dir.x + dir.y * dir.y + dir.z * dir.z);
        double dx = (u * dir.x) - target.x;
        double dy = (u * dir.y) - target.y;
        double dz = (u * dir.z) - target.z;
        double r = AstroConstants.KM_PER_AU * Math.sqrt(dx * dx + dy * dy + dz * dz);
        double k = +AstroConstants.SUN_RADIUS_KM - (1.0 + u) * (AstroConstants.SUN_RADIUS_KM - bodyRadiusKm);
        double p = -AstroConstants.SUN_RADIUS_KM + (1.0 + u) * (AstroConstants.SUN_RADIUS_KM + bodyRadiusKm);
        return new ShadowInfo(time, u, r, k, p, target, dir);
    }

    /** The Earth's shadow (atmosphere included) falling on the Moon. */
    public static ShadowInfo earthShadow(AstroTime time) {
        AstroVector s = Ephemeris.geoVector(Body.SUN, time, true);
        AstroVector m = LunarTheory.geoMoon(time);
        return calcShadow(AstroConstants.EARTH_ECLIPSE_RADIUS_KM, time, m, s.neg());
    }

    /** The Moon's shadow falling on the center of the Earth. */
    public static ShadowInfo moonShadow(AstroTime time) {
        AstroVector s = Ephemeris.geoVector(Body.SUN, time, true);
        AstroVector m = LunarTheory.geoMoon(time);
        return calcShadow(AstroConstants.MOON_MEAN_RADIUS_KM, time, m.neg(), m.sub(s));
    }

    /** The Moon's shadow falling on an observer. */
    public static ShadowInfo localMoonShadow(AstroTime time, Observer observer) {
        AstroVector pos = ObserverGeometry.observerVector(time, observer, false);
        AstroVector s = Ephemeris.geoVector(Body.SUN, time, true);
        AstroVector m = LunarTheory.geoMoon(time);
        return calcShadow(AstroConstants.MOON_MEAN_RADIUS_KM, time, pos.sub(m), m.sub(s));
    }

    /** A planet's shadow falling on the center of the Earth. */
    public static ShadowInfo planetShadow(Body body, double planetRadiusKm, AstroTime time) {
        AstroVector g = Ephemeris.geoVector(body, time, true);
        AstroVector e = Ephemeris.geoVector(Body.SUN, time, true);
        return calcShadow(planetRadiusKm, time, g.neg(), g.sub(e));
    }

    static ShadowInfo peakEarthShadow(AstroTime center) {
        return peak(Shadows::earthShadow, center, EARTH_PEAK_WINDOW_DAYS);
    }

    static ShadowInfo peakMoonShadow(AstroTime center) {
        return peak(Shadows::moonShadow, center, MOON_PEAK_WINDOW_DAYS);
    }

    static ShadowInfo peakLocalMoonShadow(AstroTime center, Observer observer) {
        return peak(t -> localMoonShadow(t, observer), center, LOCAL_PEAK_WINDOW_DAYS);
    }

    static ShadowInfo peakPlanetShadow(Body body, double planetRadiusKm, AstroTime center) {
        return peak(t -> planetShadow(body, planetRadiusKm, t), center, PLANET_PEAK_WINDOW_DAYS);
    }

    /** Time of least shadow-axis distance near {@code center}, found as a zero of the distance slope. */
    private static ShadowInfo peak(Function<AstroTime, ShadowInfo> shadow, AstroTime center, double window) {
        AstroTime t1 = center.addDays(-window);
        AstroTime t2 = center.addDays(+window);
        AstroTime tx = Search.search(slope(shadow), t1, t2, 1.0);
        if (tx == null) {
            throw new IllegalStateException("Failed to find peak shadow near " + center);
        }
        return shadow.apply(tx);
    }

    // Rate of change of the axis distance, km/day
    static Search.SearchFunction slope(Function<AstroTime, ShadowInfo> shadow) {
        double dt = 1.0 / AstroConstants.SECONDS_PER_DAY;
        return t -> {
            ShadowInfo s1 = shadow.apply(t.addDays(-dt));
            ShadowInfo s2 = shadow.apply(t.addDays(+dt));
            return (s2.r - s1.r) / dt;
        };
    }

    /** Shadow geometry at one instant. */
    public static final class ShadowInfo {
        /** When the geometry was computed. */
        public final AstroTime time;
        /** Distance along the shadow axis, in units of the Sun-caster distance. */
        public final double u;
        /** Distance of the target from the shadow axis, km. */
        public final double r;
        /** Umbra radius at the target, km; negative where the umbra has become an antumbra. */
        public final double k;
        /** Penumbra radius at the target, km. */
        public final double p;
        /** Target position relative to the caster, AU. */
        public final AstroVector target;
        /** Caster position relative to the Sun, AU. */
        public final AstroVector dir;

        ShadowInfo(AstroTime time, double u, double r, double k, double p, AstroVector target, AstroVector dir) {
            this.time = time;
            this.u = u;
            this.r = r;
            this.k = k;
            this.p = p;
            this.target = target;
            this.dir = dir;
        }
    }
}
