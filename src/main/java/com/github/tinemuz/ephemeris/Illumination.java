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
 * Visual magnitude and phase of Solar System bodies as seen from the Earth.
 *
 * <p>Planet magnitudes use the phase-curve polynomials of the Astronomical
 * Almanac; Saturn adds the brightening of its rings.</p>
 */
public final class Illumination {
    private static final double SUN_MAG_1AU = -0.17 - 5.0 * Math.log10(AstroConstants.AU_PER_PARSEC);
    private static final double MOON_MEAN_DISTANCE_AU = 385000.6 / AstroConstants.KM_PER_AU;
    private static final double MAG_SLOPE_DT_DAYS = 0.1;

    private Illumination() {}

    /**
     * Brightness and phase of a body.
     *
     * @throws IllegalArgumentException for the Earth
     */
    public static IllumInfo illumination(Body body, AstroTime time) {
        Objects.requireNonNull(body, "body");
        if (body == Body.EARTH) {
            throw new IllegalArgumentException("The Earth's illumination is not defined as seen from itself");
        }
        AstroVector earth = VsopModel.helioVector(Body.EARTH, time);
        AstroVector gc;
        AstroVector hc;
        double phaseAngle;
        if (body == Body.SUN) {
            gc = earth.neg();
            hc = AstroVector.zero(time);
            phaseAngle = 0.0;
        } else {
            if (body == Body.MOON) {
                gc = LunarTheory.geoMoon(time);
                hc = earth.add(gc);
            } else {
                hc = Ephemeris.helioVector(body, time);
                gc = hc.sub(earth);
            }
            phaseAngle = gc.angleWith(hc);
        }

        double geoDist = gc.length();
        double helioDist = hc.length();
        double ringTilt = 0.0;
        double mag;
        switch (body) {
            case SUN:
                mag = SUN_MAG_1AU + 5.0 * Math.log10(geoDist);
                break;
            case MOON:
                mag = moonMagnitude(phaseAngle, helioDist, geoDist);
                break;
            case SATURN: {
                Ephemeris.Ecliptic eclip = Ephemeris.ecliptic(gc);
                double ir = Math.toRadians(28.06);
                double nr = Math.toRadians(169.51 + 3.82e-5 * time.tt);
                double lat = Math.toRadians(eclip.elat);
                double lon = Math.toRadians(eclip.elon);
                double tilt = Math.asin(Math.sin(lat) * Math.cos(ir) - Math.cos(lat) * Math.sin(ir) * Math.sin(lon - nr));
                double sinTilt = Math.sin(Math.abs(tilt));
                mag = -9.0 + 0.044 * phaseAngle;
                mag += sinTilt * (-2.6 + 1.2 * sinTilt);
                mag += 5.0 * Math.log10(helioDist * geoDist);
                ringTilt = Math.toDegrees(tilt);
                break;
            }
            default:
                mag = planetMagnitude(body, phaseAngle, helioDist, geoDist);
                break;
        }
        double phaseFraction = (1.0 + Math.cos(Math.toRadians(phaseAngle))) / 2.0;
        return new IllumInfo(time, mag, phaseAngle, phaseFraction, helioDist, ringTilt);
    }

    /**
     * Next time after {@code start} that Venus is at its brightest.
     *
     * @throws IllegalArgumentException for any body other than Venus
     */
    public static IllumInfo searchPeakMagnitude(Body body, AstroTime start) {
        if (body != Body.VENUS) {
            throw new IllegalArgumentException("Peak magnitude is only searched for Venus, not " + body);
        }
        AstroTime time = Elongations.searchSlopeZero(body, start, 10.0, 30.0,
                t -> magnitudeSlope(body, t), "magnitude");
        return illumination(body, time);
    }

    private static double magnitudeSlope(Body body, AstroTime time) {
        AstroTime t1 = time.addDays(-MAG_SLOPE_DT_DAYS / 2.0);
        AstroTime t2 = time.addDays(+MAG_SLOPE_DT_DAYS / 2.0);
        double y1 = illumination(body, t1).mag;
        double y2 = illumination(body, t2).mag;
        return (y2 - y1) / MAG_SLOPE_DT_DAYS;
    }

    private static double moonMagnitude(double phase, double helioDist, double geoDist) {
        double rad = Math.toRadians(phase);
        double rad2 = rad * rad;
        double rad4 = rad2 * rad2;
        double mag = -12.717 + 1.49 * Math.abs(rad) + 0.0431 * rad4;
        double geoAu = geoDist / MOON_MEAN_DISTANCE_AU;
        mag += 5.0 * Math.log10(helioDist * geoAu);
        return mag;
    }

    private static double planetMagnitude(Body body, double phase, double helioDist, double geoDist) {
        double c0;
        double c1 = 0.0;
        double c2 = 0.0;
        double c3 = 0.0;
        switch (body) {
            case MERCURY:
                c0 = -0.60; c1 = +4.98; c2 = -4.88; c3 = +3.02;
                break;
            case VENUS:
                if (phase < 163.6) {
                    c0 = -4.47; c1 = +1.03; c2 = +0.57; c3 = +0.13;
                } else {
                    c0 = +0.98; c1 = -1.02;
                }
                break;
            case MARS:
                c0 = -1.52; c1 = +1.60;
                break;
            case JUPITER:
                c0 = -9.40; c1 = +0.50;
                break;
            case URANUS:
                c0 = -7.19; c1 = +0.25;
                break;
            case NEPTUNE:
                c0 = -6.87;
                break;
            case PLUTO:
                c0 = -1.00; c1 = +4.00;
                break;
            default:
                throw new IllegalArgumentException("No magnitude model for " + body);
        }
        double x = phase / 100.0;
        double mag = c0 + x * (c1 + x * (c2 + x * c3));
        mag += 5.0 * Math.log10(helioDist * geoDist);
        return mag;
    }

    /** Brightness and phase of a body at one instant. */
    public static final class IllumInfo {
        /** When the values were computed. */
        public final AstroTime time;
        /** Apparent visual magnitude. */
        public final double mag;
        /** Sun-body-Earth angle in degrees; 0 is fully lit. */
        public final double phaseAngle;
        /** Illuminated fraction of the disc, [0, 1]. */
        public final double phaseFraction;
        /** Distance from the Sun, AU. */
        public final double helioDist;
        /** Tilt of Saturn's rings toward the Earth in degrees; zero for other bodies. */
        public final double ringTilt;

        IllumInfo(AstroTime time, double mag, double phaseAngle, double phaseFraction, double helioDist, double ringTilt) {
            this.time = time;
            this.mag = mag;
            this.phaseAngle = phaseAngle;
            this.phaseFraction = phaseFraction;
            this.helioDist = helioDist;
            this.ringTilt = ringTilt;
        }
    }
}
