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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heliocentric planetary positions from truncated VSOP87 (version D) series.
 *
 * <p>Each planet has three formulas (longitude L, latitude B, radius R); each
 * formula is a power series in time whose coefficients are sums of
 * {@code A cos(phi + omega t)} terms, with {@code t} in Julian millennia of TT
 * since J2000. Velocities come from the analytic time derivative of the same
 * series. Output is rotated from the ecliptic of date into the J2000 mean
 * equator (EQJ).</p>
 *
 * <p>Version D is referred to the ecliptic and equinox of date, so the rotation
 * into EQJ is not fixed: it follows precession. Its contribution to the
 * velocity, the position turned by the rate of that rotation, is taken as a
 * central difference of the rotation over {@value #FRAME_RATE_STEP_DAYS}
 * days either side. The precession rate changes on a scale of centuries, so
 * the difference is exact to well below the series' own truncation error. The
 * series terms themselves are still differentiated analytically.</p>
 *
 * <p>Coefficients are read from the classpath resource
 * <code>vsop87d.txt</code> on first use; call {@link #preload()} to load them
 * eagerly and surface a missing or malformed file at startup.</p>
 */
public final class VsopModel {
    private static final Logger log = LoggerFactory.getLogger(VsopModel.class);
    private static final String RESOURCE = "vsop87d.txt";
    private static final double PI2 = 2.0 * Math.PI;
    private static final double FRAME_RATE_STEP_DAYS = 10.0;
    private static final Body[] MODELLED = {
        Body.MERCURY, Body.VENUS, Body.EARTH, Body.MARS,
        Body.JUPITER, Body.SATURN, Body.URANUS, Body.NEPTUNE
    };

    private static volatile boolean loaded = false;
    private static Map<Body, Series[][]> models; // body -> [L, B, R] -> series by power of t

    private VsopModel() {}

    /**
     * Load coefficient data. Call this at startup if you want to detect a
     * missing or invalid coefficient file early.
     *
     * @throws IllegalStateException if the resource cannot be loaded
     */
    public static void preload() {
        ensureLoaded();
    }

    /** True for the bodies this model covers (Mercury through Neptune). */
    public static boolean covers(Body body) {
        for (Body b : MODELLED) {
            if (b == body) return true;
        }
        return false;
    }

    /**
     * Heliocentric position in EQJ.
     *
     * @throws IllegalArgumentException if the body is not covered by the series
     */
    public static AstroVector helioVector(Body body, AstroTime time) {
        double[] p = helioPosition(body, time.tt);
        return new AstroVector(p[0], p[1], p[2], time);
    }

    /**
     * Heliocentric position and velocity in EQJ.
     *
     * @throws IllegalArgumentException if the body is not covered by the series
     */
    public static StateVector helioState(Body body, AstroTime time) {
        double[] s = helioStateArray(body, time.tt);
        return new StateVector(s[0], s[1], s[2], s[3], s[4], s[5], time);
    }

    /** Heliocentric EQJ position as {x, y, z}, for callers that work in raw TT. */
    static double[] helioPosition(Body body, double tt) {
        Series[][] model = model(body);
        double t = tt / AstroConstants.DAYS_PER_MILLENNIUM;
        double lon = evaluate(model[0], t, true);
        double lat = evaluate(model[1], t, false);
        double rad = evaluate(model[2], t, false);

        double coslat = Math.cos(lat);
        double[] ecl = {
            rad * coslat * Math.cos(lon),
            rad * coslat * Math.sin(lon),
            rad * Math.sin(lat)
        };
        return rotate(EarthOrientation.eclipticOfDateToJ2000(tt), ecl);
    }

    /** Heliocentric EQJ state as {x, y, z, vx, vy, vz}; velocity in AU/day. */
    static double[] helioStateArray(Body body, double tt) {
        Series[][] model = model(body);
        double t = tt / AstroConstants.DAYS_PER_MILLENNIUM;
        double lon = evaluate(model[0], t, true);
        double lat = evaluate(model[1], t, false);
        double rad = evaluate(model[2], t, false);
        double dlon = evaluateDerivative(model[0], t);
        double dlat = evaluateDerivative(model[1], t);
        double drad = evaluateDerivative(model[2], t);

        double coslon = Math.cos(lon);
        double sinlon = Math.sin(lon);
        double coslat = Math.cos(lat);
        double sinlat = Math.sin(lat);

        double[] pos = {
            rad * coslat * coslon,
            rad * coslat * sinlon,
            rad * sinlat
        };
        // Rates are per millennium; convert to per day
        double[] vel = {
            (drad * coslat * coslon - rad * sinlat * coslon * dlat - rad * coslat * sinlon * dlon)
                    / AstroConstants.DAYS_PER_MILLENNIUM,
            (drad * coslat * sinlon - rad * sinlat * sinlon * dlat + rad * coslat * coslon * dlon)
                    / AstroConstants.DAYS_PER_MILLENNIUM,
            (drad * sinlat + rad * coslat * dlat)
                    / AstroConstants.DAYS_PER_MILLENNIUM
        };

        RotationMatrix rot = EarthOrientation.eclipticOfDateToJ2000(tt);
        double[] p = rotate(rot, pos);
        double[] v = rotate(rot, vel);

        // The ecliptic of date itself turns slowly; add that rate to the velocity
        double[] ahead = rotate(EarthOrientation.eclipticOfDateToJ2000(tt + FRAME_RATE_STEP_DAYS), pos);
        double[] behind = rotate(EarthOrientation.eclipticOfDateToJ2000(tt - FRAME_RATE_STEP_DAYS), pos);
        for (int k = 0; k < 3; k++) {
            v[k] += (ahead[k] - behind[k]) / (2.0 * FRAME_RATE_STEP_DAYS);
        }
        return new double[] {p[0], p[1], p[2], v[0], v[1], v[2]};
    }

    private static Series[][] model(Body body) {
        ensureLoaded();
        Series[][] model = models.get(body);
        if (model == null) {
            throw new IllegalArgumentException("No planetary series for body " + body);
        }
        return model;
    }

    /**
     * Sum of {@code t^s * sum(A cos(phi + omega t))} over all powers s. Angular
     * formulas are reduced modulo 2 pi term by term to limit precision loss far
     * from the epoch.
     */
    private static double evaluate(Series[] formula, double t, boolean clampAngle) {
        double coord = 0.0;
        double tpower = 1.0;
        for (Series series : formula) {
            double sum = 0.0;
            for (int k = 0; k < series.amplitude.length; k++) {
                sum += series.amplitude[k] * Math.cos(series.phase[k] + t * series.frequency[k]);
            }
            double incr = tpower * sum;
            if (clampAngle) incr %= PI2;
            coord += incr;
            tpower *= t;
        }
        return coord;
    }

    /** Analytic d/dt of {@link #evaluate}, per millennium. */
    private static double evaluateDerivative(Series[] formula, double t) {
        double dpower = 0.0; // t^(s-1)
        double pw = 1.0;     // t^s
        double rate = 0.0;
        for (int s = 0; s < formula.length; s++) {
            Series series = formula[s];
            double sinSum = 0.0;
            double cosSum = 0.0;
            for (int k = 0; k < series.amplitude.length; k++) {
                double angle = series.phase[k] + t * series.frequency[k];
                sinSum += series.amplitude[k] * series.frequency[k] * Math.sin(angle);
                if (s > 0) {
                    cosSum += series.amplitude[k] * Math.cos(angle);
                }
            }
            rate += (s * dpower * cosSum) - (pw * sinSum);
            dpower = pw;
            pw *= t;
        }
        return rate;
    }

    private static double[] rotate(RotationMatrix rot, double[] v) {
        return new double[] {
            rot.get(0, 0) * v[0] + rot.get(0, 1) * v[1] + rot.get(0, 2) * v[2],
            rot.get(1, 0) * v[0] + rot.get(1, 1) * v[1] + rot.get(1, 2) * v[2],
            rot.get(2, 0) * v[0] + rot.get(2, 1) * v[1] + rot.get(2, 2) * v[2]
        };
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        models = loadSeriesFromResource();
        loaded = true;
    }

    /**
     * Parse the series resource. Blocks start with a header line
     * {@code @ BODY Cn} where C is L, B or R and n the power of t; each
     * following row holds amplitude (1e-8 rad or 1e-8 AU), phase (rad) and
     * frequency (rad per millennium).
     */
    private static Map<Body, Series[][]> loadSeriesFromResource() {
        InputStream in = VsopModel.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Planetary series file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Planetary series file '" + RESOURCE + "' not found on classpath");
        }
        Map<Body, List<List<Series>>> raw = new EnumMap<>(Body.class);
        int termCount = 0;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<double[]> rows = null;
            Body body = null;
            int coord = -1;
            int power = -1;
            String line;
            int lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (line.startsWith("@")) {
                    if (rows != null) {
                        store(raw, body, coord, power, rows);
                    }
                    String[] toks = line.substring(1).trim().split("\\s+");
                    if (toks.length != 2 || toks[1].length() < 2) {
                        throw new IllegalStateException("Malformed block header at line " + lineNumber);
                    }
                    body = Body.valueOf(toks[0]);
                    coord = "LBR".indexOf(toks[1].charAt(0));
                    if (coord < 0) {
                        throw new IllegalStateException("Unknown coordinate '" + toks[1] + "' at line " + lineNumber);
                    }
                    power = Integer.parseInt(toks[1].substring(1));
                    rows = new ArrayList<>();
                    continue;
                }
                if (rows == null) {
                    throw new IllegalStateException("Series row before any block header at line " + lineNumber);
                }
                String[] toks = line.split("\\s+");
                if (toks.length != 3) {
                    throw new IllegalStateException("Expected 3 columns at line " + lineNumber);
                }
                rows.add(new double[] {
                    Double.parseDouble(toks[0]) * 1.0e-8,
                    Double.parseDouble(toks[1]),
                    Double.parseDouble(toks[2])
                });
                termCount++;
            }
            if (rows != null) {
                store(raw, body, coord, power, rows);
            }
        } catch (IOException e) {
            log.error("Failed to read planetary series file", e);
            throw new IllegalStateException("Failed to read planetary series file", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse planetary series file", e);
            throw new IllegalStateException("Failed to parse planetary series file", e);
        }

        Map<Body, Series[][]> result = new EnumMap<>(Body.class);
        for (Body b : MODELLED) {
            List<List<Series>> formulas = raw.get(b);
            if (formulas == null) {
                log.error("Planetary series file has no data for {}", b);
                throw new IllegalStateException("Planetary series file has no data for " + b);
            }
            Series[][] model = new Series[3][];
            for (int c = 0; c < 3; c++) {
                List<Series> byPower = formulas.get(c);
                if (byPower.isEmpty() || byPower.contains(null)) {
                    log.error("Planetary series for {} has a gap in formula {}", b, "LBR".charAt(c));
                    throw new IllegalStateException("Incomplete series for " + b + " " + "LBR".charAt(c));
                }
                model[c] = byPower.toArray(new Series[0]);
            }
            result.put(b, model);
        }
        log.debug("Loaded planetary series: {} terms for {} bodies", termCount, result.size());
        return result;
    }

    private static void store(Map<Body, List<List<Series>>> raw, Body body, int coord, int power, List<double[]> rows) {
        List<List<Series>> formulas = raw.computeIfAbsent(body, b -> {
            List<List<Series>> list = new ArrayList<>();
            for (int c = 0; c < 3; c++) list.add(new ArrayList<>());
            return list;
        });
        List<Series> byPower = formulas.get(coord);
        while (byPower.size() <= power) byPower.add(null);
        if (byPower.get(power) != null) {
            throw new IllegalStateException("Duplicate block " + body + " " + "LBR".charAt(coord) + power);
        }
        double[] amplitude = new double[rows.size()];
        double[] phase = new double[rows.size()];
        double[] frequency = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            amplitude[i] = rows.get(i)[0];
            phase[i] = rows.get(i)[1];
            frequency[i] = rows.get(i)[2];
        }
        byPower.set(power, new Series(amplitude, phase, frequency));
    }

    // One power-of-t block of cosine terms
    private record Series(double[] amplitude, double[] phase, double[] frequency) {}
}
