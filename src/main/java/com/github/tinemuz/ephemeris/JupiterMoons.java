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
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jovicentric positions of Io, Europa, Ganymede and Callisto.
 *
 * <p>Each moon moves on a near-circular orbit in Jupiter's equatorial plane,
 * whose pole follows the IAU rotation model. Mean longitudes are counted on
 * the J2000 ecliptic and carry the principal perturbation of each moon: the
 * Laplace resonance terms for Io and Europa and the solar terms for Ganymede
 * and Callisto. This is a low-precision theory; sky-plane offsets are good to
 * a few hundredths of a Jupiter radius.</p>
 *
 * <p>Orbit constants are read from the classpath resource
 * <code>jupiter_moons.txt</code> on first use; call {@link #preload()} to load
 * them eagerly.</p>
 */
public final class JupiterMoons {
    private static final Logger log = LoggerFactory.getLogger(JupiterMoons.class);
    private static final String RESOURCE = "jupiter_moons.txt";

    /** Length unit of the orbit radii in the resource. */
    static final double RADIUS_UNIT_KM = 71398.0;

    private static final double GREAT_INEQUALITY_AMPLITUDE = 0.329;
    private static final double GREAT_INEQUALITY_PHASE = 172.74;
    private static final double GREAT_INEQUALITY_RATE = 0.00111588;

    public enum Moon { IO, EUROPA, GANYMEDE, CALLISTO }

    private static volatile boolean loaded = false;
    private static Map<Moon, Orbit> orbits;

    private JupiterMoons() {}

    /**
     * Load the orbit constants.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static void preload() {
        ensureLoaded();
    }

    /**
     * Positions and velocities of the four moons relative to Jupiter's center,
     * in EQJ, AU and AU/day. No light-time correction is applied.
     */
    public static JupiterMoonsInfo jupiterMoons(AstroTime time) {
        Objects.requireNonNull(time, "time");
        ensureLoaded();
        Map<Moon, StateVector> states = new EnumMap<>(Moon.class);
        RotationMatrix eclToEqj = Rotations.eclToEqj();
        double[][] plane = equatorialPlane(time);
        for (Moon moon : Moon.values()) {
            StateVector ecl = orbits.get(moon).state(time, plane);
            states.put(moon, eclToEqj.rotate(ecl));
        }
        return new JupiterMoonsInfo(states);
    }

    /** Jupiter's north pole as a unit vector in EQJ. */
    public static AstroVector pole(AstroTime time) {
        double t = time.julianCenturies();
        double ra = Math.toRadians(268.056595 - 0.006499 * t);
        double dec = Math.toRadians(64.495303 + 0.002413 * t);
        return new AstroVector(
            Math.cos(dec) * Math.cos(ra),
            Math.cos(dec) * Math.sin(ra),
            Math.sin(dec),
            time);
    }

    /**
     * Basis of Jupiter's equatorial plane in ECL: row 0 points to the
     * ascending node on the ecliptic, row 1 is 90 degrees ahead in the plane,
     * row 2 is the pole.
     */
    private static double[][] equatorialPlane(AstroTime time) {
        AstroVector p = Rotations.eqjToEcl().rotate(pole(time));
        double nx = -p.y;
        double ny = p.x;
        double len = Math.hypot(nx, ny);
        nx /= len;
        ny /= len;
        double[] node = {nx, ny, 0.0};
        double[] ahead = {
            p.y * node[2] - p.z * node[1],
            p.z * node[0] - p.x * node[2],
            p.x * node[1] - p.y * node[0]
        };
        return new double[][] {node, ahead, {p.x, p.y, p.z}};
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        orbits = loadOrbitsFromResource();
        loaded = true;
    }

    private static Map<Moon, Orbit> loadOrbitsFromResource() {
        InputStream in = JupiterMoons.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Jovian moon orbit file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Jovian moon orbit file '" + RESOURCE + "' not found on classpath");
        }
        Map<Moon, Orbit> result = new EnumMap<>(Moon.class);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length != 8) {
                    throw new IllegalStateException("Expected 8 columns at line " + lineNumber);
                }
                Moon moon = Moon.valueOf(toks[0]);
                double[] c = new double[7];
                for (int i = 0; i < c.length; i++) {
                    c[i] = Double.parseDouble(toks[i + 1]);
                }
                if (result.put(moon, new Orbit(c)) != null) {
                    throw new IllegalStateException("Duplicate orbit for " + moon + " at line " + lineNumber);
                }
            }
        } catch (IOException e) {
            log.error("Failed to read Jovian moon orbit file", e);
            throw new IllegalStateException("Failed to read Jovian moon orbit file", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse Jovian moon orbit file", e);
            throw new IllegalStateException("Failed to parse Jovian moon orbit file", e);
        }
        for (Moon moon : Moon.values()) {
            if (!result.containsKey(moon)) {
                log.error("Jovian moon orbit file has no row for {}", moon);
                throw new IllegalStateException("Jovian moon orbit file has no row for " + moon);
            }
        }
        log.debug("Loaded orbits for {} Jovian moons", result.size());
        return result;
    }

    /** One moon's mean orbit with its principal periodic term. */
    private static final class Orbit {
        final double lon0;
        final double rate;
        final double amp;
        final double arg0;
        final double argRate;
        final double radius;
        final double radiusAmp;

        Orbit(double[] c) {
            lon0 = c[0];
            rate = c[1];
            amp = c[2];
            arg0 = c[3];
            argRate = c[4];
            radius = c[5];
            radiusAmp = c[6];
        }

        /** Jovicentric ECL state in AU and AU/day. */
        StateVector state(AstroTime time, double[][] plane) {
            double d = time.tt;
            double v = Math.toRadians(GREAT_INEQUALITY_PHASE + GREAT_INEQUALITY_RATE * d);
            double arg = Math.toRadians(arg0 + argRate * d);
            double lon = Math.toRadians(lon0 + rate * d
                    + GREAT_INEQUALITY_AMPLITUDE * Math.sin(v) + amp * Math.sin(arg));
            double dlon = Math.toRadians(rate
                    + GREAT_INEQUALITY_AMPLITUDE * Math.cos(v) * Math.toRadians(GREAT_INEQUALITY_RATE)
                    + amp * Math.cos(arg) * Math.toRadians(argRate));

            double scale = RADIUS_UNIT_KM / AstroConstants.KM_PER_AU;
            double r = (radius + radiusAmp * Math.cos(arg)) * scale;
            double dr = -radiusAmp * Math.sin(arg) * Math.toRadians(argRate) * scale;

            // Angle in the equatorial plane whose projection on the ecliptic has longitude lon.
            double[] node = plane[0];
            double[] ahead = plane[1];
            double k = plane[2][2];
            double x = lon - Math.atan2(node[1], node[0]);
            double sx = Math.sin(x);
            double cx = Math.cos(x);
            double theta = Math.atan2(sx, k * cx);
            double dtheta = k / (sx * sx + k * k * cx * cx) * dlon;

            double ct = Math.cos(theta);
            double st = Math.sin(theta);
            double[] pos = new double[3];
            double[] vel = new double[3];
            for (int i = 0; i < 3; i++) {
                double radial = ct * node[i] + st * ahead[i];
                double along = -st * node[i] + ct * ahead[i];
                pos[i] = r * radial;
                vel[i] = dr * radial + r * dtheta * along;
            }
            return new StateVector(pos[0], pos[1], pos[2], vel[0], vel[1], vel[2], time);
        }
    }

    /** States of the four Galilean moons relative to Jupiter. */
    public static final class JupiterMoonsInfo {
        public final StateVector io;
        public final StateVector europa;
        public final StateVector ganymede;
        public final StateVector callisto;

        JupiterMoonsInfo(Map<Moon, StateVector> states) {
            this.io = states.get(Moon.IO);
            this.europa = states.get(Moon.EUROPA);
            this.ganymede = states.get(Moon.GANYMEDE);
            this.callisto = states.get(Moon.CALLISTO);
        }

        public StateVector get(Moon moon) {
            switch (moon) {
                case IO: return io;
                case EUROPA: return europa;
                case GANYMEDE: return ganymede;
                case CALLISTO: return callisto;
                default: throw new IllegalArgumentException("Unknown moon " + moon);
            }
        }
    }
}
