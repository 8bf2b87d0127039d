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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pluto's barycentric state from numerical integration under the gravity of
 * the Sun and the four giant planets.
 *
 * <p>Anchor states are kept every {@value #TIME_STEP} days from
 * {@value #FIRST_ANCHOR_TT} to {@value #LAST_ANCHOR_TT} days of TT around
 * J2000. Tabulated states are read from the classpath resource
 * <code>pluto_states.txt</code> on first use; an anchor with no row in the
 * table is integrated outward from the nearest tabulated one with a fine step
 * the first time it is needed. Call {@link #preload()} to read the table
 * eagerly. Between two anchors a segment of {@value #NSTEPS} states is
 * simulated forward from the left anchor and backward from the right one,
 * and the two runs are fade-blended so the segment meets both anchors
 * without a seam. Queries interpolate inside a segment.</p>
 *
 * <p>Anchors and segments live in one cache guarded by a single lock, so no
 * simulation ever runs twice. Times outside the anchor span are integrated
 * step by step from the nearest end anchor every time they are requested.</p>
 */
public final class PlutoPropagator {
    private static final Logger log = LoggerFactory.getLogger(PlutoPropagator.class);

    static final double TIME_STEP = 29200.0;
    static final double DT = 146.0;
    static final int NSTEPS = 201;
    static final int NUM_ANCHORS = 51;
    static final double FIRST_ANCHOR_TT = -730000.0;
    static final double LAST_ANCHOR_TT = FIRST_ANCHOR_TT + (NUM_ANCHORS - 1) * TIME_STEP;

    private static final String RESOURCE = "pluto_states.txt";

    // Untabulated anchors are integrated with DT / ANCHOR_SUBSTEPS per step
    private static final int ANCHOR_SUBSTEPS = 4;

    private static final SegmentCache CACHE = new SegmentCache();
    private static volatile boolean warnedOutOfRange = false;

    private static volatile boolean loaded = false;
    private static BodyState[] tabulated;

    private PlutoPropagator() {}

    /**
     * Read the anchor state table now instead of on the first Pluto query.
     *
     * @throws IllegalStateException if the table is missing or malformed
     */
    public static void preload() {
        ensureLoaded();
    }

    /** Pluto's position and velocity relative to the Solar System barycenter, EQJ. */
    public static StateVector baryState(AstroTime time) {
        BodyState s = calcState(time.tt);
        return new StateVector(s.r[0], s.r[1], s.r[2], s.v[0], s.v[1], s.v[2], time);
    }

    /** Pluto's position and velocity relative to the Sun, EQJ. */
    public static StateVector helioState(AstroTime time) {
        return baryState(time).sub(MajorBodies.sunBaryState(time));
    }

    /** Pluto's position relative to the Sun, EQJ. */
    public static AstroVector helioVector(AstroTime time) {
        BodyState s = calcState(time.tt);
        double[] sun = MajorBodies.positions(time.tt)[0];
        return new AstroVector(s.r[0] - sun[0], s.r[1] - sun[1], s.r[2] - sun[2], time);
    }

    /** Number of segments simulated so far in this process. */
    static int simulatedSegmentCount() {
        return CACHE.simulatedSegments();
    }

    private static BodyState calcState(double tt) {
        if (tt < FIRST_ANCHOR_TT || tt > LAST_ANCHOR_TT) {
            return outOfRange(tt);
        }
        int segIndex = clampIndex((tt - FIRST_ANCHOR_TT) / TIME_STEP, NUM_ANCHORS - 1);
        BodyState[] seg = CACHE.segment(segIndex);
        int left = clampIndex((tt - seg[0].tt) / DT, NSTEPS - 1);
        BodyState s1 = seg[left];
        BodyState s2 = seg[left + 1];

        double[] acc = mean(s1.a, s2.a);

        // Quadratic extrapolation from both neighbors, then a linear blend
        double dt1 = tt - s1.tt;
        double[] ra = updatePosition(dt1, s1.r, s1.v, acc);
        double[] va = updateVelocity(dt1, s1.v, acc);
        double dt2 = tt - s2.tt;
        double[] rb = updatePosition(dt2, s2.r, s2.v, acc);
        double[] vb = updateVelocity(dt2, s2.v, acc);

        double ramp = dt1 / DT;
        return new BodyState(tt, mix(ra, rb, ramp), mix(va, vb, ramp), acc);
    }

    private static BodyState outOfRange(double tt) {
        if (!warnedOutOfRange) {
            synchronized (PlutoPropagator.class) {
                if (!warnedOutOfRange) {
                    warnedOutOfRange = true;
                    log.warn("Pluto requested at tt={} outside the cached span [{}, {}]; "
                                    + "integrating step by step from the nearest anchor",
                            String.format("%.1f", tt), FIRST_ANCHOR_TT, LAST_ANCHOR_TT);
                }
            }
        }
        BodyState start = tt < FIRST_ANCHOR_TT ? CACHE.anchor(0) : CACHE.anchor(NUM_ANCHORS - 1);
        return integrate(start, tt, DT);
    }

    /** Integrate from {@code start} to {@code tt} in equal steps no longer than {@code maxStep}. */
    private static BodyState integrate(BodyState start, double tt, double maxStep) {
        double span = tt - start.tt;
        int n = (int) Math.ceil(Math.abs(span) / maxStep);
        BodyState state = start;
        for (int i = 1; i <= n; i++) {
            state = gravSim(start.tt + span * i / n, state);
        }
        return state;
    }

    /**
     * One predictor-corrector step: extrapolate with the current acceleration,
     * evaluate the acceleration there, average the two and re-integrate.
     */
    private static BodyState gravSim(double tt2, BodyState calc1) {
        double dt = tt2 - calc1.tt;
        double[][] major = MajorBodies.positions(tt2);
        double[] approxPos = updatePosition(dt, calc1.r, calc1.v, calc1.a);
        double[] acc = mean(MajorBodies.acceleration(approxPos, major), calc1.a);
        double[] pos = updatePosition(dt, calc1.r, calc1.v, acc);
        double[] vel = updateVelocity(dt, calc1.v, acc);
        return new BodyState(tt2, pos, vel, MajorBodies.acceleration(pos, major));
    }

    private static BodyState gravFromState(double tt, double[] r, double[] v) {
        return new BodyState(tt, r, v, MajorBodies.acceleration(r, MajorBodies.positions(tt)));
    }

    /** Index of the tabulated anchor closest to {@code index}. */
    private static int nearestTabulated(int index) {
        ensureLoaded();
        for (int offset = 0; offset < NUM_ANCHORS; offset++) {
            if (index - offset >= 0 && tabulated[index - offset] != null) return index - offset;
            if (index + offset < NUM_ANCHORS && tabulated[index + offset] != null) return index + offset;
        }
        throw new IllegalStateException("Pluto state table has no anchors");
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        tabulated = loadStatesFromResource();
        loaded = true;
    }

    /**
     * Parse the state table. Each row is {@code tt x y z vx vy vz}; the time
     * must sit on the anchor grid and appear at most once.
     */
    private static BodyState[] loadStatesFromResource() {
        InputStream in = PlutoPropagator.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Pluto state table '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Pluto state table '" + RESOURCE + "' not found on classpath");
        }
        BodyState[] table = new BodyState[NUM_ANCHORS];
        int count = 0;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length != 7) {
                    throw new IllegalStateException("Expected 7 columns at line " + lineNumber);
                }
                double tt = Double.parseDouble(toks[0]);
                double slot = (tt - FIRST_ANCHOR_TT) / TIME_STEP;
                int index = (int) Math.round(slot);
                if (Math.abs(slot - index) > 1.0e-9 || index < 0 || index >= NUM_ANCHORS) {
                    throw new IllegalStateException("State at line " + lineNumber + " is off the anchor grid: tt=" + tt);
                }
                if (table[index] != null) {
                    throw new IllegalStateException("Duplicate state for tt=" + tt + " at line " + lineNumber);
                }
                double[] r = {Double.parseDouble(toks[1]), Double.parseDouble(toks[2]), Double.parseDouble(toks[3])};
                double[] v = {Double.parseDouble(toks[4]), Double.parseDouble(toks[5]), Double.parseDouble(toks[6])};
                table[index] = gravFromState(tt, r, v);
                count++;
            }
        } catch (IOException e) {
            log.error("Failed to read Pluto state table", e);
            throw new IllegalStateException("Failed to read Pluto state table", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse Pluto state table", e);
            throw new IllegalStateException("Failed to parse Pluto state table", e);
        }
        if (count == 0) {
            log.error("Pluto state table '{}' has no rows", RESOURCE);
            throw new IllegalStateException("Pluto state table '" + RESOURCE + "' has no rows");
        }
        log.debug("Loaded {} Pluto anchor states", count);
        return table;
    }

    static int clampIndex(double frac, int nsteps) {
        int index = (int) Math.floor(frac);
        if (index < 0) return 0;
        if (index >= nsteps) return nsteps - 1;
        return index;
    }

    private static double[] updatePosition(double dt, double[] r, double[] v, double[] a) {
        return new double[] {
            r[0] + dt * (v[0] + dt * a[0] / 2.0),
            r[1] + dt * (v[1] + dt * a[1] / 2.0),
            r[2] + dt * (v[2] + dt * a[2] / 2.0)
        };
    }

    private static double[] updateVelocity(double dt, double[] v, double[] a) {
        return new double[] {v[0] + dt * a[0], v[1] + dt * a[1], v[2] + dt * a[2]};
    }

    private static double[] mean(double[] a, double[] b) {
        return new double[] {(a[0] + b[0]) / 2.0, (a[1] + b[1]) / 2.0, (a[2] + b[2]) / 2.0};
    }

    // (1 - ramp) * a + ramp * b
    private static double[] mix(double[] a, double[] b, double ramp) {
        return new double[] {
            (1.0 - ramp) * a[0] + ramp * b[0],
            (1.0 - ramp) * a[1] + ramp * b[1],
            (1.0 - ramp) * a[2] + ramp * b[2]
        };
    }

    /**
     * Lazily filled anchors and segments. Every read and write goes through
     * one lock; building a segment while holding it is what keeps concurrent
     * callers from simulating the same segment twice.
     */
    private static final class SegmentCache {
        private final Object lock = new Object();
        private final BodyState[] anchors = new BodyState[NUM_ANCHORS];
        private final BodyState[][] segments = new BodyState[NUM_ANCHORS - 1][];
        private int simulated;

        BodyState anchor(int index) {
            synchronized (lock) {
                return anchorLocked(index);
            }
        }

        BodyState[] segment(int index) {
            synchronized (lock) {
                BodyState[] seg = segments[index];
                if (seg == null) {
                    seg = simulate(index);
                    segments[index] = seg;
                    simulated++;
                }
                return seg;
            }
        }

        int simulatedSegments() {
            synchronized (lock) {
                return simulated;
            }
        }

        private BodyState anchorLocked(int index) {
            if (anchors[index] == null) {
                int source = nearestTabulated(index);
                if (source == index) {
                    anchors[index] = tabulated[index];
                } else {
                    // Chained outward from the nearest tabulated anchor
                    int inner = index > source ? index - 1 : index + 1;
                    BodyState from = anchorLocked(inner);
                    anchors[index] = integrate(from, FIRST_ANCHOR_TT + index * TIME_STEP, DT / ANCHOR_SUBSTEPS);
                }
                log.debug("Pluto anchor {} ready at tt={}", index, anchors[index].tt);
            }
            return anchors[index];
        }

        private BodyState[] simulate(int index) {
            BodyState[] seg = new BodyState[NSTEPS];
            seg[0] = anchorLocked(index);
            seg[NSTEPS - 1] = anchorLocked(index + 1);

            double steptt = seg[0].tt;
            for (int i = 1; i < NSTEPS - 1; i++) {
                steptt += DT;
                seg[i] = gravSim(steptt, seg[i - 1]);
            }

            BodyState[] reverse = new BodyState[NSTEPS];
            reverse[NSTEPS - 1] = seg[NSTEPS - 1];
            steptt = seg[NSTEPS - 1].tt;
            for (int i = NSTEPS - 2; i > 0; i--) {
                steptt -= DT;
                reverse[i] = gravSim(steptt, reverse[i + 1]);
            }

            // Fade from the forward run at the left end to the backward run at the right end
            for (int i = NSTEPS - 2; i > 0; i--) {
                double ramp = (double) i / (NSTEPS - 1);
                seg[i] = new BodyState(seg[i].tt,
                        mix(seg[i].r, reverse[i].r, ramp),
                        mix(seg[i].v, reverse[i].v, ramp),
                        mix(seg[i].a, reverse[i].a, ramp));
            }
            log.debug("Simulated Pluto segment {} covering tt [{}, {}]", index, seg[0].tt, seg[NSTEPS - 1].tt);
            return seg;
        }
    }

    // Barycentric position (AU), velocity (AU/day) and acceleration (AU/day^2)
    private record BodyState(double tt, double[] r, double[] v, double[] a) {}
}
