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
 * Finds the time at which a function of time crosses zero in the ascending
 * direction.
 *
 * <p>Each step bisects the bracket and also fits a parabola through the two
 * ends and the midpoint. When the parabola has a single root inside the
 * bracket the search jumps there and, if the local slope allows, narrows the
 * bracket tightly around it. Otherwise the half containing the sign change
 * is kept.</p>
 */
public final class Search {
    static final int MAX_ITERATIONS = 20;

    /** A real-valued function of time whose ascending zero crossing is sought. */
    @FunctionalInterface
    public interface SearchFunction {
        double apply(AstroTime time);
    }

    private Search() {}

    /**
     * Searches for the time in [t1, t2] at which {@code func} rises through zero.
     * The caller must pick a bracket with {@code func(t1) < 0 <= func(t2)} and
     * exactly one such crossing.
     *
     * @param toleranceSeconds how close to the true root the result must be
     * @return the crossing time, or {@code null} if the bracket shows no
     *         single ascending crossing
     * @throws IllegalArgumentException if the tolerance is not positive
     * @throws IllegalStateException if the search has not converged after
     *         {@value #MAX_ITERATIONS} iterations
     */
    public static AstroTime search(SearchFunction func, AstroTime t1, AstroTime t2, double toleranceSeconds) {
        Objects.requireNonNull(func, "func");
        if (!(toleranceSeconds > 0.0)) {
            throw new IllegalArgumentException("Search tolerance must be positive: " + toleranceSeconds);
        }
        double dtDays = Math.abs(toleranceSeconds / AstroConstants.SECONDS_PER_DAY);
        double f1 = func.apply(t1);
        double f2 = func.apply(t2);
        int iter = 0;
        boolean calcFmid = true;
        double fmid = 0.0;

        for (;;) {
            if (++iter > MAX_ITERATIONS) {
                throw new IllegalStateException("Search did not converge within " + MAX_ITERATIONS
                        + " iterations between " + t1 + " and " + t2);
            }

            double dt = (t2.tt - t1.tt) / 2.0;
            AstroTime tmid = t1.addDays(dt);
            if (Math.abs(dt) < dtDays) {
                return tmid;
            }

            if (calcFmid) {
                fmid = func.apply(tmid);
            } else {
                calcFmid = true;
            }

            QuadraticRoot q = quadInterp(tmid.ut, t2.ut - tmid.ut, f1, fmid, f2);
            if (q != null) {
                AstroTime tq = AstroTime.fromUniversal(q.t);
                double fq = func.apply(tq);
                if (q.slope != 0.0) {
                    double dtGuess = Math.abs(fq / q.slope);
                    if (dtGuess < dtDays) {
                        return tq;
                    }

                    // Bracket the parabola's root as tightly as the slope estimate allows
                    dtGuess *= 1.2;
                    if (dtGuess < dt / 10.0) {
                        AstroTime tleft = tq.addDays(-dtGuess);
                        AstroTime tright = tq.addDays(+dtGuess);
                        if ((tleft.ut - t1.ut) * (tleft.ut - t2.ut) < 0.0
                                && (tright.ut - t1.ut) * (tright.ut - t2.ut) < 0.0) {
                            double fleft = func.apply(tleft);
                            double fright = func.apply(tright);
                            if (fleft < 0.0 && fright >= 0.0) {
                                f1 = fleft;
                                f2 = fright;
                                t1 = tleft;
                                t2 = tright;
                                fmid = fq;
                                calcFmid = false;
                                continue;
                            }
                        }
                    }
                }
            }

            if (f1 < 0.0 && fmid >= 0.0) {
                t2 = tmid;
                f2 = fmid;
                continue;
            }
            if (fmid < 0.0 && f2 >= 0.0) {
                t1 = tmid;
                f1 = fmid;
                continue;
            }
            return null;
        }
    }

    /**
     * Root of the parabola through (tm - dt, fa), (tm, fm), (tm + dt, fb) that
     * lies within [tm - dt, tm + dt], or {@code null} if there is not exactly one.
     */
    static QuadraticRoot quadInterp(double tm, double dt, double fa, double fm, double fb) {
        double qa = (fb + fa) / 2.0 - fm;
        double qb = (fb - fa) / 2.0;
        double qc = fm;
        double x;

        if (qa == 0.0) {
            // Degenerate to a line
            if (qb == 0.0) return null;
            x = -qc / qb;
            if (x < -1.0 || x > +1.0) return null;
        } else {
            double u = qb * qb - 4.0 * qa * qc;
            if (u <= 0.0) return null;
            double ru = Math.sqrt(u);
            double x1 = (-qb + ru) / (2.0 * qa);
            double x2 = (-qb - ru) / (2.0 * qa);
            boolean in1 = x1 >= -1.0 && x1 <= +1.0;
            boolean in2 = x2 >= -1.0 && x2 <= +1.0;
            if (in1 == in2) return null;
            x = in1 ? x1 : x2;
        }
        return new QuadraticRoot(tm + x * dt, (2.0 * qa * x + qb) / dt);
    }

    /** Time (UT days) of a parabola root and the parabola's slope there (per day). */
    static final class QuadraticRoot {
        final double t;
        final double slope;

        QuadraticRoot(double t, double slope) {
            this.t = t;
            this.slope = slope;
        }
    }
}
