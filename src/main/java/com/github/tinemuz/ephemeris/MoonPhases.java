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
 * Lunar phases, quarters and nodes.
 *
 * <p>The phase angle is the Moon's geocentric ecliptic longitude minus the
 * Sun's: 0 is new moon, 90 first quarter, 180 full moon, 270 third quarter.</p>
 */
public final class MoonPhases {
    private static final double PHASE_UNCERTAINTY_DAYS = 1.5;
    private static final double QUARTER_LIMIT_DAYS = 10.0;
    private static final double NODE_STEP_DAYS = 10.0;
    private static final int MAX_NODE_ATTEMPTS = 10;

    private MoonPhases() {}

    /** The Moon's phase angle in degrees [0, 360). */
    public static double moonPhase(AstroTime time) {
        return Ephemeris.pairLongitude(Body.MOON, Body.SUN, time);
    }

    /**
     * Next (or, for negative {@code limitDays}, previous) time the phase
     * angle equals {@code targetLon}.
     *
     * @return the time, or {@code null} if it does not occur within
     *         {@code limitDays} of {@code start}
     */
    public static AstroTime searchMoonPhase(double targetLon, AstroTime start, double limitDays) {
        Search.SearchFunction offset = t -> Seasons.longitudeOffset(moonPhase(t) - targetLon);

        // Estimate from the mean synodic month, then search the uncertainty window around it
        double ya = offset.apply(start);
        double dt1;
        double dt2;
        if (limitDays < 0.0) {
            if (ya < 0.0) ya += 360.0;
            double est = -(AstroConstants.MEAN_SYNODIC_MONTH * ya) / 360.0;
            dt2 = est + PHASE_UNCERTAINTY_DAYS;
            if (dt2 < limitDays) return null;
            dt1 = Math.max(limitDays, est - PHASE_UNCERTAINTY_DAYS);
        } else {
            if (ya > 0.0) ya -= 360.0;
            double est = -(AstroConstants.MEAN_SYNODIC_MONTH * ya) / 360.0;
            dt1 = est - PHASE_UNCERTAINTY_DAYS;
            if (dt1 > limitDays) return null;
            dt2 = Math.min(limitDays, est + PHASE_UNCERTAINTY_DAYS);
        }
        return Search.search(offset, start.addDays(dt1), start.addDays(dt2), 0.1);
    }

    /** The first lunar quarter after {@code start}. */
    public static MoonQuarterInfo searchMoonQuarter(AstroTime start) {
        double phase = moonPhase(start);
        int quarter = (1 + (int) Math.floor(phase / 90.0)) % 4;
        AstroTime time = searchMoonPhase(90.0 * quarter, start, QUARTER_LIMIT_DAYS);
        if (time == null) {
            throw new IllegalStateException("Cannot find moon quarter " + quarter + " after " + start);
        }
        return new MoonQuarterInfo(quarter, time);
    }

    /** The quarter following {@code previous}. */
    public static MoonQuarterInfo nextMoonQuarter(MoonQuarterInfo previous) {
        // Skip 6 days past the previous quarter so it is not found again
        MoonQuarterInfo next = searchMoonQuarter(previous.time.addDays(6.0));
        if (next.quarter != (previous.quarter + 1) % 4) {
            throw new IllegalStateException("Expected quarter " + (previous.quarter + 1) % 4
                    + " after quarter " + previous.quarter + " but found " + next.quarter);
        }
        return next;
    }

    /** The first time after {@code start} the Moon crosses the ecliptic of date. */
    public static NodeEventInfo searchMoonNode(AstroTime start) {
        AstroTime time1 = start;
        double lat1 = LunarTheory.eclipticLatitude(time1);
        for (int attempt = 0; attempt < MAX_NODE_ATTEMPTS; attempt++) {
            AstroTime time2 = time1.addDays(NODE_STEP_DAYS);
            double lat2 = LunarTheory.eclipticLatitude(time2);
            if (lat1 <= 0.0 && lat2 > 0.0) {
                return nodeEvent(NodeKind.ASCENDING, time1, time2);
            }
            if (lat1 > 0.0 && lat2 <= 0.0) {
                return nodeEvent(NodeKind.DESCENDING, time1, time2);
            }
            time1 = time2;
            lat1 = lat2;
        }
        throw new IllegalStateException("No lunar node found within " + MAX_NODE_ATTEMPTS * NODE_STEP_DAYS
                + " days after " + start);
    }

    /** The node following {@code previous}; node kinds alternate. */
    public static NodeEventInfo nextMoonNode(NodeEventInfo previous) {
        NodeEventInfo next = searchMoonNode(previous.time.addDays(NODE_STEP_DAYS));
        if (next.kind == previous.kind) {
            throw new IllegalStateException("Two consecutive " + next.kind + " lunar nodes");
        }
        return next;
    }

    private static NodeEventInfo nodeEvent(NodeKind kind, AstroTime t1, AstroTime t2) {
        double sign = kind == NodeKind.ASCENDING ? +1.0 : -1.0;
        AstroTime time = Search.search(t -> sign * LunarTheory.eclipticLatitude(t), t1, t2, 1.0);
        if (time == null) {
            throw new IllegalStateException("Lunar node search failed between " + t1 + " and " + t2);
        }
        return new NodeEventInfo(kind, time);
    }

    /** A lunar quarter. */
    public static final class MoonQuarterInfo {
        /** 0 new moon, 1 first quarter, 2 full moon, 3 third quarter. */
        public final int quarter;
        /** When the quarter occurs. */
        public final AstroTime time;

        MoonQuarterInfo(int quarter, AstroTime time) {
            this.quarter = quarter;
            this.time = time;
        }
    }

    /** Direction of the Moon's crossing of the ecliptic. */
    public enum NodeKind {
        /** Moving from south to north. */
        ASCENDING,
        /** Moving from north to south. */
        DESCENDING
    }

    /** A crossing of the ecliptic by the Moon. */
    public static final class NodeEventInfo {
        public final NodeKind kind;
        public final AstroTime time;

        NodeEventInfo(NodeKind kind, AstroTime time) {
            this.kind = kind;
            this.time = time;
        }
    }
}
