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
 * Equinoxes and solstices.
 */
public final class Seasons {
    private static final double LIMIT_DAYS = 20.0;

    private Seasons() {}

    /**
     * The four season changes of a calendar year.
     *
     * @throws IllegalStateException if a season change is not found where it
     *         must be
     */
    public static SeasonsInfo search(int year) {
        AstroTime mar = findSeasonChange(0.0, year, 3, 19);
        AstroTime jun = findSeasonChange(90.0, year, 6, 19);
        AstroTime sep = findSeasonChange(180.0, year, 9, 21);
        AstroTime dec = findSeasonChange(270.0, year, 12, 20);
        return new SeasonsInfo(mar, jun, sep, dec);
    }

    /**
     * When the Sun's apparent ecliptic longitude of date next reaches
     * {@code targetLon}.
     *
     * @return the time, or {@code null} if it is not reached within
     *         {@code limitDays} of {@code start}
     * @throws IllegalArgumentException if {@code limitDays} is not positive
     */
    public static AstroTime searchSunLongitude(double targetLon, AstroTime start, double limitDays) {
        if (!(limitDays > 0.0)) {
            throw new IllegalArgumentException("Search limit must be positive: " + limitDays);
        }
        AstroTime t2 = start.addDays(limitDays);
        return Search.search(
                t -> longitudeOffset(Ephemeris.sunPosition(t).elon - targetLon),
                start, t2, 0.01);
    }

    private static AstroTime findSeasonChange(double targetLon, int year, int month, int day) {
        AstroTime start = AstroTime.fromCalendar(year, month, day);
        AstroTime time = searchSunLongitude(targetLon, start, LIMIT_DAYS);
        if (time == null) {
            throw new IllegalStateException("Cannot find season change near " + start);
        }
        return time;
    }

    /** Wraps an angle difference into (-180, +180]. */
    static double longitudeOffset(double diff) {
        double offset = diff;
        while (offset <= -180.0) offset += 360.0;
        while (offset > 180.0) offset -= 360.0;
        return offset;
    }

    /** The equinoxes and solstices of one year. */
    public static final class SeasonsInfo {
        /** March equinox. */
        public final AstroTime marEquinox;
        /** June solstice. */
        public final AstroTime junSolstice;
        /** September equinox. */
        public final AstroTime sepEquinox;
        /** December solstice. */
        public final AstroTime decSolstice;

        SeasonsInfo(AstroTime marEquinox, AstroTime junSolstice, AstroTime sepEquinox, AstroTime decSolstice) {
            this.marEquinox = marEquinox;
            this.junSolstice = junSolstice;
            this.sepEquinox = sepEquinox;
            this.decSolstice = decSolstice;
        }
    }
}
