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

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * An instant expressed on two time scales.
 *
 * <p>{@link #ut} follows the Earth's rotation and drives sidereal time, rise
 * and set. {@link #tt} is uniform dynamical time and drives every orbital
 * model. Both count days from the J2000 epoch, 2000-01-01T12:00:00Z; the
 * difference between them is {@link DeltaT}.</p>
 *
 * <p>Instances are immutable apart from a lazily filled cache of the Earth's
 * tilt and sidereal time. The cache is written at most once per value with a
 * deterministic result, so concurrent readers are safe.</p>
 */
public final class AstroTime implements Comparable<AstroTime> {
    /** The J2000 epoch as a {@link java.time.Instant}. */
    public static final Instant J2000 = Instant.parse("2000-01-01T12:00:00Z");

    private static final long J2000_EPOCH_DAY = LocalDate.of(2000, 1, 1).toEpochDay();

    /** Universal time, days since J2000. */
    public final double ut;

    /** Terrestrial (dynamical) time, days since J2000. */
    public final double tt;

    private volatile EarthTilt tilt;
    private volatile double siderealHours = Double.NaN;

    private AstroTime(double ut, double tt) {
        this.ut = ut;
        this.tt = tt;
    }

    /**
     * Create a time from universal time.
     *
     * @param ut days since J2000 on the UT scale
     * @throws IllegalArgumentException if {@code ut} is not finite
     */
    public static AstroTime fromUniversal(double ut) {
        requireFinite(ut, "ut");
        return new AstroTime(ut, DeltaT.terrestrialTime(ut));
    }

    /**
     * Create a time from terrestrial time; UT is solved iteratively.
     *
     * @param tt days since J2000 on the TT scale
     * @throws IllegalArgumentException if {@code tt} is not finite
     */
    public static AstroTime fromTerrestrial(double tt) {
        requireFinite(tt, "tt");
        return new AstroTime(DeltaT.universalTime(tt), tt);
    }

    /**
     * Create a time from a proleptic Gregorian calendar date and UTC clock time.
     *
     * @throws IllegalArgumentException if any field is out of range
     */
    public static AstroTime fromCalendar(int year, int month, int day, int hour, int minute, double second) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59 || !(second >= 0.0 && second < 60.0)) {
            throw new IllegalArgumentException(String.format(
                    "Invalid clock time %02d:%02d:%s", hour, minute, second));
        }
        long epochDay;
        try {
            epochDay = LocalDate.of(year, month, day).toEpochDay();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid calendar date " + year + "-" + month + "-" + day, e);
        }
        double ut = (epochDay - J2000_EPOCH_DAY) - 0.5
                + hour / 24.0 + minute / 1440.0 + second / AstroConstants.SECONDS_PER_DAY;
        return fromUniversal(ut);
    }

    /** Create a time at midnight UTC of the given date. */
    public static AstroTime fromCalendar(int year, int month, int day) {
        return fromCalendar(year, month, day, 0, 0, 0.0);
    }

    /** Create a time from a {@link java.time.Instant}, treated as UT. */
    public static AstroTime fromInstant(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        double seconds = (instant.getEpochSecond() - J2000.getEpochSecond()) + instant.getNano() * 1.0e-9;
        return fromUniversal(seconds / AstroConstants.SECONDS_PER_DAY);
    }

    /**
     * A new time offset from this one by a number of (UT) days. Terrestrial time
     * is derived again from the offset UT value.
     */
    public AstroTime addDays(double days) {
        return fromUniversal(ut + days);
    }

    /** This time as a {@link java.time.Instant} (UTC, millisecond resolution is typical). */
    public Instant toInstant() {
        double seconds = ut * AstroConstants.SECONDS_PER_DAY;
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1.0e9);
        return J2000.plusSeconds(whole).plusNanos(nanos);
    }

    /** Julian centuries of TT since J2000. */
    public double julianCenturies() {
        return tt / AstroConstants.DAYS_PER_CENTURY;
    }

    /** Nutation angles and obliquity, computed on first use. */
    public EarthTilt tilt() {
        EarthTilt t = tilt;
        if (t == null) {
            t = Nutation.tilt(tt);
            tilt = t;
        }
        return t;
    }

    /** Greenwich apparent sidereal time in hours, computed on first use. */
    double siderealTime() {
        double st = siderealHours;
        if (Double.isNaN(st)) {
            st = EarthOrientation.computeSiderealTime(this);
            siderealHours = st;
        }
        return st;
    }

    @Override
    public int compareTo(AstroTime other) {
        return Double.compare(tt, other.tt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstroTime)) return false;
        AstroTime other = (AstroTime) o;
        return Double.compare(ut, other.ut) == 0 && Double.compare(tt, other.tt) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ut, tt);
    }

    /** ISO-8601 UTC representation, truncated to milliseconds. */
    @Override
    public String toString() {
        return toInstant().truncatedTo(ChronoUnit.MILLIS).toString();
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite: " + value);
        }
    }
}
