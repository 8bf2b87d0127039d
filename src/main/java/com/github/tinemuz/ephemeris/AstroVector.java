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
 * A Cartesian position in astronomical units, valid at one instant.
 *
 * <p>Binary operations require both operands to carry the same terrestrial
 * time; combining vectors from different instants is a programming error and
 * fails with {@link IllegalStateException}.</p>
 */
public final class AstroVector {
    public final double x;
    public final double y;
    public final double z;
    public final AstroTime t;

    public AstroVector(double x, double y, double z, AstroTime t) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.t = Objects.requireNonNull(t, "t");
    }

    public static AstroVector zero(AstroTime t) {
        return new AstroVector(0.0, 0.0, 0.0, t);
    }

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    public AstroVector add(AstroVector other) {
        requireSameTime(other);
        return new AstroVector(x + other.x, y + other.y, z + other.z, t);
    }

    public AstroVector sub(AstroVector other) {
        requireSameTime(other);
        return new AstroVector(x - other.x, y - other.y, z - other.z, t);
    }

    public AstroVector neg() {
        return new AstroVector(-x, -y, -z, t);
    }

    public AstroVector scale(double k) {
        return new AstroVector(k * x, k * y, k * z, t);
    }

    public double dot(AstroVector other) {
        requireSameTime(other);
        return x * other.x + y * other.y + z * other.z;
    }

    /** Same components, relabelled with a different instant. */
    public AstroVector withTime(AstroTime time) {
        return new AstroVector(x, y, z, time);
    }

    /**
     * Angle between this vector and another, in degrees [0, 180].
     *
     * @throws IllegalStateException if either vector has (near) zero length
     */
    public double angleWith(AstroVector other) {
        double r = length() * other.length();
        if (r < 1.0e-8) {
            throw new IllegalStateException("Cannot find angle between vectors because they are too short");
        }
        double dot = dot(other) / r;
        if (dot <= -1.0) return 180.0;
        if (dot >= +1.0) return 0.0;
        return Math.toDegrees(Math.acos(dot));
    }

    void requireSameTime(AstroVector other) {
        if (other.t.tt != t.tt) {
            throw new IllegalStateException(
                    "Vectors belong to different instants: " + t + " and " + other.t);
        }
    }

    @Override
    public String toString() {
        return String.format("AstroVector(%.9f, %.9f, %.9f, %s)", x, y, z, t);
    }
}
