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
 * Position (AU) and velocity (AU/day) at one instant.
 */
public final class StateVector {
    public final double x;
    public final double y;
    public final double z;
    public final double vx;
    public final double vy;
    public final double vz;
    public final AstroTime t;

    public StateVector(double x, double y, double z, double vx, double vy, double vz, AstroTime t) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.vx = vx;
        this.vy = vy;
        this.vz = vz;
        this.t = Objects.requireNonNull(t, "t");
    }

    public StateVector(AstroVector position, AstroVector velocity) {
        this(position.x, position.y, position.z, velocity.x, velocity.y, velocity.z, position.t);
        position.requireSameTime(velocity);
    }

    public AstroVector position() {
        return new AstroVector(x, y, z, t);
    }

    public AstroVector velocity() {
        return new AstroVector(vx, vy, vz, t);
    }

    public StateVector add(StateVector other) {
        requireSameTime(other);
        return new StateVector(x + other.x, y + other.y, z + other.z,
                vx + other.vx, vy + other.vy, vz + other.vz, t);
    }

    public StateVector sub(StateVector other) {
        requireSameTime(other);
        return new StateVector(x - other.x, y - other.y, z - other.z,
                vx - other.vx, vy - other.vy, vz - other.vz, t);
    }

    public StateVector neg() {
        return new StateVector(-x, -y, -z, -vx, -vy, -vz, t);
    }

    public StateVector scale(double k) {
        return new StateVector(k * x, k * y, k * z, k * vx, k * vy, k * vz, t);
    }

    private void requireSameTime(StateVector other) {
        if (other.t.tt != t.tt) {
            throw new IllegalStateException(
                    "States belong to different instants: " + t + " and " + other.t);
        }
    }

    @Override
    public String toString() {
        return String.format("StateVector(pos=[%.9f, %.9f, %.9f], vel=[%.9f, %.9f, %.9f], %s)",
                x, y, z, vx, vy, vz, t);
    }
}
