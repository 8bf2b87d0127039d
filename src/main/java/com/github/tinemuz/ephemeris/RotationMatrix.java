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
 * A 3x3 orthonormal matrix that converts vectors from one orientation to
 * another. Rotating a vector computes {@code out[i] = sum_j rot[i][j] * v[j]}.
 */
public final class RotationMatrix {
    private final double[][] rot;

    /**
     * @param rot 3x3 matrix, copied on construction
     * @throws IllegalArgumentException if the array is not 3x3
     */
    public RotationMatrix(double[][] rot) {
        Objects.requireNonNull(rot, "rot");
        if (rot.length != 3) {
            throw new IllegalArgumentException("Rotation matrix must have 3 rows");
        }
        this.rot = new double[3][];
        for (int i = 0; i < 3; i++) {
            if (rot[i] == null || rot[i].length != 3) {
                throw new IllegalArgumentException("Rotation matrix must have 3 columns");
            }
            this.rot[i] = rot[i].clone();
        }
    }

    public static RotationMatrix identity() {
        return new RotationMatrix(new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});
    }

    /** Element at row {@code i}, column {@code j}. */
    public double get(int i, int j) {
        return rot[i][j];
    }

    /** The inverse rotation, which for an orthonormal matrix is its transpose. */
    public RotationMatrix inverse() {
        double[][] inv = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                inv[i][j] = rot[j][i];
            }
        }
        return new RotationMatrix(inv);
    }

    /**
     * Combines two rotations into one that applies {@code first} and then
     * {@code second}.
     */
    public static RotationMatrix combine(RotationMatrix first, RotationMatrix second) {
        double[][] c = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                c[i][j] = second.rot[i][0] * first.rot[0][j]
                        + second.rot[i][1] * first.rot[1][j]
                        + second.rot[i][2] * first.rot[2][j];
            }
        }
        return new RotationMatrix(c);
    }

    public AstroVector rotate(AstroVector v) {
        return new AstroVector(
                rot[0][0] * v.x + rot[0][1] * v.y + rot[0][2] * v.z,
                rot[1][0] * v.x + rot[1][1] * v.y + rot[1][2] * v.z,
                rot[2][0] * v.x + rot[2][1] * v.y + rot[2][2] * v.z,
                v.t);
    }

    public StateVector rotate(StateVector s) {
        return new StateVector(rotate(s.position()), rotate(s.velocity()));
    }

    /**
     * Follows this rotation with a counterclockwise turn (right-hand rule)
     * about one of the output axes.
     *
     * @param axis 0 = x, 1 = y, 2 = z
     * @param angle degrees
     * @throws IllegalArgumentException if {@code axis} is not 0, 1 or 2, or the
     *         angle is not finite
     */
    public RotationMatrix pivot(int axis, double angle) {
        if (axis < 0 || axis > 2) {
            throw new IllegalArgumentException("Invalid axis " + axis + ". Must be 0, 1, or 2.");
        }
        if (!Double.isFinite(angle)) {
            throw new IllegalArgumentException("Pivot angle must be finite: " + angle);
        }
        double radians = Math.toRadians(angle);
        double c = Math.cos(radians);
        double s = Math.sin(radians);

        // (i, j, k) keeps i x j = k for whichever axis k was chosen
        int i = (axis + 1) % 3;
        int j = (axis + 2) % 3;
        int k = axis;

        double[][] turn = new double[3][3];
        turn[i][i] = c;
        turn[i][j] = -s;
        turn[j][i] = s;
        turn[j][j] = c;
        turn[k][k] = 1.0;
        return combine(this, new RotationMatrix(turn));
    }

    @Override
    public String toString() {
        return String.format("RotationMatrix[[%.12f, %.12f, %.12f], [%.12f, %.12f, %.12f], [%.12f, %.12f, %.12f]]",
                rot[0][0], rot[0][1], rot[0][2],
                rot[1][0], rot[1][1], rot[1][2],
                rot[2][0], rot[2][1], rot[2][2]);
    }
}
