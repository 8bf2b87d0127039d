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
 * Spherical coordinates: latitude and longitude in degrees, distance in AU.
 */
public final class Spherical {
    /** Latitude angle, degrees [-90, +90]. */
    public final double lat;

    /** Longitude angle, degrees [0, 360). */
    public final double lon;

    /** Distance in AU. */
    public final double dist;

    public Spherical(double lat, double lon, double dist) {
        this.lat = lat;
        this.lon = lon;
        this.dist = dist;
    }

    /**
     * Converts a Cartesian vector to spherical coordinates.
     *
     * @throws IllegalStateException for the zero vector
     */
    public static Spherical fromVector(AstroVector v) {
        double xyproj = v.x * v.x + v.y * v.y;
        double dist = Math.sqrt(xyproj + v.z * v.z);
        if (xyproj == 0.0) {
            if (v.z == 0.0) {
                throw new IllegalStateException("Zero-length vector has no direction");
            }
            return new Spherical(v.z < 0.0 ? -90.0 : +90.0, 0.0, dist);
        }
        double lon = Math.toDegrees(Math.atan2(v.y, v.x));
        if (lon < 0.0) lon += 360.0;
        double lat = Math.toDegrees(Math.atan2(v.z, Math.sqrt(xyproj)));
        return new Spherical(lat, lon, dist);
    }

    /** Converts back to a Cartesian vector valid at {@code time}. */
    public AstroVector toVector(AstroTime time) {
        double radlat = Math.toRadians(lat);
        double radlon = Math.toRadians(lon);
        double rcoslat = dist * Math.cos(radlat);
        return new AstroVector(
                rcoslat * Math.cos(radlon),
                rcoslat * Math.sin(radlon),
                dist * Math.sin(radlat),
                time);
    }
}
