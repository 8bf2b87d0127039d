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
 * A geographic location on or near the Earth's surface.
 */
public final class Observer {
    /** Geodetic latitude in degrees, north positive. */
    public final double latitude;

    /** Longitude in degrees, east positive. */
    public final double longitude;

    /** Height above the reference ellipsoid in meters. */
    public final double height;

    /**
     * @throws IllegalArgumentException if latitude is outside [-90, 90] or a
     *         coordinate is not finite
     */
    public Observer(double latitude, double longitude, double height) {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > +90.0) {
            throw new IllegalArgumentException("Invalid observer latitude: " + latitude);
        }
        if (!Double.isFinite(longitude)) {
            throw new IllegalArgumentException("Invalid observer longitude: " + longitude);
        }
        if (!Double.isFinite(height)) {
            throw new IllegalArgumentException("Invalid observer height: " + height);
        }
        this.latitude = latitude;
        this.longitude = longitude;
        this.height = height;
    }

    @Override
    public String toString() {
        return String.format("Observer(lat=%.6f, lon=%.6f, height=%.3f)", latitude, longitude, height);
    }
}
