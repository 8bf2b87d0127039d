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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RotationsTest {

    private static final double IDENTITY_TOLERANCE = 1.0e-12;
    private static final double ANGLE_TOLERANCE = 1.0e-6; // degrees

    private static final AstroTime TIME = AstroTime.fromCalendar(2024, 3, 15, 6, 30, 0.0);
    private static final Observer OBSERVER = new Observer(-33.9, 151.2, 40.0);

    @Nested
    @DisplayName("Inverse law")
    class InverseTests {

        @Test
        @DisplayName("Every frame pair composes with its inverse to the identity")
        void pairsComposeToIdentity() {
            assertIdentity(RotationMatrix.combine(Rotations.eqjToEcl(), Rotations.eclToEqj()), "EQJ/ECL");
            assertIdentity(RotationMatrix.combine(Rotations.eqjToEqd(TIME), Rotations.eqdToEqj(TIME)), "EQJ/EQD");
            assertIdentity(RotationMatrix.combine(Rotations.eqdToHor(TIME, OBSERVER), Rotations.horToEqd(TIME, OBSERVER)), "EQD/HOR");
            assertIdentity(RotationMatrix.combine(Rotations.eqjToHor(TIME, OBSERVER), Rotations.horToEqj(TIME, OBSERVER)), "EQJ/HOR");
            assertIdentity(RotationMatrix.combine(Rotations.eqdToEcl(TIME), Rotations.eclToEqd(TIME)), "EQD/ECL");
            assertIdentity(RotationMatrix.combine(Rotations.eclToHor(TIME, OBSERVER), Rotations.horToEcl(TIME, OBSERVER)), "ECL/HOR");
            assertIdentity(RotationMatrix.combine(Rotations.eqjToGal(), Rotations.galToEqj()), "EQJ/GAL");
        }

        @Test
        @DisplayName("Inverse composed the other way round is also the identity")
        void reverseOrder() {
            assertIdentity(RotationMatrix.combine(Rotations.horToEcl(TIME, OBSERVER), Rotations.eclToHor(TIME, OBSERVER)), "HOR/ECL");
            assertIdentity(RotationMatrix.combine(Rotations.galToEqj(), Rotations.eqjToGal()), "GAL/EQJ");
        }

        @Test
        @DisplayName("Precession and nutation directions are mutual inverses")
        void gyrationInverse() {
            for (EarthOrientation.Direction dir : EarthOrientation.Direction.values()) {
                EarthOrientation.Direction other = dir == EarthOrientation.Direction.FROM_J2000
                        ? EarthOrientation.Direction.INTO_J2000
                        : EarthOrientation.Direction.FROM_J2000;
                assertIdentity(RotationMatrix.combine(
                        EarthOrientation.precession(TIME, dir), EarthOrientation.precession(TIME, other)), "precession");
                assertIdentity(RotationMatrix.combine(
                        EarthOrientation.nutation(TIME, dir), EarthOrientation.nutation(TIME, other)), "nutation");
            }
        }
    }

    @Nested
    @DisplayName("Rotation matrices")
    class MatrixTests {

        @Test
        @DisplayName("Rotating a sum equals summing the rotations")
        void linearity() {
            RotationMatrix rot = Rotations.eqjToHor(TIME, OBSERVER);
            AstroVector a = new AstroVector(0.3, -1.2, 0.7, TIME);
            AstroVector b = new AstroVector(-2.5, 0.4, 1.9, TIME);
            AstroVector lhs = rot.rotate(a.add(b));
            AstroVector rhs = rot.rotate(a).add(rot.rotate(b));
            assertEquals(rhs.x, lhs.x, 1.0e-14);
            assertEquals(rhs.y, lhs.y, 1.0e-14);
            assertEquals(rhs.z, lhs.z, 1.0e-14);

            StateVector s = new StateVector(a, b);
            StateVector rs = rot.rotate(s);
            assertEquals(rot.rotate(b).x, rs.vx, 1.0e-15);
            assertEquals(rot.rotate(a).z, rs.z, 1.0e-15);
        }

        @Test
        @DisplayName("Pivoting 90 degrees about z turns x into y")
        void pivot() {
            RotationMatrix rot = RotationMatrix.identity().pivot(2, 90.0);
            AstroVector v = rot.rotate(new AstroVector(1.0, 0.0, 0.0, TIME));
            assertEquals(0.0, v.x, 1.0e-15);
            assertEquals(1.0, v.y, 1.0e-15);
            assertEquals(0.0, v.z, 1.0e-15);
        }

        @Test
        @DisplayName("Invalid pivot axis is rejected")
        void invalidAxis() {
            assertThrows(IllegalArgumentException.class, () -> RotationMatrix.identity().pivot(3, 10.0));
            assertThrows(IllegalArgumentException.class, () -> RotationMatrix.identity().pivot(-1, 10.0));
        }

        @Test
        @DisplayName("Non-3x3 arrays are rejected")
        void invalidShape() {
            assertThrows(IllegalArgumentException.class, () -> new RotationMatrix(new double[2][3]));
        }
    }

    @Nested
    @DisplayName("Named frames")
    class FrameTests {

        @Test
        @DisplayName("Galactic center and north pole land on the galactic axes")
        void galacticAxes() {
            Spherical center = Spherical.fromVector(Rotations.eqjToGal().rotate(
                    new Spherical(-28.936175, 266.404996, 1.0).toVector(TIME)));
            assertEquals(0.0, center.lat, 1.0e-3);
            assertEquals(0.0, Math.min(center.lon, 360.0 - center.lon), 1.0e-3);

            Spherical pole = Spherical.fromVector(Rotations.eqjToGal().rotate(
                    new Spherical(27.12825, 192.85948, 1.0).toVector(TIME)));
            assertEquals(90.0, pole.lat, 1.0e-3);
        }

        @Test
        @DisplayName("The ecliptic pole is 23.44 degrees from the celestial pole")
        void eclipticPole() {
            AstroVector pole = Rotations.eclToEqj().rotate(new AstroVector(0.0, 0.0, 1.0, TIME));
            assertEquals(90.0 - EarthOrientation.obliquityJ2000(), Spherical.fromVector(pole).lat, 1.0e-6);
        }

        @Test
        @DisplayName("HOR rotation agrees with horizon() for a real body")
        void horizonAgreement() {
            Ephemeris.Equatorial ofDate = Ephemeris.equator(Body.SUN, TIME, OBSERVER, true, true);
            Ephemeris.Horizontal hor = Ephemeris.horizon(TIME, OBSERVER, ofDate.ra, ofDate.dec, Refraction.NONE);

            Ephemeris.Equatorial j2000 = Ephemeris.equator(Body.SUN, TIME, OBSERVER, false, true);
            AstroVector horVec = Rotations.eqjToHor(TIME, OBSERVER).rotate(j2000.vec);
            Spherical sphere = Rotations.horizonFromVector(horVec, Refraction.NONE);

            assertEquals(hor.altitude, sphere.lat, ANGLE_TOLERANCE);
            assertEquals(hor.azimuth, sphere.lon, ANGLE_TOLERANCE);
        }

        @Test
        @DisplayName("vectorFromHorizon undoes horizonFromVector with refraction")
        void horizonVectorRoundTrip() {
            AstroVector v = new Spherical(2.5, 123.0, 1.0).toVector(TIME);
            Spherical h = Rotations.horizonFromVector(v, Refraction.NORMAL);
            assertTrue(h.lat > 2.5, "refraction lifts the object");
            AstroVector back = Rotations.vectorFromHorizon(h, TIME, Refraction.NORMAL);
            assertEquals(v.x, back.x, 1.0e-12);
            assertEquals(v.y, back.y, 1.0e-12);
            assertEquals(v.z, back.z, 1.0e-12);
        }
    }

    private static void assertIdentity(RotationMatrix m, String label) {
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                assertEquals(i == j ? 1.0 : 0.0, m.get(i, j), IDENTITY_TOLERANCE, label + " [" + i + "][" + j + "]");
            }
        }
    }
}
