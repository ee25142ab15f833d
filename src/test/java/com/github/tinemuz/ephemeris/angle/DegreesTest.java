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
package com.github.tinemuz.ephemeris.angle;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DegreesTest {

    private static final double TOLERANCE = 1e-6;

    @Nested
    @DisplayName("Range normalization")
    class NormalizationTests {

        @Test
        @DisplayName("0..360 wraps negative and large angles")
        void mapTo0To360() {
            assertEquals(222.183, new Degrees(-137.817).mapTo0To360().value(), TOLERANCE);
            assertEquals(10.0, new Degrees(730.0).mapTo0To360().value(), TOLERANCE);
            assertEquals(0.0, new Degrees(360.0).mapTo0To360().value(), TOLERANCE);
            assertEquals(0.0, new Degrees(-1e-17).mapTo0To360().value(), 0.0);
        }

        @Test
        @DisplayName("-180..180 maps 189 to -171 and -189 to 171")
        void mapNeg180To180() {
            assertEquals(-171.0, new Degrees(189.0).mapNeg180To180().value(), TOLERANCE);
            assertEquals(171.0, new Degrees(-189.0).mapNeg180To180().value(), TOLERANCE);
            assertEquals(89.0, new Degrees(89.0).mapNeg180To180().value(), TOLERANCE);
            assertEquals(-180.0, new Degrees(180.0).mapNeg180To180().value(), TOLERANCE);
            assertEquals(-171.0, new Degrees(909.0).mapNeg180To180().value(), TOLERANCE);
        }

        @Test
        @DisplayName("-90..90 folds angles past the poles")
        void mapToNeg90To90() {
            assertEquals(80.0, new Degrees(100.0).mapToNeg90To90().value(), TOLERANCE);
            assertEquals(-80.0, new Degrees(-100.0).mapToNeg90To90().value(), TOLERANCE);
            assertEquals(-45.0, new Degrees(315.0).mapToNeg90To90().value(), TOLERANCE);
            assertEquals(12.5, new Degrees(12.5).mapToNeg90To90().value(), TOLERANCE);
        }

        @Test
        @DisplayName("Latitude range is closed at both poles")
        void polesKept() {
            assertEquals(90.0, new Degrees(90.0).mapToNeg90To90().value(), 0.0);
            assertEquals(-90.0, new Degrees(-90.0).mapToNeg90To90().value(), 0.0);
            assertEquals(90.0, new Degrees(450.0).mapToNeg90To90().value(), 0.0);
            assertEquals(-90.0, new Degrees(270.0).mapToNeg90To90().value(), 0.0);
        }

        @Test
        @DisplayName("Normalization is idempotent")
        void idempotent() {
            double[] samples = {-1000.5, -360.0, -180.0, -90.0, -0.1, 0.0, 45.0, 179.999, 359.999, 725.25};
            for (double x : samples) {
                Degrees d = new Degrees(x);
                Degrees once = d.mapTo0To360();
                assertEquals(once, once.mapTo0To360(), "0..360 of " + x);
                assertTrue(once.value() >= 0.0 && once.value() < 360.0, "in [0, 360): " + x);
                Degrees half = d.mapNeg180To180();
                assertEquals(half.value(), half.mapNeg180To180().value(), 1e-12, "-180..180 of " + x);
                assertTrue(half.value() >= -180.0 && half.value() < 180.0, "in [-180, 180): " + x);
                Degrees quarter = d.mapToNeg90To90();
                assertEquals(quarter.value(), quarter.mapToNeg90To90().value(), 1e-12, "-90..90 of " + x);
                assertTrue(Math.abs(quarter.value()) <= 90.0, "in [-90, 90]: " + x);
            }
        }
    }

    @Nested
    @DisplayName("Sexagesimal conversion")
    class SexagesimalTests {

        @Test
        @DisplayName("d/m/s and h/m/s build decimal degrees")
        void fromDmsAndHms() {
            assertEquals(-6.719892, Degrees.fromDms(-6, 43, 11.61).value(), TOLERANCE);
            assertEquals(134.688470, Degrees.fromHms(8, 58, 45.2328).value(), TOLERANCE);
            assertEquals(116.8625, Degrees.fromHms(7, 47, 27).value(), TOLERANCE);
        }

        @Test
        @DisplayName("Decomposition to d/m/s")
        void toDms() {
            Sexagesimal dms = new Degrees(133.167265).toDms();
            assertEquals(133, dms.whole());
            assertEquals(10, dms.minutes());
            assertEquals(2.154, dms.seconds(), 1e-3);
        }

        @Test
        @DisplayName("Negative hour angle keeps its sign on the hours")
        void toHmsNegative() {
            Sexagesimal hms = new Degrees(-130.94010921668462).toHms();
            assertEquals(-8, hms.signedWhole());
            assertEquals(43, hms.minutes());
            assertEquals(45.6262, hms.seconds(), 1e-4);
        }

        @Test
        @DisplayName("Right ascension in hours after normalization")
        void normalizedToHms() {
            Sexagesimal hms = new Degrees(-137.817).mapTo0To360().toHms();
            assertEquals(14, hms.signedWhole());
            assertEquals(48, hms.minutes());
            assertEquals(43.92, hms.seconds(), 1e-6);
        }

        @Test
        @DisplayName("Formatted strings")
        void formatting() {
            assertEquals("13° 46' 10.77\"", new Degrees(13.769657226951539).toDmsString(2));
            assertEquals("-19° 38' 51.00\"", new Degrees(-19.6475).toDmsString(2));
            assertEquals("8h 58m 44.14s", new Degrees(134.68392033025296).toHmsString(2));
            assertEquals("-0° 30' 0.0\"", new Degrees(-0.5).toDmsString(1));
        }
    }

    @Nested
    @DisplayName("Unit conversion")
    class UnitTests {

        @Test
        @DisplayName("Arc seconds from d/m/s")
        void arcSeconds() {
            assertEquals(133.167265, ArcSec.fromDms(133, 10, 2.154).toDegrees().value(), 1e-4);
            assertEquals(23.440636, ArcSec.fromDms(23, 26, 26.29).toDegrees().value(), TOLERANCE);
            assertEquals(3600.0, new Degrees(1.0).toArcSec().value(), 1e-9);
        }

        @Test
        @DisplayName("Radians round trip")
        void radians() {
            assertEquals(Math.PI, new Degrees(180.0).toRadians().value(), 1e-15);
            assertEquals(57.29577951308232, new Radians(1.0).toDegrees().value(), 1e-12);
            assertEquals(0.5, new Degrees(30.0).sin(), 1e-15);
        }
    }
}
