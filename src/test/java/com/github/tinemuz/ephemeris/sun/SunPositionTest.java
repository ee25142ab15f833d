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
package com.github.tinemuz.ephemeris.sun;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.ephemeris.coordinates.Equatorial;
import com.github.tinemuz.ephemeris.time.JulianDay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SunPositionTest {

    // 1992 October 13.0 TD, Meeus example 25.b
    private static final double JD = 2448908.5;

    @Nested
    @DisplayName("VSOP87 series")
    class SeriesTests {

        @Test
        @DisplayName("Heliocentric longitude and radius vector")
        void heliocentric() {
            assertEquals(19.907372, SunPosition.heliocentricLongitude(JD).value(), 1e-5);
            assertEquals(0.99760775, SunPosition.radiusVector(JD), 1e-7);
            assertTrue(Math.abs(SunPosition.heliocentricLatitude(JD).value()) < 1e-3);
        }

        @Test
        @DisplayName("Geocentric position is opposite the heliocentric one")
        void geocentric() {
            assertEquals(SunPosition.heliocentricLongitude(JD).value() + 180.0,
                    SunPosition.geocentricLongitude(JD).value(), 1e-12);
            assertEquals(-SunPosition.heliocentricLatitude(JD).value(),
                    SunPosition.geocentricLatitude(JD).value(), 0.0);
        }

        @Test
        @DisplayName("Radius vector stays between perihelion and aphelion")
        void radiusBounds() {
            for (int month = 1; month <= 12; month++) {
                double r = SunPosition.radiusVector(JulianDay.fromDate(2024, month, 1.0));
                assertTrue(r > 0.983 && r < 1.017, "radius in month " + month + ": " + r);
            }
        }
    }

    @Nested
    @DisplayName("Apparent place")
    class ApparentTests {

        @Test
        @DisplayName("Apparent longitude")
        void apparentLongitude() {
            assertEquals(199.9060606, SunPosition.apparentLongitude(JD).value(), 1e-4);
        }

        @Test
        @DisplayName("Apparent latitude is below one arc second")
        void apparentLatitude() {
            assertEquals(0.621, SunPosition.apparentLatitude(JD).value() * 3600.0, 0.01);
        }

        @Test
        @DisplayName("Aberration is about -20.5\"")
        void aberration() {
            assertEquals(-20.53, SunPosition.aberration(JD).value() * 3600.0, 0.01);
        }

        @Test
        @DisplayName("Right ascension and declination")
        void equatorial() {
            Equatorial eq = SunPosition.equatorial(JD);
            assertEquals(198.378180, eq.rightAscension().value(), 1e-4);
            assertEquals(-7.783871, eq.declination().value(), 1e-4);
        }

        @Test
        @DisplayName("Declination stays within the obliquity over a year")
        void declinationBounds() {
            double start = JulianDay.fromDate(2024, 1, 1.0);
            for (int day = 0; day < 366; day += 5) {
                double dec = SunPosition.equatorial(start + day).declination().value();
                assertTrue(Math.abs(dec) < 23.45, "declination on day " + day + ": " + dec);
            }
        }
    }

    @Test
    @DisplayName("Mean anomaly (Meeus 47.a)")
    void meanAnomaly() {
        assertEquals(97.643514, SunPosition.meanAnomaly(2448724.5).value(), 1e-6);
    }

    @Test
    @DisplayName("Variation in longitude is close to one degree per day")
    void longitudeVariation() {
        double perDay = SunPosition.longitudeVariation(JD) / 3600.0;
        assertEquals(1.0, perDay, 0.05);
    }
}
