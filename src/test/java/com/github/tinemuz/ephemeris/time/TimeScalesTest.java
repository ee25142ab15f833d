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
package com.github.tinemuz.ephemeris.time;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TimeScalesTest {

    private static final double SECONDS = 1.0 / TimeScales.SECONDS_PER_DAY;

    @Nested
    @DisplayName("Leap seconds")
    class LeapSecondTests {

        @Test
        @DisplayName("32 s on 2003-08-28 (Meeus 40.a epoch)")
        void year2003() {
            double jd = JulianDay.fromDateHms(2003, 8, 28, 3, 17, 0.0);
            assertEquals(32.0, TimeScales.cumulativeLeapSeconds(jd), 0.1);
        }

        @Test
        @DisplayName("Zero before 1961")
        void beforeTable() {
            assertEquals(0.0, TimeScales.cumulativeLeapSeconds(JulianDay.fromDate(1950, 1, 1.0)), 0.0);
        }

        @Test
        @DisplayName("Step takes effect on the day it is listed")
        void stepBoundary() {
            double jd2017 = JulianDay.fromDate(2017, 1, 1.0);
            assertEquals(36.0, TimeScales.cumulativeLeapSeconds(jd2017 - 1e-6), 0.0);
            assertEquals(37.0, TimeScales.cumulativeLeapSeconds(jd2017), 0.0);
            assertEquals(37.0, TimeScales.cumulativeLeapSeconds(JulianDay.fromDate(2030, 1, 1.0)), 0.0);
        }

        @Test
        @DisplayName("Before 1972 TAI - UTC drifts linearly")
        void drift() {
            // 1962-01-01: 1.8458580 s + (MJD - 37665) x 0.0011232 s
            double jd = 2437665.5;
            assertEquals(1.845858, TimeScales.cumulativeLeapSeconds(jd), 1e-9);
            assertEquals(1.845858 + 100 * 0.0011232, TimeScales.cumulativeLeapSeconds(jd + 100), 1e-9);
        }
    }

    @Nested
    @DisplayName("Delta T")
    class DeltaTTests {

        @Test
        @DisplayName("Tabulated value on 2017-01-01")
        void tabulated() {
            assertEquals(68.5927, TimeScales.deltaT(2457754.5), 1e-6);
        }

        @Test
        @DisplayName("Linear between table rows")
        void interpolated() {
            double jd2016 = JulianDay.fromDate(2016, 1, 1.0);
            double jd2017 = JulianDay.fromDate(2017, 1, 1.0);
            double mid = (jd2016 + jd2017) / 2.0;
            assertEquals((68.1024 + 68.5927) / 2.0, TimeScales.deltaT(mid), 1e-9);
        }

        @Test
        @DisplayName("First and last rows are inside the table")
        void tableEnds() {
            assertEquals(43.4724, TimeScales.deltaT(JulianDay.fromDate(1973, 2, 1.0)), 1e-9);
            assertEquals(69.14, TimeScales.deltaT(JulianDay.fromDate(2025, 1, 1.0)), 1e-9);
        }

        @Test
        @DisplayName("Polynomials outside the table")
        void polynomial() {
            assertEquals(-2.79, TimeScales.deltaTPolynomial(1900), 1e-9);
            assertEquals(120.0, TimeScales.deltaTPolynomial(1600), 1e-9);
            assertEquals(1574.2, TimeScales.deltaTPolynomial(1000), 1e-9);
            assertEquals(10583.6, TimeScales.deltaTPolynomial(0), 1e-9);
            assertEquals(62.92 + 32.217 * 0.3 + 55.89 * 0.09, TimeScales.deltaTPolynomial(2030), 1e-9);
            assertEquals(-20.0 + 32.0 * 24.2 * 24.2, TimeScales.deltaTPolynomial(-600), 1e-6);
        }

        @Test
        @DisplayName("Polynomial is used for dates before the table")
        void beforeTable() {
            double jd = JulianDay.fromDate(1900, 6, 1.0);
            assertEquals(TimeScales.deltaTPolynomial(1900), TimeScales.deltaT(jd), 1e-9);
        }

        @Test
        @DisplayName("Ancient dates are dominated by the parabola")
        void ancient() {
            // y = -1000: u = -28.2, -20 + 32 u^2
            double jd = JulianDay.fromDate(-1000, 1, 1.0);
            assertEquals(-20.0 + 32.0 * 28.2 * 28.2, TimeScales.deltaT(jd), 1e-6);
        }
    }

    @Nested
    @DisplayName("UTC to TT")
    class ConversionTests {

        @Test
        @DisplayName("TT - UTC is leap seconds + 32.184 s inside the tables")
        void insideTables() {
            double jd = JulianDay.fromDateHms(2003, 8, 28, 3, 17, 0.0);
            assertTrue(TimeScales.isUtcCovered(jd));
            assertEquals(64.184, (TimeScales.utcToTt(jd) - jd) / SECONDS, 1e-4);
        }

        @Test
        @DisplayName("Dates past the last observed Delta T still convert through the leap seconds")
        void pastDeltaTTable() {
            double jd = JulianDay.fromDate(2026, 10, 18.0);
            assertTrue(TimeScales.isUtcCovered(jd));
            assertEquals(37.0 + 32.184, (TimeScales.utcToTt(jd) - jd) / SECONDS, 1e-4);
            // UT1 - UTC held at its 2025-01-01 value: 37 + 32.184 - 69.14
            assertEquals(0.044, TimeScales.ut1MinusUtc(jd), 1e-9);
            assertEquals(0.044, (TimeScales.utcToUt1(jd) - jd) / SECONDS, 1e-4);
        }

        @Test
        @DisplayName("A leap second changes TT - UTC by exactly one second")
        void acrossLeapSecond() {
            double jd2017 = JulianDay.fromDate(2017, 1, 1.0);
            double before = (TimeScales.utcToTt(jd2017 - 1e-6) - (jd2017 - 1e-6)) / SECONDS;
            double after = (TimeScales.utcToTt(jd2017) - jd2017) / SECONDS;
            assertEquals(68.184, before, 1e-4);
            assertEquals(69.184, after, 1e-4);
        }

        @Test
        @DisplayName("UT1 lies within a second of UTC")
        void ut1NearUtc() {
            double jd = JulianDay.fromDate(2010, 6, 1.0);
            assertEquals(0.0, (TimeScales.utcToUt1(jd) - jd) / SECONDS, 0.9);
        }

        @Test
        @DisplayName("Before 1961 the input is taken as UT1")
        void outsideTables() {
            double jd = JulianDay.fromDate(1900, 1, 1.0);
            assertFalse(TimeScales.isUtcCovered(jd));
            assertEquals(jd + TimeScales.deltaT(jd) * SECONDS, TimeScales.utcToTt(jd), 1e-12);
            assertEquals(TimeScales.ut1ToTt(jd), TimeScales.utcToTt(jd), 0.0);
        }
    }
}
