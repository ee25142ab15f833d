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
package com.github.tinemuz.ephemeris.earth;

import com.github.tinemuz.ephemeris.angle.ArcSec;
import com.github.tinemuz.ephemeris.angle.Degrees;
import com.github.tinemuz.ephemeris.table.TableResource;
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Nutation in longitude and in obliquity from the 63-term IAU 1980 series
 * (Meeus, chapter 22). Accuracy is about 0.0003".
 *
 * <p>Terms are read from <code>nutation.txt</code>; each row holds the multipliers
 * of D, M, M', F and Omega followed by the sine coefficients for longitude and
 * the cosine coefficients for obliquity, in units of 0.0001".</p>
 */
public final class Nutation {
    private static final TableResource TERMS = new TableResource("nutation.txt", 9);
    private static final double UNIT_ARCSEC = 0.0001;

    private Nutation() {}

    /** Delta psi. */
    public static ArcSec inLongitude(double jd) {
        Arguments a = Arguments.at(jd);
        double sum = 0.0;
        for (double[] row : TERMS.rows()) {
            sum += (row[5] + row[6] * a.t) * Math.sin(a.argument(row));
        }
        return new ArcSec(sum * UNIT_ARCSEC);
    }

    /** Delta epsilon. */
    public static ArcSec inObliquity(double jd) {
        Arguments a = Arguments.at(jd);
        double sum = 0.0;
        for (double[] row : TERMS.rows()) {
            sum += (row[7] + row[8] * a.t) * Math.cos(a.argument(row));
        }
        return new ArcSec(sum * UNIT_ARCSEC);
    }

    /** Load the term table. */
    public static void preload() {
        TERMS.rows();
    }

    // Fundamental arguments in radians plus T, the centuries since J2000
    private record Arguments(double t, double d, double m, double mPrime, double f, double omega) {

        static Arguments at(double jd) {
            double t = JulianDay.centuriesFromJ2000(jd);
            double t2 = t * t;
            double t3 = t2 * t;
            return new Arguments(
                    t,
                    radians(297.85036 + 445267.111480 * t - 0.0019142 * t2 + t3 / 189474.0),
                    radians(357.52772 + 35999.050340 * t - 0.0001603 * t2 - t3 / 300000.0),
                    radians(134.96298 + 477198.867398 * t + 0.0086972 * t2 + t3 / 56250.0),
                    radians(93.27191 + 483202.017538 * t - 0.0036825 * t2 + t3 / 327270.0),
                    radians(125.04452 - 1934.136261 * t + 0.0020708 * t2 + t3 / 450000.0));
        }

        double argument(double[] row) {
            return row[0] * d + row[1] * m + row[2] * mPrime + row[3] * f + row[4] * omega;
        }

        private static double radians(double degrees) {
            return new Degrees(degrees).mapTo0To360().toRadians().value();
        }
    }
}
