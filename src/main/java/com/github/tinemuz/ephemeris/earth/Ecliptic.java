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
import com.github.tinemuz.ephemeris.time.JulianDay;

/** Obliquity of the ecliptic (Meeus, chapter 22). */
public final class Ecliptic {
    private static final double EPSILON_0_ARCSEC = ArcSec.fromDms(23, 26, 21.448).value();

    private Ecliptic() {}

    /**
     * Mean obliquity from Laskar's polynomial in U = T/100, valid for 10000
     * years either side of J2000.
     */
    public static Degrees meanObliquity(double jd) {
        double u = JulianDay.centuriesFromJ2000(jd) / 100.0;
        double arcsec = EPSILON_0_ARCSEC + u * (-4680.93 + u * (-1.55 + u * (1999.25 + u * (-51.38
                + u * (-249.67 + u * (-39.05 + u * (7.12 + u * (27.87 + u * (5.79 + u * 2.45)))))))));
        return new ArcSec(arcsec).toDegrees();
    }

    /** Mean obliquity plus nutation in obliquity. */
    public static Degrees trueObliquity(double jd) {
        return meanObliquity(jd).plus(Nutation.inObliquity(jd).toDegrees());
    }
}
