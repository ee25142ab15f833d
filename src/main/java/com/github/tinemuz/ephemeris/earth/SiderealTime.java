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

import com.github.tinemuz.ephemeris.angle.Degrees;
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Sidereal time at Greenwich and at the observer (Meeus, chapter 12). Results
 * are angles in [0, 360); use {@link Degrees#toHms()} for hours.
 *
 * <p>Longitudes are positive west of Greenwich, as in Meeus.</p>
 */
public final class SiderealTime {

    private SiderealTime() {}

    /** Mean sidereal time at Greenwich for any instant of UT. */
    public static Degrees mean(double jd) {
        double days = jd - JulianDay.J2000;
        double t = days / JulianDay.DAYS_PER_JULIAN_CENTURY;
        return new Degrees(280.46061836 + 360.98564736629 * days
                + t * t * (0.000387933 - t / 38710000.0)).mapTo0To360();
    }

    /** Mean sidereal time corrected by the equation of the equinoxes. */
    public static Degrees apparent(double jd) {
        Degrees nutation = Nutation.inLongitude(jd).toDegrees();
        double correction = nutation.value() * Ecliptic.trueObliquity(jd).cos();
        return new Degrees(mean(jd).value() + correction).mapTo0To360();
    }

    public static Degrees local(Degrees greenwich, Degrees longitudeWest) {
        return greenwich.minus(longitudeWest).mapTo0To360();
    }

    /** Local hour angle H = local sidereal time - right ascension, in [0, 360). */
    public static Degrees hourAngle(Degrees localSiderealTime, Degrees rightAscension) {
        return localSiderealTime.minus(rightAscension).mapTo0To360();
    }
}
