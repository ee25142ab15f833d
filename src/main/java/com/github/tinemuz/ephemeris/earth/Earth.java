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

/** Figure and orbit of the Earth. */
public final class Earth {
    /** Equatorial radius used by Meeus for the Moon's parallax, in km. */
    public static final double EQUATORIAL_RADIUS_KM = 6378.14;
    public static final double ASTRONOMICAL_UNIT_KM = 149597870.700;
    /** Length of a sidereal day in solar days. */
    public static final double SIDEREAL_TO_SOLAR = 23.9344696 / 24.0;
    // b/a of the reference ellipsoid
    private static final double POLAR_TO_EQUATORIAL = 0.99664719;
    private static final double EQUATORIAL_RADIUS_M = 6378140.0;

    private Earth() {}

    /** Eccentricity of the Earth's orbit (Meeus 47.6). */
    public static double eccentricity(double jd) {
        double t = JulianDay.centuriesFromJ2000(jd);
        return 1.0 - t * (0.002516 + 0.0000074 * t);
    }

    /**
     * Observer's geocentric position on the ellipsoid (Meeus, chapter 11).
     *
     * @param latitude     geographic latitude
     * @param heightMeters height above sea level
     */
    public static ObserverTerms observerTerms(Degrees latitude, double heightMeters) {
        double u = Math.atan(POLAR_TO_EQUATORIAL * latitude.tan());
        double h = heightMeters / EQUATORIAL_RADIUS_M;
        return new ObserverTerms(
                POLAR_TO_EQUATORIAL * Math.sin(u) + h * latitude.sin(),
                Math.cos(u) + h * latitude.cos());
    }

    /** The pair rho sin phi', rho cos phi' in units of the equatorial radius. */
    public record ObserverTerms(double rhoSinPhiPrime, double rhoCosPhiPrime) {}
}
