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
package com.github.tinemuz.ephemeris.moon;

import com.github.tinemuz.ephemeris.angle.Degrees;
import com.github.tinemuz.ephemeris.angle.Radians;
import com.github.tinemuz.ephemeris.earth.Earth;

/** The Moon's parallax and apparent size (Meeus, chapters 40 and 55). */
public final class MoonParallax {
    /** Ratio of the Moon's radius to the Earth's equatorial radius. */
    private static final double K = 0.272481;

    private MoonParallax() {}

    /**
     * Equatorial horizontal parallax pi, as {@code sin pi = R_earth / distance}.
     * The value returned is sin pi, which equals pi in radians to 1e-7.
     */
    public static Radians equatorialHorizontalParallax(double jd) {
        return new Radians(Earth.EQUATORIAL_RADIUS_KM / MoonPosition.distanceKm(jd));
    }

    /** Parallax in altitude for a body seen at {@code altitude}. */
    public static Degrees horizontalParallax(double jd, Degrees altitude) {
        double sinPi = equatorialHorizontalParallax(jd).value();
        return Degrees.fromRadians(Math.asin(sinPi * altitude.cos()));
    }

    /** Semidiameter as seen from the centre of the Earth. */
    public static Radians geocentricSemidiameter(double jd) {
        return new Radians(Math.asin(K * equatorialHorizontalParallax(jd).value()));
    }

    /**
     * Semidiameter as seen by an observer, larger than the geocentric one when
     * the Moon is high in the sky (Meeus 40.7).
     *
     * @param hourAngle    geocentric hour angle of the Moon
     * @param declination  geocentric declination of the Moon
     * @param latitude     observer's latitude
     * @param heightMeters observer's height above sea level
     */
    public static Degrees topocentricSemidiameter(double jd, Degrees hourAngle, Degrees declination,
            Degrees latitude, double heightMeters) {
        Earth.ObserverTerms observer = Earth.observerTerms(latitude, heightMeters);
        double sinPi = equatorialHorizontalParallax(jd).value();
        double a = declination.cos() * hourAngle.sin();
        double b = declination.cos() * hourAngle.cos() - observer.rhoCosPhiPrime() * sinPi;
        double c = declination.sin() - observer.rhoSinPhiPrime() * sinPi;
        double q = Math.sqrt(a * a + b * b + c * c);
        return Degrees.fromRadians(Math.asin(geocentricSemidiameter(jd).sin() / q));
    }
}
