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

/** Snapshot of the Sun for one observer and instant. Angles are in degrees. */
public final class SunData {
    /** Apparent geocentric ecliptic longitude, [0, 360). */
    public final double apparentLongitude;

    /** Apparent geocentric ecliptic latitude. */
    public final double apparentLatitude;

    /** Earth-Sun distance in astronomical units. */
    public final double distanceAu;

    /** Topocentric right ascension, [0, 360). */
    public final double rightAscension;

    /** Topocentric declination. */
    public final double declination;

    /** Topocentric local hour angle, [0, 360). */
    public final double hourAngle;

    /** Azimuth from North through East, [0, 360). */
    public final double azimuth;

    /** Topocentric altitude including refraction. */
    public final double altitude;

    SunData(double apparentLongitude, double apparentLatitude, double distanceAu, double rightAscension,
            double declination, double hourAngle, double azimuth, double altitude) {
        this.apparentLongitude = apparentLongitude;
        this.apparentLatitude = apparentLatitude;
        this.distanceAu = distanceAu;
        this.rightAscension = rightAscension;
        this.declination = declination;
        this.hourAngle = hourAngle;
        this.azimuth = azimuth;
        this.altitude = altitude;
    }
}
