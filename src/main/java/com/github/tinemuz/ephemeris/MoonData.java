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

/**
 * Snapshot of the Moon for one observer and instant, returned by
 * {@link Ephemeris#moon}. Angles are in degrees.
 */
public final class MoonData {
    /** Elongation from the Sun in ecliptic longitude, [0, 360); 180 at full Moon. */
    public final double phaseAngle;

    /** Illuminated fraction of the disk, 0 to 1. */
    public final double illuminatedFraction;

    /** One of "New Moon", "Waxing Crescent", ..., "Waning Crescent". */
    public final String phaseDescription;

    /** Days since new Moon, from the elongation. */
    public final double ageDays;

    /** Apparent geocentric ecliptic longitude. */
    public final double geocentricLongitude;

    /** Geocentric ecliptic latitude. */
    public final double geocentricLatitude;

    /** Centre-to-centre distance from the Earth in km. */
    public final double distanceKm;

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

    MoonData(double phaseAngle, double illuminatedFraction, String phaseDescription, double ageDays,
            double geocentricLongitude, double geocentricLatitude, double distanceKm,
            double rightAscension, double declination, double hourAngle, double azimuth, double altitude) {
        this.phaseAngle = phaseAngle;
        this.illuminatedFraction = illuminatedFraction;
        this.phaseDescription = phaseDescription;
        this.ageDays = ageDays;
        this.geocentricLongitude = geocentricLongitude;
        this.geocentricLatitude = geocentricLatitude;
        this.distanceKm = distanceKm;
        this.rightAscension = rightAscension;
        this.declination = declination;
        this.hourAngle = hourAngle;
        this.azimuth = azimuth;
        this.altitude = altitude;
    }
}
