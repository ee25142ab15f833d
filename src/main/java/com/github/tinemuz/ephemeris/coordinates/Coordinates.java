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
package com.github.tinemuz.ephemeris.coordinates;

import com.github.tinemuz.ephemeris.angle.ArcSec;
import com.github.tinemuz.ephemeris.angle.Degrees;
import com.github.tinemuz.ephemeris.earth.Earth;
import com.github.tinemuz.ephemeris.earth.SiderealTime;

/**
 * Transformations between ecliptic, equatorial, horizontal and topocentric
 * coordinates (Meeus, chapters 13 and 40).
 *
 * <p>Observer longitudes are positive west of Greenwich.</p>
 */
public final class Coordinates {
    // Solar equatorial horizontal parallax at 1 AU
    private static final double SIN_SOLAR_PARALLAX = Math.sin(new ArcSec(8.794).toDegrees().toRadians().value());

    private Coordinates() {}

    /** Rotate ecliptic longitude/latitude by the obliquity {@code epsilon}. */
    public static Equatorial eclipticToEquatorial(Degrees longitude, Degrees latitude, Degrees epsilon) {
        double sinEps = epsilon.sin();
        double cosEps = epsilon.cos();
        double ra = Math.atan2(longitude.sin() * cosEps - latitude.tan() * sinEps, longitude.cos());
        double dec = Math.asin(clamp(latitude.sin() * cosEps + latitude.cos() * sinEps * longitude.sin()));
        return new Equatorial(Degrees.fromRadians(ra).mapTo0To360(), Degrees.fromRadians(dec));
    }

    /**
     * Azimuth and altitude from declination, local hour angle and the
     * observer's latitude. Azimuth is measured from North, so an object east of
     * the meridian ({@code sin H < 0}) has an azimuth below 180°.
     */
    public static Horizontal equatorialToHorizontal(Degrees declination, Degrees hourAngle, Degrees latitude) {
        double sinPhi = latitude.sin();
        double cosPhi = latitude.cos();
        double sinAlt = clamp(sinPhi * declination.sin() + cosPhi * declination.cos() * hourAngle.cos());
        double alt = Math.asin(sinAlt);
        double cosAz = (declination.sin() - sinPhi * sinAlt) / (cosPhi * Math.cos(alt));
        double az = Math.acos(clamp(cosAz));
        if (hourAngle.sin() > 0.0) az = 2.0 * Math.PI - az;
        return new Horizontal(Degrees.fromRadians(az).mapTo0To360(), Degrees.fromRadians(alt));
    }

    /**
     * Sine of the equatorial horizontal parallax of a body at {@code distanceKm}
     * from the centre of the Earth.
     */
    public static double sinParallax(double distanceKm) {
        return SIN_SOLAR_PARALLAX / (distanceKm / Earth.ASTRONOMICAL_UNIT_KM);
    }

    /**
     * Topocentric right ascension and declination of a body at
     * {@code distanceKm}, seen from the given observer at {@code jd} (UT).
     */
    public static Equatorial equatorialToTopocentric(Degrees rightAscension, Degrees declination,
            Degrees longitudeWest, Degrees latitude, double heightMeters, double distanceKm, double jd) {
        Degrees lst = SiderealTime.local(SiderealTime.apparent(jd), longitudeWest);
        Degrees hourAngle = SiderealTime.hourAngle(lst, rightAscension);
        return equatorialToTopocentric(rightAscension, declination, hourAngle,
                Earth.observerTerms(latitude, heightMeters), sinParallax(distanceKm));
    }

    /** Topocentric place from a known hour angle and parallax (Meeus 40.2, 40.3). */
    public static Equatorial equatorialToTopocentric(Degrees rightAscension, Degrees declination,
            Degrees hourAngle, Earth.ObserverTerms observer, double sinParallax) {
        double rhoCos = observer.rhoCosPhiPrime();
        double rhoSin = observer.rhoSinPhiPrime();
        double cosDec = declination.cos();
        double denominator = cosDec - rhoCos * sinParallax * hourAngle.cos();
        double deltaRa = Math.atan2(-rhoCos * sinParallax * hourAngle.sin(), denominator);
        double dec = Math.atan2((declination.sin() - rhoSin * sinParallax) * Math.cos(deltaRa), denominator);
        return new Equatorial(
                rightAscension.plus(Degrees.fromRadians(deltaRa)).mapTo0To360(),
                Degrees.fromRadians(dec));
    }

    // asin/acos arguments drift just past +-1 near the poles and the zenith
    private static double clamp(double x) {
        return Math.max(-1.0, Math.min(1.0, x));
    }
}
