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
import com.github.tinemuz.ephemeris.coordinates.Coordinates;
import com.github.tinemuz.ephemeris.coordinates.Equatorial;
import com.github.tinemuz.ephemeris.earth.Earth;
import com.github.tinemuz.ephemeris.earth.Ecliptic;
import com.github.tinemuz.ephemeris.sun.SunPosition;

/**
 * Illuminated fraction and phase of the Moon (Meeus, chapter 48). All methods
 * take a Julian Day in dynamical time (TT).
 */
public final class MoonPhase {
    /** Mean synodic month in days. */
    public static final double SYNODIC_MONTH_DAYS = 29.530588853;
    private static final double DEGREES_PER_DAY = 360.0 / SYNODIC_MONTH_DAYS;

    private MoonPhase() {}

    /**
     * Phase angle i, the Sun-Moon-Earth angle, from the geocentric elongation
     * of the Moon (Meeus 48.2 and 48.3). 0 at full Moon, 180 at new Moon.
     */
    public static Degrees phaseAngle(double jd) {
        Degrees epsilon = Ecliptic.trueObliquity(jd);
        Equatorial moon = Coordinates.eclipticToEquatorial(
                MoonPosition.geocentricLongitude(jd), MoonPosition.geocentricLatitude(jd), epsilon);
        Equatorial sun = Coordinates.eclipticToEquatorial(
                SunPosition.apparentLongitude(jd), SunPosition.apparentLatitude(jd), epsilon);
        double sunDistanceKm = SunPosition.radiusVector(jd) * Earth.ASTRONOMICAL_UNIT_KM;
        double moonDistanceKm = MoonPosition.distanceKm(jd);

        double cosPsi = sun.declination().sin() * moon.declination().sin()
                + sun.declination().cos() * moon.declination().cos()
                        * sun.rightAscension().minus(moon.rightAscension()).cos();
        double psi = Math.acos(Math.max(-1.0, Math.min(1.0, cosPsi)));
        double i = Math.atan2(sunDistanceKm * Math.sin(psi), moonDistanceKm - sunDistanceKm * Math.cos(psi));
        return Degrees.fromRadians(i).mapTo0To360();
    }

    /**
     * Elongation of the Moon east of the Sun in ecliptic longitude, in [0, 360).
     * Grows through the lunation: 0 new, 90 first quarter, 180 full, 270 last quarter.
     */
    public static Degrees phaseAngle360(double jd) {
        return MoonPosition.geocentricLongitude(jd).minus(SunPosition.apparentLongitude(jd)).mapTo0To360();
    }

    /** Approximate age of the Moon in days since new Moon. */
    public static double phaseAge(double jd) {
        return phaseAngle360(jd).value() / DEGREES_PER_DAY;
    }

    /** Fraction of the disk that is illuminated, 0 to 1 (Meeus 48.1). */
    public static double illuminatedFraction(double jd) {
        return (1.0 + phaseAngle(jd).cos()) / 2.0;
    }

    public static PhaseDescription description(double jd) {
        return PhaseDescription.forElongation(phaseAngle360(jd).value());
    }
}
