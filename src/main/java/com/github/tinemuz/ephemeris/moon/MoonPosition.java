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
import com.github.tinemuz.ephemeris.earth.Nutation;
import com.github.tinemuz.ephemeris.sun.SunPosition;
import com.github.tinemuz.ephemeris.table.TableResource;
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Geocentric position of the Moon (Meeus, chapter 47), accurate to about 10"
 * in longitude and 4" in latitude. All methods take a Julian Day in dynamical
 * time (TT).
 *
 * <p>The periodic terms come from <code>moon_lr.txt</code> (table 47.A: D, M, M',
 * F multipliers, then the longitude and distance coefficients) and
 * <code>moon_b.txt</code> (table 47.B: multipliers, then the latitude
 * coefficient).</p>
 */
public final class MoonPosition {
    private static final TableResource LONGITUDE_DISTANCE_TERMS = new TableResource("moon_lr.txt", 6);
    private static final TableResource LATITUDE_TERMS = new TableResource("moon_b.txt", 5);
    private static final double MEAN_DISTANCE_KM = 385000.56;

    private MoonPosition() {}

    /** Mean longitude L', referred to the mean equinox of date. */
    public static Degrees meanLongitude(double jd) {
        double t = JulianDay.centuriesFromJ2000(jd);
        return new Degrees(218.3164477 + 481267.88123421 * t - 0.0015786 * t * t
                + t * t * t / 538841.0 - t * t * t * t / 65194000.0).mapTo0To360();
    }

    /** Mean elongation D. */
    public static Degrees meanElongation(double jd) {
        double t = JulianDay.centuriesFromJ2000(jd);
        return new Degrees(297.8501921 + 445267.1114034 * t - 0.0018819 * t * t
                + t * t * t / 545868.0 - t * t * t * t / 113065000.0).mapTo0To360();
    }

    /** Mean anomaly M'. */
    public static Degrees meanAnomaly(double jd) {
        double t = JulianDay.centuriesFromJ2000(jd);
        return new Degrees(134.9633964 + 477198.8675055 * t + 0.0087414 * t * t
                + t * t * t / 69699.0 - t * t * t * t / 14712000.0).mapTo0To360();
    }

    /** Argument of latitude F, the mean distance from the ascending node. */
    public static Degrees argumentOfLatitude(double jd) {
        double t = JulianDay.centuriesFromJ2000(jd);
        return new Degrees(93.2720950 + 483202.0175233 * t - 0.0036539 * t * t
                - t * t * t / 3526000.0 + t * t * t * t / 863310000.0).mapTo0To360();
    }

    /** Apparent geocentric longitude, including nutation. Not normalized. */
    public static Degrees geocentricLongitude(double jd) {
        Arguments a = Arguments.at(jd);
        double t = JulianDay.centuriesFromJ2000(jd);
        double sum = 0.0;
        for (double[] row : LONGITUDE_DISTANCE_TERMS.rows()) {
            sum += row[4] * a.eccentricityFactor(row) * Math.sin(a.argument(row));
        }
        double a1 = new Degrees(119.75 + 131.849 * t).mapTo0To360().toRadians().value();
        double a2 = new Degrees(53.09 + 479264.290 * t).mapTo0To360().toRadians().value();
        sum += 3958.0 * Math.sin(a1) + 1962.0 * Math.sin(a.lPrime - a.f) + 318.0 * Math.sin(a2);
        return meanLongitude(jd)
                .plus(new Degrees(sum / 1e6))
                .plus(Nutation.inLongitude(jd).toDegrees());
    }

    /** Geocentric latitude. */
    public static Degrees geocentricLatitude(double jd) {
        Arguments a = Arguments.at(jd);
        double t = JulianDay.centuriesFromJ2000(jd);
        double sum = 0.0;
        for (double[] row : LATITUDE_TERMS.rows()) {
            sum += row[4] * a.eccentricityFactor(row) * Math.sin(a.argument(row));
        }
        double a1 = new Degrees(119.75 + 131.849 * t).mapTo0To360().toRadians().value();
        double a3 = new Degrees(313.45 + 481266.484 * t).mapTo0To360().toRadians().value();
        sum += -2235.0 * Math.sin(a.lPrime)
                + 382.0 * Math.sin(a3)
                + 175.0 * Math.sin(a1 - a.f)
                + 175.0 * Math.sin(a1 + a.f)
                + 127.0 * Math.sin(a.lPrime - a.mPrime)
                - 115.0 * Math.sin(a.lPrime + a.mPrime);
        return new Degrees(sum / 1e6);
    }

    /** Distance between the centres of the Earth and the Moon, in km. */
    public static double distanceKm(double jd) {
        Arguments a = Arguments.at(jd);
        double sum = 0.0;
        for (double[] row : LONGITUDE_DISTANCE_TERMS.rows()) {
            sum += row[5] * a.eccentricityFactor(row) * Math.cos(a.argument(row));
        }
        return MEAN_DISTANCE_KM + sum / 1000.0;
    }

    /** Apparent geocentric right ascension and declination, using the true obliquity. */
    public static Equatorial equatorial(double jd) {
        return Coordinates.eclipticToEquatorial(
                geocentricLongitude(jd), geocentricLatitude(jd), Ecliptic.trueObliquity(jd));
    }

    /** Load the term tables. */
    public static void preload() {
        LONGITUDE_DISTANCE_TERMS.rows();
        LATITUDE_TERMS.rows();
    }

    // Fundamental arguments in radians and the Earth's eccentricity
    private record Arguments(double lPrime, double d, double m, double mPrime, double f, double e) {

        static Arguments at(double jd) {
            return new Arguments(
                    meanLongitude(jd).toRadians().value(),
                    meanElongation(jd).toRadians().value(),
                    SunPosition.meanAnomaly(jd).toRadians().value(),
                    meanAnomaly(jd).toRadians().value(),
                    argumentOfLatitude(jd).toRadians().value(),
                    Earth.eccentricity(jd));
        }

        double argument(double[] row) {
            return row[0] * d + row[1] * m + row[2] * mPrime + row[3] * f;
        }

        // Terms containing M shrink with the Earth's orbital eccentricity: E for
        // +-M, E^2 for +-2M
        double eccentricityFactor(double[] row) {
            double multiplier = Math.abs(row[1]);
            if (multiplier == 0.0) return 1.0;
            return multiplier == 2.0 ? e * e : e;
        }
    }
}
