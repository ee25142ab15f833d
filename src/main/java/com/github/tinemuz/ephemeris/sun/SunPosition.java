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
package com.github.tinemuz.ephemeris.sun;

import com.github.tinemuz.ephemeris.angle.ArcSec;
import com.github.tinemuz.ephemeris.angle.Degrees;
import com.github.tinemuz.ephemeris.coordinates.Coordinates;
import com.github.tinemuz.ephemeris.coordinates.Equatorial;
import com.github.tinemuz.ephemeris.earth.Ecliptic;
import com.github.tinemuz.ephemeris.earth.Nutation;
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Apparent position of the Sun to about 1" (Meeus, chapter 25, "higher
 * accuracy"). All methods take a Julian Day in dynamical time (TT).
 */
public final class SunPosition {
    // Aberration constant times the Sun's daily motion scale, see Meeus 25.11
    private static final double ABERRATION_FACTOR = -0.005775518;

    // Daily variation of the geocentric longitude: amplitude ("), phase (deg),
    // frequency (deg per millennium), power of tau
    private static final double[][] LONGITUDE_VARIATION = {
        {118.568, 87.5287, 359993.7286, 0},
        {2.476, 85.0561, 719987.4571, 0},
        {1.376, 27.8502, 4452671.1152, 0},
        {0.119, 73.1375, 450368.8564, 0},
        {0.114, 337.2264, 329644.6718, 0},
        {0.086, 222.5400, 659289.3436, 0},
        {0.078, 162.8136, 9224659.7915, 0},
        {0.054, 82.5823, 1079981.1857, 0},
        {0.052, 171.5189, 225184.4282, 0},
        {0.034, 30.3214, 4092677.3866, 0},
        {0.033, 119.8105, 337181.4711, 0},
        {0.023, 247.5418, 299295.6151, 0},
        {0.023, 325.1526, 315559.5560, 0},
        {0.021, 155.1241, 675553.2846, 0},
        {7.311, 333.4515, 359993.7286, 1},
        {0.305, 330.9814, 719987.4571, 1},
        {0.010, 328.5170, 1079981.1857, 1},
        {0.309, 241.4518, 359993.7286, 2},
        {0.021, 205.0482, 719987.4571, 2},
        {0.004, 297.8610, 4452671.1152, 2},
        {0.010, 154.7066, 359993.7286, 3},
    };
    private static final double LONGITUDE_VARIATION_CONSTANT = 3548.193;

    private SunPosition() {}

    /** Heliocentric longitude of the Earth, VSOP87 dynamical frame. */
    public static Degrees heliocentricLongitude(double jd) {
        return Degrees.fromRadians(Vsop87.longitude(JulianDay.millenniaFromJ2000(jd))).mapTo0To360();
    }

    /** Heliocentric latitude of the Earth, VSOP87 dynamical frame. */
    public static Degrees heliocentricLatitude(double jd) {
        return Degrees.fromRadians(Vsop87.latitude(JulianDay.millenniaFromJ2000(jd))).mapToNeg90To90();
    }

    /** Earth-Sun distance in AU. */
    public static double radiusVector(double jd) {
        return Vsop87.radius(JulianDay.millenniaFromJ2000(jd));
    }

    /** Geometric geocentric longitude, VSOP87 frame. */
    public static Degrees geocentricLongitude(double jd) {
        return heliocentricLongitude(jd).plus(new Degrees(180.0)).mapTo0To360();
    }

    /** Geometric geocentric latitude, VSOP87 frame. */
    public static Degrees geocentricLatitude(double jd) {
        return new Degrees(-heliocentricLatitude(jd).value());
    }

    /** Convert a VSOP87 longitude/latitude pair to FK5 (Meeus 32.3). */
    public static FrameCorrection fk5Correction(double jd, Degrees longitude, Degrees latitude) {
        double t = JulianDay.centuriesFromJ2000(jd);
        Degrees lambdaPrime = new Degrees(longitude.value() - 1.397 * t - 0.00031 * t * t).mapTo0To360();
        double cosL = lambdaPrime.cos();
        double sinL = lambdaPrime.sin();
        ArcSec deltaLongitude = new ArcSec(-0.09033 + 0.03916 * (cosL + sinL) * latitude.tan());
        ArcSec deltaLatitude = new ArcSec(0.03916 * (cosL - sinL));
        return new FrameCorrection(deltaLongitude, deltaLatitude);
    }

    /** Daily variation of the Sun's geocentric longitude, in arc seconds. */
    static double longitudeVariation(double jd) {
        double tau = JulianDay.millenniaFromJ2000(jd);
        double sum = LONGITUDE_VARIATION_CONSTANT;
        for (double[] term : LONGITUDE_VARIATION) {
            sum += term[0] * Math.pow(tau, term[3]) * new Degrees(term[1] + term[2] * tau).sin();
        }
        return sum;
    }

    /** Aberration in longitude (Meeus 25.11). */
    public static Degrees aberration(double jd) {
        return new Degrees(ABERRATION_FACTOR * radiusVector(jd) * longitudeVariation(jd) / 3600.0);
    }

    /**
     * Apparent longitude: FK5 geometric longitude plus nutation and
     * aberration, in [0, 360).
     */
    public static Degrees apparentLongitude(double jd) {
        Degrees lon = geocentricLongitude(jd);
        FrameCorrection fk5 = fk5Correction(jd, lon, geocentricLatitude(jd));
        return lon.plus(fk5.longitude().toDegrees())
                .plus(Nutation.inLongitude(jd).toDegrees())
                .plus(aberration(jd))
                .mapTo0To360();
    }

    /** Apparent latitude: the FK5 geometric latitude. */
    public static Degrees apparentLatitude(double jd) {
        Degrees lon = geocentricLongitude(jd);
        Degrees lat = geocentricLatitude(jd);
        return lat.plus(fk5Correction(jd, lon, lat).latitude().toDegrees());
    }

    /** Mean anomaly of the Sun (Meeus 47.3). */
    public static Degrees meanAnomaly(double jd) {
        double t = JulianDay.centuriesFromJ2000(jd);
        return new Degrees(357.5291092 + 35999.0502909 * t - 0.0001536 * t * t + t * t * t / 24490000.0)
                .mapTo0To360();
    }

    /** Apparent geocentric right ascension and declination. */
    public static Equatorial equatorial(double jd) {
        return Coordinates.eclipticToEquatorial(
                apparentLongitude(jd), apparentLatitude(jd), Ecliptic.trueObliquity(jd));
    }

    /** Load the VSOP87 tables. */
    public static void preload() {
        Vsop87.preload();
    }

    /** Small corrections from the VSOP87 dynamical frame to FK5. */
    public record FrameCorrection(ArcSec longitude, ArcSec latitude) {}
}
