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
package com.github.tinemuz.ephemeris.angle;

import java.util.Locale;

/**
 * An angle in decimal degrees.
 *
 * <p>Longitudes and right ascensions are normally kept in [0, 360), latitudes and
 * declinations in [-90, 90] and hour angles in [-180, 180). Instances are never
 * normalized implicitly; call one of the {@code map...} methods where a range is
 * required.</p>
 */
public record Degrees(double value) {
    private static final double MINUTES_PER_DEGREE = 60.0;
    private static final double DEGREES_PER_HOUR = 360.0 / 24.0;

    public static final Degrees ZERO = new Degrees(0.0);

    /**
     * Build an angle from degrees, arc minutes and arc seconds. The sign of the
     * result is taken from {@code degrees}; minutes and seconds are magnitudes.
     */
    public static Degrees fromDms(double degrees, double minutes, double seconds) {
        double sign = degrees < 0.0 ? -1.0 : 1.0;
        double magnitude = sign * degrees + (minutes + seconds / MINUTES_PER_DEGREE) / MINUTES_PER_DEGREE;
        return new Degrees(sign * magnitude);
    }

    /** Build an angle from hours, minutes and seconds of time (1h = 15°). */
    public static Degrees fromHms(double hours, double minutes, double seconds) {
        return new Degrees(DEGREES_PER_HOUR * (hours + (minutes + seconds / 60.0) / 60.0));
    }

    public static Degrees fromRadians(double radians) {
        return new Degrees(radians / Radians.RADIANS_PER_DEGREE);
    }

    public Radians toRadians() {
        return new Radians(value * Radians.RADIANS_PER_DEGREE);
    }

    public ArcSec toArcSec() {
        return new ArcSec(value * ArcSec.ARCSEC_PER_DEGREE);
    }

    /** Fractional hours of right ascension or hour angle. */
    public double toHours() {
        return value / DEGREES_PER_HOUR;
    }

    public double sin() {
        return Math.sin(value * Radians.RADIANS_PER_DEGREE);
    }

    public double cos() {
        return Math.cos(value * Radians.RADIANS_PER_DEGREE);
    }

    public double tan() {
        return Math.tan(value * Radians.RADIANS_PER_DEGREE);
    }

    public Degrees plus(Degrees other) {
        return new Degrees(value + other.value);
    }

    public Degrees minus(Degrees other) {
        return new Degrees(value - other.value);
    }

    public Degrees times(double factor) {
        return new Degrees(value * factor);
    }

    /** Map to [0, 360). */
    public Degrees mapTo0To360() {
        double m = value % 360.0;
        if (m < 0.0) m += 360.0;
        // -1e-17 % 360 + 360 rounds to 360.0
        if (m >= 360.0) m = 0.0;
        return new Degrees(m);
    }

    /** Map to [-180, 180). */
    public Degrees mapNeg180To180() {
        double m = mapTo0To360().value;
        if (m >= 180.0) m -= 360.0;
        return new Degrees(m);
    }

    /**
     * Map to the closed range [-90, 90]. Both poles are kept, so 90° stays 90°.
     * Angles past a pole are folded back, so 100° becomes 80° and -100° becomes
     * -80°.
     */
    public Degrees mapToNeg90To90() {
        double m = mapNeg180To180().value;
        if (m > 90.0) m = 180.0 - m;
        else if (m < -90.0) m = -180.0 - m;
        return new Degrees(m);
    }

    /** Split into sign, whole degrees, arc minutes and arc seconds. */
    public Sexagesimal toDms() {
        return Sexagesimal.of(value);
    }

    /** Split into sign, hours, minutes and seconds of time. */
    public Sexagesimal toHms() {
        return Sexagesimal.of(toHours());
    }

    /** Format as {@code 13° 46' 10.77"} with {@code width} decimals on the seconds. */
    public String toDmsString(int width) {
        Sexagesimal dms = toDms();
        return String.format(
                Locale.ROOT, "%s%d° %d' %." + width + "f\"",
                dms.sign() < 0 ? "-" : "", dms.whole(), dms.minutes(), dms.seconds());
    }

    /** Format as {@code 8h 58m 44.14s} with {@code width} decimals on the seconds. */
    public String toHmsString(int width) {
        Sexagesimal hms = toHms();
        return String.format(
                Locale.ROOT, "%s%dh %dm %." + width + "fs",
                hms.sign() < 0 ? "-" : "", hms.whole(), hms.minutes(), hms.seconds());
    }
}
