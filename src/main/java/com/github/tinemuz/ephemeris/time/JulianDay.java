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
package com.github.tinemuz.ephemeris.time;

/**
 * Julian Day conversions (Meeus, chapter 7).
 *
 * <p>A Julian Day is a continuous count of days from -4712-01-01 12:00. The
 * conversions truncate at every intermediate step; that order matters and must
 * not be replaced by rounding.</p>
 */
public final class JulianDay {
    /** JD of the J2000.0 epoch, 2000-01-01 12:00 TT. */
    public static final double J2000 = 2451545.0;
    /** MJD = JD - MJD_OFFSET. */
    public static final double MJD_OFFSET = 2400000.5;
    public static final double DAYS_PER_JULIAN_CENTURY = 36525.0;
    public static final double DAYS_PER_JULIAN_MILLENNIUM = 365250.0;
    private static final double HOURS_PER_DAY = 24.0;
    // First day of the Gregorian calendar, 1582-10-15
    private static final double GREGORIAN_START_Z = 2299161.0;

    private JulianDay() {}

    public static double fromDate(int year, int month, double day) {
        return fromDate(new CalendarDate(year, month, day));
    }

    public static double fromDate(CalendarDate date) {
        double yy = date.year();
        double mm = date.month();
        if (mm < 3) {
            mm += 12;
            yy -= 1;
        }
        double b = 0.0;
        if (!date.isJulianCalendar()) {
            double a = trunc(yy / 100.0);
            b = 2.0 - a + trunc(a / 4.0);
        }
        return trunc(365.25 * (yy + 4716.0)) + trunc(30.6001 * (mm + 1.0)) + date.day() + b - 1524.5;
    }

    public static double fromDateHms(int year, int month, int day, int hours, int minutes, double seconds) {
        return fromDate(CalendarDate.fromDateHms(year, month, day, hours, minutes, seconds));
    }

    /** Inverse of {@link #fromDate}. Valid for non-negative Julian Days. */
    public static CalendarDate toCalendarDate(double jd) {
        double j = jd + 0.5;
        double z = trunc(j);
        double f = j - z;
        double a;
        if (z < GREGORIAN_START_Z) {
            a = z;
        } else {
            double alpha = trunc((z - 1867216.25) / 36524.25);
            a = z + 1.0 + alpha - trunc(alpha / 4.0);
        }
        double b = a + 1524.0;
        double c = trunc((b - 122.1) / 365.25);
        double d = trunc(365.25 * c);
        double e = trunc((b - d) / 30.6001);
        double day = b - d - trunc(30.6001 * e) + f;
        double month = e < 14.0 ? e - 1.0 : e - 13.0;
        double year = month > 2.0 ? c - 4716.0 : c - 4715.0;
        return new CalendarDate((int) year, (int) month, day);
    }

    public static double toMjd(double jd) {
        return jd - MJD_OFFSET;
    }

    public static double fromMjd(double mjd) {
        return mjd + MJD_OFFSET;
    }

    /** Julian centuries since J2000.0, the T of most of Meeus' series. */
    public static double centuriesFromJ2000(double jd) {
        return (jd - J2000) / DAYS_PER_JULIAN_CENTURY;
    }

    /** Julian millennia since J2000.0, the tau of the VSOP87 series. */
    public static double millenniaFromJ2000(double jd) {
        return (jd - J2000) / DAYS_PER_JULIAN_MILLENNIUM;
    }

    public static double addHours(double jd, double hours) {
        return jd + hours / HOURS_PER_DAY;
    }

    private static double trunc(double x) {
        return x < 0.0 ? Math.ceil(x) : Math.floor(x);
    }
}
