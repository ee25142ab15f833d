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
 * A date in the Julian or Gregorian calendar with a fractional day.
 *
 * <p>Dates up to and including 1582-10-04 are Julian calendar dates, later ones
 * are Gregorian. Years are astronomical: 1 BC is year 0, 2 BC is year -1.</p>
 *
 * @param year  astronomical year
 * @param month month, 1 to 12
 * @param day   day of month including the fraction of the day, e.g. 4.81
 */
public record CalendarDate(int year, int month, double day) {

    public CalendarDate {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be in 1..12, was " + month);
        }
        if (!Double.isFinite(day)) {
            throw new IllegalArgumentException("day must be finite, was " + day);
        }
    }

    /** Date with the time of day folded into the fractional day. */
    public static CalendarDate fromDateHms(int year, int month, int day, int hours, int minutes, double seconds) {
        double fraction = (hours + (minutes + seconds / 60.0) / 60.0) / 24.0;
        return new CalendarDate(year, month, day + fraction);
    }

    /** Hours, minutes and seconds of the fractional part of {@code day}. */
    public static TimeOfDay fromFractionalDay(double day) {
        double hours = 24.0 * (day - Math.floor(day));
        double h = Math.floor(hours);
        double minutes = (hours - h) * 60.0;
        double m = Math.floor(minutes);
        return new TimeOfDay((int) h, (int) m, (minutes - m) * 60.0);
    }

    public TimeOfDay timeOfDay() {
        return fromFractionalDay(day);
    }

    public int dayOfMonth() {
        return (int) Math.floor(day);
    }

    public boolean isJulianCalendar() {
        return year < 1582 || (year == 1582 && (month < 10 || (month == 10 && day < 5.0)));
    }

    /**
     * Leap year rule: every fourth year in the Julian calendar; in the Gregorian
     * calendar century years only when divisible by 400.
     */
    public static boolean isLeapYear(int year) {
        if (new CalendarDate(year, 1, 1.0).isJulianCalendar()) {
            return year % 4 == 0;
        }
        return year % 100 == 0 ? year % 400 == 0 : year % 4 == 0;
    }

    /** Year plus the elapsed fraction of it, e.g. 2003.6548 for 2003-08-28. */
    public double fractionalYear() {
        double daysInYear = isLeapYear(year) ? 366.0 : 365.0;
        double start = JulianDay.fromDate(new CalendarDate(year, 1, 1.0));
        return year + (JulianDay.fromDate(this) - start) / daysInYear;
    }
}
