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

import com.github.tinemuz.ephemeris.moon.RiseSetTransit;
import com.github.tinemuz.ephemeris.time.CalendarDate;
import com.github.tinemuz.ephemeris.time.JulianDay;
import com.github.tinemuz.ephemeris.time.TimeOfDay;

import java.util.Locale;

/**
 * A rise, set or transit time in UTC. When {@link #valid} is false the event
 * does not happen on the requested day and only {@link #kind} is meaningful.
 */
public final class EventTime {
    public final boolean valid;
    public final RiseSetTransit.Kind kind;
    /** Event time as a UTC Julian Day, NaN when not valid. */
    public final double julianDay;
    public final int year;
    public final int month;
    public final int day;
    public final int hours;
    public final int minutes;
    public final double seconds;

    private EventTime(RiseSetTransit.Kind kind, double julianDay) {
        this.kind = kind;
        this.valid = kind == RiseSetTransit.Kind.TIME;
        this.julianDay = julianDay;
        if (valid) {
            CalendarDate date = JulianDay.toCalendarDate(julianDay);
            TimeOfDay time = date.timeOfDay();
            this.year = date.year();
            this.month = date.month();
            this.day = date.dayOfMonth();
            this.hours = time.hours();
            this.minutes = time.minutes();
            this.seconds = time.seconds();
        } else {
            this.year = 0;
            this.month = 0;
            this.day = 0;
            this.hours = 0;
            this.minutes = 0;
            this.seconds = 0.0;
        }
    }

    static EventTime at(double julianDayUtc) {
        return new EventTime(RiseSetTransit.Kind.TIME, julianDayUtc);
    }

    static EventTime none(RiseSetTransit.Kind kind) {
        return new EventTime(kind, Double.NaN);
    }

    @Override
    public String toString() {
        if (!valid) return kind.toString();
        return String.format(Locale.ROOT, "%d-%02d-%02d %02d:%02d:%05.2f UTC", year, month, day, hours, minutes, seconds);
    }
}
