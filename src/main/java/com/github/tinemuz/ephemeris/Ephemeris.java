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

import com.github.tinemuz.ephemeris.angle.Degrees;
import com.github.tinemuz.ephemeris.coordinates.Coordinates;
import com.github.tinemuz.ephemeris.coordinates.Equatorial;
import com.github.tinemuz.ephemeris.coordinates.Horizontal;
import com.github.tinemuz.ephemeris.coordinates.Refraction;
import com.github.tinemuz.ephemeris.earth.Earth;
import com.github.tinemuz.ephemeris.earth.Nutation;
import com.github.tinemuz.ephemeris.earth.SiderealTime;
import com.github.tinemuz.ephemeris.moon.MoonPhase;
import com.github.tinemuz.ephemeris.moon.MoonPosition;
import com.github.tinemuz.ephemeris.moon.RiseSetTransit;
import com.github.tinemuz.ephemeris.sun.SunPosition;
import com.github.tinemuz.ephemeris.time.CalendarDate;
import com.github.tinemuz.ephemeris.time.JulianDay;
import com.github.tinemuz.ephemeris.time.TimeScales;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sun and Moon ephemeris for an observer on the Earth.
 *
 * <p>This is the entry point most callers need. It takes UTC Julian Days,
 * converts them to dynamical time for the position series and to UT1 for the
 * Earth's rotation, and returns small immutable results with plain
 * {@code double} fields. Longitudes are positive west of Greenwich, following
 * Meeus.</p>
 *
 * <p>Data tables are read from the classpath on first use. Call
 * {@link #preload()} once at startup to surface a broken classpath early.</p>
 */
public final class Ephemeris {
    private static final Logger log = LoggerFactory.getLogger(Ephemeris.class);

    private Ephemeris() {}

    /** Load every data table. */
    public static void preload() {
        TimeScales.preload();
        Nutation.preload();
        SunPosition.preload();
        MoonPosition.preload();
        log.debug("Ephemeris tables loaded");
    }

    /** Julian Day of a calendar date with fractional day. */
    public static double julianDay(int year, int month, double day) {
        return JulianDay.fromDate(year, month, day);
    }

    /** Apparent local sidereal time in degrees, [0, 360). */
    public static double localSiderealTime(double jd, double longitudeWest) {
        requireFinite(jd, "jd");
        return SiderealTime.local(SiderealTime.apparent(jd), new Degrees(longitudeWest)).value();
    }

    /** Position, phase and topocentric place of the Moon at the UTC instant {@code jdUtc}. */
    public static MoonData moon(double jdUtc, Observer observer) {
        requireFinite(jdUtc, "jdUtc");
        double tt = TimeScales.utcToTt(jdUtc);
        double ut1 = universalTime(jdUtc);
        log.debug("Moon data for JD {} (TT {})", jdUtc, tt);

        Degrees longitude = MoonPosition.geocentricLongitude(tt);
        Degrees latitude = MoonPosition.geocentricLatitude(tt);
        double distanceKm = MoonPosition.distanceKm(tt);
        Equatorial geocentric = MoonPosition.equatorial(tt);
        Topocentric topo = topocentric(geocentric, distanceKm, ut1, observer);
        Degrees elongation = MoonPhase.phaseAngle360(tt);

        return new MoonData(
                elongation.value(),
                MoonPhase.illuminatedFraction(tt),
                MoonPhase.description(tt).label(),
                MoonPhase.phaseAge(tt),
                longitude.mapTo0To360().value(),
                latitude.value(),
                distanceKm,
                topo.place.rightAscension().value(),
                topo.place.declination().value(),
                topo.hourAngle.value(),
                topo.horizontal.azimuth().value(),
                topo.horizontal.altitude().value());
    }

    /** Apparent and topocentric place of the Sun at the UTC instant {@code jdUtc}. */
    public static SunData sun(double jdUtc, Observer observer) {
        requireFinite(jdUtc, "jdUtc");
        double tt = TimeScales.utcToTt(jdUtc);
        double ut1 = universalTime(jdUtc);
        log.debug("Sun data for JD {} (TT {})", jdUtc, tt);

        double distanceAu = SunPosition.radiusVector(tt);
        Equatorial geocentric = SunPosition.equatorial(tt);
        Topocentric topo = topocentric(geocentric, distanceAu * Earth.ASTRONOMICAL_UNIT_KM, ut1, observer);
        return new SunData(
                SunPosition.apparentLongitude(tt).value(),
                SunPosition.apparentLatitude(tt).value(),
                distanceAu,
                topo.place.rightAscension().value(),
                topo.place.declination().value(),
                topo.hourAngle.value(),
                topo.horizontal.azimuth().value(),
                topo.horizontal.altitude().value());
    }

    /** Moonrise on the observer's local day containing {@code jdUtc}. */
    public static EventTime moonRise(double jdUtc, Observer observer) {
        return moonEvent(RiseSetTransit.Event.RISE, jdUtc, observer);
    }

    /** Moonset on the observer's local day containing {@code jdUtc}. */
    public static EventTime moonSet(double jdUtc, Observer observer) {
        return moonEvent(RiseSetTransit.Event.SET, jdUtc, observer);
    }

    /** Upper transit of the Moon nearest the observer's local noon. */
    public static EventTime moonTransit(double jdUtc, Observer observer) {
        return moonEvent(RiseSetTransit.Event.TRANSIT, jdUtc, observer);
    }

    /** Degrees formatted as {@code 13° 46' 10.77"}. */
    public static String toDms(double degrees, int width) {
        return new Degrees(degrees).toDmsString(width);
    }

    /** Degrees formatted as hours, {@code 8h 58m 44.14s}. */
    public static String toHms(double degrees, int width) {
        return new Degrees(degrees).toHmsString(width);
    }

    private static EventTime moonEvent(RiseSetTransit.Event event, double jdUtc, Observer observer) {
        requireFinite(jdUtc, "jdUtc");
        double noonUtc = localNoon(jdUtc, observer.timezoneOffsetHours());
        double tt = TimeScales.utcToTt(noonUtc);
        double ttMinusUtc = tt - noonUtc;
        log.debug("Calculating Moon {} from local noon JD {} (TT {}), timezone offset {} h",
                event, noonUtc, tt, observer.timezoneOffsetHours());

        Degrees target = RiseSetTransit.targetAltitude(tt, Degrees.ZERO, observer.longitudeWest(),
                observer.latitude(), observer.pressureMbar(), observer.temperatureC());
        RiseSetTransit.Result result = RiseSetTransit.solve(event, tt, observer.timezoneOffsetHours(),
                target, observer.longitudeWest(), observer.latitude());
        if (!result.hasTime()) {
            log.debug("Moon {}: {}", event, result.kind);
            return EventTime.none(result.kind);
        }
        EventTime time = EventTime.at(result.julianDay - ttMinusUtc);
        log.debug("Moon {} at {}", event, time);
        return time;
    }

    // Local noon, as a UTC Julian Day, of the local day containing jdUtc
    static double localNoon(double jdUtc, double timezoneOffsetHours) {
        double offsetDays = timezoneOffsetHours / 24.0;
        CalendarDate local = JulianDay.toCalendarDate(jdUtc + offsetDays);
        return JulianDay.fromDate(local.year(), local.month(), local.dayOfMonth() + 0.5) - offsetDays;
    }

    private static double universalTime(double jdUtc) {
        return TimeScales.isUtcCovered(jdUtc) ? TimeScales.utcToUt1(jdUtc) : jdUtc;
    }

    private static Topocentric topocentric(Equatorial geocentric, double distanceKm, double ut1, Observer observer) {
        Equatorial place = Coordinates.equatorialToTopocentric(geocentric.rightAscension(),
                geocentric.declination(), observer.longitudeWest(), observer.latitude(),
                observer.heightMeters(), distanceKm, ut1);
        Degrees lst = SiderealTime.local(SiderealTime.apparent(ut1), observer.longitudeWest());
        Degrees hourAngle = SiderealTime.hourAngle(lst, place.rightAscension());
        Horizontal horizontal = Coordinates.equatorialToHorizontal(place.declination(), hourAngle, observer.latitude());
        Degrees refracted = Refraction.apparentAltitude(
                horizontal.altitude(), observer.pressureMbar(), observer.temperatureC());
        return new Topocentric(place, hourAngle, horizontal.withAltitude(refracted));
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite, was " + value);
        }
    }

    // Holder for the observer-dependent part of a result
    private record Topocentric(Equatorial place, Degrees hourAngle, Horizontal horizontal) {}
}
