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
import com.github.tinemuz.ephemeris.coordinates.Equatorial;
import com.github.tinemuz.ephemeris.coordinates.Refraction;
import com.github.tinemuz.ephemeris.earth.Earth;
import com.github.tinemuz.ephemeris.earth.SiderealTime;
import com.github.tinemuz.ephemeris.time.CalendarDate;
import com.github.tinemuz.ephemeris.time.JulianDay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Times of moonrise, moonset and transit for one local day.
 *
 * <p>Each event is found by fixed-point iteration: starting from the given
 * Julian Day (normally local noon), the Moon's position is recomputed at the
 * trial time and the trial time is moved by the remaining hour angle,
 * converted from sidereal to solar time, until the step falls below one
 * minute or {@value #MAX_ITERATIONS} steps have been taken.</p>
 *
 * <p>Rise and set are only reported when they fall on the requested local day,
 * the 24 hours starting at local midnight; an event on a neighbouring day is
 * reported as {@link Kind#NEVER_RISES} or {@link Kind#NEVER_SETS}. Longitudes
 * are positive west. Julian Days are in dynamical time.</p>
 */
public final class RiseSetTransit {
    private static final Logger log = LoggerFactory.getLogger(RiseSetTransit.class);
    static final int MAX_ITERATIONS = 10;
    private static final double CONVERGENCE_HOURS = 1.0 / 60.0;
    private static volatile boolean warnedNotConverged = false;

    private RiseSetTransit() {}

    /** Event being solved for. */
    public enum Event { RISE, SET, TRANSIT }

    /** Outcome of a search. */
    public enum Kind { TIME, NEVER_RISES, NEVER_SETS }

    /**
     * Altitude of the Moon's centre at the moment its upper limb touches the
     * horizon: horizontal parallax minus refraction minus the topocentric
     * semidiameter.
     *
     * @param altitude      altitude at which parallax and refraction are taken, normally 0°
     * @param pressureMbar  atmospheric pressure in millibars
     * @param temperatureC  air temperature in degrees Celsius
     */
    public static Degrees targetAltitude(double jd, Degrees altitude, Degrees longitudeWest, Degrees latitude,
            double pressureMbar, double temperatureC) {
        Degrees parallax = MoonParallax.horizontalParallax(jd, altitude);
        Degrees refraction = Refraction.fromTrueAltitude(altitude, pressureMbar, temperatureC);
        Equatorial moon = MoonPosition.equatorial(jd);
        Degrees lst = SiderealTime.local(SiderealTime.apparent(jd), longitudeWest);
        Degrees hourAngle = lst.minus(moon.rightAscension()).mapNeg180To180();
        Degrees semidiameter = MoonParallax.topocentricSemidiameter(jd, hourAngle, moon.declination(), latitude, 0.0);
        return parallax.minus(refraction).minus(semidiameter);
    }

    public static Result rise(double jd, double timezoneOffsetHours, Degrees targetAltitude,
            Degrees longitudeWest, Degrees latitude) {
        return solve(Event.RISE, jd, timezoneOffsetHours, targetAltitude, longitudeWest, latitude);
    }

    public static Result set(double jd, double timezoneOffsetHours, Degrees targetAltitude,
            Degrees longitudeWest, Degrees latitude) {
        return solve(Event.SET, jd, timezoneOffsetHours, targetAltitude, longitudeWest, latitude);
    }

    public static Result transit(double jd, double timezoneOffsetHours, Degrees targetAltitude,
            Degrees longitudeWest, Degrees latitude) {
        return solve(Event.TRANSIT, jd, timezoneOffsetHours, targetAltitude, longitudeWest, latitude);
    }

    /**
     * Solve for one event.
     *
     * @param jd                  starting time, normally local noon of the requested day
     * @param timezoneOffsetHours local time minus UT, in hours; 0 for a UT day
     */
    public static Result solve(Event event, double jd, double timezoneOffsetHours, Degrees targetAltitude,
            Degrees longitudeWest, Degrees latitude) {
        double sinLat = latitude.sin();
        double cosLat = latitude.cos();
        double sinH0 = targetAltitude.sin();
        double trial = jd;
        boolean converged = false;
        int iterations = 0;

        while (iterations < MAX_ITERATIONS) {
            iterations++;
            Equatorial moon = MoonPosition.equatorial(trial);
            double cosH0 = (sinH0 - sinLat * moon.declination().sin()) / (cosLat * moon.declination().cos());
            if (cosH0 < -1.0) return Result.never(Kind.NEVER_RISES, iterations);
            if (cosH0 > 1.0) return Result.never(Kind.NEVER_SETS, iterations);
            Degrees h0 = Degrees.fromRadians(Math.acos(cosH0));

            Degrees lst = SiderealTime.local(SiderealTime.apparent(trial), longitudeWest);
            Degrees hourAngle = lst.minus(moon.rightAscension()).mapNeg180To180();
            Degrees delta;
            switch (event) {
                case RISE: delta = hourAngle.plus(h0).mapNeg180To180(); break;
                case SET: delta = hourAngle.minus(h0).mapNeg180To180(); break;
                default: delta = hourAngle; break;
            }

            double deltaHours = delta.toHours() * Earth.SIDEREAL_TO_SOLAR;
            trial = JulianDay.addHours(trial, -deltaHours);
            log.debug("{} iteration {}: step {} h, JD {}", event, iterations, deltaHours, trial);
            if (Math.abs(deltaHours) < CONVERGENCE_HOURS) {
                converged = true;
                break;
            }
        }
        if (!converged) warnNotConverged(event, jd);

        if (event != Event.TRANSIT && !isOnLocalDay(trial, jd, timezoneOffsetHours)) {
            return Result.never(event == Event.RISE ? Kind.NEVER_RISES : Kind.NEVER_SETS, iterations);
        }
        return new Result(Kind.TIME, trial, converged, iterations);
    }

    /** Whether {@code candidate} lies in the local day containing {@code reference}. */
    static boolean isOnLocalDay(double candidate, double reference, double timezoneOffsetHours) {
        double offsetDays = timezoneOffsetHours / 24.0;
        CalendarDate localDate = JulianDay.toCalendarDate(reference + offsetDays);
        double localMidnight =
                JulianDay.fromDate(localDate.year(), localDate.month(), localDate.dayOfMonth()) - offsetDays;
        return candidate >= localMidnight && candidate < localMidnight + 1.0;
    }

    private static void warnNotConverged(Event event, double jd) {
        if (warnedNotConverged) return;
        synchronized (RiseSetTransit.class) {
            if (!warnedNotConverged) {
                warnedNotConverged = true;
                log.warn("Moon {} search from JD {} did not converge within {} iterations; "
                                + "returning the last estimate",
                        event, String.format("%.5f", jd), MAX_ITERATIONS);
            }
        }
    }

    /**
     * Result of a search. {@link #julianDay} is NaN unless {@link #kind} is
     * {@link Kind#TIME}.
     */
    public static final class Result {
        /** Whether a time was found, or why not. */
        public final Kind kind;

        /** Event time as a Julian Day in the scale of the input. */
        public final double julianDay;

        /** False when the iteration stopped at its step limit. */
        public final boolean converged;

        /** Number of iterations taken. */
        public final int iterations;

        private Result(Kind kind, double julianDay, boolean converged, int iterations) {
            this.kind = kind;
            this.julianDay = julianDay;
            this.converged = converged;
            this.iterations = iterations;
        }

        private static Result never(Kind kind, int iterations) {
            return new Result(kind, Double.NaN, true, iterations);
        }

        public boolean hasTime() {
            return kind == Kind.TIME;
        }

        @Override
        public String toString() {
            return hasTime() ? "Result[TIME, JD " + julianDay + (converged ? "" : ", not converged") + "]"
                    : "Result[" + kind + "]";
        }
    }
}
