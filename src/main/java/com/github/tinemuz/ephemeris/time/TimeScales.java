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

import com.github.tinemuz.ephemeris.table.BinarySearch;
import com.github.tinemuz.ephemeris.table.TableResource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between UTC, UT1 and TT (Terrestrial, i.e. dynamical, time).
 *
 * <p>Two classpath tables drive the conversion:</p>
 * <ul>
 *   <li><code>leapseconds.txt</code>: TAI - UTC steps, each with the linear drift
 *   used before 1972,</li>
 *   <li><code>deltat.txt</code>: observed values of Delta T = TT - UT1.</li>
 * </ul>
 * <p>Outside the observed Delta T range the Espenak and Meeus (2006) polynomials
 * are used. Both tables are loaded on first use; call {@link #preload()} to fail
 * fast on a broken classpath.</p>
 */
public final class TimeScales {
    private static final Logger log = LoggerFactory.getLogger(TimeScales.class);
    public static final double SECONDS_PER_DAY = 86400.0;
    /** TT - TAI in seconds. */
    public static final double TT_MINUS_TAI = 32.184;

    private static final TableResource DELTA_T = new TableResource("deltat.txt", 2);
    private static final TableResource LEAP_SECONDS = new TableResource("leapseconds.txt", 4);
    private static volatile boolean loaded = false;
    private static double[] deltaTJd;
    private static double[] deltaTSeconds;
    private static double[] leapJd;
    private static volatile boolean warnedBeyondTable = false;

    private TimeScales() {}

    /** Load both tables. Safe to call repeatedly. */
    public static void preload() {
        ensureLoaded();
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        deltaTJd = DELTA_T.column(0);
        deltaTSeconds = DELTA_T.column(1);
        leapJd = LEAP_SECONDS.column(0);
        if (deltaTJd.length < 2 || leapJd.length == 0) {
            log.error("Time scale tables are empty ({} delta T rows, {} leap second rows)",
                    deltaTJd.length, leapJd.length);
            throw new IllegalStateException("Time scale tables must not be empty");
        }
        loaded = true;
    }

    /**
     * TAI - UTC in seconds at the UTC instant {@code jd}. Zero before the first
     * table entry (1961-01-01).
     */
    public static double cumulativeLeapSeconds(double jd) {
        ensureLoaded();
        if (jd < leapJd[0]) return 0.0;
        int idx = BinarySearch.upperBound(leapJd, jd) - 1;
        double[] entry = LEAP_SECONDS.rows()[idx];
        double leapSeconds = entry[1];
        double baseMjd = entry[2];
        double coefficient = entry[3];
        return leapSeconds + (JulianDay.toMjd(jd) - baseMjd) * coefficient;
    }

    /** Delta T = TT - UT1 in seconds. */
    public static double deltaT(double jd) {
        ensureLoaded();
        int last = deltaTJd.length - 1;
        if (jd >= deltaTJd[0] && jd <= deltaTJd[last]) {
            int curr = Math.min(BinarySearch.upperBound(deltaTJd, jd), last);
            int prev = curr - 1;
            double f = (jd - deltaTJd[prev]) / (deltaTJd[curr] - deltaTJd[prev]);
            return f * (deltaTSeconds[curr] - deltaTSeconds[prev]) + deltaTSeconds[prev];
        }
        if (jd > deltaTJd[last]) warnBeyondTable(jd);
        int year = (int) JulianDay.toCalendarDate(jd).fractionalYear();
        return deltaTPolynomial(year);
    }

    /**
     * Espenak and Meeus (2006) polynomial expressions for Delta T, in seconds.
     * The year is truncated to an integer by callers.
     */
    static double deltaTPolynomial(int y) {
        double u;
        if (y < -500) {
            u = (y - 1820) / 100.0;
            return -20.0 + 32.0 * u * u;
        } else if (y < 500) {
            u = y / 100.0;
            return 10583.6 + u * (-1014.41 + u * (33.78311 + u * (-5.952053
                    + u * (-0.1798452 + u * (0.022174192 + u * 0.0090316521)))));
        } else if (y < 1600) {
            u = (y - 1000) / 100.0;
            return 1574.2 + u * (-556.01 + u * (71.23472 + u * (0.319781
                    + u * (-0.8503463 + u * (-0.005050998 + u * 0.0083572073)))));
        } else if (y < 1700) {
            u = (y - 1600) / 100.0;
            return 120.0 - 98.08 * u - 153.2 * u * u + u * u * u / 0.007129;
        } else if (y < 1800) {
            u = (y - 1700) / 100.0;
            return 8.83 + 16.03 * u - 59.285 * u * u + 133.36 * u * u * u - Math.pow(u, 4) / 0.01174;
        } else if (y < 1860) {
            u = (y - 1800) / 100.0;
            return 13.72 + u * (-33.2447 + u * (68.612 + u * (4111.6
                    + u * (-37436.0 + u * (121272.0 + u * (-169900.0 + u * 87500.0))))));
        } else if (y < 1900) {
            u = (y - 1860) / 100.0;
            return 7.62 + 57.37 * u - 2517.54 * u * u + 16806.68 * Math.pow(u, 3)
                    - 44736.24 * Math.pow(u, 4) + Math.pow(u, 5) / 0.0000233174;
        } else if (y < 1920) {
            u = (y - 1900) / 100.0;
            return -2.79 + u * (149.4119 + u * (-598.939 + u * (6196.6 - 19700.0 * u)));
        } else if (y < 1941) {
            u = (y - 1920) / 100.0;
            return 21.20 + u * (84.493 + u * (-761.00 + 2093.6 * u));
        } else if (y < 1961) {
            u = (y - 1950) / 100.0;
            return 29.07 + 40.7 * u - u * u / 0.0233 + u * u * u / 0.002547;
        } else if (y < 1986) {
            u = (y - 1975) / 100.0;
            return 45.45 + 106.7 * u - u * u / 0.026 - u * u * u / 0.000718;
        } else if (y < 2005) {
            u = (y - 2000) / 100.0;
            return 63.86 + u * (33.45 + u * (-603.74 + u * (1727.5 + u * (65181.4 + 237359.9 * u))));
        } else if (y < 2050) {
            u = (y - 2000) / 100.0;
            return 62.92 + 32.217 * u + 55.89 * u * u;
        } else if (y < 2150) {
            u = (y - 1820) / 100.0;
            return -205.72 + 56.28 * u + 32.0 * u * u;
        }
        u = (y - 1820) / 100.0;
        return -20.0 + 32.0 * u * u;
    }

    /**
     * True when {@code jd} lies inside the leap second table, i.e. from
     * 1961-01-01 on. The table stays valid after its last step, so the range
     * is open-ended.
     */
    public static boolean isUtcCovered(double jd) {
        ensureLoaded();
        return jd >= leapJd[0];
    }

    /** UT1 from UTC: UT1 = UTC + (UT1 - UTC). */
    public static double utcToUt1(double jd) {
        return jd + ut1MinusUtc(jd) / SECONDS_PER_DAY;
    }

    /**
     * UT1 - UTC in seconds, as (TAI - UTC) + (TT - TAI) - Delta T. Past the last
     * observed Delta T that value is held, so UT1 - UTC keeps following the
     * leap seconds instead of the polynomial.
     */
    static double ut1MinusUtc(double jd) {
        ensureLoaded();
        double lastObserved = deltaTJd[deltaTJd.length - 1];
        double deltaT = deltaT(Math.min(jd, lastObserved));
        return cumulativeLeapSeconds(jd) + TT_MINUS_TAI - deltaT;
    }

    public static double ut1ToTt(double jd) {
        return jd + deltaT(jd) / SECONDS_PER_DAY;
    }

    /**
     * TT from UTC. Inside the leap second table TT - UTC is exactly
     * (TAI - UTC) + 32.184 s. Before it UTC is not defined and the input is
     * taken to be UT1.
     */
    public static double utcToTt(double jd) {
        if (!isUtcCovered(jd)) {
            return ut1ToTt(jd);
        }
        return jd + (cumulativeLeapSeconds(jd) + TT_MINUS_TAI) / SECONDS_PER_DAY;
    }

    private static void warnBeyondTable(double jd) {
        if (warnedBeyondTable) return;
        synchronized (TimeScales.class) {
            if (!warnedBeyondTable) {
                warnedBeyondTable = true;
                log.warn("JD {} is past the last observed Delta T at JD {}; "
                                + "using the polynomial estimate. Consider updating deltat.txt",
                        String.format("%.1f", jd),
                        String.format("%.1f", deltaTJd[deltaTJd.length - 1]));
            }
        }
    }
}
