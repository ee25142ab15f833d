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
package com.github.tinemuz.ephemeris.coordinates;

import com.github.tinemuz.ephemeris.angle.Degrees;

/**
 * Atmospheric refraction (Meeus, chapter 16, formula 16.4 by Saemundsson).
 */
public final class Refraction {
    /** Below this altitude the formula diverges; lower altitudes are clamped to it. */
    public static final double MIN_ALTITUDE_DEG = -1.9006387000003735;
    public static final double STANDARD_PRESSURE_MBAR = 1010.0;
    public static final double STANDARD_TEMPERATURE_C = 10.0;

    private Refraction() {}

    /**
     * Refraction to add to a true (airless) altitude to obtain the apparent one.
     *
     * @param trueAltitude altitude without refraction
     * @param pressureMbar atmospheric pressure in millibars
     * @param temperatureC air temperature in degrees Celsius
     * @return refraction correction, positive
     */
    public static Degrees fromTrueAltitude(Degrees trueAltitude, double pressureMbar, double temperatureC) {
        double h = Math.max(trueAltitude.value(), MIN_ALTITUDE_DEG);
        double arcMinutes = 1.02 / new Degrees(h + 10.3 / (h + 5.11)).tan() + 0.0019279;
        double factor = (pressureMbar / STANDARD_PRESSURE_MBAR) * (283.0 / (273.0 + temperatureC));
        return new Degrees(arcMinutes * factor / 60.0);
    }

    /** Apparent altitude for a true altitude. */
    public static Degrees apparentAltitude(Degrees trueAltitude, double pressureMbar, double temperatureC) {
        return trueAltitude.plus(fromTrueAltitude(trueAltitude, pressureMbar, temperatureC));
    }
}
