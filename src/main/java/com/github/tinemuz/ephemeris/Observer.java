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
import com.github.tinemuz.ephemeris.coordinates.Refraction;

/**
 * Where and under what sky an observation is made.
 *
 * @param longitudeWest       geographic longitude, positive west of Greenwich
 * @param latitude            geographic latitude, positive north
 * @param heightMeters        height above sea level
 * @param pressureMbar        atmospheric pressure in millibars, for refraction
 * @param temperatureC        air temperature in degrees Celsius, for refraction
 * @param timezoneOffsetHours local time minus UTC, bounds the local day for rise and set
 */
public record Observer(Degrees longitudeWest, Degrees latitude, double heightMeters,
        double pressureMbar, double temperatureC, double timezoneOffsetHours) {

    public Observer {
        if (longitudeWest == null || latitude == null) {
            throw new IllegalArgumentException("longitude and latitude are required");
        }
        if (!Double.isFinite(longitudeWest.value())) {
            throw new IllegalArgumentException("longitude must be finite, was " + longitudeWest.value());
        }
        if (!(Math.abs(latitude.value()) <= 90.0)) {
            throw new IllegalArgumentException("latitude must be in [-90, 90], was " + latitude.value());
        }
        if (!Double.isFinite(heightMeters) || !Double.isFinite(pressureMbar)
                || !Double.isFinite(temperatureC) || !Double.isFinite(timezoneOffsetHours)) {
            throw new IllegalArgumentException("observer parameters must be finite");
        }
    }

    /** Observer at sea level in a standard atmosphere, on UTC. */
    public static Observer at(Degrees longitudeWest, Degrees latitude) {
        return new Observer(longitudeWest, latitude, 0.0,
                Refraction.STANDARD_PRESSURE_MBAR, Refraction.STANDARD_TEMPERATURE_C, 0.0);
    }

    public Observer withHeight(double meters) {
        return new Observer(longitudeWest, latitude, meters, pressureMbar, temperatureC, timezoneOffsetHours);
    }

    public Observer withWeather(double pressure, double temperature) {
        return new Observer(longitudeWest, latitude, heightMeters, pressure, temperature, timezoneOffsetHours);
    }

    public Observer withTimezoneOffset(double hours) {
        return new Observer(longitudeWest, latitude, heightMeters, pressureMbar, temperatureC, hours);
    }
}
