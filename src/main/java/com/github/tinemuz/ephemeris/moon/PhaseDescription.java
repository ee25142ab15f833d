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

/**
 * Name of the Moon's phase from the Sun-Moon elongation. New Moon covers only
 * [0, 22.5); the waning crescent runs from 292.5 up to the next new Moon.
 */
public enum PhaseDescription {
    NEW_MOON("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL_MOON("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    LAST_QUARTER("Last Quarter"),
    WANING_CRESCENT("Waning Crescent");

    private static final double SECTION = 22.5;

    private final String label;

    PhaseDescription(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Phase for an elongation in [0, 360); 0 is new Moon, 180 full Moon. */
    public static PhaseDescription forElongation(double degrees) {
        if (degrees < SECTION) return NEW_MOON;
        if (degrees < 3 * SECTION) return WAXING_CRESCENT;
        if (degrees < 5 * SECTION) return FIRST_QUARTER;
        if (degrees < 7 * SECTION) return WAXING_GIBBOUS;
        if (degrees < 9 * SECTION) return FULL_MOON;
        if (degrees < 11 * SECTION) return WANING_GIBBOUS;
        if (degrees < 13 * SECTION) return LAST_QUARTER;
        return WANING_CRESCENT;
    }

    @Override
    public String toString() {
        return label;
    }
}
