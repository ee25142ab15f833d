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

/**
 * Base-60 decomposition of a value, used for both d/m/s and h/m/s display.
 * {@code whole}, {@code minutes} and {@code seconds} are magnitudes; the sign is
 * kept separately so that e.g. -0° 30' survives.
 */
public record Sexagesimal(int sign, int whole, int minutes, double seconds) {

    static Sexagesimal of(double value) {
        int sign = value < 0.0 ? -1 : 1;
        double abs = Math.abs(value);
        double whole = Math.floor(abs);
        double minutes = (abs - whole) * 60.0;
        double wholeMinutes = Math.floor(minutes);
        double seconds = (minutes - wholeMinutes) * 60.0;
        return new Sexagesimal(sign, (int) whole, (int) wholeMinutes, seconds);
    }

    /** Whole part carrying the sign, as in -8 for -8h 43m. */
    public int signedWhole() {
        return sign * whole;
    }
}
