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

/** An angle in seconds of arc. Nutation and the small FK5 corrections use this unit. */
public record ArcSec(double value) {
    public static final double ARCSEC_PER_DEGREE = 3600.0;

    /** Arc seconds from degrees, arc minutes and arc seconds, all of the same sign. */
    public static ArcSec fromDms(double degrees, double minutes, double seconds) {
        return new ArcSec(seconds + 60.0 * (minutes + 60.0 * degrees));
    }

    public Degrees toDegrees() {
        return new Degrees(value / ARCSEC_PER_DEGREE);
    }

    public ArcSec plus(ArcSec other) {
        return new ArcSec(value + other.value);
    }
}
