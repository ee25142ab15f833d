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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.ephemeris.angle.Degrees;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoonParallaxTest {

    private static final double JD = 2448724.5;

    @Test
    @DisplayName("Equatorial horizontal parallax (Meeus 47.a)")
    void equatorialParallax() {
        assertEquals(0.0173126, MoonParallax.equatorialHorizontalParallax(JD).value(), 1e-7);
        assertEquals(0.991990, MoonParallax.horizontalParallax(JD, Degrees.ZERO).value(), 1e-4);
    }

    @Test
    @DisplayName("Parallax vanishes at the zenith")
    void zenith() {
        assertEquals(0.0, MoonParallax.horizontalParallax(JD, new Degrees(90.0)).value(), 1e-12);
    }

    @Test
    @DisplayName("Geocentric semidiameter")
    void geocentricSemidiameter() {
        assertEquals(0.270286, MoonParallax.geocentricSemidiameter(JD).toDegrees().value(), 1e-5);
    }

    @Test
    @DisplayName("Overhead Moon looks larger than the geocentric one")
    void augmentation() {
        double geocentric = MoonParallax.geocentricSemidiameter(JD).toDegrees().value();
        double sinPi = MoonParallax.equatorialHorizontalParallax(JD).value();
        Degrees overhead = MoonParallax.topocentricSemidiameter(JD, Degrees.ZERO, Degrees.ZERO, Degrees.ZERO, 0.0);
        Degrees onHorizon = MoonParallax.topocentricSemidiameter(JD, new Degrees(90.0), Degrees.ZERO, Degrees.ZERO, 0.0);
        assertEquals(geocentric / (1.0 - sinPi), overhead.value(), 1e-5);
        assertEquals(geocentric, onHorizon.value(), 1e-4);
        assertTrue(overhead.value() > onHorizon.value());
    }
}
