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
package com.github.tinemuz.ephemeris.sun;

import com.github.tinemuz.ephemeris.table.TableResource;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heliocentric position of the Earth from the abridged VSOP87 series of
 * Meeus' Appendix III.
 *
 * <p>The classpath resource <code>vsop87_earth.txt</code> lists the terms as
 * {@code <series> A B C}, where series is one of L0..L5, B0..B1 or R0..R4. A
 * coordinate is {@code sum_k tau^k * sum_i A_i cos(B_i + C_i tau)} scaled by
 * 1e-8, with tau in Julian millennia since J2000.</p>
 */
final class Vsop87 {
    private static final Logger log = LoggerFactory.getLogger(Vsop87.class);
    private static final String RESOURCE = "vsop87_earth.txt";
    private static final double SCALE = 1e-8;
    private static volatile boolean loaded = false;
    private static double[][][] longitude; // [power][term][A, B, C]
    private static double[][][] latitude;
    private static double[][][] radius;

    private Vsop87() {}

    /** Heliocentric ecliptic longitude in radians (not normalized). */
    static double longitude(double tau) {
        ensureLoaded();
        return evaluate(longitude, tau);
    }

    /** Heliocentric ecliptic latitude in radians. */
    static double latitude(double tau) {
        ensureLoaded();
        return evaluate(latitude, tau);
    }

    /** Radius vector in astronomical units. */
    static double radius(double tau) {
        ensureLoaded();
        return evaluate(radius, tau);
    }

    static void preload() {
        ensureLoaded();
    }

    private static double evaluate(double[][][] series, double tau) {
        double total = 0.0;
        double power = 1.0;
        for (double[][] terms : series) {
            double sum = 0.0;
            for (double[] term : terms) {
                sum += term[0] * Math.cos(term[1] + term[2] * tau);
            }
            total += sum * power;
            power *= tau;
        }
        return total * SCALE;
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        List<List<double[]>> l = new ArrayList<>();
        List<List<double[]>> b = new ArrayList<>();
        List<List<double[]>> r = new ArrayList<>();
        for (String[] toks : TableResource.readRecords(RESOURCE)) {
            if (toks.length != 4 || toks[0].length() != 2) {
                log.error("Malformed VSOP87 term '{}' in '{}'", String.join(" ", toks), RESOURCE);
                throw new IllegalStateException("Malformed VSOP87 term in '" + RESOURCE + "'");
            }
            List<List<double[]>> target;
            switch (toks[0].charAt(0)) {
                case 'L': target = l; break;
                case 'B': target = b; break;
                case 'R': target = r; break;
                default:
                    log.error("Unknown VSOP87 series '{}' in '{}'", toks[0], RESOURCE);
                    throw new IllegalStateException("Unknown VSOP87 series '" + toks[0] + "'");
            }
            int power = Character.digit(toks[0].charAt(1), 10);
            while (target.size() <= power) target.add(new ArrayList<>());
            try {
                target.get(power).add(TableResource.parseNumbers(toks, 1));
            } catch (NumberFormatException e) {
                log.error("Failed to parse VSOP87 term in '{}'", RESOURCE, e);
                throw new IllegalStateException("Failed to parse VSOP87 term in '" + RESOURCE + "'", e);
            }
        }
        longitude = toArray(l);
        latitude = toArray(b);
        radius = toArray(r);
        loaded = true;
    }

    private static double[][][] toArray(List<List<double[]>> series) {
        double[][][] out = new double[series.size()][][];
        for (int i = 0; i < out.length; i++) out[i] = series.get(i).toArray(new double[0][]);
        return out;
    }
}
