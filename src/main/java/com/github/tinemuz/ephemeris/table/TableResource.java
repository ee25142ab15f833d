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
package com.github.tinemuz.ephemeris.table;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A read-only numeric table stored as a classpath text resource.
 *
 * <p>Each non-blank line that does not start with {@code #} is one record of
 * whitespace separated columns. The table is parsed on first access and kept
 * for the lifetime of the process; any problem reading or parsing it throws an
 * {@link IllegalStateException}.</p>
 */
public final class TableResource {
    private static final Logger log = LoggerFactory.getLogger(TableResource.class);

    private final String resourceName;
    private final int columns;
    private volatile double[][] rows;

    /**
     * @param resourceName classpath resource, e.g. {@code nutation.txt}
     * @param columns      number of numeric columns every record must have
     */
    public TableResource(String resourceName, int columns) {
        this.resourceName = resourceName;
        this.columns = columns;
    }

    public String resourceName() {
        return resourceName;
    }

    /** All records in file order. Callers must not modify the returned arrays. */
    public double[][] rows() {
        double[][] r = rows;
        return r != null ? r : ensureLoaded();
    }

    /** Column {@code index} of every record, in file order. */
    public double[] column(int index) {
        double[][] r = rows();
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) out[i] = r[i][index];
        return out;
    }

    private synchronized double[][] ensureLoaded() {
        if (rows == null) {
            rows = parse(readRecords(resourceName));
            log.debug("Loaded {} records from '{}'", rows.length, resourceName);
        }
        return rows;
    }

    private double[][] parse(List<String[]> records) {
        double[][] out = new double[records.size()][];
        for (int i = 0; i < out.length; i++) {
            String[] toks = records.get(i);
            if (toks.length != columns) {
                log.error("Record {} of '{}' has {} columns, expected {}",
                        i + 1, resourceName, toks.length, columns);
                throw new IllegalStateException(
                        "Malformed record " + (i + 1) + " in '" + resourceName + "'");
            }
            try {
                out[i] = parseNumbers(toks, 0);
            } catch (NumberFormatException e) {
                log.error("Failed to parse record {} of '{}'", i + 1, resourceName, e);
                throw new IllegalStateException(
                        "Failed to parse record " + (i + 1) + " in '" + resourceName + "'", e);
            }
        }
        return out;
    }

    /** Parse {@code toks[from..]} as doubles. */
    public static double[] parseNumbers(String[] toks, int from) {
        double[] row = new double[toks.length - from];
        for (int i = from; i < toks.length; i++) row[i - from] = Double.parseDouble(toks[i]);
        return row;
    }

    /**
     * Read a classpath resource as whitespace-split records, skipping blank lines
     * and {@code #} comments.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String[]> readRecords(String resourceName) {
        InputStream in = TableResource.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            log.error("Table '{}' not found on classpath", resourceName);
            throw new IllegalStateException("Table '" + resourceName + "' not found on classpath");
        }
        List<String[]> records = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                records.add(line.split("\\s+"));
            }
        } catch (IOException e) {
            log.error("Failed to read table '{}'", resourceName, e);
            throw new IllegalStateException("Failed to read table '" + resourceName + "'", e);
        }
        return records;
    }
}
