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
package com.github.tinemuz.meeus;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximation of ΔT = TT - UT in seconds.
 *
 * <p>Uses the polynomial expressions published by Espenak and Meeus for the
 * NASA Five Millennium Canon of Solar Eclipses. Each historical era has its
 * own polynomial; the segments are evaluated as published, so values jump by a
 * fraction of a second at some era boundaries. Those jumps belong to the model
 * and are not smoothed.</p>
 *
 * <p>The expressions are published for -1999 to +3000. Outside that range the
 * long-term parabola is still used and a warning is logged once.</p>
 */
public final class DeltaT {
    private static final Logger log = LoggerFactory.getLogger(DeltaT.class);

    private static final double VALID_FROM = -1999.0;
    private static final double VALID_TO = 3001.0;

    // Ordered by start year; the first segment containing the date wins.
    private static final List<Segment> SEGMENTS = List.of(
            new Segment(Double.NEGATIVE_INFINITY, -500.0, DeltaT::longTerm),
            new Segment(-500.0, 500.0, y -> {
                double u = y / 100.0;
                return 10583.6 + u * (-1014.41 + u * (33.78311 + u * (-5.952053
                        + u * (-0.1798452 + u * (0.022174192 + u * 0.0090316521)))));
            }),
            new Segment(500.0, 1600.0, y -> {
                double u = (y - 1000.0) / 100.0;
                return 1574.2 + u * (-556.01 + u * (71.23472 + u * (0.319781
                        + u * (-0.8503463 + u * (-0.005050998 + u * 0.0083572073)))));
            }),
            new Segment(1600.0, 1700.0, y -> {
                double t = y - 1600.0;
                return 120.0 + t * (-0.9808 + t * (-0.01532 + t / 7129.0));
            }),
            new Segment(1700.0, 1800.0, y -> {
                double t = y - 1700.0;
                return 8.83 + t * (0.1603 + t * (-0.0059285 + t * (0.00013336 - t / 1174000.0)));
            }),
            new Segment(1800.0, 1860.0, y -> {
                double t = y - 1800.0;
                return 13.72 + t * (-0.332447 + t * (0.0068612 + t * (0.0041116 + t * (-0.00037436
                        + t * (0.0000121272 + t * (-0.0000001699 + t * 0.000000000875))))));
            }),
            new Segment(1860.0, 1900.0, y -> {
                double t = y - 1860.0;
                return 7.62 + t * (0.5737 + t * (-0.251754 + t * (0.01680668
                        + t * (-0.0004473624 + t / 233174.0))));
            }),
            new Segment(1900.0, 1920.0, y -> {
                double t = y - 1900.0;
                return -2.79 + t * (1.494119 + t * (-0.0598939 + t * (0.0061966 - t * 0.000197)));
            }),
            new Segment(1920.0, 1941.0, y -> {
                double t = y - 1920.0;
                return 21.20 + t * (0.84493 + t * (-0.076100 + t * 0.0020936));
            }),
            new Segment(1941.0, 1961.0, y -> {
                double t = y - 1950.0;
                return 29.07 + t * (0.407 + t * (-1.0 / 233.0 + t / 2547.0));
            }),
            new Segment(1961.0, 1986.0, y -> {
                double t = y - 1975.0;
                return 45.45 + t * (1.067 + t * (-1.0 / 260.0 - t / 718.0));
            }),
            new Segment(1986.0, 2005.0, y -> {
                double t = y - 2000.0;
                return 63.86 + t * (0.3345 + t * (-0.060374 + t * (0.0017275
                        + t * (0.000651814 + t * 0.00002373599))));
            }),
            new Segment(2005.0, 2050.0, y -> {
                double t = y - 2000.0;
                return 62.92 + t * (0.32217 + t * 0.005589);
            }),
            new Segment(2050.0, 2150.0, y -> longTerm(y) - 0.5628 * (2150.0 - y)),
            new Segment(2150.0, Double.POSITIVE_INFINITY, DeltaT::longTerm));

    private static volatile boolean warnedOutOfRange = false;

    private DeltaT() {}

    /**
     * ΔT for the middle of the given month.
     *
     * @param year  astronomical year
     * @param month month in [1, 12]
     * @return TT - UT in seconds
     */
    public static double seconds(int year, int month) {
        CalendarSystem.checkMonth(month);
        return seconds(year + (month - 0.5) / 12.0);
    }

    /**
     * ΔT for a decimal year such as 2015.5.
     *
     * @return TT - UT in seconds
     */
    public static double seconds(double decimalYear) {
        if (!Double.isFinite(decimalYear)) {
            throw MeeusException.domainRange("Year must be finite, got " + decimalYear);
        }
        if (decimalYear < VALID_FROM || decimalYear >= VALID_TO) warnOutOfRange(decimalYear);
        for (Segment s : SEGMENTS) {
            if (s.contains(decimalYear)) return s.formula().applyAsDouble(decimalYear);
        }
        // Unreachable: the segments cover the whole real line
        throw new IllegalStateException("No ΔT segment for year " + decimalYear);
    }

    private static double longTerm(double y) {
        double u = (y - 1820.0) / 100.0;
        return -20.0 + 32.0 * u * u;
    }

    private static void warnOutOfRange(double year) {
        if (warnedOutOfRange) return;
        synchronized (DeltaT.class) {
            if (!warnedOutOfRange) {
                warnedOutOfRange = true;
                log.warn(
                        "ΔT requested for year {}, outside the published range [{}, {}]; "
                                + "using the long-term parabola",
                        String.format("%.1f", year),
                        (int) VALID_FROM,
                        (int) VALID_TO - 1);
            }
        }
    }

    // Half-open [from, to) range and its polynomial
    private record Segment(double from, double to, DoubleUnaryOperator formula) {
        boolean contains(double year) {
            return year >= from && year < to;
        }
    }
}
