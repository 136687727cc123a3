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

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;
import java.util.stream.IntStream;

/**
 * Polynomial through a set of tabulated samples, in Newton's divided-difference
 * form.
 *
 * <p>The samples are sorted by abscissa on construction and must have distinct,
 * finite abscissae. The concrete variant is picked from the sample count: two
 * samples give a straight line that can only be evaluated, three give a
 * quadratic with closed-form root and extremum, four or more are solved by a
 * bracketed Newton iteration.</p>
 *
 * <p>Instances are immutable. {@link #withSample} returns a new instance.</p>
 */
public abstract class Interpolation {
    /** Newton iteration budget for root and extremum searches. */
    static final int MAX_ITERATIONS = 50;

    // Relative step below which a Newton search has converged
    static final double CONVERGENCE = 1e-13;

    final double[] x;
    final double[] y;
    // coefficients[k] = f[x0, ..., xk]
    final double[] coefficients;

    Interpolation(double[] x, double[] y) {
        this.x = x;
        this.y = y;
        this.coefficients = dividedDifferences(x, y);
    }

    /**
     * Interpolation through the samples (x[i], y[i]). The arrays are copied and
     * need not be sorted.
     *
     * @throws MeeusException of kind {@link ErrorKind#INVALID_SAMPLE} if the
     *                        lengths differ, fewer than two samples are given,
     *                        a value is not finite or two abscissae coincide
     */
    public static Interpolation of(double[] x, double[] y) {
        if (x.length != y.length) {
            throw MeeusException.invalidSample(
                    "x and y must have the same length, got " + x.length + " and " + y.length);
        }
        if (x.length < 2) {
            throw MeeusException.invalidSample("At least two samples are needed, got " + x.length);
        }
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
                throw MeeusException.invalidSample(
                        "Sample " + i + " is not finite: (" + x[i] + ", " + y[i] + ")");
            }
        }
        Integer[] order = IntStream.range(0, x.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> x[i]));
        double[] sx = new double[x.length];
        double[] sy = new double[y.length];
        for (int i = 0; i < order.length; i++) {
            sx[i] = x[order[i]];
            sy[i] = y[order[i]];
            if (i > 0 && sx[i] == sx[i - 1]) {
                throw MeeusException.invalidSample("Duplicate abscissa " + sx[i]);
            }
        }
        return create(sx, sy);
    }

    /** Interpolation through equally spaced samples at x = 0, 1, 2, ... */
    public static Interpolation of(double... y) {
        double[] x = new double[y.length];
        for (int i = 0; i < x.length; i++) x[i] = i;
        return of(x, y);
    }

    /**
     * Interpolation through values extracted from a list of tabulated objects.
     *
     * @param x     abscissae, one per element of {@code rows}
     * @param rows  tabulated rows
     * @param value extracts the ordinate from a row
     */
    public static <T> Interpolation of(double[] x, List<T> rows, ToDoubleFunction<? super T> value) {
        double[] y = new double[rows.size()];
        for (int i = 0; i < y.length; i++) y[i] = value.applyAsDouble(rows.get(i));
        return of(x, y);
    }

    private static Interpolation create(double[] x, double[] y) {
        if (x.length == 2) return new LinearInterpolation(x, y);
        if (x.length == 3) return new QuadraticInterpolation(x, y);
        return new PolynomialInterpolation(x, y);
    }

    /**
     * New interpolation with one more sample. The variant may change with the
     * count.
     *
     * @throws MeeusException if the sample is not finite or its abscissa is taken
     */
    public Interpolation withSample(double sampleX, double sampleY) {
        if (!Double.isFinite(sampleX) || !Double.isFinite(sampleY)) {
            throw MeeusException.invalidSample(
                    "Sample is not finite: (" + sampleX + ", " + sampleY + ")");
        }
        int at = upperBound(x, sampleX);
        if (x[at] < sampleX) at++;
        else if (x[at] == sampleX) throw MeeusException.invalidSample("Duplicate abscissa " + sampleX);
        double[] nx = new double[x.length + 1];
        double[] ny = new double[y.length + 1];
        System.arraycopy(x, 0, nx, 0, at);
        System.arraycopy(y, 0, ny, 0, at);
        nx[at] = sampleX;
        ny[at] = sampleY;
        System.arraycopy(x, at, nx, at + 1, x.length - at);
        System.arraycopy(y, at, ny, at + 1, y.length - at);
        return create(nx, ny);
    }

    /** Number of samples. */
    public int size() {
        return x.length;
    }

    /** Abscissa of the i-th sample in ascending order. */
    public double x(int i) {
        return x[i];
    }

    /** Ordinate of the i-th sample in ascending order of abscissa. */
    public double y(int i) {
        return y[i];
    }

    /**
     * Value of the interpolating polynomial. Outside the sample interval this is
     * an extrapolation and loses accuracy quickly.
     */
    public double evaluate(double at) {
        return nested(at)[0];
    }

    /**
     * First derivative of the interpolating polynomial.
     *
     * @throws MeeusException of kind INVALID_SAMPLE for two samples
     */
    public abstract double derivative(double at);

    /**
     * Zero of the interpolating polynomial closest to the sample interval.
     *
     * @throws MeeusException of kind NO_CONVERGENCE if no real zero is found
     */
    public abstract double root();

    /**
     * Zero of the interpolating polynomial inside [from, to].
     *
     * @throws MeeusException of kind NO_CONVERGENCE if no zero lies in the range
     */
    public abstract double root(double from, double to);

    /**
     * Abscissa where the interpolating polynomial has a minimum or maximum.
     *
     * @throws MeeusException of kind NO_CONVERGENCE if there is none
     */
    public abstract double extremum();

    /** Value, first and second derivative of the polynomial at {@code at}. */
    final double[] nested(double at) {
        int n = coefficients.length;
        double p = coefficients[n - 1];
        double dp = 0.0;
        double ddp = 0.0;
        for (int k = n - 2; k >= 0; k--) {
            double dx = at - x[k];
            ddp = ddp * dx + 2.0 * dp;
            dp = dp * dx + p;
            p = p * dx + coefficients[k];
        }
        return new double[] {p, dp, ddp};
    }

    private static double[] dividedDifferences(double[] x, double[] y) {
        int n = x.length;
        double[] table = y.clone();
        double[] c = new double[n];
        c[0] = table[0];
        for (int level = 1; level < n; level++) {
            for (int i = 0; i < n - level; i++) {
                table[i] = (table[i + 1] - table[i]) / (x[i + level] - x[i]);
            }
            c[level] = table[0];
        }
        return c;
    }

    /**
     * First index in a sorted array where arr[index] >= value.
     * If value is larger than all entries, returns the last index.
     */
    static int upperBound(double[] arr, double value) {
        int lo = 0;
        int hi = arr.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < value) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interpolation)) return false;
        Interpolation other = (Interpolation) o;
        return Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(x) + Arrays.hashCode(y);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{x=" + Arrays.toString(x) + ", y=" + Arrays.toString(y) + "}";
    }
}
