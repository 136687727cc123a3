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

/**
 * Four or more samples. Roots and extrema are found by Newton's method started at
 * the middle of the search interval. While the interval brackets a sign change
 * it shrinks on every step, and a Newton step leaving it is replaced by
 * bisection.
 */
final class PolynomialInterpolation extends Interpolation {

    PolynomialInterpolation(double[] x, double[] y) {
        super(x, y);
    }

    @Override
    public double derivative(double at) {
        return nested(at)[1];
    }

    @Override
    public double root() {
        return solve(0, x[0], x[x.length - 1], false);
    }

    @Override
    public double root(double from, double to) {
        return solve(0, Math.min(from, to), Math.max(from, to), true);
    }

    @Override
    public double extremum() {
        return solve(1, x[0], x[x.length - 1], false);
    }

    /**
     * Zero of the order-th derivative.
     *
     * @param confined whether the answer must lie in [lo, hi]
     */
    private double solve(int order, double lo, double hi, boolean confined) {
        String what = order == 0 ? "root" : "extremum";
        double fLo = nested(lo)[order];
        double fHi = nested(hi)[order];
        if (fLo == 0.0) return lo;
        if (fHi == 0.0) return hi;
        // Without a sign change plain Newton runs; a confined answer is checked at the end
        boolean bracketed = (fLo < 0.0) != (fHi < 0.0);

        double t = 0.5 * (lo + hi);
        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            double[] v = nested(t);
            double f = v[order];
            double df = v[order + 1];
            if (f == 0.0) return accept(t, lo, hi, confined, what);
            if (bracketed) {
                if ((f < 0.0) == (fLo < 0.0)) {
                    lo = t;
                    fLo = f;
                } else {
                    hi = t;
                }
            }
            double next = df != 0.0 ? t - f / df : Double.NaN;
            if (bracketed && !(next > lo && next < hi)) next = 0.5 * (lo + hi);
            if (!Double.isFinite(next)) {
                throw MeeusException.noConvergence(
                        "Newton search for the " + what + " stalled at " + t);
            }
            if (Math.abs(next - t) <= CONVERGENCE * Math.max(1.0, Math.abs(t))) {
                return accept(next, lo, hi, confined, what);
            }
            t = next;
        }
        throw MeeusException.noConvergence(
                "No " + what + " found after " + MAX_ITERATIONS + " iterations");
    }

    private static double accept(double t, double lo, double hi, boolean confined, String what) {
        if (confined && (t < lo || t > hi)) {
            throw MeeusException.noConvergence("No " + what + " in [" + lo + ", " + hi + "]");
        }
        return t;
    }
}
