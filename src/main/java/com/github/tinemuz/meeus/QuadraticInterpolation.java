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
 * Three samples. The parabola is written as a·t² + b·t + c with t measured from
 * the middle abscissa, which keeps the closed forms well conditioned.
 */
final class QuadraticInterpolation extends Interpolation {
    private final double a;
    private final double b;
    private final double c;

    QuadraticInterpolation(double[] x, double[] y) {
        super(x, y);
        double h0 = x[1] - x[0];
        a = coefficients[2];
        b = coefficients[1] + h0 * coefficients[2];
        c = y[0] + h0 * coefficients[1];
    }

    @Override
    public double derivative(double at) {
        return 2.0 * a * (at - x[1]) + b;
    }

    @Override
    public double root() {
        double[] roots = roots();
        double best = roots[0];
        for (int i = 1; i < roots.length; i++) {
            double dBest = distanceOutside(best, x[0], x[2]);
            double d = distanceOutside(roots[i], x[0], x[2]);
            if (d < dBest || (d == dBest && Math.abs(roots[i] - x[1]) < Math.abs(best - x[1]))) {
                best = roots[i];
            }
        }
        return best;
    }

    @Override
    public double root(double from, double to) {
        double lo = Math.min(from, to);
        double hi = Math.max(from, to);
        double mid = 0.5 * (lo + hi);
        double best = Double.NaN;
        for (double r : roots()) {
            if (r < lo || r > hi) continue;
            if (Double.isNaN(best) || Math.abs(r - mid) < Math.abs(best - mid)) best = r;
        }
        if (Double.isNaN(best)) {
            throw MeeusException.noConvergence("No root of the parabola in [" + lo + ", " + hi + "]");
        }
        return best;
    }

    @Override
    public double extremum() {
        if (a == 0.0) {
            throw MeeusException.noConvergence("Samples are collinear, there is no extremum");
        }
        return x[1] - b / (2.0 * a);
    }

    // Real roots as abscissae, at least one
    private double[] roots() {
        if (a == 0.0) {
            if (b == 0.0) throw MeeusException.noConvergence("Samples are constant, there is no root");
            return new double[] {x[1] - c / b};
        }
        double disc = b * b - 4.0 * a * c;
        if (disc < 0.0) throw MeeusException.noConvergence("The parabola has no real root");
        double q = -0.5 * (b + Math.copySign(Math.sqrt(disc), b));
        if (q == 0.0) return new double[] {x[1]};
        return new double[] {x[1] + q / a, x[1] + c / q};
    }

    private static double distanceOutside(double v, double lo, double hi) {
        if (v < lo) return lo - v;
        if (v > hi) return v - hi;
        return 0.0;
    }
}
