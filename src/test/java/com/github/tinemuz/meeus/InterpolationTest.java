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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

/**
 * Tests for Interpolation and its three variants.
 *
 * <p>Angle tables are from Meeus, chapter 3.
 */
class InterpolationTest {

    private static final double TOLERANCE = 1e-9;

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Variant follows the sample count")
        void variants() {
            assertInstanceOf(LinearInterpolation.class, Interpolation.of(1.0, 2.0));
            assertInstanceOf(QuadraticInterpolation.class, Interpolation.of(1.0, 2.0, 5.0));
            assertInstanceOf(PolynomialInterpolation.class, Interpolation.of(1.0, 2.0, 5.0, 3.0));
        }

        @Test
        @DisplayName("Unsorted samples are sorted by abscissa")
        void sorting() {
            Interpolation i = Interpolation.of(new double[] {2, 0, 1}, new double[] {20, 0, 10});
            assertEquals(0.0, i.x(0));
            assertEquals(1.0, i.x(1));
            assertEquals(2.0, i.x(2));
            assertEquals(10.0, i.y(1));
            assertEquals(Interpolation.of(new double[] {0, 1, 2}, new double[] {0, 10, 20}), i);
        }

        @Test
        @DisplayName("Implicit abscissae start at zero")
        void implicitAbscissae() {
            Interpolation i = Interpolation.of(5.0, 7.0, 11.0);
            assertEquals(3, i.size());
            assertEquals(2.0, i.x(2));
            assertEquals(11.0, i.evaluate(2.0), TOLERANCE);
        }

        @Test
        @DisplayName("Ordinates can be extracted from tabulated rows")
        void fromRows() {
            List<String> rows = List.of("-2", "3", "2");
            Interpolation i = Interpolation.of(new double[] {-1, 0, 1}, rows, Double::parseDouble);
            assertEquals(2.93, i.evaluate(0.7), TOLERANCE);
        }

        @Test
        @DisplayName("Invalid sample sets are rejected")
        void invalidSamples() {
            assertInvalidSample(() -> Interpolation.of(new double[] {0, 1}, new double[] {1}));
            assertInvalidSample(() -> Interpolation.of(1.0));
            assertInvalidSample(() -> Interpolation.of(new double[] {0, 1, 1}, new double[] {1, 2, 3}));
            assertInvalidSample(() -> Interpolation.of(new double[] {0, Double.NaN}, new double[] {1, 2}));
            assertInvalidSample(() -> Interpolation.of(new double[] {0, 1}, new double[] {1, Double.POSITIVE_INFINITY}));
        }

        @Test
        @DisplayName("Adding a sample keeps the order and may change the variant")
        void withSample() {
            Interpolation line = Interpolation.of(new double[] {0, 2}, new double[] {0, 4});
            Interpolation parabola = line.withSample(1.0, 1.0);
            assertInstanceOf(QuadraticInterpolation.class, parabola);
            assertEquals(1.0, parabola.x(1));
            Interpolation cubic = parabola.withSample(-1.0, 1.0).withSample(5.0, 25.0);
            assertEquals(5, cubic.size());
            assertEquals(-1.0, cubic.x(0));
            assertEquals(5.0, cubic.x(4));
            assertEquals(2, line.size(), "receiver is unchanged");
            assertInvalidSample(() -> parabola.withSample(2.0, 3.0));
        }

        @Test
        @DisplayName("Equality compares the full sample sequence")
        void equality() {
            Interpolation a = Interpolation.of(1.0, 2.0, 3.0);
            Interpolation b = Interpolation.of(new double[] {2, 1, 0}, new double[] {3, 2, 1});
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, Interpolation.of(1.0, 2.0, 3.5));
        }
    }

    @Nested
    @DisplayName("Linear variant")
    class LinearTests {

        @Test
        @DisplayName("Evaluates the straight line")
        void evaluate() {
            Interpolation i = Interpolation.of(new double[] {1, 3}, new double[] {2, 6});
            assertEquals(4.0, i.evaluate(2.0), TOLERANCE);
            assertEquals(0.0, i.evaluate(0.0), TOLERANCE);
        }

        @Test
        @DisplayName("Other operations need three samples")
        void unsupported() {
            Interpolation i = Interpolation.of(1.0, 2.0);
            assertInvalidSample(() -> i.derivative(0.5));
            assertInvalidSample(i::root);
            assertInvalidSample(() -> i.root(0, 1));
            assertInvalidSample(i::extremum);
        }
    }

    @Nested
    @DisplayName("Quadratic variant")
    class QuadraticTests {

        @Test
        @DisplayName("Symmetric abscissae")
        void symmetric() {
            Interpolation i = Interpolation.of(new double[] {-1, 0, 1}, new double[] {-2, 3, 2});
            assertEquals(-0.52, i.evaluate(-0.8), TOLERANCE);
            assertEquals(2.93, i.evaluate(0.7), TOLERANCE);
            assertEquals(8.0, i.derivative(-1.0), TOLERANCE);
            assertEquals(2.0, i.derivative(0.0), TOLERANCE);
            assertEquals(-1.0, i.derivative(0.5), TOLERANCE);
            assertEquals(-0.7207592200561265, i.root(), TOLERANCE);
            assertEquals(1.0 / 3.0, i.extremum(), TOLERANCE);
        }

        @Test
        @DisplayName("Unequal spacing")
        void unequalSpacing() {
            Interpolation i = Interpolation.of(new double[] {-3, 0, 2.5}, new double[] {12, -3, -1.75});
            assertEquals(5.0, i.evaluate(-2.0), TOLERANCE);
            assertEquals(-8.0, i.derivative(-3.0), TOLERANCE);
            assertEquals(-2.0, i.derivative(0.0), TOLERANCE);
            assertEquals(3.0, i.derivative(2.5), TOLERANCE);
            assertEquals(-1.0, i.root(), TOLERANCE);
            assertEquals(-1.0, i.root(-2.0, 0.0), TOLERANCE);
            assertEquals(3.0, i.root(2.8, 4.0), TOLERANCE);
            assertEquals(1.0, i.extremum(), TOLERANCE);
        }

        @Test
        @DisplayName("Zero crossing of an angle (Meeus example 3.d)")
        void angleRoot() {
            Interpolation i = Interpolation.of(
                    new double[] {26, 27, 28},
                    new double[] {
                        -dms(0, 28, 13.4), dms(0, 6, 46.3), dms(0, 38, 23.2)
                    });
            assertEquals(26.798732705, i.root(), 1e-9);
        }

        @Test
        @DisplayName("Extremum of a distance (Meeus example 3.c)")
        void extremumValue() {
            Interpolation i = Interpolation.of(
                    new double[] {12, 16, 20}, new double[] {1.3814294, 1.3812213, 1.3812453});
            double t = i.extremum();
            assertEquals(17.5863851788, t, 1e-9);
            assertEquals(1.38120304666, i.evaluate(t), 1e-10);
            assertEquals(0.0, i.derivative(t), 1e-12);
        }

        @Test
        @DisplayName("Collinear samples: exact linear root, no extremum")
        void collinear() {
            Interpolation i = Interpolation.of(new double[] {0, 1, 2}, new double[] {-1, 1, 3});
            assertEquals(0.5, i.root(), 0.0);
            MeeusException ex = assertThrows(MeeusException.class, i::extremum);
            assertEquals(ErrorKind.NO_CONVERGENCE, ex.kind());
        }

        @Test
        @DisplayName("No real root or no root in range")
        void noRoot() {
            Interpolation i = Interpolation.of(new double[] {-1, 0, 1}, new double[] {2, 1, 2});
            assertEquals(ErrorKind.NO_CONVERGENCE, assertThrows(MeeusException.class, i::root).kind());
            Interpolation j = Interpolation.of(new double[] {-1, 0, 1}, new double[] {-2, 3, 2});
            assertEquals(
                    ErrorKind.NO_CONVERGENCE,
                    assertThrows(MeeusException.class, () -> j.root(0.0, 1.0)).kind());
            Interpolation flat = Interpolation.of(4.0, 4.0, 4.0);
            assertEquals(ErrorKind.NO_CONVERGENCE, assertThrows(MeeusException.class, flat::root).kind());
        }
    }

    @Nested
    @DisplayName("Polynomial variant")
    class PolynomialTests {

        @Test
        @DisplayName("Root inside a range")
        void rootInRange() {
            Interpolation i = Interpolation.of(
                    new double[] {-3, 0, 2.5, 3.5}, new double[] {12, -3, -1.75, 2.25});
            assertEquals(3.0, i.root(0.0, 3.15), TOLERANCE);
        }

        @Test
        @DisplayName("Zero crossing of an angle from five samples (Meeus example 3.e)")
        void angleRoot() {
            Interpolation i = Interpolation.of(
                    new double[] {25, 26, 27, 28, 29},
                    new double[] {
                        -dms(1, 11, 21.23), -dms(0, 28, 12.31), dms(0, 16, 7.02),
                        dms(1, 1, 0.13), dms(1, 45, 46.33)
                    });
            assertEquals(26.6385869469, i.root(), 1e-9);
        }

        @Test
        @DisplayName("Sine table given out of order")
        void sineTable() {
            Interpolation i = Interpolation.of(
                    new double[] {29.43, 30.97, 27.69, 28.11, 31.58, 33.05},
                    new double[] {
                        0.4913598528, 0.5145891926, 0.4646875083,
                        0.4711658342, 0.5236885653, 0.5453707057
                    });
            assertEquals(0.5, i.evaluate(30.0), 1e-9);
            assertEquals(Math.sqrt(3.0) / 2.0, Math.toDegrees(i.derivative(30.0)), 1e-9);
        }

        @Test
        @DisplayName("Root and extremum of a cubic")
        void cubicRootAndExtremum() {
            double[] x = {0, 1, 2, 3, 4};
            double[] y = new double[x.length];
            for (int k = 0; k < x.length; k++) y[k] = cubic(x[k]);
            Interpolation i = Interpolation.of(x, y);
            assertEquals(1.5, i.root(), TOLERANCE);
            assertEquals(2.5, i.extremum(), TOLERANCE);
            assertEquals(cubic(1.7), i.evaluate(1.7), TOLERANCE);
        }

        @Test
        @DisplayName("Analytic derivative matches a centred difference")
        void derivativeMatchesDifference() {
            Interpolation i = Interpolation.of(
                    new double[] {0.0, 0.4, 1.1, 1.5, 2.3, 3.0},
                    new double[] {1.0, 1.5, 0.2, -0.7, 0.4, 2.0});
            double h = 1e-5;
            for (double t = 0.1; t < 3.0; t += 0.23) {
                double numeric = (i.evaluate(t + h) - i.evaluate(t - h)) / (2.0 * h);
                double analytic = i.derivative(t);
                assertEquals(analytic, numeric, 1e-6 * Math.max(1.0, Math.abs(analytic)), "t = " + t);
            }
        }

        @Test
        @DisplayName("No root in a range without one")
        void noRootInRange() {
            Interpolation i = Interpolation.of(
                    new double[] {-3, 0, 2.5, 3.5}, new double[] {12, -3, -1.75, 2.25});
            MeeusException ex = assertThrows(MeeusException.class, () -> i.root(0.5, 2.0));
            assertEquals(ErrorKind.NO_CONVERGENCE, ex.kind());
        }
    }

    // Helper methods

    private static double dms(int degrees, int minutes, double seconds) {
        return degrees + minutes / 60.0 + seconds / 3600.0;
    }

    private static double cubic(double t) {
        double u = t - 1.5;
        return u * u * u - 3.0 * u;
    }

    private static void assertInvalidSample(Executable call) {
        MeeusException ex = assertThrows(MeeusException.class, call);
        assertEquals(ErrorKind.INVALID_SAMPLE, ex.kind());
    }
}
