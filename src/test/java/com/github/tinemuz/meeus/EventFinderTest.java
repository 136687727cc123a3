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

import com.github.tinemuz.meeus.EventFinder.Event;
import java.util.function.ToDoubleFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for EventFinder on a solar equinox and a Keplerian perihelion passage. */
class EventFinderTest {

    // Test orbit: a = 1.5 AU, e = 0.3, period 400 days, perihelion at T0
    private static final double SEMI_MAJOR_AXIS = 1.5;
    private static final double ECCENTRICITY = 0.3;
    private static final double PERIOD_DAYS = 400.0;
    private static final double PERIHELION_JDE = 2451600.25;

    @Nested
    @DisplayName("Roots")
    class RootTests {

        @Test
        @DisplayName("March equinox 2019 from the low-accuracy Sun")
        void marchEquinox() {
            Epoch guess = Epoch.fromCalendar(2019, 3, 18, TimeScale.TT);
            Event event = EventFinder.findRoot(EventFinderTest::apparentSolarLongitude, guess, 1.0);
            // 2019-03-20 21:58 UT
            assertEquals(2458563.416, event.epoch().jde(), 0.02);
            assertEquals(0.0, event.value(), 1e-6);
            assertTrue(event.iterations() >= 1 && event.iterations() <= EventFinder.DEFAULT_MAX_ITERATIONS);
        }

        @Test
        @DisplayName("Step size only changes the path, not the answer")
        void stepIndependence() {
            Epoch guess = Epoch.fromCalendar(2019, 3, 18, TimeScale.TT);
            Event narrow = EventFinder.findRoot(EventFinderTest::apparentSolarLongitude, guess, 1.0);
            Event wide = EventFinder.findRoot(EventFinderTest::apparentSolarLongitude, guess, 5.0);
            assertEquals(narrow.epoch().jde(), wide.epoch().jde(), 1e-5);
        }

        @Test
        @DisplayName("Refining a converged epoch stays put")
        void idempotent() {
            Epoch guess = Epoch.fromCalendar(2019, 3, 18, TimeScale.TT);
            Event first = EventFinder.findRoot(EventFinderTest::apparentSolarLongitude, guess, 1.0);
            Event second = EventFinder.findRoot(EventFinderTest::apparentSolarLongitude, first.epoch(), 1.0);
            assertEquals(first.epoch().jde(), second.epoch().jde(), EventFinder.DEFAULT_TOLERANCE_DAYS);
            assertEquals(1, second.iterations());
        }
    }

    @Nested
    @DisplayName("Extrema")
    class ExtremumTests {

        @Test
        @DisplayName("Perihelion is the minimum of the radius vector")
        void perihelion() {
            Epoch guess = Epoch.ofJde(PERIHELION_JDE + 3.7);
            Event event = EventFinder.findExtremum(EventFinderTest::radiusVector, guess, 2.0);
            assertEquals(PERIHELION_JDE, event.epoch().jde(), 1e-4);
            assertEquals(SEMI_MAJOR_AXIS * (1.0 - ECCENTRICITY), event.value(), 1e-9);
        }

        @Test
        @DisplayName("Aphelion is the maximum of the radius vector")
        void aphelion() {
            Epoch guess = Epoch.ofJde(PERIHELION_JDE + PERIOD_DAYS / 2.0 - 6.0);
            Event event = EventFinder.findExtremum(EventFinderTest::radiusVector, guess, 3.0);
            assertEquals(PERIHELION_JDE + PERIOD_DAYS / 2.0, event.epoch().jde(), 1e-4);
            assertEquals(SEMI_MAJOR_AXIS * (1.0 + ECCENTRICITY), event.value(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Iteration cap is reported as non-convergence")
        void iterationCap() {
            Epoch guess = Epoch.ofJde(PERIHELION_JDE + 3.7);
            MeeusException ex = assertThrows(
                    MeeusException.class,
                    () -> EventFinder.findExtremum(EventFinderTest::radiusVector, guess, 2.0, 1e-5, 1));
            assertEquals(ErrorKind.NO_CONVERGENCE, ex.kind());
        }

        @Test
        @DisplayName("A linear function has no extremum")
        void collinear() {
            ToDoubleFunction<Epoch> linear = e -> e.jde() - 2451545.0;
            MeeusException ex = assertThrows(
                    MeeusException.class,
                    () -> EventFinder.findExtremum(linear, Epoch.ofJde(2451545.0), 1.0));
            assertEquals(ErrorKind.NO_CONVERGENCE, ex.kind());
        }

        @Test
        @DisplayName("Non-finite samples are rejected")
        void nonFinite() {
            MeeusException ex = assertThrows(
                    MeeusException.class,
                    () -> EventFinder.findRoot(e -> Double.NaN, Epoch.ofJde(2451545.0), 1.0));
            assertEquals(ErrorKind.INVALID_SAMPLE, ex.kind());
        }

        @Test
        @DisplayName("Step must be positive")
        void invalidStep() {
            MeeusException ex = assertThrows(
                    MeeusException.class,
                    () -> EventFinder.findRoot(EventFinderTest::radiusVector, Epoch.ofJde(2451545.0), 0.0));
            assertEquals(ErrorKind.DOMAIN_RANGE, ex.kind());
        }
    }

    // Helper methods

    /** Apparent geometric longitude of the Sun, Meeus chapter 25 low accuracy, in (-180, 180]. */
    private static double apparentSolarLongitude(Epoch epoch) {
        double t = epoch.centuriesSinceJ2000();
        double l0 = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double m = Math.toRadians(357.52911 + 35999.05029 * t - 0.0001537 * t * t);
        double c = (1.914602 - 0.004817 * t - 0.000014 * t * t) * Math.sin(m)
                + (0.019993 - 0.000101 * t) * Math.sin(2 * m)
                + 0.000289 * Math.sin(3 * m);
        double omega = Math.toRadians(125.04 - 1934.136 * t);
        double lambda = l0 + c - 0.00569 - 0.00478 * Math.sin(omega);
        double r = Epoch.normalizeDegrees(lambda);
        return r > 180.0 ? r - 360.0 : r;
    }

    private static double radiusVector(Epoch epoch) {
        double meanAnomaly = 2.0 * Math.PI * epoch.minus(Epoch.ofJde(PERIHELION_JDE)) / PERIOD_DAYS;
        return KeplerSolver.solve(ECCENTRICITY, meanAnomaly).radiusVector(SEMI_MAJOR_AXIS);
    }
}
