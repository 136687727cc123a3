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

import java.util.function.ToDoubleFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the instant where a smooth function of time crosses zero or reaches a
 * minimum or maximum.
 *
 * <p>Every step samples the function at three epochs, centre - step, centre and
 * centre + step, fits a parabola through them and moves the centre to the
 * parabola's root or extremum. The search ends once the move is shorter than
 * the tolerance. Equinoxes, stations and perihelion passages are all found this
 * way from a guess and a step of a few days.</p>
 *
 * <p>The function must be smooth over the sampling window. For angles that wrap
 * (longitudes) return a value continuous near the event, e.g. reduced to
 * (-180, 180].</p>
 */
public final class EventFinder {
    private static final Logger log = LoggerFactory.getLogger(EventFinder.class);

    /** Default convergence threshold, days (about one second). */
    public static final double DEFAULT_TOLERANCE_DAYS = 1e-5;
    /** Default iteration cap. */
    public static final int DEFAULT_MAX_ITERATIONS = 20;

    private EventFinder() {}

    /** Epoch where {@code f} is zero, with the default tolerance and iteration cap. */
    public static Event findRoot(ToDoubleFunction<Epoch> f, Epoch guess, double stepDays) {
        return findRoot(f, guess, stepDays, DEFAULT_TOLERANCE_DAYS, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Epoch where {@code f} is zero.
     *
     * @param f             function of time
     * @param guess         starting epoch
     * @param stepDays      sampling half-width, days
     * @param toleranceDays stop once the correction is smaller, days
     * @param maxIterations iteration cap
     * @throws MeeusException NO_CONVERGENCE if the cap is reached or the fitted
     *                        parabola has no root
     */
    public static Event findRoot(
            ToDoubleFunction<Epoch> f, Epoch guess, double stepDays,
            double toleranceDays, int maxIterations) {
        return refine(f, guess, stepDays, toleranceDays, maxIterations, false);
    }

    /** Epoch where {@code f} is extremal, with the default tolerance and iteration cap. */
    public static Event findExtremum(ToDoubleFunction<Epoch> f, Epoch guess, double stepDays) {
        return findExtremum(f, guess, stepDays, DEFAULT_TOLERANCE_DAYS, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Epoch where {@code f} has a minimum or maximum.
     *
     * @throws MeeusException NO_CONVERGENCE if the cap is reached or the samples
     *                        are collinear
     */
    public static Event findExtremum(
            ToDoubleFunction<Epoch> f, Epoch guess, double stepDays,
            double toleranceDays, int maxIterations) {
        return refine(f, guess, stepDays, toleranceDays, maxIterations, true);
    }

    private static Event refine(
            ToDoubleFunction<Epoch> f, Epoch guess, double stepDays,
            double toleranceDays, int maxIterations, boolean extremum) {
        if (!(stepDays > 0.0) || !Double.isFinite(stepDays)) {
            throw MeeusException.domainRange("Step must be positive and finite, got " + stepDays);
        }
        if (!(toleranceDays > 0.0) || maxIterations < 1) {
            throw MeeusException.domainRange(
                    "Tolerance must be positive and maxIterations at least 1, got "
                            + toleranceDays + " and " + maxIterations);
        }
        double[] offsets = {-stepDays, 0.0, stepDays};
        Epoch centre = guess;
        for (int iter = 1; iter <= maxIterations; iter++) {
            double[] values = {
                f.applyAsDouble(centre.minusDays(stepDays)),
                f.applyAsDouble(centre),
                f.applyAsDouble(centre.plusDays(stepDays))
            };
            Interpolation parabola = Interpolation.of(offsets, values);
            double t = extremum ? parabola.extremum() : parabola.root();
            Epoch refined = centre.plusDays(t);
            if (Math.abs(t) < toleranceDays) {
                return new Event(refined, f.applyAsDouble(refined), iter);
            }
            centre = refined;
        }
        log.debug(
                "{} search did not converge after {} iterations, last epoch {}",
                extremum ? "Extremum" : "Root", maxIterations, centre);
        throw MeeusException.noConvergence(
                "Event search did not converge within " + maxIterations + " iterations");
    }

    /**
     * An event found by {@link EventFinder}.
     *
     * @param epoch      when it happens
     * @param value      the function value there
     * @param iterations refinement steps used
     */
    public record Event(Epoch epoch, double value, int iterations) {}
}
