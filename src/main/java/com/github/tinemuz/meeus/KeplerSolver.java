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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves Kepler's equation E - e·sin E = M for elliptic orbits.
 *
 * <p>Newton-Raphson iteration from Danby's starting value
 * E₀ = M + 0.85·e·sign(sin M), which converges for every eccentricity in
 * [0, 1) including the near-parabolic ones where the fixed-point iteration
 * crawls. The mean anomaly is reduced to (-π, π] first, and both anomalies come
 * back in that range.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * KeplerSolver.Solution s = KeplerSolver.solveDegrees(0.1, 5.0);
 * double nu = s.trueAnomalyDeg; // 6.139762...
 * </pre>
 */
public final class KeplerSolver {
    private static final Logger log = LoggerFactory.getLogger(KeplerSolver.class);

    /** Default convergence threshold on |ΔE|, radians. */
    public static final double DEFAULT_TOLERANCE = 1e-9;
    /** Default iteration cap. */
    public static final int DEFAULT_MAX_ITERATIONS = 50;

    private static final double TWO_PI = 2.0 * Math.PI;

    private KeplerSolver() {}

    /**
     * Solve with the default tolerance and iteration cap.
     *
     * @param eccentricity e in [0, 1)
     * @param meanAnomaly  M in radians, any finite value
     */
    public static Solution solve(double eccentricity, double meanAnomaly) {
        return solve(eccentricity, meanAnomaly, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    /** Same as {@link #solve(double, double)} with the mean anomaly in degrees. */
    public static Solution solveDegrees(double eccentricity, double meanAnomalyDeg) {
        return solveDegrees(eccentricity, meanAnomalyDeg, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Same as {@link #solve(double, double, double, int)} with the mean anomaly in
     * degrees. The tolerance stays in radians.
     */
    public static Solution solveDegrees(
            double eccentricity, double meanAnomalyDeg, double tolerance, int maxIterations) {
        if (!Double.isFinite(meanAnomalyDeg)) {
            throw MeeusException.domainRange("Mean anomaly must be finite, got " + meanAnomalyDeg);
        }
        return solve(eccentricity, Math.toRadians(meanAnomalyDeg), tolerance, maxIterations);
    }

    /**
     * Solve Kepler's equation.
     *
     * @param eccentricity  e in [0, 1)
     * @param meanAnomaly   M in radians, any finite value
     * @param tolerance     stop once |ΔE| falls below this, radians
     * @param maxIterations iteration cap
     * @throws MeeusException INVALID_ECCENTRICITY for e outside [0, 1),
     *                        DOMAIN_RANGE for a non-finite M, NO_CONVERGENCE
     *                        when the cap is reached, DOMAIN_RANGE for a
     *                        non-positive tolerance or cap
     */
    public static Solution solve(
            double eccentricity, double meanAnomaly, double tolerance, int maxIterations) {
        if (!(eccentricity >= 0.0 && eccentricity < 1.0)) {
            throw MeeusException.invalidEccentricity(eccentricity);
        }
        if (!Double.isFinite(meanAnomaly)) {
            throw MeeusException.domainRange("Mean anomaly must be finite, got " + meanAnomaly);
        }
        if (!(tolerance > 0.0) || maxIterations < 1) {
            throw MeeusException.domainRange(
                    "Tolerance must be positive and maxIterations at least 1, got "
                            + tolerance + " and " + maxIterations);
        }

        double m = reduce(meanAnomaly);
        double e = m + 0.85 * eccentricity * Math.signum(Math.sin(m));
        for (int iter = 1; iter <= maxIterations; iter++) {
            double delta = (e - eccentricity * Math.sin(e) - m) / (1.0 - eccentricity * Math.cos(e));
            e -= delta;
            if (Math.abs(delta) < tolerance) return new Solution(eccentricity, m, clamp(e), iter);
        }
        log.debug(
                "Kepler iteration did not converge: e={}, M={} rad, last E={} rad after {} steps",
                eccentricity, m, e, maxIterations);
        throw MeeusException.noConvergence(String.format(
                "Kepler's equation did not converge within %d iterations (e=%s, M=%s rad)",
                maxIterations, eccentricity, m));
    }

    // Reduce an angle to (-π, π]
    private static double reduce(double angle) {
        double r = Math.IEEEremainder(angle, TWO_PI);
        return r <= -Math.PI ? r + TWO_PI : r;
    }

    // |E| <= π whenever |M| <= π; only rounding can step past it. -π is reported as π.
    private static double clamp(double eccentricAnomaly) {
        if (eccentricAnomaly > Math.PI || eccentricAnomaly <= -Math.PI) return Math.PI;
        return eccentricAnomaly;
    }

    /**
     * Immutable result of {@link #solve}. Angles are given in radians and in
     * degrees, all in (-180°, 180°].
     */
    public static final class Solution {
        /** Eccentricity the equation was solved for. */
        public final double eccentricity;

        /** Mean anomaly M reduced to (-π, π], radians. */
        public final double meanAnomaly;

        /** Eccentric anomaly E, radians. */
        public final double eccentricAnomaly;

        /** True anomaly ν, radians. */
        public final double trueAnomaly;

        /** Eccentric anomaly E, degrees. */
        public final double eccentricAnomalyDeg;

        /** True anomaly ν, degrees. */
        public final double trueAnomalyDeg;

        /** Newton steps taken. */
        public final int iterations;

        private Solution(double ecc, double m, double e, int iterations) {
            this.eccentricity = ecc;
            this.meanAnomaly = m;
            this.eccentricAnomaly = e;
            this.trueAnomaly = 2.0 * Math.atan2(
                    Math.sqrt(1.0 + ecc) * Math.sin(e / 2.0),
                    Math.sqrt(1.0 - ecc) * Math.cos(e / 2.0));
            this.eccentricAnomalyDeg = Math.toDegrees(e);
            this.trueAnomalyDeg = Math.toDegrees(this.trueAnomaly);
            this.iterations = iterations;
        }

        /**
         * Distance from the focus, r = a(1 - e·cos E), in the unit of the semi-major
         * axis.
         */
        public double radiusVector(double semiMajorAxis) {
            return semiMajorAxis * (1.0 - eccentricity * Math.cos(eccentricAnomaly));
        }

        @Override
        public String toString() {
            return String.format(
                    "Solution{E=%.9f°, ν=%.9f°, iterations=%d}",
                    eccentricAnomalyDeg, trueAnomalyDeg, iterations);
        }
    }
}
