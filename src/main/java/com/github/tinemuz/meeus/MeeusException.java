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
 * Exception thrown when a calendar conversion, interpolation or iterative solver
 * cannot produce a result.
 *
 * <p>Every failure is raised to the immediate caller. The {@link #kind()} tells
 * callers such as {@link EventFinder} whether retrying with another seed or step
 * makes sense ({@link ErrorKind#NO_CONVERGENCE}) or the input itself is wrong.</p>
 */
public final class MeeusException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** The error kind. */
    private final ErrorKind kind;

    private MeeusException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates an error for malformed calendar input.
     *
     * @param message the error message
     * @return a new MeeusException of kind {@link ErrorKind#INVALID_DATE}
     */
    public static MeeusException invalidDate(String message) {
        return new MeeusException(ErrorKind.INVALID_DATE, message);
    }

    /**
     * Creates an error for interpolation samples that break the sample rules.
     *
     * @param message the error message
     * @return a new MeeusException of kind {@link ErrorKind#INVALID_SAMPLE}
     */
    public static MeeusException invalidSample(String message) {
        return new MeeusException(ErrorKind.INVALID_SAMPLE, message);
    }

    /**
     * Creates an error for an iteration that did not converge.
     *
     * @param message the error message
     * @return a new MeeusException of kind {@link ErrorKind#NO_CONVERGENCE}
     */
    public static MeeusException noConvergence(String message) {
        return new MeeusException(ErrorKind.NO_CONVERGENCE, message);
    }

    /**
     * Creates an error for an eccentricity outside the elliptic range.
     *
     * @param eccentricity the rejected value
     * @return a new MeeusException of kind {@link ErrorKind#INVALID_ECCENTRICITY}
     */
    public static MeeusException invalidEccentricity(double eccentricity) {
        return new MeeusException(
                ErrorKind.INVALID_ECCENTRICITY,
                "Eccentricity must be in [0, 1), got " + eccentricity);
    }

    /**
     * Creates an error for input outside the range an algorithm is defined for.
     *
     * @param message the error message
     * @return a new MeeusException of kind {@link ErrorKind#DOMAIN_RANGE}
     */
    public static MeeusException domainRange(String message) {
        return new MeeusException(ErrorKind.DOMAIN_RANGE, message);
    }

    /**
     * Returns the kind of error.
     *
     * @return the error kind
     */
    public ErrorKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "MeeusException[" + kind + "]: " + getMessage();
    }
}
