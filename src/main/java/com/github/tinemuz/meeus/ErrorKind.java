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

/** The type of failure reported by a {@link MeeusException}. */
public enum ErrorKind {
    /** Calendar fields out of range or a date that does not exist. */
    INVALID_DATE("invalid-date"),
    /** Interpolation samples violate the count, ordering or uniqueness rules. */
    INVALID_SAMPLE("invalid-sample"),
    /** An iterative solver ran out of its iteration budget or has no solution. */
    NO_CONVERGENCE("no-convergence"),
    /** Orbital eccentricity outside [0, 1). */
    INVALID_ECCENTRICITY("invalid-eccentricity"),
    /** Input outside the range where a table or algorithm is defined. */
    DOMAIN_RANGE("domain-range");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    /**
     * Returns the lowercase string representation.
     *
     * @return the kind as a lowercase, hyphenated string
     */
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
