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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MeeusExceptionTest {

    @Test
    @DisplayName("Each factory sets its kind")
    void factories() {
        assertEquals(ErrorKind.INVALID_DATE, MeeusException.invalidDate("x").kind());
        assertEquals(ErrorKind.INVALID_SAMPLE, MeeusException.invalidSample("x").kind());
        assertEquals(ErrorKind.NO_CONVERGENCE, MeeusException.noConvergence("x").kind());
        assertEquals(ErrorKind.INVALID_ECCENTRICITY, MeeusException.invalidEccentricity(1.2).kind());
        assertEquals(ErrorKind.DOMAIN_RANGE, MeeusException.domainRange("x").kind());
    }

    @Test
    @DisplayName("String forms carry the kind")
    void stringForms() {
        assertEquals("no-convergence", ErrorKind.NO_CONVERGENCE.value());
        MeeusException ex = MeeusException.invalidEccentricity(1.2);
        assertEquals("Eccentricity must be in [0, 1), got 1.2", ex.getMessage());
        assertEquals("MeeusException[invalid-eccentricity]: Eccentricity must be in [0, 1), got 1.2", ex.toString());
    }
}
