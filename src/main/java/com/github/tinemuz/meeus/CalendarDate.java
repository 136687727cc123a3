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
 * A calendar date whose day may carry a fraction (12h = .5).
 *
 * <p>Years use astronomical numbering: year 0 is 1 BCE, year -1 is 2 BCE. The
 * record does not know its calendar; the method that produced it documents which
 * calendar the fields belong to.</p>
 *
 * @param year  astronomical year
 * @param month month in [1, 12]
 * @param day   day of month, fraction included
 */
public record CalendarDate(int year, int month, double day) {

    public CalendarDate {
        CalendarSystem.checkMonth(month);
        if (!Double.isFinite(day)) {
            throw MeeusException.invalidDate("Day must be finite, got " + day);
        }
    }

    /** Whole day of month, fraction dropped. */
    public int dayOfMonth() {
        return (int) Math.floor(day);
    }

    /** Fraction of the day elapsed since 0h, in [0, 1). */
    public double dayFraction() {
        return day - Math.floor(day);
    }
}
