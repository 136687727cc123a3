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
 * Julian Day number of a calendar date and back (Meeus, chapter 7). No time
 * scale handling here; {@link Epoch} adds that on top.
 */
final class JulianDay {
    private JulianDay() {}

    /**
     * Julian Day for the given date in the given calendar. Valid for years from
     * -4712 on.
     */
    static double of(int year, int month, double day, CalendarSystem calendar) {
        int y = year;
        int m = month;
        if (m <= 2) {
            y -= 1;
            m += 12;
        }
        double b = 0.0;
        if (calendar == CalendarSystem.GREGORIAN) {
            double a = Math.floor(y / 100.0);
            b = 2.0 - a + Math.floor(a / 4.0);
        }
        return Math.floor(365.25 * (y + 4716.0)) + Math.floor(30.6001 * (m + 1.0)) + day + b - 1524.5;
    }

    /**
     * Calendar date of a Julian Day.
     *
     * @param jd       Julian Day, must be >= -0.5
     * @param calendar calendar to express the date in, or null to use the one in
     *                 force on that day
     */
    static CalendarDate toDate(double jd, CalendarSystem calendar) {
        if (!(jd + 0.5 >= 0.0)) {
            throw MeeusException.domainRange(
                    "Julian Day " + jd + " is before the start of the Julian period");
        }
        double shifted = jd + 0.5;
        double z = Math.floor(shifted);
        double f = shifted - z;
        boolean julian = calendar == null
                ? z < CalendarSystem.GREGORIAN_START_JD
                : calendar == CalendarSystem.JULIAN;
        double a = z;
        if (!julian) {
            double alpha = Math.floor((z - 1867216.25) / 36524.25);
            a = z + 1.0 + alpha - Math.floor(alpha / 4.0);
        }
        double b = a + 1524.0;
        double c = Math.floor((b - 122.1) / 365.25);
        double d = Math.floor(365.25 * c);
        double e = Math.floor((b - d) / 30.6001);
        double day = b - d - Math.floor(30.6001 * e) + f;
        int month = (int) (e < 14.0 ? e - 1.0 : e - 13.0);
        int year = (int) (month > 2 ? c - 4716.0 : c - 4715.0);
        return new CalendarDate(year, month, day);
    }
}
