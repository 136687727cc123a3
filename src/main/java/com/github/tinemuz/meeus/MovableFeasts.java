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

import java.time.MonthDay;

/**
 * Dates of the movable feasts that follow the lunar calendar.
 *
 * <p>All dates are in the calendar in force during the requested year: Julian
 * up to 1582, Gregorian from 1583 on.</p>
 */
public final class MovableFeasts {
    // Days from 15 Nisan to 1 Tishri of the following Jewish year
    private static final int PESACH_TO_NEW_YEAR = 163;

    private MovableFeasts() {}

    /**
     * Date of Easter Sunday.
     *
     * <p>From 1583 on the Gregorian computus is used (Meeus, chapter 8); earlier
     * years use the Julian computus, which repeats every 532 years.</p>
     *
     * @param year Christian year, 1 or later
     * @throws MeeusException if year is before 1
     */
    public static MonthDay easter(int year) {
        checkYear(year);
        if (year >= 1583) {
            int a = year % 19;
            int b = year / 100;
            int c = year % 100;
            int d = b / 4;
            int e = b % 4;
            int f = (b + 8) / 25;
            int g = (b - f + 1) / 3;
            int h = (19 * a + b - d - g + 15) % 30;
            int i = c / 4;
            int k = c % 4;
            int l = (32 + 2 * e + 2 * i - h - k) % 7;
            int m = (a + 11 * h + 22 * l) / 451;
            int n = h + l - 7 * m + 114;
            return MonthDay.of(n / 31, n % 31 + 1);
        }
        int a = year % 4;
        int b = year % 7;
        int c = year % 19;
        int d = (19 * c + 15) % 30;
        int e = (2 * a + 4 * b - d + 34) % 7;
        int n = d + e + 114;
        return MonthDay.of(n / 31, n % 31 + 1);
    }

    /**
     * Date of Pesach (15 Nisan) in the given Christian year, using the Gauss
     * formula as given by Meeus, chapter 9.
     *
     * @param year Christian year, 1 or later
     * @throws MeeusException if year is before 1
     */
    public static MonthDay pesach(int year) {
        checkYear(year);
        int c = year / 100;
        int s = CalendarSystem.forYear(year) == CalendarSystem.GREGORIAN
                ? (int) Math.floor((3.0 * c - 5.0) / 4.0)
                : 0;
        int a = (12 * year + 12) % 19;
        int b = year % 4;
        double q = -1.904412361576 + 1.554241796621 * a + 0.25 * b
                - 0.003177794022 * year + s;
        int iq = (int) Math.floor(q);
        double r = q - iq;
        int j = Math.floorMod(iq + 3 * year + 5 * b + 2 - s, 7);

        int d;
        if (j == 2 || j == 4 || j == 6) {
            d = iq + 23;
        } else if (j == 1 && a > 6 && r >= 0.632870370) {
            d = iq + 24;
        } else if (j == 0 && a > 11 && r >= 0.897723765) {
            d = iq + 23;
        } else {
            d = iq + 22;
        }
        return d > 31 ? MonthDay.of(4, d - 31) : MonthDay.of(3, d);
    }

    /**
     * Date of Rosh Hashanah (1 Tishri) falling in the given Christian year, 163
     * days after that year's Pesach.
     *
     * @param year Christian year, 1 or later
     */
    public static MonthDay jewishNewYear(int year) {
        MonthDay p = pesach(year);
        double doy = Epoch.dayOfYear(year, p.getMonthValue(), p.getDayOfMonth()) + PESACH_TO_NEW_YEAR;
        CalendarDate date = Epoch.dateFromDayOfYear(year, doy);
        return MonthDay.of(date.month(), date.dayOfMonth());
    }

    private static void checkYear(int year) {
        if (year < 1) {
            throw MeeusException.domainRange("Year must be 1 or later, got " + year);
        }
    }
}
