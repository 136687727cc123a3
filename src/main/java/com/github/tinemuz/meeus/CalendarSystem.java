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
 * The two Christian calendars used by the Julian Day algorithms.
 *
 * <p>Dates before 1582 October 5 are Julian, dates from 1582 October 15 on are
 * Gregorian. The ten days in between were dropped by the reform and do not exist
 * when the calendar is selected automatically.</p>
 */
public enum CalendarSystem {
    JULIAN {
        @Override
        public boolean isLeapYear(int year) {
            return Math.floorMod(year, 4) == 0;
        }
    },
    GREGORIAN {
        @Override
        public boolean isLeapYear(int year) {
            return Math.floorMod(year, 4) == 0
                    && (Math.floorMod(year, 100) != 0 || Math.floorMod(year, 400) == 0);
        }
    };

    /** First Julian Day number (at noon) of the Gregorian calendar, 1582-10-15. */
    static final double GREGORIAN_START_JD = 2299161.0;

    private static final int[] DAYS_IN_MONTH = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    /**
     * Whether the year has 366 days in this calendar.
     *
     * @param year astronomical year (0 = 1 BCE)
     * @return true for leap years
     */
    public abstract boolean isLeapYear(int year);

    /**
     * Number of days in the given month of this calendar.
     *
     * @param year  astronomical year
     * @param month month in [1, 12]
     * @return 28 to 31
     * @throws MeeusException if month is out of range
     */
    public int daysInMonth(int year, int month) {
        checkMonth(month);
        if (month == 2 && isLeapYear(year)) return 29;
        return DAYS_IN_MONTH[month - 1];
    }

    /**
     * Calendar in force on the given date.
     *
     * @throws MeeusException for the days 1582-10-05 to 1582-10-14, which never existed
     */
    public static CalendarSystem forDate(int year, int month, double day) {
        if (year != 1582 || month != 10) {
            return year < 1582 || (year == 1582 && month < 10) ? JULIAN : GREGORIAN;
        }
        if (day < 5.0) return JULIAN;
        if (day >= 15.0) return GREGORIAN;
        throw MeeusException.invalidDate(
                "1582-10-" + (int) day + " does not exist: the Gregorian reform skipped Oct 5-14");
    }

    /**
     * Calendar in force for leap-year purposes during the given year. 1582 is not a
     * leap year in either calendar, so the split at 1583 is exact.
     */
    public static CalendarSystem forYear(int year) {
        return year < 1583 ? JULIAN : GREGORIAN;
    }

    static void checkMonth(int month) {
        if (month < 1 || month > 12) {
            throw MeeusException.invalidDate("Month must be in [1, 12], got " + month);
        }
    }
}
