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
 * Conversions between the Julian, Gregorian and Islamic (Moslem) calendars.
 *
 * <p>The Islamic calendar here is the arithmetical one of Meeus, chapter 9: a
 * 30-year cycle with 11 leap years. Observational calendars may differ by a day
 * or two. Results are whole dates; no time of day is involved.</p>
 */
public final class CalendarConversions {
    /** Julian Day of 622-07-16 (Julian), the first day of the Islamic era. */
    static final double ISLAMIC_EPOCH_JD = 1948439.5;

    private CalendarConversions() {}

    /**
     * Gregorian date of the day given in the Julian calendar. Both dates are
     * proleptic where the calendar was not in use.
     *
     * @throws MeeusException if the Julian date is invalid
     */
    public static CalendarDate julianToGregorian(int year, int month, int day) {
        double jd = julianDay(year, month, day, CalendarSystem.JULIAN);
        return JulianDay.toDate(jd, CalendarSystem.GREGORIAN);
    }

    /**
     * Julian date of the day given in the Gregorian calendar.
     *
     * @throws MeeusException if the Gregorian date is invalid
     */
    public static CalendarDate gregorianToJulian(int year, int month, int day) {
        double jd = julianDay(year, month, day, CalendarSystem.GREGORIAN);
        return JulianDay.toDate(jd, CalendarSystem.JULIAN);
    }

    /**
     * Julian calendar date of an Islamic date.
     *
     * @param year  Islamic year, 1 or later
     * @param month Islamic month in [1, 12]
     * @param day   day in [1, 30]
     * @throws MeeusException if a field is out of range
     */
    public static CalendarDate islamicToJulian(int year, int month, int day) {
        checkIslamic(year, month, day);
        int n = day + (int) Math.floor(29.5001 * (month - 1) + 0.99);
        int q = year / 30;
        int r = year % 30;
        int a = (11 * r + 3) / 30;
        int w = 404 * q + 354 * r + 208 + a;
        int q1 = w / 1461;
        int q2 = w % 1461;
        int g = 621 + 4 * (7 * q + q1);
        int k = (int) Math.floor(q2 / 365.2422);
        int e = (int) Math.floor(365.2422 * k);
        int j = q2 - e + n - 1;
        int x = g + k;
        if (j > 366 && x % 4 == 0) {
            j -= 366;
            x++;
        } else if (j > 365 && x % 4 != 0) {
            j -= 365;
            x++;
        }
        return julianDateFromDayOfYear(x, j);
    }

    /** Gregorian date of an Islamic date. */
    public static CalendarDate islamicToGregorian(int year, int month, int day) {
        CalendarDate julian = islamicToJulian(year, month, day);
        return julianToGregorian(julian.year(), julian.month(), julian.dayOfMonth());
    }

    /**
     * Islamic date of a day given in the Julian calendar.
     *
     * @return the Islamic year, month and day
     * @throws MeeusException if the date is invalid or before 622-07-16
     */
    public static CalendarDate julianToIslamic(int year, int month, int day) {
        double jd = julianDay(year, month, day, CalendarSystem.JULIAN);
        if (jd < ISLAMIC_EPOCH_JD) {
            throw MeeusException.domainRange(
                    "Julian date " + year + "-" + month + "-" + day
                            + " is before the Islamic era (622-07-16)");
        }
        // Estimate the year from the mean cycle, then settle it against year starts
        int h = (int) Math.floor((30.0 * (jd - ISLAMIC_EPOCH_JD) + 10646.0) / 10631.0);
        while (h > 1 && islamicJulianDay(h, 1, 1) > jd) h--;
        while (islamicJulianDay(h + 1, 1, 1) <= jd) h++;

        int m = Math.min(12, (int) ((jd - islamicJulianDay(h, 1, 1)) / 29.5) + 1);
        while (m > 1 && islamicJulianDay(h, m, 1) > jd) m--;
        while (m < 12 && islamicJulianDay(h, m + 1, 1) <= jd) m++;

        int d = (int) (jd - islamicJulianDay(h, m, 1)) + 1;
        return new CalendarDate(h, m, d);
    }

    /** Islamic date of a day given in the Gregorian calendar. */
    public static CalendarDate gregorianToIslamic(int year, int month, int day) {
        CalendarDate julian = gregorianToJulian(year, month, day);
        return julianToIslamic(julian.year(), julian.month(), julian.dayOfMonth());
    }

    private static double julianDay(int year, int month, int day, CalendarSystem calendar) {
        int days = calendar.daysInMonth(year, month);
        if (day < 1 || day > days) {
            throw MeeusException.invalidDate(
                    "Day must be in [1, " + days + "] for " + calendar + " "
                            + year + "-" + month + ", got " + day);
        }
        return JulianDay.of(year, month, day, calendar);
    }

    private static double islamicJulianDay(int year, int month, int day) {
        CalendarDate julian = islamicToJulian(year, month, day);
        return JulianDay.of(julian.year(), julian.month(), julian.dayOfMonth(), CalendarSystem.JULIAN);
    }

    private static void checkIslamic(int year, int month, int day) {
        if (year < 1) {
            throw MeeusException.domainRange("Islamic year must be 1 or later, got " + year);
        }
        if (month < 1 || month > 12) {
            throw MeeusException.invalidDate("Islamic month must be in [1, 12], got " + month);
        }
        if (day < 1 || day > 30) {
            throw MeeusException.invalidDate("Islamic day must be in [1, 30], got " + day);
        }
    }

    // Day of year in the Julian calendar, whatever calendar was in force that year
    private static CalendarDate julianDateFromDayOfYear(int year, int dayOfYear) {
        int k = CalendarSystem.JULIAN.isLeapYear(year) ? 1 : 2;
        int month = dayOfYear < 32 ? 1 : (int) Math.floor(9.0 * (k + dayOfYear) / 275.0 + 0.98);
        int day = dayOfYear - (275 * month) / 9 + k * ((month + 9) / 12) + 30;
        return new CalendarDate(year, month, day);
    }
}
