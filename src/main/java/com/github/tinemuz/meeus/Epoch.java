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

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.util.Locale;

/**
 * An instant on the uniform time axis of Terrestrial Time, stored as a Julian
 * Ephemeris Day (JDE).
 *
 * <p>Epochs are immutable. Calendar input is treated as UTC unless
 * {@link TimeScale#TT} is given: the UTC reading is moved to TT by adding
 * TT - TAI (32.184 s) and, from 1972 on, TAI - UTC taken from
 * {@link LeapSeconds}. Calendar views apply the inverse correction for the scale
 * asked for, so {@code fromCalendar(d, scale).toCalendar(scale)} returns
 * {@code d}.</p>
 *
 * <p>The calendar is chosen from the date itself: Julian before 1582 October 5,
 * Gregorian from 1582 October 15. Years use astronomical numbering (0 = 1 BCE).
 * With a JDE in the millions a double resolves roughly 10 ms, which is enough
 * for the algorithms built on top.</p>
 *
 * <p>Equality and ordering compare the stored JDE exactly; two epochs a
 * nanosecond apart are different.</p>
 */
public final class Epoch implements Comparable<Epoch> {
    /** JDE of the standard epoch J2000.0 (2000 January 1.5 TT). */
    public static final double J2000 = 2451545.0;
    /** Days in a Julian century. */
    public static final double DAYS_PER_CENTURY = 36525.0;
    /** Offset between a JDE and a Modified Julian Day. */
    public static final double MJD_OFFSET = 2400000.5;

    static final double SECONDS_PER_DAY = 86400.0;

    // Earliest year the Julian Day formula handles (JD 0 is -4712 January 1.5)
    private static final int MIN_YEAR = -4712;

    private final double jde;

    private Epoch(double jde) {
        // -0.0 and 0.0 are the same instant
        this.jde = jde + 0.0;
    }

    /**
     * Epoch for a raw Julian Ephemeris Day.
     *
     * @throws MeeusException if the value is NaN or infinite
     */
    public static Epoch ofJde(double jde) {
        if (!Double.isFinite(jde)) {
            throw MeeusException.domainRange("JDE must be finite, got " + jde);
        }
        return new Epoch(jde);
    }

    /**
     * Epoch for a UTC calendar date, calendar chosen automatically.
     *
     * @param year  astronomical year, -4712 or later
     * @param month month in [1, 12]
     * @param day   day of month with fraction, in [0, days in month + 1)
     * @throws MeeusException if a field is out of range
     */
    public static Epoch fromCalendar(int year, int month, double day) {
        return fromCalendar(year, month, day, TimeScale.UTC, null);
    }

    /** Epoch for a calendar date on the given time scale, calendar chosen automatically. */
    public static Epoch fromCalendar(int year, int month, double day, TimeScale scale) {
        return fromCalendar(year, month, day, scale, null);
    }

    /** Epoch for a calendar date on the given time scale with the month given by name. */
    public static Epoch fromCalendar(int year, Month month, double day, TimeScale scale) {
        return fromCalendar(year, month.getValue(), day, scale, null);
    }

    /**
     * Epoch for a calendar date on the given scale.
     *
     * @param calendar calendar the fields are expressed in; null selects the
     *                 calendar in force on that date
     * @throws MeeusException if a field is out of range or the date falls in the
     *                        days skipped by the Gregorian reform
     */
    public static Epoch fromCalendar(
            int year, int month, double day, TimeScale scale, CalendarSystem calendar) {
        double jd = julianDay(year, month, day, calendar);
        return new Epoch(jd + scale.secondsToTerrestrial(year, month) / SECONDS_PER_DAY);
    }

    /**
     * Epoch for a wall-clock reading.
     *
     * @throws MeeusException if hour is outside [0, 23], minute outside [0, 59],
     *                        second outside [0, 60) or the date is invalid
     */
    public static Epoch fromCalendar(
            int year, int month, int day, int hour, int minute, double second, TimeScale scale) {
        if (hour < 0 || hour > 23) {
            throw MeeusException.invalidDate("Hour must be in [0, 23], got " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw MeeusException.invalidDate("Minute must be in [0, 59], got " + minute);
        }
        if (!(second >= 0.0 && second < 60.0)) {
            throw MeeusException.invalidDate("Second must be in [0, 60), got " + second);
        }
        double fraction = (hour + (minute + second / 60.0) / 60.0) / 24.0;
        return fromCalendar(year, month, day + fraction, scale, null);
    }

    /**
     * Epoch for a UTC calendar date using an explicit TAI - UTC leap count instead
     * of the bundled table. Useful once the table is out of date.
     *
     * @param leapSeconds leap seconds accumulated since 1972 (TAI - UTC - 10 s)
     */
    public static Epoch fromUtc(int year, int month, double day, double leapSeconds) {
        double jd = julianDay(year, month, day, null);
        return new Epoch(jd + LeapSeconds.ttMinusUtc(year, month, leapSeconds) / SECONDS_PER_DAY);
    }

    /** Epoch for midnight at the start of a {@code java.time} (proleptic Gregorian) date. */
    public static Epoch of(LocalDate date, TimeScale scale) {
        return fromCalendar(
                date.getYear(), date.getMonthValue(), date.getDayOfMonth(), scale,
                CalendarSystem.GREGORIAN);
    }

    /** Epoch for a {@code java.time} (proleptic Gregorian) date-time on the given scale. */
    public static Epoch of(LocalDateTime dateTime, TimeScale scale) {
        double seconds = dateTime.getSecond() + dateTime.getNano() / 1e9;
        double fraction =
                (dateTime.getHour() + (dateTime.getMinute() + seconds / 60.0) / 60.0) / 24.0;
        return fromCalendar(
                dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth() + fraction,
                scale, CalendarSystem.GREGORIAN);
    }

    /**
     * Month from an English name, either the full name or its three-letter
     * abbreviation, in any case: "Jan", "FEB", "september".
     *
     * @throws MeeusException if the name is not recognised
     */
    public static Month parseMonth(String name) {
        String n = name == null ? "" : name.strip().toUpperCase(Locale.ROOT);
        for (Month m : Month.values()) {
            if (n.equals(m.name()) || (n.length() == 3 && m.name().startsWith(n))) return m;
        }
        throw MeeusException.invalidDate("Unknown month name '" + name + "'");
    }

    /** Leap-year test using the calendar in force during that year. */
    public static boolean isLeapYear(int year) {
        return CalendarSystem.forYear(year).isLeapYear(year);
    }

    /**
     * Day of the year, 1-based, keeping the fraction of the day: 1978-11-14 is
     * 318.0, 2012-03-03.1 is 63.1.
     *
     * @throws MeeusException if the month or day is out of range
     */
    public static double dayOfYear(int year, int month, double day) {
        CalendarSystem calendar = CalendarSystem.forYear(year);
        int days = calendar.daysInMonth(year, month);
        if (!(day >= 1.0 && day < days + 1.0)) {
            throw MeeusException.invalidDate(
                    "Day must be in [1, " + (days + 1) + ") for " + year + "-" + month + ", got " + day);
        }
        int k = calendar.isLeapYear(year) ? 1 : 2;
        return Math.floor(275.0 * month / 9.0) - k * Math.floor((month + 9.0) / 12.0) + day - 30.0;
    }

    /**
     * Inverse of {@link #dayOfYear}.
     *
     * @param dayOfYear 1-based day of the year with fraction
     * @return the date in that year, fraction carried into the day
     * @throws MeeusException if dayOfYear is outside the year
     */
    public static CalendarDate dateFromDayOfYear(int year, double dayOfYear) {
        boolean leap = CalendarSystem.forYear(year).isLeapYear(year);
        int length = leap ? 366 : 365;
        if (!(dayOfYear >= 1.0 && dayOfYear < length + 1.0)) {
            throw MeeusException.invalidDate(
                    "Day of year must be in [1, " + (length + 1) + ") for " + year + ", got " + dayOfYear);
        }
        double n = Math.floor(dayOfYear);
        double fraction = dayOfYear - n;
        int k = leap ? 1 : 2;
        int month = n < 32.0 ? 1 : (int) Math.floor(9.0 * (k + n) / 275.0 + 0.98);
        double day = n - Math.floor(275.0 * month / 9.0) + k * Math.floor((month + 9.0) / 12.0) + 30.0;
        return new CalendarDate(year, month, day + fraction);
    }

    /** The stored Julian Ephemeris Day. */
    public double jde() {
        return jde;
    }

    /** Modified Julian Day, JDE - 2400000.5. */
    public double mjd() {
        return jde - MJD_OFFSET;
    }

    /** Julian centuries of TT elapsed since J2000.0. */
    public double centuriesSinceJ2000() {
        return (jde - J2000) / DAYS_PER_CENTURY;
    }

    public Epoch plusDays(double days) {
        return ofJde(jde + days);
    }

    public Epoch minusDays(double days) {
        return ofJde(jde - days);
    }

    /** Signed number of days from {@code other} to this epoch. */
    public double minus(Epoch other) {
        return jde - other.jde;
    }

    public boolean isBefore(Epoch other) {
        return jde < other.jde;
    }

    public boolean isAfter(Epoch other) {
        return jde > other.jde;
    }

    /** UTC calendar date in the calendar in force at this epoch. */
    public CalendarDate toCalendar() {
        return toCalendar(TimeScale.UTC, null);
    }

    /** Calendar date on the given scale in the calendar in force at this epoch. */
    public CalendarDate toCalendar(TimeScale scale) {
        return toCalendar(scale, null);
    }

    /**
     * Calendar date on the given scale.
     *
     * @param calendar calendar to express the date in, or null for the one in force
     * @throws MeeusException if the epoch precedes JD 0
     */
    public CalendarDate toCalendar(TimeScale scale, CalendarSystem calendar) {
        CalendarDate tt = JulianDay.toDate(jde, calendar);
        if (scale == TimeScale.TT) return tt;
        double offset = scale.secondsToTerrestrial(tt.year(), tt.month());
        CalendarDate civil = JulianDay.toDate(jde - offset / SECONDS_PER_DAY, calendar);
        // The correction can move the reading back across a month with a different leap count
        if (civil.year() != tt.year() || civil.month() != tt.month()) {
            double retry = scale.secondsToTerrestrial(civil.year(), civil.month());
            if (retry != offset) civil = JulianDay.toDate(jde - retry / SECONDS_PER_DAY, calendar);
        }
        return civil;
    }

    /** Day of the year of the UTC date, fraction included. */
    public double dayOfYear() {
        CalendarDate d = toCalendar();
        return dayOfYear(d.year(), d.month(), d.day());
    }

    /** Day of the week of the UTC civil date. */
    public DayOfWeek dayOfWeek() {
        CalendarDate d = toCalendar();
        int whole = d.dayOfMonth();
        double jd0 = JulianDay.of(
                d.year(), d.month(), whole, CalendarSystem.forDate(d.year(), d.month(), whole));
        // (JD0 + 1.5) mod 7 counts from Sunday = 0
        int index = (int) Math.floorMod((long) Math.floor(jd0 + 1.5), 7L);
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }

    /** ΔT = TT - UT, in seconds, for the month of this epoch. */
    public double deltaT() {
        CalendarDate d = toCalendar(TimeScale.TT);
        return DeltaT.seconds(d.year(), d.month());
    }

    /**
     * Mean sidereal time at Greenwich, in degrees in [0, 360).
     *
     * <p>The stored day number is used as the UT argument of the IAU 1982
     * expression, so build the epoch from UT clock fields with
     * {@link TimeScale#TT} when the full ΔT shift matters.</p>
     */
    public double meanSiderealTime() {
        double days = jde - J2000;
        double t = days / DAYS_PER_CENTURY;
        double theta = 280.46061837 + 360.98564736629 * days + t * t * (0.000387933 - t / 38710000.0);
        return normalizeDegrees(theta);
    }

    /**
     * Apparent sidereal time at Greenwich, in degrees in [0, 360): the mean value
     * corrected by the equation of the equinoxes, Δψ·cos ε.
     *
     * @param trueObliquity      true obliquity of the ecliptic ε, degrees
     * @param nutationLongitude  nutation in longitude Δψ, degrees
     */
    public double apparentSiderealTime(double trueObliquity, double nutationLongitude) {
        double correction = nutationLongitude * Math.cos(Math.toRadians(trueObliquity));
        return normalizeDegrees(meanSiderealTime() + correction);
    }

    @Override
    public int compareTo(Epoch other) {
        return Double.compare(jde, other.jde);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Epoch)) return false;
        return Double.compare(jde, ((Epoch) o).jde) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(jde);
    }

    @Override
    public String toString() {
        return "JDE " + jde;
    }

    private static double julianDay(int year, int month, double day, CalendarSystem calendar) {
        CalendarSystem.checkMonth(month);
        if (!Double.isFinite(day)) {
            throw MeeusException.invalidDate("Day must be finite, got " + day);
        }
        if (year < MIN_YEAR) {
            throw MeeusException.invalidDate("Year must be " + MIN_YEAR + " or later, got " + year);
        }
        CalendarSystem cal = calendar != null ? calendar : CalendarSystem.forDate(year, month, day);
        int days = cal.daysInMonth(year, month);
        if (!(day >= 0.0 && day < days + 1.0)) {
            throw MeeusException.invalidDate(
                    "Day must be in [0, " + (days + 1) + ") for " + year + "-" + month + ", got " + day);
        }
        return JulianDay.of(year, month, day, cal);
    }

    static double normalizeDegrees(double degrees) {
        double r = degrees % 360.0;
        if (r < 0.0) r += 360.0;
        return r >= 360.0 ? 0.0 : r;
    }
}
