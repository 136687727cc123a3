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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Historical table of leap seconds and the UTC to TT offset derived from it.
 *
 * <p>The table is read once from the classpath resource
 * <code>leapseconds.txt</code> and never changes afterwards. Lookups never fail:
 * dates before the first entry have no leap seconds, dates after the last entry
 * keep the last count. Because future leap seconds cannot be predicted, a
 * warning is logged once when a lookup lands well past the end of the table.
 * Call {@link #preload()} at startup to surface a missing or corrupt resource
 * early.</p>
 */
public final class LeapSeconds {
    private static final Logger log = LoggerFactory.getLogger(LeapSeconds.class);
    private static final String RESOURCE = "leapseconds.txt";

    /** TT - TAI, seconds. */
    static final double TT_MINUS_TAI = 32.184;
    /** TAI - UTC when the leap-second system started on 1972-01-01, seconds. */
    static final double TAI_MINUS_UTC_1972 = 10.0;

    private static final long UTC_1972_KEY = monthKey(1972, 1);
    private static final int STALE_AFTER_YEARS = 5;

    private static volatile List<Entry> table;
    private static volatile boolean warnedStale = false;

    private LeapSeconds() {}

    /**
     * Cumulative number of leap seconds in force during the given month.
     *
     * @param year  Gregorian year
     * @param month month in [1, 12]
     * @return 0 before July 1972, the last tabulated count after the table ends
     * @throws MeeusException if month is out of range
     */
    public static int count(int year, int month) {
        CalendarSystem.checkMonth(month);
        List<Entry> t = ensureLoaded();
        long key = monthKey(year, month);
        if (key < t.get(0).key()) return 0;
        Entry last = t.get(t.size() - 1);
        if (key >= last.key()) {
            warnIfStale(key, last);
            return last.count();
        }
        // Last entry whose key is <= the requested month
        int lo = 0;
        int hi = t.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (t.get(mid).key() <= key) lo = mid;
            else hi = mid - 1;
        }
        return t.get(lo).count();
    }

    /**
     * TT - UTC in seconds for a civil date: 32.184 s always, plus TAI - UTC from
     * 1972 on.
     */
    public static double ttMinusUtc(int year, int month) {
        return ttMinusUtc(year, month, count(year, month));
    }

    /** Same as {@link #ttMinusUtc(int, int)} with the leap count supplied by the caller. */
    static double ttMinusUtc(int year, int month, double leapSeconds) {
        if (monthKey(year, month) < UTC_1972_KEY) return TT_MINUS_TAI;
        return TT_MINUS_TAI + TAI_MINUS_UTC_1972 + leapSeconds;
    }

    /**
     * The most recent entry in the table. Use it to check how current the bundled
     * resource is.
     */
    public static Entry last() {
        List<Entry> t = ensureLoaded();
        return t.get(t.size() - 1);
    }

    /**
     * Load the table now and warn if today's date is already past the point where
     * the table can be trusted.
     */
    public static void preload() {
        List<Entry> t = ensureLoaded();
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        warnIfStale(monthKey(today.getYear(), today.getMonthValue()), t.get(t.size() - 1));
    }

    private static void warnIfStale(long key, Entry last) {
        if (warnedStale || key - last.key() <= STALE_AFTER_YEARS * 12L) return;
        synchronized (LeapSeconds.class) {
            if (!warnedStale) {
                warnedStale = true;
                log.warn(
                        "Leap-second lookup is more than {} years past the last table entry {}-{}; "
                                + "using {} s. Consider updating {}",
                        STALE_AFTER_YEARS,
                        last.year(),
                        String.format("%02d", last.month()),
                        last.count(),
                        RESOURCE);
            }
        }
    }

    private static List<Entry> ensureLoaded() {
        List<Entry> t = table;
        if (t != null) return t;
        synchronized (LeapSeconds.class) {
            if (table == null) table = loadFromResource();
            return table;
        }
    }

    /**
     * Parse <code>leapseconds.txt</code>: one <code>year month count</code> row per
     * entry, '#' comments and blank lines ignored. Rows must be in date order with
     * non-decreasing counts. Any problem is a packaging defect and is thrown as
     * an IllegalStateException.
     */
    private static List<Entry> loadFromResource() {
        InputStream in = LeapSeconds.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Leap-second table '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException(
                    "Leap-second table '" + RESOURCE + "' not found on classpath");
        }
        try (BufferedReader br =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<Entry> rows = new ArrayList<>();
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length < 3) continue; // malformed row
                Entry e = new Entry(
                        Integer.parseInt(toks[0]),
                        Integer.parseInt(toks[1]),
                        Integer.parseInt(toks[2]));
                if (!rows.isEmpty()) {
                    Entry prev = rows.get(rows.size() - 1);
                    if (e.key() <= prev.key() || e.count() < prev.count()) {
                        throw new IllegalStateException("Out-of-order leap-second row: " + line);
                    }
                }
                rows.add(e);
            }
            if (rows.isEmpty()) {
                throw new IllegalStateException("Leap-second table '" + RESOURCE + "' is empty");
            }
            Entry last = rows.get(rows.size() - 1);
            log.debug(
                    "Loaded {} leap-second entries, last {}-{} = {} s",
                    rows.size(), last.year(), last.month(), last.count());
            return List.copyOf(rows);
        } catch (IOException e) {
            log.error("Failed to read leap-second table", e);
            throw new IllegalStateException("Failed to read leap-second table", e);
        } catch (IllegalStateException e) {
            log.error("Invalid leap-second table: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to parse leap-second table", e);
            throw new IllegalStateException("Failed to parse leap-second table", e);
        }
    }

    private static long monthKey(int year, int month) {
        return year * 12L + (month - 1);
    }

    /**
     * One row of the table: from the first day of {@code month} in {@code year},
     * TAI - UTC is 10 s plus {@code count}.
     */
    public record Entry(int year, int month, int count) {

        public Entry {
            CalendarSystem.checkMonth(month);
        }

        /** The last UTC day of the month before this entry, which ended with the leap second. */
        public CalendarDate insertionDate() {
            int y = month == 1 ? year - 1 : year;
            int m = month == 1 ? 12 : month - 1;
            return new CalendarDate(y, m, CalendarSystem.GREGORIAN.daysInMonth(y, m));
        }

        long key() {
            return monthKey(year, month);
        }
    }
}
