package com.example.airtime_backend.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a local wall-clock window on one calendar day into UTC windows.
 *
 * <p>A window whose start is after its end runs overnight and is split at local midnight: the
 * first part ends at 23:59:59.999999 of {@code day}, the second starts at 00:00 of the next day.
 * Callers reject windows whose start equals their end.</p>
 *
 * <p>Local times that fall in a DST gap resolve to the instant after the gap, so a short window
 * inside a gap can come out empty or inverted; such windows are dropped.</p>
 */
public final class LocalDayWindowBuilder {
    static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_999_000);

    private LocalDayWindowBuilder() {
    }

    /**
     * @param start local start time.
     * @param end   local end time; before {@code start} for an overnight window.
     * @param day   local calendar day the window starts on.
     * @param zone  timezone the wall-clock times are expressed in.
     * @return one window, or two for an overnight window, in UTC; none when DST leaves nothing.
     */
    public static List<TimeWindow> buildLocalDayWindows(LocalTime start, LocalTime end, LocalDate day, ZoneId zone) {
        List<TimeWindow> windows = new ArrayList<>(2);
        if (!start.isAfter(end)) {
            addIfNotEmpty(windows, day.atTime(start).atZone(zone).toInstant(), day.atTime(end).atZone(zone).toInstant());
            return windows;
        }
        LocalDate next = day.plusDays(1);
        addIfNotEmpty(windows, day.atTime(start).atZone(zone).toInstant(), day.atTime(END_OF_DAY).atZone(zone).toInstant());
        addIfNotEmpty(windows, next.atStartOfDay(zone).toInstant(), next.atTime(end).atZone(zone).toInstant());
        return windows;
    }

    private static void addIfNotEmpty(List<TimeWindow> out, Instant start, Instant end) {
        if (end.isAfter(start)) {
            out.add(new TimeWindow(start, end));
        }
    }
}
