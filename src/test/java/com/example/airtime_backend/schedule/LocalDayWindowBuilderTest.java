package com.example.airtime_backend.schedule;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalDayWindowBuilderTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 15);

    @Test
    void sameDayWindowIsConvertedAsIs() {
        List<TimeWindow> windows = LocalDayWindowBuilder.buildLocalDayWindows(
                LocalTime.of(9, 0), LocalTime.of(17, 0), MONDAY, ZoneOffset.UTC);

        assertThat(windows).containsExactly(new TimeWindow(
                Instant.parse("2024-01-15T09:00:00Z"), Instant.parse("2024-01-15T17:00:00Z")));
    }

    @Test
    void overnightWindowIsSplitAtLocalMidnight() {
        List<TimeWindow> windows = LocalDayWindowBuilder.buildLocalDayWindows(
                LocalTime.of(22, 0), LocalTime.of(6, 0), MONDAY, ZoneOffset.UTC);

        assertThat(windows).containsExactly(
                new TimeWindow(Instant.parse("2024-01-15T22:00:00Z"), Instant.parse("2024-01-15T23:59:59.999999Z")),
                new TimeWindow(Instant.parse("2024-01-16T00:00:00Z"), Instant.parse("2024-01-16T06:00:00Z")));
    }

    @Test
    void overnightPartsDoNotShareABoundary() {
        List<TimeWindow> windows = LocalDayWindowBuilder.buildLocalDayWindows(
                LocalTime.of(22, 0), LocalTime.of(6, 0), MONDAY, ZoneOffset.UTC);

        assertThat(windows.get(0).end()).isBefore(windows.get(1).start());
        assertThat(windows.get(0).contains(Instant.parse("2024-01-16T00:00:00Z"))).isFalse();
        assertThat(windows.get(1).contains(Instant.parse("2024-01-16T00:00:00Z"))).isTrue();
    }

    @Test
    void localTimesAreResolvedInTheChannelZone() {
        List<TimeWindow> windows = LocalDayWindowBuilder.buildLocalDayWindows(
                LocalTime.of(9, 0), LocalTime.of(17, 0), MONDAY, ZoneId.of("Europe/Amsterdam"));

        assertThat(windows).containsExactly(new TimeWindow(
                Instant.parse("2024-01-15T08:00:00Z"), Instant.parse("2024-01-15T16:00:00Z")));
    }

    @Test
    void windowInsideSpringForwardGapIsDropped() {
        List<TimeWindow> windows = LocalDayWindowBuilder.buildLocalDayWindows(
                LocalTime.of(2, 30), LocalTime.of(3, 15), LocalDate.of(2024, 3, 10), ZoneId.of("America/New_York"));

        assertThat(windows).isEmpty();
    }

    @Test
    void windowAcrossSpringForwardGapLosesTheMissingHour() {
        List<TimeWindow> windows = LocalDayWindowBuilder.buildLocalDayWindows(
                LocalTime.of(1, 0), LocalTime.of(4, 0), LocalDate.of(2024, 3, 10), ZoneId.of("America/New_York"));

        assertThat(windows).containsExactly(new TimeWindow(
                Instant.parse("2024-03-10T06:00:00Z"), Instant.parse("2024-03-10T08:00:00Z")));
    }
}
