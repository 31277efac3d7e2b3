package com.example.airtime_backend.schedule;

import java.time.Instant;
import java.util.Optional;

/**
 * UTC interval produced from a local wall-clock window. {@code end} is exclusive.
 */
public record TimeWindow(Instant start, Instant end) {
    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return otherStart.isBefore(end) && otherEnd.isAfter(start);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Optional<TimeWindow> intersect(TimeWindow other) {
        Instant s = start.isAfter(other.start) ? start : other.start;
        Instant e = end.isBefore(other.end) ? end : other.end;
        return s.isBefore(e) ? Optional.of(new TimeWindow(s, e)) : Optional.empty();
    }
}
