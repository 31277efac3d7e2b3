package com.example.airtime_backend.schedule;

import com.example.airtime_backend.model.Shift;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only snapshot of a {@link Shift}, detached from the persistence context.
 */
public record ShiftDefinition(UUID id, String name, LocalTime start, LocalTime end, Set<DayOfWeek> days) {
    public ShiftDefinition {
        days = days == null ? Set.of() : Set.copyOf(days);
    }

    public static ShiftDefinition from(Shift shift) {
        return new ShiftDefinition(shift.getId(), shift.getName(), shift.getStartTime(), shift.getEndTime(),
                shift.dayOfWeekSet());
    }

    /** An empty day set applies to every day. */
    public boolean appliesOn(DayOfWeek dayOfWeek) {
        return days.isEmpty() || days.contains(dayOfWeek);
    }

    public boolean isOvernight() {
        return start.isAfter(end);
    }
}
