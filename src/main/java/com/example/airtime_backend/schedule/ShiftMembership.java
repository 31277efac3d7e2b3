package com.example.airtime_backend.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Answers whether a UTC range overlaps any window of a channel's active shifts.
 *
 * <p>Day iteration starts one local day before the range so that the after-midnight tail of an
 * overnight shift that began the previous evening is considered. With no shifts nothing is
 * in-shift.</p>
 */
public class ShiftMembership {
    private final List<ShiftDefinition> shifts;
    private final ZoneId zone;

    public ShiftMembership(List<ShiftDefinition> shifts, ZoneId zone) {
        this.shifts = List.copyOf(shifts);
        this.zone = zone;
    }

    public boolean hasShifts() {
        return !shifts.isEmpty();
    }

    public boolean isWithinAnyShift(Instant utcStart, Instant utcEnd) {
        if (shifts.isEmpty() || utcStart == null || utcEnd == null) {
            return false;
        }
        LocalDate first = utcStart.atZone(zone).toLocalDate().minusDays(1);
        LocalDate last = utcEnd.atZone(zone).toLocalDate();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            for (ShiftDefinition shift : shifts) {
                if (!shift.appliesOn(day.getDayOfWeek())) {
                    continue;
                }
                for (TimeWindow window : LocalDayWindowBuilder.buildLocalDayWindows(shift.start(), shift.end(), day, zone)) {
                    if (window.overlaps(utcStart, utcEnd)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * All shift windows produced for the local days {@code from..to} inclusive, in day order.
     */
    public List<TimeWindow> windowsFor(LocalDate from, LocalDate to) {
        List<TimeWindow> out = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            for (ShiftDefinition shift : shifts) {
                if (shift.appliesOn(day.getDayOfWeek())) {
                    out.addAll(LocalDayWindowBuilder.buildLocalDayWindows(shift.start(), shift.end(), day, zone));
                }
            }
        }
        return out;
    }

    public ZoneId zone() {
        return zone;
    }
}
