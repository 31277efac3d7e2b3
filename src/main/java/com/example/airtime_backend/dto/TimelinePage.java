package com.example.airtime_backend.dto;

import java.time.Instant;

/**
 * One calendar page of a channel timeline.
 *
 * @param inShift whether the page intersects a shift window; always true when no shift is selected.
 */
public record TimelinePage(int page, Instant start, Instant end, long segmentCount, boolean inShift) {
}
