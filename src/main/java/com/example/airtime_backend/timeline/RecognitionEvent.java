package com.example.airtime_backend.timeline;

import java.time.Instant;
import java.util.Map;

/**
 * One detection reported by the fingerprinting provider, already resolved to a track title.
 *
 * @param timestampUtc          start of the detected play.
 * @param playedDurationSeconds length of the play; {@code null} or non-positive events are skipped.
 * @param title                 resolved track title.
 * @param metadata              provider payload kept with the segment (artists, external ids, offsets).
 */
public record RecognitionEvent(Instant timestampUtc,
                               Integer playedDurationSeconds,
                               String title,
                               Map<String, Object> metadata) {
}
