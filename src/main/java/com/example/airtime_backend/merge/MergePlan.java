package com.example.airtime_backend.merge;

import com.example.airtime_backend.model.AudioSegment;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One planned merge: the constituents in timeline order and the attributes of the segment that
 * replaces them.
 */
public record MergePlan(List<AudioSegment> sources,
                        Instant start,
                        Instant end,
                        boolean recognized,
                        String title,
                        String titleBefore,
                        String titleAfter,
                        Map<String, Object> metadata) {

    public MergePlan {
        sources = List.copyOf(sources);
    }

    public List<UUID> sourceIds() {
        return sources.stream().map(AudioSegment::getId).toList();
    }

    public int durationSeconds() {
        return (int) Duration.between(start, end).getSeconds();
    }
}
