package com.example.airtime_backend.timeline;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Timeline entry produced by {@link TimelineSynthesizer}, not yet persisted.
 */
public record SegmentCandidate(Instant start,
                               Instant end,
                               boolean recognized,
                               String title,
                               String titleBefore,
                               String titleAfter,
                               Map<String, Object> metadata,
                               String fileName,
                               String filePath) {

    public static SegmentCandidate recognized(Instant start, Instant end, String title, Map<String, Object> metadata) {
        return new SegmentCandidate(start, end, true, title, null, null, metadata, null, null);
    }

    public static SegmentCandidate gap(Instant start, Instant end, String titleBefore, String titleAfter) {
        return new SegmentCandidate(start, end, false, null, titleBefore, titleAfter, null, null, null);
    }

    public int durationSeconds() {
        return (int) Duration.between(start, end).getSeconds();
    }

    public SegmentCandidate withStart(Instant newStart) {
        return new SegmentCandidate(newStart, end, recognized, title, titleBefore, titleAfter, metadata, fileName, filePath);
    }

    public SegmentCandidate withFile(String newFileName, String newFilePath) {
        return new SegmentCandidate(start, end, recognized, title, titleBefore, titleAfter, metadata, newFileName, newFilePath);
    }
}
