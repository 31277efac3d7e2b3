package com.example.airtime_backend.timeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a recognized candidate adds information over the intervals accepted so far.
 *
 * <p>The first accepted interval the candidate overlaps decides: a contained candidate is
 * discarded, one that runs past the existing end by at least the gap threshold is kept from that
 * end onwards, anything else is discarded. A candidate overlapping nothing is accepted as is.
 * The kept part is checked again against the remaining intervals, so accepted intervals never
 * overlap.</p>
 */
public class OverlapPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(OverlapPolicy.class);

    public static final Duration DEFAULT_GAP_THRESHOLD = Duration.ofSeconds(2);

    private final Duration gapThreshold;

    public OverlapPolicy() {
        this(DEFAULT_GAP_THRESHOLD);
    }

    public OverlapPolicy(Duration gapThreshold) {
        if (gapThreshold == null || gapThreshold.isNegative()) {
            throw new IllegalArgumentException("gapThreshold must be >= 0");
        }
        this.gapThreshold = gapThreshold;
    }

    /**
     * @param accepted  candidates accepted so far, in arrival order.
     * @param candidate candidate under test.
     * @return the part of {@code candidate} to keep, or empty when it is discarded.
     */
    public Optional<SegmentCandidate> resolve(List<SegmentCandidate> accepted, SegmentCandidate candidate) {
        SegmentCandidate current = candidate;
        while (true) {
            SegmentCandidate existing = firstOverlap(accepted, current.start(), current.end());
            if (existing == null) {
                return Optional.of(current);
            }
            if (!current.start().isBefore(existing.start()) && !current.end().isAfter(existing.end())) {
                LOGGER.debug("OVERLAP contained candidate={}..{} existing={}..{}",
                        current.start(), current.end(), existing.start(), existing.end());
                return Optional.empty();
            }
            Duration extension = Duration.between(existing.end(), current.end());
            if (extension.isNegative() || extension.isZero() || extension.compareTo(gapThreshold) < 0) {
                LOGGER.debug("OVERLAP insufficient extension candidate={}..{} existing={}..{} extension={}",
                        current.start(), current.end(), existing.start(), existing.end(), extension);
                return Optional.empty();
            }
            current = current.withStart(existing.end());
        }
    }

    private static SegmentCandidate firstOverlap(List<SegmentCandidate> accepted, Instant start, Instant end) {
        for (SegmentCandidate existing : accepted) {
            if (start.isBefore(existing.end()) && end.isAfter(existing.start())) {
                return existing;
            }
        }
        return null;
    }

    public Duration getGapThreshold() {
        return gapThreshold;
    }
}
