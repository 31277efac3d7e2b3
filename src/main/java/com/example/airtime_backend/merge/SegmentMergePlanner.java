package com.example.airtime_backend.merge;

import com.example.airtime_backend.model.AudioSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Plans the collapse of short recognized segments into their adjacent neighbors.
 *
 * <p>Single left-to-right pass over a start-ordered timeline. A recognized segment shorter than
 * the short-segment threshold absorbs its immediate neighbors when they touch it within the
 * adjacency tolerance. Segments already merged or deleted never take part, and a segment
 * consumed by one merge is not reused later in the same pass. Longer runs of short segments
 * collapse over successive runs.</p>
 */
public class SegmentMergePlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentMergePlanner.class);

    public static final int DEFAULT_SHORT_SEGMENT_SECONDS = 20;
    public static final Duration DEFAULT_MAX_GAP = Duration.ofSeconds(1);

    private final int shortSegmentSeconds;
    private final Duration maxGap;

    public SegmentMergePlanner() {
        this(DEFAULT_SHORT_SEGMENT_SECONDS, DEFAULT_MAX_GAP);
    }

    public SegmentMergePlanner(int shortSegmentSeconds, Duration maxGap) {
        this.shortSegmentSeconds = shortSegmentSeconds;
        this.maxGap = maxGap;
    }

    /**
     * @param timeline channel segments; sorted by start before planning.
     * @return merges in timeline order; each segment appears in at most one plan.
     */
    public List<MergePlan> plan(List<AudioSegment> timeline) {
        List<AudioSegment> sorted = new ArrayList<>(timeline);
        sorted.sort(Comparator.comparing(AudioSegment::getStartTime));

        Set<Integer> consumed = new HashSet<>();
        List<MergePlan> plans = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            AudioSegment candidate = sorted.get(i);
            if (consumed.contains(i) || candidate.isMergedOrDeleted() || !isCandidate(candidate)) {
                continue;
            }

            List<Integer> group = new ArrayList<>();
            if (i > 0 && isAvailable(sorted.get(i - 1), i - 1, consumed)
                    && isAdjacent(sorted.get(i - 1).getEndTime(), candidate.getStartTime())) {
                group.add(i - 1);
            }
            group.add(i);
            if (i + 1 < sorted.size() && isAvailable(sorted.get(i + 1), i + 1, consumed)
                    && isAdjacent(candidate.getEndTime(), sorted.get(i + 1).getStartTime())) {
                group.add(i + 1);
            }

            if (group.size() == 1) {
                LOGGER.debug("MERGE no adjacent neighbor segment={} start={} duration={}s",
                        candidate.getId(), candidate.getStartTime(), candidate.getDurationSeconds());
                continue;
            }

            consumed.addAll(group);
            List<AudioSegment> sources = group.stream().map(sorted::get).toList();
            plans.add(toPlan(sources));
        }
        return plans;
    }

    public boolean isCandidate(AudioSegment segment) {
        return segment.isRecognized() && segment.getDurationSeconds() < shortSegmentSeconds;
    }

    private boolean isAvailable(AudioSegment neighbor, int index, Set<Integer> consumed) {
        return !consumed.contains(index) && !neighbor.isMergedOrDeleted();
    }

    private boolean isAdjacent(Instant earlierEnd, Instant laterStart) {
        return Duration.between(earlierEnd, laterStart).abs().compareTo(maxGap) <= 0;
    }

    static MergePlan toPlan(List<AudioSegment> sources) {
        Instant start = sources.stream().map(AudioSegment::getStartTime).min(Comparator.naturalOrder()).orElseThrow();
        Instant end = sources.stream().map(AudioSegment::getEndTime).max(Comparator.naturalOrder()).orElseThrow();

        boolean allRecognized = sources.stream().allMatch(AudioSegment::isRecognized);
        if (allRecognized) {
            AudioSegment longest = sources.get(0);
            for (AudioSegment s : sources) {
                if (s.getDurationSeconds() > longest.getDurationSeconds()) {
                    longest = s;
                }
            }
            return new MergePlan(sources, start, end, true, longest.getTitle(), null, null, longest.getMetadata());
        }

        AudioSegment first = sources.get(0);
        AudioSegment last = sources.get(sources.size() - 1);
        String before = first.isRecognized() ? first.getTitle() : first.getTitleBefore();
        String after = last.isRecognized() ? last.getTitle() : last.getTitleAfter();
        return new MergePlan(sources, start, end, false, null, before, after, null);
    }

    public int getShortSegmentSeconds() {
        return shortSegmentSeconds;
    }

    public Duration getMaxGap() {
        return maxGap;
    }
}
