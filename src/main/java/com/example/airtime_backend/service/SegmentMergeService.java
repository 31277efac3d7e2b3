package com.example.airtime_backend.service;

import com.example.airtime_backend.merge.MergePlan;
import com.example.airtime_backend.merge.SegmentMergePlanner;
import com.example.airtime_backend.model.AudioSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Collapses short recognized segments of a freshly ingested timeline into their neighbors.
 * Each merge commits on its own; a failed merge is logged and the pass continues.
 */
@Service
public class SegmentMergeService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentMergeService.class);

    private final SegmentMergePlanner planner;
    private final SegmentMergeWriter writer;

    public SegmentMergeService(SegmentMergePlanner planner, SegmentMergeWriter writer) {
        this.planner = planner;
        this.writer = writer;
    }

    /**
     * @param channelId owner of {@code segments}.
     * @param segments  channel timeline; sorted by start here.
     * @return non-deleted segments that were not merged away plus the merged segments, by start.
     */
    public List<AudioSegment> mergeShortRecognizedSegments(UUID channelId, List<AudioSegment> segments) {
        List<AudioSegment> sorted = new ArrayList<>(segments);
        sorted.sort(Comparator.comparing(AudioSegment::getStartTime));

        List<MergePlan> plans = planner.plan(sorted);
        List<AudioSegment> created = new ArrayList<>();
        Set<UUID> consumed = new HashSet<>();
        int failed = 0;
        for (MergePlan plan : plans) {
            try {
                Optional<AudioSegment> merged = writer.apply(channelId, plan);
                if (merged.isPresent()) {
                    created.add(merged.get());
                    consumed.addAll(plan.sourceIds());
                }
            } catch (RuntimeException e) {
                failed++;
                LOGGER.error("MERGE failed channel={} sources={} span={}..{} err={}",
                        channelId, plan.sourceIds(), plan.start(), plan.end(), e.toString(), e);
            }
        }

        List<AudioSegment> out = new ArrayList<>();
        for (AudioSegment segment : sorted) {
            if (!segment.isDeleted() && !consumed.contains(segment.getId())) {
                out.add(segment);
            }
        }
        out.addAll(created);
        out.sort(Comparator.comparing(AudioSegment::getStartTime));
        LOGGER.info("MERGE pass channel={} segments={} planned={} merged={} failed={}",
                channelId, segments.size(), plans.size(), created.size(), failed);
        return out;
    }
}
