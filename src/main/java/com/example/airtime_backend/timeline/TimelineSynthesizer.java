package com.example.airtime_backend.timeline;

import com.example.airtime_backend.config.PipelineProperties;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.util.SegmentFileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns sparse recognition events into an ordered, gapless candidate timeline: recognized
 * segments plus synthesized unrecognized segments for every gap between them.
 */
@Component
public class TimelineSynthesizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimelineSynthesizer.class);

    private final OverlapPolicy overlapPolicy;

    @Autowired
    public TimelineSynthesizer(PipelineProperties properties) {
        this(new OverlapPolicy(Duration.ofSeconds(properties.getSynthesis().getGapThresholdSeconds())));
    }

    public TimelineSynthesizer(OverlapPolicy overlapPolicy) {
        this.overlapPolicy = overlapPolicy;
    }

    public List<SegmentCandidate> synthesize(List<RecognitionEvent> events) {
        return synthesize(events, null);
    }

    /**
     * @param events  recognition events in arrival order.
     * @param channel when present, every candidate gets its stable file identity.
     * @return recognized and gap candidates sorted by start.
     */
    public List<SegmentCandidate> synthesize(List<RecognitionEvent> events, Channel channel) {
        List<SegmentCandidate> accepted = new ArrayList<>();
        int skipped = 0;
        for (RecognitionEvent event : events) {
            if (event.timestampUtc() == null || event.playedDurationSeconds() == null || event.playedDurationSeconds() <= 0) {
                LOGGER.warn("SYNTH skip event without usable bounds ts={} duration={} title={}",
                        event.timestampUtc(), event.playedDurationSeconds(), event.title());
                skipped++;
                continue;
            }
            Instant start = event.timestampUtc();
            Instant end = start.plusSeconds(event.playedDurationSeconds());
            SegmentCandidate candidate = SegmentCandidate.recognized(start, end, event.title(), event.metadata());
            var kept = overlapPolicy.resolve(accepted, candidate);
            if (kept.isPresent()) {
                accepted.add(kept.get());
            } else {
                skipped++;
            }
        }

        accepted.sort(Comparator.comparing(SegmentCandidate::start));

        List<SegmentCandidate> timeline = new ArrayList<>(accepted);
        for (int i = 0; i < accepted.size() - 1; i++) {
            SegmentCandidate current = accepted.get(i);
            SegmentCandidate next = accepted.get(i + 1);
            if (next.start().isAfter(current.end())) {
                timeline.add(SegmentCandidate.gap(current.end(), next.start(), current.title(), next.title()));
            }
        }
        timeline.sort(Comparator.comparing(SegmentCandidate::start));

        if (channel != null) {
            timeline.replaceAll(c -> c.withFile(
                    SegmentFileNames.fileName(channel, c.start(), c.durationSeconds()),
                    SegmentFileNames.filePath(channel, c.start(), c.durationSeconds())));
        }
        LOGGER.info("SYNTH done events={} recognized={} gaps={} skipped={}",
                events.size(), accepted.size(), timeline.size() - accepted.size(), skipped);
        return timeline;
    }
}
