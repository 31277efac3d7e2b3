package com.example.airtime_backend.service;

import com.example.airtime_backend.config.PipelineProperties;
import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.repository.AudioSegmentRepository;
import com.example.airtime_backend.repository.ChannelRepository;
import com.example.airtime_backend.timeline.SegmentCandidate;
import com.example.airtime_backend.util.SegmentFileNames;
import com.example.airtime_backend.util.SegmentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists a synthesized timeline. Items are handled one by one and commit on their own, so a
 * failing item is logged and skipped while the rest of the batch goes through.
 *
 * <p>Before an item is written, older active segments of the channel that overlap it (with a
 * small tolerance) are deactivated unless a segment with the exact same bounds already exists.
 * Segments created during the recent session window are left alone so a run never deactivates
 * its own output.</p>
 */
@Service
public class SegmentIngestService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentIngestService.class);

    private final AudioSegmentRepository segmentRepository;
    private final ChannelRepository channelRepository;
    private final PipelineProperties properties;
    private final Clock clock;

    public SegmentIngestService(AudioSegmentRepository segmentRepository,
                                ChannelRepository channelRepository,
                                PipelineProperties properties,
                                Clock clock) {
        this.segmentRepository = segmentRepository;
        this.channelRepository = channelRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param channelId  owner of every candidate.
     * @param candidates synthesized timeline.
     * @return the persisted segment for every candidate that went through, in candidate order.
     * @throws java.util.NoSuchElementException when the channel does not exist.
     */
    public List<AudioSegment> insertSegments(UUID channelId, List<SegmentCandidate> candidates) {
        Channel channel = channelRepository.findById(channelId).orElseThrow();
        Instant sessionStart = clock.instant().minus(Duration.ofMinutes(properties.getIngest().getRecentSessionMinutes()));

        List<AudioSegment> persisted = new ArrayList<>();
        int deactivated = 0;
        int failed = 0;
        for (SegmentCandidate candidate : candidates) {
            try {
                IngestOutcome outcome = ingestOne(channel, candidate, sessionStart);
                persisted.add(outcome.segment());
                deactivated += outcome.deactivated();
            } catch (RuntimeException e) {
                failed++;
                LOGGER.warn("INGEST item failed channel={} start={} end={} recognized={} err={}",
                        channelId, candidate.start(), candidate.end(), candidate.recognized(), e.toString());
            }
        }
        LOGGER.info("INGEST done channel={} candidates={} persisted={} deactivated={} failed={}",
                channelId, candidates.size(), persisted.size(), deactivated, failed);
        return persisted;
    }

    IngestOutcome ingestOne(Channel channel, SegmentCandidate candidate, Instant sessionStart) {
        int duration = candidate.durationSeconds();
        String fileName = candidate.fileName() != null
                ? candidate.fileName()
                : SegmentFileNames.fileName(channel, candidate.start(), duration);
        String filePath = candidate.filePath() != null
                ? candidate.filePath()
                : SegmentFileNames.filePath(channel, candidate.start(), duration);

        List<AudioSegment> exact = segmentRepository.findExact(channel.getId(), candidate.start(), candidate.end());
        List<AudioSegment> stale = exact.isEmpty()
                ? findStale(channel, candidate, sessionStart)
                : List.of();

        AudioSegment segment;
        Optional<AudioSegment> byPath = segmentRepository.findByFilePath(filePath);
        if (byPath.isPresent()) {
            segment = byPath.get();
            LOGGER.debug("INGEST path exists segment={} path={}", segment.getId(), filePath);
        } else if (!exact.isEmpty() && exact.get(0).isDeleted()) {
            segment = exact.get(0);
            LOGGER.debug("INGEST keep deleted segment={} start={} end={}", segment.getId(), candidate.start(), candidate.end());
        } else {
            segment = exact.isEmpty()
                    ? new AudioSegment(channel, candidate.start(), candidate.end())
                    : exact.get(0);
            apply(segment, candidate, fileName, filePath);
            segment.validate();
            segment = segmentRepository.save(segment);
            LOGGER.debug("INGEST {} segment={} start={} end={}", exact.isEmpty() ? "created" : "updated",
                    segment.getId(), candidate.start(), candidate.end());
        }

        int deactivated = deactivate(stale, segment);
        return new IngestOutcome(segment, deactivated);
    }

    private List<AudioSegment> findStale(Channel channel, SegmentCandidate candidate, Instant sessionStart) {
        Duration tolerance = Duration.ofSeconds(properties.getIngest().getToleranceSeconds());
        return segmentRepository.findStaleOverlaps(
                channel.getId(),
                candidate.start().minus(tolerance),
                candidate.end().plus(tolerance),
                sessionStart,
                candidate.start(),
                candidate.end());
    }

    private int deactivate(List<AudioSegment> stale, AudioSegment replacement) {
        List<AudioSegment> changed = new ArrayList<>();
        for (AudioSegment old : stale) {
            if (old.getId() != null && old.getId().equals(replacement.getId())) {
                continue;
            }
            old.setActive(false);
            old.setNotes("Deactivated due to overlap with segment ID:" + replacement.getId()
                    + " (time: " + replacement.getStartTime() + " - " + replacement.getEndTime() + ")");
            changed.add(old);
        }
        if (changed.isEmpty()) {
            return 0;
        }
        segmentRepository.saveAll(changed);
        LOGGER.info("INGEST deactivated overlapping count={} replacement={} ids={}",
                changed.size(), replacement.getId(), changed.stream().map(AudioSegment::getId).toList());
        return changed.size();
    }

    private static void apply(AudioSegment segment, SegmentCandidate candidate, String fileName, String filePath) {
        segment.setRecognized(candidate.recognized());
        if (candidate.recognized()) {
            segment.setTitle(candidate.title());
            segment.setTitleBefore(null);
            segment.setTitleAfter(null);
            segment.setMetadata(candidate.metadata());
        } else {
            segment.setTitleBefore(candidate.titleBefore());
            segment.setTitleAfter(candidate.titleAfter());
        }
        segment.setSource(SegmentSource.RECOGNITION);
        segment.setActive(true);
        segment.setFileName(fileName);
        segment.setFilePath(filePath);
    }

    record IngestOutcome(AudioSegment segment, int deactivated) {}
}
