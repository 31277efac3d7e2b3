package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.model.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class AudioSegmentRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Autowired
    private AudioSegmentRepository segmentRepository;

    @Autowired
    private ChannelRepository channelRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Channel channel;

    @BeforeEach
    void setUp() {
        channel = channelRepository.save(new Channel("Radio 1", 7, 42, "UTC"));
    }

    private AudioSegment save(long fromSec, long toSec, boolean recognized, String path) {
        AudioSegment segment = new AudioSegment(channel, T0.plusSeconds(fromSec), T0.plusSeconds(toSec));
        segment.setRecognized(recognized);
        if (recognized) {
            segment.setTitle("Song");
        } else {
            segment.setTitleBefore("Before");
            segment.setTitleAfter("After");
        }
        segment.setFilePath(path);
        return segmentRepository.saveAndFlush(segment);
    }

    @Test
    void duplicateFilePathTriggersUniqueViolation() {
        save(0, 60, true, "media/20240115/a.mp3");

        AudioSegment duplicate = new AudioSegment(channel, T0.plusSeconds(100), T0.plusSeconds(160));
        duplicate.setRecognized(true);
        duplicate.setTitle("Other");
        duplicate.setFilePath("media/20240115/a.mp3");

        assertThrows(DataIntegrityViolationException.class, () -> segmentRepository.saveAndFlush(duplicate));
    }

    @Test
    void staleOverlapsExcludeTheExactMatchAndRecentRows() {
        AudioSegment overlapping = save(0, 180, true, "media/a.mp3");
        save(300, 420, true, "media/b.mp3");
        Instant start = T0.plusSeconds(170);
        Instant end = T0.plusSeconds(300);

        List<AudioSegment> stale = segmentRepository.findStaleOverlaps(channel.getId(),
                start.minusSeconds(1), end.plusSeconds(1), Instant.now().plus(Duration.ofMinutes(1)), start, end);
        List<AudioSegment> recent = segmentRepository.findStaleOverlaps(channel.getId(),
                start.minusSeconds(1), end.plusSeconds(1), Instant.now().minus(Duration.ofHours(1)), start, end);

        // the second row only touches within the tolerance
        assertThat(stale).extracting(AudioSegment::getId).containsExactlyInAnyOrder(overlapping.getId(),
                segmentRepository.findByFilePath("media/b.mp3").orElseThrow().getId());
        assertThat(recent).isEmpty();

        List<AudioSegment> exact = segmentRepository.findStaleOverlaps(channel.getId(),
                T0.minusSeconds(1), T0.plusSeconds(181), Instant.now().plus(Duration.ofMinutes(1)), T0, T0.plusSeconds(180));
        assertThat(exact).isEmpty();
    }

    @Test
    void bulkUpdatesChangeOnlyTheTargetedRows() {
        AudioSegment track = save(0, 60, true, "media/a.mp3");
        AudioSegment gap = save(60, 200, false, "media/b.mp3");

        int deactivated = segmentRepository.deactivateByIdIn(List.of(track.getId()));
        int flagged = segmentRepository.updateRequiresAnalysis(List.of(track.getId(), gap.getId()), false);
        int renamed = segmentRepository.renameUnrecognized(List.of(track.getId(), gap.getId()), "Ads");
        entityManager.clear();

        assertThat(deactivated).isEqualTo(1);
        assertThat(flagged).isEqualTo(2);
        assertThat(renamed).isEqualTo(1);
        AudioSegment reloadedTrack = segmentRepository.findById(track.getId()).orElseThrow();
        AudioSegment reloadedGap = segmentRepository.findById(gap.getId()).orElseThrow();
        assertThat(reloadedTrack.isActive()).isFalse();
        assertThat(reloadedTrack.getTitle()).isEqualTo("Song");
        assertThat(reloadedGap.isActive()).isTrue();
        assertThat(reloadedGap.getTitle()).isEqualTo("Ads");
        assertThat(reloadedGap.getRequiresAnalysis()).isFalse();
    }

    @Test
    void activeRangeSkipsDeletedAndInactiveRows() {
        AudioSegment first = save(0, 60, true, "media/a.mp3");
        AudioSegment deleted = save(60, 120, true, "media/b.mp3");
        deleted.setDeleted(true);
        segmentRepository.saveAndFlush(deleted);
        AudioSegment last = save(120, 180, false, "media/c.mp3");
        save(3600, 3660, true, "media/d.mp3");

        List<AudioSegment> page = segmentRepository.findActiveInRange(channel.getId(), T0, T0.plusSeconds(3600));

        assertThat(page).extracting(AudioSegment::getId).containsExactly(first.getId(), last.getId());
        assertThat(segmentRepository.countActiveInRange(channel.getId(), T0, T0.plusSeconds(3600))).isEqualTo(2);
    }
}
