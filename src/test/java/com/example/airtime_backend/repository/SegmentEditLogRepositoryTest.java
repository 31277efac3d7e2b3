package com.example.airtime_backend.repository;

import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.model.SegmentEditLog;
import com.example.airtime_backend.util.EditAction;
import com.example.airtime_backend.util.TriggerType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class SegmentEditLogRepositoryTest {

    @Autowired
    private SegmentEditLogRepository editLogRepository;

    @Autowired
    private AudioSegmentRepository segmentRepository;

    @Autowired
    private ChannelRepository channelRepository;

    @Test
    void mergeAuditIsFoundByItsSourceKey() {
        Channel channel = channelRepository.save(new Channel("Radio 1", 7, 42, "UTC"));
        AudioSegment merged = new AudioSegment(channel, Instant.parse("2024-01-15T10:00:00Z"), Instant.parse("2024-01-15T10:10:05Z"));
        merged.setRecognized(true);
        merged.setTitle("Song");
        merged = segmentRepository.saveAndFlush(merged);

        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        SegmentEditLog log = new SegmentEditLog(merged, EditAction.MERGE, TriggerType.AUTOMATIC, List.of(a, b));
        log.setMetadata(Map.of("durationSeconds", 605));
        editLogRepository.saveAndFlush(log);

        assertThat(editLogRepository.existsByAudioSegmentIdAndActionAndSourceSegmentIds(
                merged.getId(), EditAction.MERGE, SegmentEditLog.sourceKey(List.of(b, a)))).isTrue();
        assertThat(editLogRepository.existsByAudioSegmentIdAndActionAndSourceSegmentIds(
                merged.getId(), EditAction.MERGE, SegmentEditLog.sourceKey(List.of(a)))).isFalse();
        assertThat(editLogRepository.findByAudioSegmentIdOrderByCreatedAtAsc(merged.getId()))
                .singleElement()
                .satisfies(entry -> assertThat(entry.sourceSegmentIdList()).containsExactlyInAnyOrder(a, b));
    }
}
