package com.example.airtime_backend.service;

import com.example.airtime_backend.merge.MergePlan;
import com.example.airtime_backend.merge.SegmentMergePlanner;
import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.model.SegmentEditLog;
import com.example.airtime_backend.repository.AudioSegmentRepository;
import com.example.airtime_backend.repository.ChannelRepository;
import com.example.airtime_backend.repository.SegmentEditLogRepository;
import com.example.airtime_backend.util.EditAction;
import com.example.airtime_backend.util.SegmentSource;
import com.example.airtime_backend.util.TriggerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SegmentMergeWriterTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private AudioSegmentRepository segmentRepository;
    @Mock
    private ChannelRepository channelRepository;
    @Mock
    private SegmentEditLogRepository editLogRepository;

    private SegmentMergeWriter writer;
    private Channel channel;
    private AudioSegment jingle;
    private AudioSegment song;
    private MergePlan plan;

    @BeforeEach
    void setUp() {
        writer = new SegmentMergeWriter(segmentRepository, channelRepository, editLogRepository);
        channel = new Channel("Radio 1", 7, 42, "UTC");
        channel.setId(UUID.randomUUID());
        jingle = track(0, 5, "Jingle");
        song = track(5, 605, "Song");
        plan = new SegmentMergePlanner().plan(List.of(jingle, song)).get(0);
        when(segmentRepository.findAllById(plan.sourceIds())).thenReturn(List.of(jingle, song));
    }

    private AudioSegment track(long fromSec, long toSec, String title) {
        AudioSegment segment = new AudioSegment(channel, T0.plusSeconds(fromSec), T0.plusSeconds(toSec));
        segment.setId(UUID.randomUUID());
        segment.setRecognized(true);
        segment.setTitle(title);
        return segment;
    }

    private void saveAssignsIds() {
        when(segmentRepository.save(any(AudioSegment.class))).thenAnswer(inv -> {
            AudioSegment s = inv.getArgument(0);
            if (s.getId() == null) {
                s.setId(UUID.randomUUID());
            }
            return s;
        });
    }

    @Test
    void writesMergedSegmentSoftDeletesSourcesAndAudits() {
        when(channelRepository.findById(channel.getId())).thenReturn(Optional.of(channel));
        saveAssignsIds();

        Optional<AudioSegment> result = writer.apply(channel.getId(), plan);

        assertThat(result).isPresent();
        AudioSegment merged = result.get();
        assertThat(merged.getSource()).isEqualTo(SegmentSource.MERGED);
        assertThat(merged.getTitle()).isEqualTo("Song");
        assertThat(merged.getDurationSeconds()).isEqualTo(605);
        assertThat(merged.getFilePath()).isEqualTo("media/20240115/audio_7_42_20240115100000_605.mp3");
        assertThat(jingle.isDeleted()).isTrue();
        assertThat(song.isActive()).isFalse();
        assertThat(song.getNotes()).isEqualTo("Merged into segment ID:" + merged.getId());

        ArgumentCaptor<SegmentEditLog> log = ArgumentCaptor.forClass(SegmentEditLog.class);
        verify(editLogRepository).save(log.capture());
        assertThat(log.getValue().getAction()).isEqualTo(EditAction.MERGE);
        assertThat(log.getValue().getTriggerType()).isEqualTo(TriggerType.AUTOMATIC);
        assertThat(log.getValue().sourceSegmentIdList()).containsExactlyInAnyOrder(jingle.getId(), song.getId());
        assertThat(log.getValue().getMetadata()).containsEntry("durationSeconds", 605);
    }

    @Test
    void alreadyMergedSourceAbortsThePlan() {
        song.setSource(SegmentSource.MERGED);

        assertThat(writer.apply(channel.getId(), plan)).isEmpty();
        verify(segmentRepository, never()).save(any(AudioSegment.class));
        assertThat(jingle.isDeleted()).isFalse();
    }

    @Test
    void missingSourceAbortsThePlan() {
        when(segmentRepository.findAllById(plan.sourceIds())).thenReturn(List.of(jingle));

        assertThat(writer.apply(channel.getId(), plan)).isEmpty();
        verify(segmentRepository, never()).save(any(AudioSegment.class));
    }

    @Test
    void existingAuditEntryIsNotDuplicated() {
        when(channelRepository.findById(channel.getId())).thenReturn(Optional.of(channel));
        saveAssignsIds();
        when(editLogRepository.existsByAudioSegmentIdAndActionAndSourceSegmentIds(any(), eq(EditAction.MERGE), anyString()))
                .thenReturn(true);

        assertThat(writer.apply(channel.getId(), plan)).isPresent();
        verify(editLogRepository, never()).save(any(SegmentEditLog.class));
    }
}
