package com.example.airtime_backend.service;

import com.example.airtime_backend.config.PipelineProperties;
import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.repository.AudioSegmentRepository;
import com.example.airtime_backend.repository.ChannelRepository;
import com.example.airtime_backend.timeline.SegmentCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SegmentIngestServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");
    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instant END = Instant.parse("2024-01-15T10:03:00Z");

    @Mock
    private AudioSegmentRepository segmentRepository;
    @Mock
    private ChannelRepository channelRepository;

    private SegmentIngestService service;
    private Channel channel;

    @BeforeEach
    void setUp() {
        service = new SegmentIngestService(segmentRepository, channelRepository, new PipelineProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        channel = new Channel("Radio 1", 7, 42, "UTC");
        channel.setId(UUID.randomUUID());
        when(channelRepository.findById(channel.getId())).thenReturn(Optional.of(channel));
    }

    private static AudioSegment existing(Channel channel, Instant start, Instant end) {
        AudioSegment segment = new AudioSegment(channel, start, end);
        segment.setId(UUID.randomUUID());
        segment.setRecognized(true);
        segment.setTitle("Old");
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
    void newSegmentReplacesOlderOverlappingOnes() {
        saveAssignsIds();
        AudioSegment stale = existing(channel, Instant.parse("2024-01-15T09:59:00Z"), Instant.parse("2024-01-15T10:01:00Z"));
        when(segmentRepository.findStaleOverlaps(eq(channel.getId()), any(), any(), any(), eq(START), eq(END)))
                .thenReturn(List.of(stale));

        List<AudioSegment> persisted = service.insertSegments(channel.getId(),
                List.of(SegmentCandidate.recognized(START, END, "Song", Map.of("acrid", "abc"))));

        assertThat(persisted).hasSize(1);
        AudioSegment segment = persisted.get(0);
        assertThat(segment.getTitle()).isEqualTo("Song");
        assertThat(segment.getDurationSeconds()).isEqualTo(180);
        assertThat(segment.getFilePath()).isEqualTo("media/20240115/audio_7_42_20240115100000_180.mp3");
        assertThat(stale.isActive()).isFalse();
        assertThat(stale.getNotes()).startsWith("Deactivated due to overlap with segment ID:" + segment.getId());
        verify(segmentRepository).findStaleOverlaps(channel.getId(),
                START.minusSeconds(1), END.plusSeconds(1), NOW.minusSeconds(300), START, END);
        verify(segmentRepository).saveAll(List.of(stale));
    }

    @Test
    void exactMatchIsUpdatedAndNothingIsDeactivated() {
        saveAssignsIds();
        AudioSegment match = existing(channel, START, END);
        when(segmentRepository.findExact(channel.getId(), START, END)).thenReturn(List.of(match));

        List<AudioSegment> persisted = service.insertSegments(channel.getId(),
                List.of(SegmentCandidate.recognized(START, END, "Song", Map.of())));

        assertThat(persisted).containsExactly(match);
        assertThat(match.getTitle()).isEqualTo("Song");
        verify(segmentRepository, never()).findStaleOverlaps(any(), any(), any(), any(), any(), any());
        verify(segmentRepository, never()).saveAll(anyList());
    }

    @Test
    void deletedExactMatchIsKeptAsIs() {
        AudioSegment match = existing(channel, START, END);
        match.setDeleted(true);
        match.setActive(false);
        when(segmentRepository.findExact(channel.getId(), START, END)).thenReturn(List.of(match));

        List<AudioSegment> persisted = service.insertSegments(channel.getId(),
                List.of(SegmentCandidate.recognized(START, END, "Song", Map.of())));

        assertThat(persisted).containsExactly(match);
        assertThat(match.getTitle()).isEqualTo("Old");
        assertThat(match.isActive()).isFalse();
        verify(segmentRepository, never()).save(any(AudioSegment.class));
    }

    @Test
    void existingFilePathIsReturnedWithoutWriting() {
        AudioSegment byPath = existing(channel, START, END);
        when(segmentRepository.findByFilePath("media/20240115/audio_7_42_20240115100000_180.mp3"))
                .thenReturn(Optional.of(byPath));

        List<AudioSegment> persisted = service.insertSegments(channel.getId(),
                List.of(SegmentCandidate.recognized(START, END, "Song", Map.of())));

        assertThat(persisted).containsExactly(byPath);
        verify(segmentRepository, never()).save(any(AudioSegment.class));
    }

    @Test
    void failingItemDoesNotStopTheBatch() {
        SegmentCandidate broken = SegmentCandidate.recognized(START, END, null, Map.of());
        SegmentCandidate fine = SegmentCandidate.gap(END, END.plusSeconds(60), "Song", "Next");
        saveAssignsIds();

        List<AudioSegment> persisted = service.insertSegments(channel.getId(), List.of(broken, fine));

        assertThat(persisted).hasSize(1);
        assertThat(persisted.get(0).isRecognized()).isFalse();
        assertThat(persisted.get(0).getTitleBefore()).isEqualTo("Song");
        verify(segmentRepository).save(any(AudioSegment.class));
    }
}
