package com.example.airtime_backend.service;

import com.example.airtime_backend.config.PipelineProperties;
import com.example.airtime_backend.eligibility.AnalysisCandidate;
import com.example.airtime_backend.eligibility.EligibilityContext;
import com.example.airtime_backend.eligibility.EligibilityEngine;
import com.example.airtime_backend.eligibility.EligibilityResult;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.model.Shift;
import com.example.airtime_backend.model.TitleMappingRule;
import com.example.airtime_backend.model.UnrecognizedCategory;
import com.example.airtime_backend.repository.AudioSegmentRepository;
import com.example.airtime_backend.repository.ChannelRepository;
import com.example.airtime_backend.repository.ShiftRepository;
import com.example.airtime_backend.repository.TitleMappingRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EligibilityServiceTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private AudioSegmentRepository segmentRepository;
    @Mock
    private ChannelRepository channelRepository;
    @Mock
    private ShiftRepository shiftRepository;
    @Mock
    private TitleMappingRuleRepository titleMappingRuleRepository;

    private EligibilityService service;
    private Channel channel;

    @BeforeEach
    void setUp() {
        service = new EligibilityService(new EligibilityEngine(), segmentRepository, channelRepository,
                shiftRepository, titleMappingRuleRepository, new PipelineProperties());
        channel = new Channel("Radio 1", 7, 42, "UTC");
        channel.setId(UUID.randomUUID());
    }

    private AnalysisCandidate candidate(long fromSec, long toSec, boolean recognized, String title) {
        return new AnalysisCandidate(UUID.randomUUID(), channel.getId(), title, T0.plusSeconds(fromSec),
                T0.plusSeconds(toSec), (int) (toSec - fromSec), recognized);
    }

    private void channelWithMondayShift() {
        Shift shift = new Shift(channel, "Monday", LocalTime.of(6, 0), LocalTime.of(18, 0), "monday");
        shift.setId(UUID.randomUUID());
        when(channelRepository.findAllById(Set.of(channel.getId()))).thenReturn(List.of(channel));
        when(shiftRepository.findActiveByChannelIn(Set.of(channel.getId()))).thenReturn(List.of(shift));
    }

    @Test
    void writesFlagsAndDeactivatesIneligibleSegments() {
        channelWithMondayShift();
        AnalysisCandidate talk = candidate(0, 300, false, null);
        AnalysisCandidate blip = candidate(300, 305, false, null);

        EligibilityResult result = service.markRequiresAnalysis(List.of(talk, blip));

        assertThat(result.eligibleIds()).containsExactly(talk.getId());
        verify(segmentRepository).updateRequiresAnalysis(List.of(talk.getId()), true);
        verify(segmentRepository).updateRequiresAnalysis(List.of(blip.getId()), false);
        verify(segmentRepository).deactivateByIdIn(List.of(blip.getId()));
        verify(segmentRepository, never()).renameUnrecognized(any(), anyString());
    }

    @Test
    void categoryRenameIsPersisted() {
        channelWithMondayShift();
        UnrecognizedCategory category = new UnrecognizedCategory(channel, "Ads");
        TitleMappingRule rule = new TitleMappingRule(category, "Jingle A", null);
        when(titleMappingRuleRepository.findActiveByChannelIn(Set.of(channel.getId()))).thenReturn(List.of(rule));
        AnalysisCandidate jingle = candidate(0, 30, true, "Jingle A");
        AnalysisCandidate ad = candidate(30, 300, false, null);

        service.markRequiresAnalysis(List.of(jingle, ad));

        verify(segmentRepository).renameUnrecognized(List.of(ad.getId()), "Ads");
    }

    @Test
    void ruleWithSkipTranscriptionOffStillSuppressesTheGap() {
        channelWithMondayShift();
        UnrecognizedCategory category = new UnrecognizedCategory(channel, "News");
        TitleMappingRule rule = new TitleMappingRule(category, "Jingle A", "Song B");
        rule.setSkipTranscription(false);
        when(titleMappingRuleRepository.findActiveByChannelIn(Set.of(channel.getId()))).thenReturn(List.of(rule));
        AnalysisCandidate jingle = candidate(0, 30, true, "Jingle A");
        AnalysisCandidate gap = candidate(30, 300, false, null);
        AnalysisCandidate song = candidate(300, 500, true, "Song B");

        EligibilityResult result = service.markRequiresAnalysis(List.of(jingle, gap, song));

        assertThat(gap.isRequiresAnalysis()).isFalse();
        assertThat(gap.getSuppressedBy()).isEqualTo("title-transition");
        assertThat(result.eligibleIds()).isEmpty();
        verify(segmentRepository, never()).updateRequiresAnalysis(any(), eq(true));
        verify(segmentRepository).deactivateByIdIn(List.of(jingle.getId(), gap.getId(), song.getId()));
        verify(segmentRepository).renameUnrecognized(List.of(gap.getId()), "News");
    }

    @Test
    void emptyInputTouchesNothing() {
        EligibilityResult result = service.markRequiresAnalysis(List.of());

        assertThat(result.candidates()).isEmpty();
        verifyNoInteractions(segmentRepository, channelRepository, shiftRepository, titleMappingRuleRepository);
    }

    @Test
    void unknownChannelIsTreatedAsWithoutShifts() {
        AnalysisCandidate talk = candidate(0, 300, false, null);

        service.markRequiresAnalysis(List.of(talk));

        assertThat(talk.isRequiresAnalysis()).isFalse();
        verify(segmentRepository, never()).updateRequiresAnalysis(any(), eq(true));
        verify(segmentRepository).updateRequiresAnalysis(List.of(talk.getId()), false);
    }

    @Test
    void contextUsesConfiguredThresholds() {
        PipelineProperties properties = new PipelineProperties();
        properties.getEligibility().setMinimumDurationSeconds(30);
        properties.getEligibility().setSuppressionMinutes(5);
        EligibilityService configured = new EligibilityService(new EligibilityEngine(), segmentRepository,
                channelRepository, shiftRepository, titleMappingRuleRepository, properties);

        EligibilityContext context = configured.loadContext(List.of(channel.getId()));

        assertThat(context.minimumDurationSeconds()).isEqualTo(30);
        assertThat(context.suppressionDuration()).isEqualTo(Duration.ofMinutes(5));
        assertThat(context.shiftsFor(channel.getId()).hasShifts()).isFalse();
    }
}
