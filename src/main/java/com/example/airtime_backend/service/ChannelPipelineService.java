package com.example.airtime_backend.service;

import com.example.airtime_backend.dto.PipelineRunResult;
import com.example.airtime_backend.eligibility.AnalysisCandidate;
import com.example.airtime_backend.eligibility.EligibilityResult;
import com.example.airtime_backend.engine.Interfaces.RecognitionProvider;
import com.example.airtime_backend.engine.Interfaces.TranscriptionSubmitter;
import com.example.airtime_backend.engine.Interfaces.TranscriptionSubmitter.TranscriptionRequest;
import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.repository.ChannelRepository;
import com.example.airtime_backend.timeline.RecognitionEvent;
import com.example.airtime_backend.timeline.SegmentCandidate;
import com.example.airtime_backend.timeline.TimelineSynthesizer;
import com.example.airtime_backend.util.RunStatus;
import com.example.airtime_backend.util.SegmentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs the whole segment pipeline for one channel and day: fetch, synthesize, ingest, merge,
 * eligibility and transcription hand-off. Stages run in sequence and each commits its own work,
 * so eligibility always reads the merged state.
 */
@Service
public class ChannelPipelineService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelPipelineService.class);

    private final ChannelRepository channelRepository;
    private final RecognitionProvider recognitionProvider;
    private final TimelineSynthesizer synthesizer;
    private final SegmentIngestService ingestService;
    private final SegmentMergeService mergeService;
    private final EligibilityService eligibilityService;
    private final TranscriptionSubmitter transcriptionSubmitter;

    public ChannelPipelineService(ChannelRepository channelRepository,
                                  RecognitionProvider recognitionProvider,
                                  TimelineSynthesizer synthesizer,
                                  SegmentIngestService ingestService,
                                  SegmentMergeService mergeService,
                                  EligibilityService eligibilityService,
                                  TranscriptionSubmitter transcriptionSubmitter) {
        this.channelRepository = channelRepository;
        this.recognitionProvider = recognitionProvider;
        this.synthesizer = synthesizer;
        this.ingestService = ingestService;
        this.mergeService = mergeService;
        this.eligibilityService = eligibilityService;
        this.transcriptionSubmitter = transcriptionSubmitter;
    }

    /**
     * @param channelId channel to process.
     * @param day       UTC day whose recognition events are fetched.
     * @param cutoff    events starting at or after this instant are ignored; {@code null} keeps all.
     * @return outcome of the run; failures are reported, never thrown.
     */
    public PipelineRunResult runChannel(UUID channelId, LocalDate day, Instant cutoff) {
        long t0 = System.nanoTime();
        try {
            Channel channel = channelRepository.findById(channelId).orElseThrow();
            List<RecognitionEvent> events = beforeCutoff(recognitionProvider.fetchEvents(channel, day), cutoff);
            if (events.isEmpty()) {
                LOGGER.info("PIPELINE no events channel={} day={} cutoff={}", channelId, day, cutoff);
                return PipelineRunResult.empty(channelId, day, "no events");
            }

            List<SegmentCandidate> candidates = synthesizer.synthesize(events, channel);
            if (candidates.isEmpty()) {
                return PipelineRunResult.empty(channelId, day, "no segments synthesized");
            }

            List<AudioSegment> inserted = ingestService.insertSegments(channelId, candidates);
            List<AudioSegment> merged = mergeService.mergeShortRecognizedSegments(channelId, inserted);
            int mergedCount = (int) merged.stream().filter(s -> s.getSource() == SegmentSource.MERGED).count();

            List<AnalysisCandidate> analysis = new ArrayList<>();
            for (AudioSegment segment : merged) {
                analysis.add(AnalysisCandidate.from(segment, channelId));
            }
            EligibilityResult eligibility = eligibilityService.markRequiresAnalysis(analysis);

            List<TranscriptionRequest> requests = new ArrayList<>();
            for (AnalysisCandidate candidate : eligibility.candidates()) {
                if (candidate.isRequiresAnalysis()) {
                    requests.add(new TranscriptionRequest(candidate.getId(), true));
                }
            }
            int submitted = requests.isEmpty() ? 0 : transcriptionSubmitter.submit(requests);

            LOGGER.info("PIPELINE done channel={} day={} events={} segments={} merged={} eligible={} submitted={} in={}ms",
                    channelId, day, events.size(), merged.size(), mergedCount, requests.size(), submitted,
                    (System.nanoTime() - t0) / 1_000_000);
            return new PipelineRunResult(channelId, day, RunStatus.SUCCESS, events.size(), merged.size(),
                    mergedCount, requests.size(), submitted, null);
        } catch (Exception e) {
            LOGGER.error("PIPELINE failed channel={} day={} err={}", channelId, day, e.toString(), e);
            return PipelineRunResult.failed(channelId, day, e.getMessage());
        }
    }

    static List<RecognitionEvent> beforeCutoff(List<RecognitionEvent> events, Instant cutoff) {
        if (cutoff == null) {
            return events;
        }
        List<RecognitionEvent> kept = new ArrayList<>();
        for (RecognitionEvent event : events) {
            if (event.timestampUtc() != null && event.timestampUtc().isBefore(cutoff)) {
                kept.add(event);
            }
        }
        return kept;
    }
}
