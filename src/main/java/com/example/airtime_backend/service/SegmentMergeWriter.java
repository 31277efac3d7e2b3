package com.example.airtime_backend.service;

import com.example.airtime_backend.merge.MergePlan;
import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.model.SegmentEditLog;
import com.example.airtime_backend.repository.AudioSegmentRepository;
import com.example.airtime_backend.repository.ChannelRepository;
import com.example.airtime_backend.repository.SegmentEditLogRepository;
import com.example.airtime_backend.util.EditAction;
import com.example.airtime_backend.util.SegmentFileNames;
import com.example.airtime_backend.util.SegmentSource;
import com.example.airtime_backend.util.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies one {@link MergePlan} in its own transaction: writes the merged segment, soft-deletes
 * the constituents and records the audit entry.
 */
@Component
public class SegmentMergeWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentMergeWriter.class);

    private final AudioSegmentRepository segmentRepository;
    private final ChannelRepository channelRepository;
    private final SegmentEditLogRepository editLogRepository;

    public SegmentMergeWriter(AudioSegmentRepository segmentRepository,
                              ChannelRepository channelRepository,
                              SegmentEditLogRepository editLogRepository) {
        this.segmentRepository = segmentRepository;
        this.channelRepository = channelRepository;
        this.editLogRepository = editLogRepository;
    }

    /**
     * @return the merged segment, or empty when a constituent is gone, already merged or deleted.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<AudioSegment> apply(UUID channelId, MergePlan plan) {
        List<UUID> sourceIds = plan.sourceIds();
        List<AudioSegment> sources = segmentRepository.findAllById(sourceIds);
        if (sources.size() != sourceIds.size()) {
            LOGGER.info("MERGE skip missing sources channel={} expected={} found={}", channelId, sourceIds, sources.size());
            return Optional.empty();
        }
        for (AudioSegment source : sources) {
            if (source.isMergedOrDeleted()) {
                LOGGER.info("MERGE skip already merged/deleted channel={} segment={} source={} deleted={}",
                        channelId, source.getId(), source.getSource(), source.isDeleted());
                return Optional.empty();
            }
        }

        Channel channel = channelRepository.findById(channelId).orElseThrow();
        int duration = plan.durationSeconds();
        String filePath = SegmentFileNames.filePath(channel, plan.start(), duration);

        Optional<AudioSegment> existing = segmentRepository.findByFilePath(filePath);
        if (existing.isPresent() && sourceIds.contains(existing.get().getId())) {
            LOGGER.warn("MERGE skip path collides with a source channel={} path={} segment={}",
                    channelId, filePath, existing.get().getId());
            return Optional.empty();
        }
        AudioSegment merged = existing.orElseGet(() -> new AudioSegment(channel, plan.start(), plan.end()));
        merged.setRange(plan.start(), plan.end());
        merged.setRecognized(plan.recognized());
        merged.setTitle(plan.title());
        merged.setTitleBefore(plan.titleBefore());
        merged.setTitleAfter(plan.titleAfter());
        merged.setMetadata(plan.metadata());
        merged.setSource(SegmentSource.MERGED);
        merged.setActive(true);
        merged.setDeleted(false);
        merged.setFileName(SegmentFileNames.fileName(channel, plan.start(), duration));
        merged.setFilePath(filePath);
        merged.validate();
        merged = segmentRepository.save(merged);

        for (AudioSegment source : sources) {
            source.setDeleted(true);
            source.setActive(false);
            source.setNotes("Merged into segment ID:" + merged.getId());
        }
        segmentRepository.saveAll(sources);

        String key = SegmentEditLog.sourceKey(sourceIds);
        if (editLogRepository.existsByAudioSegmentIdAndActionAndSourceSegmentIds(merged.getId(), EditAction.MERGE, key)) {
            LOGGER.debug("MERGE audit exists merged={} sources={}", merged.getId(), key);
        } else {
            SegmentEditLog log = new SegmentEditLog(merged, EditAction.MERGE, TriggerType.AUTOMATIC, sourceIds);
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("start", plan.start().toString());
            meta.put("end", plan.end().toString());
            meta.put("durationSeconds", duration);
            meta.put("recognized", plan.recognized());
            log.setMetadata(meta);
            log.setNotes("Automatic merge of short recognized segment");
            editLogRepository.save(log);
        }

        LOGGER.info("MERGE done channel={} merged={} sources={} span={}..{}",
                channelId, merged.getId(), key, plan.start(), plan.end());
        return Optional.of(merged);
    }
}
