package com.example.airtime_backend.service;

import com.example.airtime_backend.config.PipelineProperties;
import com.example.airtime_backend.eligibility.AnalysisCandidate;
import com.example.airtime_backend.eligibility.EligibilityContext;
import com.example.airtime_backend.eligibility.EligibilityEngine;
import com.example.airtime_backend.eligibility.EligibilityResult;
import com.example.airtime_backend.eligibility.TitleRename;
import com.example.airtime_backend.eligibility.TitleRuleDefinition;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.model.Shift;
import com.example.airtime_backend.model.TitleMappingRule;
import com.example.airtime_backend.repository.AudioSegmentRepository;
import com.example.airtime_backend.repository.ChannelRepository;
import com.example.airtime_backend.repository.ShiftRepository;
import com.example.airtime_backend.repository.TitleMappingRuleRepository;
import com.example.airtime_backend.schedule.ShiftDefinition;
import com.example.airtime_backend.schedule.ShiftMembership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Loads the rule and shift configuration of the affected channels, runs the
 * {@link EligibilityEngine} and writes the outcome back: {@code requiresAnalysis} on every
 * candidate, deactivation of the ineligible ones and the category renames.
 */
@Service
public class EligibilityService {
    private static final Logger LOGGER = LoggerFactory.getLogger(EligibilityService.class);

    private final EligibilityEngine engine;
    private final AudioSegmentRepository segmentRepository;
    private final ChannelRepository channelRepository;
    private final ShiftRepository shiftRepository;
    private final TitleMappingRuleRepository titleMappingRuleRepository;
    private final PipelineProperties properties;

    public EligibilityService(EligibilityEngine engine,
                              AudioSegmentRepository segmentRepository,
                              ChannelRepository channelRepository,
                              ShiftRepository shiftRepository,
                              TitleMappingRuleRepository titleMappingRuleRepository,
                              PipelineProperties properties) {
        this.engine = engine;
        this.segmentRepository = segmentRepository;
        this.channelRepository = channelRepository;
        this.shiftRepository = shiftRepository;
        this.titleMappingRuleRepository = titleMappingRuleRepository;
        this.properties = properties;
    }

    @Transactional
    public EligibilityResult markRequiresAnalysis(List<AnalysisCandidate> candidates) {
        if (candidates.isEmpty()) {
            return new EligibilityResult(List.of(), List.of());
        }
        Set<UUID> channelIds = new LinkedHashSet<>();
        candidates.forEach(c -> channelIds.add(c.getChannelId()));

        EligibilityContext context = loadContext(channelIds);
        EligibilityResult result = engine.markRequiresAnalysis(candidates, context);
        persist(result);
        return result;
    }

    /**
     * Snapshots the active title rules and shifts of the given channels.
     */
    @Transactional(readOnly = true)
    public EligibilityContext loadContext(Collection<UUID> channelIds) {
        Map<UUID, Channel> channels = new HashMap<>();
        channelRepository.findAllById(channelIds).forEach(ch -> channels.put(ch.getId(), ch));

        Map<UUID, List<ShiftDefinition>> shiftsByChannel = new HashMap<>();
        for (Shift shift : shiftRepository.findActiveByChannelIn(channelIds)) {
            try {
                shiftsByChannel.computeIfAbsent(shift.getChannel().getId(), k -> new ArrayList<>())
                        .add(ShiftDefinition.from(shift));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Skipping shift {} ({}) with invalid days={} err={}",
                        shift.getId(), shift.getName(), shift.getDays(), e.getMessage());
            }
        }

        Map<UUID, ShiftMembership> memberships = new HashMap<>();
        for (UUID channelId : channelIds) {
            Channel channel = channels.get(channelId);
            if (channel == null) {
                LOGGER.warn("ELIGIBILITY unknown channel={}, treating as without shifts", channelId);
                continue;
            }
            memberships.put(channelId, new ShiftMembership(shiftsByChannel.getOrDefault(channelId, List.of()), channel.zoneId()));
        }

        Map<UUID, List<TitleRuleDefinition>> rulesByChannel = new HashMap<>();
        for (TitleMappingRule rule : titleMappingRuleRepository.findActiveByChannelIn(channelIds)) {
            rulesByChannel.computeIfAbsent(rule.getCategory().getChannel().getId(), k -> new ArrayList<>())
                    .add(TitleRuleDefinition.from(rule));
        }

        return new EligibilityContext(rulesByChannel, memberships,
                properties.getEligibility().getMinimumDurationSeconds(),
                Duration.ofMinutes(properties.getEligibility().getSuppressionMinutes()));
    }

    private void persist(EligibilityResult result) {
        List<UUID> eligible = result.eligibleIds();
        List<UUID> ineligible = result.ineligibleIds();
        if (!eligible.isEmpty()) {
            segmentRepository.updateRequiresAnalysis(eligible, true);
        }
        int deactivated = 0;
        if (!ineligible.isEmpty()) {
            segmentRepository.updateRequiresAnalysis(ineligible, false);
            deactivated = segmentRepository.deactivateByIdIn(ineligible);
        }

        Map<UUID, String> lastRename = new LinkedHashMap<>();
        for (TitleRename rename : result.renames()) {
            lastRename.put(rename.segmentId(), rename.title());
        }
        Map<String, List<UUID>> byTitle = new LinkedHashMap<>();
        lastRename.forEach((id, title) -> byTitle.computeIfAbsent(title, k -> new ArrayList<>()).add(id));
        int renamed = 0;
        for (Map.Entry<String, List<UUID>> entry : byTitle.entrySet()) {
            renamed += segmentRepository.renameUnrecognized(entry.getValue(), entry.getKey());
        }

        LOGGER.info("ELIGIBILITY persisted eligible={} ineligible={} deactivated={} renamed={}",
                eligible.size(), ineligible.size(), deactivated, renamed);
    }
}
