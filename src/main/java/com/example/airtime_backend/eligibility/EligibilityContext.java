package com.example.airtime_backend.eligibility;

import com.example.airtime_backend.schedule.ShiftMembership;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Configuration snapshot for one evaluation: per-channel title rules and shift membership plus
 * the rule thresholds. Channels missing from either map have no rules or no shifts.
 */
public record EligibilityContext(Map<UUID, List<TitleRuleDefinition>> titleRules,
                                 Map<UUID, ShiftMembership> shifts,
                                 int minimumDurationSeconds,
                                 Duration suppressionDuration) {

    public static final int DEFAULT_MINIMUM_DURATION_SECONDS = 10;
    public static final Duration DEFAULT_SUPPRESSION = Duration.ofMinutes(10);

    public EligibilityContext {
        titleRules = Map.copyOf(titleRules);
        shifts = Map.copyOf(shifts);
    }

    public EligibilityContext(Map<UUID, List<TitleRuleDefinition>> titleRules, Map<UUID, ShiftMembership> shifts) {
        this(titleRules, shifts, DEFAULT_MINIMUM_DURATION_SECONDS, DEFAULT_SUPPRESSION);
    }

    public List<TitleRuleDefinition> titleRulesFor(UUID channelId) {
        return titleRules.getOrDefault(channelId, List.of());
    }

    public ShiftMembership shiftsFor(UUID channelId) {
        ShiftMembership membership = shifts.get(channelId);
        return membership != null ? membership : new ShiftMembership(List.of(), ZoneOffset.UTC);
    }
}
