package com.example.airtime_backend.eligibility;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Suppresses the audio that follows a configured title up to the next expected title, capped at
 * the suppression duration, and renames the unrecognized segment right after the title to the
 * rule's category.
 *
 * <p>A rule without an after-title suppresses only the matching segments themselves.</p>
 */
public class TitleTransitionRule implements EligibilityRule {
    private static final Logger LOGGER = LoggerFactory.getLogger(TitleTransitionRule.class);

    @Override
    public String name() {
        return "title-transition";
    }

    @Override
    public void apply(UUID channelId, List<AnalysisCandidate> timeline, EligibilityContext context, List<TitleRename> renames) {
        List<TitleRuleDefinition> rules = context.titleRulesFor(channelId);
        if (rules.isEmpty() || timeline.isEmpty()) {
            return;
        }

        Map<String, List<Integer>> titleIndex = indexByTitle(timeline);
        List<Interval> intervals = new ArrayList<>();
        for (TitleRuleDefinition rule : rules) {
            List<Integer> beforeIdx = titleIndex.getOrDefault(rule.beforeTitle(), List.of());
            if (beforeIdx.isEmpty()) {
                continue;
            }
            intervals.addAll(suppressionIntervals(rule, beforeIdx, titleIndex, timeline, context));
            for (int b : beforeIdx) {
                int next = b + 1;
                if (next < timeline.size() && !timeline.get(next).isRecognized()) {
                    renames.add(new TitleRename(timeline.get(next).getId(), rule.categoryName(), rule.id()));
                }
            }
        }

        List<Interval> merged = mergeIntervals(intervals);
        if (merged.isEmpty()) {
            return;
        }
        int suppressed = 0;
        for (AnalysisCandidate candidate : timeline) {
            for (Interval interval : merged) {
                if (interval.touches(candidate.getStart(), candidate.getEnd())) {
                    candidate.suppress(name());
                    suppressed++;
                    break;
                }
            }
        }
        LOGGER.debug("TITLE RULES channel={} intervals={} suppressed={}", channelId, merged.size(), suppressed);
    }

    private static List<Interval> suppressionIntervals(TitleRuleDefinition rule,
                                                       List<Integer> beforeIdx,
                                                       Map<String, List<Integer>> titleIndex,
                                                       List<AnalysisCandidate> timeline,
                                                       EligibilityContext context) {
        List<Interval> out = new ArrayList<>();
        if (!rule.hasAfterTitle()) {
            for (int b : beforeIdx) {
                AnalysisCandidate before = timeline.get(b);
                out.add(new Interval(before.getStart(), before.getEnd()));
            }
            return out;
        }

        List<Integer> afterIdx = titleIndex.getOrDefault(rule.afterTitle(), List.of());
        for (int b : beforeIdx) {
            AnalysisCandidate before = timeline.get(b);
            Instant capEnd = before.getStart().plus(context.suppressionDuration());
            Instant end = capEnd;
            for (int a : afterIdx) {
                if (a > b) {
                    Instant afterStart = timeline.get(a).getStart();
                    end = afterStart.isBefore(capEnd) ? afterStart : capEnd;
                    break;
                }
            }
            if (end.isAfter(before.getStart())) {
                out.add(new Interval(before.getStart(), end));
            }
        }
        return out;
    }

    private static Map<String, List<Integer>> indexByTitle(List<AnalysisCandidate> timeline) {
        Map<String, List<Integer>> index = new HashMap<>();
        for (int i = 0; i < timeline.size(); i++) {
            String title = timeline.get(i).getTitle();
            if (title != null) {
                index.computeIfAbsent(title, k -> new ArrayList<>()).add(i);
            }
        }
        return index;
    }

    static List<Interval> mergeIntervals(List<Interval> intervals) {
        if (intervals.isEmpty()) {
            return List.of();
        }
        List<Interval> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.comparing(Interval::start));
        List<Interval> merged = new ArrayList<>();
        Interval current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            Interval next = sorted.get(i);
            if (!next.start().isAfter(current.end())) {
                current = new Interval(current.start(), next.end().isAfter(current.end()) ? next.end() : current.end());
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    record Interval(Instant start, Instant end) {
        boolean touches(Instant segStart, Instant segEnd) {
            return !segStart.isAfter(end) && segEnd.isAfter(start);
        }
    }
}
