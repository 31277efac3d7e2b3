package com.example.airtime_backend.eligibility;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Decides per segment whether transcription and analysis should run.
 *
 * <p>Every candidate starts eligible. The rules run in order on each channel's timeline sorted by
 * start and can only mark candidates ineligible, so the order between suppressing rules does not
 * change the outcome. Renames are applied after all rules ran; a later rename of the same segment
 * wins.</p>
 */
public class EligibilityEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(EligibilityEngine.class);

    private final List<EligibilityRule> rules;

    public EligibilityEngine() {
        this(List.of(
                new RecognizedSegmentRule(),
                new MinimumDurationRule(),
                new TitleTransitionRule(),
                new ShiftWindowRule()));
    }

    public EligibilityEngine(List<EligibilityRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public EligibilityResult markRequiresAnalysis(List<AnalysisCandidate> candidates, EligibilityContext context) {
        Map<UUID, List<AnalysisCandidate>> byChannel = new LinkedHashMap<>();
        for (AnalysisCandidate candidate : candidates) {
            byChannel.computeIfAbsent(candidate.getChannelId(), k -> new ArrayList<>()).add(candidate);
        }

        List<TitleRename> renames = new ArrayList<>();
        for (Map.Entry<UUID, List<AnalysisCandidate>> entry : byChannel.entrySet()) {
            List<AnalysisCandidate> timeline = entry.getValue();
            timeline.sort(Comparator.comparing(AnalysisCandidate::getStart));
            for (EligibilityRule rule : rules) {
                rule.apply(entry.getKey(), timeline, context, renames);
            }
        }

        Map<UUID, AnalysisCandidate> byId = new LinkedHashMap<>();
        candidates.forEach(c -> byId.put(c.getId(), c));
        for (TitleRename rename : renames) {
            AnalysisCandidate target = byId.get(rename.segmentId());
            if (target != null) {
                target.rename(rename.title());
            }
        }

        long eligible = candidates.stream().filter(AnalysisCandidate::isRequiresAnalysis).count();
        LOGGER.info("ELIGIBILITY evaluated candidates={} channels={} eligible={} renames={}",
                candidates.size(), byChannel.size(), eligible, renames.size());
        return new EligibilityResult(List.copyOf(candidates), List.copyOf(renames));
    }

    public List<EligibilityRule> getRules() {
        return rules;
    }
}
