package com.example.airtime_backend.eligibility;

import java.util.List;
import java.util.UUID;

/**
 * One suppression rule. Rules run per channel over the start-ordered timeline and may only mark
 * candidates ineligible; renames are reported through {@code renames}.
 */
public interface EligibilityRule {
    String name();

    void apply(UUID channelId, List<AnalysisCandidate> timeline, EligibilityContext context, List<TitleRename> renames);
}
