package com.example.airtime_backend.eligibility;

import java.util.List;
import java.util.UUID;

public record EligibilityResult(List<AnalysisCandidate> candidates, List<TitleRename> renames) {

    public List<UUID> eligibleIds() {
        return candidates.stream().filter(AnalysisCandidate::isRequiresAnalysis).map(AnalysisCandidate::getId).toList();
    }

    public List<UUID> ineligibleIds() {
        return candidates.stream().filter(c -> !c.isRequiresAnalysis()).map(AnalysisCandidate::getId).toList();
    }
}
