package com.example.airtime_backend.eligibility;

import java.util.List;
import java.util.UUID;

/** Recognized tracks are never analyzed. */
public class RecognizedSegmentRule implements EligibilityRule {
    @Override
    public String name() {
        return "recognized";
    }

    @Override
    public void apply(UUID channelId, List<AnalysisCandidate> timeline, EligibilityContext context, List<TitleRename> renames) {
        for (AnalysisCandidate candidate : timeline) {
            if (candidate.isRecognized()) {
                candidate.suppress(name());
            }
        }
    }
}
