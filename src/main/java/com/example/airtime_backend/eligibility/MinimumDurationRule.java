package com.example.airtime_backend.eligibility;

import java.util.List;
import java.util.UUID;

/** Unrecognized audio shorter than the minimum is not worth transcribing. Unknown duration keeps the default. */
public class MinimumDurationRule implements EligibilityRule {
    @Override
    public String name() {
        return "minimum-duration";
    }

    @Override
    public void apply(UUID channelId, List<AnalysisCandidate> timeline, EligibilityContext context, List<TitleRename> renames) {
        for (AnalysisCandidate candidate : timeline) {
            if (candidate.isRecognized()) {
                continue;
            }
            Integer duration = candidate.getDurationSeconds();
            if (duration != null && duration < context.minimumDurationSeconds()) {
                candidate.suppress(name());
            }
        }
    }
}
