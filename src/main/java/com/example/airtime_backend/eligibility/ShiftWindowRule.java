package com.example.airtime_backend.eligibility;

import com.example.airtime_backend.schedule.ShiftMembership;

import java.util.List;
import java.util.UUID;

/** Audio outside every active shift window of its channel is not analyzed; no shifts suppresses everything. */
public class ShiftWindowRule implements EligibilityRule {
    @Override
    public String name() {
        return "shift-window";
    }

    @Override
    public void apply(UUID channelId, List<AnalysisCandidate> timeline, EligibilityContext context, List<TitleRename> renames) {
        ShiftMembership membership = context.shiftsFor(channelId);
        for (AnalysisCandidate candidate : timeline) {
            if (!membership.isWithinAnyShift(candidate.getStart(), candidate.getEnd())) {
                candidate.suppress(name());
            }
        }
    }
}
