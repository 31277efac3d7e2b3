package com.example.airtime_backend.eligibility;

import com.example.airtime_backend.model.AudioSegment;

import java.time.Instant;
import java.util.UUID;

/**
 * Segment view evaluated by the {@link EligibilityEngine}. Starts out eligible; rules can only
 * mark it ineligible.
 */
public class AnalysisCandidate {
    private final UUID id;
    private final UUID channelId;
    private final String title;
    private final Instant start;
    private final Instant end;
    private final Integer durationSeconds;
    private final boolean recognized;

    private boolean requiresAnalysis = true;
    private String suppressedBy;
    private String renamedTo;

    public AnalysisCandidate(UUID id, UUID channelId, String title, Instant start, Instant end,
                             Integer durationSeconds, boolean recognized) {
        this.id = id;
        this.channelId = channelId;
        this.title = title;
        this.start = start;
        this.end = end;
        this.durationSeconds = durationSeconds;
        this.recognized = recognized;
    }

    public static AnalysisCandidate from(AudioSegment segment) {
        return from(segment, segment.getChannel().getId());
    }

    public static AnalysisCandidate from(AudioSegment segment, UUID channelId) {
        return new AnalysisCandidate(segment.getId(), channelId, segment.getTitle(),
                segment.getStartTime(), segment.getEndTime(), segment.getDurationSeconds(), segment.isRecognized());
    }

    /**
     * Marks the candidate ineligible. The first rule to suppress is kept for logging.
     */
    public void suppress(String rule) {
        if (requiresAnalysis) {
            suppressedBy = rule;
        }
        requiresAnalysis = false;
    }

    void rename(String newTitle) {
        this.renamedTo = newTitle;
    }

    public UUID getId() { return id; }
    public UUID getChannelId() { return channelId; }
    public String getTitle() { return title; }
    public Instant getStart() { return start; }
    public Instant getEnd() { return end; }
    public Integer getDurationSeconds() { return durationSeconds; }
    public boolean isRecognized() { return recognized; }
    public boolean isRequiresAnalysis() { return requiresAnalysis; }
    public String getSuppressedBy() { return suppressedBy; }
    public String getRenamedTo() { return renamedTo; }

    @Override
    public String toString() {
        return "AnalysisCandidate{id=" + id + ", title=" + title + ", start=" + start + ", end=" + end
                + ", requiresAnalysis=" + requiresAnalysis + (suppressedBy != null ? ", by=" + suppressedBy : "") + "}";
    }
}
