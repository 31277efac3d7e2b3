package com.example.airtime_backend.dto;

import com.example.airtime_backend.util.RunStatus;

import java.time.LocalDate;
import java.util.UUID;

public record PipelineRunResult(UUID channelId,
                                LocalDate day,
                                RunStatus status,
                                int events,
                                int segments,
                                int merged,
                                int eligible,
                                int submitted,
                                String message) {

    public static PipelineRunResult empty(UUID channelId, LocalDate day, String message) {
        return new PipelineRunResult(channelId, day, RunStatus.SKIPPED, 0, 0, 0, 0, 0, message);
    }

    public static PipelineRunResult failed(UUID channelId, LocalDate day, String message) {
        return new PipelineRunResult(channelId, day, RunStatus.FAILED, 0, 0, 0, 0, 0, message);
    }
}
