package com.example.airtime_backend.engine.Interfaces;

import java.util.List;
import java.util.UUID;

public interface TranscriptionSubmitter {
    record TranscriptionRequest(UUID segmentId, boolean requiresAnalysis) {}

    /**
     * Hands eligible segments to the transcription provider. Whether a job already exists for a
     * segment is the submitter's call.
     *
     * @return number of requests accepted.
     */
    int submit(List<TranscriptionRequest> requests) throws Exception;
}
