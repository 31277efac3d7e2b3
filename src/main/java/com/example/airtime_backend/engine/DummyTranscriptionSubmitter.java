package com.example.airtime_backend.engine;

import com.example.airtime_backend.engine.Interfaces.TranscriptionSubmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DummyTranscriptionSubmitter implements TranscriptionSubmitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(DummyTranscriptionSubmitter.class);

    @Override
    public int submit(List<TranscriptionRequest> requests) {
        int accepted = 0;
        for (TranscriptionRequest request : requests) {
            if (request.requiresAnalysis()) {
                accepted++;
            }
        }
        LOGGER.info("TRANSCRIBE dummy submit requests={} accepted={}", requests.size(), accepted);
        return accepted;
    }
}
