package com.example.airtime_backend.engine;

import com.example.airtime_backend.engine.Interfaces.RecognitionProvider;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.timeline.RecognitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Service
public class DummyRecognitionProvider implements RecognitionProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(DummyRecognitionProvider.class);

    @Override
    public List<RecognitionEvent> fetchEvents(Channel channel, LocalDate day) {
        LOGGER.debug("RECOGNITION dummy fetch channel={} project={} acrChannel={} day={}",
                channel.getId(), channel.getProjectId(), channel.getAcrChannelId(), day);
        return List.of();
    }
}
