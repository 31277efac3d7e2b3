package com.example.airtime_backend.engine.Interfaces;

import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.timeline.RecognitionEvent;

import java.time.LocalDate;
import java.util.List;

public interface RecognitionProvider {
    /**
     * @param channel channel whose provider ids are queried.
     * @param day     UTC day to fetch.
     * @return recognition events of that day, in the order the provider reports them.
     */
    List<RecognitionEvent> fetchEvents(Channel channel, LocalDate day) throws Exception;
}
