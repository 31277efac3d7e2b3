package com.example.airtime_backend.service;

import com.example.airtime_backend.dto.PipelineRunResult;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.repository.ChannelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Fans out one pipeline task per active channel. The hourly tick processes today up to the last
 * completed hour minus one; the daily tick reprocesses the whole previous day.
 */
@Service
@ConditionalOnProperty(name = "pipeline.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class PipelineScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineScheduler.class);

    private final ChannelRepository channelRepository;
    private final ChannelPipelineService pipelineService;
    private final TaskExecutor pipelineExecutor;
    private final Clock clock;

    public PipelineScheduler(ChannelRepository channelRepository,
                             ChannelPipelineService pipelineService,
                             @Qualifier("pipelineTaskExecutor") TaskExecutor pipelineExecutor,
                             Clock clock) {
        this.channelRepository = channelRepository;
        this.pipelineService = pipelineService;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
    }

    @Scheduled(cron = "${pipeline.scheduling.hourly-cron:0 5 * * * *}", zone = "UTC")
    public void processToday() {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        Instant cutoff = todayCutoff(now);
        if (LocalDate.ofInstant(cutoff, ZoneOffset.UTC).isBefore(today)) {
            LOGGER.info("SCHEDULER today skipped, no completed hour yet now={}", now);
            return;
        }
        dispatch(today, cutoff);
    }

    @Scheduled(cron = "${pipeline.scheduling.daily-cron:0 0 2 * * *}", zone = "UTC")
    public void processPreviousDay() {
        LocalDate previousDay = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1);
        dispatch(previousDay, null);
    }

    /**
     * Start of the hour one hour before {@code now}; events from that instant on are left for a
     * later tick.
     */
    static Instant todayCutoff(Instant now) {
        return now.minus(Duration.ofHours(1)).truncatedTo(ChronoUnit.HOURS);
    }

    int dispatch(LocalDate day, Instant cutoff) {
        List<Channel> channels = channelRepository.findByActiveTrueAndDeletedFalse();
        int submitted = 0;
        for (Channel channel : channels) {
            try {
                pipelineExecutor.execute(() -> runAndLog(channel, day, cutoff));
                submitted++;
            } catch (TaskRejectedException e) {
                LOGGER.warn("SCHEDULER rejected channel={} day={} err={}", channel.getId(), day, e.toString());
            }
        }
        LOGGER.info("SCHEDULER dispatched day={} cutoff={} channels={} submitted={}", day, cutoff, channels.size(), submitted);
        return submitted;
    }

    private void runAndLog(Channel channel, LocalDate day, Instant cutoff) {
        PipelineRunResult result = pipelineService.runChannel(channel.getId(), day, cutoff);
        LOGGER.info("SCHEDULER channel={} day={} status={} segments={} eligible={}",
                result.channelId(), result.day(), result.status(), result.segments(), result.eligible());
    }
}
