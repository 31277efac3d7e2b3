package com.example.airtime_backend.service;

import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.model.Channel;
import com.example.airtime_backend.model.FilterSchedule;
import com.example.airtime_backend.model.PredefinedFilter;
import com.example.airtime_backend.model.Shift;
import com.example.airtime_backend.repository.AudioSegmentRepository;
import com.example.airtime_backend.repository.ChannelRepository;
import com.example.airtime_backend.repository.PredefinedFilterRepository;
import com.example.airtime_backend.repository.ShiftRepository;
import com.example.airtime_backend.schedule.LocalDayWindowBuilder;
import com.example.airtime_backend.schedule.ShiftDefinition;
import com.example.airtime_backend.schedule.ShiftMembership;
import com.example.airtime_backend.schedule.TimeWindow;
import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Shift and predefined-filter membership of channel segments, both as in-memory checks and as
 * query predicates that OR one overlap clause per produced window.
 */
@Service
public class ShiftFilterService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShiftFilterService.class);

    private final ShiftRepository shiftRepository;
    private final ChannelRepository channelRepository;
    private final PredefinedFilterRepository predefinedFilterRepository;
    private final AudioSegmentRepository segmentRepository;

    public ShiftFilterService(ShiftRepository shiftRepository,
                              ChannelRepository channelRepository,
                              PredefinedFilterRepository predefinedFilterRepository,
                              AudioSegmentRepository segmentRepository) {
        this.shiftRepository = shiftRepository;
        this.channelRepository = channelRepository;
        this.predefinedFilterRepository = predefinedFilterRepository;
        this.segmentRepository = segmentRepository;
    }

    @Transactional(readOnly = true)
    public ShiftMembership membershipFor(UUID channelId) {
        Channel channel = channelRepository.findById(channelId).orElseThrow();
        List<ShiftDefinition> definitions = new ArrayList<>();
        for (Shift shift : shiftRepository.findActiveByChannel(channelId)) {
            try {
                definitions.add(ShiftDefinition.from(shift));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Skipping shift {} with invalid days={} err={}", shift.getId(), shift.getDays(), e.getMessage());
            }
        }
        return new ShiftMembership(definitions, channel.zoneId());
    }

    /**
     * @return whether {@code [utcStart, utcEnd)} overlaps any active shift window of the channel;
     * false for a channel without active shifts.
     */
    @Transactional(readOnly = true)
    public boolean isWithinAnyShift(UUID channelId, Instant utcStart, Instant utcEnd) {
        return membershipFor(channelId).isWithinAnyShift(utcStart, utcEnd);
    }

    /**
     * Predicate matching the shift channel's segments that overlap a shift window inside
     * {@code [utcStart, utcEnd)}. An empty or inverted range matches nothing.
     *
     * @throws java.util.NoSuchElementException when the shift does not exist.
     */
    @Transactional(readOnly = true)
    public Specification<AudioSegment> buildShiftFilterPredicate(UUID shiftId, Instant utcStart, Instant utcEnd) {
        if (utcStart == null || utcEnd == null || !utcEnd.isAfter(utcStart)) {
            return matchNothing();
        }
        Shift shift = shiftRepository.findById(shiftId).orElseThrow();
        Channel channel = shift.getChannel();
        List<TimeWindow> windows = shiftWindows(ShiftDefinition.from(shift), channel.zoneId(), new TimeWindow(utcStart, utcEnd));
        LOGGER.debug("SHIFT predicate shift={} channel={} windows={}", shiftId, channel.getId(), windows.size());
        return overlapsAny(channel.getId(), windows);
    }

    @Transactional(readOnly = true)
    public List<AudioSegment> filterSegmentsByShift(UUID shiftId, Instant utcStart, Instant utcEnd) {
        return segmentRepository.findAll(buildShiftFilterPredicate(shiftId, utcStart, utcEnd), Sort.by("startTime"));
    }

    /**
     * Predicate for a predefined filter: each schedule applies on its own weekday in the filter
     * timezone, and overnight schedules of the previous day contribute their after-midnight tail.
     */
    @Transactional(readOnly = true)
    public Specification<AudioSegment> buildPredefinedFilterPredicate(UUID filterId, Instant utcStart, Instant utcEnd) {
        if (utcStart == null || utcEnd == null || !utcEnd.isAfter(utcStart)) {
            return matchNothing();
        }
        PredefinedFilter filter = predefinedFilterRepository.findWithSchedules(filterId).orElseThrow();
        ZoneId zone = resolveZone(filter.getTimezone());
        TimeWindow range = new TimeWindow(utcStart, utcEnd);

        List<TimeWindow> windows = new ArrayList<>();
        LocalDate last = utcEnd.atZone(zone).toLocalDate();
        for (LocalDate day = utcStart.atZone(zone).toLocalDate(); !day.isAfter(last); day = day.plusDays(1)) {
            LocalDate prev = day.minusDays(1);
            for (FilterSchedule schedule : filter.getSchedules()) {
                if (schedule.getDayOfWeek() == day.getDayOfWeek()) {
                    addClipped(windows, LocalDayWindowBuilder.buildLocalDayWindows(schedule.getStartTime(), schedule.getEndTime(), day, zone), range);
                }
                if (schedule.isOvernight() && schedule.getDayOfWeek() == prev.getDayOfWeek()) {
                    addClipped(windows, LocalDayWindowBuilder.buildLocalDayWindows(schedule.getStartTime(), schedule.getEndTime(), prev, zone), range);
                }
            }
        }
        LOGGER.debug("FILTER predicate filter={} channel={} windows={}", filterId, filter.getChannel().getId(), windows.size());
        return overlapsAny(filter.getChannel().getId(), windows);
    }

    @Transactional(readOnly = true)
    public List<AudioSegment> filterByPredefinedFilter(UUID filterId, Instant utcStart, Instant utcEnd) {
        return segmentRepository.findAll(buildPredefinedFilterPredicate(filterId, utcStart, utcEnd), Sort.by("startTime"));
    }

    /**
     * Windows of one shift clipped to {@code range}, starting one local day early so the tail of
     * an overnight shift from the evening before is included. Sorted by start.
     */
    public static List<TimeWindow> shiftWindows(ShiftDefinition shift, ZoneId zone, TimeWindow range) {
        List<TimeWindow> windows = new ArrayList<>();
        LocalDate last = range.end().atZone(zone).toLocalDate();
        for (LocalDate day = range.start().atZone(zone).toLocalDate().minusDays(1); !day.isAfter(last); day = day.plusDays(1)) {
            if (shift.appliesOn(day.getDayOfWeek())) {
                addClipped(windows, LocalDayWindowBuilder.buildLocalDayWindows(shift.start(), shift.end(), day, zone), range);
            }
        }
        windows.sort(Comparator.comparing(TimeWindow::start));
        return windows;
    }

    static Specification<AudioSegment> overlapsAny(UUID channelId, List<TimeWindow> windows) {
        if (windows.isEmpty()) {
            return matchNothing();
        }
        List<TimeWindow> copy = List.copyOf(windows);
        return (root, query, cb) -> {
            List<Predicate> ors = new ArrayList<>();
            for (TimeWindow window : copy) {
                ors.add(cb.and(
                        cb.lessThan(root.<Instant>get("startTime"), window.end()),
                        cb.greaterThan(root.<Instant>get("endTime"), window.start())));
            }
            return cb.and(
                    cb.equal(root.get("channel").get("id"), channelId),
                    cb.or(ors.toArray(new Predicate[0])));
        };
    }

    static Specification<AudioSegment> matchNothing() {
        return (root, query, cb) -> cb.disjunction();
    }

    private static void addClipped(List<TimeWindow> out, List<TimeWindow> windows, TimeWindow range) {
        for (TimeWindow window : windows) {
            window.intersect(range).ifPresent(out::add);
        }
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            LOGGER.warn("Invalid filter timezone={}, using UTC", timezone);
            return ZoneOffset.UTC;
        }
    }
}
