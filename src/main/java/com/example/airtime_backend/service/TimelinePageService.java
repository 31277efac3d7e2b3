package com.example.airtime_backend.service;

import com.example.airtime_backend.config.PipelineProperties;
import com.example.airtime_backend.dto.TimelinePage;
import com.example.airtime_backend.model.AudioSegment;
import com.example.airtime_backend.repository.AudioSegmentRepository;
import com.example.airtime_backend.schedule.ShiftDefinition;
import com.example.airtime_backend.schedule.TimeWindow;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Splits a bounded UTC range of a channel timeline into fixed-size hour pages, optionally
 * restricted to the windows of one shift.
 */
@Service
public class TimelinePageService {
    private final AudioSegmentRepository segmentRepository;
    private final PipelineProperties properties;
    private final Clock clock;

    public TimelinePageService(AudioSegmentRepository segmentRepository, PipelineProperties properties, Clock clock) {
        this.segmentRepository = segmentRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public TimeWindow resolveRange(Instant start, Instant end) {
        return resolveRange(start, end, clock.instant());
    }

    /**
     * Missing start means the start of today (UTC), missing end means start plus the maximum
     * range; an end past that maximum is capped.
     *
     * @throws IllegalArgumentException when the resolved end is not after the start.
     */
    public TimeWindow resolveRange(Instant start, Instant end, Instant now) {
        Instant from = start != null ? start : now.truncatedTo(ChronoUnit.DAYS);
        Instant max = from.plus(Duration.ofDays(properties.getPaging().getMaxRangeDays()));
        Instant to = end != null ? end : max;
        if (to.isAfter(max)) {
            to = max;
        }
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("Range end " + to + " must be after start " + from);
        }
        return new TimeWindow(from, to);
    }

    /**
     * Windows of {@code shift} in {@code zone} that intersect {@code range}, sorted by start.
     */
    public List<TimeWindow> shiftWindows(TimeWindow range, ShiftDefinition shift, ZoneId zone) {
        return ShiftFilterService.shiftWindows(shift, zone, range);
    }

    public int totalPages(TimeWindow range, int pageSizeHours) {
        long rangeSeconds = Duration.between(range.start(), range.end()).getSeconds();
        long pageSeconds = Duration.ofHours(pageSizeHours).getSeconds();
        return (int) Math.max(1, (rangeSeconds + pageSeconds - 1) / pageSeconds);
    }

    /**
     * @param page          1-based page number.
     * @param pageSizeHours hours per page.
     * @throws PageOutOfRangeException when the page starts at or after the end of the range.
     */
    public TimeWindow pageWindow(TimeWindow range, int page, int pageSizeHours) {
        if (pageSizeHours < 1) {
            throw new IllegalArgumentException("pageSizeHours must be >= 1");
        }
        if (page < 1) {
            throw new PageOutOfRangeException(page, totalPages(range, pageSizeHours));
        }
        Instant start = range.start().plus(Duration.ofHours((long) (page - 1) * pageSizeHours));
        if (!start.isBefore(range.end())) {
            throw new PageOutOfRangeException(page, totalPages(range, pageSizeHours));
        }
        Instant end = start.plus(Duration.ofHours(pageSizeHours));
        return new TimeWindow(start, end.isAfter(range.end()) ? range.end() : end);
    }

    @Transactional(readOnly = true)
    public List<TimelinePage> listPages(UUID channelId, TimeWindow range, int pageSizeHours, List<TimeWindow> shiftWindows) {
        List<TimelinePage> pages = new ArrayList<>();
        int total = totalPages(range, pageSizeHours);
        for (int page = 1; page <= total; page++) {
            TimeWindow window = pageWindow(range, page, pageSizeHours);
            if (shiftWindows == null || shiftWindows.isEmpty()) {
                long count = segmentRepository.countActiveInRange(channelId, window.start(), window.end());
                pages.add(new TimelinePage(page, window.start(), window.end(), count, true));
                continue;
            }
            List<TimeWindow> parts = intersecting(window, shiftWindows);
            long count = parts.isEmpty() ? 0 : segmentRepository.count(startsWithin(channelId, parts));
            pages.add(new TimelinePage(page, window.start(), window.end(), count, !parts.isEmpty()));
        }
        return pages;
    }

    /**
     * Active segments of the channel starting inside the page, or inside the parts of the shift
     * windows that fall in the page when shift windows are given.
     */
    @Transactional(readOnly = true)
    public List<AudioSegment> findSegments(UUID channelId, TimeWindow page, List<TimeWindow> shiftWindows) {
        if (shiftWindows == null || shiftWindows.isEmpty()) {
            return segmentRepository.findActiveInRange(channelId, page.start(), page.end());
        }
        List<TimeWindow> parts = intersecting(page, shiftWindows);
        if (parts.isEmpty()) {
            return List.of();
        }
        return segmentRepository.findAll(startsWithin(channelId, parts), Sort.by("startTime"));
    }

    private static List<TimeWindow> intersecting(TimeWindow page, List<TimeWindow> windows) {
        List<TimeWindow> parts = new ArrayList<>();
        for (TimeWindow window : windows) {
            Optional<TimeWindow> part = page.intersect(window);
            part.ifPresent(parts::add);
        }
        return parts;
    }

    static Specification<AudioSegment> startsWithin(UUID channelId, List<TimeWindow> windows) {
        List<TimeWindow> copy = List.copyOf(windows);
        return (root, query, cb) -> {
            List<Predicate> ors = new ArrayList<>();
            for (TimeWindow window : copy) {
                ors.add(cb.and(
                        cb.greaterThanOrEqualTo(root.<Instant>get("startTime"), window.start()),
                        cb.lessThan(root.<Instant>get("startTime"), window.end())));
            }
            return cb.and(
                    cb.equal(root.get("channel").get("id"), channelId),
                    cb.isTrue(root.<Boolean>get("active")),
                    cb.isFalse(root.<Boolean>get("deleted")),
                    cb.or(ors.toArray(new Predicate[0])));
        };
    }
}
