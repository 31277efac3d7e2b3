package com.example.airtime_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Recurring wall-clock window (in the channel timezone) during which channel audio is eligible
 * for analysis. A shift whose start is after its end runs overnight.
 */
@Entity
@Table(name = "shift", uniqueConstraints = {
        @UniqueConstraint(name = "ux_shift_channel_name", columnNames = {"channel_id", "name"})
})
public class Shift {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "channel_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_shift_channel"))
    private Channel channel;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "days", nullable = false, length = 200)
    private String days;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Shift() {
    }

    public Shift(Channel channel, String name, LocalTime startTime, LocalTime endTime, String days) {
        this.channel = channel;
        this.name = name;
        this.startTime = startTime;
        this.endTime = endTime;
        this.days = days;
    }

    /**
     * Parses the comma-separated {@code days} column ("monday,tuesday").
     *
     * @return weekdays this shift applies to; empty when none are configured.
     * @throws IllegalArgumentException when a day name is unknown.
     */
    @Transient
    public Set<DayOfWeek> dayOfWeekSet() {
        return parseDays(days);
    }

    /**
     * Rejects zero-length shifts and malformed day lists.
     */
    public void validate() {
        if (startTime != null && startTime.equals(endTime)) {
            throw new IllegalStateException("Start and end time cannot be the same");
        }
        if (days == null || days.isBlank()) {
            throw new IllegalStateException("At least one day must be specified");
        }
        List<String> names = splitDays(days);
        if (names.size() != Set.copyOf(names).size()) {
            throw new IllegalStateException("Duplicate days are not allowed");
        }
        try {
            parseDays(days);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    public static Set<DayOfWeek> parseDays(String days) {
        Set<DayOfWeek> result = EnumSet.noneOf(DayOfWeek.class);
        for (String day : splitDays(days)) {
            try {
                result.add(DayOfWeek.valueOf(day.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid day: " + day, e);
            }
        }
        return result;
    }

    private static List<String> splitDays(String days) {
        List<String> out = new ArrayList<>();
        if (days == null) {
            return out;
        }
        for (String part : days.split(",")) {
            String trimmed = part.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public Channel getChannel() { return channel; }
    public void setChannel(Channel channel) { this.channel = channel; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public LocalTime getEndTime() { return endTime; }
    public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
    public String getDays() { return days; }
    public void setDays(String days) { this.days = days; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
