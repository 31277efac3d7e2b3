package com.example.airtime_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Named set of per-weekday time windows used to slice a channel timeline. Unlike a
 * {@link Shift}, every weekday may carry its own hours.
 */
@Entity
@Table(name = "predefined_filter")
public class PredefinedFilter {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "channel_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_predefined_filter_channel"))
    private Channel channel;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "timezone", nullable = false, length = 50)
    private String timezone = "UTC";

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @OneToMany(mappedBy = "filter", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<FilterSchedule> schedules = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected PredefinedFilter() {
    }

    public PredefinedFilter(Channel channel, String name, String timezone) {
        this.channel = channel;
        this.name = name;
        this.timezone = timezone;
    }

    public void addSchedule(FilterSchedule schedule) {
        schedule.setFilter(this);
        schedules.add(schedule);
    }

    public UUID getId() { return id; }
    public Channel getChannel() { return channel; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public List<FilterSchedule> getSchedules() { return schedules; }
    public Instant getCreatedAt() { return createdAt; }
}
