package com.example.airtime_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Broadcast channel monitored by the recognition provider. All segment time math for a channel
 * happens in its IANA timezone.
 */
@Entity
@Table(name = "channel", uniqueConstraints = {
        @UniqueConstraint(name = "ux_channel_project_acr", columnNames = {"project_id", "acr_channel_id"})
})
public class Channel {
    private static final Logger LOGGER = LoggerFactory.getLogger(Channel.class);

    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "project_id", nullable = false)
    private long projectId;

    @Column(name = "acr_channel_id", nullable = false)
    private long acrChannelId;

    @Column(name = "timezone", nullable = false, length = 50)
    private String timezone = "UTC";

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Channel() {
    }

    public Channel(String name, long projectId, long acrChannelId, String timezone) {
        this.name = name;
        this.projectId = projectId;
        this.acrChannelId = acrChannelId;
        this.timezone = timezone;
    }

    /**
     * Resolves the channel timezone, falling back to UTC when the stored id is missing or invalid.
     *
     * @return zone used for local-day computations.
     */
    @Transient
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            LOGGER.warn("Channel {} has invalid timezone={}, using UTC", id, timezone);
            return ZoneOffset.UTC;
        }
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public long getProjectId() { return projectId; }
    public void setProjectId(long projectId) { this.projectId = projectId; }
    public long getAcrChannelId() { return acrChannelId; }
    public void setAcrChannelId(long acrChannelId) { this.acrChannelId = acrChannelId; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public Instant getCreatedAt() { return createdAt; }
}
