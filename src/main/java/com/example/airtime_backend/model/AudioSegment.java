package com.example.airtime_backend.model;

import com.example.airtime_backend.util.SegmentSource;
import jakarta.persistence.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One contiguous slice of channel audio, either recognized by the fingerprinting provider or
 * synthesized to fill the gap between two recognized tracks.
 */
@Entity
@Table(
        name = "audio_segment",
        indexes = {
                @Index(name = "idx_audio_segment_channel_range", columnList = "channel_id, start_time, end_time"),
                @Index(name = "idx_audio_segment_channel_active", columnList = "channel_id, is_active, is_delete")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_audio_segment_file_path", columnNames = {"file_path"})
        }
)
@Check(constraints = "end_time > start_time")
public class AudioSegment {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "channel_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_audio_segment_channel"))
    private Channel channel;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "duration_seconds", nullable = false)
    private int durationSeconds;

    @Column(name = "is_recognized", nullable = false)
    private boolean recognized;

    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "title_before", length = 500)
    private String titleBefore;

    @Column(name = "title_after", length = 500)
    private String titleAfter;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_delete", nullable = false)
    private boolean deleted = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 32)
    private SegmentSource source = SegmentSource.RECOGNITION;

    @Column(name = "requires_analysis")
    private Boolean requiresAnalysis;

    @Column(name = "file_name", length = 255)
    private String fileName;

    @Column(name = "file_path", length = 512)
    private String filePath;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata;

    @Column(name = "notes", length = 2000)
    private String notes;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public AudioSegment() {
    }

    public AudioSegment(Channel channel, Instant startTime, Instant endTime) {
        this.channel = channel;
        setRange(startTime, endTime);
    }

    /**
     * Sets both bounds and recomputes {@link #getDurationSeconds()} from them.
     *
     * @param startTime inclusive start instant (UTC).
     * @param endTime   exclusive end instant (UTC), must be after {@code startTime}.
     */
    public void setRange(Instant startTime, Instant endTime) {
        this.startTime = startTime;
        this.endTime = endTime;
        this.durationSeconds = (startTime == null || endTime == null)
                ? 0
                : (int) Duration.between(startTime, endTime).getSeconds();
    }

    /**
     * Checks the recognition/title invariants and the time bounds.
     *
     * @throws IllegalStateException when the segment would violate a model invariant.
     */
    public void validate() {
        if (channel == null) {
            throw new IllegalStateException("Segment must belong to a channel");
        }
        if (startTime == null || endTime == null || !endTime.isAfter(startTime)) {
            throw new IllegalStateException("End time must be after start time");
        }
        long expected = Duration.between(startTime, endTime).getSeconds();
        if (durationSeconds != expected) {
            throw new IllegalStateException("Duration (" + durationSeconds + "s) doesn't match time difference (" + expected + "s)");
        }
        if (recognized) {
            if (isBlank(title)) {
                throw new IllegalStateException("Recognized segments must have a title");
            }
        } else {
            if (isBlank(titleBefore)) {
                throw new IllegalStateException("Unrecognized segments must have a title_before");
            }
            if (isBlank(titleAfter)) {
                throw new IllegalStateException("Unrecognized segments must have a title_after");
            }
        }
    }

    /**
     * A merged or soft-deleted segment never takes part in another automatic merge.
     */
    @Transient
    public boolean isMergedOrDeleted() {
        return deleted || source == SegmentSource.MERGED;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public Channel getChannel() { return channel; }
    public void setChannel(Channel channel) { this.channel = channel; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public int getDurationSeconds() { return durationSeconds; }
    public boolean isRecognized() { return recognized; }
    public void setRecognized(boolean recognized) { this.recognized = recognized; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getTitleBefore() { return titleBefore; }
    public void setTitleBefore(String titleBefore) { this.titleBefore = titleBefore; }
    public String getTitleAfter() { return titleAfter; }
    public void setTitleAfter(String titleAfter) { this.titleAfter = titleAfter; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public SegmentSource getSource() { return source; }
    public void setSource(SegmentSource source) { this.source = source; }
    public Boolean getRequiresAnalysis() { return requiresAnalysis; }
    public void setRequiresAnalysis(Boolean requiresAnalysis) { this.requiresAnalysis = requiresAnalysis; }
    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }
    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public long getVersion() { return version; }

    @Override
    public String toString() {
        String status = active ? "ACTIVE" : "INACTIVE";
        String deletedStatus = deleted ? " [DELETED]" : "";
        if (recognized && title != null) {
            return "Recognized: " + title + " (" + startTime + " - " + endTime + ") [" + status + "]" + deletedStatus;
        }
        return "Unrecognized: " + startTime + " - " + endTime + " (" + durationSeconds + "s) [" + status + "]" + deletedStatus;
    }
}
