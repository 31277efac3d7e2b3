package com.example.airtime_backend.model;

import com.example.airtime_backend.util.EditAction;
import com.example.airtime_backend.util.TriggerType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only audit record of an edit on the timeline. For a merge, {@code audioSegment} is the
 * produced segment and {@code sourceSegmentIds} lists the segments it supersedes.
 */
@Entity
@Table(name = "segment_edit_log", indexes = {
        @Index(name = "idx_segment_edit_log_segment", columnList = "audio_segment_id"),
        @Index(name = "idx_segment_edit_log_action", columnList = "action")
})
public class SegmentEditLog {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "audio_segment_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_segment_edit_log_segment"))
    private AudioSegment audioSegment;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 20)
    private EditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    private TriggerType triggerType;

    /** Sorted, comma-joined ids; doubles as the de-duplication key. */
    @Column(name = "source_segment_ids", nullable = false, length = 4000)
    private String sourceSegmentIds;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata;

    @Column(name = "notes", length = 2000)
    private String notes;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected SegmentEditLog() {
    }

    public SegmentEditLog(AudioSegment audioSegment, EditAction action, TriggerType triggerType,
                          Collection<UUID> sourceSegmentIds) {
        this.audioSegment = audioSegment;
        this.action = action;
        this.triggerType = triggerType;
        this.sourceSegmentIds = sourceKey(sourceSegmentIds);
    }

    /**
     * Builds the canonical key for a set of source ids: sorted and comma-joined, so the same set
     * always yields the same string regardless of input order.
     */
    public static String sourceKey(Collection<UUID> ids) {
        return ids.stream()
                .filter(Objects::nonNull)
                .map(UUID::toString)
                .sorted()
                .collect(Collectors.joining(","));
    }

    @Transient
    public List<UUID> sourceSegmentIdList() {
        if (sourceSegmentIds == null || sourceSegmentIds.isBlank()) {
            return List.of();
        }
        return Arrays.stream(sourceSegmentIds.split(","))
                .map(UUID::fromString)
                .toList();
    }

    public UUID getId() { return id; }
    public AudioSegment getAudioSegment() { return audioSegment; }
    public EditAction getAction() { return action; }
    public TriggerType getTriggerType() { return triggerType; }
    public String getSourceSegmentIds() { return sourceSegmentIds; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public Instant getCreatedAt() { return createdAt; }
}
