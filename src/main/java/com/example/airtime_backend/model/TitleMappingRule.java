package com.example.airtime_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Title transition rule: after a track titled {@code beforeTitle} plays, audio up to the next
 * {@code afterTitle} (or a capped duration) belongs to the rule's category.
 */
@Entity
@Table(name = "title_mapping_rule", indexes = {
        @Index(name = "idx_title_mapping_rule_active", columnList = "is_active"),
        @Index(name = "idx_title_mapping_rule_before", columnList = "before_title")
})
public class TitleMappingRule {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_title_mapping_rule_category"))
    private UnrecognizedCategory category;

    @Column(name = "before_title", nullable = false, length = 255)
    private String beforeTitle;

    @Column(name = "after_title", length = 255)
    private String afterTitle;

    @Column(name = "skip_transcription", nullable = false)
    private boolean skipTranscription = true;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "notes", length = 1000)
    private String notes;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected TitleMappingRule() {
    }

    public TitleMappingRule(UnrecognizedCategory category, String beforeTitle, String afterTitle) {
        this.category = category;
        this.beforeTitle = beforeTitle;
        this.afterTitle = afterTitle;
    }

    public UUID getId() { return id; }
    public UnrecognizedCategory getCategory() { return category; }
    public void setCategory(UnrecognizedCategory category) { this.category = category; }
    public String getBeforeTitle() { return beforeTitle; }
    public void setBeforeTitle(String beforeTitle) { this.beforeTitle = beforeTitle; }
    public String getAfterTitle() { return afterTitle; }
    public void setAfterTitle(String afterTitle) { this.afterTitle = afterTitle; }
    public boolean isSkipTranscription() { return skipTranscription; }
    public void setSkipTranscription(boolean skipTranscription) { this.skipTranscription = skipTranscription; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
