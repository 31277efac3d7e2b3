package com.example.airtime_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.UUID;

@Entity
@Table(name = "filter_schedule", uniqueConstraints = {
        @UniqueConstraint(name = "ux_filter_schedule_slot",
                columnNames = {"filter_id", "day_of_week", "start_time", "end_time"})
})
public class FilterSchedule {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "filter_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_filter_schedule_filter"))
    private PredefinedFilter filter;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "notes", length = 1000)
    private String notes;

    protected FilterSchedule() {
    }

    public FilterSchedule(DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime) {
        if (startTime.equals(endTime)) {
            throw new IllegalArgumentException("Start and end time cannot be the same");
        }
        this.dayOfWeek = dayOfWeek;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    @Transient
    public boolean isOvernight() {
        return startTime.isAfter(endTime);
    }

    public UUID getId() { return id; }
    public PredefinedFilter getFilter() { return filter; }
    void setFilter(PredefinedFilter filter) { this.filter = filter; }
    public DayOfWeek getDayOfWeek() { return dayOfWeek; }
    public LocalTime getStartTime() { return startTime; }
    public LocalTime getEndTime() { return endTime; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
}
