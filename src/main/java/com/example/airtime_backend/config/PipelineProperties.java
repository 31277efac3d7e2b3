package com.example.airtime_backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds of the segment pipeline and the scheduler switches.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @Valid
    private Synthesis synthesis = new Synthesis();
    @Valid
    private Ingest ingest = new Ingest();
    @Valid
    private Merge merge = new Merge();
    @Valid
    private Eligibility eligibility = new Eligibility();
    @Valid
    private Scheduling scheduling = new Scheduling();
    @Valid
    private Paging paging = new Paging();

    public Synthesis getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(Synthesis synthesis) {
        this.synthesis = synthesis;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Merge getMerge() {
        return merge;
    }

    public void setMerge(Merge merge) {
        this.merge = merge;
    }

    public Eligibility getEligibility() {
        return eligibility;
    }

    public void setEligibility(Eligibility eligibility) {
        this.eligibility = eligibility;
    }

    public Scheduling getScheduling() {
        return scheduling;
    }

    public void setScheduling(Scheduling scheduling) {
        this.scheduling = scheduling;
    }

    public Paging getPaging() {
        return paging;
    }

    public void setPaging(Paging paging) {
        this.paging = paging;
    }

    public static class Synthesis {
        @PositiveOrZero
        private long gapThresholdSeconds = 2;

        public long getGapThresholdSeconds() {
            return gapThresholdSeconds;
        }

        public void setGapThresholdSeconds(long gapThresholdSeconds) {
            this.gapThresholdSeconds = gapThresholdSeconds;
        }
    }

    public static class Ingest {
        @PositiveOrZero
        private long toleranceSeconds = 1;
        @PositiveOrZero
        private long recentSessionMinutes = 5;

        public long getToleranceSeconds() {
            return toleranceSeconds;
        }

        public void setToleranceSeconds(long toleranceSeconds) {
            this.toleranceSeconds = toleranceSeconds;
        }

        public long getRecentSessionMinutes() {
            return recentSessionMinutes;
        }

        public void setRecentSessionMinutes(long recentSessionMinutes) {
            this.recentSessionMinutes = recentSessionMinutes;
        }
    }

    public static class Merge {
        @Min(1)
        private int shortSegmentSeconds = 20;
        @PositiveOrZero
        private long maxGapSeconds = 1;

        public int getShortSegmentSeconds() {
            return shortSegmentSeconds;
        }

        public void setShortSegmentSeconds(int shortSegmentSeconds) {
            this.shortSegmentSeconds = shortSegmentSeconds;
        }

        public long getMaxGapSeconds() {
            return maxGapSeconds;
        }

        public void setMaxGapSeconds(long maxGapSeconds) {
            this.maxGapSeconds = maxGapSeconds;
        }
    }

    public static class Eligibility {
        @PositiveOrZero
        private int minimumDurationSeconds = 10;
        @Min(1)
        private long suppressionMinutes = 10;

        public int getMinimumDurationSeconds() {
            return minimumDurationSeconds;
        }

        public void setMinimumDurationSeconds(int minimumDurationSeconds) {
            this.minimumDurationSeconds = minimumDurationSeconds;
        }

        public long getSuppressionMinutes() {
            return suppressionMinutes;
        }

        public void setSuppressionMinutes(long suppressionMinutes) {
            this.suppressionMinutes = suppressionMinutes;
        }
    }

    public static class Scheduling {
        private boolean enabled = true;
        @NotBlank
        private String hourlyCron = "0 5 * * * *";
        @NotBlank
        private String dailyCron = "0 0 2 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHourlyCron() {
            return hourlyCron;
        }

        public void setHourlyCron(String hourlyCron) {
            this.hourlyCron = hourlyCron;
        }

        public String getDailyCron() {
            return dailyCron;
        }

        public void setDailyCron(String dailyCron) {
            this.dailyCron = dailyCron;
        }
    }

    public static class Paging {
        @Min(1)
        private int maxRangeDays = 7;
        @Min(1)
        private int pageSizeHours = 1;

        public int getMaxRangeDays() {
            return maxRangeDays;
        }

        public void setMaxRangeDays(int maxRangeDays) {
            this.maxRangeDays = maxRangeDays;
        }

        public int getPageSizeHours() {
            return pageSizeHours;
        }

        public void setPageSizeHours(int pageSizeHours) {
            this.pageSizeHours = pageSizeHours;
        }
    }
}
