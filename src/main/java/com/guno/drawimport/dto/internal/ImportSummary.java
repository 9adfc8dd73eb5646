package com.guno.drawimport.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Import Summary - run outcome report: counts, previous vs. new maximum period
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummary {

    @Builder.Default
    private LocalDateTime startTime = LocalDateTime.now();

    private LocalDateTime endTime;

    @Builder.Default
    private String status = "IN_PROGRESS";

    private LocalDate drawDate;

    private RunState finalState;

    private String source;

    private String pinnedShape;

    private PageStopReason stopReason;

    @Builder.Default
    private Integer totalApiCalls = 0;

    @Builder.Default
    private Integer totalHtmlCalls = 0;

    @Builder.Default
    private Integer recordsFetched = 0;

    @Builder.Default
    private Integer recordsRejected = 0;

    @Builder.Default
    private Integer recordsAdded = 0;

    @Builder.Default
    private Integer recordsUpgraded = 0;

    @Builder.Default
    private Integer conflicts = 0;

    @Builder.Default
    private Integer totalRecords = 0;

    private String previousMaxPeriod;

    private String newMaxPeriod;

    private boolean changed;

    private boolean written;

    public void markSuccess() {
        this.status = "SUCCESS";
        if (this.endTime == null) {
            this.endTime = LocalDateTime.now();
        }
    }

    public boolean isSuccess() {
        return "SUCCESS".equals(status);
    }

    public boolean isNoData() {
        return "NO_DATA".equals(status);
    }

    public String getDurationFormatted() {
        if (startTime == null) return "Unknown";

        LocalDateTime end = endTime != null ? endTime : LocalDateTime.now();
        long seconds = ChronoUnit.SECONDS.between(startTime, end);

        if (seconds < 60) {
            return seconds + "s";
        } else if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        } else {
            return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
        }
    }

    public String getSummaryStats() {
        return String.format(
                "ImportSummary[Status=%s, State=%s, Source=%s, Added=%d, Upgraded=%d, Total=%d, MaxPeriod=%s->%s, Written=%s, Duration=%s]",
                status,
                finalState,
                source,
                recordsAdded,
                recordsUpgraded,
                totalRecords,
                previousMaxPeriod,
                newMaxPeriod,
                written,
                getDurationFormatted()
        );
    }
}
