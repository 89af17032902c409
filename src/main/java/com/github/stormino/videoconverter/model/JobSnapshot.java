package com.github.stormino.videoconverter.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Read-only view of one job inside an {@link AggregatedProgress}.
 */
@Value
@Builder
public class JobSnapshot {
    int jobId;
    String displayName;
    JobStatus status;
    double progress;
    LocalDateTime startedAt;
    String message;

    public boolean isActive() {
        return status == JobStatus.IN_PROGRESS;
    }
}
