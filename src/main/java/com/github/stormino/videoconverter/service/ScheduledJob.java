package com.github.stormino.videoconverter.service;

import com.github.stormino.videoconverter.model.JobSnapshot;
import com.github.stormino.videoconverter.model.JobStatus;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Mutable job table entry. Only touched while holding the scheduler lock.
 */
@Data
class ScheduledJob {

    private final int id;
    private final String displayName;
    private JobStatus status = JobStatus.PENDING;
    private double progress = 0.0;
    private LocalDateTime startedAt;
    private String message = "";

    JobSnapshot toSnapshot() {
        return JobSnapshot.builder()
                .jobId(id)
                .displayName(displayName)
                .status(status)
                .progress(progress)
                .startedAt(startedAt)
                .message(message)
                .build();
    }
}
