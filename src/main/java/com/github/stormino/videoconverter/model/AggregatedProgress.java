package com.github.stormino.videoconverter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable summary of a batch at one instant. Built under the scheduler lock,
 * so all counts and job views come from the same state.
 */
@Value
@Builder
public class AggregatedProgress {

    int totalJobs;

    // finished jobs, successful or failed
    int completedJobs;

    int inProgressJobs;
    int pendingJobs;
    int failedJobs;
    int cancelledJobs;

    // (completedJobs + sum of in-progress progress) / totalJobs
    double overallProgress;

    @Singular
    List<JobSnapshot> jobSnapshots;

    @Singular
    List<String> activeFileNames;

    public static AggregatedProgress empty() {
        return AggregatedProgress.builder().build();
    }

    public int getSuccessfulJobs() {
        return completedJobs - failedJobs;
    }

    public boolean isFinished() {
        return totalJobs > 0 && pendingJobs == 0 && inProgressJobs == 0;
    }
}
