package com.github.stormino.videoconverter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a finished conversion batch.
 */
@Value
@Builder
public class BatchReport {

    LocalDateTime startedAt;
    LocalDateTime completedAt;

    int totalFiles;
    int successful;
    int failed;
    int cancelled;

    long totalOriginalSize;
    long totalConvertedSize;
    double totalDurationSeconds;

    // index-aligned with the submitted requests
    @Singular
    List<ExecutionResult> results;

    @Singular
    List<String> errors;

    public static BatchReport of(List<ExecutionResult> results, LocalDateTime startedAt) {
        BatchReportBuilder builder = BatchReport.builder()
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now())
                .totalFiles(results.size());

        int successful = 0;
        int failed = 0;
        int cancelled = 0;
        long originalSize = 0;
        long convertedSize = 0;
        double duration = 0;
        List<String> errors = new ArrayList<>();

        for (ExecutionResult result : results) {
            builder.result(result);
            duration += result.getDurationSeconds();
            if (result.isSuccess()) {
                successful++;
                originalSize += result.getOriginalSize();
                convertedSize += result.getConvertedSize();
            } else if (result.isCancelled()) {
                cancelled++;
            } else {
                failed++;
                errors.add(result.describeFailure());
            }
        }

        return builder
                .successful(successful)
                .failed(failed)
                .cancelled(cancelled)
                .totalOriginalSize(originalSize)
                .totalConvertedSize(convertedSize)
                .totalDurationSeconds(duration)
                .errors(errors)
                .build();
    }

    public long getTotalSizeSaved() {
        return totalOriginalSize - totalConvertedSize;
    }

    /**
     * Share of files converted successfully, in [0, 1].
     */
    public double getSuccessRate() {
        if (totalFiles == 0) {
            return 0.0;
        }
        return (double) successful / totalFiles;
    }

    /**
     * Mean compression ratio over successful conversions.
     */
    public double getAverageCompressionRatio() {
        return results.stream()
                .filter(ExecutionResult::isSuccess)
                .mapToDouble(ExecutionResult::getCompressionRatio)
                .average()
                .orElse(0.0);
    }

    public boolean wasCancelled() {
        return cancelled > 0;
    }
}
