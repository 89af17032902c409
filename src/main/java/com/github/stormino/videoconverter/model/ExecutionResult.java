package com.github.stormino.videoconverter.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Outcome of one encoder run, with size and timing statistics.
 * Expected failures are values here, not exceptions.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionResult {

    /**
     * Terminal state the run ended in.
     */
    ExecutionState state;

    /**
     * Failure classification, {@code null} on success.
     */
    FailureReason failureReason;

    /**
     * Short diagnostic for failed or cancelled runs.
     */
    String errorMessage;

    /**
     * Optional exception behind the failure.
     */
    Throwable cause;

    ConversionRequest request;

    @Builder.Default
    long originalSize = 0L;

    @Builder.Default
    long convertedSize = 0L;

    @Builder.Default
    double durationSeconds = 0.0;

    /**
     * Encoding speed relative to realtime.
     */
    @Builder.Default
    double speedRatio = 0.0;

    LocalDateTime startedAt;
    LocalDateTime completedAt;

    /**
     * Create a failed result.
     *
     * @param request Request that failed
     * @param reason Failure classification
     * @param errorMessage Diagnostic text
     * @return Failed result
     */
    public static ExecutionResult failure(ConversionRequest request, FailureReason reason, String errorMessage) {
        return failure(request, reason, errorMessage, null);
    }

    /**
     * Create a failed result with cause.
     *
     * @param request Request that failed
     * @param reason Failure classification
     * @param errorMessage Diagnostic text
     * @param cause Exception that caused the failure
     * @return Failed result
     */
    public static ExecutionResult failure(ConversionRequest request, FailureReason reason,
                                          String errorMessage, Throwable cause) {
        LocalDateTime now = LocalDateTime.now();
        return ExecutionResult.builder()
                .state(ExecutionState.FAILED)
                .failureReason(reason)
                .errorMessage(errorMessage)
                .cause(cause)
                .request(request)
                .startedAt(now)
                .completedAt(now)
                .build();
    }

    /**
     * Create a cancelled result.
     *
     * @param request Request that was cancelled
     * @param message Cancellation message
     * @return Cancelled result
     */
    public static ExecutionResult cancelled(ConversionRequest request, String message) {
        LocalDateTime now = LocalDateTime.now();
        return ExecutionResult.builder()
                .state(ExecutionState.CANCELLED)
                .failureReason(FailureReason.CANCELLED)
                .errorMessage(message)
                .request(request)
                .startedAt(now)
                .completedAt(now)
                .build();
    }

    public boolean isSuccess() {
        return state == ExecutionState.COMPLETED;
    }

    public boolean isCancelled() {
        return state == ExecutionState.CANCELLED;
    }

    public boolean isFailed() {
        return state == ExecutionState.FAILED;
    }

    /**
     * Fraction of the original size saved, 0 when the original size is unknown.
     */
    public double getCompressionRatio() {
        if (originalSize <= 0) {
            return 0.0;
        }
        return 1.0 - ((double) convertedSize / originalSize);
    }

    public long getSizeSaved() {
        return originalSize - convertedSize;
    }

    /**
     * One-line description used in batch error lists.
     */
    public String describeFailure() {
        String name = request != null ? request.getDisplayName() : "unknown";
        String reason = failureReason != null ? failureReason.getDisplayName() : state.getDisplayName();
        if (errorMessage == null || errorMessage.isBlank()) {
            return name + ": " + reason;
        }
        return name + ": " + reason + " - " + errorMessage;
    }
}
