package com.github.stormino.videoconverter.exception;

import com.github.stormino.videoconverter.model.ExecutionResult;
import com.github.stormino.videoconverter.model.FailureReason;

/**
 * Thrown out of a batch job function when an encoder run did not complete,
 * so the scheduler records the job as failed.
 */
public class ConversionFailedException extends ConversionException {

    private final transient ExecutionResult result;

    public ConversionFailedException(ExecutionResult result) {
        super(result.describeFailure(), result.getCause());
        this.result = result;
    }

    public ExecutionResult getResult() {
        return result;
    }

    public FailureReason getFailureReason() {
        return result.getFailureReason();
    }
}
