package com.github.stormino.videoconverter.model;

/**
 * Why an encoder run did not produce a converted file.
 */
public enum FailureReason {

    /**
     * The availability check for the requested encoder failed. No process was spawned.
     */
    ENCODER_NOT_AVAILABLE("Encoder not available"),

    /**
     * The encoder binary could not be started.
     */
    ENCODER_NOT_FOUND("Encoder not found"),

    /**
     * The input file could not be read before spawning.
     */
    INPUT_NOT_READABLE("Input not readable"),

    /**
     * The encoder exited with a non-zero code, or its output stream broke.
     */
    PROCESS_EXECUTION_FAILED("Encoder process failed"),

    /**
     * The encoder exited cleanly but the expected output file is missing.
     */
    OUTPUT_NOT_CREATED("Output not created"),

    /**
     * A cancellation request was honored.
     */
    CANCELLED("Cancelled");

    private final String displayName;

    FailureReason(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
