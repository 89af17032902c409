package com.github.stormino.videoconverter.model;

/**
 * Lifecycle state of a single encoder run.
 */
public enum ExecutionState {
    NOT_STARTED("Not started"),
    RUNNING("Running"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String displayName;

    ExecutionState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
