package com.github.stormino.videoconverter.service.state;

import com.github.stormino.videoconverter.model.ExecutionState;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for an encoder run.
 * Validates state transitions and prevents leaving a terminal state.
 *
 * Valid state flow:
 * <pre>
 * NOT_STARTED → RUNNING → COMPLETED
 *     ↓            ↓
 *   FAILED       FAILED
 *   CANCELLED    CANCELLED
 * </pre>
 */
@Slf4j
public class ConversionStateMachine {

    private static final ConversionStateMachine INSTANCE = new ConversionStateMachine();

    private final Map<ExecutionState, Set<ExecutionState>> validTransitions;

    public ConversionStateMachine() {
        validTransitions = new EnumMap<>(ExecutionState.class);
        initializeTransitions();
    }

    public static ConversionStateMachine getInstance() {
        return INSTANCE;
    }

    private void initializeTransitions() {
        // NOT_STARTED fails directly when a precondition does not hold
        validTransitions.put(ExecutionState.NOT_STARTED,
            EnumSet.of(ExecutionState.RUNNING, ExecutionState.FAILED, ExecutionState.CANCELLED));

        validTransitions.put(ExecutionState.RUNNING,
            EnumSet.of(ExecutionState.COMPLETED, ExecutionState.FAILED, ExecutionState.CANCELLED));

        // Terminal states (no transitions)
        validTransitions.put(ExecutionState.COMPLETED, EnumSet.noneOf(ExecutionState.class));
        validTransitions.put(ExecutionState.FAILED, EnumSet.noneOf(ExecutionState.class));
        validTransitions.put(ExecutionState.CANCELLED, EnumSet.noneOf(ExecutionState.class));
    }

    /**
     * Check if a state transition is valid.
     *
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if transition is valid
     */
    public boolean isValidTransition(@NonNull ExecutionState currentState, @NonNull ExecutionState newState) {
        if (currentState == newState) {
            // Same state is always valid (idempotent)
            return true;
        }

        Set<ExecutionState> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Validate and perform state transition.
     *
     * @param jobName Job name for logging
     * @param currentState Current state
     * @param newState Desired new state
     * @return New state if valid, current state if invalid
     */
    public ExecutionState transition(
            @NonNull String jobName,
            @NonNull ExecutionState currentState,
            @NonNull ExecutionState newState) {

        if (isValidTransition(currentState, newState)) {
            if (currentState != newState) {
                log.debug("Job {} state transition: {} → {}", jobName, currentState, newState);
            }
            return newState;
        } else {
            log.warn("Job {} invalid state transition attempted: {} → {} (rejected)",
                    jobName, currentState, newState);
            return currentState;
        }
    }

    /**
     * Validate and perform state transition with exception on failure.
     *
     * @param jobName Job name for logging
     * @param currentState Current state
     * @param newState Desired new state
     * @return New state
     * @throws IllegalStateException if transition is invalid
     */
    public ExecutionState transitionOrThrow(
            @NonNull String jobName,
            @NonNull ExecutionState currentState,
            @NonNull ExecutionState newState) {

        if (!isValidTransition(currentState, newState)) {
            throw new IllegalStateException(String.format(
                    "Invalid state transition for job %s: %s → %s",
                    jobName, currentState, newState));
        }

        if (currentState != newState) {
            log.debug("Job {} state transition: {} → {}", jobName, currentState, newState);
        }
        return newState;
    }
}
