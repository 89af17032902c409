package com.github.stormino.videoconverter.service.state;

import com.github.stormino.videoconverter.model.ExecutionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConversionStateMachine")
class ConversionStateMachineTest {

    private static final String JOB = "movie.mov";

    private ConversionStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        stateMachine = new ConversionStateMachine();
    }

    @Nested
    @DisplayName("isValidTransition")
    class ValidTransitionTests {

        @Test
        @DisplayName("NOT_STARTED can start, fail or be cancelled")
        void notStartedTransitions() {
            assertTrue(stateMachine.isValidTransition(ExecutionState.NOT_STARTED, ExecutionState.RUNNING));
            assertTrue(stateMachine.isValidTransition(ExecutionState.NOT_STARTED, ExecutionState.FAILED));
            assertTrue(stateMachine.isValidTransition(ExecutionState.NOT_STARTED, ExecutionState.CANCELLED));
            assertFalse(stateMachine.isValidTransition(ExecutionState.NOT_STARTED, ExecutionState.COMPLETED));
        }

        @Test
        @DisplayName("RUNNING can reach every terminal state")
        void runningTransitions() {
            assertTrue(stateMachine.isValidTransition(ExecutionState.RUNNING, ExecutionState.COMPLETED));
            assertTrue(stateMachine.isValidTransition(ExecutionState.RUNNING, ExecutionState.FAILED));
            assertTrue(stateMachine.isValidTransition(ExecutionState.RUNNING, ExecutionState.CANCELLED));
            assertFalse(stateMachine.isValidTransition(ExecutionState.RUNNING, ExecutionState.NOT_STARTED));
        }

        @ParameterizedTest
        @EnumSource(value = ExecutionState.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
        @DisplayName("terminal states cannot be left")
        void terminalStatesAreFinal(ExecutionState terminal) {
            for (ExecutionState target : ExecutionState.values()) {
                if (target != terminal) {
                    assertFalse(stateMachine.isValidTransition(terminal, target),
                            terminal + " -> " + target + " should be rejected");
                }
            }
        }

        @ParameterizedTest
        @EnumSource(ExecutionState.class)
        @DisplayName("same state transition is idempotent")
        void sameStateIsValid(ExecutionState state) {
            assertTrue(stateMachine.isValidTransition(state, state));
        }
    }

    @Nested
    @DisplayName("transition")
    class TransitionTests {

        @Test
        @DisplayName("should return the new state when valid")
        void shouldReturnNewState() {
            assertEquals(ExecutionState.RUNNING,
                    stateMachine.transition(JOB, ExecutionState.NOT_STARTED, ExecutionState.RUNNING));
        }

        @Test
        @DisplayName("should keep the current state when invalid")
        void shouldKeepCurrentState() {
            assertEquals(ExecutionState.CANCELLED,
                    stateMachine.transition(JOB, ExecutionState.CANCELLED, ExecutionState.COMPLETED));
        }

        @Test
        @DisplayName("transitionOrThrow should throw when invalid")
        void shouldThrowWhenInvalid() {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> stateMachine.transitionOrThrow(JOB, ExecutionState.COMPLETED, ExecutionState.RUNNING));
            assertTrue(e.getMessage().contains(JOB));
        }

        @Test
        @DisplayName("should reject null arguments")
        void shouldRejectNulls() {
            assertThrows(NullPointerException.class,
                    () -> stateMachine.transition(JOB, null, ExecutionState.RUNNING));
        }
    }

    @Test
    @DisplayName("getInstance should return a shared instance")
    void shouldShareInstance() {
        assertSame(ConversionStateMachine.getInstance(), ConversionStateMachine.getInstance());
    }
}
