package com.github.stormino.videoconverter.exception;

import com.github.stormino.videoconverter.model.ConversionRequest;
import com.github.stormino.videoconverter.model.ExecutionResult;
import com.github.stormino.videoconverter.model.FailureReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception Hierarchy")
class ExceptionHierarchyTest {

    @Nested
    @DisplayName("ConversionException")
    class ConversionExceptionTests {

        @Test
        @DisplayName("should extend RuntimeException")
        void shouldExtendRuntimeException() {
            assertInstanceOf(RuntimeException.class, new ConversionException("Test error"));
        }

        @Test
        @DisplayName("should create with message and cause")
        void shouldCreateWithMessageAndCause() {
            Exception cause = new RuntimeException("Root cause");
            ConversionException ex = new ConversionException("Conversion failed", cause);

            assertEquals("Conversion failed", ex.getMessage());
            assertEquals(cause, ex.getCause());
        }

        @Test
        @DisplayName("should create with cause only")
        void shouldCreateWithCauseOnly() {
            Exception cause = new RuntimeException("Root cause");

            assertEquals(cause, new ConversionException(cause).getCause());
        }
    }

    @Nested
    @DisplayName("ConversionFailedException")
    class ConversionFailedExceptionTests {

        private final ConversionRequest request = ConversionRequest.builder()
                .inputPath(Path.of("clip.mov"))
                .outputPath(Path.of("clip.mp4"))
                .build();

        @Test
        @DisplayName("should expose the result and its reason")
        void shouldExposeResult() {
            ExecutionResult result = ExecutionResult.failure(request, FailureReason.OUTPUT_NOT_CREATED, "missing");

            ConversionFailedException ex = new ConversionFailedException(result);

            assertInstanceOf(ConversionException.class, ex);
            assertSame(result, ex.getResult());
            assertEquals(FailureReason.OUTPUT_NOT_CREATED, ex.getFailureReason());
            assertEquals("clip.mov: Output not created - missing", ex.getMessage());
        }

        @Test
        @DisplayName("should keep the cause of the failure")
        void shouldKeepCause() {
            IOException cause = new IOException("broken pipe");
            ExecutionResult result = ExecutionResult.failure(request,
                    FailureReason.PROCESS_EXECUTION_FAILED, "Error running encoder", cause);

            assertSame(cause, new ConversionFailedException(result).getCause());
        }
    }

    @Nested
    @DisplayName("ConfigurationException")
    class ConfigurationExceptionTests {

        @Test
        @DisplayName("should carry the key and name the rejected value")
        void shouldCarryKeyAndValue() {
            ConfigurationException ex = new ConfigurationException("Maximum concurrency must be at least 1",
                    "converter.scheduler.max-concurrent", 0);

            assertInstanceOf(ConversionException.class, ex);
            assertEquals("converter.scheduler.max-concurrent", ex.getConfigKey());
            assertEquals("Maximum concurrency must be at least 1 (converter.scheduler.max-concurrent=0)",
                    ex.getMessage());
        }
    }
}
