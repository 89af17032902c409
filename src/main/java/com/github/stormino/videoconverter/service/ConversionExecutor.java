package com.github.stormino.videoconverter.service;

import com.github.stormino.videoconverter.model.ConversionRequest;
import com.github.stormino.videoconverter.model.ExecutionResult;
import com.github.stormino.videoconverter.model.ExecutionState;
import com.github.stormino.videoconverter.model.FailureReason;
import com.github.stormino.videoconverter.model.ProgressSample;
import com.github.stormino.videoconverter.service.command.ArgvBuilder;
import com.github.stormino.videoconverter.service.command.EncoderAvailability;
import com.github.stormino.videoconverter.service.parser.FfmpegProgressParser;
import com.github.stormino.videoconverter.service.parser.ProgressParser;
import com.github.stormino.videoconverter.service.state.ConversionStateMachine;
import com.github.stormino.videoconverter.util.ConversionConstants;
import com.github.stormino.videoconverter.util.FormatUtils;
import com.github.stormino.videoconverter.util.OutputFileGuard;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs one encoder process for one conversion request.
 * <p>
 * An instance is single-use: it moves from NOT_STARTED through RUNNING to a
 * terminal state and rejects a second {@link #execute} call. {@link #cancel()}
 * may be called from any thread at any time. No timeout is applied; a hung
 * encoder keeps its job running until cancelled.
 */
@Slf4j
public class ConversionExecutor {

    private final ArgvBuilder argvBuilder;
    private final EncoderAvailability encoderAvailability;
    private final int diagnosticTailChars;
    private final ConversionStateMachine stateMachine = ConversionStateMachine.getInstance();

    private final Object stateLock = new Object();
    private ExecutionState state = ExecutionState.NOT_STARTED;

    private volatile boolean cancelRequested = false;
    private volatile Process process;

    public ConversionExecutor(@NonNull ArgvBuilder argvBuilder,
                              @NonNull EncoderAvailability encoderAvailability) {
        this(argvBuilder, encoderAvailability, ConversionConstants.DIAGNOSTIC_TAIL_CHARS);
    }

    public ConversionExecutor(@NonNull ArgvBuilder argvBuilder,
                              @NonNull EncoderAvailability encoderAvailability,
                              int diagnosticTailChars) {
        this.argvBuilder = argvBuilder;
        this.encoderAvailability = encoderAvailability;
        this.diagnosticTailChars = Math.max(1, diagnosticTailChars);
    }

    /**
     * Run the conversion with the default callback interval.
     */
    public ExecutionResult execute(@NonNull ConversionRequest request, Consumer<ProgressSample> progressCallback) {
        return execute(request, progressCallback,
                Duration.ofMillis(ConversionConstants.DEFAULT_MIN_CALLBACK_INTERVAL_MS));
    }

    /**
     * Run the conversion and block until the encoder exits.
     *
     * @param request What to convert
     * @param progressCallback Receives parsed samples, at most once per interval; may be null
     * @param minCallbackInterval Minimum time between two callback invocations
     * @return Terminal result; expected failures are reported here rather than thrown
     * @throws IllegalStateException if this executor was already used
     */
    public ExecutionResult execute(@NonNull ConversionRequest request,
                                   Consumer<ProgressSample> progressCallback,
                                   @NonNull Duration minCallbackInterval) {
        String jobName = request.getDisplayName();
        synchronized (stateLock) {
            if (state != ExecutionState.NOT_STARTED) {
                throw new IllegalStateException("Executor for " + jobName + " was already used (state " + state + ")");
            }
        }

        LocalDateTime startedAt = LocalDateTime.now();
        long startNanos = System.nanoTime();

        if (!encoderAvailability.isAvailable(request)) {
            return finish(jobName, stamp(ExecutionResult.failure(request, FailureReason.ENCODER_NOT_AVAILABLE,
                    "Encoder '" + request.getEncoder() + "' is not available"), 0L, startedAt, startNanos));
        }

        Path inputPath = request.getInputPath();
        long originalSize;
        try {
            if (!Files.isReadable(inputPath)) {
                return finish(jobName, stamp(ExecutionResult.failure(request, FailureReason.INPUT_NOT_READABLE,
                        "Cannot read input file: " + inputPath), 0L, startedAt, startNanos));
            }
            originalSize = Files.size(inputPath);
        } catch (IOException e) {
            return finish(jobName, stamp(ExecutionResult.failure(request, FailureReason.INPUT_NOT_READABLE,
                    "Cannot read input file: " + e.getMessage(), e), 0L, startedAt, startNanos));
        }

        if (cancelRequested) {
            return finish(jobName, stamp(ExecutionResult.cancelled(request, ConversionConstants.CANCELLED_MESSAGE),
                    originalSize, startedAt, startNanos));
        }

        Path outputPath = request.getOutputPath();
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            return finish(jobName, stamp(ExecutionResult.failure(request, FailureReason.PROCESS_EXECUTION_FAILED,
                    "Cannot create output directory: " + e.getMessage(), e), originalSize, startedAt, startNanos));
        }

        List<String> command = argvBuilder.buildCommand(request);
        log.info("Starting conversion: {}", jobName);
        log.debug("Command: {}", String.join(" ", command));

        try (OutputFileGuard outputGuard = new OutputFileGuard()) {
            Process started;
            try {
                ProcessBuilder processBuilder = new ProcessBuilder(command);
                processBuilder.redirectErrorStream(true);
                started = processBuilder.start();
            } catch (IOException e) {
                log.error("Could not start encoder for {}: {}", jobName, e.getMessage());
                return finish(jobName, stamp(ExecutionResult.failure(request, FailureReason.ENCODER_NOT_FOUND,
                        "Encoder not found: " + e.getMessage(), e), originalSize, startedAt, startNanos));
            }

            // From here on any exit path that does not commit removes the output
            outputGuard.guard(outputPath);
            synchronized (stateLock) {
                state = stateMachine.transitionOrThrow(jobName, state, ExecutionState.RUNNING);
                process = started;
            }
            if (cancelRequested) {
                destroy(started);
            }

            try {
                ProgressParser parser = new FfmpegProgressParser(request.getTotalDurationSeconds());
                String output = streamOutput(started, parser, progressCallback, minCallbackInterval, jobName);

                int exitCode = started.waitFor();

                if (cancelRequested) {
                    destroy(started);
                    return finish(jobName, stamp(ExecutionResult.cancelled(request, ConversionConstants.CANCELLED_MESSAGE),
                            originalSize, startedAt, startNanos));
                }

                if (exitCode != 0) {
                    String diagnostic = FormatUtils.tail(output, diagnosticTailChars);
                    log.error("Encoder exited with code {} for {}", exitCode, jobName);
                    log.debug("Encoder output tail for {}:\n{}", jobName, diagnostic);
                    return finish(jobName, stamp(ExecutionResult.failure(request, FailureReason.PROCESS_EXECUTION_FAILED,
                            "Encoder exited with code " + exitCode + ": " + diagnostic), originalSize, startedAt, startNanos));
                }

                if (!Files.exists(outputPath)) {
                    return finish(jobName, stamp(ExecutionResult.failure(request, FailureReason.OUTPUT_NOT_CREATED,
                            "Output file was not created: " + outputPath), originalSize, startedAt, startNanos));
                }

                long convertedSize = Files.size(outputPath);
                outputGuard.commit(outputPath);

                double durationSeconds = elapsedSeconds(startNanos);
                double speedRatio = parser.getLastSample()
                        .map(ProgressSample::getSpeedMultiplier)
                        .orElse(0.0);
                if (speedRatio <= 0 && request.getTotalDurationSeconds() > 0 && durationSeconds > 0) {
                    speedRatio = request.getTotalDurationSeconds() / durationSeconds;
                }

                ExecutionResult result = ExecutionResult.builder()
                        .state(ExecutionState.COMPLETED)
                        .request(request)
                        .originalSize(originalSize)
                        .convertedSize(convertedSize)
                        .durationSeconds(durationSeconds)
                        .speedRatio(speedRatio)
                        .startedAt(startedAt)
                        .completedAt(LocalDateTime.now())
                        .build();

                log.info("Conversion complete: {} ({} -> {}, {} reduction, {}x speed)",
                        jobName,
                        FormatUtils.formatBinarySize(originalSize),
                        FormatUtils.formatBinarySize(convertedSize),
                        FormatUtils.formatPercentage(result.getCompressionRatio() * 100.0),
                        String.format("%.1f", speedRatio));

                return finish(jobName, result);

            } catch (IOException e) {
                destroy(started);
                if (cancelRequested) {
                    return finish(jobName, stamp(ExecutionResult.cancelled(request, ConversionConstants.CANCELLED_MESSAGE),
                            originalSize, startedAt, startNanos));
                }
                log.error("Error running encoder for {}: {}", jobName, e.getMessage(), e);
                return finish(jobName, stamp(ExecutionResult.failure(request, FailureReason.PROCESS_EXECUTION_FAILED,
                        "Error running encoder: " + e.getMessage(), e), originalSize, startedAt, startNanos));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelRequested = true;
                destroy(started);
                log.warn("Interrupted while converting {}, treating as cancellation", jobName);
                return finish(jobName, stamp(ExecutionResult.cancelled(request, "Conversion interrupted"),
                        originalSize, startedAt, startNanos));
            }
        } finally {
            process = null;
        }
    }

    /**
     * Request cancellation. Kills the running encoder, if any, together with
     * its child processes. Safe to call repeatedly and from any thread.
     */
    public void cancel() {
        cancelRequested = true;
        Process current = process;
        if (current != null) {
            log.debug("Cancelling running encoder process {}", current.pid());
            destroy(current);
        }
    }

    public ExecutionState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public boolean isRunning() {
        return getState() == ExecutionState.RUNNING;
    }

    /**
     * Read merged encoder output line by line, feeding the parser and the
     * throttled callback. Returns the retained tail of the output.
     */
    private String streamOutput(Process started, ProgressParser parser, Consumer<ProgressSample> progressCallback,
                                Duration minCallbackInterval, String jobName) throws IOException {
        StringBuilder output = new StringBuilder();
        long intervalNanos = Math.max(0L, minCallbackInterval.toNanos());
        long lastCallbackNanos = 0L;
        boolean callbackInvoked = false;

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {

            String line;
            while ((line = reader.readLine()) != null) {
                appendBounded(output, line);
                log.trace("Encoder output: {}", line);

                Optional<ProgressSample> sample = parser.parseLine(line);
                if (sample.isEmpty() || progressCallback == null) {
                    continue;
                }

                long now = System.nanoTime();
                if (!callbackInvoked || now - lastCallbackNanos >= intervalNanos) {
                    lastCallbackNanos = now;
                    callbackInvoked = true;
                    notifyProgress(progressCallback, sample.get(), jobName);
                }
            }
        }
        return output.toString();
    }

    private void notifyProgress(Consumer<ProgressSample> progressCallback, ProgressSample sample, String jobName) {
        try {
            progressCallback.accept(sample);
        } catch (RuntimeException e) {
            log.warn("Progress callback failed for {}: {}", jobName, e.getMessage(), e);
        }
    }

    private void appendBounded(StringBuilder output, String line) {
        output.append(line).append('\n');
        int limit = diagnosticTailChars * 2;
        if (output.length() > limit) {
            output.delete(0, output.length() - diagnosticTailChars);
        }
    }

    private ExecutionResult finish(String jobName, ExecutionResult result) {
        synchronized (stateLock) {
            state = stateMachine.transition(jobName, state, result.getState());
        }
        if (result.isFailed()) {
            log.warn("Conversion failed: {}", result.describeFailure());
        } else if (result.isCancelled()) {
            log.info("Conversion cancelled: {}", jobName);
        }
        return result;
    }

    private static ExecutionResult stamp(ExecutionResult result, long originalSize,
                                         LocalDateTime startedAt, long startNanos) {
        return result.toBuilder()
                .originalSize(originalSize)
                .durationSeconds(elapsedSeconds(startNanos))
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now())
                .build();
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static void destroy(Process target) {
        try {
            target.descendants().forEach(ProcessHandle::destroyForcibly);
            target.destroyForcibly();
        } catch (RuntimeException e) {
            // The process may exit between the check and the kill
            log.debug("Could not terminate encoder process: {}", e.getMessage());
        }
    }
}
