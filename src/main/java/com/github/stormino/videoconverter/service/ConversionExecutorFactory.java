package com.github.stormino.videoconverter.service;

import com.github.stormino.videoconverter.config.ConverterProperties;
import com.github.stormino.videoconverter.service.command.ArgvBuilder;
import com.github.stormino.videoconverter.service.command.EncoderAvailability;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Creates single-use {@link ConversionExecutor}s wired to the configured collaborators.
 */
@Component
@RequiredArgsConstructor
public class ConversionExecutorFactory {

    private final ArgvBuilder argvBuilder;
    private final EncoderAvailability encoderAvailability;
    private final ConverterProperties properties;

    public ConversionExecutor create() {
        return new ConversionExecutor(argvBuilder, encoderAvailability,
                properties.getExecutor().getDiagnosticTailChars());
    }

    public Duration getMinCallbackInterval() {
        return properties.getExecutor().getMinCallbackInterval();
    }
}
