package com.github.stormino.videoconverter.service.command;

import com.github.stormino.videoconverter.config.ConverterProperties;
import com.github.stormino.videoconverter.model.ConversionRequest;
import com.github.stormino.videoconverter.util.ConversionConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Default ffmpeg command: re-encode the video stream with the requested
 * encoder and copy audio. Applications with their own quality or preset
 * handling register a different {@link ArgvBuilder} bean.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FfmpegCommandBuilder implements ArgvBuilder {

    private final ConverterProperties properties;

    @Override
    public List<String> buildCommand(@NonNull ConversionRequest request) {
        List<String> command = new ArrayList<>();
        command.add(properties.getExecutor().getFfmpegPath());
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add(ConversionConstants.FFMPEG_LOG_LEVEL);
        command.add("-stats");
        command.add("-i");
        command.add(request.getInputPath().toString());
        command.add("-c:v");
        command.add(request.getEncoder());
        command.add("-c:a");
        command.add("copy");
        command.add("-y");
        command.add(request.getOutputPath().toString());

        log.debug("Built conversion command: {}", String.join(" ", command));
        return command;
    }
}
