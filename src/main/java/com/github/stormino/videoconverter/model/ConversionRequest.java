package com.github.stormino.videoconverter.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * One file to convert. The encoder name is opaque here: it is only handed to
 * the availability check and the command builder.
 */
@Value
@Builder
public class ConversionRequest implements JobDescriptor {

    @NonNull
    Path inputPath;

    @NonNull
    Path outputPath;

    @Builder.Default
    String encoder = "libx265";

    // 0 when the duration is unknown; percentages then stay at 0
    @Builder.Default
    double totalDurationSeconds = 0.0;
}
