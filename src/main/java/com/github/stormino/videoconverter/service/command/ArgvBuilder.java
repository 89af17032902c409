package com.github.stormino.videoconverter.service.command;

import com.github.stormino.videoconverter.model.ConversionRequest;

import java.util.List;

/**
 * Builds the encoder command line for one conversion.
 */
@FunctionalInterface
public interface ArgvBuilder {

    /**
     * @param request Conversion to build the command for
     * @return Program followed by its arguments
     */
    List<String> buildCommand(ConversionRequest request);
}
