package com.github.stormino.videoconverter.service.command;

import com.github.stormino.videoconverter.model.ConversionRequest;

/**
 * Tells whether the encoder a request needs can be used on this machine.
 */
@FunctionalInterface
public interface EncoderAvailability {

    boolean isAvailable(ConversionRequest request);
}
