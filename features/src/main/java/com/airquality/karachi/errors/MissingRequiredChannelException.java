package com.airquality.karachi.errors;

import java.util.List;

/**
 * One or more configured channels are not columns of the raw input.
 */
public class MissingRequiredChannelException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final List<String> missingChannels;

    public MissingRequiredChannelException(List<String> missingChannels) {
        super("Raw input is missing configured channels: " + missingChannels);
        this.missingChannels = List.copyOf(missingChannels);
    }

    public List<String> getMissingChannels() { return missingChannels; }
}
