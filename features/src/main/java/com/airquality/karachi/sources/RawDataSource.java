package com.airquality.karachi.sources;

import com.airquality.karachi.models.RawTable;

import java.io.IOException;

/**
 * Supplies one batch of raw observations. Implementations hold no connection
 * beyond a single {@link #load()} call.
 */
public interface RawDataSource {

    RawTable load() throws IOException;

    /** Short label for logs. */
    String describe();
}
