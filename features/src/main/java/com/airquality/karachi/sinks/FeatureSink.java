package com.airquality.karachi.sinks;

import com.airquality.karachi.models.FeatureSpec;
import com.airquality.karachi.models.FeatureTable;

import java.io.IOException;

/**
 * Destination for a finalized feature table. A write replaces the previous
 * content for the same schema version as a whole.
 */
public interface FeatureSink {

    void write(FeatureTable table, FeatureSpec spec) throws IOException;

    /** Short label for logs. */
    String describe();
}
