package com.airquality.karachi.sinks;

import com.airquality.karachi.errors.DataSourceException;
import com.airquality.karachi.models.FeatureSpec;
import com.airquality.karachi.models.FeatureTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Writes to the primary sink and, only on an I/O failure, to the secondary one.
 * Both failing is fatal.
 */
public class FallbackFeatureSink implements FeatureSink {

    private static final Logger LOG = LoggerFactory.getLogger(FallbackFeatureSink.class);

    private final FeatureSink primary;
    private final FeatureSink secondary;

    public FallbackFeatureSink(FeatureSink primary, FeatureSink secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    @Override
    public void write(FeatureTable table, FeatureSpec spec) {
        IOException primaryFailure;
        try {
            primary.write(table, spec);
            return;
        } catch (IOException e) {
            primaryFailure = e;
            LOG.warn("Primary sink {} failed ({}); falling back to {}",
                    primary.describe(), e.getMessage(), secondary.describe());
        }

        try {
            secondary.write(table, spec);
        } catch (IOException e) {
            e.addSuppressed(primaryFailure);
            throw new DataSourceException(String.format(
                    "Both feature sinks failed: %s and %s", primary.describe(), secondary.describe()), e);
        }
    }

    @Override
    public String describe() {
        return primary.describe() + " -> " + secondary.describe();
    }
}
