package com.airquality.karachi.sources;

import com.airquality.karachi.errors.DataSourceException;
import com.airquality.karachi.models.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Tries the primary source and, only on an I/O failure, the secondary one.
 * Both failing is fatal; the primary failure is attached as suppressed.
 */
public class FallbackRawSource implements RawDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(FallbackRawSource.class);

    private final RawDataSource primary;
    private final RawDataSource secondary;

    public FallbackRawSource(RawDataSource primary, RawDataSource secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    @Override
    public RawTable load() {
        IOException primaryFailure;
        try {
            return primary.load();
        } catch (IOException e) {
            primaryFailure = e;
            LOG.warn("Primary source {} failed ({}); falling back to {}",
                    primary.describe(), e.getMessage(), secondary.describe());
        }

        try {
            return secondary.load();
        } catch (IOException e) {
            e.addSuppressed(primaryFailure);
            throw new DataSourceException(String.format(
                    "Both raw sources failed: %s and %s", primary.describe(), secondary.describe()), e);
        }
    }

    @Override
    public String describe() {
        return primary.describe() + " -> " + secondary.describe();
    }
}
