package com.airquality.karachi.functions;

import com.airquality.karachi.models.FeatureTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills null readings inside existing rows, one channel at a time.
 *
 * Interior gaps are linearly interpolated between the surrounding valid readings,
 * weighted by timestamp distance. Leading and trailing gaps take the nearest valid
 * reading (forward-fill, then backward-fill). A channel with no valid reading at
 * all falls back to the configured default.
 */
public class GapImputer {

    private static final Logger LOG = LoggerFactory.getLogger(GapImputer.class);

    private final List<String> channels;
    private final double defaultValue;

    public GapImputer(List<String> channels, double defaultValue) {
        this.channels = List.copyOf(channels);
        this.defaultValue = defaultValue;
    }

    public Result impute(FeatureTable table) {
        long[] timestamps = table.getTimestamps();
        Map<String, Double[]> filled = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (String channel : channels) {
            Double[] values = table.getColumn(channel);
            int missing = countNulls(values);
            if (missing == values.length && missing > 0) {
                LOG.warn("Channel '{}' has no valid readings; filling {} rows with default {}",
                        channel, missing, defaultValue);
            }
            if (missing > 0) {
                interpolate(values, timestamps);
                forwardFill(values);
                backwardFill(values);
                fillDefault(values, defaultValue);
            }
            filled.put(channel, values);
            counts.put(channel, missing);
        }

        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        LOG.info("Imputed {} values across {} channels: {}", total, channels.size(), counts);
        return new Result(table.withColumns(filled), counts);
    }

    /**
     * Time-weighted linear interpolation of interior nulls, in place.
     * Nulls before the first or after the last valid reading are left alone.
     */
    static void interpolate(Double[] values, long[] timestamps) {
        int previous = -1;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                continue;
            }
            if (previous >= 0 && i - previous > 1) {
                double start = values[previous];
                double end = values[i];
                double span = timestamps[i] - timestamps[previous];
                for (int gap = previous + 1; gap < i; gap++) {
                    double fraction = (timestamps[gap] - timestamps[previous]) / span;
                    values[gap] = start + fraction * (end - start);
                }
            }
            previous = i;
        }
    }

    static void forwardFill(Double[] values) {
        Double last = null;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                values[i] = last;
            } else {
                last = values[i];
            }
        }
    }

    static void backwardFill(Double[] values) {
        Double next = null;
        for (int i = values.length - 1; i >= 0; i--) {
            if (values[i] == null) {
                values[i] = next;
            } else {
                next = values[i];
            }
        }
    }

    private static void fillDefault(Double[] values, double defaultValue) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                values[i] = defaultValue;
            }
        }
    }

    private static int countNulls(Double[] values) {
        int count = 0;
        for (Double value : values) {
            if (value == null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Imputed table plus the number of values filled per channel.
     */
    public static final class Result {
        private final FeatureTable table;
        private final Map<String, Integer> imputedCounts;

        Result(FeatureTable table, Map<String, Integer> imputedCounts) {
            this.table = table;
            this.imputedCounts = imputedCounts;
        }

        public FeatureTable getTable() { return table; }
        public Map<String, Integer> getImputedCounts() { return imputedCounts; }
    }
}
