package com.airquality.karachi.functions;

import com.airquality.karachi.models.FeatureTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Left-joins an auxiliary normalized table (weather) onto the primary one (air quality)
 * by exact timestamp. The primary table decides which rows exist; auxiliary hours
 * without a primary row are discarded and primary hours without weather get nulls,
 * which the imputer fills afterwards.
 */
public class RawTableJoiner {

    private static final Logger LOG = LoggerFactory.getLogger(RawTableJoiner.class);

    public FeatureTable leftJoin(FeatureTable primary, FeatureTable auxiliary) {
        Map<Long, Integer> auxRows = new HashMap<>();
        for (int row = 0; row < auxiliary.size(); row++) {
            auxRows.put(auxiliary.getTimestamp(row), row);
        }

        Map<String, Double[]> added = new LinkedHashMap<>();
        for (String column : auxiliary.getColumnNames()) {
            if (primary.hasColumn(column)) {
                LOG.warn("Column '{}' exists in both tables; keeping the primary values", column);
                continue;
            }
            Double[] source = auxiliary.getColumn(column);
            Double[] joined = new Double[primary.size()];
            for (int row = 0; row < primary.size(); row++) {
                Integer auxRow = auxRows.get(primary.getTimestamp(row));
                joined[row] = auxRow == null ? null : source[auxRow];
            }
            added.put(column, joined);
        }

        int matched = 0;
        for (int row = 0; row < primary.size(); row++) {
            if (auxRows.containsKey(primary.getTimestamp(row))) {
                matched++;
            }
        }
        LOG.info("Joined auxiliary table: {}/{} primary rows matched", matched, primary.size());
        return primary.withColumns(added);
    }
}
