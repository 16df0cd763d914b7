package com.airquality.karachi.models;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, timestamp-keyed columnar table passed between pipeline stages.
 *
 * Timestamps are UTC epoch millis and strictly increasing. Cells are nullable
 * {@code Double}s; a null means "no value" (missing reading or missing history).
 * Every mutator returns a new table so a stage can never alter its input.
 */
public final class FeatureTable {

    private static final DateTimeFormatter LOG_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final long[] timestamps;
    private final LinkedHashMap<String, Double[]> columns;

    public FeatureTable(long[] timestamps, Map<String, Double[]> columns) {
        for (int i = 1; i < timestamps.length; i++) {
            if (timestamps[i] <= timestamps[i - 1]) {
                throw new IllegalArgumentException(
                        "Timestamps must be strictly increasing at row " + i);
            }
        }
        this.timestamps = timestamps.clone();
        this.columns = new LinkedHashMap<>();
        for (Map.Entry<String, Double[]> entry : columns.entrySet()) {
            if (entry.getValue().length != timestamps.length) {
                throw new IllegalArgumentException(String.format(
                        "Column '%s' has %d values, expected %d",
                        entry.getKey(), entry.getValue().length, timestamps.length));
            }
            this.columns.put(entry.getKey(), entry.getValue().clone());
        }
    }

    public int size() {
        return timestamps.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    public long getTimestamp(int row) {
        return timestamps[row];
    }

    public long[] getTimestamps() {
        return timestamps.clone();
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Double[] getColumn(String name) {
        return requireColumn(name).clone();
    }

    public Double getValue(String name, int row) {
        return requireColumn(name)[row];
    }

    /**
     * Values of one row in column order.
     */
    public Map<String, Double> getRow(int row) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, Double[]> entry : columns.entrySet()) {
            values.put(entry.getKey(), entry.getValue()[row]);
        }
        return values;
    }

    /**
     * Adds (or replaces in place) the given columns, keeping insertion order for new ones.
     */
    public FeatureTable withColumns(Map<String, Double[]> added) {
        LinkedHashMap<String, Double[]> merged = new LinkedHashMap<>(columns);
        merged.putAll(added);
        return new FeatureTable(timestamps, merged);
    }

    public FeatureTable withColumn(String name, Double[] values) {
        Map<String, Double[]> added = new LinkedHashMap<>();
        added.put(name, values);
        return withColumns(added);
    }

    /**
     * Projects the table onto exactly the given columns, in the given order.
     */
    public FeatureTable selectColumns(List<String> order) {
        LinkedHashMap<String, Double[]> selected = new LinkedHashMap<>();
        for (String name : order) {
            selected.put(name, requireColumn(name));
        }
        return new FeatureTable(timestamps, selected);
    }

    /**
     * Keeps only rows whose flag is set.
     */
    public FeatureTable filterRows(boolean[] keep) {
        if (keep.length != timestamps.length) {
            throw new IllegalArgumentException("Row mask length " + keep.length
                    + " does not match table size " + timestamps.length);
        }
        int kept = 0;
        for (boolean k : keep) {
            if (k) {
                kept++;
            }
        }

        long[] keptTimestamps = new long[kept];
        LinkedHashMap<String, Double[]> keptColumns = new LinkedHashMap<>();
        for (String name : columns.keySet()) {
            keptColumns.put(name, new Double[kept]);
        }

        int target = 0;
        for (int row = 0; row < timestamps.length; row++) {
            if (!keep[row]) {
                continue;
            }
            keptTimestamps[target] = timestamps[row];
            for (Map.Entry<String, Double[]> entry : columns.entrySet()) {
                keptColumns.get(entry.getKey())[target] = entry.getValue()[row];
            }
            target++;
        }
        return new FeatureTable(keptTimestamps, keptColumns);
    }

    private Double[] requireColumn(String name) {
        Double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureTable)) return false;
        FeatureTable other = (FeatureTable) o;
        if (!Arrays.equals(timestamps, other.timestamps)) return false;
        if (!new ArrayList<>(columns.keySet()).equals(new ArrayList<>(other.columns.keySet()))) return false;
        for (Map.Entry<String, Double[]> entry : columns.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.columns.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(timestamps);
        for (Map.Entry<String, Double[]> entry : columns.entrySet()) {
            result = 31 * result + entry.getKey().hashCode();
            result = 31 * result + Arrays.hashCode(entry.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return String.format("FeatureTable{rows=0, columns=%d}", columns.size());
        }
        return String.format("FeatureTable{rows=%d, columns=%d, from=%s, to=%s}",
                timestamps.length, columns.size(),
                LOG_FORMAT.format(Instant.ofEpochMilli(timestamps[0])),
                LOG_FORMAT.format(Instant.ofEpochMilli(timestamps[timestamps.length - 1])));
    }
}
