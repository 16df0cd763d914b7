package com.airquality.karachi.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Frozen column contract shared by training and serving.
 *
 * Table column order is always {@code [primary_key] + feature_columns + target_columns}.
 * Serving builds its input vector from {@code feature_columns}, in order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"version", "primary_key", "feature_columns", "target_columns", "column_types"})
public final class FeatureSpec {

    @JsonProperty("version")
    private final int version;

    @JsonProperty("primary_key")
    private final String primaryKey;

    @JsonProperty("feature_columns")
    private final List<String> featureColumns;

    @JsonProperty("target_columns")
    private final List<String> targetColumns;

    @JsonProperty("column_types")
    private final Map<String, ColumnKind> columnTypes;

    @JsonCreator
    public FeatureSpec(
            @JsonProperty("version") int version,
            @JsonProperty("primary_key") String primaryKey,
            @JsonProperty("feature_columns") List<String> featureColumns,
            @JsonProperty("target_columns") List<String> targetColumns,
            @JsonProperty("column_types") Map<String, ColumnKind> columnTypes) {
        this.version = version;
        this.primaryKey = Objects.requireNonNull(primaryKey, "primary_key");
        this.featureColumns = List.copyOf(featureColumns);
        this.targetColumns = targetColumns == null ? List.of() : List.copyOf(targetColumns);
        this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
    }

    public static FeatureSpec of(int version, FeatureLayout layout) {
        return new FeatureSpec(version, FeatureLayout.PRIMARY_KEY,
                layout.getFeatureColumns(), layout.getTargetColumns(), layout.getColumnKinds());
    }

    public int getVersion() { return version; }
    public String getPrimaryKey() { return primaryKey; }
    public List<String> getFeatureColumns() { return featureColumns; }
    public List<String> getTargetColumns() { return targetColumns; }
    public Map<String, ColumnKind> getColumnTypes() { return columnTypes; }

    /**
     * Full header of a persisted feature table, primary key first.
     */
    @JsonIgnore
    public List<String> getColumns() {
        List<String> columns = new ArrayList<>();
        columns.add(primaryKey);
        columns.addAll(featureColumns);
        columns.addAll(targetColumns);
        return columns;
    }

    @JsonIgnore
    public ColumnKind kindOf(String column) {
        return columnTypes.getOrDefault(column, ColumnKind.FLOAT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSpec)) return false;
        FeatureSpec that = (FeatureSpec) o;
        return version == that.version
                && primaryKey.equals(that.primaryKey)
                && featureColumns.equals(that.featureColumns)
                && targetColumns.equals(that.targetColumns)
                && columnTypes.equals(that.columnTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, primaryKey, featureColumns, targetColumns, columnTypes);
    }

    @Override
    public String toString() {
        return String.format("FeatureSpec{version=%d, features=%d, targets=%s}",
                version, featureColumns.size(), targetColumns);
    }
}
