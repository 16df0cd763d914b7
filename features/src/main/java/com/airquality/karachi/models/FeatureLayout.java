package com.airquality.karachi.models;

import com.airquality.karachi.utils.PipelineConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column names of every feature group, derived once from the configuration.
 *
 * Stages name their output columns through this class and the schema finalizer
 * orders the table by it, so a column can only be spelled one way.
 */
public final class FeatureLayout {

    public static final String PRIMARY_KEY = "timestamp";
    public static final String IS_WEEKEND = "is_weekend";

    private final List<String> channelColumns;
    private final List<String> calendarColumns;
    private final List<String> cyclicColumns;
    private final List<String> lagColumns;
    private final List<String> rollingColumns;
    private final List<String> interactionColumns;
    private final List<String> targetColumns;
    private final Map<String, ColumnKind> kinds;

    private FeatureLayout(PipelineConfig config) {
        this.channelColumns = List.copyOf(config.getChannels());

        List<String> calendar = new ArrayList<>();
        List<String> cyclic = new ArrayList<>();
        for (CalendarField field : config.getCyclicFields()) {
            if (config.isRetainCalendarFields()) {
                calendar.add(field.getColumnName());
            }
            cyclic.add(field.sinColumn());
            cyclic.add(field.cosColumn());
        }
        this.calendarColumns = List.copyOf(calendar);
        this.cyclicColumns = List.copyOf(cyclic);

        List<String> lags = new ArrayList<>();
        for (PipelineConfig.HorizonSpec spec : config.getLags()) {
            for (int h : spec.getSteps()) {
                lags.add(lagColumn(spec.getChannel(), h));
            }
        }
        this.lagColumns = List.copyOf(lags);

        List<String> rolling = new ArrayList<>();
        for (PipelineConfig.WindowSpec spec : config.getWindows()) {
            for (int w : spec.getSizes()) {
                for (Aggregate aggregate : spec.getAggregates()) {
                    rolling.add(rollingColumn(spec.getChannel(), aggregate, w));
                }
            }
        }
        this.rollingColumns = List.copyOf(rolling);

        List<String> interactions = new ArrayList<>();
        for (PipelineConfig.RatioSpec ratio : config.getRatios()) {
            interactions.add(ratio.getName());
        }
        for (PipelineConfig.ProductSpec product : config.getProducts()) {
            interactions.add(product.getName());
        }
        this.interactionColumns = List.copyOf(interactions);

        List<String> targets = new ArrayList<>();
        for (PipelineConfig.HorizonSpec spec : config.getTargets()) {
            for (int h : spec.getSteps()) {
                targets.add(targetColumn(spec.getChannel(), h));
            }
        }
        this.targetColumns = List.copyOf(targets);

        this.kinds = buildKinds();
    }

    public static FeatureLayout from(PipelineConfig config) {
        return new FeatureLayout(config);
    }

    // --- Naming ---

    public static String lagColumn(String channel, int horizon) {
        return channel + "_lag_" + horizon;
    }

    public static String rollingColumn(String channel, Aggregate aggregate, int window) {
        return channel + "_rolling_" + aggregate.getLabel() + "_" + window;
    }

    public static String targetColumn(String channel, int horizon) {
        return channel + "_target_" + horizon + "h";
    }

    private Map<String, ColumnKind> buildKinds() {
        Map<String, ColumnKind> result = new LinkedHashMap<>();
        result.put(PRIMARY_KEY, ColumnKind.INTEGER);
        Set<String> seen = new HashSet<>();
        seen.add(PRIMARY_KEY);
        for (String column : getColumns()) {
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Feature column name used twice: " + column);
            }
            boolean integral = calendarColumns.contains(column) || IS_WEEKEND.equals(column);
            result.put(column, integral ? ColumnKind.INTEGER : ColumnKind.FLOAT);
        }
        return Collections.unmodifiableMap(result);
    }

    // --- Groups ---

    public List<String> getChannelColumns() { return channelColumns; }
    public List<String> getCalendarColumns() { return calendarColumns; }
    public List<String> getCyclicColumns() { return cyclicColumns; }
    public List<String> getLagColumns() { return lagColumns; }
    public List<String> getRollingColumns() { return rollingColumns; }
    public List<String> getInteractionColumns() { return interactionColumns; }
    public List<String> getTargetColumns() { return targetColumns; }

    /**
     * Model inputs in frozen order: everything except the key and the targets.
     */
    public List<String> getFeatureColumns() {
        List<String> features = new ArrayList<>(channelColumns);
        features.addAll(calendarColumns);
        features.add(IS_WEEKEND);
        features.addAll(cyclicColumns);
        features.addAll(lagColumns);
        features.addAll(rollingColumns);
        features.addAll(interactionColumns);
        return features;
    }

    /**
     * All value columns (features then targets), excluding the primary key.
     */
    public List<String> getColumns() {
        List<String> columns = getFeatureColumns();
        columns.addAll(targetColumns);
        return columns;
    }

    /**
     * Columns whose nulls mark a row as lacking history or future context.
     */
    public List<String> getRequiredColumns() {
        List<String> required = new ArrayList<>(lagColumns);
        required.addAll(rollingColumns);
        required.addAll(targetColumns);
        return required;
    }

    /** Kind of every column, primary key first. */
    public Map<String, ColumnKind> getColumnKinds() {
        return kinds;
    }
}
