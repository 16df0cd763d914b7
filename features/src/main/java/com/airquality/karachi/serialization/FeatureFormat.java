package com.airquality.karachi.serialization;

import com.airquality.karachi.errors.SchemaMismatchException;
import com.airquality.karachi.models.ColumnKind;
import com.airquality.karachi.models.FeatureSpec;
import com.airquality.karachi.models.FeatureTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Text form of feature values shared by every persisted representation.
 * Integer columns print without a fraction; float columns use the shortest
 * round-tripping decimal, so the same table always yields the same bytes.
 */
public final class FeatureFormat {

    private FeatureFormat() {}

    public static String format(double value, ColumnKind kind) {
        if (kind == ColumnKind.INTEGER) {
            return Long.toString(Math.round(value));
        }
        return Double.toString(value);
    }

    /**
     * Cells of one table row in spec column order, primary key first.
     */
    public static List<String> formatRow(FeatureTable table, FeatureSpec spec, int row) {
        List<String> cells = new ArrayList<>();
        cells.add(Long.toString(table.getTimestamp(row)));
        for (String column : valueColumns(spec)) {
            cells.add(format(table.getValue(column, row), spec.kindOf(column)));
        }
        return cells;
    }

    /**
     * Fails unless the table columns equal the spec's feature and target columns, in order.
     */
    public static void requireConforms(FeatureTable table, FeatureSpec spec) {
        List<String> expected = valueColumns(spec);
        if (!table.getColumnNames().equals(expected)) {
            throw new SchemaMismatchException(String.format(
                    "Table columns %s do not match spec v%d columns %s",
                    table.getColumnNames(), spec.getVersion(), expected));
        }
    }

    static List<String> valueColumns(FeatureSpec spec) {
        List<String> columns = new ArrayList<>(spec.getFeatureColumns());
        columns.addAll(spec.getTargetColumns());
        return columns;
    }
}
