package com.airquality.karachi.functions;

import com.airquality.karachi.models.ColumnKind;
import com.airquality.karachi.models.FeatureLayout;
import com.airquality.karachi.models.FeatureSpec;
import com.airquality.karachi.models.FeatureTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Last stage: fixes column order and kinds, prunes rows without full history or
 * future context, and emits the Feature Spec for the result.
 */
public class SchemaFinalizer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaFinalizer.class);

    private final FeatureLayout layout;
    private final int schemaVersion;

    public SchemaFinalizer(FeatureLayout layout, int schemaVersion) {
        this.layout = layout;
        this.schemaVersion = schemaVersion;
    }

    public Result finalizeTable(FeatureTable table) {
        List<String> expected = layout.getColumns();
        Set<String> actual = new HashSet<>(table.getColumnNames());
        if (!actual.equals(new HashSet<>(expected))) {
            Set<String> missing = new HashSet<>(expected);
            missing.removeAll(actual);
            Set<String> unexpected = new HashSet<>(actual);
            unexpected.removeAll(expected);
            throw new IllegalStateException(String.format(
                    "Schema drift: missing columns %s, unexpected columns %s", missing, unexpected));
        }
        FeatureTable ordered = table.selectColumns(expected);

        boolean[] keep = new boolean[ordered.size()];
        List<Double[]> required = new ArrayList<>();
        for (String column : layout.getRequiredColumns()) {
            required.add(ordered.getColumn(column));
        }
        int dropped = 0;
        for (int row = 0; row < keep.length; row++) {
            keep[row] = true;
            for (Double[] values : required) {
                if (values[row] == null) {
                    keep[row] = false;
                    dropped++;
                    break;
                }
            }
        }
        FeatureTable pruned = ordered.filterRows(keep);
        if (dropped > 0) {
            LOG.info("Dropped {} rows lacking lag/window/target context", dropped);
        }
        if (pruned.isEmpty()) {
            LOG.warn("No rows left after pruning; history is shorter than the largest lag/window/target");
        }

        FeatureTable typed = castColumns(pruned);
        FeatureSpec spec = FeatureSpec.of(schemaVersion, layout);
        return new Result(typed, spec, dropped);
    }

    private FeatureTable castColumns(FeatureTable table) {
        Map<String, ColumnKind> kinds = layout.getColumnKinds();
        Map<String, Double[]> cast = new LinkedHashMap<>();
        for (String column : table.getColumnNames()) {
            Double[] values = table.getColumn(column);
            boolean integral = kinds.get(column) == ColumnKind.INTEGER;
            for (int row = 0; row < values.length; row++) {
                Double value = values[row];
                if (value == null) {
                    throw new IllegalStateException(String.format(
                            "Null left in column '%s' at row %d after finalization", column, row));
                }
                if (integral) {
                    if (value != Math.rint(value)) {
                        throw new IllegalStateException(String.format(
                                "Integer column '%s' holds non-integral value %s", column, value));
                    }
                    values[row] = Math.rint(value);
                }
            }
            cast.put(column, values);
        }
        return table.withColumns(cast);
    }

    /**
     * Finalized table, its spec and the number of rows pruned for missing context.
     */
    public static final class Result {
        private final FeatureTable table;
        private final FeatureSpec spec;
        private final int droppedRows;

        Result(FeatureTable table, FeatureSpec spec, int droppedRows) {
            this.table = table;
            this.spec = spec;
            this.droppedRows = droppedRows;
        }

        public FeatureTable getTable() { return table; }
        public FeatureSpec getSpec() { return spec; }
        public int getDroppedRows() { return droppedRows; }
    }
}
