package com.airquality.karachi.serving;

import com.airquality.karachi.errors.InvalidFeatureValueException;
import com.airquality.karachi.models.FeatureSpec;
import com.airquality.karachi.models.FeatureTable;

import java.util.List;
import java.util.Map;

/**
 * Builds model input vectors in the frozen feature column order.
 *
 * A field absent from the payload (or explicitly null) becomes 0.0. Present
 * fields must be numbers or numeric strings; anything else is rejected with the
 * offending field named rather than silently zeroed.
 */
public class FeatureVectorBuilder {

    public static final double DEFAULT_VALUE = 0.0;

    private final FeatureSpec spec;

    public FeatureVectorBuilder(FeatureSpec spec) {
        this.spec = spec;
    }

    public double[] build(Map<String, ?> features) {
        List<String> columns = spec.getFeatureColumns();
        double[] vector = new double[columns.size()];
        for (int i = 0; i < vector.length; i++) {
            String column = columns.get(i);
            vector[i] = toDouble(column, features.get(column));
        }
        return vector;
    }

    /**
     * Vector for the most recent row of a persisted feature table.
     */
    public double[] latest(FeatureTable table) {
        if (table.isEmpty()) {
            throw new IllegalArgumentException("Feature table has no rows");
        }
        return build(table.getRow(table.size() - 1));
    }

    private static double toDouble(String field, Object value) {
        if (value == null) {
            return DEFAULT_VALUE;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidFeatureValueException(field, value);
            }
            return d;
        }
        if (value instanceof CharSequence) {
            try {
                double d = Double.parseDouble(value.toString().trim());
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new InvalidFeatureValueException(field, value);
                }
                return d;
            } catch (NumberFormatException e) {
                throw new InvalidFeatureValueException(field, value);
            }
        }
        throw new InvalidFeatureValueException(field, value);
    }

    public FeatureSpec getSpec() {
        return spec;
    }
}
