package com.airquality.karachi.functions;

import com.airquality.karachi.models.Aggregate;
import com.airquality.karachi.models.FeatureLayout;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.models.WindowPolicy;
import com.airquality.karachi.utils.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Causal history features: positional lags and trailing rolling aggregates.
 *
 * Offsets count rows of the sorted table, not clock hours: when readings are missing,
 * lag 1 is the previous available reading. The rolling window for row i covers rows
 * [i-w, i-1] and never row i itself. Rows without enough history get null and are
 * pruned by the schema finalizer.
 */
public class LagWindowEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LagWindowEngine.class);

    private final List<PipelineConfig.HorizonSpec> lags;
    private final List<PipelineConfig.WindowSpec> windows;
    private final WindowPolicy policy;

    public LagWindowEngine(List<PipelineConfig.HorizonSpec> lags,
                           List<PipelineConfig.WindowSpec> windows,
                           WindowPolicy policy) {
        this.lags = List.copyOf(lags);
        this.windows = List.copyOf(windows);
        this.policy = policy;
    }

    public FeatureTable apply(FeatureTable table) {
        Map<String, Double[]> added = new LinkedHashMap<>();

        for (PipelineConfig.HorizonSpec spec : lags) {
            Double[] values = table.getColumn(spec.getChannel());
            for (int horizon : spec.getSteps()) {
                added.put(FeatureLayout.lagColumn(spec.getChannel(), horizon), lag(values, horizon));
            }
        }

        for (PipelineConfig.WindowSpec spec : windows) {
            Double[] values = table.getColumn(spec.getChannel());
            for (int size : spec.getSizes()) {
                for (Aggregate aggregate : spec.getAggregates()) {
                    added.put(FeatureLayout.rollingColumn(spec.getChannel(), aggregate, size),
                            rolling(values, size, aggregate, policy));
                }
            }
        }

        LOG.info("Derived {} lag/rolling columns ({} window policy)", added.size(), policy);
        return table.withColumns(added);
    }

    /**
     * out[i] = values[i - horizon], null where that row does not exist.
     */
    public static Double[] lag(Double[] values, int horizon) {
        Double[] out = new Double[values.length];
        for (int i = horizon; i < values.length; i++) {
            out[i] = values[i - horizon];
        }
        return out;
    }

    /**
     * Aggregate over rows [i - size, i - 1].
     */
    public static Double[] rolling(Double[] values, int size, Aggregate aggregate, WindowPolicy policy) {
        Double[] out = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            int end = i;                       // exclusive
            int start = i - size;
            if (start < 0) {
                if (policy == WindowPolicy.FULL) {
                    continue;
                }
                start = 0;
            }
            if (end - start < aggregate.getMinObservations()) {
                continue;
            }
            out[i] = aggregate(values, start, end, aggregate);
        }
        return out;
    }

    private static Double aggregate(Double[] values, int start, int end, Aggregate aggregate) {
        int count = end - start;
        double sum = 0.0;
        for (int j = start; j < end; j++) {
            if (values[j] == null) {
                return null;
            }
            sum += values[j];
        }
        double mean = sum / count;
        if (aggregate == Aggregate.MEAN) {
            return mean;
        }
        double squares = 0.0;
        for (int j = start; j < end; j++) {
            double d = values[j] - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (count - 1));
    }
}
