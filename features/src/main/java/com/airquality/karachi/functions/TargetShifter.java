package com.airquality.karachi.functions;

import com.airquality.karachi.models.FeatureLayout;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.utils.PipelineConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forward-shifted label columns. Runs after every feature stage so no feature
 * can be computed from a label.
 */
public class TargetShifter {

    private final List<PipelineConfig.HorizonSpec> targets;

    public TargetShifter(List<PipelineConfig.HorizonSpec> targets) {
        this.targets = List.copyOf(targets);
    }

    public FeatureTable apply(FeatureTable table) {
        Map<String, Double[]> added = new LinkedHashMap<>();
        for (PipelineConfig.HorizonSpec spec : targets) {
            Double[] values = table.getColumn(spec.getChannel());
            for (int horizon : spec.getSteps()) {
                added.put(FeatureLayout.targetColumn(spec.getChannel(), horizon), lead(values, horizon));
            }
        }
        return table.withColumns(added);
    }

    /**
     * out[i] = values[i + horizon], null past the end of the table.
     */
    public static Double[] lead(Double[] values, int horizon) {
        Double[] out = new Double[values.length];
        for (int i = 0; i + horizon < values.length; i++) {
            out[i] = values[i + horizon];
        }
        return out;
    }
}
