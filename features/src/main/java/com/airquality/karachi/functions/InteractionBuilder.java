package com.airquality.karachi.functions;

import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.utils.PipelineConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-wise ratio and product features computed from current channel values.
 */
public class InteractionBuilder {

    private final List<PipelineConfig.RatioSpec> ratios;
    private final List<PipelineConfig.ProductSpec> products;
    private final double epsilon;

    public InteractionBuilder(List<PipelineConfig.RatioSpec> ratios,
                              List<PipelineConfig.ProductSpec> products,
                              double epsilon) {
        this.ratios = List.copyOf(ratios);
        this.products = List.copyOf(products);
        this.epsilon = epsilon;
    }

    public FeatureTable apply(FeatureTable table) {
        Map<String, Double[]> added = new LinkedHashMap<>();

        for (PipelineConfig.RatioSpec ratio : ratios) {
            Double[] numerator = table.getColumn(ratio.getNumerator());
            Double[] denominator = table.getColumn(ratio.getDenominator());
            Double[] out = new Double[table.size()];
            for (int i = 0; i < out.length; i++) {
                if (numerator[i] != null && denominator[i] != null) {
                    out[i] = numerator[i] / (denominator[i] + epsilon);
                }
            }
            added.put(ratio.getName(), out);
        }

        for (PipelineConfig.ProductSpec product : products) {
            Double[] left = table.getColumn(product.getLeft());
            Double[] right = table.getColumn(product.getRight());
            Double[] out = new Double[table.size()];
            for (int i = 0; i < out.length; i++) {
                if (left[i] != null && right[i] != null) {
                    out[i] = left[i] * right[i] / product.getDivisor();
                }
            }
            added.put(product.getName(), out);
        }

        return table.withColumns(added);
    }
}
