package com.airquality.karachi.serving;

import com.airquality.karachi.models.FeatureTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Serving-side half of the feature contract: payload or latest row in, one number out.
 */
public class PredictionService {

    private static final Logger LOG = LoggerFactory.getLogger(PredictionService.class);

    private final FeatureVectorBuilder vectorBuilder;
    private final Predictor predictor;

    public PredictionService(FeatureVectorBuilder vectorBuilder, Predictor predictor) {
        this.vectorBuilder = vectorBuilder;
        this.predictor = predictor;
    }

    public Prediction predict(Map<String, ?> features) {
        long absent = vectorBuilder.getSpec().getFeatureColumns().stream()
                .filter(c -> features.get(c) == null)
                .count();
        if (absent > 0) {
            LOG.debug("{} feature columns absent from payload; defaulted to {}",
                    absent, FeatureVectorBuilder.DEFAULT_VALUE);
        }
        return new Prediction(predictor.predict(vectorBuilder.build(features)), null);
    }

    public Prediction predictLatest(FeatureTable table) {
        double[] vector = vectorBuilder.latest(table);
        long timestamp = table.getTimestamp(table.size() - 1);
        return new Prediction(predictor.predict(vector), timestamp);
    }
}
