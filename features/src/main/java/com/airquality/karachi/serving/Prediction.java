package com.airquality.karachi.serving;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of the prediction contract.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Prediction {

    @JsonProperty("prediction")
    private final double value;

    @JsonProperty("timestamp")
    private final Long timestamp;

    public Prediction(double value, Long timestamp) {
        this.value = value;
        this.timestamp = timestamp;
    }

    public double getValue() { return value; }

    /** Epoch millis of the feature row used, null for ad-hoc payloads. */
    public Long getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("Prediction{value=%.4f, timestamp=%s}", value, timestamp);
    }
}
