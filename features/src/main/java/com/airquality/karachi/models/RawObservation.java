package com.airquality.karachi.models;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One raw reading as delivered by a source, before timestamp normalization.
 * The timestamp is kept in whatever form the source produced (String, epoch
 * seconds, Instant, LocalDateTime, OffsetDateTime or ZonedDateTime).
 * Channel values are nullable.
 */
public class RawObservation {

    private final Object timestamp;
    private final Map<String, Double> values;

    public RawObservation(Object timestamp, Map<String, Double> values) {
        this.timestamp = timestamp;
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    public Object getTimestamp() { return timestamp; }
    public Map<String, Double> getValues() { return values; }

    public Double getValue(String channel) {
        return values.get(channel);
    }

    @Override
    public String toString() {
        return String.format("RawObservation{timestamp=%s, values=%s}", timestamp, values);
    }
}
