package com.airquality.karachi.models;

/**
 * Rolling window aggregates.
 */
public enum Aggregate {

    MEAN("mean", 1),
    STD("std", 2);

    private final String label;
    private final int minObservations;

    Aggregate(String label, int minObservations) {
        this.label = label;
        this.minObservations = minObservations;
    }

    public String getLabel() { return label; }

    /** Fewest values the aggregate is defined on (sample std needs two). */
    public int getMinObservations() { return minObservations; }
}
