package com.airquality.karachi.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A batch of raw observations plus the columns its source declared.
 * A declared column may still be null on every row; presence checks use the declared set.
 */
public class RawTable {

    private final List<String> columns;
    private final List<RawObservation> observations;

    public RawTable(List<String> columns, List<RawObservation> observations) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(columns)));
        this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
    }

    /**
     * Builds a table whose declared columns are the union of the observations' keys.
     */
    public static RawTable of(List<RawObservation> observations) {
        Set<String> columns = new LinkedHashSet<>();
        for (RawObservation obs : observations) {
            columns.addAll(obs.getValues().keySet());
        }
        return new RawTable(new ArrayList<>(columns), observations);
    }

    public List<String> getColumns() { return columns; }
    public List<RawObservation> getObservations() { return observations; }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return observations.size();
    }
}
