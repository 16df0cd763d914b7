package com.airquality.karachi.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row accounting for one pipeline run.
 */
public final class PipelineReport {

    private final int inputRows;
    private final int duplicatesDropped;
    private final Map<String, Integer> imputedCounts;
    private final int insufficientHistoryDropped;
    private final int outputRows;

    public PipelineReport(int inputRows, int duplicatesDropped, Map<String, Integer> imputedCounts,
                          int insufficientHistoryDropped, int outputRows) {
        this.inputRows = inputRows;
        this.duplicatesDropped = duplicatesDropped;
        this.imputedCounts = Collections.unmodifiableMap(new LinkedHashMap<>(imputedCounts));
        this.insufficientHistoryDropped = insufficientHistoryDropped;
        this.outputRows = outputRows;
    }

    public int getInputRows() { return inputRows; }
    public int getDuplicatesDropped() { return duplicatesDropped; }
    public Map<String, Integer> getImputedCounts() { return imputedCounts; }
    public int getInsufficientHistoryDropped() { return insufficientHistoryDropped; }
    public int getOutputRows() { return outputRows; }

    public int getTotalImputed() {
        int total = 0;
        for (int count : imputedCounts.values()) {
            total += count;
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format(
                "PipelineReport{input=%d, duplicates=%d, imputed=%d, insufficientHistory=%d, output=%d}",
                inputRows, duplicatesDropped, getTotalImputed(), insufficientHistoryDropped, outputRows);
    }
}
