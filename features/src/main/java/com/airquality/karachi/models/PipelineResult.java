package com.airquality.karachi.models;

/**
 * Output of a successful pipeline run: the finalized table, its spec and the run report.
 */
public final class PipelineResult {

    private final FeatureTable table;
    private final FeatureSpec spec;
    private final PipelineReport report;

    public PipelineResult(FeatureTable table, FeatureSpec spec, PipelineReport report) {
        this.table = table;
        this.spec = spec;
        this.report = report;
    }

    public FeatureTable getTable() { return table; }
    public FeatureSpec getSpec() { return spec; }
    public PipelineReport getReport() { return report; }
}
