package com.airquality.karachi.functions;

import com.airquality.karachi.errors.MissingRequiredChannelException;
import com.airquality.karachi.models.FeatureLayout;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.models.PipelineReport;
import com.airquality.karachi.models.PipelineResult;
import com.airquality.karachi.models.RawTable;
import com.airquality.karachi.utils.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch feature derivation, raw table in, finalized feature table out.
 *
 * Stage order is fixed: normalize, join, impute, calendar, lag/window, interactions,
 * targets, finalize. Each stage receives a new table from the previous one. The
 * pipeline holds no state between runs, so identical input and configuration give
 * identical output.
 */
public class FeaturePipeline {

    private static final Logger LOG = LoggerFactory.getLogger(FeaturePipeline.class);

    private final PipelineConfig config;
    private final FeatureLayout layout;

    public FeaturePipeline(PipelineConfig config) {
        this.config = config;
        this.layout = FeatureLayout.from(config);
    }

    public PipelineResult run(RawTable airQuality) {
        return run(airQuality, null);
    }

    /**
     * @param airQuality primary table; decides which timestamps exist
     * @param weather optional auxiliary table left-joined by timestamp, may be null
     */
    public PipelineResult run(RawTable airQuality, RawTable weather) {
        LOG.info("Starting feature pipeline with {}", config);
        List<String> primaryChannels = new ArrayList<>();
        List<String> weatherChannels = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String channel : config.getChannels()) {
            if (airQuality.hasColumn(channel)) {
                primaryChannels.add(channel);
            } else if (weather != null && weather.hasColumn(channel)) {
                weatherChannels.add(channel);
            } else {
                missing.add(channel);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingRequiredChannelException(missing);
        }

        // 1. Timestamps
        TimeNormalizer.Result normalized = new TimeNormalizer(primaryChannels).normalize(airQuality);
        FeatureTable table = normalized.getTable();
        int duplicates = normalized.getDuplicatesDropped();

        if (weather != null && !weatherChannels.isEmpty()) {
            if (weather.size() == 0) {
                // no weather rows at all: channels stay null and the imputer applies the default
                LOG.warn("Weather table is empty; channels {} will be filled by the imputer", weatherChannels);
                Map<String, Double[]> empty = new LinkedHashMap<>();
                for (String channel : weatherChannels) {
                    empty.put(channel, new Double[table.size()]);
                }
                table = table.withColumns(empty);
            } else {
                TimeNormalizer.Result weatherNormalized = new TimeNormalizer(weatherChannels).normalize(weather);
                duplicates += weatherNormalized.getDuplicatesDropped();
                table = new RawTableJoiner().leftJoin(table, weatherNormalized.getTable());
            }
        }
        table = table.selectColumns(config.getChannels());
        int inputRows = table.size();

        // 2. Gaps
        GapImputer.Result imputed = new GapImputer(config.getChannels(), config.getImputeDefault())
                .impute(table);
        table = imputed.getTable();

        // 3. Calendar
        table = new CyclicEncoder(config.getCyclicFields(), config.isRetainCalendarFields())
                .encode(table);

        // 4. History
        table = new LagWindowEngine(config.getLags(), config.getWindows(), config.getWindowPolicy())
                .apply(table);

        // 5. Interactions
        table = new InteractionBuilder(config.getRatios(), config.getProducts(), config.getRatioEpsilon())
                .apply(table);

        // 6. Labels, strictly after every feature stage
        table = new TargetShifter(config.getTargets()).apply(table);

        // 7. Schema
        SchemaFinalizer.Result finalized = new SchemaFinalizer(layout, config.getSchemaVersion())
                .finalizeTable(table);

        PipelineReport report = new PipelineReport(
                inputRows,
                duplicates,
                imputed.getImputedCounts(),
                finalized.getDroppedRows(),
                finalized.getTable().size());
        LOG.info("Feature pipeline finished: {}", report);
        return new PipelineResult(finalized.getTable(), finalized.getSpec(), report);
    }

    public FeatureLayout getLayout() {
        return layout;
    }
}
