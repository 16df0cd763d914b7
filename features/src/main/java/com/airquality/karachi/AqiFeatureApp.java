package com.airquality.karachi;

import com.airquality.karachi.errors.PipelineException;
import com.airquality.karachi.functions.FeaturePipeline;
import com.airquality.karachi.models.PipelineResult;
import com.airquality.karachi.models.RawTable;
import com.airquality.karachi.serialization.FeatureSpecStore;
import com.airquality.karachi.sinks.CsvFeatureSink;
import com.airquality.karachi.sinks.FallbackFeatureSink;
import com.airquality.karachi.sinks.FeatureSink;
import com.airquality.karachi.sinks.RedisFeatureSink;
import com.airquality.karachi.sources.CsvRawSource;
import com.airquality.karachi.sources.FallbackRawSource;
import com.airquality.karachi.sources.RawDataSource;
import com.airquality.karachi.utils.ConfigLoader;
import com.airquality.karachi.utils.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Karachi AQI feature job.
 *
 * Loads the raw air-quality (and optional weather) batch, derives the feature table,
 * freezes the Feature Spec and only then persists the table. Any fatal error aborts
 * before anything is written.
 */
public class AqiFeatureApp {

    private static final Logger LOG = LoggerFactory.getLogger(AqiFeatureApp.class);

    public static void main(String[] args) {
        try {
            PipelineResult result = run();
            LOG.info("Feature job complete: {}", result.getReport());
        } catch (PipelineException | IllegalStateException | IllegalArgumentException | IOException e) {
            LOG.error("Feature job aborted: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static PipelineResult run() throws IOException {
        LOG.info("Starting Karachi AQI feature job");

        // 1. Configuration
        PipelineConfig config = PipelineConfig.fromEnvironment();

        RawDataSource airSource = new CsvRawSource(Paths.get(ConfigLoader.rawAirPath()));
        Optional<String> backup = ConfigLoader.rawAirBackupPath();
        if (backup.isPresent()) {
            airSource = new FallbackRawSource(airSource, new CsvRawSource(Paths.get(backup.get())));
        }
        Optional<String> weatherPath = ConfigLoader.rawWeatherPath();
        RawDataSource weatherSource = weatherPath.isPresent()
                ? new CsvRawSource(Paths.get(weatherPath.get()))
                : null;

        FeatureSpecStore specStore = new FeatureSpecStore(Paths.get(ConfigLoader.featureSpecPath()));
        Path tablePath = Paths.get(ConfigLoader.featureTablePath());
        FeatureSink csvSink = new CsvFeatureSink(tablePath);

        if (!ConfigLoader.redisEnabled()) {
            return execute(config, airSource, weatherSource, specStore, List.of(csvSink));
        }
        try (RedisFeatureSink redisSink = RedisFeatureSink.fromEnvironment()) {
            // local spill of a failed online write
            FeatureSink online = new FallbackFeatureSink(redisSink, new CsvFeatureSink(
                    tablePath.resolveSibling(tablePath.getFileName() + ".redis-pending")));
            return execute(config, airSource, weatherSource, specStore, List.of(csvSink, online));
        }
    }

    /**
     * Runs the job against already built sources and sinks. The spec is frozen before
     * the first sink is written, so a schema conflict persists nothing.
     *
     * @param weatherSource optional, may be null
     */
    static PipelineResult execute(PipelineConfig config,
                                  RawDataSource airSource,
                                  RawDataSource weatherSource,
                                  FeatureSpecStore specStore,
                                  List<FeatureSink> sinks) throws IOException {
        // 2. Raw input
        RawTable air = airSource.load();
        RawTable weather = weatherSource != null ? weatherSource.load() : null;

        // 3. Derivation (pure, in memory)
        PipelineResult result = new FeaturePipeline(config).run(air, weather);

        // 4. Contract first
        specStore.freeze(result.getSpec());

        // 5. Data
        for (FeatureSink sink : sinks) {
            sink.write(result.getTable(), result.getSpec());
        }
        return result;
    }
}
