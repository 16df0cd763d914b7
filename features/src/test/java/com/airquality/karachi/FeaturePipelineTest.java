package com.airquality.karachi;

import com.airquality.karachi.errors.MissingRequiredChannelException;
import com.airquality.karachi.functions.FeaturePipeline;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.models.PipelineResult;
import com.airquality.karachi.models.RawObservation;
import com.airquality.karachi.models.RawTable;
import com.airquality.karachi.utils.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeaturePipelineTest {

    // 2024-01-01T00:00:00Z
    private static final long START_SECONDS = 1_704_067_200L;
    private static final int HOURS = 48;

    private static final PipelineConfig CONFIG = PipelineConfig.builder()
            .channels(List.of("aqi", "pm2_5", "pm10"))
            .build();

    @Test
    void testColumnsFollowSpecOrder() {
        PipelineResult result = new FeaturePipeline(CONFIG).run(airTable(-1, 0.0));

        List<String> expected = new ArrayList<>(result.getSpec().getFeatureColumns());
        expected.addAll(result.getSpec().getTargetColumns());
        assertThat(result.getTable().getColumnNames()).isEqualTo(expected);
        assertThat(result.getSpec().getFeatureColumns()).startsWith("aqi", "pm2_5", "pm10", "is_weekend");
        assertThat(result.getSpec().getFeatureColumns()).contains(
                "aqi_lag_6", "pm2_5_rolling_mean_3", "pm10_rolling_std_3", "pm_ratio");
        assertThat(result.getSpec().getTargetColumns()).containsExactly("aqi_target_1h", "aqi_target_6h");
    }

    @Test
    void testNoNullsAndRowAccounting() {
        RawTable raw = airTable(-1, 0.0);
        // one gap in pm10
        Map<String, Double> values = new HashMap<>(raw.getObservations().get(10).getValues());
        values.put("pm10", null);
        List<RawObservation> observations = new ArrayList<>(raw.getObservations());
        observations.set(10, new RawObservation(observations.get(10).getTimestamp(), values));

        PipelineResult result = new FeaturePipeline(CONFIG).run(RawTable.of(observations));
        FeatureTable table = result.getTable();

        for (String column : table.getColumnNames()) {
            assertThat(table.getColumn(column)).as(column).doesNotContainNull();
        }
        // lag 6 drops the first six rows, target 6 the last six
        assertThat(result.getReport().getInputRows()).isEqualTo(HOURS);
        assertThat(result.getReport().getInsufficientHistoryDropped()).isEqualTo(12);
        assertThat(result.getReport().getOutputRows()).isEqualTo(HOURS - 12);
        assertThat(result.getReport().getImputedCounts()).containsEntry("pm10", 1).containsEntry("aqi", 0);
        assertThat(result.getReport().getTotalImputed()).isEqualTo(1);
        assertThat(table.getTimestamp(0)).isEqualTo((START_SECONDS + 6 * 3600) * 1000);
    }

    @Test
    void testWorkedExampleValues() {
        PipelineResult result = new FeaturePipeline(CONFIG).run(airTable(-1, 0.0));
        FeatureTable table = result.getTable();

        // first output row is raw row 6: pm2_5 = 10 * (6 + 1)
        assertThat(table.getValue("pm2_5", 0)).isEqualTo(70.0);
        assertThat(table.getValue("pm2_5_lag_1", 0)).isEqualTo(60.0);
        assertThat(table.getValue("pm2_5_rolling_mean_3", 0)).isCloseTo(50.0, within(1e-9));
        assertThat(table.getValue("aqi_target_1h", 0)).isEqualTo(aqi(7));
        assertThat(table.getValue("pm_ratio", 0)).isCloseTo(70.0 / (140.0 + 1e-5), within(1e-12));
    }

    @Test
    void testRunIsDeterministic() {
        FeaturePipeline pipeline = new FeaturePipeline(CONFIG);

        PipelineResult first = pipeline.run(airTable(-1, 0.0));
        PipelineResult second = pipeline.run(airTable(-1, 0.0));

        assertThat(second.getTable()).isEqualTo(first.getTable());
        assertThat(second.getSpec()).isEqualTo(first.getSpec());
    }

    @Test
    void testFutureChangeOnlyMovesTargets() {
        int perturbed = 30;
        FeatureTable base = new FeaturePipeline(CONFIG).run(airTable(-1, 0.0)).getTable();
        FeatureTable changed = new FeaturePipeline(CONFIG).run(airTable(perturbed, 500.0)).getTable();
        List<String> features = new FeaturePipeline(CONFIG).getLayout().getFeatureColumns();

        for (int row = 0; row < base.size(); row++) {
            int rawIndex = row + 6;
            if (rawIndex >= perturbed) {
                break;
            }
            for (String column : features) {
                assertThat(changed.getValue(column, row))
                        .as("%s at raw row %d", column, rawIndex)
                        .isEqualTo(base.getValue(column, row));
            }
        }
        // the row one hour earlier sees the change only through its label
        int labelRow = perturbed - 1 - 6;
        assertThat(changed.getValue("aqi_target_1h", labelRow)).isNotEqualTo(base.getValue("aqi_target_1h", labelRow));
    }

    @Test
    void testMissingChannelFailsBeforeProcessing() {
        List<RawObservation> observations = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            Map<String, Double> values = new HashMap<>();
            values.put("aqi", 2.0);
            values.put("pm2_5", 10.0);
            observations.add(new RawObservation(START_SECONDS + i * 3600L, values));
        }

        assertThatThrownBy(() -> new FeaturePipeline(CONFIG).run(RawTable.of(observations)))
                .isInstanceOf(MissingRequiredChannelException.class)
                .satisfies(e -> assertThat(((MissingRequiredChannelException) e).getMissingChannels())
                    .containsExactly("pm10"));
    }

    @Test
    void testWeatherChannelsAreJoinedByTimestamp() {
        PipelineConfig config = PipelineConfig.builder()
                .channels(List.of("aqi", "pm2_5", "pm10", "temperature", "humidity"))
                .build();
        List<RawObservation> weather = new ArrayList<>();
        for (int i = 0; i < HOURS; i++) {
            Map<String, Double> values = new HashMap<>();
            values.put("temperature", 20.0 + i % 5);
            values.put("humidity", 50.0);
            weather.add(new RawObservation(START_SECONDS + i * 3600L, values));
        }

        PipelineResult result = new FeaturePipeline(config).run(airTable(-1, 0.0), RawTable.of(weather));
        FeatureTable table = result.getTable();

        assertThat(result.getSpec().getFeatureColumns()).contains("temperature", "humidity", "temp_humidity_index");
        // raw row 6: temperature 21
        assertThat(table.getValue("temperature", 0)).isEqualTo(21.0);
        assertThat(table.getValue("temp_humidity_index", 0)).isCloseTo(10.5, within(1e-12));
    }

    @Test
    void testEmptyWeatherTableFallsBackToDefault() {
        PipelineConfig config = PipelineConfig.builder()
                .channels(List.of("aqi", "pm2_5", "pm10", "temperature"))
                .imputeDefault(-1.0)
                .build();
        RawTable weather = new RawTable(List.of("temperature"), List.of());

        PipelineResult result = new FeaturePipeline(config).run(airTable(-1, 0.0), weather);

        assertThat(result.getTable().getColumn("temperature")).containsOnly(-1.0);
        assertThat(result.getReport().getImputedCounts()).containsEntry("temperature", HOURS);
        assertThat(result.getReport().getOutputRows()).isEqualTo(HOURS - 12);
    }

    // Helper methods
    private static double aqi(int i) {
        return 1.0 + i % 5;
    }

    /**
     * Hourly rows where pm2_5 = 10 * (i + 1) and pm10 = 2 * pm2_5; row {@code perturbedRow}
     * gets {@code aqiOverride} as its aqi.
     */
    private static RawTable airTable(int perturbedRow, double aqiOverride) {
        List<RawObservation> observations = new ArrayList<>();
        for (int i = 0; i < HOURS; i++) {
            Map<String, Double> values = new HashMap<>();
            values.put("aqi", i == perturbedRow ? aqiOverride : aqi(i));
            values.put("pm2_5", 10.0 * (i + 1));
            values.put("pm10", 20.0 * (i + 1));
            observations.add(new RawObservation(START_SECONDS + i * 3600L, values));
        }
        return RawTable.of(observations);
    }
}
