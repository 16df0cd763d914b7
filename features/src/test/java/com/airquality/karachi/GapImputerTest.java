package com.airquality.karachi;

import com.airquality.karachi.functions.GapImputer;
import com.airquality.karachi.models.FeatureTable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GapImputerTest {

    private static final long HOUR_MS = 3_600_000L;

    @Test
    void testInteriorGapIsInterpolated() {
        FeatureTable table = hourly("pm2_5", 10.0, null, 30.0);

        GapImputer.Result result = new GapImputer(List.of("pm2_5"), 0.0).impute(table);

        assertThat(result.getTable().getColumn("pm2_5")).containsExactly(10.0, 20.0, 30.0);
        assertThat(result.getImputedCounts()).containsEntry("pm2_5", 1);
    }

    @Test
    void testInterpolationIsWeightedByTime() {
        // readings at 0h, 1h (missing) and 4h
        long[] timestamps = {0L, HOUR_MS, 4 * HOUR_MS};
        Map<String, Double[]> columns = new LinkedHashMap<>();
        columns.put("no2", new Double[]{0.0, null, 40.0});
        FeatureTable table = new FeatureTable(timestamps, columns);

        FeatureTable imputed = new GapImputer(List.of("no2"), 0.0).impute(table).getTable();

        assertThat(imputed.getValue("no2", 1)).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void testLongInteriorRunIsInterpolated() {
        FeatureTable table = hourly("o3", 0.0, null, null, null, 40.0);

        FeatureTable imputed = new GapImputer(List.of("o3"), 0.0).impute(table).getTable();

        assertThat(imputed.getColumn("o3")).containsExactly(0.0, 10.0, 20.0, 30.0, 40.0);
    }

    @Test
    void testEdgesTakeNearestValidValue() {
        FeatureTable table = hourly("co", null, null, 5.0, 7.0, null);

        GapImputer.Result result = new GapImputer(List.of("co"), 0.0).impute(table);

        assertThat(result.getTable().getColumn("co")).containsExactly(5.0, 5.0, 5.0, 7.0, 7.0);
        assertThat(result.getImputedCounts()).containsEntry("co", 3);
    }

    @Test
    void testAllNullChannelFallsBackToDefault() {
        FeatureTable table = hourly("nh3", null, null, null);

        GapImputer.Result result = new GapImputer(List.of("nh3"), -1.0).impute(table);

        assertThat(result.getTable().getColumn("nh3")).containsExactly(-1.0, -1.0, -1.0);
        assertThat(result.getImputedCounts()).containsEntry("nh3", 3);
    }

    @Test
    void testCompleteChannelIsUntouched() {
        FeatureTable table = hourly("so2", 1.0, 2.0, 3.0);

        GapImputer.Result result = new GapImputer(List.of("so2"), 0.0).impute(table);

        assertThat(result.getTable()).isEqualTo(table);
        assertThat(result.getImputedCounts()).containsEntry("so2", 0);
    }

    @Test
    void testInputTableIsNotModified() {
        FeatureTable table = hourly("pm10", 10.0, null, 30.0);

        new GapImputer(List.of("pm10"), 0.0).impute(table);

        assertThat(table.getValue("pm10", 1)).isNull();
    }

    // Helper methods
    private static FeatureTable hourly(String channel, Double... values) {
        long[] timestamps = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            timestamps[i] = i * HOUR_MS;
        }
        Map<String, Double[]> columns = new LinkedHashMap<>();
        columns.put(channel, values);
        return new FeatureTable(timestamps, columns);
    }
}
