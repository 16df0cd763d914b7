package com.airquality.karachi;

import com.airquality.karachi.functions.SchemaFinalizer;
import com.airquality.karachi.models.CalendarField;
import com.airquality.karachi.models.ColumnKind;
import com.airquality.karachi.models.FeatureLayout;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.utils.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaFinalizerTest {

    private static final PipelineConfig CONFIG = PipelineConfig.builder()
            .channels(List.of("pm2_5"))
            .lags(List.of(new PipelineConfig.HorizonSpec("pm2_5", List.of(1))))
            .windows(List.of())
            .targets(List.of(new PipelineConfig.HorizonSpec("pm2_5", List.of(1))))
            .cyclicFields(List.of(CalendarField.HOUR))
            .retainCalendarFields(true)
            .build();

    private final FeatureLayout layout = FeatureLayout.from(CONFIG);
    private final SchemaFinalizer finalizer = new SchemaFinalizer(layout, 3);

    @Test
    void testOrdersColumnsAndPrunesIncompleteRows() {
        SchemaFinalizer.Result result = finalizer.finalizeTable(table());

        assertThat(result.getTable().getColumnNames()).containsExactly(
                "pm2_5", "hour", "is_weekend", "hour_sin", "hour_cos", "pm2_5_lag_1", "pm2_5_target_1h");
        assertThat(result.getDroppedRows()).isEqualTo(2);
        assertThat(result.getTable().size()).isEqualTo(2);
        assertThat(result.getTable().getColumn("pm2_5")).containsExactly(20.0, 30.0);
    }

    @Test
    void testSpecMatchesTable() {
        SchemaFinalizer.Result result = finalizer.finalizeTable(table());

        assertThat(result.getSpec().getVersion()).isEqualTo(3);
        assertThat(result.getSpec().getPrimaryKey()).isEqualTo("timestamp");
        assertThat(result.getSpec().getTargetColumns()).containsExactly("pm2_5_target_1h");
        assertThat(result.getSpec().getColumns().subList(1, result.getSpec().getColumns().size()))
                .isEqualTo(result.getTable().getColumnNames());
        assertThat(result.getSpec().kindOf("hour")).isEqualTo(ColumnKind.INTEGER);
        assertThat(result.getSpec().kindOf("is_weekend")).isEqualTo(ColumnKind.INTEGER);
        assertThat(result.getSpec().kindOf("hour_sin")).isEqualTo(ColumnKind.FLOAT);
        assertThat(result.getSpec().kindOf("timestamp")).isEqualTo(ColumnKind.INTEGER);
    }

    @Test
    void testMissingColumnIsSchemaDrift() {
        FeatureTable drifted = table().selectColumns(List.of(
                "pm2_5", "hour", "is_weekend", "hour_sin", "hour_cos", "pm2_5_lag_1"));

        assertThatThrownBy(() -> finalizer.finalizeTable(drifted))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("pm2_5_target_1h");
    }

    @Test
    void testUnexpectedColumnIsSchemaDrift() {
        FeatureTable drifted = table().withColumn("extra", new Double[]{1.0, 1.0, 1.0, 1.0});

        assertThatThrownBy(() -> finalizer.finalizeTable(drifted))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("extra");
    }

    @Test
    void testNonIntegralCalendarValueFails() {
        FeatureTable broken = table().withColumn("hour", new Double[]{0.0, 1.5, 2.0, 3.0});

        assertThatThrownBy(() -> finalizer.finalizeTable(broken))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("hour");
    }

    @Test
    void testEverythingPrunedGivesEmptyTable() {
        Map<String, Double[]> columns = new LinkedHashMap<>();
        for (String column : layout.getColumns()) {
            columns.put(column, new Double[]{null});
        }
        columns.put("pm2_5", new Double[]{1.0});

        SchemaFinalizer.Result result = finalizer.finalizeTable(new FeatureTable(new long[]{0L}, columns));

        assertThat(result.getTable().isEmpty()).isTrue();
        assertThat(result.getTable().getColumnNames()).isEqualTo(layout.getColumns());
    }

    // Helper methods
    private static FeatureTable table() {
        // columns deliberately out of layout order
        Map<String, Double[]> columns = new LinkedHashMap<>();
        columns.put("pm2_5_target_1h", new Double[]{20.0, 30.0, 40.0, null});
        columns.put("pm2_5_lag_1", new Double[]{null, 10.0, 20.0, 30.0});
        columns.put("hour_cos", new Double[]{1.0, 0.9, 0.8, 0.7});
        columns.put("hour_sin", new Double[]{0.0, 0.1, 0.2, 0.3});
        columns.put("is_weekend", new Double[]{0.0, 0.0, 0.0, 0.0});
        columns.put("hour", new Double[]{0.0, 1.0, 2.0, 3.0});
        columns.put("pm2_5", new Double[]{10.0, 20.0, 30.0, 40.0});
        return new FeatureTable(new long[]{0L, 3_600_000L, 7_200_000L, 10_800_000L}, columns);
    }
}
