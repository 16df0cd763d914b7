package com.airquality.karachi;

import com.airquality.karachi.errors.EmptyInputException;
import com.airquality.karachi.errors.MalformedTimestampException;
import com.airquality.karachi.functions.TimeNormalizer;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.models.RawObservation;
import com.airquality.karachi.models.RawTable;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeNormalizerTest {

    private static final long HOUR_MS = 3_600_000L;
    private static final long JAN_1_2024 = Instant.parse("2024-01-01T00:00:00Z").toEpochMilli();

    private final TimeNormalizer normalizer = new TimeNormalizer(List.of("pm2_5"));

    @Test
    void testSortsAscending() {
        RawTable raw = table(
                obs("2024-01-01 02:00:00", 30.0),
                obs("2024-01-01 00:00:00", 10.0),
                obs("2024-01-01 01:00:00", 20.0));

        FeatureTable table = normalizer.normalize(raw).getTable();

        assertThat(table.getTimestamps()).containsExactly(JAN_1_2024, JAN_1_2024 + HOUR_MS, JAN_1_2024 + 2 * HOUR_MS);
        assertThat(table.getColumn("pm2_5")).containsExactly(10.0, 20.0, 30.0);
    }

    @Test
    void testDuplicateTimestampsKeepFirstSeen() {
        RawTable raw = table(
                obs("2024-01-01 01:00:00", 20.0),
                obs("2024-01-01 00:00:00", 10.0),
                obs("2024-01-01T01:00:00Z", 99.0),   // same instant, different spelling
                obs("2024-01-01 00:00", 77.0));

        TimeNormalizer.Result result = normalizer.normalize(raw);

        assertThat(result.getDuplicatesDropped()).isEqualTo(2);
        assertThat(result.getTable().size()).isEqualTo(2);
        assertThat(result.getTable().getColumn("pm2_5")).containsExactly(10.0, 20.0);
    }

    @Test
    void testMissingHoursStayAbsent() {
        RawTable raw = table(
                obs("2024-01-01 00:00:00", 10.0),
                obs("2024-01-01 05:00:00", 60.0));

        FeatureTable table = normalizer.normalize(raw).getTable();

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.getTimestamp(1) - table.getTimestamp(0)).isEqualTo(5 * HOUR_MS);
    }

    @Test
    void testAcceptsSupportedTimestampForms() {
        long expected = JAN_1_2024 + 5 * HOUR_MS;
        List<Object> forms = Arrays.asList(
                "2024-01-01T05:00:00",
                "2024-01-01 05:00",
                "2024-01-01 05:00:00.000",
                "2024/01/01 05:00:00",
                "2024-01-01T10:00:00+05:00",
                "2024-01-01T05:00:00Z",
                String.valueOf(expected / 1000),
                expected / 1000,
                (int) (expected / 1000),
                (double) (expected / 1000),
                BigDecimal.valueOf(expected / 1000),
                BigDecimal.valueOf(expected / 1000).setScale(3),
                Instant.ofEpochMilli(expected),
                LocalDateTime.of(2024, 1, 1, 5, 0),
                OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.ofHours(5)));

        for (Object form : forms) {
            FeatureTable table = normalizer.normalize(table(obs(form, 1.0))).getTable();
            assertThat(table.getTimestamp(0)).as("form %s", form).isEqualTo(expected);
        }
    }

    @Test
    void testMalformedTimestampFails() {
        RawTable raw = table(
                obs("2024-01-01 00:00:00", 10.0),
                obs("yesterday at noon", 20.0));

        assertThatThrownBy(() -> normalizer.normalize(raw))
                .isInstanceOf(MalformedTimestampException.class)
                .hasMessageContaining("yesterday at noon")
                .satisfies(e -> assertThat(((MalformedTimestampException) e).getRowIndex()).isEqualTo(1));
    }

    @Test
    void testFractionalOrNonFiniteEpochSecondsFail() {
        List<Object> rejected = Arrays.asList(
                1_704_067_200.5,
                Double.NaN,
                Double.POSITIVE_INFINITY,
                new BigDecimal("1704067200.25"));

        for (Object form : rejected) {
            assertThatThrownBy(() -> normalizer.normalize(table(obs(form, 1.0))))
                    .as("form %s", form)
                    .isInstanceOf(MalformedTimestampException.class);
        }
    }

    @Test
    void testNullTimestampFails() {
        RawTable raw = table(obs(null, 10.0));

        assertThatThrownBy(() -> normalizer.normalize(raw))
                .isInstanceOf(MalformedTimestampException.class);
    }

    @Test
    void testEmptyInputFails() {
        RawTable raw = new RawTable(List.of("pm2_5"), new ArrayList<>());

        assertThatThrownBy(() -> normalizer.normalize(raw))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void testNonFiniteReadingsBecomeNull() {
        RawTable raw = table(
                obs("2024-01-01 00:00:00", Double.NaN),
                obs("2024-01-01 01:00:00", null));

        FeatureTable table = normalizer.normalize(raw).getTable();

        assertThat(table.getColumn("pm2_5")).containsOnlyNulls();
    }

    // Helper methods
    private static RawObservation obs(Object timestamp, Double pm25) {
        Map<String, Double> values = new HashMap<>();
        values.put("pm2_5", pm25);
        return new RawObservation(timestamp, values);
    }

    private static RawTable table(RawObservation... observations) {
        return new RawTable(List.of("pm2_5"), Arrays.asList(observations));
    }
}
