package com.airquality.karachi.functions;

import com.airquality.karachi.errors.EmptyInputException;
import com.airquality.karachi.errors.MalformedTimestampException;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.models.RawObservation;
import com.airquality.karachi.models.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw batch into a strictly increasing, de-duplicated table.
 *
 * Every timestamp becomes a UTC epoch-millis instant. Rows are stable-sorted and,
 * for repeated timestamps, the first row seen in input order wins. Missing hours
 * stay missing: nothing is resampled or zero-filled here.
 */
public class TimeNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(TimeNormalizer.class);

    // "2024-01-01T05:00", "2024-01-01 05:00:00", "2024-01-01 05:00:00.000"
    private static final DateTimeFormatter LOCAL_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendPattern("HH:mm")
            .optionalStart().appendPattern(":ss").optionalEnd()
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter SLASH_FORMAT =
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

    private final List<String> channels;

    /**
     * @param channels columns carried into the table, in order
     */
    public TimeNormalizer(List<String> channels) {
        this.channels = List.copyOf(channels);
    }

    public Result normalize(RawTable raw) {
        List<RawObservation> observations = raw.getObservations();

        List<long[]> keyed = new ArrayList<>(observations.size()); // {epochMillis, inputIndex}
        for (int i = 0; i < observations.size(); i++) {
            keyed.add(new long[]{toEpochMillis(i, observations.get(i).getTimestamp()), i});
        }
        // List.sort is stable, so equal timestamps stay in input order
        keyed.sort(Comparator.comparingLong(k -> k[0]));

        List<long[]> unique = new ArrayList<>(keyed.size());
        for (long[] k : keyed) {
            if (unique.isEmpty() || unique.get(unique.size() - 1)[0] != k[0]) {
                unique.add(k);
            }
        }
        int duplicates = keyed.size() - unique.size();
        if (duplicates > 0) {
            LOG.warn("Dropped {} duplicate timestamp rows (kept first-seen)", duplicates);
        }
        if (unique.isEmpty()) {
            throw new EmptyInputException("No usable rows after timestamp normalization");
        }

        long[] timestamps = new long[unique.size()];
        Map<String, Double[]> columns = new LinkedHashMap<>();
        for (String channel : channels) {
            columns.put(channel, new Double[unique.size()]);
        }
        for (int row = 0; row < unique.size(); row++) {
            timestamps[row] = unique.get(row)[0];
            RawObservation obs = observations.get((int) unique.get(row)[1]);
            for (String channel : channels) {
                columns.get(channel)[row] = finiteOrNull(obs.getValue(channel));
            }
        }

        FeatureTable table = new FeatureTable(timestamps, columns);
        LOG.info("Normalized {} raw rows into {}", observations.size(), table);
        return new Result(table, duplicates);
    }

    /**
     * Parses any supported timestamp form to UTC epoch millis.
     */
    static long toEpochMillis(int rowIndex, Object value) {
        if (value == null) {
            throw new MalformedTimestampException(rowIndex, null, null);
        }
        try {
            if (value instanceof Instant) {
                return ((Instant) value).toEpochMilli();
            }
            if (value instanceof LocalDateTime) {
                return ((LocalDateTime) value).toInstant(ZoneOffset.UTC).toEpochMilli();
            }
            if (value instanceof OffsetDateTime) {
                return ((OffsetDateTime) value).toInstant().toEpochMilli();
            }
            if (value instanceof ZonedDateTime) {
                return ((ZonedDateTime) value).toInstant().toEpochMilli();
            }
            if (value instanceof Number) {
                return Math.multiplyExact(epochSeconds((Number) value), 1000L);
            }
            if (value instanceof CharSequence) {
                return parseString(value.toString().trim());
            }
        } catch (DateTimeParseException | ArithmeticException | NumberFormatException e) {
            throw new MalformedTimestampException(rowIndex, value, e);
        }
        throw new MalformedTimestampException(rowIndex, value, null);
    }

    /**
     * Whole epoch seconds from any numeric type. Fractional or non-finite values are rejected.
     */
    private static long epochSeconds(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ArithmeticException("Non-finite epoch seconds: " + d);
            }
        }
        BigDecimal seconds = value instanceof BigDecimal ? (BigDecimal) value : new BigDecimal(value.toString());
        return seconds.longValueExact();
    }

    private static long parseString(String text) {
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            // Epoch seconds, as delivered by the OpenWeather "dt" field
            return Math.multiplyExact(Long.parseLong(text), 1000L);
        }
        if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
            return OffsetDateTime.parse(text.replace(' ', 'T')).toInstant().toEpochMilli();
        }
        if (text.indexOf('/') > 0) {
            return LocalDateTime.parse(text, SLASH_FORMAT).toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        return LocalDateTime.parse(text, LOCAL_FORMAT).toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    private static Double finiteOrNull(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return value;
    }

    /**
     * Normalized table plus the number of duplicate rows removed.
     */
    public static final class Result {
        private final FeatureTable table;
        private final int duplicatesDropped;

        Result(FeatureTable table, int duplicatesDropped) {
            this.table = table;
            this.duplicatesDropped = duplicatesDropped;
        }

        public FeatureTable getTable() { return table; }
        public int getDuplicatesDropped() { return duplicatesDropped; }
    }
}
