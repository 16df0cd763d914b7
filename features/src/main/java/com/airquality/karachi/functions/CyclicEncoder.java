package com.airquality.karachi.functions;

import com.airquality.karachi.models.CalendarField;
import com.airquality.karachi.models.FeatureLayout;
import com.airquality.karachi.models.FeatureTable;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calendar features derived from the row timestamp only.
 *
 * Each configured field f with period P becomes the pair sin(2*pi*f/P), cos(2*pi*f/P).
 * The weekend flag is always emitted; raw calendar integers only when retained.
 */
public class CyclicEncoder {

    private final List<CalendarField> fields;
    private final boolean retainCalendarFields;

    public CyclicEncoder(List<CalendarField> fields, boolean retainCalendarFields) {
        this.fields = List.copyOf(fields);
        this.retainCalendarFields = retainCalendarFields;
    }

    public FeatureTable encode(FeatureTable table) {
        int n = table.size();
        Map<String, Double[]> calendar = new LinkedHashMap<>();
        Map<String, Double[]> cyclic = new LinkedHashMap<>();
        Double[] weekend = new Double[n];

        for (CalendarField field : fields) {
            if (retainCalendarFields) {
                calendar.put(field.getColumnName(), new Double[n]);
            }
            cyclic.put(field.sinColumn(), new Double[n]);
            cyclic.put(field.cosColumn(), new Double[n]);
        }

        for (int row = 0; row < n; row++) {
            LocalDateTime time = LocalDateTime.ofEpochSecond(
                    Math.floorDiv(table.getTimestamp(row), 1000L), 0, ZoneOffset.UTC);
            DayOfWeek day = time.getDayOfWeek();
            weekend[row] = (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) ? 1.0 : 0.0;

            for (CalendarField field : fields) {
                int value = field.valueOf(time);
                double angle = 2 * Math.PI * value / field.getPeriod();
                if (retainCalendarFields) {
                    calendar.get(field.getColumnName())[row] = (double) value;
                }
                cyclic.get(field.sinColumn())[row] = Math.sin(angle);
                cyclic.get(field.cosColumn())[row] = Math.cos(angle);
            }
        }

        Map<String, Double[]> added = new LinkedHashMap<>(calendar);
        added.put(FeatureLayout.IS_WEEKEND, weekend);
        added.putAll(cyclic);
        return table.withColumns(added);
    }
}
