package com.airquality.karachi.models;

import java.time.LocalDateTime;

/**
 * Calendar fields that can be cyclically encoded.
 * Day-of-week follows the Monday = 0 convention used by the training code.
 */
public enum CalendarField {

    HOUR("hour", "hour", 24),
    DAY_OF_WEEK("dayofweek", "day", 7),
    MONTH("month", "month", 12),
    DAY_OF_MONTH("day", "dom", 31);

    private final String columnName;
    private final String cyclicPrefix;
    private final int period;

    CalendarField(String columnName, String cyclicPrefix, int period) {
        this.columnName = columnName;
        this.cyclicPrefix = cyclicPrefix;
        this.period = period;
    }

    /** Name of the raw integer column, emitted only when calendar fields are retained. */
    public String getColumnName() { return columnName; }
    public String getCyclicPrefix() { return cyclicPrefix; }
    public int getPeriod() { return period; }

    public String sinColumn() {
        return cyclicPrefix + "_sin";
    }

    public String cosColumn() {
        return cyclicPrefix + "_cos";
    }

    public int valueOf(LocalDateTime time) {
        switch (this) {
            case HOUR:
                return time.getHour();
            case DAY_OF_WEEK:
                return time.getDayOfWeek().getValue() - 1;
            case MONTH:
                return time.getMonthValue();
            case DAY_OF_MONTH:
                return time.getDayOfMonth();
            default:
                throw new IllegalStateException("Unhandled calendar field " + this);
        }
    }
}
