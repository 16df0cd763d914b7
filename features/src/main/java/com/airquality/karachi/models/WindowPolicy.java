package com.airquality.karachi.models;

/**
 * Minimum-periods policy for trailing rolling windows.
 */
public enum WindowPolicy {
    /** A rolling value exists only once the whole trailing window is available. */
    FULL,
    /** A rolling value uses whatever prior rows exist (at least 1 for MEAN, 2 for STD). */
    PARTIAL
}
