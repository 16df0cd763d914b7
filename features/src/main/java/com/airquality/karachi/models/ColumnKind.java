package com.airquality.karachi.models;

/**
 * Storage kind of a feature column in the frozen schema.
 */
public enum ColumnKind {
    INTEGER,
    FLOAT
}
