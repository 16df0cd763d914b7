package com.airquality.karachi.errors;

/**
 * A raw row carried a timestamp that could not be parsed.
 */
public class MalformedTimestampException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final int rowIndex;
    private final Object rawValue;

    public MalformedTimestampException(int rowIndex, Object rawValue, Throwable cause) {
        super(String.format("Unparseable timestamp at raw row %d: '%s'", rowIndex, rawValue), cause);
        this.rowIndex = rowIndex;
        this.rawValue = rawValue;
    }

    public int getRowIndex() { return rowIndex; }
    public Object getRawValue() { return rawValue; }
}
