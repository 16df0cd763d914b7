package com.airquality.karachi.errors;

/**
 * A serving payload field could not be converted to a number.
 */
public class InvalidFeatureValueException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public InvalidFeatureValueException(String field, Object value) {
        super(String.format("Feature '%s' is not numeric: '%s'", field, value));
        this.field = field;
    }

    public String getField() { return field; }
}
