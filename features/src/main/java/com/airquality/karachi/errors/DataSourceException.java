package com.airquality.karachi.errors;

/**
 * Every configured source (or sink) failed.
 */
public class DataSourceException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
