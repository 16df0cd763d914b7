package com.airquality.karachi.errors;

/**
 * Base class for fatal feature pipeline errors.
 * Any of these aborts the run before a feature table or spec is persisted.
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
