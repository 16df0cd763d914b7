package com.airquality.karachi.errors;

/**
 * A feature table or spec disagrees with the frozen Feature Spec of its schema version.
 */
public class SchemaMismatchException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public SchemaMismatchException(String message) {
        super(message);
    }
}
