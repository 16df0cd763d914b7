package com.airquality.karachi.errors;

public class EmptyInputException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message) {
        super(message);
    }
}
