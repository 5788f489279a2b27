package com.memelet.service;

/**
 * The model answered, but its text is not a JSON object.
 */
public class ResponseParseException extends PipelineException {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
