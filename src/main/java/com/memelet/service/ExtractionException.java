package com.memelet.service;

/**
 * Frames or samples could not be produced for a record (decode failure, timeout, missing album item).
 */
public class ExtractionException extends PipelineException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
