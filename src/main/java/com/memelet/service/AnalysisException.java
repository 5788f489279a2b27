package com.memelet.service;

/**
 * The vision model could not be reached or did not return a usable answer.
 */
public class AnalysisException extends PipelineException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
