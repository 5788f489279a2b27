package com.memelet.service;

/**
 * Base class of the failures that send a record to the error state during analysis.
 */
public class PipelineException extends Exception {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
