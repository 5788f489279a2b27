package com.memelet.service;

/**
 * What happened to one record handed to the processor.
 */
enum ProcessOutcome {
    DONE,
    FAILED,
    SKIPPED
}
